package com.github.forax.dynproxy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.lang.invoke.MethodType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

class ValueConversionTest {
  public enum Color { RED, GREEN, BLUE }

  public interface Echo {
    boolean echo(boolean value);
    byte echo(byte value);
    char echo(char value);
    short echo(short value);
    int echo(int value);
    long echo(long value);
    float echo(float value);
    double echo(double value);
    Color echo(Color value);
    String echo(String value);
    int[] echo(int[] value);
  }

  public interface Results {
    byte asByte();
    short asShort();
    long asLong();
    char asChar();
    boolean asBoolean();
    int asInt();
    float asFloat();
    double asDouble();
    Color color();
    String text();
    void discard();
  }

  public interface Mixed {
    String mix(int a, long b, double c, boolean d, String e, char f);
    int sum(int... values);
  }

  private static final ProxyHandler IDENTITY = (proxy, method, args) -> args[0];

  private static Results results(Object value) {
    return ProxyFactory.getInstance().create((proxy, method, args) -> value, Results.class);
  }

  @Test
  void primitive_values_survive_a_round_trip_through_the_handler() {
    Echo echo = ProxyFactory.getInstance().create(IDENTITY, Echo.class);

    assertThat(echo.echo(true)).isTrue();
    assertThat(echo.echo(false)).isFalse();
    assertThat(echo.echo(Byte.MIN_VALUE)).isEqualTo(Byte.MIN_VALUE);
    assertThat(echo.echo(Character.MAX_VALUE)).isEqualTo(Character.MAX_VALUE);
    assertThat(echo.echo(Short.MAX_VALUE)).isEqualTo(Short.MAX_VALUE);
    assertThat(echo.echo(Integer.MIN_VALUE)).isEqualTo(Integer.MIN_VALUE);
    assertThat(echo.echo(Long.MAX_VALUE)).isEqualTo(Long.MAX_VALUE);
    assertThat(echo.echo(Float.MIN_VALUE)).isEqualTo(Float.MIN_VALUE);
    assertThat(echo.echo(Double.MAX_VALUE)).isEqualTo(Double.MAX_VALUE);
    assertThat(Double.isNaN(echo.echo(Double.NaN))).isTrue();
  }

  @Test
  void reference_values_pass_through() {
    Echo echo = ProxyFactory.getInstance().create(IDENTITY, Echo.class);
    int[] array = { 1, 2, 3 };

    assertThat(echo.echo(Color.BLUE)).isSameAs(Color.BLUE);
    assertThat(echo.echo("text")).isEqualTo("text");
    assertThat(echo.echo(array)).isSameAs(array);
    assertThat(echo.echo((String) null)).isNull();
  }

  @Test
  void primitive_arguments_are_boxed() {
    ArrayList<List<Object>> calls = new ArrayList<>();
    Mixed mixed = ProxyFactory.getInstance().create((proxy, method, args) -> {
      calls.add(Arrays.asList(args));
      return "done";
    }, Mixed.class);

    assertThat(mixed.mix(1, 2L, 3.5, true, "five", '6')).isEqualTo("done");

    assertThat(calls.get(0)).containsExactly(1, 2L, 3.5, true, "five", '6');
  }

  @Test
  void varargs_are_passed_as_an_array() {
    Mixed mixed = ProxyFactory.getInstance().create(
        (proxy, method, args) -> Arrays.stream((int[]) args[0]).sum(), Mixed.class);

    assertThat(mixed.sum(1, 2, 3, 4)).isEqualTo(10);
    assertThat(mixed.sum()).isEqualTo(0);
  }

  @Test
  void numbers_are_narrowed_to_the_return_type() {
    assertThat(results(70_000).asShort()).isEqualTo((short) 70_000);
    assertThat(results(42).asLong()).isEqualTo(42L);
    assertThat(results(3.9).asInt()).isEqualTo(3);
    assertThat(results(65).asChar()).isEqualTo('A');
  }

  @Test
  void numbers_are_converted_to_byte_float_and_double() {
    assertThat(results(300).asByte()).isEqualTo((byte) 44);
    assertThat(results(-1L).asByte()).isEqualTo((byte) -1);
    assertThat(results(2.5).asFloat()).isEqualTo(2.5f);
    assertThat(results(16_777_217).asFloat()).isEqualTo(16_777_216f);
    assertThat(results(7).asDouble()).isEqualTo(7.0);
    assertThat(results(1.5f).asDouble()).isEqualTo(1.5);
    assertThat(results(Long.MAX_VALUE).asDouble()).isEqualTo((double) Long.MAX_VALUE);
  }

  @Test
  void non_numbers_are_rejected_for_byte_float_and_double() {
    assertThatThrownBy(() -> results("1").asByte()).isInstanceOf(ClassCastException.class);
    assertThatThrownBy(() -> results(true).asFloat()).isInstanceOf(ClassCastException.class);
    assertThatThrownBy(() -> results(null).asDouble()).isInstanceOf(NullPointerException.class);
  }

  @Test
  void enum_can_be_returned_as_an_ordinal() {
    assertThat(results(1).color()).isSameAs(Color.GREEN);
    assertThat(results(Color.BLUE).color()).isSameAs(Color.BLUE);
    assertThat(results(null).color()).isNull();
  }

  @Test
  void enum_ordinal_out_of_range_is_rejected() {
    assertThatThrownBy(() -> results(3).color()).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void void_method_discards_any_result() {
    results("whatever").discard();
    results(null).discard();
    results(new Object()).discard();
  }

  @Test
  void null_for_a_primitive_return_type_is_rejected() {
    assertThatThrownBy(() -> results(null).asInt()).isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> results(null).asBoolean()).isInstanceOf(NullPointerException.class);
  }

  @Test
  void wrong_result_type_is_rejected() {
    assertThatThrownBy(() -> results("42").asInt()).isInstanceOf(ClassCastException.class);
    assertThatThrownBy(() -> results(1).asBoolean()).isInstanceOf(ClassCastException.class);
    assertThatThrownBy(() -> results(42).text()).isInstanceOf(ClassCastException.class);
    assertThatThrownBy(() -> results("RED").color()).isInstanceOf(ClassCastException.class);
  }

  @Test
  void conversion_table_covers_every_primitive_type() {
    for(Class<?> type: new Class<?>[] {
        boolean.class, byte.class, char.class, short.class, int.class, long.class, float.class, double.class }) {
      ValueConversion conversion = ValueConversion.of(type);
      assertThat(conversion.primitive()).isSameAs(type);
      assertThat(conversion.wrapper()).isSameAs(MethodType.methodType(type).wrap().returnType());
    }
    assertThatThrownBy(() -> ValueConversion.of(void.class)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ValueConversion.of(String.class)).isInstanceOf(IllegalArgumentException.class);
  }
}

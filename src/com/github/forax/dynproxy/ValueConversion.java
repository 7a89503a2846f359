package com.github.forax.dynproxy;

import static org.objectweb.asm.Opcodes.INVOKESTATIC;

import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Type;

/**
 * How a value of a primitive type crosses the {@link ProxyHandler}:
 * the bytecode that boxes an argument and the bytecode that converts
 * the result of the handler back to the primitive return type.
 */
enum ValueConversion {
  BOOLEAN(boolean.class, Boolean.class, "asBoolean"),
  BYTE(byte.class, Byte.class, "asByte"),
  CHAR(char.class, Character.class, "asChar"),
  SHORT(short.class, Short.class, "asShort"),
  INT(int.class, Integer.class, "asInt"),
  LONG(long.class, Long.class, "asLong"),
  FLOAT(float.class, Float.class, "asFloat"),
  DOUBLE(double.class, Double.class, "asDouble");

  private static final String RETURN_VALUES = Type.getInternalName(ReturnValues.class);

  private final Class<?> primitive;
  private final Class<?> wrapper;
  private final String unboxMethodName;

  private ValueConversion(Class<?> primitive, Class<?> wrapper, String unboxMethodName) {
    this.primitive = primitive;
    this.wrapper = wrapper;
    this.unboxMethodName = unboxMethodName;
  }

  public Class<?> primitive() {
    return primitive;
  }

  public Class<?> wrapper() {
    return wrapper;
  }

  /**
   * Returns the conversion of a primitive type.
   * @param type a primitive type other than void.
   * @return the conversion of the primitive type.
   * @throws IllegalArgumentException if {@code type} is not a primitive type or is void.
   */
  public static ValueConversion of(Class<?> type) {
    for(ValueConversion conversion: values()) {
      if (conversion.primitive == type) {
        return conversion;
      }
    }
    throw new IllegalArgumentException("no conversion for " + type);
  }

  /**
   * Emit the bytecode that replaces the primitive value on top of the stack by its box.
   * @param mv the method visitor.
   */
  void box(MethodVisitor mv) {
    String wrapperName = Type.getInternalName(wrapper);
    mv.visitMethodInsn(INVOKESTATIC, wrapperName, "valueOf",
        "(" + Type.getDescriptor(primitive) + ")L" + wrapperName + ";", false);
  }

  /**
   * Emit the bytecode that replaces the object on top of the stack by a primitive value.
   * @param mv the method visitor.
   * @see ReturnValues
   */
  void unbox(MethodVisitor mv) {
    mv.visitMethodInsn(INVOKESTATIC, RETURN_VALUES, unboxMethodName,
        "(Ljava/lang/Object;)" + Type.getDescriptor(primitive), false);
  }
}

package com.github.forax.dynproxy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

class ProxyHandlerTest {
  public interface Repository {
    void save(String item);
    List<String> items();
    int size();
  }

  interface Internal {
    String hello(String name);
  }

  @Test
  void delegating_handler_calls_the_target() {
    ArrayList<String> items = new ArrayList<>();
    Repository target = new Repository() {
      @Override
      public void save(String item) {
        items.add(item);
      }

      @Override
      public List<String> items() {
        return items;
      }

      @Override
      public int size() {
        return items.size();
      }
    };
    Repository repository = ProxyFactory.getInstance().create(ProxyHandler.delegatingTo(target), Repository.class);

    repository.save("a");
    repository.save("b");

    assertThat(repository.items()).containsExactly("a", "b");
    assertThat(repository.size()).isEqualTo(2);
  }

  @Test
  void delegating_handler_rethrows_the_target_exception() {
    UnsupportedOperationException failure = new UnsupportedOperationException("read only");
    Repository target = new Repository() {
      @Override
      public void save(String item) {
        throw failure;
      }

      @Override
      public List<String> items() {
        return List.of();
      }

      @Override
      public int size() {
        return 0;
      }
    };
    Repository repository = ProxyFactory.getInstance().create(ProxyHandler.delegatingTo(target), Repository.class);

    assertThatThrownBy(() -> repository.save("a")).isSameAs(failure);
  }

  @Test
  void delegating_handler_works_with_non_public_interfaces() {
    Internal target = name -> "hello " + name;
    Internal internal = ProxyFactory.getInstance().create(ProxyHandler.delegatingTo(target), Internal.class);

    assertThat(internal.hello("proxy")).isEqualTo("hello proxy");
  }

  @Test
  void delegating_to_null_is_rejected() {
    assertThatThrownBy(() -> ProxyHandler.delegatingTo(null)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void handlers_can_be_chained() {
    ArrayList<String> trace = new ArrayList<>();
    ProxyHandler inner = (proxy, method, args) -> "result of " + method.name();
    ProxyHandler tracing = (proxy, method, args) -> {
      trace.add("before " + method.name());
      Object result = inner.invoke(proxy, method, args);
      trace.add("after " + method.name());
      return result;
    };
    Internal internal = ProxyFactory.getInstance().create(tracing, Internal.class);

    assertThat(internal.hello("x")).isEqualTo("result of hello");
    assertThat(trace).containsExactly("before hello", "after hello");
  }
}

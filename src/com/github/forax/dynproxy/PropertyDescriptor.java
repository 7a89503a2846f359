package com.github.forax.dynproxy;

import java.util.Optional;

/**
 * A bean property of an interface, a getter ({@code getFoo()} or {@code isFoo()})
 * and optionally a setter ({@code setFoo(value)}) of the same type.
 *
 * Properties are only metadata, their accessors are proxied like any other methods.
 */
public final class PropertyDescriptor {
  private final String name;
  private final int index;
  private final MethodDescriptor getter;
  private final MethodDescriptor setter;  // may be null

  PropertyDescriptor(String name, int index, MethodDescriptor getter, MethodDescriptor setter) {
    this.name = name;
    this.index = index;
    this.getter = getter;
    this.setter = setter;
  }

  public String name() {
    return name;
  }

  public int index() {
    return index;
  }

  public Class<?> type() {
    return getter.returnType();
  }

  public MethodDescriptor getter() {
    return getter;
  }

  public Optional<MethodDescriptor> setter() {
    return Optional.ofNullable(setter);
  }

  @Override
  public String toString() {
    return getter.declaringInterface() + '.' + name + ':' + type().getName() + '#' + index;
  }
}

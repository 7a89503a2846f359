package com.github.forax.dynproxy;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.invoke.MethodType;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A generated proxy class, shared by all the proxies created for the same target type.
 *
 * @see ProxyFactory
 */
public final class ProxyBlueprint {
  private static final MethodType CONSTRUCTOR_TYPE = MethodType.methodType(Object.class, ProxyHandler.class);
  private static final MethodType GETTER_TYPE = MethodType.methodType(ProxyHandler.class, Object.class);

  private final String name;
  private final Class<?> targetType;
  private final Class<?> proxyClass;
  private final List<Class<?>> interfaces;
  private final MethodHandle constructor;
  private final MethodHandle handlerGetter;

  private ProxyBlueprint(String name, Class<?> targetType, Class<?> proxyClass, List<Class<?>> interfaces,
                         MethodHandle constructor, MethodHandle handlerGetter) {
    this.name = name;
    this.targetType = targetType;
    this.proxyClass = proxyClass;
    this.interfaces = interfaces;
    this.constructor = constructor;
    this.handlerGetter = handlerGetter;
  }

  static ProxyBlueprint of(String name, Class<?> targetType, List<Class<?>> interfaces, Lookup lookup)
      throws NoSuchMethodException, NoSuchFieldException, IllegalAccessException {
    Class<?> proxyClass = lookup.lookupClass();
    MethodHandle constructor = lookup.findConstructor(proxyClass, MethodType.methodType(void.class, ProxyHandler.class))
        .asType(CONSTRUCTOR_TYPE);
    MethodHandle handlerGetter = lookup.findGetter(proxyClass, ProxyGenerator.HANDLER_FIELD, ProxyHandler.class)
        .asType(GETTER_TYPE);
    return new ProxyBlueprint(name, targetType, proxyClass,
        Collections.unmodifiableList(new ArrayList<>(interfaces)), constructor, handlerGetter);
  }

  /**
   * Returns the name of the blueprint, the name of the target type followed by {@value ProxyFactory#PROXY_SUFFIX}.
   * @return the name of the blueprint.
   */
  public String name() {
    return name;
  }

  /**
   * Returns the type the blueprint was requested for.
   * @return the type the blueprint was requested for.
   */
  public Class<?> targetType() {
    return targetType;
  }

  public Class<?> proxyClass() {
    return proxyClass;
  }

  /**
   * Returns the interfaces implemented by the proxy class, including all the super-interfaces.
   * @return an unmodifiable list of interfaces, each interface appears once.
   */
  public List<Class<?>> interfaces() {
    return interfaces;
  }

  /**
   * Create a new proxy bound to {@code handler}.
   * @param handler the handler called by all the methods of the proxy.
   * @return a new proxy.
   * @throws IllegalArgumentException if {@code handler} is null.
   */
  public Object newInstance(ProxyHandler handler) {
    if (handler == null) {
      throw new IllegalArgumentException("handler is null");
    }
    try {
      return (Object) constructor.invokeExact(handler);
    } catch (Throwable e) {
      throw rethrow(e);
    }
  }

  ProxyHandler handler(Object proxy) {
    try {
      return (ProxyHandler) handlerGetter.invokeExact(proxy);
    } catch (Throwable e) {
      throw rethrow(e);
    }
  }

  private static RuntimeException rethrow(Throwable e) {
    if (e instanceof RuntimeException) {
      throw (RuntimeException)e;
    }
    if (e instanceof Error) {
      throw (Error)e;
    }
    throw new UndeclaredThrowableException(e);
  }

  @Override
  public String toString() {
    return name + interfaces;
  }
}

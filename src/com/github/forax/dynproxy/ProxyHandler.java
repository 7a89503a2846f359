package com.github.forax.dynproxy;

/**
 * Receives every call made on a proxy created by {@link ProxyFactory}.
 *
 * A handler is stateless from the point of view of the proxy machinery,
 * the same handler can be bound to several proxy instances.
 */
@FunctionalInterface
public interface ProxyHandler {
  /**
   * Called each time a method of the proxy is called.
   *
   * The value returned is converted back to the return type of the interface method:
   * it is ignored if the method returns void, unboxed (and narrowed if it's a {@link Number})
   * if the method returns a primitive type, translated from an ordinal if the method returns
   * an enum and the value is a {@link Number}, and cast otherwise.
   * Any exception thrown by this method is propagated unchanged to the caller of the proxy.
   *
   * @param proxy the proxy instance on which the method was called.
   * @param method the descriptor of the called method.
   * @param args the arguments of the call, primitive values are boxed,
   *             an empty array if the method takes no parameter.
   * @return the value to return to the caller of the proxy.
   * @throws Throwable if any errors occur.
   */
  public Object invoke(Object proxy, MethodDescriptor method, Object[] args) throws Throwable;

  /**
   * Create a handler that calls the same method on {@code target}.
   * If the target method throws an exception, this exception is propagated as is.
   *
   * @param target an object implementing the interfaces of the proxies the handler will be bound to.
   * @return a new handler that delegates to {@code target}.
   * @throws IllegalArgumentException if {@code target} is null.
   */
  public static ProxyHandler delegatingTo(Object target) {
    if (target == null) {
      throw new IllegalArgumentException("target is null");
    }
    return (proxy, method, args) -> method.invoke(target, args);
  }
}

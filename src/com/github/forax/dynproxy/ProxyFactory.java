package com.github.forax.dynproxy;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates proxies, objects implementing interfaces whose methods all call the same {@link ProxyHandler}.
 *
 * <pre>
 *   public interface Calc {
 *     int add(int a, int b);
 *   }
 *   ...
 *   Calc calc = ProxyFactory.getInstance().create(
 *       (proxy, method, args) -&gt; (Integer) args[0] + (Integer) args[1],
 *       Calc.class);
 *   calc.add(2, 3);   // 5
 * </pre>
 *
 * The proxy class of a type is generated once and cached as a {@link ProxyBlueprint}
 * named by the name of the type followed by {@value #PROXY_SUFFIX}.
 * All the methods of this class are thread-safe.
 */
public final class ProxyFactory {
  /**
   * Suffix appended to the name of the target type to name its blueprint.
   */
  public static final String PROXY_SUFFIX = "Proxy";

  private static final Object LOCK = new Object();
  private static volatile ProxyFactory instance;

  private final ProxyOptions options;
  private final ConcurrentHashMap<String, ProxyBlueprint> blueprints = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<Class<?>, ProxyBlueprint> proxyClasses = new ConcurrentHashMap<>();

  ProxyFactory(ProxyOptions options) {
    this.options = options;
  }

  /**
   * Returns the factory shared by the whole application,
   * its options are {@link ProxyOptions#fromSystemProperties() read from the system properties}.
   * @return the shared factory.
   */
  public static ProxyFactory getInstance() {
    ProxyFactory factory = instance;
    if (factory == null) {
      synchronized(LOCK) {
        factory = instance;
        if (factory == null) {
          instance = factory = new ProxyFactory(ProxyOptions.fromSystemProperties());
        }
      }
    }
    return factory;
  }

  public ProxyOptions options() {
    return options;
  }

  /**
   * Create a proxy implementing an interface and its super-interfaces.
   *
   * @param handler the handler called by each method of the proxy.
   * @param interfaceType the interface implemented by the proxy.
   * @return a new proxy.
   * @throws IllegalArgumentException if {@code handler} is null or {@code interfaceType} is not an interface.
   * @throws ProxySynthesisException if the proxy class can not be generated.
   *
   * @see #create(ProxyHandler, Class, boolean)
   */
  public <T> T create(ProxyHandler handler, Class<T> interfaceType) {
    return interfaceType.cast(create(handler, interfaceType, true));
  }

  /**
   * Create a proxy for a type.
   * If {@code isInterface} is true, or if {@code type} is an interface, the proxy implements {@code type}
   * and its super-interfaces, otherwise the proxy implements the interfaces implemented by
   * the class {@code type} or its superclasses, and their super-interfaces.
   *
   * @param handler the handler called by each method of the proxy.
   * @param type an interface or a class implementing at least one interface.
   * @param isInterface true if {@code type} should be an interface.
   * @return a new proxy.
   * @throws IllegalArgumentException if {@code handler} or {@code type} is null, if {@code isInterface}
   *         is true and {@code type} is not an interface, if {@code type} is a class that implements no interface
   *         or if another type with the same name already has a blueprint.
   * @throws ProxySynthesisException if the proxy class can not be generated.
   */
  public Object create(ProxyHandler handler, Class<?> type, boolean isInterface) {
    if (handler == null) {
      throw new IllegalArgumentException("handler is null");
    }
    return blueprint(type, isInterface).newInstance(handler);
  }

  /**
   * Returns the blueprint for a type, the blueprint is generated the first time this method is called for a type.
   *
   * @param type an interface or a class implementing at least one interface.
   * @param isInterface true if {@code type} should be an interface.
   * @return the blueprint of {@code type}.
   * @throws IllegalArgumentException if the interfaces of {@code type} are not valid.
   * @throws ProxySynthesisException if the proxy class can not be generated.
   *
   * @see #create(ProxyHandler, Class, boolean)
   */
  public ProxyBlueprint blueprint(Class<?> type, boolean isInterface) {
    if (type == null) {
      throw new IllegalArgumentException("type is null");
    }
    if (isInterface && !type.isInterface()) {
      throw new IllegalArgumentException(type.getName() + " is not an interface");
    }
    String name = type.getName() + PROXY_SUFFIX;
    ProxyBlueprint blueprint = blueprints.get(name);
    if (blueprint == null) {
      blueprint = blueprints.computeIfAbsent(name, key -> {
        Class<?>[] interfaces = type.isInterface()? new Class<?>[] { type }: implementedInterfaces(type);
        ProxyBlueprint newBlueprint = ProxyBuilder.build(key, type, interfaces, options);
        proxyClasses.put(newBlueprint.proxyClass(), newBlueprint);
        return newBlueprint;
      });
    }
    if (blueprint.targetType() != type) {
      throw new IllegalArgumentException("blueprint " + name + " is already used by another type named "
          + type.getName() + " from another class loader");
    }
    return blueprint;
  }

  // interfaces of the class and of its superclasses
  private static Class<?>[] implementedInterfaces(Class<?> type) {
    LinkedHashSet<Class<?>> interfaces = new LinkedHashSet<>();
    for(Class<?> clazz = type; clazz != null; clazz = clazz.getSuperclass()) {
      interfaces.addAll(Arrays.asList(clazz.getInterfaces()));
    }
    return interfaces.toArray(new Class<?>[0]);
  }

  /**
   * Returns the blueprint named {@code name} if it exists.
   * @param name a blueprint name.
   * @return the blueprint or an empty optional.
   */
  public Optional<ProxyBlueprint> lookupBlueprint(String name) {
    return Optional.ofNullable(blueprints.get(name));
  }

  /**
   * Returns true if {@code type} is a proxy class generated by this factory.
   * @param type a class.
   * @return true if {@code type} is a proxy class generated by this factory.
   */
  public boolean isProxyClass(Class<?> type) {
    return proxyClasses.containsKey(type);
  }

  /**
   * Returns the handler bound to a proxy.
   * @param proxy a proxy created by this factory.
   * @return the handler of the proxy.
   * @throws IllegalArgumentException if {@code proxy} was not created by this factory.
   */
  public ProxyHandler getHandler(Object proxy) {
    ProxyBlueprint blueprint = (proxy == null)? null: proxyClasses.get(proxy.getClass());
    if (blueprint == null) {
      throw new IllegalArgumentException("not a proxy " + proxy);
    }
    return blueprint.handler(proxy);
  }
}

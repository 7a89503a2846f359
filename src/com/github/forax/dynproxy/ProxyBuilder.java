package com.github.forax.dynproxy;

import java.lang.invoke.MethodHandles.Lookup;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the {@link ProxyBlueprint} of a set of interfaces: computes the interface closure,
 * registers the descriptors of its interfaces, generates and loads the proxy class.
 */
final class ProxyBuilder {
  private static final Logger LOGGER = LoggerFactory.getLogger(ProxyBuilder.class);

  private ProxyBuilder() {
    // no instance
  }

  /**
   * Returns the interfaces and all their super-interfaces, each interface appears once,
   * depth first, in the order the interfaces are declared.
   *
   * @param interfaces some interfaces.
   * @return the interface closure.
   * @throws IllegalArgumentException if one of the types is not an interface.
   */
  static List<Class<?>> closure(List<? extends Class<?>> interfaces) {
    LinkedHashSet<Class<?>> closure = new LinkedHashSet<>();
    for(Class<?> interfaze: interfaces) {
      collect(interfaze, closure);
    }
    return new ArrayList<>(closure);
  }

  private static void collect(Class<?> interfaze, LinkedHashSet<Class<?>> closure) {
    if (!interfaze.isInterface()) {
      throw new IllegalArgumentException(interfaze.getName() + " is not an interface");
    }
    if (!closure.add(interfaze)) {
      return;  // already reached by another path
    }
    for(Class<?> superInterface: interfaze.getInterfaces()) {
      collect(superInterface, closure);
    }
  }

  /**
   * Build a new blueprint.
   *
   * @param name the name of the blueprint.
   * @param targetType the type the blueprint is created for.
   * @param interfaces the interfaces the proxy class should implement.
   * @param options the options.
   * @return a new blueprint.
   * @throws IllegalArgumentException if there is no interface, if a type is not an interface
   *         or if the non-public interfaces are not in the same package.
   * @throws ProxySynthesisException if the proxy class can not be generated or loaded.
   */
  static ProxyBlueprint build(String name, Class<?> targetType, Class<?>[] interfaces, ProxyOptions options) {
    if (interfaces == null || interfaces.length == 0) {
      throw new IllegalArgumentException("no interface to implement for " + name);
    }
    List<Class<?>> supplied = new ArrayList<>(new LinkedHashSet<>(Arrays.asList(interfaces)));
    List<Class<?>> closure = closure(supplied);
    for(Class<?> interfaze: closure) {
      if (interfaze.isSealed()) {
        throw new ProxySynthesisException("sealed interface " + interfaze.getName() + " can not be implemented by a proxy");
      }
    }

    ProxyClassDefiner definer = ProxyClassDefiner.forInterfaces(closure);
    String binaryName = definer.binaryName(name);
    String internalName = binaryName.replace('.', '/');

    ArrayList<InterfaceDescriptor> descriptors = new ArrayList<>(closure.size());
    for(Class<?> interfaze: closure) {
      descriptors.add(InterfaceDescriptors.register(interfaze));
    }
    byte[] data = ProxyGenerator.generate(internalName, supplied, descriptors);
    options.dump(internalName, data);

    ProxyBlueprint blueprint;
    try {
      Lookup lookup = definer.define(binaryName, data);
      blueprint = ProxyBlueprint.of(name, targetType, closure, lookup);
    } catch (LinkageError | ReflectiveOperationException e) {
      throw new ProxySynthesisException("can not define proxy class " + binaryName + " for " + closure, e);
    }
    LOGGER.debug("create blueprint {} as {} implementing {}", name, binaryName, closure);
    return blueprint;
  }
}

package com.github.forax.dynproxy;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide cache of the {@link InterfaceDescriptor}s of the proxied interfaces,
 * indexed by the fully qualified name of the interface.
 *
 * The cache only grows, a descriptor is never removed or replaced.
 * {@link #resolveMethod(String, int)} is called by the code of the generated proxies
 * to find the {@link MethodDescriptor} passed to the {@link ProxyHandler}.
 */
public final class InterfaceDescriptors {
  private static final Logger LOGGER = LoggerFactory.getLogger(InterfaceDescriptors.class);

  private static final ConcurrentHashMap<String, InterfaceDescriptor> DESCRIPTORS = new ConcurrentHashMap<>();

  private InterfaceDescriptors() {
    // no instance
  }

  /**
   * Register an interface, registering an interface already registered does nothing.
   *
   * @param interfaze the interface to register.
   * @return the descriptor of the interface.
   * @throws IllegalArgumentException if {@code interfaze} is not an interface or if another interface
   *         with the same name, loaded by another class loader, is already registered.
   */
  public static InterfaceDescriptor register(Class<?> interfaze) {
    InterfaceDescriptor descriptor = DESCRIPTORS.computeIfAbsent(interfaze.getName(), name -> {
      InterfaceDescriptor newDescriptor = InterfaceDescriptor.of(interfaze);
      LOGGER.debug("register {} with {} method(s)", name, newDescriptor.methods().size());
      return newDescriptor;
    });
    if (descriptor.type() != interfaze) {
      throw new IllegalArgumentException("an interface named " + interfaze.getName()
          + " is already registered from another class loader");
    }
    return descriptor;
  }

  /**
   * Returns the descriptor of a registered interface.
   * @param interfaceName the fully qualified name of the interface.
   * @return the descriptor of the interface or an empty optional if the interface is not registered.
   */
  public static Optional<InterfaceDescriptor> lookup(String interfaceName) {
    return Optional.ofNullable(DESCRIPTORS.get(interfaceName));
  }

  /**
   * Returns the method at position {@code index} of a registered interface.
   *
   * @param interfaceName the fully qualified name of the interface.
   * @param index the position of the method in the interface.
   * @return the descriptor of the method.
   * @throws MethodDescriptorNotFoundException if the interface is not registered or has no method at {@code index}.
   */
  public static MethodDescriptor resolveMethod(String interfaceName, int index) {
    List<MethodDescriptor> methods = descriptor(interfaceName).methods();
    if (index < 0 || index >= methods.size()) {
      throw new MethodDescriptorNotFoundException("no method at index " + index + " in " + interfaceName);
    }
    return methods.get(index);
  }

  /**
   * Returns the property at position {@code index} of a registered interface.
   *
   * @param interfaceName the fully qualified name of the interface.
   * @param index the position of the property in the interface.
   * @return the descriptor of the property.
   * @throws MethodDescriptorNotFoundException if the interface is not registered or has no property at {@code index}.
   */
  public static PropertyDescriptor resolveProperty(String interfaceName, int index) {
    List<PropertyDescriptor> properties = descriptor(interfaceName).properties();
    if (index < 0 || index >= properties.size()) {
      throw new MethodDescriptorNotFoundException("no property at index " + index + " in " + interfaceName);
    }
    return properties.get(index);
  }

  private static InterfaceDescriptor descriptor(String interfaceName) {
    InterfaceDescriptor descriptor = DESCRIPTORS.get(interfaceName);
    if (descriptor == null) {
      throw new MethodDescriptorNotFoundException("interface " + interfaceName + " is not registered");
    }
    return descriptor;
  }
}

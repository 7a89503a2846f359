package com.github.forax.dynproxy;

import static org.objectweb.asm.Opcodes.ASM9;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The shape of an interface: its own abstract methods, in declaration order,
 * and the bean properties formed by some of these methods.
 *
 * Inherited methods are not part of the descriptor of an interface,
 * they belong to the descriptor of the super-interface that declares them.
 */
public final class InterfaceDescriptor {
  private static final Logger LOGGER = LoggerFactory.getLogger(InterfaceDescriptor.class);

  private final Class<?> type;
  private final List<MethodDescriptor> methods;
  private final List<PropertyDescriptor> properties;

  private InterfaceDescriptor(Class<?> type, List<MethodDescriptor> methods, List<PropertyDescriptor> properties) {
    this.type = type;
    this.methods = methods;
    this.properties = properties;
  }

  /**
   * Reflect the shape of an interface.
   *
   * @param interfaze an interface.
   * @return a new descriptor.
   * @throws IllegalArgumentException if {@code interfaze} is not an interface.
   */
  static InterfaceDescriptor of(Class<?> interfaze) {
    if (!interfaze.isInterface()) {
      throw new IllegalArgumentException(interfaze + " is not an interface");
    }
    String name = interfaze.getName();
    List<Method> declaredMethods = abstractMethodsInDeclarationOrder(interfaze);
    ArrayList<MethodDescriptor> methods = new ArrayList<>(declaredMethods.size());
    for(int i = 0; i < declaredMethods.size(); i++) {
      methods.add(new MethodDescriptor(name, i, declaredMethods.get(i)));
    }
    return new InterfaceDescriptor(interfaze,
        Collections.unmodifiableList(methods),
        Collections.unmodifiableList(properties(methods)));
  }

  public Class<?> type() {
    return type;
  }

  /**
   * Returns the fully qualified name of the interface.
   * @return the fully qualified name of the interface.
   */
  public String name() {
    return type.getName();
  }

  /**
   * Returns the abstract methods declared by the interface, the index of each
   * {@link MethodDescriptor} is its position in this list.
   * @return an unmodifiable list of method descriptors.
   */
  public List<MethodDescriptor> methods() {
    return methods;
  }

  public List<PropertyDescriptor> properties() {
    return properties;
  }

  @Override
  public String toString() {
    return name() + methods;
  }

  private static boolean isProxyable(Method method) {
    int modifiers = method.getModifiers();
    return Modifier.isAbstract(modifiers) && !Modifier.isStatic(modifiers) && !method.isSynthetic();
  }

  private static String signature(String name, String descriptor) {
    return name + descriptor;
  }

  private static List<Method> abstractMethodsInDeclarationOrder(Class<?> interfaze) {
    LinkedHashMap<String, Method> methodMap = new LinkedHashMap<>();
    for(Method method: interfaze.getDeclaredMethods()) {
      if (isProxyable(method)) {
        methodMap.put(signature(method.getName(), Type.getMethodDescriptor(method)), method);
      }
    }

    List<String> order = readDeclarationOrder(interfaze);
    ArrayList<Method> methods = new ArrayList<>(methodMap.size());
    if (order != null) {
      for(String signature: order) {
        Method method = methodMap.remove(signature);
        if (method != null) {
          methods.add(method);
        }
      }
    } else {
      LOGGER.debug("class file of {} not found, methods are sorted by name", interfaze.getName());
    }

    // methods not found in the class file, or all of them if the class file is not available
    ArrayList<Method> remaining = new ArrayList<>(methodMap.values());
    remaining.sort(Comparator.comparing(Method::getName).thenComparing(method -> Type.getMethodDescriptor(method)));
    methods.addAll(remaining);
    return methods;
  }

  // reflection doesn't guarantee any order, so read the order of the methods from the class file
  private static List<String> readDeclarationOrder(Class<?> interfaze) {
    String resourceName = '/' + interfaze.getName().replace('.', '/') + ".class";
    try(InputStream input = interfaze.getResourceAsStream(resourceName)) {
      if (input == null) {
        return null;
      }
      ArrayList<String> order = new ArrayList<>();
      new ClassReader(input).accept(new ClassVisitor(ASM9) {
        @Override
        public MethodVisitor visitMethod(int access, String name, String descriptor, String signature, String[] exceptions) {
          order.add(signature(name, descriptor));
          return null;
        }
      }, ClassReader.SKIP_CODE|ClassReader.SKIP_DEBUG|ClassReader.SKIP_FRAMES);
      return order;
    } catch (IOException | IllegalArgumentException e) {  // IllegalArgumentException if the class version is unknown
      LOGGER.warn("can not read the class file of {}, methods are sorted by name instead of declaration order",
          interfaze.getName(), e);
      return null;
    }
  }

  private static List<PropertyDescriptor> properties(List<MethodDescriptor> methods) {
    LinkedHashMap<String, MethodDescriptor> getters = new LinkedHashMap<>();
    Map<String, MethodDescriptor> setters = new LinkedHashMap<>();
    for(MethodDescriptor method: methods) {
      String name = method.name();
      int parameterCount = method.parameterTypes().size();
      Class<?> returnType = method.returnType();
      if (parameterCount == 0 && returnType != void.class && name.length() > 3 && name.startsWith("get")) {
        getters.putIfAbsent(propertyName(name.substring(3)), method);
      } else if (parameterCount == 0 && returnType == boolean.class && name.length() > 2 && name.startsWith("is")) {
        getters.putIfAbsent(propertyName(name.substring(2)), method);
      } else if (parameterCount == 1 && returnType == void.class && name.length() > 3 && name.startsWith("set")) {
        setters.putIfAbsent(propertyName(name.substring(3)), method);
      }
    }

    ArrayList<PropertyDescriptor> properties = new ArrayList<>(getters.size());
    for(Map.Entry<String, MethodDescriptor> entry: getters.entrySet()) {
      String name = entry.getKey();
      MethodDescriptor getter = entry.getValue();
      MethodDescriptor setter = setters.get(name);
      if (setter != null && setter.parameterTypes().get(0) != getter.returnType()) {
        setter = null;
      }
      properties.add(new PropertyDescriptor(name, properties.size(), getter, setter));
    }
    return properties;
  }

  private static String propertyName(String suffix) {
    if (suffix.length() > 1 && Character.isUpperCase(suffix.charAt(1))) {
      return suffix;  // URL stays URL
    }
    return Character.toLowerCase(suffix.charAt(0)) + suffix.substring(1);
  }
}

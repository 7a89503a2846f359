package com.github.forax.dynproxy;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.objectweb.asm.Type;

/**
 * Describes an abstract method of an interface, its position in the
 * {@link InterfaceDescriptor#methods() methods} of its interface is its {@link #index() index}.
 *
 * Instances are created once when an interface is {@link InterfaceDescriptors#register(Class) registered}
 * and never change after that.
 */
public final class MethodDescriptor {
  private final String declaringInterface;
  private final int index;
  private final Method method;
  private final List<Class<?>> parameterTypes;

  MethodDescriptor(String declaringInterface, int index, Method method) {
    this.declaringInterface = declaringInterface;
    this.index = index;
    this.method = method;
    this.parameterTypes = Collections.unmodifiableList(Arrays.asList(method.getParameterTypes()));
  }

  /**
   * Returns the fully qualified name of the interface that declares the method.
   * @return the fully qualified name of the interface that declares the method.
   */
  public String declaringInterface() {
    return declaringInterface;
  }

  /**
   * Returns the position of the method in the declaring interface.
   * @return the position of the method in the declaring interface.
   */
  public int index() {
    return index;
  }

  public String name() {
    return method.getName();
  }

  public List<Class<?>> parameterTypes() {
    return parameterTypes;
  }

  public Class<?> returnType() {
    return method.getReturnType();
  }

  /**
   * Returns the reflected method.
   * @return the reflected method.
   */
  public Method method() {
    return method;
  }

  /**
   * Returns the JVM descriptor of the method, by example {@code (II)I} for {@code int add(int, int)}.
   * @return the JVM descriptor of the method.
   */
  public String descriptor() {
    return Type.getMethodDescriptor(method);
  }

  /**
   * Call the described method on {@code target}.
   * Unlike {@link Method#invoke(Object, Object...)}, the exception thrown by the target method
   * is rethrown as is.
   *
   * @param target the receiver of the call.
   * @param args the arguments of the call.
   * @return the value returned by the call, boxed if it's a primitive value.
   * @throws IllegalAccessException if the method is declared by a non-public interface
   *         of a package that is not open to this library.
   * @throws Throwable the exception thrown by the target method.
   */
  public Object invoke(Object target, Object[] args) throws Throwable {
    if (!Modifier.isPublic(method.getDeclaringClass().getModifiers()) && !method.trySetAccessible()) {
      throw new IllegalAccessException("can not access " + method
          + ", its package is not open to " + MethodDescriptor.class.getModule());
    }
    try {
      return method.invoke(target, args);
    } catch (InvocationTargetException e) {
      throw e.getCause();
    }
  }

  @Override
  public String toString() {
    return declaringInterface + '.' + name() + descriptor() + '#' + index;
  }
}

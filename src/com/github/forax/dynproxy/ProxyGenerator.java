package com.github.forax.dynproxy;

import static org.objectweb.asm.Opcodes.*;

import java.lang.reflect.Method;
import java.util.HashSet;
import java.util.List;

import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.FieldVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Type;

/**
 * Generates the bytecode of a proxy class.
 *
 * For each abstract method {@code R m(T1, T2)} at index {@code i} of an interface {@code I},
 * the generated method is equivalent to
 * <pre>
 *   public R m(T1 a1, T2 a2) {
 *     MethodDescriptor method = InterfaceDescriptors.resolveMethod("I", i);
 *     Object result = handler.invoke(this, method, new Object[] { box(a1), box(a2) });
 *     return convert(result);
 *   }
 * </pre>
 */
final class ProxyGenerator {
  static final String HANDLER_FIELD = "handler";

  private static final String HANDLER_NAME = Type.getInternalName(ProxyHandler.class);
  private static final String HANDLER_DESC = Type.getDescriptor(ProxyHandler.class);
  private static final String INVOKE_DESC =
      "(Ljava/lang/Object;" + Type.getDescriptor(MethodDescriptor.class) + "[Ljava/lang/Object;)Ljava/lang/Object;";
  private static final String DESCRIPTORS_NAME = Type.getInternalName(InterfaceDescriptors.class);
  private static final String RESOLVE_METHOD_DESC = "(Ljava/lang/String;I)" + Type.getDescriptor(MethodDescriptor.class);
  private static final String RETURN_VALUES_NAME = Type.getInternalName(ReturnValues.class);
  private static final String AS_ENUM_DESC = "(Ljava/lang/Object;Ljava/lang/Class;)Ljava/lang/Object;";

  private ProxyGenerator() {
    // no instance
  }

  private static String[] internalNames(Class<?>[] types) {
    String[] array = new String[types.length];
    for(int i = 0; i < array.length; i++) {
      array[i] = Type.getInternalName(types[i]);
    }
    return array;
  }

  /**
   * Generate a proxy class.
   *
   * @param proxyName the internal name of the proxy class.
   * @param interfaces the interfaces implemented by the proxy class.
   * @param closure the descriptors of the interfaces and all their super-interfaces,
   *                the methods are generated in that order.
   * @return the bytecode of the proxy class.
   */
  static byte[] generate(String proxyName, List<Class<?>> interfaces, List<InterfaceDescriptor> closure) {
    ClassWriter writer = new ClassWriter(ClassWriter.COMPUTE_FRAMES|ClassWriter.COMPUTE_MAXS);
    writer.visit(V1_8, ACC_PUBLIC|ACC_SUPER|ACC_FINAL, proxyName, null, "java/lang/Object",
        internalNames(interfaces.toArray(new Class<?>[0])));

    FieldVisitor fv = writer.visitField(ACC_PRIVATE|ACC_FINAL, HANDLER_FIELD, HANDLER_DESC, null, null);
    fv.visitEnd();

    { // constructor
      MethodVisitor init = writer.visitMethod(ACC_PUBLIC, "<init>", "(" + HANDLER_DESC + ")V", null, null);
      init.visitCode();
      init.visitVarInsn(ALOAD, 0);
      init.visitVarInsn(ALOAD, 1);
      init.visitFieldInsn(PUTFIELD, proxyName, HANDLER_FIELD, HANDLER_DESC);
      init.visitVarInsn(ALOAD, 0);
      init.visitMethodInsn(INVOKESPECIAL, "java/lang/Object", "<init>", "()V", false);
      init.visitInsn(RETURN);
      init.visitMaxs(-1, -1);
      init.visitEnd();
    }

    // the same signature can come from several interfaces, the first one wins
    HashSet<String> signatures = new HashSet<>();
    for(InterfaceDescriptor descriptor: closure) {
      for(MethodDescriptor method: descriptor.methods()) {
        String signature = method.name() + method.descriptor();
        if (signatures.contains(signature) || isOverriddenByDefault(method, closure)) {
          continue;
        }
        signatures.add(signature);
        generateMethod(writer, proxyName, method);
      }
    }

    writer.visitEnd();
    return writer.toByteArray();
  }

  // a default method of a sub-interface is more specific than the abstract method, it keeps its body
  private static boolean isOverriddenByDefault(MethodDescriptor descriptor, List<InterfaceDescriptor> closure) {
    Class<?> declaringClass = descriptor.method().getDeclaringClass();
    for(InterfaceDescriptor interfaceDescriptor: closure) {
      Class<?> type = interfaceDescriptor.type();
      if (type == declaringClass || !declaringClass.isAssignableFrom(type)) {
        continue;
      }
      for(Method method: type.getDeclaredMethods()) {
        if (method.isDefault() && !method.isBridge() && method.getName().equals(descriptor.name())
            && Type.getMethodDescriptor(method).equals(descriptor.descriptor())) {
          return true;
        }
      }
    }
    return false;
  }

  private static void generateMethod(ClassWriter writer, String proxyName, MethodDescriptor descriptor) {
    Method method = descriptor.method();
    int access = ACC_PUBLIC | (method.isVarArgs()? ACC_VARARGS: 0);
    MethodVisitor mv = writer.visitMethod(access, descriptor.name(), descriptor.descriptor(), null,
        internalNames(method.getExceptionTypes()));
    mv.visitCode();
    mv.visitVarInsn(ALOAD, 0);
    mv.visitFieldInsn(GETFIELD, proxyName, HANDLER_FIELD, HANDLER_DESC);
    mv.visitVarInsn(ALOAD, 0);

    mv.visitLdcInsn(descriptor.declaringInterface());
    pushInt(mv, descriptor.index());
    mv.visitMethodInsn(INVOKESTATIC, DESCRIPTORS_NAME, "resolveMethod", RESOLVE_METHOD_DESC, false);

    List<Class<?>> parameterTypes = descriptor.parameterTypes();
    pushInt(mv, parameterTypes.size());
    mv.visitTypeInsn(ANEWARRAY, "java/lang/Object");
    int slot = 1;
    for(int i = 0; i < parameterTypes.size(); i++) {
      Class<?> parameterType = parameterTypes.get(i);
      mv.visitInsn(DUP);
      pushInt(mv, i);
      mv.visitVarInsn(Type.getType(parameterType).getOpcode(ILOAD), slot);
      if (parameterType.isPrimitive()) {
        ValueConversion.of(parameterType).box(mv);
      }
      mv.visitInsn(AASTORE);
      slot += (parameterType == long.class || parameterType == double.class)? 2: 1;
    }

    mv.visitMethodInsn(INVOKEINTERFACE, HANDLER_NAME, "invoke", INVOKE_DESC, true);
    convertAndReturn(mv, descriptor.returnType());
    mv.visitMaxs(-1, -1);
    mv.visitEnd();
  }

  private static void convertAndReturn(MethodVisitor mv, Class<?> returnType) {
    if (returnType == void.class) {
      mv.visitInsn(POP);
      mv.visitInsn(RETURN);
      return;
    }
    if (returnType.isPrimitive()) {
      ValueConversion.of(returnType).unbox(mv);
      mv.visitInsn(Type.getType(returnType).getOpcode(IRETURN));
      return;
    }
    if (returnType.isEnum()) {
      mv.visitLdcInsn(Type.getType(returnType));
      mv.visitMethodInsn(INVOKESTATIC, RETURN_VALUES_NAME, "asEnum", AS_ENUM_DESC, false);
    }
    if (returnType != Object.class) {
      mv.visitTypeInsn(CHECKCAST, Type.getInternalName(returnType));
    }
    mv.visitInsn(ARETURN);
  }

  private static void pushInt(MethodVisitor mv, int value) {
    if (value >= -1 && value <= 5) {
      mv.visitInsn(ICONST_0 + value);
      return;
    }
    if (value >= Byte.MIN_VALUE && value <= Byte.MAX_VALUE) {
      mv.visitIntInsn(BIPUSH, value);
      return;
    }
    if (value >= Short.MIN_VALUE && value <= Short.MAX_VALUE) {
      mv.visitIntInsn(SIPUSH, value);
      return;
    }
    mv.visitLdcInsn(value);
  }
}

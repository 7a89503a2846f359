package com.github.forax.dynproxy;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Loads the bytecode of a proxy class.
 *
 * If all the interfaces are public, the proxy class is defined by a new class loader
 * that sees the interfaces and this library. Otherwise, the proxy class is defined
 * in the package of the non-public interfaces, by their class loader.
 */
abstract class ProxyClassDefiner {
  static final String GENERATED_PACKAGE = "com.github.forax.dynproxy.generated";
  // proxies defined in the package of a user interface get a name no user class is expected to have
  static final String PROXY_INFIX = "$$DynProxy$";

  /**
   * Returns the binary name of the proxy class for a blueprint name,
   * each call may return a new name.
   * @param blueprintName the name of the blueprint.
   * @return the binary name of the proxy class.
   */
  abstract String binaryName(String blueprintName);

  /**
   * Define the proxy class.
   * @param binaryName the binary name of the proxy class.
   * @param data the bytecode of the proxy class.
   * @return a lookup with a private access on the new proxy class.
   * @throws IllegalAccessException if the package of the proxy class is not accessible.
   */
  abstract Lookup define(String binaryName, byte[] data) throws IllegalAccessException;

  /**
   * Select how to define a proxy class implementing all the interfaces of {@code closure}.
   * @param closure the interfaces and their super-interfaces.
   * @return a class definer.
   * @throws IllegalArgumentException if the non-public interfaces are not in the same package.
   */
  static ProxyClassDefiner forInterfaces(List<Class<?>> closure) {
    Class<?> nonPublic = null;
    for(Class<?> interfaze: closure) {
      if (Modifier.isPublic(interfaze.getModifiers())) {
        continue;
      }
      if (nonPublic == null) {
        nonPublic = interfaze;
        continue;
      }
      if (nonPublic.getClassLoader() != interfaze.getClassLoader()
          || !nonPublic.getPackageName().equals(interfaze.getPackageName())) {
        throw new IllegalArgumentException("non-public interfaces " + nonPublic.getName() + " and "
            + interfaze.getName() + " are not in the same package");
      }
    }
    if (nonPublic != null) {
      return new PackageDefiner(nonPublic);
    }

    ArrayList<ClassLoader> loaders = new ArrayList<>();
    for(Class<?> interfaze: closure) {
      ClassLoader loader = interfaze.getClassLoader();
      if (loader != null && !loaders.contains(loader)) {
        loaders.add(loader);
      }
    }
    ClassLoader libraryLoader = ProxyClassDefiner.class.getClassLoader();
    if (libraryLoader != null && !loaders.contains(libraryLoader)) {
      loaders.add(libraryLoader);
    }
    return new LoaderDefiner(loaders);
  }

  static Lookup privateLookup(Class<?> type) throws IllegalAccessException {
    return MethodHandles.privateLookupIn(type, MethodHandles.lookup());
  }

  private static final class LoaderDefiner extends ProxyClassDefiner {
    private final List<ClassLoader> loaders;

    LoaderDefiner(List<ClassLoader> loaders) {
      this.loaders = loaders;
    }

    @Override
    String binaryName(String blueprintName) {
      // the VM refuses to define a class in java.* outside of the boot layer
      return blueprintName.startsWith("java.")? GENERATED_PACKAGE + '.' + blueprintName: blueprintName;
    }

    @Override
    Lookup define(String binaryName, byte[] data) throws IllegalAccessException {
      ProxyClassLoader loader = new ProxyClassLoader(loaders);
      return privateLookup(loader.define(binaryName, data));
    }
  }

  private static final class PackageDefiner extends ProxyClassDefiner {
    private static final AtomicInteger COUNTER = new AtomicInteger();

    private final Class<?> nonPublicInterface;

    PackageDefiner(Class<?> nonPublicInterface) {
      this.nonPublicInterface = nonPublicInterface;
    }

    @Override
    String binaryName(String blueprintName) {
      String packageName = nonPublicInterface.getPackageName();
      String simpleName = blueprintName.substring(blueprintName.lastIndexOf('.') + 1)
          + PROXY_INFIX + COUNTER.incrementAndGet();
      return packageName.isEmpty()? simpleName: packageName + '.' + simpleName;
    }

    @Override
    Lookup define(String binaryName, byte[] data) throws IllegalAccessException {
      Lookup lookup = privateLookup(nonPublicInterface);
      return privateLookup(lookup.defineClass(data));
    }
  }

  /**
   * A class loader per proxy class, it resolves the names used by the proxy class
   * through the class loaders of the interfaces and of this library.
   */
  static final class ProxyClassLoader extends ClassLoader {
    static {
      ClassLoader.registerAsParallelCapable();
    }

    private final List<ClassLoader> loaders;

    ProxyClassLoader(List<ClassLoader> loaders) {
      super("dynproxy", null);
      this.loaders = loaders;
    }

    Class<?> define(String name, byte[] data) {
      return defineClass(name, data, 0, data.length);
    }

    @Override
    protected Class<?> findClass(String name) throws ClassNotFoundException {
      ClassNotFoundException failure = new ClassNotFoundException(name);
      for(ClassLoader loader: loaders) {
        try {
          return Class.forName(name, false, loader);
        } catch (ClassNotFoundException e) {
          failure.addSuppressed(e);
        }
      }
      throw failure;
    }
  }
}

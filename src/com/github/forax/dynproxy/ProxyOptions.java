package com.github.forax.dynproxy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Options of a {@link ProxyFactory}.
 *
 * The default options are read from the system properties:
 * <ul>
 *   <li>{@value #DUMP_DIRECTORY_PROPERTY}: a directory where the generated proxy classes are written.
 * </ul>
 */
public final class ProxyOptions {
  private static final Logger LOGGER = LoggerFactory.getLogger(ProxyOptions.class);

  /**
   * Name of the system property indicating where to write the generated classes.
   */
  public static final String DUMP_DIRECTORY_PROPERTY = "dynproxy.dumpDirectory";

  private static final ProxyOptions DEFAULTS = new ProxyOptions(null);

  private final Path dumpDirectory;  // may be null

  private ProxyOptions(Path dumpDirectory) {
    this.dumpDirectory = dumpDirectory;
  }

  /**
   * Returns options that don't dump the generated classes.
   * @return the default options.
   */
  public static ProxyOptions defaults() {
    return DEFAULTS;
  }

  /**
   * Read the options from the system properties.
   * @return the options specified by the system properties.
   */
  public static ProxyOptions fromSystemProperties() {
    String directory = System.getProperty(DUMP_DIRECTORY_PROPERTY);
    if (directory == null || directory.isEmpty()) {
      return DEFAULTS;
    }
    return new ProxyOptions(Paths.get(directory));
  }

  /**
   * Returns new options that write the generated classes in {@code directory}.
   * @param directory the directory or null to not write the generated classes.
   * @return new options.
   */
  public ProxyOptions withDumpDirectory(Path directory) {
    return new ProxyOptions(directory);
  }

  public Optional<Path> dumpDirectory() {
    return Optional.ofNullable(dumpDirectory);
  }

  void dump(String internalName, byte[] data) {
    if (dumpDirectory == null) {
      return;
    }
    Path file = dumpDirectory.resolve(internalName + ".class");
    try {
      Files.createDirectories(file.getParent());
      Files.write(file, data);
      LOGGER.debug("write {}", file);
    } catch (IOException e) {
      LOGGER.warn("can not write the proxy class {}", file, e);
    }
  }

  @Override
  public String toString() {
    return "ProxyOptions{dumpDirectory=" + dumpDirectory + '}';
  }
}

package com.github.forax.dynproxy;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProxyOptionsTest {
  public interface Dumped {
    String value();
  }

  @Test
  void defaults_do_not_dump() {
    assertThat(ProxyOptions.defaults().dumpDirectory()).isEmpty();
  }

  @Test
  void dump_directory_is_read_from_the_system_properties(@TempDir Path directory) {
    String previous = System.getProperty(ProxyOptions.DUMP_DIRECTORY_PROPERTY);
    System.setProperty(ProxyOptions.DUMP_DIRECTORY_PROPERTY, directory.toString());
    try {
      assertThat(ProxyOptions.fromSystemProperties().dumpDirectory()).contains(directory);
    } finally {
      if (previous == null) {
        System.clearProperty(ProxyOptions.DUMP_DIRECTORY_PROPERTY);
      } else {
        System.setProperty(ProxyOptions.DUMP_DIRECTORY_PROPERTY, previous);
      }
    }
  }

  @Test
  void generated_class_is_written_to_the_dump_directory(@TempDir Path directory) throws IOException {
    ProxyFactory factory = new ProxyFactory(ProxyOptions.defaults().withDumpDirectory(directory));

    Dumped dumped = factory.create((proxy, method, args) -> "dumped", Dumped.class);

    assertThat(dumped.value()).isEqualTo("dumped");
    Path file = directory.resolve(dumped.getClass().getName().replace('.', '/') + ".class");
    assertThat(file).exists();
    byte[] data = Files.readAllBytes(file);
    assertThat(data).startsWith((byte) 0xCA, (byte) 0xFE, (byte) 0xBA, (byte) 0xBE);
  }

  @Test
  void dump_failure_does_not_prevent_the_creation(@TempDir Path directory) throws IOException {
    Path notADirectory = Files.createFile(directory.resolve("file"));
    ProxyFactory factory = new ProxyFactory(ProxyOptions.defaults().withDumpDirectory(notADirectory));

    Dumped dumped = factory.create((proxy, method, args) -> "still works", Dumped.class);

    assertThat(dumped.value()).isEqualTo("still works");
  }
}

package io.clientforge.generators.java;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

public class GeneratorConfigTest {

  @Test
  void shouldDefaultClientClassName() {
    GeneratorConfig config = new GeneratorConfig(Path.of("out"), "com.example.api");

    assertThat(config.clientClassName()).isEqualTo("ApiClient");
    assertThat(config.schemasPackage()).isEqualTo("com.example.api.schemas");
  }

  @Test
  void shouldResolvePackageDirectoryBelowOutput() {
    GeneratorConfig config = new GeneratorConfig(Path.of("out"), "com.example.api", "PetClient");

    assertThat(config.packageDirectory(config.schemasPackage()))
      .isEqualTo(Path.of("out", "com", "example", "api", "schemas"));
  }

  @Test
  void shouldRejectInvalidPackageName() {
    assertThatThrownBy(() -> new GeneratorConfig(Path.of("out"), "com.example.class"))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("package");
    assertThatThrownBy(() -> new GeneratorConfig(Path.of("out"), "com..example"))
      .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void shouldRejectInvalidClientClassName() {
    assertThatThrownBy(() -> new GeneratorConfig(Path.of("out"), "com.example", "Pet-Client"))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("Pet-Client");
    assertThatThrownBy(() -> new GeneratorConfig(Path.of("out"), "com.example", "enum"))
      .isInstanceOf(IllegalArgumentException.class);
  }
}

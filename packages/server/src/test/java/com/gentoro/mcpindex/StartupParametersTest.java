package com.gentoro.mcpindex;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  @DisplayName("defaults to server mode with the bundled configuration")
  void defaults() {
    StartupParameters params = new StartupParameters(new String[0]);
    assertEquals(StartupParameters.MODE_SERVER, params.mode());
    assertEquals(ConfigurationProvider.DEFAULT_LOCATION, params.configFile());
    assertFalse(params.isFlagSet("refresh"));
  }

  @Test
  @DisplayName("valued options and bare flags are both recognised")
  void optionsAndFlags() {
    StartupParameters params =
        new StartupParameters(
            new String[] {
              "--mode", "build-data", "--force", "--output", "out/data", "stray", "--refresh"
            });

    assertEquals(StartupParameters.MODE_BUILD_DATA, params.mode());
    assertEquals("out/data", params.getParameter("output", String.class));
    assertTrue(params.isFlagSet("force"));
    assertTrue(params.isFlagSet("refresh"));
    assertFalse(params.isFlagSet("output"));
    assertTrue(params.isParameterPresent("force"));
    assertTrue(params.getOptionalParameter("missing", String.class).isEmpty());
  }

  @Test
  @DisplayName("unknown modes and a valueless config file are rejected")
  void validation() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--mode", "daemon"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--config-file", "--refresh"}));
  }

  @Test
  @DisplayName("usage lists every mode")
  void usage() {
    String usage = StartupParameters.usage();
    assertTrue(usage.contains("server|interactive|build-data|help"));
    assertTrue(usage.contains("--clear-cache"));
  }
}

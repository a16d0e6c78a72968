package com.gentoro.usagereporting;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.usagereporting.exception.ConfigException;
import com.gentoro.usagereporting.plugin.SendValuesPolicy;
import com.gentoro.usagereporting.plugin.DefaultSendOperationsAsTrace;
import com.gentoro.usagereporting.trace.SendErrorsPolicy;
import java.util.List;
import java.util.Set;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class UsageReportingOptionsTest {

  private static UsageReportingOptions.Builder valid() {
    return UsageReportingOptions.builder().apiKey("key").graphRef("graph@current");
  }

  @Test
  void defaults() {
    UsageReportingOptions options = valid().build();

    assertEquals(UsageReportingOptions.DEFAULT_ENDPOINT_URL, options.endpointUrl());
    assertEquals(10_000, options.reportIntervalMs());
    assertEquals(5, options.maxAttempts());
    assertEquals(100, options.minimumRetryDelayMs());
    assertTrue(options.sendTraces());
    assertFalse(options.sendReportsImmediately());
    assertEquals(SendValuesPolicy.Kind.NONE, options.sendHeaders().kind());
    assertEquals(SendValuesPolicy.Kind.NONE, options.sendVariableValues().kind());
    assertEquals(SendErrorsPolicy.Kind.MASKED, options.sendErrors().kind());
    assertTrue(options.sendOperationAsTrace() instanceof DefaultSendOperationsAsTrace);
  }

  @Test
  @DisplayName("Missing credentials are a configuration error")
  void credentialsAreRequired() {
    assertThrows(
        ConfigException.class, () -> UsageReportingOptions.builder().graphRef("g").build());
    assertThrows(ConfigException.class, () -> UsageReportingOptions.builder().apiKey("k").build());
    assertThrows(ConfigException.class, () -> valid().apiKey("  ").build());
  }

  @Test
  void rejectsOutOfRangeValues() {
    assertThrows(ConfigException.class, () -> valid().maxAttempts(0).build());
    assertThrows(ConfigException.class, () -> valid().reportIntervalMs(-1).build());
    assertThrows(ConfigException.class, () -> valid().minimumRetryDelayMs(-1).build());
    assertThrows(ConfigException.class, () -> valid().sendErrors(null).build());
  }

  @Test
  void readsYamlConfiguration() {
    Configuration config =
        new ConfigurationProvider("classpath:usage-reporting-test.yaml").config();

    UsageReportingOptions options = UsageReportingOptions.fromConfiguration(config).build();

    assertEquals("test-key", options.apiKey());
    assertEquals("my-graph@current", options.graphRef());
    assertEquals("http://localhost:9999/", options.endpointUrl());
    assertEquals(2_500, options.reportIntervalMs());
    assertEquals(3, options.maxAttempts());
    assertEquals(SendValuesPolicy.Kind.EXCEPT, options.sendHeaders().kind());
    assertEquals(Set.of("x-secret"), options.sendHeaders().names());
    assertEquals(SendValuesPolicy.Kind.ALL, options.sendVariableValues().kind());
    assertEquals(SendErrorsPolicy.Kind.UNMODIFIED, options.sendErrors().kind());
    // Unresolved placeholders count as unset.
    assertNull(options.overrideReportedSchema());
  }

  @Test
  void unresolvedCredentialsFailTheBuild() {
    Configuration config = new BaseConfiguration();
    config.setProperty("usageReporting.apiKey", "${env:USAGE_REPORTING_SURELY_UNSET_VARIABLE}");
    config.setProperty("usageReporting.graphRef", "graph@current");

    assertThrows(
        ConfigException.class, () -> UsageReportingOptions.fromConfiguration(config).build());
  }

  @Test
  void rejectsInvalidConfigurationValues() {
    Configuration rate = base();
    rate.setProperty("usageReporting.fieldLevelInstrumentation", "1.5");
    assertThrows(ConfigException.class, () -> UsageReportingOptions.fromConfiguration(rate));

    Configuration bool = base();
    bool.setProperty("usageReporting.sendTraces", "maybe");
    assertThrows(ConfigException.class, () -> UsageReportingOptions.fromConfiguration(bool));

    Configuration errors = base();
    errors.setProperty("usageReporting.sendErrors", "sometimes");
    assertThrows(ConfigException.class, () -> UsageReportingOptions.fromConfiguration(errors));

    Configuration both = base();
    both.setProperty("usageReporting.sendHeaders.exceptNames", List.of("a"));
    both.setProperty("usageReporting.sendHeaders.onlyNames", List.of("b"));
    assertThrows(ConfigException.class, () -> UsageReportingOptions.fromConfiguration(both));
  }

  private static Configuration base() {
    Configuration config = new BaseConfiguration();
    config.setProperty("usageReporting.apiKey", "key");
    config.setProperty("usageReporting.graphRef", "graph@current");
    return config;
  }
}

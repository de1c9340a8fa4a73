package com.gentoro.projectkit.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import java.io.StringReader;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingServiceTest {

  @Test
  void appliesLevelsOfDottedLoggerNames() throws Exception {
    YAMLConfiguration config = new YAMLConfiguration();
    config.read(
        new StringReader(
            "logging:\n"
                + "  level:\n"
                + "    com.gentoro.projectkit.testonly: ERROR\n"
                + "    com.gentoro.projectkit.testother: bogus\n"));

    LoggingService.applyConfiguration(config);

    Logger configured = (Logger) LoggerFactory.getLogger("com.gentoro.projectkit.testonly");
    Logger invalid = (Logger) LoggerFactory.getLogger("com.gentoro.projectkit.testother");
    assertEquals(Level.ERROR, configured.getLevel());
    assertNull(invalid.getLevel());
  }

  @Test
  void nullConfigurationIsIgnored() {
    assertDoesNotThrow(() -> LoggingService.applyConfiguration(null));
  }
}

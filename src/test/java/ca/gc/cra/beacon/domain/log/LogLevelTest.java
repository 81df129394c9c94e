package ca.gc.cra.beacon.domain.log;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class LogLevelTest {

  @Test
  void levelsAreOrderedBySeverity() {
    assertEquals(
        List.of(LogLevel.DEBUG, LogLevel.INFO, LogLevel.NOTICE, LogLevel.WARN, LogLevel.ERROR, LogLevel.CRITICAL),
        Arrays.asList(LogLevel.values()));
    assertTrue(LogLevel.WARN.compareTo(LogLevel.NOTICE) > 0);
  }

  @Test
  void statusAndDisplayNames() {
    assertEquals("critical", LogLevel.CRITICAL.statusName());
    assertEquals("CRITICAL", LogLevel.CRITICAL.displayName());
    assertEquals("notice", LogLevel.NOTICE.statusName());
  }

  @Test
  void fromStringIsCaseInsensitive() {
    assertEquals(LogLevel.WARN, LogLevel.fromString(" Warn "));
  }

  @Test
  void fromStringRejectsUnknownAndBlank() {
    assertThrows(IllegalArgumentException.class, () -> LogLevel.fromString("verbose"));
    assertThrows(IllegalArgumentException.class, () -> LogLevel.fromString(" "));
  }
}

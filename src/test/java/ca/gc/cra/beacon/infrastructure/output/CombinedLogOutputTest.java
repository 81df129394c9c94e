package ca.gc.cra.beacon.infrastructure.output;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.beacon.application.port.LogOutput;
import ca.gc.cra.beacon.domain.log.LogAttributes;
import ca.gc.cra.beacon.domain.log.LogLevel;
import ca.gc.cra.beacon.testutil.RecordingLogOutput;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CombinedLogOutputTest {

  @Test
  void writeForwardsToEveryOutputInOrder() {
    List<String> order = new ArrayList<>();
    RecordingLogOutput first = new RecordingLogOutput();
    RecordingLogOutput second = new RecordingLogOutput();
    LogOutput tracking1 = (level, message, date, attributes, tags) -> {
      order.add("first");
      first.writeLogWith(level, message, date, attributes, tags);
    };
    LogOutput tracking2 = (level, message, date, attributes, tags) -> {
      order.add("second");
      second.writeLogWith(level, message, date, attributes, tags);
    };
    CombinedLogOutput combined = new CombinedLogOutput(List.of(tracking1, tracking2));

    combined.writeLogWith(LogLevel.NOTICE, "fan out", Instant.EPOCH, LogAttributes.EMPTY, Set.of("t"));

    assertEquals(List.of("first", "second"), order);
    assertEquals("fan out", first.last().message());
    assertEquals(Set.of("t"), second.last().tags());
  }

  @Test
  void failingOutputDoesNotStopLaterOutputs() {
    RecordingLogOutput after = new RecordingLogOutput();
    LogOutput failing = (level, message, date, attributes, tags) -> {
      throw new IllegalStateException("disk full");
    };
    CombinedLogOutput combined = new CombinedLogOutput(List.of(failing, after));

    assertDoesNotThrow(() ->
        combined.writeLogWith(LogLevel.ERROR, "still delivered", Instant.EPOCH, LogAttributes.EMPTY, Set.of()));

    assertEquals(1, after.writes().size());
    assertEquals("still delivered", after.last().message());
  }

  @Test
  void outputsAreCopied() {
    List<LogOutput> outputs = new ArrayList<>(List.of(LogOutput.NO_OP));
    CombinedLogOutput combined = new CombinedLogOutput(outputs);
    outputs.add(new RecordingLogOutput());

    assertEquals(1, combined.outputs().size());
    assertThrows(UnsupportedOperationException.class, () -> combined.outputs().add(LogOutput.NO_OP));
  }
}

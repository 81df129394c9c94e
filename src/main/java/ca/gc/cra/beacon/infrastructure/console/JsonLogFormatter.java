package ca.gc.cra.beacon.infrastructure.console;

import ca.gc.cra.beacon.domain.log.Log;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import java.io.IOException;
import java.io.StringWriter;

/**
 * Formats logs as pretty-printed JSON, optionally preceded by a literal prefix.
 *
 * <p>The prefix is plain text in front of the document; with a non-empty prefix the output as a whole is
 * not valid JSON. Encoding failures never propagate: the failure's {@code toString()} is returned in place
 * of the payload.</p>
 *
 * @since 0.1.0
 */
public final class JsonLogFormatter implements ConsoleLogFormatter {
  private final JsonFactory jsonFactory = new JsonFactory();
  private final LogJsonEncoder encoder = new LogJsonEncoder();
  private final String prefix;

  /**
   * Creates a formatter without prefix.
   */
  public JsonLogFormatter() {
    this("");
  }

  /**
   * Creates a formatter.
   *
   * @param prefix literal prefix; {@code null} treated as empty
   */
  public JsonLogFormatter(String prefix) {
    this.prefix = prefix == null ? "" : prefix;
  }

  @Override
  public String format(Log log) {
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.setPrettyPrinter(new DefaultPrettyPrinter());
      encoder.write(log, gen);
    } catch (IOException | RuntimeException ex) {
      return ex.toString();
    }
    return prefix + out;
  }
}

package ca.gc.cra.beacon.infrastructure.console;

import ca.gc.cra.beacon.domain.log.Log;
import ca.gc.cra.beacon.domain.log.UserInfo;
import com.fasterxml.jackson.core.JsonGenerationException;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * <strong>What:</strong> Writes a {@link Log} as one JSON object in the canonical log wire shape.
 * <p><strong>Why:</strong> Keeps field naming and ordering in one place so every JSON rendering of the same
 * record is byte-identical.</p>
 * <p><strong>Wire shape:</strong> {@code date}, {@code status}, {@code message}, {@code service},
 * {@code logger.name}, {@code logger.version}, {@code logger.thread_name}, {@code version}, optional
 * {@code usr.*}, optional {@code ddtags}, then user and internal attributes at the root sorted by key.
 * Attributes named like a reserved field are not written.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class LogJsonEncoder {
  static final DateTimeFormatter DATE_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", Locale.ROOT).withZone(ZoneOffset.UTC);

  static final Set<String> RESERVED_KEYS = Set.of(
      "date",
      "status",
      "message",
      "service",
      "logger.name",
      "logger.version",
      "logger.thread_name",
      "version",
      "usr.id",
      "usr.name",
      "usr.email",
      "ddtags");

  private static final int MAX_DEPTH = 32;

  /**
   * Writes the log as a complete JSON object.
   *
   * @param log record to encode; never {@code null}
   * @param gen target generator; never {@code null}
   * @throws IOException when the generator fails or an attribute value cannot be represented in JSON
   */
  public void write(Log log, JsonGenerator gen) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("date", DATE_FORMAT.format(log.date()));
    gen.writeStringField("status", log.status().statusName());
    gen.writeStringField("message", log.message());
    gen.writeStringField("service", log.serviceName());
    gen.writeStringField("logger.name", log.loggerName());
    gen.writeStringField("logger.version", log.loggerVersion());
    gen.writeStringField("logger.thread_name", log.threadName());
    gen.writeStringField("version", log.applicationVersion());
    writeUserInfo(gen, log.userInfo());
    if (!log.tags().isEmpty()) {
      gen.writeStringField("ddtags", String.join(",", new TreeSet<>(log.tags())));
    }

    Map<String, Object> attributes = new TreeMap<>(log.attributes().userAttributes());
    attributes.putAll(log.attributes().internalAttributes());
    for (Map.Entry<String, Object> entry : attributes.entrySet()) {
      if (RESERVED_KEYS.contains(entry.getKey())) {
        continue;
      }
      gen.writeFieldName(entry.getKey());
      writeValue(gen, entry.getKey(), entry.getValue(), 0);
    }
    gen.writeEndObject();
  }

  private void writeUserInfo(JsonGenerator gen, UserInfo userInfo) throws IOException {
    if (userInfo.id() != null) {
      gen.writeStringField("usr.id", userInfo.id());
    }
    if (userInfo.name() != null) {
      gen.writeStringField("usr.name", userInfo.name());
    }
    if (userInfo.email() != null) {
      gen.writeStringField("usr.email", userInfo.email());
    }
  }

  private void writeValue(JsonGenerator gen, String path, Object value, int depth) throws IOException {
    if (depth > MAX_DEPTH) {
      throw new JsonGenerationException("Attribute '" + path + "' nests deeper than " + MAX_DEPTH, gen);
    }
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof CharSequence text) {
      gen.writeString(text.toString());
    } else if (value instanceof Boolean bool) {
      gen.writeBoolean(bool);
    } else if (value instanceof Number number) {
      writeNumber(gen, path, number);
    } else if (value instanceof Instant instant) {
      gen.writeString(DATE_FORMAT.format(instant));
    } else if (value instanceof Enum<?> constant) {
      gen.writeString(constant.name());
    } else if (value instanceof Map<?, ?> map) {
      writeMap(gen, path, map, depth);
    } else if (value instanceof Iterable<?> iterable) {
      gen.writeStartArray();
      int index = 0;
      for (Object element : iterable) {
        writeValue(gen, path + '[' + index++ + ']', element, depth + 1);
      }
      gen.writeEndArray();
    } else if (value.getClass().isArray()) {
      gen.writeStartArray();
      int length = Array.getLength(value);
      for (int i = 0; i < length; i++) {
        writeValue(gen, path + '[' + i + ']', Array.get(value, i), depth + 1);
      }
      gen.writeEndArray();
    } else {
      throw unsupported(gen, path, value);
    }
  }

  private void writeNumber(JsonGenerator gen, String path, Number number) throws IOException {
    if (number instanceof Integer || number instanceof Short || number instanceof Byte) {
      gen.writeNumber(number.intValue());
    } else if (number instanceof Long value) {
      gen.writeNumber(value);
    } else if (number instanceof BigInteger value) {
      gen.writeNumber(value);
    } else if (number instanceof BigDecimal value) {
      gen.writeNumber(value);
    } else if (number instanceof Double || number instanceof Float) {
      double value = number.doubleValue();
      if (Double.isNaN(value) || Double.isInfinite(value)) {
        throw new JsonGenerationException(
            "Attribute '" + path + "' is not a finite number: " + number, gen);
      }
      if (number instanceof Float floatValue) {
        gen.writeNumber(floatValue);
      } else {
        gen.writeNumber(value);
      }
    } else {
      throw unsupported(gen, path, number);
    }
  }

  private void writeMap(JsonGenerator gen, String path, Map<?, ?> map, int depth) throws IOException {
    Map<String, Object> sorted = new TreeMap<>();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new JsonGenerationException("Attribute '" + path + "' contains a non-string key", gen);
      }
      sorted.put(key, entry.getValue());
    }
    gen.writeStartObject();
    for (Map.Entry<String, Object> entry : sorted.entrySet()) {
      gen.writeFieldName(entry.getKey());
      writeValue(gen, path + '.' + entry.getKey(), entry.getValue(), depth + 1);
    }
    gen.writeEndObject();
  }

  private static JsonGenerationException unsupported(JsonGenerator gen, String path, Object value) {
    return new JsonGenerationException(
        "Attribute '" + path + "' has unsupported type " + value.getClass().getName(), gen);
  }
}

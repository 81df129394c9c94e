package ca.gc.cra.beacon.infrastructure.console;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.domain.log.Log;
import ca.gc.cra.beacon.domain.log.LogAttributes;
import ca.gc.cra.beacon.domain.log.LogLevel;
import ca.gc.cra.beacon.domain.log.UserInfo;
import ca.gc.cra.beacon.testutil.JsonDocuments;
import ca.gc.cra.beacon.testutil.LogFixtures;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class JsonLogFormatterTest {

  @Test
  void formatProducesJsonWithAllLogFields() {
    JsonLogFormatter formatter = new JsonLogFormatter();
    Log log = LogFixtures.log(
        LogLevel.ERROR,
        "payment declined",
        LogAttributes.of(Map.of("order.id", "o-17", "amount", 12)),
        Set.of("team:payments", "env:staging"));

    Map<String, Object> json = JsonDocuments.parseObject(formatter.format(log));

    assertEquals("1970-01-01T00:00:12.345Z", json.get("date"));
    assertEquals("error", json.get("status"));
    assertEquals("payment declined", json.get("message"));
    assertEquals("checkout-service", json.get("service"));
    assertEquals("checkout", json.get("logger.name"));
    assertEquals("0.1.0", json.get("logger.version"));
    assertEquals("main", json.get("logger.thread_name"));
    assertEquals("2.4.1", json.get("version"));
    assertEquals("env:staging,team:payments", json.get("ddtags"));
    assertEquals("o-17", json.get("order.id"));
    assertEquals(12, ((Number) json.get("amount")).intValue());
  }

  @Test
  void formatWritesFieldsInStableOrder() {
    JsonLogFormatter formatter = new JsonLogFormatter();
    Log log = LogFixtures.log(
        LogLevel.INFO, "ordered", LogAttributes.of(Map.of("zeta", 1, "alpha", 2)), Set.of("a"));

    List<String> keys = List.copyOf(JsonDocuments.parseObject(formatter.format(log)).keySet());

    assertEquals(List.of(
        "date", "status", "message", "service", "logger.name", "logger.version",
        "logger.thread_name", "version", "ddtags", "alpha", "zeta"), keys);
  }

  @Test
  void formatIsPrettyPrinted() {
    String text = new JsonLogFormatter().format(LogFixtures.log(LogLevel.INFO, "pretty"));

    assertTrue(text.startsWith("{"));
    assertTrue(text.contains("\n"));
    assertTrue(text.contains("\"message\" : \"pretty\""));
  }

  @Test
  void prefixIsPrependedOutsideTheDocument() {
    Log log = LogFixtures.log(LogLevel.NOTICE, "prefixed");
    String plain = new JsonLogFormatter().format(log);

    String prefixed = new JsonLogFormatter("[beacon] ").format(log);

    assertEquals("[beacon] " + plain, prefixed);
    Map<String, Object> json = JsonDocuments.parseObject(prefixed.substring("[beacon] ".length()));
    assertEquals("prefixed", json.get("message"));
    assertEquals("notice", json.get("status"));
    assertThrows(IllegalArgumentException.class, () -> JsonDocuments.parseObject(prefixed));
  }

  @Test
  void unsupportedAttributeValueReturnsErrorDescription() {
    JsonLogFormatter formatter = new JsonLogFormatter("prefix: ");
    Log log = LogFixtures.log(LogLevel.WARN, "bad attribute", Map.of("handle", new Object()));

    String text = assertDoesNotThrow(() -> formatter.format(log));

    assertTrue(text.contains("JsonGenerationException"), text);
    assertTrue(text.contains("handle"), text);
    assertFalse(text.startsWith("prefix: "));
  }

  @Test
  void nonFiniteNumberReturnsErrorDescription() {
    Log log = LogFixtures.log(LogLevel.INFO, "nan", Map.of("ratio", Double.NaN));

    String text = new JsonLogFormatter().format(log);

    assertTrue(text.contains("not a finite number"), text);
  }

  @Test
  void selfReferencingAttributeReturnsErrorDescription() {
    Map<String, Object> loop = new HashMap<>();
    loop.put("self", loop);
    Log log = LogFixtures.log(LogLevel.INFO, "loop", Map.of("loop", loop));

    String text = assertDoesNotThrow(() -> new JsonLogFormatter().format(log));

    assertTrue(text.contains("nests deeper"), text);
  }

  @Test
  void nestedStructuresAreEncoded() {
    Map<String, Object> nested = new LinkedHashMap<>();
    nested.put("b", List.of(1, "two", true));
    nested.put("a", new int[] {3, 4});
    Map<String, Object> attributes = new HashMap<>();
    attributes.put("nested", nested);
    attributes.put("when", Instant.parse("2024-01-01T00:00:00Z"));
    attributes.put("level", LogLevel.WARN);
    attributes.put("price", new BigDecimal("9.99"));
    attributes.put("missing", null);

    Map<String, Object> json = JsonDocuments.parseObject(
        new JsonLogFormatter().format(LogFixtures.log(LogLevel.INFO, "nested", attributes)));

    @SuppressWarnings("unchecked")
    Map<String, Object> nestedJson = (Map<String, Object>) json.get("nested");
    assertEquals(List.of("a", "b"), List.copyOf(nestedJson.keySet()));
    assertEquals(List.of(1, "two", true), nestedJson.get("b"));
    assertEquals("2024-01-01T00:00:00.000Z", json.get("when"));
    assertEquals("WARN", json.get("level"));
    assertEquals(0, new BigDecimal("9.99").compareTo(new BigDecimal(json.get("price").toString())));
    assertTrue(json.containsKey("missing"));
    assertNull(json.get("missing"));
  }

  @Test
  void userInfoIsWrittenWhenPresent() {
    Log log = new Log(
        LogFixtures.DATE, LogLevel.INFO, "user", "svc", null, "logger", "0.1.0", "main", "1.0",
        new UserInfo("u-1", "Ada", null), LogAttributes.EMPTY, Set.of());

    Map<String, Object> json = JsonDocuments.parseObject(new JsonLogFormatter().format(log));

    assertEquals("u-1", json.get("usr.id"));
    assertEquals("Ada", json.get("usr.name"));
    assertFalse(json.containsKey("usr.email"));
    assertFalse(json.containsKey("ddtags"));
  }

  @Test
  void internalAttributesWinAndReservedKeysAreSkipped() {
    Map<String, Object> user = new HashMap<>();
    user.put("error.kind", "user-supplied");
    user.put("message", "shadow");
    LogAttributes attributes = new LogAttributes(user, Map.of("error.kind", "java.io.IOException"));

    Map<String, Object> json = JsonDocuments.parseObject(
        new JsonLogFormatter().format(LogFixtures.log(LogLevel.ERROR, "real", attributes, Set.of())));

    assertEquals("java.io.IOException", json.get("error.kind"));
    assertEquals("real", json.get("message"));
  }

  @Test
  void formatIsIdempotent() {
    JsonLogFormatter formatter = new JsonLogFormatter();
    Log log = LogFixtures.log(
        LogLevel.CRITICAL, "same", LogAttributes.of(Map.of("k1", "v1", "k2", List.of(1, 2))), Set.of("x", "y"));

    assertEquals(formatter.format(log), formatter.format(log));
  }
}

package com.scout.pipeline.transform.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scout.pipeline.crawl.service.PermanentProcessingException;
import com.scout.pipeline.transform.model.NaturalKey;
import com.scout.pipeline.transform.model.RawEvent;
import com.scout.pipeline.transform.model.SilverRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;

/**
 * Derives silver-layer identity and attributes from a raw event. Each attribute is resolved from an
 * ordered list of candidate fields; the first usable value wins.
 */
@Component
public class NaturalKeyExtractor {
  static final String KEY_SOURCE_TXN_COLUMN = "txn_id_column";
  static final String KEY_SOURCE_DERIVED = "derived_uuid";
  static final String UNKNOWN_STORE = "unknown";

  private static final List<String> KEY_FIELDS = List.of("transaction_id", "txn_id", "id");
  private static final List<String> LANDING_TXN_FIELDS = List.of("transaction_id", "txn_id", "transactionId");
  private static final List<String> TIME_FIELDS = List.of("timestamp", "ts", "transaction_timestamp", "created_at");
  private static final List<String> STORE_FIELDS = List.of("store_id", "device_id");
  private static final List<String> AMOUNT_FIELDS = List.of("amount", "peso_value", "total_amount");
  private static final List<Function<String, Instant>> TIME_PARSERS = List.of(
      raw -> OffsetDateTime.parse(raw).toInstant(),
      raw -> LocalDateTime.parse(raw.replace(' ', 'T')).toInstant(ZoneOffset.UTC),
      raw -> LocalDate.parse(raw).atStartOfDay().toInstant(ZoneOffset.UTC)
  );

  private final ObjectMapper objectMapper;

  public NaturalKeyExtractor(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public SilverRecord toSilver(RawEvent event, Instant loadedAt) {
    JsonNode payload = parse(event);
    NaturalKey key = naturalKey(event, payload);
    return new SilverRecord(
        key.value(),
        key.source(),
        event.sourceFile(),
        event.eventId(),
        eventTime(event, payload),
        storeKey(payload),
        amount(payload),
        event.payload(),
        loadedAt,
        loadedAt
    );
  }

  NaturalKey naturalKey(RawEvent event, JsonNode payload) {
    if (!isBlank(event.txnId())) {
      return new NaturalKey(event.txnId().trim(), KEY_SOURCE_TXN_COLUMN);
    }
    for (String field : KEY_FIELDS) {
      String value = text(payload.get(field));
      if (value != null) {
        return new NaturalKey(value, field);
      }
    }
    UUID derived = UUID.nameUUIDFromBytes(event.objectKey().getBytes(StandardCharsets.UTF_8));
    return new NaturalKey(derived.toString(), KEY_SOURCE_DERIVED);
  }

  Instant eventTime(RawEvent event, JsonNode payload) {
    for (String field : TIME_FIELDS) {
      Instant parsed = parseInstant(payload.get(field));
      if (parsed != null) {
        return parsed;
      }
    }
    return event.ingestedAt();
  }

  String storeKey(JsonNode payload) {
    for (String field : STORE_FIELDS) {
      String value = text(payload.get(field));
      if (value != null) {
        return value;
      }
    }
    return UNKNOWN_STORE;
  }

  BigDecimal amount(JsonNode payload) {
    for (String field : AMOUNT_FIELDS) {
      BigDecimal value = decimal(payload.get(field));
      if (value != null) {
        return value;
      }
    }
    BigDecimal nested = decimal(payload.path("total").get("amount"));
    return nested == null ? BigDecimal.ZERO.setScale(2) : nested;
  }

  /**
   * Landing-time transaction id, read from the top-level payload only in the same order as the
   * natural key fields, with the camel-case spelling last.
   */
  public String landingTxnId(String payloadJson) {
    try {
      JsonNode node = objectMapper.readTree(payloadJson);
      if (node == null || !node.isObject()) {
        return null;
      }
      for (String field : LANDING_TXN_FIELDS) {
        String value = text(node.get(field));
        if (value != null) {
          return value;
        }
      }
      return null;
    } catch (JsonProcessingException e) {
      return null;
    }
  }

  private JsonNode parse(RawEvent event) {
    try {
      JsonNode node = objectMapper.readTree(event.payload());
      if (node == null || !node.isObject()) {
        throw new PermanentProcessingException("raw event " + event.eventId() + " is not a JSON object");
      }
      return node;
    } catch (JsonProcessingException e) {
      throw new PermanentProcessingException("raw event " + event.eventId() + " has malformed JSON", e);
    }
  }

  private static String text(JsonNode node) {
    if (node == null || node.isNull() || node.isContainerNode()) {
      return null;
    }
    String value = node.asText();
    return isBlank(value) ? null : value.trim();
  }

  private static BigDecimal decimal(JsonNode node) {
    if (node == null || node.isNull() || node.isContainerNode()) {
      return null;
    }
    try {
      BigDecimal value = node.isNumber() ? node.decimalValue() : new BigDecimal(node.asText().trim());
      return value.setScale(2, RoundingMode.HALF_UP);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static Instant parseInstant(JsonNode node) {
    if (node == null || node.isNull() || node.isContainerNode()) {
      return null;
    }
    if (node.isIntegralNumber()) {
      long value = node.asLong();
      // values below 1e11 are treated as epoch seconds
      return value < 100_000_000_000L ? Instant.ofEpochSecond(value) : Instant.ofEpochMilli(value);
    }
    String raw = node.asText().trim();
    if (raw.isEmpty()) {
      return null;
    }
    for (Function<String, Instant> parser : TIME_PARSERS) {
      try {
        return parser.apply(raw);
      } catch (DateTimeParseException e) {
        continue;
      }
    }
    return null;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}

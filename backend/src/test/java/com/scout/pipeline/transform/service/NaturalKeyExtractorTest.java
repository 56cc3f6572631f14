package com.scout.pipeline.transform.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scout.pipeline.crawl.service.PermanentProcessingException;
import com.scout.pipeline.transform.model.RawEvent;
import com.scout.pipeline.transform.model.SilverRecord;
import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class NaturalKeyExtractorTest {

  private static final Instant INGESTED = Instant.parse("2026-03-02T08:00:00Z");
  private static final Instant LOADED = Instant.parse("2026-03-02T09:00:00Z");

  private final NaturalKeyExtractor extractor = new NaturalKeyExtractor(new ObjectMapper());

  @Test
  void landingTxnIdTakesPrecedence() {
    SilverRecord record =
        extractor.toSilver(event("t-landing", "{\"transaction_id\": \"t-payload\"}"), LOADED);

    assertThat(record.naturalKey()).isEqualTo("t-landing");
    assertThat(record.keySource()).isEqualTo(NaturalKeyExtractor.KEY_SOURCE_TXN_COLUMN);
    assertThat(record.loadedAt()).isEqualTo(LOADED);
  }

  @Test
  void payloadKeyFieldsAreTriedInOrder() {
    SilverRecord byTransactionId =
        extractor.toSilver(event(null, "{\"id\": \"x\", \"transaction_id\": \"t-1\"}"), LOADED);
    SilverRecord byId = extractor.toSilver(event(null, "{\"id\": 42}"), LOADED);

    assertThat(byTransactionId.naturalKey()).isEqualTo("t-1");
    assertThat(byTransactionId.keySource()).isEqualTo("transaction_id");
    assertThat(byId.naturalKey()).isEqualTo("42");
  }

  @Test
  void keylessPayloadGetsStableDerivedKey() {
    SilverRecord first = extractor.toSilver(event(null, "{\"amount\": 1}"), LOADED);
    SilverRecord second = extractor.toSilver(event(null, "{\"amount\": 2}"), LOADED);

    assertThat(first.keySource()).isEqualTo(NaturalKeyExtractor.KEY_SOURCE_DERIVED);
    assertThat(first.naturalKey()).isEqualTo(second.naturalKey()).hasSize(36);
  }

  @Test
  void eventTimeAcceptsCommonShapes() {
    assertThat(timeOf("{\"timestamp\": \"2026-03-01T10:15:30+08:00\"}"))
        .isEqualTo(Instant.parse("2026-03-01T02:15:30Z"));
    assertThat(timeOf("{\"ts\": \"2026-03-01 10:15:30\"}"))
        .isEqualTo(Instant.parse("2026-03-01T10:15:30Z"));
    assertThat(timeOf("{\"created_at\": \"2026-03-01\"}"))
        .isEqualTo(Instant.parse("2026-03-01T00:00:00Z"));
    assertThat(timeOf("{\"ts\": 1772360130}")).isEqualTo(Instant.ofEpochSecond(1772360130L));
    assertThat(timeOf("{\"ts\": 1772360130123}")).isEqualTo(Instant.ofEpochMilli(1772360130123L));
    assertThat(timeOf("{\"ts\": \"yesterday\"}")).isEqualTo(INGESTED);
  }

  @Test
  void storeAndAmountFallBack() {
    SilverRecord nested =
        extractor.toSilver(event("t", "{\"device_id\": \"pos-7\", \"total\": {\"amount\": \"19.999\"}}"), LOADED);
    SilverRecord bare = extractor.toSilver(event("t", "{}"), LOADED);

    assertThat(nested.storeKey()).isEqualTo("pos-7");
    assertThat(nested.amount()).isEqualByComparingTo(new BigDecimal("20.00"));
    assertThat(bare.storeKey()).isEqualTo(NaturalKeyExtractor.UNKNOWN_STORE);
    assertThat(bare.amount()).isEqualByComparingTo(BigDecimal.ZERO);
  }

  @Test
  void nonObjectPayloadIsPermanent() {
    assertThatThrownBy(() -> extractor.toSilver(event(null, "[1, 2]"), LOADED))
        .isInstanceOf(PermanentProcessingException.class);
    assertThatThrownBy(() -> extractor.toSilver(event(null, "{oops"), LOADED))
        .isInstanceOf(PermanentProcessingException.class);
  }

  @Test
  void landingTxnIdReadsTopLevelOnly() {
    assertThat(extractor.landingTxnId("{\"txn_id\": \"a\"}")).isEqualTo("a");
    assertThat(extractor.landingTxnId("{\"transactionId\": \"b\"}")).isEqualTo("b");
    assertThat(extractor.landingTxnId("{\"inner\": {\"txn_id\": \"c\"}}")).isNull();
    assertThat(extractor.landingTxnId("not json")).isNull();
  }

  @Test
  void landedTransactionIdWinsOverTxnIdWhenBothArePresent() {
    String payload = "{\"transaction_id\": \"T-A\", \"txn_id\": \"T-B\"}";

    String landed = extractor.landingTxnId(payload);
    SilverRecord record = extractor.toSilver(event(landed, payload), LOADED);

    assertThat(landed).isEqualTo("T-A");
    assertThat(record.naturalKey()).isEqualTo("T-A");
  }

  private Instant timeOf(String payload) {
    return extractor.toSilver(event("t", payload), LOADED).eventTime();
  }

  private static RawEvent event(String txnId, String payload) {
    return new RawEvent(1L, "bucket/file.json::row-0", "bucket/file.json", "row-0", txnId, payload, INGESTED);
  }
}

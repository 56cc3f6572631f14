package com.scout.pipeline.ingest.model;

public record HandlerResult(
    int recordsProcessed,
    int recordsFailed,
    String errorDetail
) {
    public HandlerResult plus(HandlerResult other) {
        String detail = errorDetail;
        if (other.errorDetail() != null) {
            detail = detail == null ? other.errorDetail() : detail + "; " + other.errorDetail();
        }
        return new HandlerResult(recordsProcessed + other.recordsProcessed(), recordsFailed + other.recordsFailed(), detail);
    }
}

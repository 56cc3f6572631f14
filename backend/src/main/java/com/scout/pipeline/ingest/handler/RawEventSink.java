package com.scout.pipeline.ingest.handler;

/**
 * Landing target for parsed entries. Returns true when the entry was new, false when the same
 * (sourceFile, entryName) had already landed.
 */
@FunctionalInterface
public interface RawEventSink {
    boolean land(String sourceFile, String entryName, String payloadJson);
}

package com.scout.pipeline.transform.service;

import com.scout.pipeline.ingest.handler.RawEventSink;
import com.scout.pipeline.transform.persistence.BronzeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Lands parsed file entries into the bronze layer as-is.
 */
@Service
public class BronzeLandingService implements RawEventSink {
    private static final Logger log = LoggerFactory.getLogger(BronzeLandingService.class);

    private final BronzeRepository bronzeRepository;
    private final NaturalKeyExtractor keyExtractor;
    private final Clock clock;

    public BronzeLandingService(BronzeRepository bronzeRepository, NaturalKeyExtractor keyExtractor, Clock clock) {
        this.bronzeRepository = bronzeRepository;
        this.keyExtractor = keyExtractor;
        this.clock = clock;
    }

    @Override
    public boolean land(String sourceFile, String entryName, String payloadJson) {
        boolean landed = bronzeRepository.land(
            sourceFile,
            entryName,
            keyExtractor.landingTxnId(payloadJson),
            payloadJson,
            clock.instant()
        );
        if (!landed) {
            log.debug("Entry {} of {} already landed", entryName, sourceFile);
        }
        return landed;
    }
}

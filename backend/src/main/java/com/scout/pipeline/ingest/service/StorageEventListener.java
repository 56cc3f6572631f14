package com.scout.pipeline.ingest.service;

import com.scout.pipeline.ingest.model.ObjectCreatedEvent;
import com.scout.pipeline.ingest.model.SubmitResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Consumes object-created notifications so that a write to a watched prefix implies an enqueue.
 */
@Component
public class StorageEventListener {
    private static final Logger log = LoggerFactory.getLogger(StorageEventListener.class);

    private final FileIntakeService intakeService;

    public StorageEventListener(FileIntakeService intakeService) {
        this.intakeService = intakeService;
    }

    @EventListener
    public void onObjectCreated(ObjectCreatedEvent event) {
        try {
            SubmitResult result = intakeService.onObjectCreated(event);
            log.debug("Object {}/{} intake outcome {}", event.bucket(), event.path(), result.outcome());
        } catch (Exception e) {
            log.warn("Intake failed for object {}/{}", event.bucket(), event.path(), e);
        }
    }
}

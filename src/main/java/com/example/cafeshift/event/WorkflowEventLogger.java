package com.example.cafeshift.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Records committed workflow events. Notification transports subscribe to the same events.
 */
@Component
public class WorkflowEventLogger {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowEventLogger.class);

    @TransactionalEventListener(fallbackExecution = true)
    public void onEvent(WorkflowEvent event) {
        logger.info("Workflow event {} for {}: {}", event.kind(), event.recipients(), event);
    }
}

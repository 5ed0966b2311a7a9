package com.confluencesentinel.monitor;

import com.confluencesentinel.core.alert.AlertPayload;
import com.confluencesentinel.core.alert.AlertSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AlertSink} that writes every alert to the log.
 *
 * <p>
 * Default sink when no broker is configured.
 * </p>
 */
public class LoggingAlertSink implements AlertSink {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingAlertSink.class);

    private long delivered;

    @Override
    public synchronized void deliver(AlertPayload payload) {
        delivered++;
        LOG.info("{}\n{}", payload.getTitle(), payload.getMessage());
    }

    public synchronized long getDeliveredCount() {
        return delivered;
    }
}

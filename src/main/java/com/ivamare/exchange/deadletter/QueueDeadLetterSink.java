package com.ivamare.exchange.deadletter;

import com.ivamare.exchange.transport.QueueClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Dead-letter sink writing to a fixed queue, created on first use.
 */
public class QueueDeadLetterSink implements DeadLetterSink {

    private static final Logger log = LoggerFactory.getLogger(QueueDeadLetterSink.class);

    private final QueueClient queueClient;
    private final String queueName;
    private final AtomicBoolean queueReady = new AtomicBoolean(false);

    public QueueDeadLetterSink(QueueClient queueClient, String queueName) {
        this.queueClient = queueClient;
        this.queueName = queueName;
    }

    @Override
    public void send(String envelope) {
        if (!queueReady.get()) {
            queueClient.ensureExists(queueName);
            queueReady.set(true);
        }
        String messageId = queueClient.send(queueName, envelope, null);
        log.debug("Dead-letter envelope stored in {} as {}", queueName, messageId);
    }

    public String getQueueName() {
        return queueName;
    }
}

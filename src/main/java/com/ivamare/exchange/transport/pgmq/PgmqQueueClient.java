package com.ivamare.exchange.transport.pgmq;

import com.ivamare.exchange.exception.TransportExceptionClassifier;
import com.ivamare.exchange.transport.DestinationNotFoundException;
import com.ivamare.exchange.transport.QueueClient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Queue transport backed by PostgreSQL PGMQ.
 *
 * <p>Queue names may contain hyphens; they are mapped to PGMQ identifiers by
 * replacing every character outside {@code [a-zA-Z0-9_]} with an underscore.
 * The message lifetime travels in the PGMQ message headers as
 * {@code x-expires-at} for consumers to honour. After each send a
 * {@code NOTIFY pgmq_notify_<queue>} wakes up listening consumers.
 */
public class PgmqQueueClient implements QueueClient {

    private static final Logger log = LoggerFactory.getLogger(PgmqQueueClient.class);

    static final String EXPIRES_AT_HEADER = "x-expires-at";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public PgmqQueueClient(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this(jdbcTemplate, objectMapper, Clock.systemUTC());
    }

    public PgmqQueueClient(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public String send(String destination, String body, Integer timeToLiveSeconds) {
        String queueName = escapeIdentifier(destination);
        String headers = toJson(headers(timeToLiveSeconds));

        Long msgId;
        try {
            msgId = jdbcTemplate.queryForObject(
                "SELECT pgmq.send(?, ?::jsonb, ?::jsonb, ?)",
                Long.class,
                queueName, body, headers, 0
            );
        } catch (DataAccessException e) {
            if (TransportExceptionClassifier.isMissingDestination(e)) {
                throw new DestinationNotFoundException(destination, e);
            }
            throw e;
        }

        if (msgId == null) {
            throw new IllegalStateException("Failed to send message to queue " + destination);
        }

        jdbcTemplate.execute("NOTIFY " + escapeIdentifier(notifyChannel(queueName)));

        log.debug("Sent message to {}: msgId={}", destination, msgId);
        return String.valueOf(msgId);
    }

    @Override
    public void ensureExists(String destination) {
        jdbcTemplate.execute("SELECT pgmq.create('" + escapeIdentifier(destination) + "')");
        log.debug("Ensured queue exists: {}", destination);
    }

    private Map<String, Object> headers(Integer timeToLiveSeconds) {
        Map<String, Object> headers = new LinkedHashMap<>();
        if (timeToLiveSeconds != null && timeToLiveSeconds > 0) {
            Instant expiresAt = clock.instant().plusSeconds(timeToLiveSeconds);
            headers.put(EXPIRES_AT_HEADER, expiresAt.toString());
        }
        return headers;
    }

    static String notifyChannel(String queueName) {
        return "pgmq_notify_" + queueName;
    }

    static String escapeIdentifier(String identifier) {
        return identifier.replaceAll("[^a-zA-Z0-9_]", "_");
    }

    private String toJson(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize headers", e);
        }
    }
}

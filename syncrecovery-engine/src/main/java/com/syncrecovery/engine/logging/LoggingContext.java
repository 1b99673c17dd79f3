package com.syncrecovery.engine.logging;

import org.slf4j.MDC;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Scoped MDC entries for recovery attempts, replay runs and replayed events.
 * Closing the scope puts back whatever the keys held before it was opened,
 * so pooled threads never carry ids from one task into the next.
 *
 * <pre>
 * try (var ctx = LoggingContext.forOperation(operationId, "NETWORK_ERROR")) {
 *     log.info("Attempting recovery"); // carries operationId, failureType, traceId
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String OPERATION_ID = "operationId";
    public static final String FAILURE_TYPE = "failureType";
    public static final String REPLAY_SESSION_ID = "replaySessionId";
    public static final String EVENT_ID = "eventId";
    public static final String CORRELATION_ID = "correlationId";
    public static final String TRACE_ID = "traceId";

    // Values the keys held before this scope; null means absent
    private final Map<String, String> previous = new HashMap<>();

    private LoggingContext() {
    }

    public static LoggingContext forOperation(String operationId, String failureType) {
        return new LoggingContext()
            .put(OPERATION_ID, operationId)
            .put(FAILURE_TYPE, failureType)
            .withTraceId();
    }

    public static LoggingContext forReplaySession(String sessionId) {
        return new LoggingContext()
            .put(REPLAY_SESSION_ID, sessionId)
            .withTraceId();
    }

    /**
     * Scope for one replayed event, usually nested in a replay session scope.
     */
    public static LoggingContext forEvent(String eventId, String correlationId) {
        return new LoggingContext()
            .put(EVENT_ID, eventId)
            .put(CORRELATION_ID, correlationId)
            .withTraceId();
    }

    private LoggingContext put(String key, String value) {
        if (value != null) {
            previous.putIfAbsent(key, MDC.get(key));
            MDC.put(key, value);
        }
        return this;
    }

    private LoggingContext withTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
        return this;
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
    }
}

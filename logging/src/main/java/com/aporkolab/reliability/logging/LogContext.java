package com.aporkolab.reliability.logging;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;

import org.slf4j.MDC;

/**
 * Scoped diagnostic fields for SLF4J logging via MDC (Mapped Diagnostic Context).
 * 
 * A context plays the role of a "child logger": every log statement issued
 * while it is open carries its fixed fields (component, queue, correlation ID).
 * Closing it restores whatever was in the MDC before.
 * 
 * Usage:
 * <pre>
 * try (LogContext ctx = LogContext.continueOrCreate(correlationId).withQueue("orders.created")) {
 *     log.info("Processing message"); // Logs include correlationId and queue
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String CORRELATION_ID_KEY = "correlationId";
    public static final String COMPONENT_KEY = "component";
    public static final String QUEUE_KEY = "queue";
    public static final String SERVICE_NAME_KEY = "service";
    public static final String DELIVERY_TAG_KEY = "deliveryTag";

    private final Map<String, String> previousContext;

    private LogContext(Map<String, String> previousContext) {
        this.previousContext = previousContext;
    }

    /**
     * Opens a scope that keeps the current fields and restores them on close.
     */
    public static LogContext open() {
        return new LogContext(MDC.getCopyOfContextMap());
    }

    /**
     * Opens a scope bound to the given component name.
     */
    public static LogContext forComponent(String component) {
        return open().with(COMPONENT_KEY, component);
    }

    /**
     * Opens a scope with a freshly generated correlation ID.
     */
    public static LogContext create() {
        return create(generateId());
    }

    public static LogContext create(String correlationId) {
        LogContext context = open();
        MDC.put(CORRELATION_ID_KEY, correlationId);
        return context;
    }

    /**
     * Continues an existing correlation or starts a new one when absent.
     */
    public static LogContext continueOrCreate(String correlationId) {
        if (correlationId == null || correlationId.isBlank()) {
            return create();
        }
        return create(correlationId);
    }

    public static String getCurrentCorrelationId() {
        return MDC.get(CORRELATION_ID_KEY);
    }

    public LogContext with(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
        return this;
    }

    public LogContext withComponent(String component) {
        return with(COMPONENT_KEY, component);
    }

    public LogContext withQueue(String queue) {
        return with(QUEUE_KEY, queue);
    }

    public LogContext withService(String serviceName) {
        return with(SERVICE_NAME_KEY, serviceName);
    }

    public LogContext withDeliveryTag(long deliveryTag) {
        return with(DELIVERY_TAG_KEY, String.valueOf(deliveryTag));
    }

    /**
     * Wraps a Runnable so it runs with the caller's fields on another thread.
     */
    public static Runnable wrap(Runnable runnable) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            try {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                runnable.run();
            } finally {
                restore(previous);
            }
        };
    }

    public static <T> Callable<T> wrap(Callable<T> callable) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            try {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                return callable.call();
            } finally {
                restore(previous);
            }
        };
    }

    @Override
    public void close() {
        restore(previousContext);
    }

    private static void restore(Map<String, String> previous) {
        if (previous != null) {
            MDC.setContextMap(previous);
        } else {
            MDC.clear();
        }
    }

    private static String generateId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}

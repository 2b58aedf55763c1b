package com.meltwater.syncrabbit.util;

import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Logger class which provides a standardized way of outputting variables and their values.
 *
 * <p>
 * Example usage:
 * <pre>
 * Logger log = new Logger(AmqpConnection.class);
 * log.infoWithParams("Connected to broker.", "host", "localhost", "port", 5672);
 * </pre>
 * Which would output something like this (depending on you slf4j backend configuration):
 * <pre>INFO AmqpConnection: Connected to broker. [ host="localhost", port=5672 ]</pre>
 * </p>
 *
 * <p>Note that variables must have a sane toString() method.</p>
 */
public class Logger {

    private static final List<Class<?>> JAVA_WRAPPER_TYPES = Arrays.asList(
            Boolean.class,
            Byte.class,
            Character.class,
            Double.class,
            Float.class,
            Integer.class,
            Long.class,
            Short.class);

    private final org.slf4j.Logger logger;

    public Logger(Class<?> clazz) {
        this(LoggerFactory.getLogger(clazz));
    }

    protected Logger(org.slf4j.Logger logger) {
        this.logger = logger;
    }

    public String getName() {
        return logger.getName();
    }

    public boolean isTraceEnabled() {
        return logger.isTraceEnabled();
    }

    public void traceWithParams(String message, Object... arguments) {
        if (!logger.isTraceEnabled()) {
            return;
        }
        try {
            logger.trace(buildLogMessage(message, arguments));
        } catch (IllegalArgumentException e) {
            logMessageAssemblyFailure(message, arguments);
        }
    }

    public void debugWithParams(String message, Object... arguments) {
        if (!logger.isDebugEnabled()) {
            return;
        }
        try {
            logger.debug(buildLogMessage(message, arguments));
        } catch (IllegalArgumentException e) {
            logMessageAssemblyFailure(message, arguments);
        }
    }

    public void infoWithParams(String message, Object... arguments) {
        if (!logger.isInfoEnabled()) {
            return;
        }
        try {
            logger.info(buildLogMessage(message, arguments));
        } catch (IllegalArgumentException e) {
            logMessageAssemblyFailure(message, arguments);
        }
    }

    public void warnWithParams(String message, Object... arguments) {
        if (!logger.isWarnEnabled()) {
            return;
        }
        try {
            logger.warn(buildLogMessage(message, arguments));
        } catch (IllegalArgumentException e) {
            logMessageAssemblyFailure(message, arguments);
        }
    }

    public void warnWithParams(String message, Throwable t, Object... arguments) {
        if (!logger.isWarnEnabled()) {
            return;
        }
        try {
            logger.warn(buildLogMessage(message, arguments), t);
        } catch (IllegalArgumentException e) {
            logMessageAssemblyFailure(message, arguments);
            logger.warn(message, t);
        }
    }

    public void errorWithParams(String message, Throwable t, Object... arguments) {
        if (!logger.isErrorEnabled()) {
            return;
        }
        try {
            logger.error(buildLogMessage(message, arguments), t);
        } catch (IllegalArgumentException e) {
            logMessageAssemblyFailure(message, arguments);
            logger.error(message, t);
        }
    }

    private void logMessageAssemblyFailure(String message, Object... arguments) {
        logger.error(
                "Failed to assemble log message for logger {}! Arguments must be declared in pairs! message={}, arguments={}",
                getName(), message, Arrays.toString(arguments));
    }

    protected String buildLogMessage(String message, Object[] arguments) {
        if (arguments.length % 2 != 0) {
            throw new IllegalArgumentException(
                    "Arguments must be declared in pairs: (message, key, value, key2, value2, ...)");
        }
        final StringBuilder sb = new StringBuilder(message);
        if (arguments.length == 0) {
            return sb.toString();
        }
        sb.append(" [ ");
        for (int i = 0; i < arguments.length; i += 2) {
            append(sb, arguments[i], arguments[i + 1]);
            if (i + 2 < arguments.length) {
                sb.append(", ");
            }
        }
        sb.append(" ]");
        return sb.toString();
    }

    private void append(StringBuilder sb, Object key, Object value) {
        sb.append(key);
        sb.append('=');
        if (value instanceof byte[]) {
            sb.append("<").append(((byte[]) value).length).append(" bytes>");
        } else if (value instanceof Map || isPrimitive(value)) {
            sb.append(value);
        } else {
            sb.append('"');
            sb.append(value);
            sb.append('"');
        }
    }

    private boolean isPrimitive(Object o) {
        return o == null || JAVA_WRAPPER_TYPES.contains(o.getClass());
    }
}

package com.meltwater.syncrabbit;

import java.util.Optional;

/**
 * The exchange types an {@link AmqpExchange} can be declared with.
 */
public enum ExchangeType {
    direct,
    fanout,
    topic,
    headers;

    /**
     * @return the type with exactly this (lower case) name, empty for anything else
     */
    public static Optional<ExchangeType> parse(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (ExchangeType type : values()) {
            if (type.name().equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}

package com.raditha.tokenizer.model;

import com.raditha.tokenizer.exception.ConfigurationException;

/**
 * Algorithms available for minting new tokens.
 */
public enum TokenStrategy {
    /**
     * Random UUID tokens, redrawn on the rare collision with an existing token.
     */
    RANDOM_UNIQUE,

    /**
     * Decimal counter tokens: the smallest positive integer not already used.
     * Produces short, readable tokens that look like ordinary numbers.
     */
    SEQUENTIAL_COUNTER;

    /**
     * Convert a string value to a TokenStrategy.
     *
     * @param value the strategy name (case-insensitive)
     * @return the corresponding strategy
     * @throws ConfigurationException if the value names no known strategy
     */
    public static TokenStrategy fromString(String value) {
        if (value == null) {
            throw new ConfigurationException("Token method cannot be null");
        }

        return switch (value.trim().toLowerCase()) {
            case "uuid", "random", "random-unique" -> RANDOM_UNIQUE;
            case "sequential", "sequential-counter" -> SEQUENTIAL_COUNTER;
            default -> throw new ConfigurationException(
                    "Invalid token method: " + value + ". Must be: uuid or sequential");
        };
    }

    /**
     * Get the string representation of this strategy for CLI usage.
     *
     * @return lowercase string representation
     */
    public String toCliString() {
        return switch (this) {
            case RANDOM_UNIQUE -> "uuid";
            case SEQUENTIAL_COUNTER -> "sequential";
        };
    }
}

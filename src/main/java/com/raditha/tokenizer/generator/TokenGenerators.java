package com.raditha.tokenizer.generator;

import com.raditha.tokenizer.model.TokenStrategy;

/**
 * Creates the generator for a strategy.
 */
public final class TokenGenerators {

    private TokenGenerators() {
    }

    /**
     * Returns a new generator; sequential generators hold per-run state and must
     * not be shared between mappings.
     */
    public static TokenGenerator forStrategy(TokenStrategy strategy) {
        return switch (strategy) {
            case RANDOM_UNIQUE -> new RandomTokenGenerator();
            case SEQUENTIAL_COUNTER -> new SequentialTokenGenerator();
        };
    }
}

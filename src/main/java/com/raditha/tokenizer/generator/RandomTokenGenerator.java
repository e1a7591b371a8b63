package com.raditha.tokenizer.generator;

import com.raditha.tokenizer.mapping.TokenMapping;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Issues random UUID tokens. A draw that collides with an existing token is
 * discarded and drawn again.
 */
public class RandomTokenGenerator extends AbstractTokenGenerator {

    private final Supplier<UUID> uuids;

    public RandomTokenGenerator() {
        this(UUID::randomUUID);
    }

    /**
     * @param uuids source of candidate tokens
     */
    public RandomTokenGenerator(Supplier<UUID> uuids) {
        this.uuids = uuids;
    }

    @Override
    protected String generate(TokenMapping mapping) {
        String token = uuids.get().toString();
        while (mapping.containsToken(token)) {
            token = uuids.get().toString();
        }
        return token;
    }
}

package com.raditha.tokenizer.generator;

import com.raditha.tokenizer.mapping.TokenMapping;

/**
 * Base class for generators: reuses an existing assignment and only asks the
 * subclass for a token when the value has none.
 */
public abstract class AbstractTokenGenerator implements TokenGenerator {

    @Override
    public final String tokenFor(String value, TokenMapping mapping) {
        return mapping.tokenFor(value).orElseGet(() -> generate(mapping));
    }

    /**
     * Mint a token that is not a key of {@code mapping}.
     */
    protected abstract String generate(TokenMapping mapping);
}

package com.raditha.tokenizer.generator;

import com.raditha.tokenizer.mapping.TokenMapping;

/**
 * Chooses the token for an original value.
 */
public interface TokenGenerator {

    /**
     * Return the token already assigned to {@code value}, or a new token that no
     * entry in {@code mapping} uses. The mapping is not modified; the caller
     * records the returned pair.
     *
     * @param value   the original value
     * @param mapping the mapping of the current run
     * @return the token to substitute for the value
     */
    String tokenFor(String value, TokenMapping mapping);
}

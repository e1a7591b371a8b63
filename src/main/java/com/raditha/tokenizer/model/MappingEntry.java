package com.raditha.tokenizer.model;

import java.util.Objects;

/**
 * One persisted association between a surrogate token and the value it replaced.
 *
 * @param token         the surrogate written into tokenized output
 * @param originalValue the value the token stands for
 */
public record MappingEntry(String token, String originalValue) {

    public MappingEntry {
        Objects.requireNonNull(token, "token cannot be null");
        Objects.requireNonNull(originalValue, "originalValue cannot be null");
    }
}

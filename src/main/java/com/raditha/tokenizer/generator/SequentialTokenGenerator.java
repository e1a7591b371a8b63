package com.raditha.tokenizer.generator;

import com.raditha.tokenizer.mapping.TokenMapping;

/**
 * Issues the smallest positive integer, as a decimal string, that is not yet a
 * token. In a fresh mapping the n-th distinct value gets token {@code "n"}.
 * <p>
 * Tokens are never removed from a mapping, so every integer below the last one
 * issued is known to be taken and the probe resumes from there. Handing the
 * generator a different mapping restarts the probe at 1.
 */
public class SequentialTokenGenerator extends AbstractTokenGenerator {

    private TokenMapping probed;
    private long next = 1;

    @Override
    protected String generate(TokenMapping mapping) {
        if (mapping != probed) {
            probed = mapping;
            next = 1;
        }
        while (mapping.containsToken(Long.toString(next))) {
            next++;
        }
        return Long.toString(next);
    }
}

package com.raditha.tokenizer.config;

import com.raditha.tokenizer.model.FileFormat;
import com.raditha.tokenizer.model.TokenStrategy;

import java.nio.file.Path;
import java.util.List;

/**
 * Resolved settings for a tokenize or detokenize run.
 *
 * @param columns     columns to tokenize, in the order given (ignored when detokenizing)
 * @param strategy    how new tokens are minted (ignored when detokenizing)
 * @param mappingFile where the token map is read from and written to
 * @param format      delimiter and encoding of all files
 */
public record TokenizerConfig(
        List<String> columns,
        TokenStrategy strategy,
        Path mappingFile,
        FileFormat format) {

    public static final String DEFAULT_MAPPING_FILE = "token_map.csv";

    /**
     * Validate configuration.
     */
    public TokenizerConfig {
        columns = columns == null ? List.of() : List.copyOf(columns);
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        if (mappingFile == null) {
            throw new IllegalArgumentException("mappingFile cannot be null");
        }
        if (format == null) {
            throw new IllegalArgumentException("format cannot be null");
        }
    }

    /**
     * UUID tokens, {@code token_map.csv}, comma separated UTF-8, no columns.
     */
    public static TokenizerConfig defaults() {
        return new TokenizerConfig(
                List.of(),
                TokenStrategy.RANDOM_UNIQUE,
                Path.of(DEFAULT_MAPPING_FILE),
                FileFormat.csv());
    }
}

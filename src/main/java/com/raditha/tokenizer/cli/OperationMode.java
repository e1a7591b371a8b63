package com.raditha.tokenizer.cli;

/**
 * Direction of a run.
 */
public enum OperationMode {
    /**
     * Replace the selected columns with tokens and update the token map.
     */
    TOKENIZE,

    /**
     * Replace every known token with its original value. The token map is only read.
     */
    DETOKENIZE;

    public static OperationMode of(boolean detokenize) {
        return detokenize ? DETOKENIZE : TOKENIZE;
    }
}

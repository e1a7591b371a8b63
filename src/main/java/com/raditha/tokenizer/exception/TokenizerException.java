package com.raditha.tokenizer.exception;

/**
 * Base class for failures raised by the tokenizer that are not plain I/O errors.
 */
public class TokenizerException extends RuntimeException {

    public TokenizerException(String message) {
        super(message);
    }

    public TokenizerException(String message, Throwable cause) {
        super(message, cause);
    }
}

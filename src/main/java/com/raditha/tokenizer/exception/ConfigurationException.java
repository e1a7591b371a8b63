package com.raditha.tokenizer.exception;

/**
 * Invalid or incomplete settings, detected before any file is opened.
 */
public class ConfigurationException extends TokenizerException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

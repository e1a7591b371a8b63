package com.raditha.tokenizer.exception;

import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * The record file to transform does not exist.
 */
public class InputNotFoundException extends NoSuchFileException {

    public InputNotFoundException(Path input) {
        super(input.toString(), null, "Input file not found");
    }
}

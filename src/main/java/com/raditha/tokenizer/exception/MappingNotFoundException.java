package com.raditha.tokenizer.exception;

import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * The token map file does not exist. Only fatal when detokenizing; tokenization
 * starts from an empty mapping instead.
 */
public class MappingNotFoundException extends NoSuchFileException {

    public MappingNotFoundException(Path mappingFile) {
        super(mappingFile.toString(), null, "Token map file not found");
    }
}

package com.raditha.tokenizer.report;

import java.nio.file.Path;
import java.util.List;

/**
 * Receives the recoverable events of a tokenize or detokenize run.
 * <p>
 * The processing classes never log directly. They report here and let the
 * caller decide what to do with each event, which keeps them free of global
 * logging state.
 */
public interface ProcessingListener {

    /**
     * A listener that ignores every event.
     */
    ProcessingListener NONE = new ProcessingListener() {
    };

    /**
     * A row in the token map did not have exactly two fields and was skipped.
     *
     * @param mappingFile the file being loaded
     * @param rowNumber   1-based row number within the file
     * @param fields      the fields that were read
     */
    default void malformedMappingRow(Path mappingFile, long rowNumber, List<String> fields) {
    }

    /**
     * No token map exists yet, so tokenization starts from an empty one.
     */
    default void mappingNotFound(Path mappingFile) {
    }

    default void mappingLoaded(Path mappingFile, int entries) {
    }

    default void mappingSaved(Path mappingFile, int entries) {
    }

    /**
     * A column selected for tokenization is not in the input header. Reported once
     * per column; the column is left untouched in every row.
     */
    default void missingColumn(String column, List<String> header) {
    }

    /**
     * A row had fewer fields than the header; the missing values read as empty.
     */
    default void recordShapeMismatch(long recordNumber, int expectedFields, int actualFields) {
    }

    /**
     * The input had no header row, so there was nothing to transform.
     */
    default void emptyInput(Path input) {
    }
}

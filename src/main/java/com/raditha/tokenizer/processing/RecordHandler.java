package com.raditha.tokenizer.processing;

import com.raditha.tokenizer.model.TabularRecord;

import java.io.IOException;

/**
 * Callback invoked for each record read from an input file.
 */
@FunctionalInterface
public interface RecordHandler {
    void handle(TabularRecord rec) throws IOException;
}

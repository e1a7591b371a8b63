package com.raditha.tokenizer.processing;

import com.raditha.tokenizer.mapping.TokenMapping;
import com.raditha.tokenizer.report.ProcessingReport;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Counters for one run.
 */
final class RunStats {
    long records;
    long replaced;
    long created;
    long reused;
    final List<String> missing = new ArrayList<>();

    ProcessingReport toReport(Path input, Path output, TokenMapping mapping) {
        return new ProcessingReport(input, output, records, replaced, created, reused, missing, mapping.size());
    }
}

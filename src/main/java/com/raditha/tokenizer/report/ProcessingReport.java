package com.raditha.tokenizer.report;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a single tokenize or detokenize run.
 *
 * @param input             file that was read
 * @param output            file that was written
 * @param recordsProcessed  data rows written to the output
 * @param valuesReplaced    cells whose value was substituted
 * @param tokensCreated     new tokens added to the mapping (always 0 when detokenizing)
 * @param tokensReused      substitutions served by an existing token
 * @param missingColumns    selected columns that were absent from the header
 * @param mappingSize       number of entries in the mapping at the end of the run
 */
public record ProcessingReport(
        Path input,
        Path output,
        long recordsProcessed,
        long valuesReplaced,
        long tokensCreated,
        long tokensReused,
        List<String> missingColumns,
        int mappingSize) {

    public ProcessingReport {
        missingColumns = missingColumns == null ? List.of() : List.copyOf(missingColumns);
    }

    /**
     * Get summary statistics.
     */
    public String getSummary() {
        return String.format(
                "%d records, %d values replaced (%d new tokens, %d reused), %d tokens in mapping",
                recordsProcessed,
                valuesReplaced,
                tokensCreated,
                tokensReused,
                mappingSize);
    }
}

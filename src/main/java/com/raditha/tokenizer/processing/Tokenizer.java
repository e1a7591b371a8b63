package com.raditha.tokenizer.processing;

import com.raditha.tokenizer.exception.ConfigurationException;
import com.raditha.tokenizer.exception.InputNotFoundException;
import com.raditha.tokenizer.generator.TokenGenerator;
import com.raditha.tokenizer.generator.TokenGenerators;
import com.raditha.tokenizer.mapping.MappingStore;
import com.raditha.tokenizer.mapping.TokenMapping;
import com.raditha.tokenizer.model.FileFormat;
import com.raditha.tokenizer.model.TabularRecord;
import com.raditha.tokenizer.model.TokenStrategy;
import com.raditha.tokenizer.report.ProcessingListener;
import com.raditha.tokenizer.report.ProcessingReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Replaces the values of selected columns with tokens and records every
 * assignment in the token map.
 * <p>
 * The token map is written once, after the last record. If the run fails before
 * that point the token map on disk is exactly what it was before the run,
 * although the output file may hold the records written so far.
 */
public class Tokenizer {

    private final FileFormat format;
    private final ProcessingListener listener;
    private final MappingStore mappingStore;

    public Tokenizer(FileFormat format, ProcessingListener listener) {
        this(format, listener, new MappingStore(format, listener));
    }

    public Tokenizer(FileFormat format, ProcessingListener listener, MappingStore mappingStore) {
        this.format = format;
        this.listener = listener;
        this.mappingStore = mappingStore;
    }

    /**
     * Tokenize {@code columns} of {@code input} into {@code output}, reusing and
     * extending the token map at {@code mappingFile}.
     *
     * @throws ConfigurationException if no columns are given or the strategy is missing
     * @throws InputNotFoundException if the input file does not exist
     * @throws IOException            if reading or writing any file fails
     */
    public ProcessingReport tokenize(Path input, Path output, Collection<String> columns,
                                     TokenStrategy strategy, Path mappingFile) throws IOException {
        if (strategy == null) {
            throw new ConfigurationException("A token method is required for tokenization");
        }
        return tokenize(input, output, columns, TokenGenerators.forStrategy(strategy), mappingFile);
    }

    /**
     * Same as {@link #tokenize(Path, Path, Collection, TokenStrategy, Path)} with an
     * explicit generator.
     */
    public ProcessingReport tokenize(Path input, Path output, Collection<String> columns,
                                     TokenGenerator generator, Path mappingFile) throws IOException {
        Set<String> selected = validateColumns(columns);
        if (!Files.exists(input)) {
            throw new InputNotFoundException(input);
        }

        TokenMapping mapping = mappingStore.loadIfExists(mappingFile);
        RunStats stats = new RunStats();

        try (RecordReader reader = RecordReader.open(input, format, listener)) {
            List<String> header = reader.header();
            if (header.isEmpty()) {
                listener.emptyInput(input);
            }
            List<String> present = resolveColumns(selected, header, stats);

            try (RecordWriter writer = RecordWriter.open(output, format, header)) {
                reader.forEachRecord(rec -> {
                    tokenizeRecord(rec, present, generator, mapping, stats);
                    writer.write(rec);
                    stats.records++;
                });
            }
        }

        mappingStore.save(mappingFile, mapping);
        return stats.toReport(input, output, mapping);
    }

    /**
     * Substitute tokens into one record in place, adding new assignments to
     * {@code mapping}.
     */
    void tokenizeRecord(TabularRecord rec, List<String> columns, TokenGenerator generator,
                        TokenMapping mapping, RunStats stats) {
        for (String column : columns) {
            String value = rec.get(column);
            String token = mapping.tokenFor(value).orElse(null);
            if (token == null) {
                token = generator.tokenFor(value, mapping);
                mapping.put(token, value);
                stats.created++;
            } else {
                stats.reused++;
            }
            rec.set(column, token);
            stats.replaced++;
        }
    }

    private List<String> resolveColumns(Set<String> selected, List<String> header, RunStats stats) {
        List<String> present = new ArrayList<>();
        for (String column : selected) {
            if (header.contains(column)) {
                present.add(column);
            } else {
                listener.missingColumn(column, header);
                stats.missing.add(column);
            }
        }
        return present;
    }

    private static Set<String> validateColumns(Collection<String> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new ConfigurationException("At least one column to tokenize is required");
        }
        Set<String> selected = new LinkedHashSet<>();
        for (String column : columns) {
            if (column == null || column.isEmpty()) {
                throw new ConfigurationException("Column names cannot be empty");
            }
            selected.add(column);
        }
        return selected;
    }
}

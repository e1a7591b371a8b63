package com.raditha.tokenizer.processing;

import com.raditha.tokenizer.exception.InputNotFoundException;
import com.raditha.tokenizer.exception.MappingNotFoundException;
import com.raditha.tokenizer.mapping.MappingStore;
import com.raditha.tokenizer.mapping.TokenMapping;
import com.raditha.tokenizer.model.FileFormat;
import com.raditha.tokenizer.model.TabularRecord;
import com.raditha.tokenizer.report.ProcessingListener;
import com.raditha.tokenizer.report.ProcessingReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Restores original values from a token map.
 * <p>
 * Every column of every record is checked, not only the ones that were
 * tokenized: any value that is exactly a known token is replaced. A value in an
 * untouched column that happens to equal a token (for instance {@code "2"} when
 * sequential tokens were used) is replaced as well.
 */
public class Detokenizer {

    private final FileFormat format;
    private final ProcessingListener listener;
    private final MappingStore mappingStore;

    public Detokenizer(FileFormat format, ProcessingListener listener) {
        this(format, listener, new MappingStore(format, listener));
    }

    public Detokenizer(FileFormat format, ProcessingListener listener, MappingStore mappingStore) {
        this.format = format;
        this.listener = listener;
        this.mappingStore = mappingStore;
    }

    /**
     * Detokenize {@code input} into {@code output}. The token map is only read.
     *
     * @throws MappingNotFoundException if the token map does not exist
     * @throws InputNotFoundException   if the input file does not exist
     * @throws IOException              if reading or writing any file fails
     */
    public ProcessingReport detokenize(Path input, Path output, Path mappingFile) throws IOException {
        TokenMapping mapping = mappingStore.loadRequired(mappingFile);
        if (!Files.exists(input)) {
            throw new InputNotFoundException(input);
        }

        RunStats stats = new RunStats();
        try (RecordReader reader = RecordReader.open(input, format, listener)) {
            List<String> header = reader.header();
            if (header.isEmpty()) {
                listener.emptyInput(input);
            }
            try (RecordWriter writer = RecordWriter.open(output, format, header)) {
                reader.forEachRecord(rec -> {
                    stats.replaced += detokenizeRecord(rec, mapping);
                    writer.write(rec);
                    stats.records++;
                });
            }
        }
        stats.reused = stats.replaced;
        return stats.toReport(input, output, mapping);
    }

    /**
     * Replace known tokens in one record in place.
     *
     * @return the number of values replaced
     */
    int detokenizeRecord(TabularRecord rec, TokenMapping mapping) {
        int replaced = 0;
        for (String column : rec.columns()) {
            String original = mapping.valueFor(rec.get(column)).orElse(null);
            if (original != null) {
                rec.set(column, original);
                replaced++;
            }
        }
        return replaced;
    }
}

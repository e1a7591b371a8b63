package com.raditha.tokenizer.mapping;

import com.raditha.tokenizer.exception.MappingNotFoundException;
import com.raditha.tokenizer.model.FileFormat;
import com.raditha.tokenizer.model.MappingEntry;
import com.raditha.tokenizer.report.ProcessingListener;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Reads and writes token map files.
 * <p>
 * A token map is a header-less delimited file with exactly two fields per row:
 * {@code token,original_value}. Every read or write of a token map in the
 * application goes through this class.
 */
public class MappingStore {

    private final FileFormat format;
    private final ProcessingListener listener;

    public MappingStore(FileFormat format, ProcessingListener listener) {
        this.format = format;
        this.listener = listener;
    }

    /**
     * Load a mapping for tokenization. A missing file is not an error; the run
     * starts from an empty mapping.
     */
    public TokenMapping loadIfExists(Path mappingFile) throws IOException {
        if (!Files.exists(mappingFile)) {
            listener.mappingNotFound(mappingFile);
            return new TokenMapping();
        }
        return load(mappingFile);
    }

    /**
     * Load a mapping for detokenization, where a missing file is fatal.
     *
     * @throws MappingNotFoundException if the file does not exist
     */
    public TokenMapping loadRequired(Path mappingFile) throws IOException {
        if (!Files.exists(mappingFile)) {
            throw new MappingNotFoundException(mappingFile);
        }
        return load(mappingFile);
    }

    /**
     * Read every well-formed row of an existing mapping file. Rows that do not
     * have exactly two fields are reported to the listener and skipped. Bytes
     * that are not valid in the configured charset fail the load.
     */
    public TokenMapping load(Path mappingFile) throws IOException {
        TokenMapping mapping = new TokenMapping();
        try (BufferedReader in = Files.newBufferedReader(mappingFile, format.charset());
             CSVParser parser = format.withoutHeader().parse(in)) {
            for (CSVRecord row : parser) {
                if (row.size() != 2) {
                    listener.malformedMappingRow(mappingFile, row.getRecordNumber(), row.toList());
                    continue;
                }
                mapping.put(row.get(0), row.get(1));
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        listener.mappingLoaded(mappingFile, mapping.size());
        return mapping;
    }

    /**
     * Write the whole mapping, replacing any existing file.
     * <p>
     * Rows go to a temporary file next to the target which is then moved into
     * place, so a failed write never leaves a truncated token map behind.
     */
    public void save(Path mappingFile, TokenMapping mapping) throws IOException {
        Path target = mappingFile.toAbsolutePath();
        Path directory = target.getParent();
        if (directory != null) {
            Files.createDirectories(directory);
        }
        Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
        try {
            try (BufferedWriter writer = Files.newBufferedWriter(temp, format.charset());
                 CSVPrinter printer = new CSVPrinter(writer, format.withoutHeader())) {
                for (MappingEntry entry : mapping.entries()) {
                    printer.printRecord(entry.token(), entry.originalValue());
                }
            }
            move(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
        listener.mappingSaved(mappingFile, mapping.size());
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}

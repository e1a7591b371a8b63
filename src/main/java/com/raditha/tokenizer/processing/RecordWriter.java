package com.raditha.tokenizer.processing;

import com.raditha.tokenizer.model.FileFormat;
import com.raditha.tokenizer.model.TabularRecord;
import org.apache.commons.csv.CSVPrinter;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes records to a delimited file, header first, keeping the column order of
 * the input they came from.
 */
public class RecordWriter implements Closeable {

    private final CSVPrinter printer;
    private final List<String> header;

    private RecordWriter(CSVPrinter printer, List<String> header) {
        this.printer = printer;
        this.header = header;
    }

    /**
     * Create or truncate {@code output} and write the header row. An empty header
     * produces an empty file.
     */
    public static RecordWriter open(Path output, FileFormat format, List<String> header) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        CSVPrinter printer = new CSVPrinter(Files.newBufferedWriter(output, format.charset()), format.withoutHeader());
        if (!header.isEmpty()) {
            printer.printRecord(header);
        }
        return new RecordWriter(printer, List.copyOf(header));
    }

    public void write(TabularRecord rec) throws IOException {
        if (!rec.columns().equals(header)) {
            throw new IllegalArgumentException("Record columns " + rec.columns() + " do not match header " + header);
        }
        printer.printRecord(rec.values());
    }

    @Override
    public void close() throws IOException {
        printer.close(true);
    }
}

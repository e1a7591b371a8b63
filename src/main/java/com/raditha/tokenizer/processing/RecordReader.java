package com.raditha.tokenizer.processing;

import com.raditha.tokenizer.model.FileFormat;
import com.raditha.tokenizer.model.TabularRecord;
import com.raditha.tokenizer.report.ProcessingListener;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Streams the records of a delimited file whose first row names the columns.
 * Only the current record is held in memory.
 */
public class RecordReader implements Closeable {

    private final CSVParser parser;
    private final List<String> header;
    private final ProcessingListener listener;

    private RecordReader(CSVParser parser, ProcessingListener listener) {
        this.parser = parser;
        this.header = List.copyOf(parser.getHeaderNames());
        this.listener = listener;
    }

    /**
     * Open {@code input} and read its header row. Bytes that are not valid in the
     * configured charset fail the read with a
     * {@link java.nio.charset.MalformedInputException} instead of being replaced.
     *
     * @throws IOException if the file cannot be read or its header is unusable
     */
    public static RecordReader open(Path input, FileFormat format, ProcessingListener listener) throws IOException {
        BufferedReader in = Files.newBufferedReader(input, format.charset());
        try {
            return new RecordReader(format.withHeader().parse(in), listener);
        } catch (IllegalArgumentException e) {
            in.close();
            throw new IOException("Invalid header in " + input + ": " + e.getMessage(), e);
        } catch (IOException | RuntimeException e) {
            in.close();
            throw e;
        }
    }

    /**
     * Column names in file order. Empty when the file has no header row.
     */
    public List<String> header() {
        return header;
    }

    /**
     * Hand every remaining record to {@code handler}, in file order. Short rows
     * are padded with empty values.
     *
     * @throws IOException if a row has more fields than the header, since the
     *                     surplus values would have no column to go to
     */
    public void forEachRecord(RecordHandler handler) throws IOException {
        try {
            for (CSVRecord row : parser) {
                List<String> fields = row.toList();
                if (fields.size() > header.size()) {
                    throw new IOException(String.format("Record %d has %d fields but the header has %d",
                            row.getRecordNumber(), fields.size(), header.size()));
                }
                if (fields.size() < header.size()) {
                    listener.recordShapeMismatch(row.getRecordNumber(), header.size(), fields.size());
                }
                handler.handle(TabularRecord.of(row.getRecordNumber(), header, fields));
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }
}

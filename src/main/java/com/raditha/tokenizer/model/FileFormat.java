package com.raditha.tokenizer.model;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.DuplicateHeaderMode;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Delimiter and character set shared by the input, the output and the token map.
 * Output is always written with the format the input was read with.
 *
 * @param delimiter field separator
 * @param charset   encoding of every file the run touches
 */
public record FileFormat(char delimiter, Charset charset) {

    public FileFormat {
        Objects.requireNonNull(charset, "charset cannot be null");
        if (delimiter == '"' || delimiter == '\r' || delimiter == '\n') {
            throw new IllegalArgumentException("Illegal delimiter: " + delimiter);
        }
    }

    /**
     * Comma separated UTF-8.
     */
    public static FileFormat csv() {
        return new FileFormat(',', StandardCharsets.UTF_8);
    }

    /**
     * Format for files that start with a header row naming the columns. Column
     * names must be unique and non-empty.
     */
    public CSVFormat withHeader() {
        return base()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setDuplicateHeaderMode(DuplicateHeaderMode.DISALLOW)
                .get();
    }

    /**
     * Format for header-less files such as the token map.
     */
    public CSVFormat withoutHeader() {
        return base().get();
    }

    private CSVFormat.Builder base() {
        return CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setIgnoreSurroundingSpaces(false)
                .setTrim(false);
    }
}

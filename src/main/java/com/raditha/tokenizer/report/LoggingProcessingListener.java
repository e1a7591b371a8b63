package com.raditha.tokenizer.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Forwards processing events to SLF4J.
 */
public class LoggingProcessingListener implements ProcessingListener {

    private static final Logger logger = LoggerFactory.getLogger(LoggingProcessingListener.class);

    @Override
    public void malformedMappingRow(Path mappingFile, long rowNumber, List<String> fields) {
        logger.warn("Skipping malformed row {} in token map file {}: {}", rowNumber, mappingFile, fields);
    }

    @Override
    public void mappingNotFound(Path mappingFile) {
        logger.info("Token map file {} does not exist yet, starting with an empty mapping", mappingFile);
    }

    @Override
    public void mappingLoaded(Path mappingFile, int entries) {
        logger.info("Loaded {} tokens from {}", entries, mappingFile);
    }

    @Override
    public void mappingSaved(Path mappingFile, int entries) {
        logger.info("Saved {} tokens to {}", entries, mappingFile);
    }

    @Override
    public void missingColumn(String column, List<String> header) {
        logger.warn("Column '{}' not found in input file (columns: {})", column, header);
    }

    @Override
    public void recordShapeMismatch(long recordNumber, int expectedFields, int actualFields) {
        logger.debug("Record {} has {} fields, header has {}", recordNumber, actualFields, expectedFields);
    }

    @Override
    public void emptyInput(Path input) {
        logger.warn("Input file {} has no header row, nothing to process", input);
    }
}

package com.raditha.tokenizer.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Writes a run summary as JSON so pipelines can check what a run did without
 * parsing log output. The summary never contains original values or tokens.
 */
public class ReportExporter {

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * DTO keeping paths as plain strings.
     */
    public record RunReportDTO(
            String mode,
            LocalDateTime timestamp,
            String input,
            String output,
            String mappingFile,
            long recordsProcessed,
            long valuesReplaced,
            long tokensCreated,
            long tokensReused,
            List<String> missingColumns,
            int mappingSize) {
    }

    public RunReportDTO toDTO(String mode, ProcessingReport report, Path mappingFile) {
        return new RunReportDTO(
                mode,
                LocalDateTime.now(),
                report.input().toString(),
                report.output().toString(),
                mappingFile.toString(),
                report.recordsProcessed(),
                report.valuesReplaced(),
                report.tokensCreated(),
                report.tokensReused(),
                report.missingColumns(),
                report.mappingSize());
    }

    /**
     * Export the report to {@code reportFile}, replacing any existing file.
     */
    public void exportToJson(String mode, ProcessingReport report, Path mappingFile, Path reportFile)
            throws IOException {
        Path parent = reportFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(reportFile.toFile(), toDTO(mode, report, mappingFile));
    }
}

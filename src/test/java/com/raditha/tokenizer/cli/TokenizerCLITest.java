package com.raditha.tokenizer.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenizerCLITest {

    @TempDir
    Path tempDir;

    private Path input;
    private Path output;
    private Path restored;
    private Path mapFile;
    private StringWriter err;

    @BeforeEach
    void setUp() throws IOException {
        input = tempDir.resolve("people.csv");
        output = tempDir.resolve("people_tokens.csv");
        restored = tempDir.resolve("people_restored.csv");
        mapFile = tempDir.resolve("token_map.csv");
        err = new StringWriter();
        Files.writeString(input, """
                id,name,ssn
                1,Alice,111-22-3333
                2,Bob,444-55-6666
                3,Alice,777-88-9999
                """);
    }

    @Test
    void testTokenizeSequential() throws IOException {
        int exitCode = run(input.toString(), output.toString(),
                "--tokenize-columns", "ssn", "--token-method", "sequential", "--token-map-file", mapFile.toString());

        assertEquals(0, exitCode);
        assertEquals(List.of("id,name,ssn", "1,Alice,1", "2,Bob,2", "3,Alice,3"), Files.readAllLines(output));
        assertEquals(List.of("1,111-22-3333", "2,444-55-6666", "3,777-88-9999"), Files.readAllLines(mapFile));
    }

    @Test
    void testTokenizeThenDetokenizeRestoresInput() throws IOException {
        assertEquals(0, run(input.toString(), output.toString(), "-c", "name", "ssn", "-m", mapFile.toString()));
        assertEquals(0, run(output.toString(), restored.toString(), "--detokenize", "-m", mapFile.toString()));

        assertEquals(Files.readAllLines(input), Files.readAllLines(restored));
    }

    @Test
    void testUnderscoreOptionNamesAccepted() throws IOException {
        int exitCode = run(input.toString(), output.toString(),
                "--tokenize_columns", "ssn", "--token_method", "sequential", "--token_map_file", mapFile.toString());

        assertEquals(0, exitCode);
        assertEquals(3, Files.readAllLines(mapFile).size());
    }

    @Test
    void testCommaSeparatedColumns() throws IOException {
        int exitCode = run(input.toString(), output.toString(),
                "-c", "name,ssn", "-s", "sequential", "-m", mapFile.toString());

        assertEquals(0, exitCode);
        assertEquals(List.of("id,name,ssn", "1,1,2", "2,3,4", "3,1,5"), Files.readAllLines(output));
    }

    @Test
    void testMissingColumnStillSucceeds() throws IOException {
        int exitCode = run(input.toString(), output.toString(), "-c", "email", "-m", mapFile.toString());

        assertEquals(0, exitCode);
        assertEquals(Files.readAllLines(input), Files.readAllLines(output));
    }

    @Test
    void testMissingInputReturnsIoExitCode() {
        int exitCode = run(tempDir.resolve("absent.csv").toString(), output.toString(),
                "-c", "ssn", "-m", mapFile.toString());

        assertEquals(TokenizerCLI.EXIT_IO, exitCode);
        assertFalse(Files.exists(output));
        assertFalse(Files.exists(mapFile));
    }

    @Test
    void testUndecodableInputReturnsIoExitCode() throws IOException {
        Files.write(input, new byte[]{'i', 'd', ',', 's', 's', 'n', '\n', '1', ',', (byte) 0xC3, 0x28, '\n'});

        int exitCode = run(input.toString(), output.toString(),
                "-c", "ssn", "-s", "sequential", "-m", mapFile.toString());

        assertEquals(TokenizerCLI.EXIT_IO, exitCode);
        assertFalse(Files.exists(mapFile));
    }

    @Test
    void testLatin1InputWithMatchingEncodingRoundTrips() throws IOException {
        Files.writeString(input, "id,name\n1,José\n", StandardCharsets.ISO_8859_1);

        assertEquals(0, run(input.toString(), output.toString(),
                "-c", "name", "--encoding", "ISO-8859-1", "-m", mapFile.toString()));
        assertEquals(0, run(output.toString(), restored.toString(),
                "--detokenize", "--encoding", "ISO-8859-1", "-m", mapFile.toString()));

        assertEquals(List.of("id,name", "1,José"), Files.readAllLines(restored, StandardCharsets.ISO_8859_1));
    }

    @Test
    void testDetokenizeWithoutMappingReturnsIoExitCode() {
        int exitCode = run(input.toString(), restored.toString(), "--detokenize", "-m", mapFile.toString());

        assertEquals(TokenizerCLI.EXIT_IO, exitCode);
        assertFalse(Files.exists(restored));
    }

    @Test
    void testUnknownTokenMethodIsUsageError() {
        int exitCode = run(input.toString(), output.toString(), "-c", "ssn", "--token-method", "hash",
                "-m", mapFile.toString());

        assertEquals(TokenizerCLI.EXIT_CONFIGURATION, exitCode);
        assertTrue(err.toString().contains("Invalid token method") || err.toString().contains("hash"));
        assertFalse(Files.exists(output));
    }

    @Test
    void testTokenizeWithoutColumnsIsConfigurationError() {
        int exitCode = run(input.toString(), output.toString(), "-m", mapFile.toString());

        assertEquals(TokenizerCLI.EXIT_CONFIGURATION, exitCode);
        assertFalse(Files.exists(output));
    }

    @Test
    void testDetokenizeDoesNotNeedColumns() throws IOException {
        Files.writeString(mapFile, "1,one\n");
        int exitCode = run(input.toString(), restored.toString(), "-d", "-m", mapFile.toString());

        assertEquals(0, exitCode);
        assertEquals("one,Alice,111-22-3333", Files.readAllLines(restored).get(1));
    }

    @Test
    void testOutputSameAsInputRejected() throws IOException {
        String before = Files.readString(input);
        int exitCode = run(input.toString(), input.toString(), "-c", "ssn", "-m", mapFile.toString());

        assertEquals(TokenizerCLI.EXIT_CONFIGURATION, exitCode);
        assertEquals(before, Files.readString(input));
    }

    @Test
    void testColumnsFromConfigFile() throws IOException {
        Path yaml = tempDir.resolve("custom.yml");
        Files.writeString(yaml, """
                tokenizer:
                  columns: [ssn]
                  token_method: sequential
                  token_map_file: %s
                """.formatted(mapFile.toString().replace("\\", "/")));

        int exitCode = run(input.toString(), output.toString(), "--config-file", yaml.toString());

        assertEquals(0, exitCode);
        assertEquals(List.of("id,name,ssn", "1,Alice,1", "2,Bob,2", "3,Alice,3"), Files.readAllLines(output));
        assertTrue(Files.exists(mapFile));
    }

    @Test
    void testMissingConfigFileIsConfigurationError() {
        int exitCode = run(input.toString(), output.toString(), "-c", "ssn",
                "--config-file", tempDir.resolve("missing.yml").toString());

        assertEquals(TokenizerCLI.EXIT_CONFIGURATION, exitCode);
    }

    @Test
    void testDelimiterOption() throws IOException {
        Files.writeString(input, "id;ssn\n1;111\n");

        int exitCode = run(input.toString(), output.toString(), "-c", "ssn", "-s", "sequential",
                "--delimiter", ";", "-m", mapFile.toString());

        assertEquals(0, exitCode);
        assertEquals(List.of("id;ssn", "1;1"), Files.readAllLines(output));
        assertEquals(List.of("1;111"), Files.readAllLines(mapFile));
    }

    @Test
    void testReportFileWritten() throws IOException {
        Path reportFile = tempDir.resolve("run.json");

        int exitCode = run(input.toString(), output.toString(), "-c", "ssn", "-m", mapFile.toString(),
                "--report", reportFile.toString());

        assertEquals(0, exitCode);
        String json = Files.readString(reportFile);
        assertTrue(json.contains("\"mode\" : \"tokenize\""));
        assertTrue(json.contains("\"tokensCreated\" : 3"));
        assertFalse(json.contains("111-22-3333"), "Reports must not leak original values");
    }

    private int run(String... args) {
        CommandLine cmd = TokenizerCLI.createCommandLine();
        cmd.setErr(new PrintWriter(err, true));
        cmd.setOut(new PrintWriter(new StringWriter(), true));
        return cmd.execute(args);
    }
}

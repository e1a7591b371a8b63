package com.raditha.tokenizer.cli;

import com.raditha.tokenizer.config.TokenizerConfig;
import com.raditha.tokenizer.config.TokenizerSettings;
import com.raditha.tokenizer.exception.ConfigurationException;
import com.raditha.tokenizer.model.TokenStrategy;
import com.raditha.tokenizer.processing.Detokenizer;
import com.raditha.tokenizer.processing.Tokenizer;
import com.raditha.tokenizer.report.LoggingProcessingListener;
import com.raditha.tokenizer.report.ProcessingListener;
import com.raditha.tokenizer.report.ProcessingReport;
import com.raditha.tokenizer.report.ReportExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the tokenizer.
 * <p>
 * Usage:
 * java -jar tokenizer.jar [options] &lt;input_file&gt; &lt;output_file&gt;
 * <p>
 * Configuration priority: CLI arguments > tokenizer.yml > defaults
 */
@Command(name = "tokenizer", mixinStandardHelpOptions = true, version = "Tokenizer v1.0.0",
        description = "Replaces sensitive data in a CSV file with unique, reversible tokens.")
public class TokenizerCLI implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(TokenizerCLI.class);

    static final int EXIT_ERROR = 1;
    static final int EXIT_CONFIGURATION = 2;
    static final int EXIT_IO = 3;

    @Parameters(index = "0", description = "The input CSV file.", paramLabel = "<input_file>")
    private Path inputFile;

    @Parameters(index = "1", description = "The output CSV file.", paramLabel = "<output_file>")
    private Path outputFile;

    @Option(names = {"-c", "--tokenize-columns", "--tokenize_columns"}, arity = "1..*", split = ",",
            description = "Column names to tokenize.", paramLabel = "<column>")
    private List<String> tokenizeColumns;

    @Option(names = {"-s", "--token-method", "--token_method"},
            description = "Tokenization method: uuid or sequential (default: uuid)",
            paramLabel = "<method>", converter = TokenStrategyConverter.class)
    private TokenStrategy tokenMethod;

    @Option(names = {"-m", "--token-map-file", "--token_map_file"},
            description = "File storing the token-to-value mapping (default: token_map.csv)", paramLabel = "<path>")
    private String tokenMapFile;

    @Option(names = {"-d", "--detokenize"}, description = "Detokenize the data using the token map file.")
    private boolean detokenize = false;

    @Option(names = "--delimiter", description = "Field delimiter of all files (default: ,)", paramLabel = "<char>")
    private String delimiter;

    @Option(names = "--encoding", description = "Character encoding of all files (default: UTF-8)", paramLabel = "<charset>")
    private String encoding;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private Path configFile;

    @Option(names = "--report", description = "Write a JSON summary of the run to this file", paramLabel = "<path>")
    private Path reportFile;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws Exception {
        TokenizerConfig config = TokenizerSettings.resolve(configFile).loadConfig(
                tokenizeColumns,
                tokenMethod != null ? tokenMethod.toCliString() : null,
                tokenMapFile,
                delimiter,
                encoding);
        OperationMode mode = OperationMode.of(detokenize);
        validateConfiguration(config, mode);

        ProcessingListener listener = new LoggingProcessingListener();
        ProcessingReport report = switch (mode) {
            case TOKENIZE -> new Tokenizer(config.format(), listener).tokenize(
                    inputFile, outputFile, config.columns(), config.strategy(), config.mappingFile());
            case DETOKENIZE -> new Detokenizer(config.format(), listener).detokenize(
                    inputFile, outputFile, config.mappingFile());
        };
        logger.info("{}", report.getSummary());

        if (mode == OperationMode.TOKENIZE) {
            logger.info("Data tokenized successfully. Output saved to '{}'. Token map saved to '{}'.",
                    outputFile, config.mappingFile());
        } else {
            logger.info("Data detokenized successfully. Output saved to '{}'.", outputFile);
        }

        if (reportFile != null) {
            new ReportExporter().exportToJson(mode.name().toLowerCase(), report, config.mappingFile(), reportFile);
            logger.info("Run report saved to '{}'.", reportFile);
        }
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Build the command line with the application's error handling installed.
     */
    static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new TokenizerCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof ConfigurationException || ex instanceof IllegalArgumentException) {
                logger.error("Configuration error: {}", ex.getMessage());
                return EXIT_CONFIGURATION;
            } else if (ex instanceof CharacterCodingException) {
                logger.error("I/O error: a file contains bytes that are not valid in the configured encoding"
                        + " (set --encoding): {}", ex.getMessage());
                return EXIT_IO;
            } else if (ex instanceof IOException) {
                logger.error("I/O error: {}", ex.getMessage());
                return EXIT_IO;
            } else {
                logger.error("An error occurred: {}", ex.getMessage(), ex);
                return EXIT_ERROR;
            }
        });

        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return EXIT_CONFIGURATION;
        });
        return cmd;
    }

    /**
     * Validate the resolved configuration before any file is opened.
     *
     * @throws ConfigurationException if the configuration is invalid
     */
    private void validateConfiguration(TokenizerConfig config, OperationMode mode) {
        if (mode == OperationMode.TOKENIZE && config.columns().isEmpty()) {
            throw new ConfigurationException(
                    "At least one column to tokenize is required (--tokenize-columns or 'columns' in the config file)");
        }
        Path output = outputFile.toAbsolutePath().normalize();
        if (output.equals(inputFile.toAbsolutePath().normalize())) {
            throw new ConfigurationException("Output file must differ from the input file: " + outputFile);
        }
        if (output.equals(config.mappingFile().toAbsolutePath().normalize())) {
            throw new ConfigurationException("Output file must differ from the token map file: " + outputFile);
        }
    }

    public static class TokenStrategyConverter implements ITypeConverter<TokenStrategy> {
        @Override
        public TokenStrategy convert(String value) throws Exception {
            return TokenStrategy.fromString(value);
        }
    }
}

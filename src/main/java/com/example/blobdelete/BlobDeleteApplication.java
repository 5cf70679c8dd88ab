package com.example.blobdelete;

import com.azure.storage.blob.models.DeleteSnapshotsOptionType;
import com.example.blobdelete.config.AppConfig;
import com.example.blobdelete.service.BlobDeletionService;
import com.example.blobdelete.service.DeletionReport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Command line entry point: deletes the blobs listed in a CSV file or inline CSV data.
 */
public final class BlobDeleteApplication {

    private static final String LOG4J_CONFIGURATION_PROPERTY = "log4j.configurationFile";
    private static final Path DEFAULT_CONFIG = Path.of("config", "application.properties");

    static {
        // must run before the first logger is created
        useLoggingConfigFromConfigDirectory();
    }

    private static final Logger LOGGER = LogManager.getLogger(BlobDeleteApplication.class);

    private BlobDeleteApplication() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs the deletion and returns the process exit code: 0 when every listed blob was deleted, 1 otherwise.
     */
    static int run(String[] args) {
        CliArguments arguments;
        try {
            arguments = CliArguments.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.print(CliArguments.usage());
            return 1;
        }
        if (arguments.help()) {
            System.out.print(CliArguments.usage());
            return 0;
        }

        try {
            AppConfig config = AppConfig.load(arguments.configPath().orElse(DEFAULT_CONFIG),
                    arguments.inputFilePath().orElse(null), arguments.inputCsvData().orElse(null),
                    arguments.threadCount().orElse(null), arguments.deleteSnapshotsMethod().orElse(null),
                    arguments.timeoutSeconds().orElse(null));
            LOGGER.info("Deleting blobs listed in {} with snapshot method {}",
                    config.getInputFilePath().orElse("inline CSV content"), config.getDeleteSnapshotsMethod());

            DeletionReport report = new BlobDeletionService(config).execute();
            report.outcomes().forEach(System.out::println);
            if (report.hasFailures()) {
                LOGGER.error("{} of {} deletions failed", report.failures().size(), report.outcomes().size());
                return 1;
            }
            return 0;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.fatal("Interrupted while deleting blobs", ex);
            return 1;
        } catch (IOException | RuntimeException ex) {
            LOGGER.fatal("Blob deletion failed", ex);
            return 1;
        }
    }

    private static void useLoggingConfigFromConfigDirectory() {
        if (System.getProperty(LOG4J_CONFIGURATION_PROPERTY) != null) {
            return;
        }
        Stream.of("log4j2.properties", "log4j2.xml")
                .map(name -> Path.of("config", name))
                .filter(Files::isRegularFile)
                .findFirst()
                .ifPresent(path -> System.setProperty(LOG4J_CONFIGURATION_PROPERTY, path.toUri().toString()));
    }

    enum Option {
        HELP("-h", "--help", null, "Show this help message"),
        CONFIG("-c", "--config", "<path>", "Configuration file (default: config/application.properties)"),
        INPUT_FILE("-f", "--input-file", "<path>", "CSV file of account,container,blob[,leaseId] lines"),
        INPUT_DATA("-d", "--input-data", "<csv>", "Inline CSV, \\n separates lines (excludes --input-file)"),
        THREADS("-t", "--threads", "<count>", "Number of worker threads"),
        DELETE_SNAPSHOTS("-s", "--delete-snapshots", "<include|only>",
                "Delete the blob with its snapshots, or only the snapshots"),
        TIMEOUT("-T", "--timeout", "<seconds>", "Server side timeout for each delete request");

        private final String shortName;
        private final String longName;
        private final String valueName;
        private final String description;

        Option(String shortName, String longName, String valueName, String description) {
            this.shortName = shortName;
            this.longName = longName;
            this.valueName = valueName;
            this.description = description;
        }

        boolean takesValue() {
            return valueName != null;
        }

        String synopsis() {
            return shortName + ", " + longName + (takesValue() ? " " + valueName : "");
        }

        static Option named(String argument) {
            for (Option option : values()) {
                if (option.shortName.equals(argument) || option.longName.equals(argument)) {
                    return option;
                }
            }
            throw new IllegalArgumentException("Unknown argument: " + argument);
        }
    }

    record CliArguments(Optional<Path> configPath, Optional<String> inputFilePath, Optional<String> inputCsvData,
            Optional<Integer> threadCount, Optional<DeleteSnapshotsOptionType> deleteSnapshotsMethod,
            Optional<Long> timeoutSeconds, boolean help) {

        private static final Pattern ESCAPE_SEQUENCE = Pattern.compile("\\\\([nrt\\\\])");

        static CliArguments parse(String[] args) {
            Map<Option, String> values = new EnumMap<>(Option.class);
            for (int i = 0; args != null && i < args.length; i++) {
                Option option = Option.named(args[i]);
                String value = "";
                if (option.takesValue()) {
                    if (i + 1 == args.length) {
                        throw new IllegalArgumentException("Missing value for argument " + args[i]);
                    }
                    value = args[++i];
                }
                values.put(option, value);
            }
            if (values.containsKey(Option.INPUT_FILE) && values.containsKey(Option.INPUT_DATA)) {
                throw new IllegalArgumentException("--input-file and --input-data cannot be used together");
            }

            return new CliArguments(
                    valueOf(values, Option.CONFIG).map(Path::of),
                    valueOf(values, Option.INPUT_FILE),
                    valueOf(values, Option.INPUT_DATA).map(CliArguments::unescapeCsvContent),
                    valueOf(values, Option.THREADS)
                            .map(raw -> (int) parseBounded(raw, "thread count", 1, Integer.MAX_VALUE)),
                    valueOf(values, Option.DELETE_SNAPSHOTS).map(AppConfig::parseDeleteSnapshotsMethod),
                    valueOf(values, Option.TIMEOUT).map(raw -> parseBounded(raw, "timeout", 0, Long.MAX_VALUE)),
                    values.containsKey(Option.HELP));
        }

        private static Optional<String> valueOf(Map<Option, String> values, Option option) {
            return Optional.ofNullable(values.get(option));
        }

        private static long parseBounded(String raw, String description, long minimum, long maximum) {
            long parsed;
            try {
                parsed = Long.parseLong(raw.trim());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid value for " + description + ": '" + raw + "'", ex);
            }
            if (parsed < minimum || parsed > maximum) {
                throw new IllegalArgumentException(description + " must be between " + minimum + " and " + maximum
                        + ", but was " + parsed);
            }
            return parsed;
        }

        /**
         * Expands {@code \n}, {@code \r}, {@code \t} and {@code \\}; any other backslash is kept as written.
         */
        static String unescapeCsvContent(String rawValue) {
            if (rawValue == null) {
                return null;
            }
            return ESCAPE_SEQUENCE.matcher(rawValue)
                    .replaceAll(match -> Matcher.quoteReplacement(expand(match.group(1).charAt(0))));
        }

        private static String expand(char escaped) {
            switch (escaped) {
                case 'n':
                    return "\n";
                case 'r':
                    return "\r";
                case 't':
                    return "\t";
                default:
                    return "\\";
            }
        }

        static String usage() {
            StringBuilder usage = new StringBuilder("Usage: java -jar blob-delete.jar [options]")
                    .append(System.lineSeparator())
                    .append("Options:")
                    .append(System.lineSeparator());
            for (Option option : Option.values()) {
                usage.append(String.format("  %-36s %s%n", option.synopsis(), option.description));
            }
            return usage.toString();
        }
    }
}

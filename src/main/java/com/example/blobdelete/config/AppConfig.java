package com.example.blobdelete.config;

import com.azure.storage.blob.models.DeleteSnapshotsOptionType;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;

/**
 * Holds configuration parameters for the Blob Delete application.
 */
public final class AppConfig {

    private static final String DEFAULT_SEPARATOR = ",";
    private static final String DEFAULT_SERVICE_VERSION = "2021-08-06";
    private static final int DEFAULT_MAX_RETRIES = 3;

    private final String inputFilePath;
    private final String inputCsvContent;
    private final int threadPoolSize;
    private final String csvSeparator;
    private final boolean csvHasHeader;
    private final DeleteSnapshotsOptionType deleteSnapshotsMethod;
    private final Long timeoutSeconds;
    private final String serviceVersion;
    private final int maxRetries;
    private final String accountKey;

    private AppConfig(Builder builder) {
        if (builder.threadPoolSize <= 0) {
            throw new IllegalArgumentException("threadPoolSize must be greater than zero");
        }
        if (builder.maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative, but was " + builder.maxRetries);
        }
        if (builder.timeoutSeconds != null && builder.timeoutSeconds < 0) {
            throw new IllegalArgumentException("timeoutSeconds must not be negative, but was " + builder.timeoutSeconds);
        }
        if (isBlank(builder.inputFilePath) && isBlank(builder.inputCsvContent)) {
            throw new IllegalArgumentException("Either inputFilePath or inputCsvContent must be provided.");
        }
        if (!isBlank(builder.inputFilePath) && !isBlank(builder.inputCsvContent)) {
            throw new IllegalArgumentException("Only one of inputFilePath or inputCsvContent can be provided.");
        }
        this.inputFilePath = isBlank(builder.inputFilePath) ? null : builder.inputFilePath;
        this.inputCsvContent = isBlank(builder.inputCsvContent) ? null : builder.inputCsvContent;
        this.threadPoolSize = builder.threadPoolSize;
        this.csvSeparator = builder.csvSeparator == null || builder.csvSeparator.isEmpty() ? DEFAULT_SEPARATOR
                : builder.csvSeparator;
        this.csvHasHeader = builder.csvHasHeader;
        this.deleteSnapshotsMethod = builder.deleteSnapshotsMethod == null ? DeleteSnapshotsOptionType.INCLUDE
                : builder.deleteSnapshotsMethod;
        this.timeoutSeconds = builder.timeoutSeconds;
        this.serviceVersion = isBlank(builder.serviceVersion) ? DEFAULT_SERVICE_VERSION : builder.serviceVersion.trim();
        this.maxRetries = builder.maxRetries;
        this.accountKey = isBlank(builder.accountKey) ? null : builder.accountKey.trim();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> getInputFilePath() {
        return Optional.ofNullable(inputFilePath);
    }

    public Optional<String> getInputCsvContent() {
        return Optional.ofNullable(inputCsvContent);
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public String getCsvSeparator() {
        return csvSeparator;
    }

    public boolean isCsvHasHeader() {
        return csvHasHeader;
    }

    public DeleteSnapshotsOptionType getDeleteSnapshotsMethod() {
        return deleteSnapshotsMethod;
    }

    public Optional<Long> getTimeoutSeconds() {
        return Optional.ofNullable(timeoutSeconds);
    }

    public String getServiceVersion() {
        return serviceVersion;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Shared key for all accounts in the input. When absent, requests authenticate with a default Azure credential.
     */
    public Optional<String> getAccountKey() {
        return Optional.ofNullable(accountKey);
    }

    public static AppConfig load(Path path) throws IOException {
        return load(path, null, null, null, null, null);
    }

    public static AppConfig load(Path path, String overrideInputFilePath, String overrideInputCsvContent,
            Integer overrideThreadPoolSize, DeleteSnapshotsOptionType overrideDeleteSnapshotsMethod,
            Long overrideTimeoutSeconds) throws IOException {
        Properties properties = new Properties();
        try (InputStream inputStream = Files.newInputStream(path)) {
            properties.load(inputStream);
        }

        validateMutuallyExclusive(properties);

        String inputFilePath = firstNonBlank(overrideInputFilePath, properties.getProperty("inputFilePath"));
        String inputCsvContent = firstNonBlank(overrideInputCsvContent, properties.getProperty("inputCsvContent"));
        if (!isBlank(inputCsvContent)) {
            inputFilePath = null;
        }
        if (isBlank(inputFilePath) && isBlank(inputCsvContent)) {
            throw new IllegalArgumentException(
                    "Either inputFilePath or inputCsvContent must be provided (config or CLI override).");
        }

        return builder()
                .inputFilePath(inputFilePath)
                .inputCsvContent(inputCsvContent)
                .threadPoolSize(overrideThreadPoolSize != null ? overrideThreadPoolSize
                        : property(properties, "threadPoolSize", Integer::valueOf,
                                Runtime.getRuntime().availableProcessors()))
                .csvSeparator(properties.getProperty("csvSeparator", DEFAULT_SEPARATOR))
                .csvHasHeader(property(properties, "csvHasHeader", Boolean::valueOf, Boolean.TRUE))
                .deleteSnapshotsMethod(overrideDeleteSnapshotsMethod != null ? overrideDeleteSnapshotsMethod
                        : property(properties, "deleteSnapshots", AppConfig::parseDeleteSnapshotsMethod, null))
                .timeoutSeconds(overrideTimeoutSeconds != null ? overrideTimeoutSeconds
                        : AppConfig.<Long>property(properties, "timeoutSeconds", Long::valueOf, null))
                .serviceVersion(properties.getProperty("serviceVersion"))
                .maxRetries(property(properties, "maxRetries", Integer::valueOf, DEFAULT_MAX_RETRIES))
                .accountKey(properties.getProperty("accountKey"))
                .build();
    }

    /**
     * Parses {@code include} or {@code only}, ignoring case.
     */
    public static DeleteSnapshotsOptionType parseDeleteSnapshotsMethod(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (DeleteSnapshotsOptionType candidate : DeleteSnapshotsOptionType.values()) {
            if (candidate.toString().equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Invalid delete snapshots method '" + value + "', expected include or only");
    }

    private static <T> T property(Properties properties, String propertyName, Function<String, T> parser,
            T defaultValue) {
        String value = properties.getProperty(propertyName);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return parser.apply(value.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for property '" + propertyName + "': " + value, e);
        }
    }

    private static void validateMutuallyExclusive(Properties properties) {
        String filePath = properties.getProperty("inputFilePath");
        String csvContent = properties.getProperty("inputCsvContent");
        if (!isBlank(filePath) && !isBlank(csvContent)) {
            throw new IllegalArgumentException(
                    "Properties inputFilePath and inputCsvContent are mutually exclusive. Please configure only one.");
        }
    }

    private static String firstNonBlank(String first, String second) {
        if (!isBlank(first)) {
            return first;
        }
        return isBlank(second) ? null : second;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static final class Builder {

        private String inputFilePath;
        private String inputCsvContent;
        private int threadPoolSize = Runtime.getRuntime().availableProcessors();
        private String csvSeparator = DEFAULT_SEPARATOR;
        private boolean csvHasHeader = true;
        private DeleteSnapshotsOptionType deleteSnapshotsMethod;
        private Long timeoutSeconds;
        private String serviceVersion;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private String accountKey;

        private Builder() {
        }

        public Builder inputFilePath(String inputFilePath) {
            this.inputFilePath = inputFilePath;
            return this;
        }

        public Builder inputCsvContent(String inputCsvContent) {
            this.inputCsvContent = inputCsvContent;
            return this;
        }

        public Builder threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = threadPoolSize;
            return this;
        }

        public Builder csvSeparator(String csvSeparator) {
            this.csvSeparator = csvSeparator;
            return this;
        }

        public Builder csvHasHeader(boolean csvHasHeader) {
            this.csvHasHeader = csvHasHeader;
            return this;
        }

        public Builder deleteSnapshotsMethod(DeleteSnapshotsOptionType deleteSnapshotsMethod) {
            this.deleteSnapshotsMethod = deleteSnapshotsMethod;
            return this;
        }

        public Builder timeoutSeconds(Long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder serviceVersion(String serviceVersion) {
            this.serviceVersion = serviceVersion;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder accountKey(String accountKey) {
            this.accountKey = accountKey;
            return this;
        }

        public AppConfig build() {
            return new AppConfig(this);
        }
    }
}

package com.example.blobdelete.io;

import com.example.blobdelete.model.BlobDeleteRequest;
import com.example.blobdelete.request.LeaseId;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Reads delete requests from CSV lines of the form {@code account,container,blob[,leaseId]}. Blank and malformed
 * lines are logged and skipped; line numbers count the header row.
 */
public final class CsvBlobDeleteRequestReader {

    private static final Logger LOGGER = LogManager.getLogger(CsvBlobDeleteRequestReader.class);
    private static final String INLINE_SOURCE = "inline CSV content";

    private final Pattern separator;
    private final boolean hasHeader;

    public CsvBlobDeleteRequestReader(String separator, boolean hasHeader) {
        this.separator = Pattern.compile(Pattern.quote(Objects.requireNonNull(separator, "separator")));
        this.hasHeader = hasHeader;
    }

    public List<BlobDeleteRequest> read(Path csvPath) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(csvPath)) {
            return read(reader, csvPath.toString());
        }
    }

    public List<BlobDeleteRequest> read(String csvContent) {
        try {
            return read(new BufferedReader(new StringReader(csvContent)), INLINE_SOURCE);
        } catch (IOException e) {
            throw new UncheckedIOException("Reading in-memory CSV failed", e);
        }
    }

    private List<BlobDeleteRequest> read(BufferedReader reader, String source) throws IOException {
        List<BlobDeleteRequest> requests = new ArrayList<>();
        long lineNumber = 0;
        for (String line = reader.readLine(); line != null; line = reader.readLine()) {
            lineNumber++;
            if (hasHeader && lineNumber == 1) {
                continue;
            }
            if (line.isBlank()) {
                LOGGER.warn("Skipping blank line {} of {}", lineNumber, source);
                continue;
            }
            try {
                requests.add(toRequest(line, lineNumber));
            } catch (MalformedLineException e) {
                LOGGER.error("Skipping line {} of {}: {}. Line content: {}", lineNumber, source, e.getMessage(), line);
            }
        }
        LOGGER.debug("Read {} request(s) from {}", requests.size(), source);
        return requests;
    }

    private BlobDeleteRequest toRequest(String line, long lineNumber) throws MalformedLineException {
        String[] fields = separator.split(line.trim(), -1);
        if (fields.length < 3) {
            throw new MalformedLineException("expected at least 3 fields but found " + fields.length);
        }
        return new BlobDeleteRequest(required(fields[0], "storage account"), required(fields[1], "container"),
                required(fields[2], "blob name"), fields.length > 3 ? lease(fields[3]) : null, lineNumber, line);
    }

    private static String required(String field, String name) throws MalformedLineException {
        String value = unquote(field);
        if (value.isEmpty()) {
            throw new MalformedLineException(name + " is empty");
        }
        return value;
    }

    private static LeaseId lease(String field) throws MalformedLineException {
        String value = unquote(field);
        if (value.isEmpty()) {
            return null;
        }
        try {
            return LeaseId.parse(value);
        } catch (IllegalArgumentException e) {
            throw new MalformedLineException(e.getMessage());
        }
    }

    private static String unquote(String field) {
        return field.replace("\"", "").trim();
    }

    private static final class MalformedLineException extends Exception {

        MalformedLineException(String message) {
            super(message);
        }
    }
}

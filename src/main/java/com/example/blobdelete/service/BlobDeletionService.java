package com.example.blobdelete.service;

import com.example.blobdelete.client.BlobStorageClient;
import com.example.blobdelete.client.BlobStorageClientFactory;
import com.example.blobdelete.config.AppConfig;
import com.example.blobdelete.io.CsvBlobDeleteRequestReader;
import com.example.blobdelete.model.BlobDeleteRequest;
import com.example.blobdelete.request.DeleteBlobBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Reads the configured CSV input and deletes every listed blob on a fixed worker pool. Each storage account gets
 * one client, and from it one request template that every task for that account refines.
 */
public class BlobDeletionService {

    private static final Logger LOGGER = LogManager.getLogger(BlobDeletionService.class);

    private final AppConfig config;
    private final BlobStorageClientFactory clientFactory;

    public BlobDeletionService(AppConfig config) {
        this(config, new BlobStorageClientFactory(config));
    }

    public BlobDeletionService(AppConfig config, BlobStorageClientFactory clientFactory) {
        this.config = Objects.requireNonNull(config, "config");
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
    }

    public DeletionReport execute() throws IOException, InterruptedException {
        return deleteAll(readRequests());
    }

    List<BlobDeleteRequest> readRequests() throws IOException {
        CsvBlobDeleteRequestReader reader = new CsvBlobDeleteRequestReader(config.getCsvSeparator(),
                config.isCsvHasHeader());
        Optional<String> inlineContent = config.getInputCsvContent();
        if (inlineContent.isPresent()) {
            return reader.read(inlineContent.get());
        }
        String inputFile = config.getInputFilePath()
                .orElseThrow(() -> new IllegalStateException("No input source configured"));
        return reader.read(Path.of(inputFile));
    }

    /**
     * Deletes {@code requests} and reports one outcome per request, in the same order.
     */
    public DeletionReport deleteAll(List<BlobDeleteRequest> requests) throws InterruptedException {
        if (requests.isEmpty()) {
            LOGGER.info("No blobs to delete");
            return new DeletionReport(List.of());
        }

        Map<String, Optional<DeleteBlobBuilder>> templates = new HashMap<>();
        List<Callable<DeletionOutcome>> tasks = new ArrayList<>(requests.size());
        for (BlobDeleteRequest request : requests) {
            Optional<DeleteBlobBuilder> template = templates.computeIfAbsent(request.accountName(),
                    this::createTemplate);
            tasks.add(template.<Callable<DeletionOutcome>>map(t -> new BlobDeletionTask(t, request))
                    .orElse(() -> DeletionOutcome.failed(request,
                            "no client for storage account " + request.accountName())));
        }
        LOGGER.info("Deleting {} blob(s) across {} storage account(s)", requests.size(), templates.size());

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(config.getThreadPoolSize(), tasks.size()));
        try {
            List<Future<DeletionOutcome>> futures = executor.invokeAll(tasks);
            List<DeletionOutcome> outcomes = new ArrayList<>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(outcomeOf(futures.get(i), requests.get(i)));
            }
            DeletionReport report = new DeletionReport(outcomes);
            LOGGER.info("Deletion completed. Deleted: {}, failed: {}", report.deletedCount(),
                    report.failures().size());
            return report;
        } finally {
            executor.shutdownNow();
        }
    }

    private Optional<DeleteBlobBuilder> createTemplate(String accountName) {
        BlobStorageClient client;
        try {
            client = clientFactory.create(accountName);
        } catch (RuntimeException ex) {
            LOGGER.error("Could not create a client for storage account {}", accountName, ex);
            return Optional.empty();
        }
        LOGGER.debug("Storage account {} resolved to {}", accountName, client.getEndpoint());

        DeleteBlobBuilder template = client.deleteBlob().withDeleteSnapshotsMethod(config.getDeleteSnapshotsMethod());
        Optional<Long> timeoutSeconds = config.getTimeoutSeconds();
        return Optional.of(timeoutSeconds.isPresent() ? template.withTimeout(timeoutSeconds.get()) : template);
    }

    private static DeletionOutcome outcomeOf(Future<DeletionOutcome> future, BlobDeleteRequest request)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException ex) {
            LOGGER.error("Deletion task for {} failed", request.describe(), ex.getCause());
            return DeletionOutcome.failed(request, "task failed: " + ex.getCause());
        }
    }
}

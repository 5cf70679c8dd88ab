package com.example.blobdelete.client;

import com.azure.core.credential.TokenCredential;
import com.azure.core.http.HttpClient;
import com.azure.core.http.HttpHeaders;
import com.azure.core.http.HttpPipeline;
import com.azure.core.http.HttpPipelineBuilder;
import com.azure.core.http.policy.AddDatePolicy;
import com.azure.core.http.policy.AddHeadersPolicy;
import com.azure.core.http.policy.BearerTokenAuthenticationPolicy;
import com.azure.core.http.policy.ExponentialBackoff;
import com.azure.core.http.policy.HttpPipelinePolicy;
import com.azure.core.http.policy.RetryPolicy;
import com.azure.identity.DefaultAzureCredentialBuilder;
import com.azure.storage.common.StorageSharedKeyCredential;
import com.azure.storage.common.policy.StorageSharedKeyCredentialPolicy;
import com.example.blobdelete.config.AppConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Creates {@link BlobStorageClient} instances with the pipeline described by an {@link AppConfig}.
 */
public class BlobStorageClientFactory {

    private static final Logger LOGGER = LogManager.getLogger(BlobStorageClientFactory.class);
    private static final String STORAGE_SCOPE = "https://storage.azure.com/.default";
    private static final Duration RETRY_BASE_DELAY = Duration.ofMillis(800);
    private static final Duration RETRY_MAX_DELAY = Duration.ofSeconds(30);

    private final AppConfig config;
    private final HttpClient httpClient;
    private TokenCredential credential;

    public BlobStorageClientFactory(AppConfig config) {
        this(config, HttpClient.createDefault());
    }

    public BlobStorageClientFactory(AppConfig config, HttpClient httpClient) {
        this.config = Objects.requireNonNull(config, "config");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public BlobStorageClient create(String storageAccountName) {
        String endpoint = BlobUris.resolveEndpoint(storageAccountName);
        LOGGER.debug("Creating client for endpoint {}", endpoint);
        return new BlobStorageClient(endpoint, buildPipeline(storageAccountName));
    }

    HttpPipeline buildPipeline(String storageAccountName) {
        List<HttpPipelinePolicy> policies = new ArrayList<>();
        policies.add(new AddHeadersPolicy(new HttpHeaders().set(BlobHeaders.VERSION, config.getServiceVersion())));
        policies.add(new AddDatePolicy());
        policies.add(new RetryPolicy(new ExponentialBackoff(config.getMaxRetries(), RETRY_BASE_DELAY,
                RETRY_MAX_DELAY)));
        policies.add(authenticationPolicy(storageAccountName));

        return new HttpPipelineBuilder()
                .httpClient(httpClient)
                .policies(policies.toArray(new HttpPipelinePolicy[0]))
                .build();
    }

    private HttpPipelinePolicy authenticationPolicy(String storageAccountName) {
        if (config.getAccountKey().isPresent()) {
            String accountName = accountNameOf(storageAccountName);
            LOGGER.debug("Using shared key authentication for account {}", accountName);
            return new StorageSharedKeyCredentialPolicy(
                    new StorageSharedKeyCredential(accountName, config.getAccountKey().get()));
        }
        return new BearerTokenAuthenticationPolicy(credential(), STORAGE_SCOPE);
    }

    private synchronized TokenCredential credential() {
        if (credential == null) {
            credential = new DefaultAzureCredentialBuilder().build();
        }
        return credential;
    }

    static String accountNameOf(String storageAccountName) {
        String trimmed = storageAccountName.trim();
        int schemeEnd = trimmed.indexOf("://");
        String host = schemeEnd >= 0 ? trimmed.substring(schemeEnd + 3) : trimmed;
        int slash = host.indexOf('/');
        if (schemeEnd >= 0 && slash >= 0 && slash + 1 < host.length()) {
            // path-style endpoint such as http://127.0.0.1:10000/devstoreaccount1
            String path = host.substring(slash + 1);
            int next = path.indexOf('/');
            return next >= 0 ? path.substring(0, next) : path;
        }
        if (slash >= 0) {
            host = host.substring(0, slash);
        }
        int dot = host.indexOf('.');
        return dot >= 0 ? host.substring(0, dot) : host;
    }
}

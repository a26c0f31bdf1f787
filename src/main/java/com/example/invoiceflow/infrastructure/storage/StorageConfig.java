package com.example.invoiceflow.infrastructure.storage;

import com.example.invoiceflow.domain.port.BlobStore;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Wires the blob stores. Google Cloud Storage is only created when {@code invoice.storage.gcs.enabled=true};
 * the local filesystem store is always available for the remaining schemes.
 */
@Configuration
@EnableConfigurationProperties(StorageProperties.class)
public class StorageConfig {

    private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

    private final StorageProperties properties;
    private final ResourceLoader resourceLoader;

    /**
     * @param properties     bound {@code invoice.storage.*} settings
     * @param resourceLoader loader used to resolve the credentials location
     */
    public StorageConfig(StorageProperties properties, ResourceLoader resourceLoader) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
    }

    @Bean
    @ConditionalOnProperty(value = "invoice.storage.gcs.enabled", havingValue = "true")
    @ConditionalOnMissingBean
    public Storage storage() throws IOException {
        StorageOptions.Builder optionsBuilder = StorageOptions.newBuilder();
        GoogleCredentials credentials = null;

        String credentialsLocation = properties.getGcs().getCredentials();
        if (StringUtils.hasText(credentialsLocation)) {
            Resource resource = resourceLoader.getResource(credentialsLocation);
            if (resource.exists()) {
                try (InputStream inputStream = resource.getInputStream()) {
                    credentials = GoogleCredentials.fromStream(inputStream);
                }
            } else {
                log.warn("GCS credentials resource {} not found; falling back to application default credentials.",
                        credentialsLocation);
            }
        }

        if (credentials == null) {
            credentials = GoogleCredentials.getApplicationDefault();
        }

        optionsBuilder.setCredentials(credentials);
        if (StringUtils.hasText(properties.getGcs().getProjectId())) {
            optionsBuilder.setProjectId(properties.getGcs().getProjectId());
        }

        return optionsBuilder.build().getService();
    }

    @Bean
    @ConditionalOnMissingBean(BlobStore.class)
    public BlobStore blobStore(ObjectProvider<Storage> storage) {
        List<BlobStore> stores = new ArrayList<>();
        Storage gcs = storage.getIfAvailable();
        if (gcs != null) {
            stores.add(new GcsBlobStore(gcs));
        }
        Path localRoot = Path.of(properties.getLocal().getRoot());
        stores.add(new LocalBlobStore(localRoot));
        log.info("Blob stores configured: gcs={}, local root={}", gcs != null, localRoot.toAbsolutePath());
        return new RoutingBlobStore(stores);
    }
}

package com.di.loannova.config;

import com.di.loannova.output.CloudObjectStore;
import com.di.loannova.output.GcsObjectStore;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers a Google Cloud Storage client backed by Application Default Credentials,
 * and the {@link CloudObjectStore} on top of it, only when cloud export is switched on.
 */
@Configuration
@ConditionalOnProperty(prefix = "loannova.pipeline.output.cloud", name = "enabled", havingValue = "true")
public class GcsStorageConfig {

    @Bean
    @ConditionalOnMissingBean(Storage.class)
    public Storage gcsStorage() {
        return StorageOptions.getDefaultInstance().getService();
    }

    @Bean
    @ConditionalOnMissingBean(CloudObjectStore.class)
    public CloudObjectStore gcsObjectStore(Storage storage, PipelineProperties properties) {
        String bucket = properties.getOutput().getCloud().getBucket();
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalStateException("loannova.pipeline.output.cloud.bucket must be set when cloud export is enabled");
        }
        return new GcsObjectStore(storage, bucket);
    }
}

package com.di.loannova.output;

import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.BucketInfo;
import com.google.cloud.storage.Storage;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link CloudObjectStore} on a single Google Cloud Storage bucket.
 */
@Slf4j
public class GcsObjectStore implements CloudObjectStore {

    private final Storage storage;
    private final String  bucket;

    public GcsObjectStore(Storage storage, String bucket) {
        this.storage = storage;
        this.bucket  = bucket;
    }

    @Override
    public String upload(byte[] content, String key, String contentType) {
        BlobInfo info = BlobInfo.newBuilder(BlobId.of(bucket, key))
                .setContentType(contentType)
                .build();
        storage.create(info, content);
        String url = "gs://" + bucket + "/" + key;
        log.debug("[GCS] uploaded {} bytes -> {}", content.length, url);
        return url;
    }

    @Override
    public boolean exists(String container) {
        return storage.get(container) != null;
    }

    @Override
    public void createContainerIfAbsent() {
        if (!exists(bucket)) {
            storage.create(BucketInfo.of(bucket));
            log.info("[GCS] created bucket {}", bucket);
        }
    }
}

package com.di.loannova.output;

/**
 * Object store that run artifacts are exported to.
 */
public interface CloudObjectStore {

    /**
     * Stores {@code content} under {@code key}, overwriting any existing object.
     *
     * @return the URL of the stored object
     */
    String upload(byte[] content, String key, String contentType);

    boolean exists(String container);

    void createContainerIfAbsent();
}

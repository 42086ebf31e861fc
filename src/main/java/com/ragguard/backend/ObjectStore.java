package com.ragguard.backend;

import java.io.IOException;
import java.util.Map;

/**
 * Binary object storage used for staging documents and splitting PDFs
 */
public interface ObjectStore {

    byte[] get(String key) throws IOException;

    void put(String key, byte[] content, String contentType, Map<String, String> metadata) throws IOException;

    void delete(String key) throws IOException;
}

package com.linkql.metadata.memory;

public class MetadataLoadException extends RuntimeException {
    public MetadataLoadException(String message) {
        super(message);
    }

    public MetadataLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}

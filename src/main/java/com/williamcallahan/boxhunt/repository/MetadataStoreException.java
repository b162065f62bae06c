/**
 * Exception thrown when the metadata store cannot be read or written
 *
 * @author William Callahan
 *
 * Features:
 * - Unchecked so it propagates through Reactor operators to the caller of a batch
 * - Wraps the underlying IOException as its cause
 */

package com.williamcallahan.boxhunt.repository;

public class MetadataStoreException extends RuntimeException {

    public MetadataStoreException(String message) {
        super(message);
    }

    public MetadataStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

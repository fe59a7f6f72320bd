package com.agentmanager.core.errors;

/**
 * Wraps a failure of the backing store.
 */
public class StorageException extends AgentManagerException {

    public StorageException(String message, Throwable cause) {
        super("STORAGE_FAILED", message, cause);
    }
}

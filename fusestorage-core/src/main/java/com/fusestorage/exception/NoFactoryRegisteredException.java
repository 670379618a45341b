package com.fusestorage.exception;

/**
 * Thrown when a manager is opened through the registry before any factory was registered.
 */
public class NoFactoryRegisteredException extends FuseStorageException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public NoFactoryRegisteredException(String message) {
        super(message);
    }
}

package com.gamearena.game;

/**
 * Thrown when a bundled or user-supplied game catalog cannot be loaded.
 */
public class CatalogException extends Exception {
    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.spectra.json;

import com.spectra.Location;

/**
 * Thrown when an AST cannot be written to or read from JSON.
 */
public class AstJsonException extends RuntimeException {
    private final Location location;

    public AstJsonException(String message) {
        this(message, null, null);
    }

    public AstJsonException(String message, Throwable cause) {
        this(message, null, cause);
    }

    /**
     * @param location source range of the node that could not be written
     */
    public AstJsonException(String message, Location location, Throwable cause) {
        super(message, cause);
        this.location = location;
    }

    /**
     * Source range of the offending node, or null when the failure is not tied to one
     * (e.g. malformed JSON input).
     */
    public Location location() {
        return location;
    }
}

package com.cstkit.json;

/**
 * Failure to write a tree to JSON or to read ranges back from it. Carries the
 * type of the node being written when there was one.
 */
public class CstJsonException extends RuntimeException {

    private final String nodeType;

    public CstJsonException(String message) {
        this(message, null, null);
    }

    public CstJsonException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public CstJsonException(String message, String nodeType, Throwable cause) {
        super(message, cause);
        this.nodeType = nodeType;
    }

    /** Type of the node that failed to serialize, or null when reading. */
    public String nodeType() {
        return nodeType;
    }
}

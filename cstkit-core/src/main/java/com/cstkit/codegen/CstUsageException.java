package com.cstkit.codegen;

/**
 * Thrown when a caller breaks the rendering or rewriting contract, such as
 * removing a node from a slot that requires it or popping an empty indent
 * stack. These are programming errors and abort the current pass.
 */
public class CstUsageException extends RuntimeException {

    public CstUsageException(String message) {
        super(message);
    }

    public CstUsageException(String message, Throwable cause) {
        super(message, cause);
    }
}

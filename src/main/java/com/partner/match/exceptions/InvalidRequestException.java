package com.partner.match.exceptions;

/**
 * Custom exception thrown when the engine is called in violation of its contract.
 * <p>
 * Raised for caller bugs such as a missing requester, a non-positive result limit or a
 * non-positive session duration. Legitimately empty inputs never raise it; they produce
 * empty results instead.
 * </p>
 */
public class InvalidRequestException extends RuntimeException {

    /**
     * Constructs a new InvalidRequestException with the specified detail message.
     *
     * @param message the detail message which explains the violated contract.
     */
    public InvalidRequestException(String message) {
        super(message);
    }
}

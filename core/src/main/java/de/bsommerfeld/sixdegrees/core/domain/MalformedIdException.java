package de.bsommerfeld.sixdegrees.core.domain;

/**
 * Thrown when an external identifier does not follow the
 * prefix-plus-digits format. This always signals a broken format assumption
 * and is never coerced into a soft null.
 */
public class MalformedIdException extends IllegalArgumentException {

    public MalformedIdException(String message) {
        super(message);
    }

    public MalformedIdException(String message, Throwable cause) {
        super(message, cause);
    }
}

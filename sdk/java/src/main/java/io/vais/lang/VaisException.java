package io.vais.lang;

/**
 * Base unchecked exception for the Vais SDK.
 */
public class VaisException extends RuntimeException {
    public VaisException(String message) {
        super(message);
    }
}

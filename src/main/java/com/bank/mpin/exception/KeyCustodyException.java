package com.bank.mpin.exception;

/**
 * The transport key pair could neither be loaded nor generated. Authenticated
 * traffic cannot be served without it.
 */
public class KeyCustodyException extends RuntimeException {

    public KeyCustodyException(String message, Throwable cause) {
        super(message, cause);
    }
}

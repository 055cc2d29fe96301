package com.bank.mpin.exception;

/**
 * User-correctable input problem: malformed phone number or missing fields.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }
}

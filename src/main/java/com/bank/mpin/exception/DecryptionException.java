package com.bank.mpin.exception;

/**
 * Raised for every transport decryption failure. The message is the same whatever
 * went wrong, so callers cannot tell a bad encoding from a bad padding.
 */
public class DecryptionException extends Exception {

    public static final String GENERIC_MESSAGE = "Invalid encrypted data";

    public DecryptionException(Throwable cause) {
        super(GENERIC_MESSAGE, cause);
    }
}

package com.bank.mpin.service;

import com.bank.mpin.exception.InvalidInputException;

/**
 * Phone numbers are identity keys once reduced to their digits.
 */
public final class PhoneNumbers {

    public static final int MIN_DIGITS = 10;
    public static final int MAX_DIGITS = 15;

    private PhoneNumbers() {}

    /**
     * Strip everything but ASCII digits and enforce the 10-15 digit length.
     *
     * @throws InvalidInputException if the input is missing or has the wrong number of digits
     */
    public static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidInputException("Phone number is required");
        }
        String digits = raw.replaceAll("[^0-9]", "");
        if (digits.length() < MIN_DIGITS || digits.length() > MAX_DIGITS) {
            throw new InvalidInputException("Invalid phone number format");
        }
        return digits;
    }

    /**
     * Log-safe form keeping only the last four digits.
     */
    public static String mask(String phone) {
        if (phone == null || phone.length() <= 4) {
            return "****";
        }
        return "*".repeat(phone.length() - 4) + phone.substring(phone.length() - 4);
    }
}

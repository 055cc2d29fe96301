package com.bank.mpin.model;

public record IssuedSession(String token, long expiresAt) {}

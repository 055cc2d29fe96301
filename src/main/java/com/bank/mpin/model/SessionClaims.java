package com.bank.mpin.model;

public record SessionClaims(String identityId, String phone, long issuedAt, long expiresAt) {}

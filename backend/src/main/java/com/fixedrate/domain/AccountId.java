package com.fixedrate.domain;

import java.util.Locale;

/**
 * Account identity (EVM-style address). Normalised to lowercase so lookups are case-insensitive.
 */
public record AccountId(String value) {

    public AccountId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("account address must not be blank");
        }
        value = value.trim().toLowerCase(Locale.ROOT);
    }

    public static AccountId of(String value) {
        return new AccountId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}

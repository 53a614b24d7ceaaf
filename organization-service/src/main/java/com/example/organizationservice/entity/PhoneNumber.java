package com.example.organizationservice.entity;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.regex.Pattern;

/**
 * International phone number: a plus sign followed by 6 to 15 digits.
 */
@Getter
@EqualsAndHashCode
public final class PhoneNumber {

    private static final Pattern FORMAT = Pattern.compile("\\+\\d{6,15}");

    private final String value;

    private PhoneNumber(String value) {
        this.value = value;
    }

    public static PhoneNumber of(String value) {
        if (value == null || !FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid phone number: " + value + ". Expected format +XXXXXXXXXX");
        }
        return new PhoneNumber(value);
    }

    @Override
    public String toString() {
        return value;
    }
}

package com.example.organizationservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception for input the API rejects after binding (HTTP 400).
 * The message is written for the client and returned as is.
 */
public class BadRequestException extends BaseException {

    public BadRequestException(String code, String message) {
        super(code, message, HttpStatus.BAD_REQUEST);
    }

    public static BadRequestException invalidSort(String message) {
        return new BadRequestException("INVALID_SORT", message);
    }

    public static BadRequestException invalidCoordinate(IllegalArgumentException cause) {
        return new BadRequestException("INVALID_COORDINATE", cause.getMessage());
    }

    public static BadRequestException invalidPhoneNumber(IllegalArgumentException cause) {
        return new BadRequestException("INVALID_PHONE_NUMBER", cause.getMessage());
    }

    public static BadRequestException invalidBoundingBox(IllegalArgumentException cause) {
        return new BadRequestException("INVALID_BOUNDING_BOX", cause.getMessage());
    }
}

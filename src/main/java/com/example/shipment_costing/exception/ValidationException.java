package com.example.shipment_costing.exception;

/**
 * Malformed or missing input. Nothing has been written when this is thrown.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}

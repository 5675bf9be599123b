package com.example.shipment_costing.exception;

/**
 * The shipment row lock could not be acquired in time. Safe to retry.
 */
public class ConcurrencyTimeoutException extends RuntimeException {

    public ConcurrencyTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}

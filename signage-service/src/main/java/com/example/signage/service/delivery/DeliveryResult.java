package com.example.signage.service.delivery;

/**
 * Tally of one fan-out: connections the event was handed to, and connections that
 * failed and were dropped.
 */
public record DeliveryResult(int success, int failure) {

    public static final DeliveryResult NONE = new DeliveryResult(0, 0);
}

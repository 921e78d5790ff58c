package com.openstay.stay.booking.domain.model;

public enum BookingStatus {
    DUE,
    PAID
}

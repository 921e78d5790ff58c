package com.openstay.stay.inventory.domain.model;

public enum ReleaseOutcome {
    /** One unit returned to the room type. */
    RELEASED,
    /** Room type was already at full capacity; nothing written. */
    CLAMPED
}

package com.openstay.stay.visit.domain.model;

public enum VisitStatus {
    PENDING,
    APPROVED,
    REJECTED
}

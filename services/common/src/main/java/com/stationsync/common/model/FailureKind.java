package com.stationsync.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a run's pipeline ended without delivering anything, or delivered only partially.
 */
public enum FailureKind {
    UNRESOLVABLE("unresolvable"),
    DEVICE_UNAVAILABLE("device_unavailable"),
    DATA_NOT_FOUND("data_not_found"),
    DATA_UNREADABLE("data_unreadable"),
    DELIVERY_FAILED("delivery_failed"),
    STOPPED("stopped"),
    UNEXPECTED("unexpected");

    private final String value;

    FailureKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static FailureKind fromValue(String value) {
        for (FailureKind kind : FailureKind.values()) {
            if (kind.value.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown failure kind: " + value);
    }
}

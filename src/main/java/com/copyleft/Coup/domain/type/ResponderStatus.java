package com.copyleft.Coup.domain.type;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ResponderStatus {
    PENDING,
    PASSED,
    CHALLENGED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}

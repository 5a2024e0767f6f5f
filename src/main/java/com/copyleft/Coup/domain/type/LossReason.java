package com.copyleft.Coup.domain.type;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;

@AllArgsConstructor
public enum LossReason {
    COUP("coup"),
    ASSASSINATED("assassinated"),
    FAILED_CHALLENGE("failed_challenge"), // 도전했으나 상대가 역할을 증명함
    LOST_CHALLENGE("lost_challenge");     // 허세가 도전에 걸림

    private final String wireName;

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}

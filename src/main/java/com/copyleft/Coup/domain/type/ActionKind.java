package com.copyleft.Coup.domain.type;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;

@AllArgsConstructor
public enum ActionKind {
    LOSE_INFLUENCE("loseInfluence"),
    TAX("tax"),
    FOREIGN_AID("foreign_aid"),
    ASSASSINATE("assassinate"),
    STEAL("steal"),
    EXCHANGE("exchange");

    private final String wireName;

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}

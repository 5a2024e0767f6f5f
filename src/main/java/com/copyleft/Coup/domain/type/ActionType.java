package com.copyleft.Coup.domain.type;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;

@Getter
@AllArgsConstructor
public enum ActionType {

    INCOME("income"),
    FOREIGN_AID("foreign_aid"),
    COUP("coup"),
    TAX("tax"),
    ASSASSINATE("assassinate"),
    STEAL("steal"),
    EXCHANGE("exchange");

    private final String wireName;

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static ActionType fromWire(String value) {
        if (value == null) return null;
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(value))
                .findFirst()
                .orElse(null);
    }
}

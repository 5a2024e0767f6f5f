package com.copyleft.Coup.domain.type;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;

@Getter
@AllArgsConstructor
public enum ResponseType {

    PASS("pass"),
    CHALLENGE("challenge"),
    BLOCK("block"),
    LOSE_INFLUENCE("loseInfluence"),
    EXCHANGE_CHOICE("exchangeChoice");

    private final String wireName;

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static ResponseType fromWire(String value) {
        if (value == null) return null;
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(value))
                .findFirst()
                .orElse(null);
    }
}

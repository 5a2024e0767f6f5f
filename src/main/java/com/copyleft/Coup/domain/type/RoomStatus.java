package com.copyleft.Coup.domain.type;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RoomStatus {
    LOBBY,
    PLAYING,
    ENDED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package com.copyleft.Coup.domain.type;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;

@AllArgsConstructor
public enum Stage {
    AWAITING_CHALLENGE("awaitingChallenge"),           // 행동 주장에 대한 도전 대기
    AWAITING_BLOCK("awaitingBlock"),                   // 차단 대기
    AWAITING_CHALLENGE_BLOCK("awaitingChallengeBlock"), // 차단 주장에 대한 도전 대기
    AWAITING_CHOICE("awaitingChoice");                 // 특정 플레이어의 선택 대기

    private final String wireName;

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}

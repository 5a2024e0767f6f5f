package com.copyleft.Coup.global.constant;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum ErrorCode {

    BAD_JOIN("플레이어 id가 필요합니다."),
    INVALID_ROOM_CODE("방 코드는 영문 대문자 4자리여야 합니다."),

    ROOM_FULL("방의 정원이 초과되었습니다."),
    GAME_IN_PROGRESS("이미 게임이 진행 중인 방입니다."),
    NOT_IN_ROOM("참가 중인 방이 없습니다."),
    ROOM_BUSY("방이 다른 요청을 처리 중입니다. 다시 시도해주세요."),

    NOT_HOST("방장만 게임을 시작할 수 있습니다."),
    NOT_ENOUGH_PLAYERS("게임 시작을 위해 최소 2명이 필요합니다."),
    START_FAILED("게임 시작 처리에 실패했습니다."),

    UNKNOWN_ERROR("알 수 없는 오류가 발생했습니다.");

    private final String message;
}

package com.copyleft.Coup.domain.type;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 엔진이 요청을 거절한 이유. 거절된 요청은 상태를 바꾸지 않는다.
 */
@Getter
@AllArgsConstructor
public enum RejectCode {

    UNKNOWN_PLAYER("Unknown player."),
    GAME_OVER("The game is already over."),
    ACTION_ALREADY_PENDING("Another action is still being resolved."),
    MUST_COUP("A player with 10 or more coins must Coup."),
    UNKNOWN_ACTION("Unknown action."),
    INVALID_TARGET("Invalid target."),
    INSUFFICIENT_COINS("Not enough coins."),

    NO_PENDING_ACTION("Nothing is waiting for a response."),
    NOT_A_RESPONDER("You cannot respond right now."),
    UNSUPPORTED_RESPONSE("That response is not allowed at this stage."),
    INVALID_BLOCK_ROLE("That role cannot block this action."),
    INVALID_CARD_INDEX("Choose one of your unrevealed cards."),
    INVALID_EXCHANGE_CHOICE("Invalid exchange choice."),

    // 엔진 바깥에서 방이 거절하는 경우
    NOT_YOUR_TURN("It is not your turn.");

    private final String message;
}

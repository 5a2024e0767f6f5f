package com.copyleft.Coup.feature.game;

/**
 * 플레이어 목록으로 게임을 만들 수 없을 때. 방 쪽에서 처리한다.
 */
public class GameSetupException extends RuntimeException {

    public GameSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}

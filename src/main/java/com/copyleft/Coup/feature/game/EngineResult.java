package com.copyleft.Coup.feature.game;

import com.copyleft.Coup.domain.type.RejectCode;
import com.copyleft.Coup.feature.game.dto.PrivateMessage;

import java.util.List;

/**
 * initiate/respond 호출 결과.
 *
 * @param log             최근 게임 로그 (보존 개수만큼)
 * @param privateMessages 수신자 한 명에게만 보내야 하는 메시지
 * @param rejection       거절된 요청이면 그 이유, 받아들여졌으면 null
 */
public record EngineResult(List<String> log, List<PrivateMessage> privateMessages, RejectCode rejection) {

    public boolean isAccepted() {
        return rejection == null;
    }
}

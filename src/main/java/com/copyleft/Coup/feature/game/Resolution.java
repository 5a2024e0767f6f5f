package com.copyleft.Coup.feature.game;

import com.copyleft.Coup.domain.type.RejectCode;
import com.copyleft.Coup.feature.game.dto.PrivateMessage;

import java.util.List;

/**
 * 엔진 내부 처리 결과. rejection이 있으면 상태는 바뀌지 않았다.
 */
record Resolution(List<PrivateMessage> privateMessages, RejectCode rejection) {

    static Resolution accepted() {
        return new Resolution(List.of(), null);
    }

    static Resolution accepted(List<PrivateMessage> privateMessages) {
        return new Resolution(List.copyOf(privateMessages), null);
    }

    static Resolution rejected(RejectCode code) {
        return new Resolution(List.of(), code);
    }

    boolean isRejected() {
        return rejection != null;
    }
}

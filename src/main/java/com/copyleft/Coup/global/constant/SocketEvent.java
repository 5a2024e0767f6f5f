package com.copyleft.Coup.global.constant;

public enum SocketEvent {
    STATE,            // 보는 사람별 방/게임 상태
    PRIVATE,          // 한 사람에게만 가는 메시지 (교환 선택지)

    ACTION_REJECTED,  // 규칙상 무시된 요청 (요청자에게만)
    LEAVE_SUCCESS,

    ERROR_MESSAGE
}

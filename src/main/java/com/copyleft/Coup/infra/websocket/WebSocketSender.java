package com.copyleft.Coup.infra.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

@Slf4j
@Component
@RequiredArgsConstructor
public class WebSocketSender {

    private final WebSocketSessionManager sessionManager;
    private final ObjectMapper objectMapper;

    public void sendEventToSession(String sessionId, Object event) {
        if (sessionId == null) return;

        WebSocketSession session = sessionManager.getSession(sessionId);
        if (session != null && session.isOpen()) {
            try {
                String payload = objectMapper.writeValueAsString(event);
                session.sendMessage(new TextMessage(payload));
                // 상태에는 본인 카드가 들어 있으므로 페이로드는 남기지 않는다
                log.debug("이벤트 전송 (1:1): [세션 ID: {}], [이벤트: {}]", sessionId, event.getClass().getSimpleName());
            } catch (IOException e) {
                log.error("1:1 이벤트 전송 실패: [세션 ID: {}], [오류: {}]", sessionId, e.getMessage());
            }
        } else {
            log.warn("세션을 찾을 수 없거나 닫혀있습니다: [세션 ID: {}]", sessionId);
        }
    }

    public void closeSession(String sessionId) {
        WebSocketSession session = sessionManager.getSession(sessionId);
        if (session == null || !session.isOpen()) return;
        try {
            session.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            log.warn("세션 종료 실패: [세션 ID: {}], [오류: {}]", sessionId, e.getMessage());
        }
    }
}

package com.copyleft.Coup.infra.websocket.handler;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.web.socket.WebSocketSession;

/**
 * action 이름 하나를 맡아 처리하는 명령 핸들러. 라우터가 getAction()으로 찾는다.
 */
public interface WebSocketCommandHandler {

    String getAction();

    void handle(WebSocketSession session, JsonNode payload);
}

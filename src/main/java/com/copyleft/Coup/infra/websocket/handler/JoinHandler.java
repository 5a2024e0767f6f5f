package com.copyleft.Coup.infra.websocket.handler;

import com.copyleft.Coup.feature.room.RoomService;
import com.copyleft.Coup.feature.room.dto.JoinRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

@Slf4j
@Component
@RequiredArgsConstructor
public class JoinHandler implements WebSocketCommandHandler {

    private final RoomService roomService;
    private final ObjectMapper objectMapper;

    @Override
    public String getAction() {
        return "JOIN";
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        try {
            JoinRequest dto = payload == null ? new JoinRequest() : objectMapper.treeToValue(payload, JoinRequest.class);
            roomService.join(session.getId(), dto);
        } catch (JsonProcessingException e) {
            log.warn("[JOIN] payload 형식 오류: session={}, msg={}", session.getId(), e.getMessage());
        }
    }
}

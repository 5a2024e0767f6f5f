package com.copyleft.Coup.infra.websocket.handler;

import com.copyleft.Coup.feature.room.RoomService;
import com.copyleft.Coup.feature.room.dto.RenameRequest;
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
public class RenameHandler implements WebSocketCommandHandler {

    private final RoomService roomService;
    private final ObjectMapper objectMapper;

    @Override
    public String getAction() {
        return "RENAME";
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        if (payload == null) return;
        try {
            roomService.rename(session.getId(), objectMapper.treeToValue(payload, RenameRequest.class));
        } catch (JsonProcessingException e) {
            log.warn("[RENAME] payload 형식 오류: session={}, msg={}", session.getId(), e.getMessage());
        }
    }
}

package com.copyleft.Coup.infra.websocket.handler;

import com.copyleft.Coup.feature.room.RoomService;
import com.copyleft.Coup.feature.room.dto.RespondRequest;
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
public class RespondHandler implements WebSocketCommandHandler {

    private final RoomService roomService;
    private final ObjectMapper objectMapper;

    @Override
    public String getAction() {
        return "RESPOND";
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        if (payload == null || !payload.has("responseType")) {
            log.warn("RESPOND 요청 오류: responseType 누락. session={}", session.getId());
            return;
        }
        try {
            roomService.respond(session.getId(), objectMapper.treeToValue(payload, RespondRequest.class));
        } catch (JsonProcessingException e) {
            log.warn("[RESPOND] payload 형식 오류: session={}, msg={}", session.getId(), e.getMessage());
        }
    }
}

package com.copyleft.Coup.infra.websocket.handler;

import com.copyleft.Coup.feature.room.RoomService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

@Component
@RequiredArgsConstructor
public class RematchHandler implements WebSocketCommandHandler {

    private final RoomService roomService;

    @Override
    public String getAction() {
        return "REMATCH";
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        roomService.rematch(session.getId());
    }
}

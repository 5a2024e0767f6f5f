package com.copyleft.Coup.infra.websocket;

import com.copyleft.Coup.feature.room.RoomResponseSender;
import com.copyleft.Coup.feature.room.RoomService;
import com.copyleft.Coup.global.constant.ErrorCode;
import com.copyleft.Coup.infra.websocket.dto.WebSocketRequest;
import com.copyleft.Coup.infra.websocket.handler.WebSocketCommandHandler;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Component
public class WebSocketRouterHandler extends TextWebSocketHandler {

    private final WebSocketSessionManager sessionManager;
    private final ObjectMapper objectMapper;
    private final RoomService roomService;
    private final RoomResponseSender responseSender;

    private final Map<String, WebSocketCommandHandler> handlerMap;

    public WebSocketRouterHandler(
            WebSocketSessionManager sessionManager,
            ObjectMapper objectMapper,
            RoomService roomService,
            RoomResponseSender responseSender,
            List<WebSocketCommandHandler> handlers
    ) {
        this.sessionManager = sessionManager;
        this.objectMapper = objectMapper;
        this.roomService = roomService;
        this.responseSender = responseSender;
        this.handlerMap = handlers.stream()
                .collect(Collectors.toMap(WebSocketCommandHandler::getAction, Function.identity()));
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        log.info("새로운 세션 연결: {}", session.getId());
        sessionManager.registerSession(session);
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, TextMessage message) {
        WebSocketRequest request;
        try {
            request = objectMapper.readValue(message.getPayload(), WebSocketRequest.class);
        } catch (JsonProcessingException e) {
            log.warn("잘못된 메시지 형식: session={}, msg={}", session.getId(), e.getMessage());
            return;
        }

        String action = request.action();
        log.info("Action 수신: {}, Session: {}", action, session.getId());

        WebSocketCommandHandler handler = action == null ? null : handlerMap.get(action);
        if (handler == null) {
            log.warn("알 수 없는 Action 입니다: {}", action);
            return;
        }

        try {
            handler.handle(session, request.payload());
        } catch (RuntimeException e) {
            log.error("메시지 처리 중 오류: action={}, msg={}", action, e.getMessage(), e);
            responseSender.sendError(session.getId(), ErrorCode.UNKNOWN_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, @NonNull CloseStatus status) {
        log.info("세션 연결 종료: {} (사유: {})", session.getId(), status);
        sessionManager.removeSession(session);
        roomService.disconnect(session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("전송 오류 발생: [세션 ID: {}], [오류: {}]", session.getId(), exception.getMessage());
    }
}

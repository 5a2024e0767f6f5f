package com.copyleft.Coup.infra.websocket.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 클라이언트 명령. payload 구조는 action마다 다르다.
 */
public record WebSocketRequest(String action, JsonNode payload) {}

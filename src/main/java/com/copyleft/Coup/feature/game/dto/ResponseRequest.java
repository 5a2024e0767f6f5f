package com.copyleft.Coup.feature.game.dto;

public record ResponseRequest(String playerId, String responseType, ResponsePayload payload) {

    public ResponseRequest {
        if (payload == null) {
            payload = ResponsePayload.empty();
        }
    }

    public static ResponseRequest of(String playerId, String responseType) {
        return new ResponseRequest(playerId, responseType, ResponsePayload.empty());
    }
}

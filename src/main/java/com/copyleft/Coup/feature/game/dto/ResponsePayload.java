package com.copyleft.Coup.feature.game.dto;

import java.util.List;

/**
 * 응답 종류에 따라 하나만 채워진다. block은 role, loseInfluence는 cardIndex, exchangeChoice는 keep.
 */
public record ResponsePayload(String role, Integer cardIndex, List<String> keep) {

    public static ResponsePayload empty() {
        return new ResponsePayload(null, null, null);
    }

    public static ResponsePayload block(String role) {
        return new ResponsePayload(role, null, null);
    }

    public static ResponsePayload cardIndex(int cardIndex) {
        return new ResponsePayload(null, cardIndex, null);
    }

    public static ResponsePayload keep(List<String> keep) {
        return new ResponsePayload(null, null, keep);
    }
}

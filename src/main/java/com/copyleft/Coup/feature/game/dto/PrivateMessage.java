package com.copyleft.Coup.feature.game.dto;

import com.copyleft.Coup.domain.exchange.ExchangeOffer;

/**
 * recipientId 한 사람에게만 전달해야 하는 메시지. 절대 방 전체에 뿌리지 않는다.
 */
public record PrivateMessage(String recipientId, String kind, ExchangeOffer offer) {

    public static final String EXCHANGE_OPTIONS = "exchangeOptions";

    public static PrivateMessage exchangeOptions(String recipientId, ExchangeOffer offer) {
        return new PrivateMessage(recipientId, EXCHANGE_OPTIONS, offer);
    }
}

package com.copyleft.Coup.domain.exchange;

import com.copyleft.Coup.domain.type.Role;

import java.util.List;

/**
 * 교환하는 본인에게만 전달되는 선택지 목록.
 */
public record ExchangeOffer(int keepCount, List<OfferedOption> options) {

    public record OfferedOption(String id, Role role) {}

    public static ExchangeOffer from(ExchangeSecret secret) {
        return new ExchangeOffer(
                secret.keepCount(),
                secret.options().stream()
                        .map(o -> new OfferedOption(o.id(), o.role()))
                        .toList()
        );
    }
}

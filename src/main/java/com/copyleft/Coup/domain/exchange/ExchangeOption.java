package com.copyleft.Coup.domain.exchange;

import com.copyleft.Coup.domain.type.Role;

/**
 * 교환 선택지 하나. id는 손패 위치와 무관한 합성 식별자다.
 */
public record ExchangeOption(String id, Role role, Source source) {

    public enum Source {
        HAND,
        DRAWN
    }
}

package com.copyleft.Coup.domain.exchange;

import java.util.List;

/**
 * 서버만 아는 교환 정보. 공개 상태에는 절대 포함하지 않는다.
 */
public record ExchangeSecret(int keepCount, List<ExchangeOption> options) {

    public ExchangeSecret {
        options = List.copyOf(options);
    }
}

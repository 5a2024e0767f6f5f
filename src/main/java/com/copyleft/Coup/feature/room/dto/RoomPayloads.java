package com.copyleft.Coup.feature.room.dto;

import com.copyleft.Coup.domain.exchange.ExchangeOffer;
import com.copyleft.Coup.domain.type.RoomStatus;
import com.copyleft.Coup.domain.view.GameView;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

public class RoomPayloads {

    // 보는 사람별 방 상태
    @Getter
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RoomState {
        private String room;
        private String youId;
        private String hostId;
        private RoomStatus phase;
        private List<MemberInfo> members;
        private GameView game; // 로비에서는 null
    }

    @Getter
    @Builder
    public static class MemberInfo {
        private String id;
        private String name;
        private boolean host;
    }

    // 한 사람에게만 보내는 비공개 정보
    @Getter
    @Builder
    public static class PrivateInfo {
        private String kind;
        private ExchangeOffer offer;
    }
}

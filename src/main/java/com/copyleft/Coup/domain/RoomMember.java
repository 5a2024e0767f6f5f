package com.copyleft.Coup.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@ToString
@AllArgsConstructor
public class RoomMember {

    private final String id;  // 재접속해도 유지되는 플레이어 id
    private String name;      // 표시용 이름
    private String sessionId; // 현재 연결된 세션 (재접속 시 교체)

    public Seat toSeat() {
        return new Seat(id, name);
    }
}

package com.copyleft.Coup.feature.room.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class JoinRequest {
    private String room; // 방 코드
    private String id;   // 재접속해도 유지되는 플레이어 id
    private String name;
}

package com.copyleft.Coup.feature.room.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class TakeActionRequest {
    private String actionType;
    private String targetId; // 대상이 없는 행동이면 null
}

package com.copyleft.Coup.feature.room.dto;

import com.copyleft.Coup.feature.game.dto.ResponsePayload;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class RespondRequest {
    private String responseType;
    private ResponsePayload payload;
}

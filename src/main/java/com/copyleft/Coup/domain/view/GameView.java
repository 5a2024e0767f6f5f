package com.copyleft.Coup.domain.view;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class GameView {
    private List<PlayerView> players;
    private List<String> log;
    private PendingActionView pendingAction; // 진행 중인 협상이 없으면 null
    private String turnPlayerId;
    private boolean gameOver;
    private String winnerId;
}

package com.copyleft.Coup.feature.game.dto;

/**
 * actionType은 income, foreign_aid, coup, tax, assassinate, steal, exchange 중 하나.
 * targetId는 대상이 필요한 행동에서만 쓴다.
 */
public record ActionRequest(String actorId, String actionType, String targetId) {}

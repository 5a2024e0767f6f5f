package com.copyleft.Coup.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "game.rule")
public record GameProperties(
        // 방 설정
        int maxPlayerCount,    // 방 최대 인원 (기본 8명)
        int minPlayerCount,    // 게임 시작 최소 인원 (기본 2명)
        int roomCodeLength,    // 방 코드 길이 (영문 대문자)

        // 이름 설정
        int nameMaxLength,
        String defaultPlayerName,

        // 상태 전송 시 남기는 게임 로그 수
        int logRetention
) {}

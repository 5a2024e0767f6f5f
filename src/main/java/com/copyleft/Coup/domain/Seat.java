package com.copyleft.Coup.domain;

/**
 * 게임에 참가하는 플레이어의 id와 표시 이름. 목록 순서가 턴 순서가 된다.
 */
public record Seat(String id, String name) {}

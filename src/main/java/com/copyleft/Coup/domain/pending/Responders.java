package com.copyleft.Coup.domain.pending;

import com.copyleft.Coup.domain.Player;
import com.copyleft.Coup.domain.type.ResponderStatus;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 현재 단계에서 응답할 수 있는 플레이어와 각자의 응답 상태.
 * 입력 순서를 유지하므로 도전자가 여럿이면 먼저 기록된 쪽이 우선한다.
 */
@ToString
public class Responders {

    private final Map<String, ResponderStatus> entries = new LinkedHashMap<>();
    private String firstChallenger;

    private Responders() {
    }

    /**
     * 살아 있는 플레이어 중 excludeId를 제외한 전원.
     */
    public static Responders everyoneAliveExcept(List<Player> players, String excludeId) {
        Responders responders = new Responders();
        for (Player p : players) {
            if (Objects.equals(p.getId(), excludeId) || !p.isAlive()) continue;
            responders.entries.put(p.getId(), ResponderStatus.PENDING);
        }
        return responders;
    }

    public static Responders only(String playerId) {
        Responders responders = new Responders();
        responders.entries.put(playerId, ResponderStatus.PENDING);
        return responders;
    }

    public boolean contains(String playerId) {
        return entries.containsKey(playerId);
    }

    public void markPassed(String playerId) {
        entries.put(playerId, ResponderStatus.PASSED);
    }

    public void markChallenged(String playerId) {
        entries.put(playerId, ResponderStatus.CHALLENGED);
        if (firstChallenger == null) {
            firstChallenger = playerId;
        }
    }

    public Optional<String> firstChallenger() {
        return Optional.ofNullable(firstChallenger);
    }

    public boolean allPassed() {
        return entries.values().stream().allMatch(s -> s == ResponderStatus.PASSED);
    }

    public Map<String, ResponderStatus> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }
}

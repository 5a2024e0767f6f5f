package com.copyleft.Coup.domain.type;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;

@Getter
@AllArgsConstructor
public enum Role {

    DUKE("Duke"),             // 세금, 해외 원조 차단
    ASSASSIN("Assassin"),     // 암살
    CAPTAIN("Captain"),       // 강탈, 강탈 차단
    AMBASSADOR("Ambassador"), // 교환, 강탈 차단
    CONTESSA("Contessa");     // 암살 차단

    public static final int COPIES_PER_ROLE = 3;

    private final String displayName;

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    /**
     * 표시 이름 또는 enum 이름으로 역할을 찾는다. 대소문자는 구분하지 않는다.
     * 일치하는 역할이 없으면 null.
     */
    public static Role fromName(String name) {
        if (name == null) return null;
        String trimmed = name.trim();
        return Arrays.stream(values())
                .filter(r -> r.displayName.equalsIgnoreCase(trimmed) || r.name().equalsIgnoreCase(trimmed))
                .findFirst()
                .orElse(null);
    }
}

package com.copyleft.Coup.domain;

import com.copyleft.Coup.domain.type.Role;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

@Getter
@ToString
public class Card {

    private final Role role;
    private boolean revealed;

    public Card(Role role) {
        this.role = Objects.requireNonNull(role, "role");
        this.revealed = false;
    }

    // 한 번 공개된 카드는 다시 숨겨지지 않는다.
    public void reveal() {
        this.revealed = true;
    }
}

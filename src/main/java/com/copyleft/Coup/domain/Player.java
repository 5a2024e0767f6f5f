package com.copyleft.Coup.domain;

import com.copyleft.Coup.domain.type.Role;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.IntStream;

@Getter
@ToString(exclude = "influence")
public class Player {

    private final String id;

    @Setter
    private String name;

    private int coins;

    // 슬롯 순서가 곧 카드 인덱스다. 카드를 잃을 때 인덱스로 지정한다.
    @Getter(AccessLevel.NONE)
    private final List<Card> influence = new ArrayList<>(2);

    public Player(String id, String name, int startingCoins) {
        this.id = id;
        this.name = name;
        this.coins = startingCoins;
    }

    public List<Card> getInfluence() {
        return Collections.unmodifiableList(influence);
    }

    public void addCoins(int amount) {
        this.coins += amount;
    }

    public void spendCoins(int amount) {
        this.coins -= amount;
    }

    public boolean isAlive() {
        return influence.stream().anyMatch(c -> !c.isRevealed());
    }

    public boolean holds(Role role) {
        return influence.stream().anyMatch(c -> !c.isRevealed() && c.getRole() == role);
    }

    public List<Integer> unrevealedSlots() {
        return IntStream.range(0, influence.size())
                .filter(i -> !influence.get(i).isRevealed())
                .boxed()
                .toList();
    }

    void receive(Card card) {
        influence.add(card);
    }

    void replace(int slot, Card card) {
        influence.set(slot, card);
    }
}

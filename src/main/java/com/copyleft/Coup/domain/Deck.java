package com.copyleft.Coup.domain;

import com.copyleft.Coup.domain.type.Role;
import com.copyleft.Coup.global.util.RandomUtil;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * 역할 카드 더미. 뽑기는 맨 뒤에서, 되돌린 카드는 맨 앞에 넣은 뒤 전체를 섞는다.
 * <p>
 * 더미가 비어 있을 때 뽑으면 버린 카드를 모으지 않고 15장짜리 새 더미를 만든다.
 * 이때 역할별 장수가 일시적으로 3장을 넘을 수 있다.
 */
public class Deck {

    private final List<Role> cards;
    private final Random random;

    private Deck(List<Role> cards, Random random) {
        this.cards = cards;
        this.random = random;
    }

    public static Deck standard() {
        return standard(RandomUtil.random());
    }

    public static Deck standard(Random random) {
        Deck deck = new Deck(fullSet(), random);
        Collections.shuffle(deck.cards, random);
        return deck;
    }

    /**
     * 순서가 고정된 더미. 마지막 원소가 가장 먼저 뽑힌다.
     */
    public static Deck of(List<Role> drawOrderReversed, Random random) {
        return new Deck(new ArrayList<>(drawOrderReversed), random);
    }

    public Role draw() {
        if (cards.isEmpty()) {
            cards.addAll(fullSet());
            Collections.shuffle(cards, random);
        }
        return cards.remove(cards.size() - 1);
    }

    public void returnCards(Collection<Role> roles) {
        for (Role role : roles) {
            cards.add(0, role);
        }
        Collections.shuffle(cards, random);
    }

    public int size() {
        return cards.size();
    }

    public List<Role> contents() {
        return List.copyOf(cards);
    }

    private static List<Role> fullSet() {
        List<Role> set = new ArrayList<>(Role.values().length * Role.COPIES_PER_ROLE);
        for (Role role : Role.values()) {
            for (int i = 0; i < Role.COPIES_PER_ROLE; i++) {
                set.add(role);
            }
        }
        return set;
    }
}

package com.copyleft.Coup.domain;

import com.copyleft.Coup.domain.exchange.ExchangeSecret;
import com.copyleft.Coup.domain.pending.PendingAction;
import com.copyleft.Coup.domain.type.Role;
import com.copyleft.Coup.domain.view.CardView;
import com.copyleft.Coup.domain.view.GameView;
import com.copyleft.Coup.domain.view.PlayerView;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 한 판의 권위 있는 게임 상태. 숨겨진 카드와 비공개 교환 정보를 모두 소유한다.
 * <p>
 * 한 게임 안에서는 요청을 하나씩 순서대로 처리한다고 가정하며, 스스로 동기화하지 않는다.
 */
@Getter
public class Game {

    public static final int MIN_PLAYERS = 2;
    public static final int MAX_PLAYERS = 8;
    public static final int STARTING_COINS = 2;
    public static final int CARDS_PER_PLAYER = 2;

    private final List<Player> players;

    @Getter(AccessLevel.NONE)
    private final Deck deck;

    @Getter(AccessLevel.NONE)
    private final List<String> log = new ArrayList<>();

    private int turnIndex;
    private PendingAction pendingAction;
    private boolean gameOver;
    private String winnerId;

    @Getter(AccessLevel.NONE)
    private final Map<String, ExchangeSecret> exchangeSecrets = new HashMap<>();

    private Game(List<Player> players, Deck deck) {
        this.players = players;
        this.deck = deck;
        this.turnIndex = 0;
    }

    public static Game start(List<Seat> seats) {
        return start(seats, Deck.standard());
    }

    /**
     * 좌석 순서대로 턴이 돈다.
     *
     * @throws IllegalArgumentException 플레이어 목록이 비었거나 인원이 맞지 않거나 id가 비었거나 중복일 때
     */
    public static Game start(List<Seat> seats, Deck deck) {
        validateSeats(seats);
        Objects.requireNonNull(deck, "deck");

        List<Player> players = new ArrayList<>(seats.size());
        for (Seat seat : seats) {
            players.add(new Player(seat.id(), seat.name(), STARTING_COINS));
        }

        Game game = new Game(Collections.unmodifiableList(players), deck);
        for (Player p : players) {
            for (int i = 0; i < CARDS_PER_PLAYER; i++) {
                p.receive(new Card(game.drawOne()));
            }
        }

        game.appendLog("Game started. Each player has 2 influence and 2 coins.");
        game.currentPlayer().ifPresent(cp -> game.appendLog("It is now " + cp.getName() + "'s turn."));
        return game;
    }

    private static void validateSeats(List<Seat> seats) {
        if (seats == null || seats.isEmpty()) {
            throw new IllegalArgumentException("No players to start a game with");
        }
        if (seats.size() < MIN_PLAYERS || seats.size() > MAX_PLAYERS) {
            throw new IllegalArgumentException(
                    "Player count must be between " + MIN_PLAYERS + " and " + MAX_PLAYERS + ": " + seats.size());
        }
        Set<String> ids = new HashSet<>();
        for (Seat seat : seats) {
            if (seat == null || seat.id() == null || seat.id().isBlank()) {
                throw new IllegalArgumentException("Player id must not be blank");
            }
            if (!ids.add(seat.id())) {
                throw new IllegalArgumentException("Duplicate player id: " + seat.id());
            }
        }
    }

    // ---- 조회 ----

    public Optional<Player> findPlayer(String playerId) {
        if (playerId == null) return Optional.empty();
        return players.stream().filter(p -> p.getId().equals(playerId)).findFirst();
    }

    public boolean isAlive(String playerId) {
        return findPlayer(playerId).map(Player::isAlive).orElse(false);
    }

    public List<Player> alivePlayers() {
        return players.stream().filter(Player::isAlive).toList();
    }

    public boolean playerHasRole(String playerId, Role role) {
        return findPlayer(playerId).map(p -> p.holds(role)).orElse(false);
    }

    public String nameOf(String playerId) {
        return findPlayer(playerId).map(Player::getName).orElse(playerId);
    }

    public Optional<Player> currentPlayer() {
        if (gameOver) return Optional.empty();
        for (int step = 0; step < players.size(); step++) {
            Player p = players.get((turnIndex + step) % players.size());
            if (p.isAlive()) return Optional.of(p);
        }
        return Optional.empty();
    }

    public boolean hasPendingAction() {
        return pendingAction != null;
    }

    public void setPendingAction(PendingAction pendingAction) {
        this.pendingAction = pendingAction;
    }

    public void appendLog(String line) {
        log.add(line);
    }

    public List<String> getLog() {
        return Collections.unmodifiableList(log);
    }

    public List<String> recentLog(int limit) {
        int from = Math.max(0, log.size() - limit);
        return List.copyOf(log.subList(from, log.size()));
    }

    // ---- 더미 ----

    public Role drawOne() {
        return deck.draw();
    }

    public void returnToDeck(Collection<Role> roles) {
        deck.returnCards(roles);
    }

    public List<Role> deckContents() {
        return deck.contents();
    }

    // ---- 카드 변경 ----

    /**
     * 주장한 역할 카드를 보여 증명한 뒤 더미에 되돌리고 같은 자리에 새 카드를 숨겨서 받는다.
     *
     * @return 해당 역할의 숨겨진 카드가 없으면 false. 호출 전에 보유를 확인하므로 정상 흐름에서는 일어나지 않는다.
     */
    public boolean revealAndRedraw(String playerId, Role role) {
        Player p = findPlayer(playerId).orElse(null);
        if (p == null) return false;

        List<Card> hand = p.getInfluence();
        for (int slot = 0; slot < hand.size(); slot++) {
            Card card = hand.get(slot);
            if (card.isRevealed() || card.getRole() != role) continue;

            card.reveal();
            appendLog(p.getName() + " reveals " + role.getDisplayName() + ".");

            returnToDeck(List.of(role));
            p.replace(slot, new Card(drawOne()));
            appendLog(p.getName() + " draws a replacement influence.");
            return true;
        }
        return false;
    }

    /**
     * 지정한 슬롯의 숨겨진 카드를 공개한다. 범위를 벗어나거나 이미 공개된 슬롯이면 false.
     */
    public boolean loseInfluence(String playerId, Integer cardIndex) {
        Player p = findPlayer(playerId).orElse(null);
        if (p == null || cardIndex == null) return false;
        if (cardIndex < 0 || cardIndex >= p.getInfluence().size()) return false;

        Card card = p.getInfluence().get(cardIndex);
        if (card.isRevealed()) return false;

        card.reveal();
        appendLog(p.getName() + " loses influence (" + card.getRole().getDisplayName() + " revealed).");
        checkWin();
        return true;
    }

    /**
     * 교환에서 고른 역할로 숨겨진 슬롯들을 원래 순서대로 교체한다.
     */
    public void replaceHiddenCards(String playerId, List<Role> kept) {
        Player p = findPlayer(playerId).orElseThrow();
        List<Integer> slots = p.unrevealedSlots();
        if (slots.size() != kept.size()) {
            throw new IllegalStateException("Hidden slot count " + slots.size() + " does not match kept " + kept.size());
        }
        for (int k = 0; k < slots.size(); k++) {
            p.replace(slots.get(k), new Card(kept.get(k)));
        }
    }

    // ---- 턴 ----

    /** 진행 중인 협상을 지우고 다음 턴으로 넘긴다. */
    public void finishTurn() {
        this.pendingAction = null;
        nextTurn();
    }

    public void nextTurn() {
        checkWin();
        if (gameOver) return;

        for (int step = 0; step < players.size(); step++) {
            turnIndex = (turnIndex + 1) % players.size();
            if (players.get(turnIndex).isAlive()) break;
        }

        currentPlayer().ifPresent(cp -> appendLog("It is now " + cp.getName() + "'s turn."));
    }

    public void checkWin() {
        if (gameOver) return;

        List<Player> alive = alivePlayers();
        if (alive.size() == 1) {
            gameOver = true;
            winnerId = alive.get(0).getId();
            appendLog(alive.get(0).getName() + " wins!");
        }
    }

    // ---- 비공개 교환 정보 ----

    public void storeExchangeSecret(String actorId, ExchangeSecret secret) {
        exchangeSecrets.put(actorId, secret);
    }

    public Optional<ExchangeSecret> findExchangeSecret(String actorId) {
        return Optional.ofNullable(exchangeSecrets.get(actorId));
    }

    public void removeExchangeSecret(String actorId) {
        exchangeSecrets.remove(actorId);
    }

    // ---- 보는 사람별 상태 ----

    /**
     * viewerId 기준으로 본 상태. 숨겨진 카드는 본인에게만 역할이 보이고, 공개된 카드는 모두에게 보인다.
     * viewerId가 null이면 숨겨진 카드는 하나도 보이지 않는다.
     */
    public GameView viewFor(String viewerId, int logRetention) {
        List<PlayerView> playerViews = players.stream()
                .map(p -> new PlayerView(
                        p.getId(),
                        p.getName(),
                        p.getCoins(),
                        p.isAlive(),
                        p.getInfluence().stream()
                                .map(c -> cardViewFor(c, p.getId().equals(viewerId)))
                                .toList()))
                .toList();

        return GameView.builder()
                .players(playerViews)
                .log(recentLog(logRetention))
                .pendingAction(pendingAction == null ? null : pendingAction.toView())
                .turnPlayerId(currentPlayer().map(Player::getId).orElse(null))
                .gameOver(gameOver)
                .winnerId(winnerId)
                .build();
    }

    private static CardView cardViewFor(Card card, boolean owner) {
        if (card.isRevealed() || owner) {
            return new CardView.Visible(card.getRole(), card.isRevealed());
        }
        return new CardView.Hidden();
    }
}

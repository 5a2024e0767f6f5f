package com.copyleft.Coup.domain;

import com.copyleft.Coup.domain.type.Role;
import com.copyleft.Coup.domain.view.CardView;
import com.copyleft.Coup.domain.view.GameView;
import com.copyleft.Coup.domain.view.PlayerView;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.copyleft.Coup.feature.game.GameFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class GameTest {

    @Test
    @DisplayName("게임을 시작하면 모두 2코인과 숨겨진 카드 2장을 받는다")
    void start_DealsTwoCardsAndTwoCoins() {
        // when
        Game game = Game.start(List.of(new Seat("a", "Alice"), new Seat("b", "Bob"), new Seat("c", "Carol")));

        // then
        for (Player p : game.getPlayers()) {
            assertEquals(2, p.getCoins());
            assertEquals(2, p.getInfluence().size());
            assertTrue(p.getInfluence().stream().noneMatch(Card::isRevealed));
        }
        assertEquals(15 - 6, game.deckContents().size());
        assertEquals("a", game.currentPlayer().orElseThrow().getId());
        assertEquals(List.of(
                "Game started. Each player has 2 influence and 2 coins.",
                "It is now Alice's turn."), game.getLog());
    }

    @Test
    @DisplayName("플레이어 목록이 잘못되면 게임을 만들지 않는다")
    void start_InvalidSeats_Throws() {
        List<Seat> nine = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            nine.add(new Seat("p" + i, "P" + i));
        }

        assertThrows(IllegalArgumentException.class, () -> Game.start(null));
        assertThrows(IllegalArgumentException.class, () -> Game.start(List.of()));
        assertThrows(IllegalArgumentException.class, () -> Game.start(List.of(new Seat("a", "Alice"))));
        assertThrows(IllegalArgumentException.class, () -> Game.start(nine));
        assertThrows(IllegalArgumentException.class,
                () -> Game.start(List.of(new Seat("a", "Alice"), new Seat(" ", "Bob"))));
        assertThrows(IllegalArgumentException.class,
                () -> Game.start(List.of(new Seat("a", "Alice"), new Seat("a", "Bob"))));
    }

    @Test
    @DisplayName("보는 사람은 자기 카드와 공개된 카드만 볼 수 있다")
    void viewFor_HidesOtherPlayersUnrevealedCards() {
        // given
        Game game = twoPlayers(List.of(Role.DUKE, Role.CAPTAIN), List.of(Role.CONTESSA, Role.ASSASSIN));
        game.loseInfluence("p2", 1);

        // when
        GameView view = game.viewFor("p1", 80);

        // then
        PlayerView me = view.getPlayers().get(0);
        assertEquals(new CardView.Visible(Role.DUKE, false), me.influence().get(0));
        assertEquals(new CardView.Visible(Role.CAPTAIN, false), me.influence().get(1));

        PlayerView other = view.getPlayers().get(1);
        assertInstanceOf(CardView.Hidden.class, other.influence().get(0));
        assertEquals(new CardView.Visible(Role.ASSASSIN, true), other.influence().get(1));
    }

    @Test
    @DisplayName("보는 사람이 없으면 숨겨진 카드는 하나도 보이지 않는다")
    void viewFor_NullViewer_SeesNoHiddenRole() {
        // given
        Game game = twoPlayers(List.of(Role.DUKE, Role.CAPTAIN), List.of(Role.CONTESSA, Role.ASSASSIN));

        // when
        GameView view = game.viewFor(null, 80);

        // then
        view.getPlayers().forEach(p ->
                p.influence().forEach(c -> assertInstanceOf(CardView.Hidden.class, c)));
    }

    @Test
    @DisplayName("직렬화된 상태에도 남의 숨겨진 역할 이름은 들어가지 않는다")
    void viewFor_Json_DoesNotLeakRoles() throws Exception {
        // given
        Game game = twoPlayers(List.of(Role.DUKE, Role.DUKE), List.of(Role.CONTESSA, Role.CONTESSA));
        ObjectMapper objectMapper = new ObjectMapper();

        // when
        JsonNode json = objectMapper.valueToTree(game.viewFor("p1", 80));

        // then
        JsonNode otherCards = json.get("players").get(1).get("influence");
        for (JsonNode card : otherCards) {
            assertEquals("hidden", card.get("kind").asText());
            assertFalse(card.has("role"));
        }
        assertFalse(json.toString().contains("Contessa"));
        assertTrue(json.get("players").get(0).get("influence").get(0).get("role").asText().equals("Duke"));
    }

    @Test
    @DisplayName("로그는 최근 N줄만 담는다")
    void viewFor_TrimsLog() {
        // given
        Game game = twoPlayers(List.of(Role.DUKE, Role.CAPTAIN), List.of(Role.CONTESSA, Role.ASSASSIN));
        for (int i = 0; i < 10; i++) {
            game.appendLog("line " + i);
        }

        // when
        GameView view = game.viewFor("p1", 3);

        // then
        assertEquals(List.of("line 7", "line 8", "line 9"), view.getLog());
    }

    @Test
    @DisplayName("범위를 벗어나거나 이미 공개된 카드는 잃을 수 없다")
    void loseInfluence_InvalidIndex_ReturnsFalse() {
        // given
        Game game = twoPlayers(List.of(Role.DUKE, Role.CAPTAIN), List.of(Role.CONTESSA, Role.ASSASSIN));

        // when & then
        assertFalse(game.loseInfluence("p1", -1));
        assertFalse(game.loseInfluence("p1", 2));
        assertFalse(game.loseInfluence("p1", null));
        assertFalse(game.loseInfluence("nobody", 0));

        assertTrue(game.loseInfluence("p1", 0));
        assertFalse(game.loseInfluence("p1", 0));
        assertTrue(player(game, "p1").getInfluence().get(0).isRevealed());
        assertTrue(game.getLog().contains("Alice loses influence (Duke revealed)."));
    }

    @Test
    @DisplayName("한 명만 남으면 게임이 끝나고 승자가 정해진다")
    void loseInfluence_LastOpponent_EndsGame() {
        // given
        Game game = twoPlayers(List.of(Role.DUKE, Role.CAPTAIN), List.of(Role.CONTESSA, Role.ASSASSIN));

        // when
        game.loseInfluence("p2", 0);
        game.loseInfluence("p2", 1);

        // then
        assertTrue(game.isGameOver());
        assertEquals("p1", game.getWinnerId());
        assertTrue(game.getLog().contains("Alice wins!"));
        assertTrue(game.currentPlayer().isEmpty());
    }

    @Test
    @DisplayName("턴은 탈락한 플레이어를 건너뛴다")
    void finishTurn_SkipsEliminatedPlayers() {
        // given
        Game game = threePlayers(
                List.of(Role.DUKE, Role.CAPTAIN),
                List.of(Role.CONTESSA, Role.ASSASSIN),
                List.of(Role.AMBASSADOR, Role.DUKE));
        game.loseInfluence("p2", 0);
        game.loseInfluence("p2", 1);

        // when
        game.finishTurn();

        // then
        assertEquals("p3", game.currentPlayer().orElseThrow().getId());
        assertTrue(game.getLog().contains("It is now Carol's turn."));

        // when
        game.finishTurn();

        // then
        assertEquals("p1", game.currentPlayer().orElseThrow().getId());
    }

    @Test
    @DisplayName("증명한 카드는 공개 후 더미로 돌아가고 같은 자리에 새 카드를 받는다")
    void revealAndRedraw_ReplacesSameSlot() {
        // given
        Game game = twoPlayers(List.of(Role.CAPTAIN, Role.DUKE), List.of(Role.CONTESSA, Role.ASSASSIN));
        Card before = player(game, "p1").getInfluence().get(1);

        // when
        boolean proven = game.revealAndRedraw("p1", Role.DUKE);

        // then
        assertTrue(proven);
        Card after = player(game, "p1").getInfluence().get(1);
        assertNotSame(before, after);
        assertFalse(after.isRevealed());
        assertEquals(Role.CAPTAIN, player(game, "p1").getInfluence().get(0).getRole());
        assertTrue(game.getLog().contains("Alice reveals Duke."));
        assertTrue(game.getLog().contains("Alice draws a replacement influence."));
        roleCounts(game).values().forEach(n -> assertEquals(3, n));
    }

    @Test
    @DisplayName("가지고 있지 않은 역할은 증명할 수 없다")
    void revealAndRedraw_RoleNotHeld_ReturnsFalse() {
        // given
        Game game = twoPlayers(List.of(Role.CAPTAIN, Role.DUKE), List.of(Role.CONTESSA, Role.ASSASSIN));
        String before = snapshot(game);

        // when
        boolean proven = game.revealAndRedraw("p1", Role.AMBASSADOR);

        // then
        assertFalse(proven);
        assertEquals(before, snapshot(game));
    }

    @Test
    @DisplayName("시작 직후 더미와 손패를 합치면 역할별 3장이다")
    void start_ConservesRoles() {
        // when
        Game game = Game.start(List.of(new Seat("a", "Alice"), new Seat("b", "Bob")));

        // then
        Map<Role, Integer> counts = roleCounts(game);
        for (Role role : Role.values()) {
            assertEquals(3, counts.get(role));
        }
    }

    @Test
    @DisplayName("손패와 로그는 밖에서 고칠 수 없는 읽기 전용 목록으로 나간다")
    void getters_ReturnReadOnlyLists() {
        // given
        Game game = twoPlayers(List.of(Role.DUKE, Role.CAPTAIN), List.of(Role.CONTESSA, Role.ASSASSIN));
        int logSize = game.getLog().size();

        // when & then
        assertThrows(UnsupportedOperationException.class, () -> player(game, "p1").getInfluence().clear());
        assertThrows(UnsupportedOperationException.class, () -> game.getLog().add("Alice wins."));
        assertEquals(2, player(game, "p1").getInfluence().size());
        assertEquals(logSize, game.getLog().size());
    }
}

package com.copyleft.Coup.feature.game;

import com.copyleft.Coup.domain.Game;
import com.copyleft.Coup.domain.continuation.Continuation;
import com.copyleft.Coup.domain.pending.PendingAction;
import com.copyleft.Coup.domain.type.LossReason;
import com.copyleft.Coup.domain.type.Role;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.copyleft.Coup.feature.game.GameFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ContinuationRunnerTest {

    private ContinuationRunner continuationRunner;
    private Game game;

    @BeforeEach
    void setUp() {
        continuationRunner = new ContinuationRunner(new ExchangeCoordinator());
        game = threePlayers(
                List.of(Role.CAPTAIN, Role.DUKE),
                List.of(Role.CONTESSA, Role.ASSASSIN),
                List.of(Role.AMBASSADOR, Role.DUKE));
    }

    private void eliminate(String playerId) {
        game.loseInfluence(playerId, 0);
        game.loseInfluence(playerId, 1);
    }

    @Test
    @DisplayName("숨겨진 카드가 있으면 상실 대기 단계를 건다")
    void demandLoss_AliveTarget_WaitsForChoice() {
        // when
        continuationRunner.demandLoss(game, "p2", LossReason.COUP, Continuation.endTurn());

        // then
        PendingAction.LoseInfluence pending = assertInstanceOf(PendingAction.LoseInfluence.class, game.getPendingAction());
        assertEquals("p2", pending.playerId());
        assertEquals("p1", game.currentPlayer().orElseThrow().getId());
    }

    @Test
    @DisplayName("잃을 카드가 없으면 기다리지 않고 바로 다음 전이를 실행한다")
    void demandLoss_NoHiddenCards_RunsContinuation() {
        // given
        eliminate("p2");

        // when
        continuationRunner.demandLoss(game, "p2", LossReason.FAILED_CHALLENGE, Continuation.endTurn());

        // then
        assertNull(game.getPendingAction());
        assertEquals("p3", game.currentPlayer().orElseThrow().getId());
    }

    @Test
    @DisplayName("암살 대상이 이미 탈락했으면 차단 기회 없이 턴을 끝낸다")
    void assassinateOpenBlock_DeadTarget_EndsTurn() {
        // given
        eliminate("p2");

        // when
        continuationRunner.run(game, new Continuation.AssassinateOpenBlock("p1", "p2"));

        // then
        assertNull(game.getPendingAction());
        assertEquals("p3", game.currentPlayer().orElseThrow().getId());
    }

    @Test
    @DisplayName("강탈 대상이 이미 탈락했으면 차단 기회 없이 바로 빼앗는다")
    void stealOpenBlock_DeadTarget_AppliesSteal() {
        // given
        eliminate("p2");

        // when
        continuationRunner.run(game, new Continuation.StealOpenBlock("p1", "p2"));

        // then
        assertEquals(4, player(game, "p1").getCoins());
        assertEquals(0, player(game, "p2").getCoins());
        assertEquals("p3", game.currentPlayer().orElseThrow().getId());
    }

    @Test
    @DisplayName("강탈 대상이 살아 있으면 대상에게만 차단 기회를 연다")
    void stealOpenBlock_AliveTarget_OpensBlock() {
        // when
        continuationRunner.run(game, new Continuation.StealOpenBlock("p1", "p2"));

        // then
        PendingAction.StealBlock pending = assertInstanceOf(PendingAction.StealBlock.class, game.getPendingAction());
        assertEquals("p2", pending.targetId());
        assertEquals(2, player(game, "p1").getCoins());
    }

    @Test
    @DisplayName("게임이 끝났으면 남은 전이는 실행하지 않는다")
    void run_GameOver_SkipsContinuation() {
        // given
        eliminate("p2");
        eliminate("p3");
        assertTrue(game.isGameOver());

        // when
        continuationRunner.run(game, new Continuation.StealApply("p1", "p2"));

        // then
        assertEquals(2, player(game, "p1").getCoins());
        assertNull(game.getPendingAction());
    }
}

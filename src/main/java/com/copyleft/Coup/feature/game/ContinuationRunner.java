package com.copyleft.Coup.feature.game;

import com.copyleft.Coup.domain.Game;
import com.copyleft.Coup.domain.Player;
import com.copyleft.Coup.domain.continuation.Continuation;
import com.copyleft.Coup.domain.pending.PendingAction;
import com.copyleft.Coup.domain.type.LossReason;
import com.copyleft.Coup.feature.game.dto.PrivateMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 강제 영향력 상실을 걸고, 상실이 끝난 뒤 저장해 둔 다음 전이를 실행한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContinuationRunner {

    static final int STEAL_AMOUNT = 2;

    private final ExchangeCoordinator exchangeCoordinator;

    /**
     * playerId에게 카드 한 장을 잃게 한다. 이미 숨겨진 카드가 없으면 기다리지 않고 바로 continuation을 실행한다.
     */
    public List<PrivateMessage> demandLoss(Game game, String playerId, LossReason reason, Continuation continuation) {
        boolean hasHidden = game.findPlayer(playerId).map(Player::isAlive).orElse(false);
        if (!hasHidden) {
            log.debug("잃을 카드가 없어 상실을 건너뜀: playerId={}, reason={}", playerId, reason);
            game.setPendingAction(null);
            return run(game, continuation);
        }
        game.setPendingAction(new PendingAction.LoseInfluence(playerId, reason, continuation));
        return List.of();
    }

    public List<PrivateMessage> run(Game game, Continuation continuation) {
        // 게임이 끝났으면 더 진행할 것이 없다
        if (game.isGameOver() || continuation == null) {
            game.finishTurn();
            return List.of();
        }

        if (continuation instanceof Continuation.AssassinateOpenBlock c) {
            if (!game.isAlive(c.targetId())) {
                game.finishTurn();
                return List.of();
            }
            game.setPendingAction(new PendingAction.AssassinateBlock(c.actorId(), c.targetId()));
            return List.of();
        }
        if (continuation instanceof Continuation.AssassinateBlockStands) {
            game.appendLog("Assassination is blocked.");
            game.finishTurn();
            return List.of();
        }
        if (continuation instanceof Continuation.AssassinateForceTargetLoss c) {
            return demandLoss(game, c.targetId(), LossReason.ASSASSINATED,
                    new Continuation.EndTurnAfterAssassination(c.targetId()));
        }
        if (continuation instanceof Continuation.EndTurnAfterAssassination c) {
            game.appendLog(game.nameOf(c.targetId()) + " is assassinated.");
            game.finishTurn();
            return List.of();
        }
        if (continuation instanceof Continuation.StealOpenBlock c) {
            if (!game.isAlive(c.targetId())) {
                applySteal(game, c.actorId(), c.targetId());
                game.finishTurn();
                return List.of();
            }
            game.setPendingAction(new PendingAction.StealBlock(c.actorId(), c.targetId()));
            return List.of();
        }
        if (continuation instanceof Continuation.StealApply c) {
            applySteal(game, c.actorId(), c.targetId());
            game.finishTurn();
            return List.of();
        }
        if (continuation instanceof Continuation.StealBlockStands) {
            game.appendLog("Steal is blocked.");
            game.finishTurn();
            return List.of();
        }
        if (continuation instanceof Continuation.StealApplyAfterBlockFail c) {
            applySteal(game, c.actorId(), c.targetId());
            game.finishTurn();
            return List.of();
        }
        if (continuation instanceof Continuation.ExchangeStartChoice c) {
            return exchangeCoordinator.startChoice(game, c.actorId());
        }

        // EndTurn
        game.finishTurn();
        return List.of();
    }

    /**
     * 대상이 가진 만큼, 최대 2코인을 옮긴다.
     */
    public void applySteal(Game game, String actorId, String targetId) {
        Player actor = game.findPlayer(actorId).orElse(null);
        Player target = game.findPlayer(targetId).orElse(null);
        if (actor == null || target == null) return;

        int amount = Math.min(STEAL_AMOUNT, target.getCoins());
        target.spendCoins(amount);
        actor.addCoins(amount);
        game.appendLog(actor.getName() + " steals " + amount + " coin(s) from " + target.getName() + ".");
    }
}

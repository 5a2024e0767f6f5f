package com.copyleft.Coup.feature.game;

import com.copyleft.Coup.domain.Game;
import com.copyleft.Coup.domain.Player;
import com.copyleft.Coup.domain.continuation.Continuation;
import com.copyleft.Coup.domain.pending.PendingAction;
import com.copyleft.Coup.domain.pending.Responders;
import com.copyleft.Coup.domain.type.ActionType;
import com.copyleft.Coup.domain.type.LossReason;
import com.copyleft.Coup.domain.type.RejectCode;
import com.copyleft.Coup.feature.game.dto.ActionRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 현재 플레이어의 행동을 받아 즉시 처리하거나 협상 단계를 연다.
 * 대상이나 코인이 맞지 않으면 로그만 남기고 턴은 그대로 둔다.
 */
@Component
@RequiredArgsConstructor
public class ActionInitiator {

    static final int INCOME_AMOUNT = 1;
    static final int FOREIGN_AID_AMOUNT = 2;
    static final int COUP_COST = 7;
    static final int ASSASSINATE_COST = 3;
    static final int FORCED_COUP_COINS = 10;

    private final ContinuationRunner continuationRunner;

    public Resolution initiate(Game game, ActionRequest request) {
        if (game.isGameOver()) return Resolution.rejected(RejectCode.GAME_OVER);
        if (game.hasPendingAction()) return Resolution.rejected(RejectCode.ACTION_ALREADY_PENDING);

        Player actor = game.findPlayer(request.actorId()).orElse(null);
        if (actor == null) return Resolution.rejected(RejectCode.UNKNOWN_PLAYER);

        ActionType type = ActionType.fromWire(request.actionType());

        if (type != ActionType.COUP && actor.getCoins() >= FORCED_COUP_COINS) {
            game.appendLog(actor.getName() + " has 10+ coins and must Coup.");
            return Resolution.rejected(RejectCode.MUST_COUP);
        }

        if (type == null) {
            game.appendLog("Unknown action: " + request.actionType());
            return Resolution.rejected(RejectCode.UNKNOWN_ACTION);
        }

        switch (type) {
            case INCOME:
                return income(game, actor);
            case COUP:
                return coup(game, actor, request.targetId());
            case FOREIGN_AID:
                return foreignAid(game, actor);
            case TAX:
                return tax(game, actor);
            case ASSASSINATE:
                return assassinate(game, actor, request.targetId());
            case STEAL:
                return steal(game, actor, request.targetId());
            case EXCHANGE:
                return exchange(game, actor);
            default:
                throw new IllegalStateException("Unhandled action type: " + type);
        }
    }

    private Resolution income(Game game, Player actor) {
        actor.addCoins(INCOME_AMOUNT);
        game.appendLog(actor.getName() + " takes Income (+1).");
        game.finishTurn();
        return Resolution.accepted();
    }

    private Resolution coup(Game game, Player actor, String targetId) {
        Player target = livingPlayer(game, targetId);
        if (target == null) {
            game.appendLog("Invalid Coup target.");
            return Resolution.rejected(RejectCode.INVALID_TARGET);
        }
        if (actor.getCoins() < COUP_COST) {
            game.appendLog(actor.getName() + " cannot Coup (needs 7 coins).");
            return Resolution.rejected(RejectCode.INSUFFICIENT_COINS);
        }

        actor.spendCoins(COUP_COST);
        game.appendLog(actor.getName() + " launches a Coup on " + target.getName() + " (7 coins).");
        return Resolution.accepted(
                continuationRunner.demandLoss(game, target.getId(), LossReason.COUP, Continuation.endTurn()));
    }

    private Resolution foreignAid(Game game, Player actor) {
        // 막히면 되돌린다
        actor.addCoins(FOREIGN_AID_AMOUNT);
        game.appendLog(actor.getName() + " attempts Foreign Aid (+2).");
        game.setPendingAction(new PendingAction.ForeignAidBlock(actor.getId(), othersOf(game, actor)));
        return Resolution.accepted();
    }

    private Resolution tax(Game game, Player actor) {
        game.appendLog(actor.getName() + " claims Duke for Tax (+3).");
        game.setPendingAction(new PendingAction.TaxChallenge(actor.getId(), othersOf(game, actor)));
        return Resolution.accepted();
    }

    private Resolution assassinate(Game game, Player actor, String targetId) {
        Player target = livingOpponent(game, actor, targetId);
        if (target == null) {
            game.appendLog("Invalid Assassination target.");
            return Resolution.rejected(RejectCode.INVALID_TARGET);
        }
        if (actor.getCoins() < ASSASSINATE_COST) {
            game.appendLog(actor.getName() + " cannot Assassinate (needs 3 coins).");
            return Resolution.rejected(RejectCode.INSUFFICIENT_COINS);
        }

        actor.spendCoins(ASSASSINATE_COST);
        game.appendLog(actor.getName() + " claims Assassin to assassinate " + target.getName() + " (3 coins).");
        game.setPendingAction(new PendingAction.AssassinateChallenge(actor.getId(), target.getId(), othersOf(game, actor)));
        return Resolution.accepted();
    }

    private Resolution steal(Game game, Player actor, String targetId) {
        Player target = livingOpponent(game, actor, targetId);
        if (target == null) {
            game.appendLog("Invalid Steal target.");
            return Resolution.rejected(RejectCode.INVALID_TARGET);
        }

        game.appendLog(actor.getName() + " claims Captain to steal from " + target.getName() + ".");
        game.setPendingAction(new PendingAction.StealChallenge(actor.getId(), target.getId(), othersOf(game, actor)));
        return Resolution.accepted();
    }

    private Resolution exchange(Game game, Player actor) {
        game.appendLog(actor.getName() + " claims Ambassador to Exchange.");
        game.setPendingAction(new PendingAction.ExchangeChallenge(actor.getId(), othersOf(game, actor)));
        return Resolution.accepted();
    }

    private static Responders othersOf(Game game, Player actor) {
        return Responders.everyoneAliveExcept(game.getPlayers(), actor.getId());
    }

    private static Player livingPlayer(Game game, String targetId) {
        return game.findPlayer(targetId).filter(Player::isAlive).orElse(null);
    }

    private static Player livingOpponent(Game game, Player actor, String targetId) {
        Player target = livingPlayer(game, targetId);
        if (target == null || target.getId().equals(actor.getId())) return null;
        return target;
    }
}

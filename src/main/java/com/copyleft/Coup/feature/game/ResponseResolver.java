package com.copyleft.Coup.feature.game;

import com.copyleft.Coup.domain.Game;
import com.copyleft.Coup.domain.Player;
import com.copyleft.Coup.domain.continuation.Continuation;
import com.copyleft.Coup.domain.pending.PendingAction;
import com.copyleft.Coup.domain.pending.Responders;
import com.copyleft.Coup.domain.type.LossReason;
import com.copyleft.Coup.domain.type.RejectCode;
import com.copyleft.Coup.domain.type.ResponseType;
import com.copyleft.Coup.domain.type.Role;
import com.copyleft.Coup.feature.game.dto.ResponsePayload;
import com.copyleft.Coup.feature.game.dto.ResponseRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 진행 중인 협상에 대한 응답(통과, 도전, 차단, 카드 선택, 교환 선택)을 처리하는 상태 기계.
 * <p>
 * 도전 단계 공통 규칙: 응답 대상이 아니면 무시, pass/challenge만 받는다.
 * 도전이 하나라도 기록되면 가장 먼저 도전한 사람 기준으로 즉시 판정하고,
 * 전원이 통과하면 다음 단계로 넘어가며, 그 외에는 기다린다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResponseResolver {

    static final int TAX_AMOUNT = 3;
    static final int FOREIGN_AID_AMOUNT = 2;

    private final ContinuationRunner continuationRunner;
    private final ExchangeCoordinator exchangeCoordinator;

    public Resolution respond(Game game, ResponseRequest request) {
        if (game.isGameOver()) return Resolution.rejected(RejectCode.GAME_OVER);

        PendingAction pending = game.getPendingAction();
        if (pending == null) return Resolution.rejected(RejectCode.NO_PENDING_ACTION);

        String playerId = request.playerId();
        ResponseType type = ResponseType.fromWire(request.responseType());
        ResponsePayload payload = request.payload();

        if (pending instanceof PendingAction.LoseInfluence p) return onLoseInfluence(game, p, playerId, type, payload);
        if (pending instanceof PendingAction.TaxChallenge p) return onTaxChallenge(game, p, playerId, type);
        if (pending instanceof PendingAction.ForeignAidBlock p) return onForeignAidBlock(game, p, playerId, type, payload);
        if (pending instanceof PendingAction.ForeignAidChallengeBlock p) return onForeignAidChallengeBlock(game, p, playerId, type);
        if (pending instanceof PendingAction.AssassinateChallenge p) return onAssassinateChallenge(game, p, playerId, type);
        if (pending instanceof PendingAction.AssassinateBlock p) return onAssassinateBlock(game, p, playerId, type, payload);
        if (pending instanceof PendingAction.AssassinateChallengeBlock p) return onAssassinateChallengeBlock(game, p, playerId, type);
        if (pending instanceof PendingAction.StealChallenge p) return onStealChallenge(game, p, playerId, type);
        if (pending instanceof PendingAction.StealBlock p) return onStealBlock(game, p, playerId, type, payload);
        if (pending instanceof PendingAction.StealChallengeBlock p) return onStealChallengeBlock(game, p, playerId, type);
        if (pending instanceof PendingAction.ExchangeChallenge p) return onExchangeChallenge(game, p, playerId, type);
        if (pending instanceof PendingAction.ExchangeChoice p) {
            return exchangeCoordinator.choose(game, p, playerId, type, payload);
        }

        log.warn("처리할 수 없는 협상 단계: {}", pending);
        return Resolution.rejected(RejectCode.UNSUPPORTED_RESPONSE);
    }

    // ---- 영향력 상실 ----

    private Resolution onLoseInfluence(Game game, PendingAction.LoseInfluence pending, String playerId,
                                       ResponseType type, ResponsePayload payload) {
        if (!pending.playerId().equals(playerId)) return Resolution.rejected(RejectCode.NOT_A_RESPONDER);
        if (type != ResponseType.LOSE_INFLUENCE) return Resolution.rejected(RejectCode.UNSUPPORTED_RESPONSE);

        if (!game.loseInfluence(playerId, payload.cardIndex())) {
            return Resolution.rejected(RejectCode.INVALID_CARD_INDEX);
        }

        game.setPendingAction(null);
        return Resolution.accepted(continuationRunner.run(game, pending.continuation()));
    }

    // ---- 세금 (Duke) ----

    private Resolution onTaxChallenge(Game game, PendingAction.TaxChallenge pending, String playerId, ResponseType type) {
        RejectCode vote = recordVote(pending.responders(), playerId, type);
        if (vote != null) return Resolution.rejected(vote);

        Player actor = game.findPlayer(pending.actorId()).orElseThrow();
        String challengerId = pending.responders().firstChallenger().orElse(null);
        if (challengerId != null) {
            if (proveClaim(game, pending.actorId(), Role.DUKE, challengerId, false)) {
                takeTax(game, actor);
                return lose(game, challengerId, LossReason.FAILED_CHALLENGE, Continuation.endTurn());
            }
            game.appendLog("Tax fails.");
            return lose(game, pending.actorId(), LossReason.LOST_CHALLENGE, Continuation.endTurn());
        }

        if (pending.responders().allPassed()) {
            takeTax(game, actor);
            game.finishTurn();
        }
        return Resolution.accepted();
    }

    private void takeTax(Game game, Player actor) {
        actor.addCoins(TAX_AMOUNT);
        game.appendLog(actor.getName() + " takes Tax (+3).");
    }

    // ---- 해외 원조 ----

    private Resolution onForeignAidBlock(Game game, PendingAction.ForeignAidBlock pending, String playerId,
                                         ResponseType type, ResponsePayload payload) {
        if (!pending.responders().contains(playerId)) return Resolution.rejected(RejectCode.NOT_A_RESPONDER);

        if (type == ResponseType.BLOCK) {
            if (Role.fromName(payload.role()) != Role.DUKE) return Resolution.rejected(RejectCode.INVALID_BLOCK_ROLE);

            game.setPendingAction(new PendingAction.ForeignAidChallengeBlock(
                    pending.actorId(), playerId, Responders.everyoneAliveExcept(game.getPlayers(), playerId)));
            game.appendLog(game.nameOf(playerId) + " blocks Foreign Aid with Duke.");
            return Resolution.accepted();
        }
        if (type != ResponseType.PASS) return Resolution.rejected(RejectCode.UNSUPPORTED_RESPONSE);

        pending.responders().markPassed(playerId);
        if (pending.responders().allPassed()) {
            game.appendLog("Foreign Aid succeeds.");
            game.finishTurn();
        }
        return Resolution.accepted();
    }

    private Resolution onForeignAidChallengeBlock(Game game, PendingAction.ForeignAidChallengeBlock pending,
                                                  String playerId, ResponseType type) {
        RejectCode vote = recordVote(pending.responders(), playerId, type);
        if (vote != null) return Resolution.rejected(vote);

        Player actor = game.findPlayer(pending.actorId()).orElseThrow();
        String challengerId = pending.responders().firstChallenger().orElse(null);
        if (challengerId != null) {
            if (proveClaim(game, pending.blockerId(), Role.DUKE, challengerId, true)) {
                revertForeignAid(game, actor);
                return lose(game, challengerId, LossReason.FAILED_CHALLENGE, Continuation.endTurn());
            }
            game.appendLog("Block fails. Foreign Aid succeeds.");
            return lose(game, pending.blockerId(), LossReason.LOST_CHALLENGE, Continuation.endTurn());
        }

        if (pending.responders().allPassed()) {
            revertForeignAid(game, actor);
            game.finishTurn();
        }
        return Resolution.accepted();
    }

    // 시작할 때 임시로 준 2코인을 회수한다
    private void revertForeignAid(Game game, Player actor) {
        actor.spendCoins(FOREIGN_AID_AMOUNT);
        game.appendLog("Foreign Aid is blocked.");
    }

    // ---- 암살 (Assassin / Contessa) ----

    private Resolution onAssassinateChallenge(Game game, PendingAction.AssassinateChallenge pending,
                                              String playerId, ResponseType type) {
        RejectCode vote = recordVote(pending.responders(), playerId, type);
        if (vote != null) return Resolution.rejected(vote);

        String challengerId = pending.responders().firstChallenger().orElse(null);
        if (challengerId != null) {
            if (proveClaim(game, pending.actorId(), Role.ASSASSIN, challengerId, false)) {
                return lose(game, challengerId, LossReason.FAILED_CHALLENGE,
                        new Continuation.AssassinateOpenBlock(pending.actorId(), pending.targetId()));
            }
            game.appendLog("Assassination fails.");
            return lose(game, pending.actorId(), LossReason.LOST_CHALLENGE, Continuation.endTurn());
        }

        if (pending.responders().allPassed()) {
            game.setPendingAction(new PendingAction.AssassinateBlock(pending.actorId(), pending.targetId()));
        }
        return Resolution.accepted();
    }

    private Resolution onAssassinateBlock(Game game, PendingAction.AssassinateBlock pending, String playerId,
                                          ResponseType type, ResponsePayload payload) {
        if (!pending.targetId().equals(playerId)) return Resolution.rejected(RejectCode.NOT_A_RESPONDER);

        if (type == ResponseType.PASS) {
            return lose(game, pending.targetId(), LossReason.ASSASSINATED,
                    new Continuation.EndTurnAfterAssassination(pending.targetId()));
        }
        if (type != ResponseType.BLOCK) return Resolution.rejected(RejectCode.UNSUPPORTED_RESPONSE);
        if (Role.fromName(payload.role()) != Role.CONTESSA) return Resolution.rejected(RejectCode.INVALID_BLOCK_ROLE);

        game.appendLog(game.nameOf(playerId) + " blocks the assassination with Contessa.");
        game.setPendingAction(new PendingAction.AssassinateChallengeBlock(
                pending.actorId(), pending.targetId(),
                Responders.everyoneAliveExcept(game.getPlayers(), pending.targetId())));
        return Resolution.accepted();
    }

    private Resolution onAssassinateChallengeBlock(Game game, PendingAction.AssassinateChallengeBlock pending,
                                                   String playerId, ResponseType type) {
        RejectCode vote = recordVote(pending.responders(), playerId, type);
        if (vote != null) return Resolution.rejected(vote);

        String challengerId = pending.responders().firstChallenger().orElse(null);
        if (challengerId != null) {
            if (proveClaim(game, pending.targetId(), Role.CONTESSA, challengerId, true)) {
                return lose(game, challengerId, LossReason.FAILED_CHALLENGE, new Continuation.AssassinateBlockStands());
            }
            return lose(game, pending.targetId(), LossReason.LOST_CHALLENGE,
                    new Continuation.AssassinateForceTargetLoss(pending.actorId(), pending.targetId()));
        }

        if (pending.responders().allPassed()) {
            game.appendLog("Assassination is blocked.");
            game.finishTurn();
        }
        return Resolution.accepted();
    }

    // ---- 강탈 (Captain / Captain, Ambassador 차단) ----

    private Resolution onStealChallenge(Game game, PendingAction.StealChallenge pending,
                                        String playerId, ResponseType type) {
        RejectCode vote = recordVote(pending.responders(), playerId, type);
        if (vote != null) return Resolution.rejected(vote);

        String challengerId = pending.responders().firstChallenger().orElse(null);
        if (challengerId != null) {
            if (proveClaim(game, pending.actorId(), Role.CAPTAIN, challengerId, false)) {
                return lose(game, challengerId, LossReason.FAILED_CHALLENGE,
                        new Continuation.StealOpenBlock(pending.actorId(), pending.targetId()));
            }
            game.appendLog("Steal fails.");
            return lose(game, pending.actorId(), LossReason.LOST_CHALLENGE, Continuation.endTurn());
        }

        if (pending.responders().allPassed()) {
            game.setPendingAction(new PendingAction.StealBlock(pending.actorId(), pending.targetId()));
        }
        return Resolution.accepted();
    }

    private Resolution onStealBlock(Game game, PendingAction.StealBlock pending, String playerId,
                                    ResponseType type, ResponsePayload payload) {
        if (!pending.targetId().equals(playerId)) return Resolution.rejected(RejectCode.NOT_A_RESPONDER);

        if (type == ResponseType.PASS) {
            game.setPendingAction(null);
            continuationRunner.applySteal(game, pending.actorId(), pending.targetId());
            game.finishTurn();
            return Resolution.accepted();
        }
        if (type != ResponseType.BLOCK) return Resolution.rejected(RejectCode.UNSUPPORTED_RESPONSE);

        Role blockRole = Role.fromName(payload.role());
        if (blockRole != Role.CAPTAIN && blockRole != Role.AMBASSADOR) {
            return Resolution.rejected(RejectCode.INVALID_BLOCK_ROLE);
        }

        game.appendLog(game.nameOf(playerId) + " blocks the steal with " + blockRole.getDisplayName() + ".");
        game.setPendingAction(new PendingAction.StealChallengeBlock(
                pending.actorId(), pending.targetId(), blockRole,
                Responders.everyoneAliveExcept(game.getPlayers(), pending.targetId())));
        return Resolution.accepted();
    }

    private Resolution onStealChallengeBlock(Game game, PendingAction.StealChallengeBlock pending,
                                             String playerId, ResponseType type) {
        RejectCode vote = recordVote(pending.responders(), playerId, type);
        if (vote != null) return Resolution.rejected(vote);

        String challengerId = pending.responders().firstChallenger().orElse(null);
        if (challengerId != null) {
            if (proveClaim(game, pending.targetId(), pending.blockRole(), challengerId, true)) {
                return lose(game, challengerId, LossReason.FAILED_CHALLENGE, new Continuation.StealBlockStands());
            }
            return lose(game, pending.targetId(), LossReason.LOST_CHALLENGE,
                    new Continuation.StealApplyAfterBlockFail(pending.actorId(), pending.targetId()));
        }

        if (pending.responders().allPassed()) {
            game.appendLog("Steal is blocked.");
            game.finishTurn();
        }
        return Resolution.accepted();
    }

    // ---- 교환 (Ambassador) ----

    private Resolution onExchangeChallenge(Game game, PendingAction.ExchangeChallenge pending,
                                           String playerId, ResponseType type) {
        RejectCode vote = recordVote(pending.responders(), playerId, type);
        if (vote != null) return Resolution.rejected(vote);

        String challengerId = pending.responders().firstChallenger().orElse(null);
        if (challengerId != null) {
            if (proveClaim(game, pending.actorId(), Role.AMBASSADOR, challengerId, false)) {
                return lose(game, challengerId, LossReason.FAILED_CHALLENGE,
                        new Continuation.ExchangeStartChoice(pending.actorId()));
            }
            game.appendLog("Exchange fails.");
            return lose(game, pending.actorId(), LossReason.LOST_CHALLENGE, Continuation.endTurn());
        }

        if (pending.responders().allPassed()) {
            return Resolution.accepted(exchangeCoordinator.startChoice(game, pending.actorId()));
        }
        return Resolution.accepted();
    }

    // ---- 공통 ----

    /**
     * 도전/통과 단계의 응답을 기록한다. 받아들이지 않으면 거절 사유를 돌려준다.
     */
    private RejectCode recordVote(Responders responders, String playerId, ResponseType type) {
        if (playerId == null || !responders.contains(playerId)) return RejectCode.NOT_A_RESPONDER;

        if (type == ResponseType.PASS) {
            responders.markPassed(playerId);
            return null;
        }
        if (type == ResponseType.CHALLENGE) {
            responders.markChallenged(playerId);
            return null;
        }
        return RejectCode.UNSUPPORTED_RESPONSE;
    }

    /**
     * 도전 판정. 주장한 역할을 실제로 가지고 있으면 공개 후 새 카드로 바꾸고 true.
     */
    private boolean proveClaim(Game game, String claimantId, Role role, String challengerId, boolean blockClaim) {
        String challenger = game.nameOf(challengerId) + (blockClaim ? " challenges block" : " challenges");

        if (game.playerHasRole(claimantId, role)) {
            game.appendLog(challenger + " — FAILED.");
            if (!game.revealAndRedraw(claimantId, role)) {
                log.error("보유 확인 후 공개 실패: claimantId={}, role={}", claimantId, role);
            }
            return true;
        }
        game.appendLog(challenger + " — SUCCESS.");
        return false;
    }

    private Resolution lose(Game game, String playerId, LossReason reason, Continuation continuation) {
        return Resolution.accepted(continuationRunner.demandLoss(game, playerId, reason, continuation));
    }
}

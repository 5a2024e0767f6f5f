package com.copyleft.Coup.domain.pending;

import com.copyleft.Coup.domain.continuation.Continuation;
import com.copyleft.Coup.domain.type.ActionKind;
import com.copyleft.Coup.domain.type.LossReason;
import com.copyleft.Coup.domain.type.Role;
import com.copyleft.Coup.domain.type.Stage;
import com.copyleft.Coup.domain.view.PendingActionView;

/**
 * 진행 중인 협상. 게임에는 이 중 최대 하나만 존재한다.
 * 행동 종류와 단계의 조합마다 별도의 타입을 두어 잘못된 필드 조합이 생기지 않게 한다.
 */
public sealed interface PendingAction {

    ActionKind kind();

    Stage stage();

    PendingActionView toView();

    /** 지정된 플레이어가 카드 한 장을 골라 공개해야 한다. */
    record LoseInfluence(String playerId, LossReason reason, Continuation continuation) implements PendingAction {
        public ActionKind kind() { return ActionKind.LOSE_INFLUENCE; }
        public Stage stage() { return Stage.AWAITING_CHOICE; }

        public PendingActionView toView() {
            return PendingActionView.builder()
                    .type(kind()).stage(stage())
                    .playerId(playerId)
                    .reason(reason)
                    .build();
        }
    }

    record TaxChallenge(String actorId, Responders responders) implements PendingAction {
        public ActionKind kind() { return ActionKind.TAX; }
        public Stage stage() { return Stage.AWAITING_CHALLENGE; }

        public PendingActionView toView() {
            return PendingActionView.claim(kind(), stage(), actorId, null, Role.DUKE, responders);
        }
    }

    /** 해외 원조는 도전할 수 없고 Duke 주장으로 차단만 가능하다. */
    record ForeignAidBlock(String actorId, Responders responders) implements PendingAction {
        public ActionKind kind() { return ActionKind.FOREIGN_AID; }
        public Stage stage() { return Stage.AWAITING_BLOCK; }

        public PendingActionView toView() {
            return PendingActionView.claim(kind(), stage(), actorId, null, null, responders);
        }
    }

    record ForeignAidChallengeBlock(String actorId, String blockerId, Responders responders) implements PendingAction {
        public ActionKind kind() { return ActionKind.FOREIGN_AID; }
        public Stage stage() { return Stage.AWAITING_CHALLENGE_BLOCK; }

        public PendingActionView toView() {
            return PendingActionView.block(kind(), stage(), actorId, null, null, blockerId, Role.DUKE, responders);
        }
    }

    record AssassinateChallenge(String actorId, String targetId, Responders responders) implements PendingAction {
        public ActionKind kind() { return ActionKind.ASSASSINATE; }
        public Stage stage() { return Stage.AWAITING_CHALLENGE; }

        public PendingActionView toView() {
            return PendingActionView.claim(kind(), stage(), actorId, targetId, Role.ASSASSIN, responders);
        }
    }

    /** 대상만 응답한다. */
    record AssassinateBlock(String actorId, String targetId, Responders responders) implements PendingAction {
        public AssassinateBlock(String actorId, String targetId) {
            this(actorId, targetId, Responders.only(targetId));
        }

        public ActionKind kind() { return ActionKind.ASSASSINATE; }
        public Stage stage() { return Stage.AWAITING_BLOCK; }

        public PendingActionView toView() {
            return PendingActionView.claim(kind(), stage(), actorId, targetId, Role.ASSASSIN, responders);
        }
    }

    /** 차단자는 항상 암살 대상이다. */
    record AssassinateChallengeBlock(String actorId, String targetId, Responders responders) implements PendingAction {
        public ActionKind kind() { return ActionKind.ASSASSINATE; }
        public Stage stage() { return Stage.AWAITING_CHALLENGE_BLOCK; }

        public PendingActionView toView() {
            return PendingActionView.block(kind(), stage(), actorId, targetId, null, targetId, Role.CONTESSA, responders);
        }
    }

    record StealChallenge(String actorId, String targetId, Responders responders) implements PendingAction {
        public ActionKind kind() { return ActionKind.STEAL; }
        public Stage stage() { return Stage.AWAITING_CHALLENGE; }

        public PendingActionView toView() {
            return PendingActionView.claim(kind(), stage(), actorId, targetId, Role.CAPTAIN, responders);
        }
    }

    record StealBlock(String actorId, String targetId, Responders responders) implements PendingAction {
        public StealBlock(String actorId, String targetId) {
            this(actorId, targetId, Responders.only(targetId));
        }

        public ActionKind kind() { return ActionKind.STEAL; }
        public Stage stage() { return Stage.AWAITING_BLOCK; }

        public PendingActionView toView() {
            return PendingActionView.claim(kind(), stage(), actorId, targetId, Role.CAPTAIN, responders);
        }
    }

    /** blockRole은 Captain 또는 Ambassador. */
    record StealChallengeBlock(String actorId, String targetId, Role blockRole, Responders responders) implements PendingAction {
        public ActionKind kind() { return ActionKind.STEAL; }
        public Stage stage() { return Stage.AWAITING_CHALLENGE_BLOCK; }

        public PendingActionView toView() {
            return PendingActionView.block(kind(), stage(), actorId, targetId, null, targetId, blockRole, responders);
        }
    }

    record ExchangeChallenge(String actorId, Responders responders) implements PendingAction {
        public ActionKind kind() { return ActionKind.EXCHANGE; }
        public Stage stage() { return Stage.AWAITING_CHALLENGE; }

        public PendingActionView toView() {
            return PendingActionView.claim(kind(), stage(), actorId, null, Role.AMBASSADOR, responders);
        }
    }

    /** 공개되는 것은 고를 장수뿐이다. 선택지 내용은 비공개 저장소에만 있다. */
    record ExchangeChoice(String actorId, int keepCount) implements PendingAction {
        public ActionKind kind() { return ActionKind.EXCHANGE; }
        public Stage stage() { return Stage.AWAITING_CHOICE; }

        public PendingActionView toView() {
            return PendingActionView.builder()
                    .type(kind()).stage(stage())
                    .actorId(actorId)
                    .keepCount(keepCount)
                    .build();
        }
    }
}

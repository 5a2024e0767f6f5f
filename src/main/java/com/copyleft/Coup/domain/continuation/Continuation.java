package com.copyleft.Coup.domain.continuation;

/**
 * 강제 영향력 상실이 끝난 뒤 이어서 수행할 전이.
 * 클로저가 아닌 순수 데이터이며, 재개에 필요한 식별자만 담는다.
 */
public sealed interface Continuation {

    record EndTurn() implements Continuation {}

    record AssassinateOpenBlock(String actorId, String targetId) implements Continuation {}

    record AssassinateBlockStands() implements Continuation {}

    record AssassinateForceTargetLoss(String actorId, String targetId) implements Continuation {}

    record EndTurnAfterAssassination(String targetId) implements Continuation {}

    record StealOpenBlock(String actorId, String targetId) implements Continuation {}

    record StealApply(String actorId, String targetId) implements Continuation {}

    record StealBlockStands() implements Continuation {}

    record StealApplyAfterBlockFail(String actorId, String targetId) implements Continuation {}

    record ExchangeStartChoice(String actorId) implements Continuation {}

    static Continuation endTurn() {
        return new EndTurn();
    }
}

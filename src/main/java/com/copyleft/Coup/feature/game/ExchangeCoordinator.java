package com.copyleft.Coup.feature.game;

import com.copyleft.Coup.domain.Game;
import com.copyleft.Coup.domain.Player;
import com.copyleft.Coup.domain.exchange.ExchangeOffer;
import com.copyleft.Coup.domain.exchange.ExchangeOption;
import com.copyleft.Coup.domain.exchange.ExchangeSecret;
import com.copyleft.Coup.domain.pending.PendingAction;
import com.copyleft.Coup.domain.type.RejectCode;
import com.copyleft.Coup.domain.type.ResponseType;
import com.copyleft.Coup.domain.type.Role;
import com.copyleft.Coup.feature.game.dto.PrivateMessage;
import com.copyleft.Coup.feature.game.dto.ResponsePayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 대사 교환. 선택지는 본인에게만 비공개로 보내고, 공개 상태에는 고를 장수만 남긴다.
 */
@Slf4j
@Component
public class ExchangeCoordinator {

    static final int DRAW_COUNT = 2;
    private static final String OPTION_PREFIX = "opt-";

    public List<PrivateMessage> startChoice(Game game, String actorId) {
        Player actor = game.findPlayer(actorId).orElse(null);
        if (actor == null) {
            game.finishTurn();
            return List.of();
        }

        List<Integer> hiddenSlots = actor.unrevealedSlots();
        int keepCount = hiddenSlots.size();
        if (keepCount == 0) {
            game.finishTurn();
            return List.of();
        }

        List<ExchangeOption> options = new ArrayList<>(keepCount + DRAW_COUNT);
        int seq = 1;
        for (int slot : hiddenSlots) {
            Role role = actor.getInfluence().get(slot).getRole();
            options.add(new ExchangeOption(OPTION_PREFIX + seq++, role, ExchangeOption.Source.HAND));
        }
        for (int i = 0; i < DRAW_COUNT; i++) {
            options.add(new ExchangeOption(OPTION_PREFIX + seq++, game.drawOne(), ExchangeOption.Source.DRAWN));
        }

        ExchangeSecret secret = new ExchangeSecret(keepCount, options);
        game.storeExchangeSecret(actorId, secret);
        game.setPendingAction(new PendingAction.ExchangeChoice(actorId, keepCount));

        log.debug("교환 선택지 전달: actorId={}, keepCount={}", actorId, keepCount);
        return List.of(PrivateMessage.exchangeOptions(actorId, ExchangeOffer.from(secret)));
    }

    public Resolution choose(Game game, PendingAction.ExchangeChoice pending, String playerId,
                             ResponseType type, ResponsePayload payload) {
        if (!pending.actorId().equals(playerId)) return Resolution.rejected(RejectCode.NOT_A_RESPONDER);
        if (type != ResponseType.EXCHANGE_CHOICE) return Resolution.rejected(RejectCode.UNSUPPORTED_RESPONSE);

        ExchangeSecret secret = game.findExchangeSecret(playerId).orElse(null);
        Player actor = game.findPlayer(playerId).orElse(null);
        if (secret == null || actor == null) return Resolution.rejected(RejectCode.INVALID_EXCHANGE_CHOICE);

        Set<String> keep = payload.keep() == null ? Set.of() : new LinkedHashSet<>(payload.keep());
        if (keep.size() != secret.keepCount()) return Resolution.rejected(RejectCode.INVALID_EXCHANGE_CHOICE);

        List<Role> kept = new ArrayList<>();
        List<Role> returned = new ArrayList<>();
        for (ExchangeOption option : secret.options()) {
            if (keep.contains(option.id())) kept.add(option.role());
            else returned.add(option.role());
        }
        if (kept.size() != secret.keepCount()) return Resolution.rejected(RejectCode.INVALID_EXCHANGE_CHOICE);
        if (actor.unrevealedSlots().size() != secret.keepCount()) {
            return Resolution.rejected(RejectCode.INVALID_EXCHANGE_CHOICE);
        }

        game.replaceHiddenCards(playerId, kept);
        game.returnToDeck(returned);
        game.removeExchangeSecret(playerId);

        game.appendLog(actor.getName() + " completes Exchange.");
        game.finishTurn();
        return Resolution.accepted();
    }
}

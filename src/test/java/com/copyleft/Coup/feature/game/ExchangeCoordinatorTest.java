package com.copyleft.Coup.feature.game;

import com.copyleft.Coup.domain.Card;
import com.copyleft.Coup.domain.Game;
import com.copyleft.Coup.domain.exchange.ExchangeOffer;
import com.copyleft.Coup.domain.pending.PendingAction;
import com.copyleft.Coup.domain.type.RejectCode;
import com.copyleft.Coup.domain.type.Role;
import com.copyleft.Coup.domain.view.GameView;
import com.copyleft.Coup.feature.game.dto.ActionRequest;
import com.copyleft.Coup.feature.game.dto.PrivateMessage;
import com.copyleft.Coup.feature.game.dto.ResponsePayload;
import com.copyleft.Coup.feature.game.dto.ResponseRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.copyleft.Coup.feature.game.GameFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ExchangeCoordinatorTest {

    private GameService gameService;
    private Game game;

    @BeforeEach
    void setUp() {
        gameService = engine();
        game = twoPlayers(List.of(Role.AMBASSADOR, Role.CAPTAIN), List.of(Role.CONTESSA, Role.ASSASSIN));
    }

    private EngineResult choose(String playerId, List<String> keep) {
        return gameService.respond(game, new ResponseRequest(playerId, "exchangeChoice", ResponsePayload.keep(keep)));
    }

    /** 교환을 선언하고 상대가 통과한 뒤 받은 선택지 */
    private ExchangeOffer startExchange() {
        gameService.initiate(game, new ActionRequest("p1", "exchange", null));
        EngineResult result = gameService.respond(game, ResponseRequest.of("p2", "pass"));

        assertEquals(1, result.privateMessages().size());
        PrivateMessage message = result.privateMessages().get(0);
        assertEquals("p1", message.recipientId());
        assertEquals(PrivateMessage.EXCHANGE_OPTIONS, message.kind());
        return message.offer();
    }

    @Test
    @DisplayName("도전이 없으면 손패 두 장과 새로 뽑은 두 장을 본인에게만 보여준다")
    void start_OffersHandAndTwoDrawnCards() {
        // when
        ExchangeOffer offer = startExchange();

        // then
        assertEquals(2, offer.keepCount());
        assertEquals(4, offer.options().size());
        assertEquals(Role.AMBASSADOR, offer.options().get(0).role());
        assertEquals(Role.CAPTAIN, offer.options().get(1).role());
        assertEquals(List.of("opt-1", "opt-2", "opt-3", "opt-4"),
                offer.options().stream().map(ExchangeOffer.OfferedOption::id).toList());

        PendingAction.ExchangeChoice pending = assertInstanceOf(PendingAction.ExchangeChoice.class, game.getPendingAction());
        assertEquals(2, pending.keepCount());

        // 공개 상태에는 고를 장수만 있다
        GameView view = game.viewFor("p2", 80);
        assertEquals(2, view.getPendingAction().getKeepCount());
        assertNull(view.getPendingAction().getResponders());
    }

    @Test
    @DisplayName("고른 카드로 손패를 바꾸고 나머지는 더미로 돌려보낸다")
    void choose_ValidKeep_ReplacesHand() {
        // given
        ExchangeOffer offer = startExchange();
        Role third = offer.options().get(2).role();
        Role fourth = offer.options().get(3).role();

        // when
        EngineResult result = choose("p1", List.of("opt-3", "opt-4"));

        // then
        assertTrue(result.isAccepted());
        List<Card> hand = player(game, "p1").getInfluence();
        assertEquals(third, hand.get(0).getRole());
        assertEquals(fourth, hand.get(1).getRole());
        assertEquals(15 - 4, game.deckContents().size());
        roleCounts(game).values().forEach(n -> assertEquals(3, n));
        assertTrue(result.log().contains("Alice completes Exchange."));
        assertEquals("p2", game.currentPlayer().orElseThrow().getId());
        assertTrue(game.findExchangeSecret("p1").isEmpty());
    }

    @Test
    @DisplayName("장수가 틀리거나 중복이거나 없는 선택지는 거절되고 단계는 그대로다")
    void choose_InvalidKeep_Rejected() {
        // given
        startExchange();
        String before = snapshot(game);

        // when & then
        assertEquals(RejectCode.INVALID_EXCHANGE_CHOICE, choose("p1", List.of("opt-1")).rejection());
        assertEquals(RejectCode.INVALID_EXCHANGE_CHOICE, choose("p1", List.of("opt-1", "opt-1")).rejection());
        assertEquals(RejectCode.INVALID_EXCHANGE_CHOICE, choose("p1", List.of("opt-1", "opt-9")).rejection());
        assertEquals(RejectCode.INVALID_EXCHANGE_CHOICE, choose("p1", List.of("opt-1", "opt-2", "opt-3")).rejection());
        assertEquals(RejectCode.INVALID_EXCHANGE_CHOICE, choose("p1", null).rejection());
        assertEquals(RejectCode.NOT_A_RESPONDER, choose("p2", List.of("opt-1", "opt-2")).rejection());
        assertEquals(RejectCode.UNSUPPORTED_RESPONSE,
                gameService.respond(game, ResponseRequest.of("p1", "pass")).rejection());

        assertEquals(before, snapshot(game));
        assertTrue(game.findExchangeSecret("p1").isPresent());
    }

    @Test
    @DisplayName("카드가 한 장 남았으면 한 장만 고른다")
    void start_OneHiddenCard_KeepsOne() {
        // given
        game.loseInfluence("p1", 1);

        // when
        ExchangeOffer offer = startExchange();
        EngineResult result = choose("p1", List.of("opt-2"));

        // then
        assertEquals(1, offer.keepCount());
        assertEquals(3, offer.options().size());
        assertTrue(result.isAccepted());
        assertEquals(offer.options().get(1).role(), player(game, "p1").getInfluence().get(0).getRole());
        assertTrue(player(game, "p1").getInfluence().get(1).isRevealed());
        roleCounts(game).values().forEach(n -> assertEquals(3, n));
    }

    @Test
    @DisplayName("Ambassador가 없는데 교환을 주장하면 도전에 져서 교환이 취소된다")
    void challenge_Bluff_ExchangeFails() {
        // given
        game = twoPlayers(List.of(Role.DUKE, Role.CAPTAIN), List.of(Role.CONTESSA, Role.ASSASSIN));
        gameService.initiate(game, new ActionRequest("p1", "exchange", null));

        // when
        EngineResult result = gameService.respond(game, ResponseRequest.of("p2", "challenge"));

        // then
        assertTrue(result.privateMessages().isEmpty());
        assertTrue(result.log().contains("Exchange fails."));
        assertInstanceOf(PendingAction.LoseInfluence.class, game.getPendingAction());
    }

    @Test
    @DisplayName("진짜 Ambassador에게 도전하면 도전자가 카드를 잃은 뒤 교환 선택지가 열린다")
    void challenge_ClaimTrue_StartsChoiceAfterLoss() {
        // given
        gameService.initiate(game, new ActionRequest("p1", "exchange", null));
        gameService.respond(game, ResponseRequest.of("p2", "challenge"));

        // when
        EngineResult result = gameService.respond(game,
                new ResponseRequest("p2", "loseInfluence", ResponsePayload.cardIndex(0)));

        // then
        assertEquals(1, result.privateMessages().size());
        assertInstanceOf(PendingAction.ExchangeChoice.class, game.getPendingAction());
    }
}

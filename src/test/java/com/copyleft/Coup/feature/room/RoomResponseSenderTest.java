package com.copyleft.Coup.feature.room;

import com.copyleft.Coup.domain.Game;
import com.copyleft.Coup.domain.Room;
import com.copyleft.Coup.domain.RoomMember;
import com.copyleft.Coup.domain.exchange.ExchangeOffer;
import com.copyleft.Coup.domain.type.Role;
import com.copyleft.Coup.domain.view.CardView;
import com.copyleft.Coup.domain.view.PlayerView;
import com.copyleft.Coup.feature.game.GameFixtures;
import com.copyleft.Coup.feature.game.dto.PrivateMessage;
import com.copyleft.Coup.feature.room.dto.RoomPayloads;
import com.copyleft.Coup.global.constant.SocketEvent;
import com.copyleft.Coup.infra.websocket.WebSocketSender;
import com.copyleft.Coup.infra.websocket.dto.WebSocketResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RoomResponseSenderTest {

    @Mock private WebSocketSender webSocketSender;

    private RoomResponseSender responseSender;
    private Room room;

    @BeforeEach
    void setUp() {
        responseSender = new RoomResponseSender(webSocketSender, GameFixtures.PROPERTIES);

        room = new Room("ABCD");
        room.addMember(new RoomMember("p1", "Alice", "s1"));
        room.addMember(new RoomMember("p2", "Bob", "s2"));
        Game game = GameFixtures.twoPlayers(List.of(Role.DUKE, Role.CAPTAIN), List.of(Role.CONTESSA, Role.ASSASSIN));
        room.startGame(game);
    }

    @SuppressWarnings("unchecked")
    private RoomPayloads.RoomState stateSentTo(String sessionId) {
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(webSocketSender).sendEventToSession(eq(sessionId), captor.capture());
        WebSocketResponse<RoomPayloads.RoomState> response = (WebSocketResponse<RoomPayloads.RoomState>) captor.getValue();
        assertEquals(SocketEvent.STATE.name(), response.getEvent());
        return response.getData();
    }

    @Test
    @DisplayName("멤버마다 자기 카드만 보이는 상태를 따로 보낸다")
    void broadcastState_ProjectsPerMember() {
        // when
        responseSender.broadcastState(room);

        // then
        RoomPayloads.RoomState forAlice = stateSentTo("s1");
        assertEquals("p1", forAlice.getYouId());
        assertEquals("p1", forAlice.getHostId());
        PlayerView aliceSeesBob = forAlice.getGame().getPlayers().get(1);
        aliceSeesBob.influence().forEach(c -> assertInstanceOf(CardView.Hidden.class, c));
        assertEquals(new CardView.Visible(Role.DUKE, false), forAlice.getGame().getPlayers().get(0).influence().get(0));

        RoomPayloads.RoomState forBob = stateSentTo("s2");
        assertEquals("p2", forBob.getYouId());
        forBob.getGame().getPlayers().get(0).influence().forEach(c -> assertInstanceOf(CardView.Hidden.class, c));
        assertEquals(new CardView.Visible(Role.CONTESSA, false), forBob.getGame().getPlayers().get(1).influence().get(0));
    }

    @Test
    @DisplayName("비공개 메시지는 받는 사람의 세션에만 보낸다")
    void sendPrivateMessages_OnlyToRecipient() {
        // given
        ExchangeOffer offer = new ExchangeOffer(2, List.of(new ExchangeOffer.OfferedOption("opt-1", Role.DUKE)));

        // when
        responseSender.sendPrivateMessages(room, List.of(PrivateMessage.exchangeOptions("p2", offer)));

        // then
        verify(webSocketSender).sendEventToSession(eq("s2"), any(WebSocketResponse.class));
        verify(webSocketSender, never()).sendEventToSession(eq("s1"), any());
    }
}

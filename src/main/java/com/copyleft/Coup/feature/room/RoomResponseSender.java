package com.copyleft.Coup.feature.room;

import com.copyleft.Coup.config.GameProperties;
import com.copyleft.Coup.domain.Room;
import com.copyleft.Coup.domain.RoomMember;
import com.copyleft.Coup.domain.type.RejectCode;
import com.copyleft.Coup.feature.game.dto.PrivateMessage;
import com.copyleft.Coup.feature.room.dto.RoomPayloads;
import com.copyleft.Coup.global.constant.ErrorCode;
import com.copyleft.Coup.global.constant.SocketEvent;
import com.copyleft.Coup.infra.websocket.WebSocketSender;
import com.copyleft.Coup.infra.websocket.dto.WebSocketResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class RoomResponseSender {

    private final WebSocketSender webSocketSender;
    private final GameProperties gameProperties;

    /**
     * 멤버마다 자기 시점의 상태를 따로 만들어 보낸다. 같은 상태를 방 전체에 뿌리지 않는다.
     */
    public void broadcastState(Room room) {
        List<RoomPayloads.MemberInfo> members = room.getMembers().stream()
                .map(m -> RoomPayloads.MemberInfo.builder()
                        .id(m.getId())
                        .name(m.getName())
                        .host(room.isHost(m.getId()))
                        .build())
                .toList();

        for (RoomMember member : room.getMembers()) {
            RoomPayloads.RoomState state = RoomPayloads.RoomState.builder()
                    .room(room.getRoomCode())
                    .youId(member.getId())
                    .hostId(room.getHostId())
                    .phase(room.getStatus())
                    .members(members)
                    .game(room.getGame() == null ? null
                            : room.getGame().viewFor(member.getId(), gameProperties.logRetention()))
                    .build();

            WebSocketResponse<RoomPayloads.RoomState> response = WebSocketResponse.<RoomPayloads.RoomState>builder()
                    .event(SocketEvent.STATE.name())
                    .data(state)
                    .build();

            webSocketSender.sendEventToSession(member.getSessionId(), response);
        }
    }

    // 교환 선택지 등은 받는 사람 한 명에게만
    public void sendPrivateMessages(Room room, List<PrivateMessage> messages) {
        for (PrivateMessage message : messages) {
            room.findMember(message.recipientId()).ifPresent(member -> {
                RoomPayloads.PrivateInfo data = RoomPayloads.PrivateInfo.builder()
                        .kind(message.kind())
                        .offer(message.offer())
                        .build();

                WebSocketResponse<RoomPayloads.PrivateInfo> response = WebSocketResponse.<RoomPayloads.PrivateInfo>builder()
                        .event(SocketEvent.PRIVATE.name())
                        .data(data)
                        .build();

                webSocketSender.sendEventToSession(member.getSessionId(), response);
            });
        }
    }

    public void sendRejected(String sessionId, RejectCode rejectCode) {
        WebSocketResponse<Void> response = WebSocketResponse.<Void>builder()
                .event(SocketEvent.ACTION_REJECTED.name())
                .message(rejectCode.getMessage())
                .code(rejectCode.name())
                .build();
        webSocketSender.sendEventToSession(sessionId, response);
    }

    public void sendError(String sessionId, ErrorCode errorCode) {
        WebSocketResponse<Void> response = WebSocketResponse.<Void>builder()
                .event(SocketEvent.ERROR_MESSAGE.name())
                .message(errorCode.getMessage())
                .code(errorCode.name())
                .build();
        webSocketSender.sendEventToSession(sessionId, response);
    }

    public void sendLeaveSuccess(String sessionId) {
        WebSocketResponse<Void> response = WebSocketResponse.<Void>builder()
                .event(SocketEvent.LEAVE_SUCCESS.name())
                .build();
        webSocketSender.sendEventToSession(sessionId, response);
    }

    // 같은 id로 재접속하면 이전 연결은 끊는다
    public void closeReplacedSession(String sessionId) {
        webSocketSender.closeSession(sessionId);
    }
}

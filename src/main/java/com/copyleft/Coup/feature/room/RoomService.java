package com.copyleft.Coup.feature.room;

import com.copyleft.Coup.config.GameProperties;
import com.copyleft.Coup.domain.Game;
import com.copyleft.Coup.domain.Player;
import com.copyleft.Coup.domain.Room;
import com.copyleft.Coup.domain.RoomMember;
import com.copyleft.Coup.domain.type.RejectCode;
import com.copyleft.Coup.domain.type.RoomStatus;
import com.copyleft.Coup.feature.game.EngineResult;
import com.copyleft.Coup.feature.game.GameRoomLockFacade;
import com.copyleft.Coup.feature.game.GameService;
import com.copyleft.Coup.feature.game.GameSetupException;
import com.copyleft.Coup.feature.game.LockResult;
import com.copyleft.Coup.feature.game.dto.ActionRequest;
import com.copyleft.Coup.feature.game.dto.ResponseRequest;
import com.copyleft.Coup.feature.room.dto.JoinRequest;
import com.copyleft.Coup.feature.room.dto.RenameRequest;
import com.copyleft.Coup.feature.room.dto.RespondRequest;
import com.copyleft.Coup.feature.room.dto.TakeActionRequest;
import com.copyleft.Coup.global.constant.ErrorCode;
import com.copyleft.Coup.infra.persistence.RoomRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.function.BiConsumer;

/**
 * 방 입장/퇴장, 게임 시작, 행동과 응답 전달. 같은 방의 요청은 방 락으로 하나씩 처리한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoomService {

    private final RoomRepository roomRepository;
    private final GameRoomLockFacade lockFacade;
    private final GameService gameService;
    private final RoomResponseSender responseSender;
    private final GameProperties gameProperties;

    public void join(String sessionId, JoinRequest request) {
        String roomCode = sanitizeRoomCode(request.getRoom());
        if (roomCode.length() != gameProperties.roomCodeLength()) {
            responseSender.sendError(sessionId, ErrorCode.INVALID_ROOM_CODE);
            return;
        }

        String playerId = request.getId() == null ? "" : request.getId().trim();
        if (playerId.isEmpty()) {
            responseSender.sendError(sessionId, ErrorCode.BAD_JOIN);
            return;
        }

        String name = sanitizeName(request.getName());
        if (name.isEmpty()) {
            name = gameProperties.defaultPlayerName();
        }

        // 이 세션이 다른 방(또는 다른 id)으로 이미 들어가 있으면 먼저 내보낸다
        roomRepository.findSessionBinding(sessionId)
                .filter(b -> !b.roomCode().equals(roomCode) || !b.playerId().equals(playerId))
                .ifPresent(b -> leaveInternal(sessionId, false));

        String joinName = name;
        LockResult<Void> result = lockFacade.execute(roomCode, () -> {
            Room room = roomRepository.findRoomByCode(roomCode).orElse(null);
            RoomMember existing = room == null ? null : room.findMember(playerId).orElse(null);

            if (room != null && existing == null) {
                if (room.size() >= gameProperties.maxPlayerCount()) {
                    responseSender.sendError(sessionId, ErrorCode.ROOM_FULL);
                    return;
                }
                if (room.getStatus() != RoomStatus.LOBBY) {
                    responseSender.sendError(sessionId, ErrorCode.GAME_IN_PROGRESS);
                    return;
                }
            }

            if (room == null) {
                room = new Room(roomCode);
                log.info("방 생성: room={}", roomCode);
            }

            if (existing != null) {
                String oldSessionId = existing.getSessionId();
                existing.setSessionId(sessionId);
                renameMember(room, existing, joinName);

                if (oldSessionId != null && !oldSessionId.equals(sessionId)) {
                    roomRepository.deleteSessionBinding(oldSessionId);
                    responseSender.closeReplacedSession(oldSessionId);
                }
                log.info("재접속: room={}, player={}", roomCode, playerId);
            } else {
                room.addMember(new RoomMember(playerId, joinName, sessionId));
                log.info("방 입장 완료: room={}, player={} ({}/{})",
                        roomCode, playerId, room.size(), gameProperties.maxPlayerCount());
            }

            roomRepository.saveRoom(room);
            roomRepository.saveSessionBinding(sessionId, roomCode, playerId);
            responseSender.broadcastState(room);
        });

        if (result.isLockFailed()) {
            responseSender.sendError(sessionId, ErrorCode.ROOM_BUSY);
        }
    }

    public void rename(String sessionId, RenameRequest request) {
        String name = sanitizeName(request.getName());
        if (name.isEmpty()) return;

        withMember(sessionId, (room, member) -> {
            renameMember(room, member, name);
            responseSender.broadcastState(room);
        });
    }

    public void leave(String sessionId) {
        leaveInternal(sessionId, true);
    }

    /** 연결이 끊긴 세션. 이미 닫혔으므로 퇴장 응답은 보내지 않는다. */
    public void disconnect(String sessionId) {
        leaveInternal(sessionId, false);
    }

    public void startGame(String sessionId) {
        withMember(sessionId, (room, member) -> {
            if (room.getStatus() != RoomStatus.LOBBY) {
                log.debug("로비가 아니라 시작 요청 무시: room={}", room.getRoomCode());
                return;
            }
            startFromJoinOrder(room, member);
        });
    }

    public void rematch(String sessionId) {
        withMember(sessionId, (room, member) -> {
            if (room.getStatus() != RoomStatus.ENDED) {
                log.debug("끝난 게임이 없어 재대결 요청 무시: room={}", room.getRoomCode());
                return;
            }
            startFromJoinOrder(room, member);
        });
    }

    public void takeAction(String sessionId, TakeActionRequest request) {
        withMember(sessionId, (room, member) -> {
            Game game = activeGame(room);
            if (game == null) return;

            String currentId = game.currentPlayer().map(Player::getId).orElse(null);
            if (!member.getId().equals(currentId)) {
                responseSender.sendRejected(sessionId, RejectCode.NOT_YOUR_TURN);
                return;
            }
            if (game.hasPendingAction()) {
                responseSender.sendRejected(sessionId, RejectCode.ACTION_ALREADY_PENDING);
                return;
            }

            EngineResult result = gameService.initiate(game,
                    new ActionRequest(member.getId(), request.getActionType(), request.getTargetId()));
            afterEngineCall(room, sessionId, result);
        });
    }

    public void respond(String sessionId, RespondRequest request) {
        withMember(sessionId, (room, member) -> {
            Game game = activeGame(room);
            if (game == null) return;

            EngineResult result = gameService.respond(game,
                    new ResponseRequest(member.getId(), request.getResponseType(), request.getPayload()));
            afterEngineCall(room, sessionId, result);
        });
    }

    // ---- 내부 ----

    private void withMember(String sessionId, BiConsumer<Room, RoomMember> work) {
        RoomRepository.SessionBinding binding = roomRepository.findSessionBinding(sessionId).orElse(null);
        if (binding == null) {
            responseSender.sendError(sessionId, ErrorCode.NOT_IN_ROOM);
            return;
        }

        LockResult<Void> result = lockFacade.execute(binding.roomCode(), () -> {
            Room room = roomRepository.findRoomByCode(binding.roomCode()).orElse(null);
            RoomMember member = room == null ? null : room.findMember(binding.playerId())
                    .filter(m -> sessionId.equals(m.getSessionId()))
                    .orElse(null);

            if (member == null) {
                roomRepository.deleteSessionBinding(sessionId);
                responseSender.sendError(sessionId, ErrorCode.NOT_IN_ROOM);
                return;
            }
            work.accept(room, member);
        });

        if (result.isLockFailed()) {
            responseSender.sendError(sessionId, ErrorCode.ROOM_BUSY);
        }
    }

    private void leaveInternal(String sessionId, boolean notify) {
        RoomRepository.SessionBinding binding = roomRepository.findSessionBinding(sessionId).orElse(null);
        if (binding == null) {
            log.info("이미 방에 없는 세션의 퇴장 요청: {}", sessionId);
            if (notify) responseSender.sendLeaveSuccess(sessionId);
            return;
        }

        String roomCode = binding.roomCode();
        LockResult<Void> result = lockFacade.execute(roomCode, () -> {
            roomRepository.deleteSessionBinding(sessionId);
            if (notify) responseSender.sendLeaveSuccess(sessionId);

            Room room = roomRepository.findRoomByCode(roomCode).orElse(null);
            if (room == null) return;

            // 재접속으로 이미 다른 세션이 차지했으면 멤버는 그대로 둔다
            RoomMember member = room.findMember(binding.playerId()).orElse(null);
            if (member == null || !sessionId.equals(member.getSessionId())) return;

            boolean wasHost = room.isHost(member.getId());
            room.removeMember(member.getId());

            if (room.isEmpty()) {
                roomRepository.deleteRoom(roomCode);
                log.info("방 삭제 완료: {}", roomCode);
                return;
            }

            if (wasHost) {
                log.info("방장 위임: 구 방장={} -> 새 방장={}", member.getId(), room.getHostId());
            }

            if (room.getStatus() != RoomStatus.LOBBY) {
                room.resetToLobby();
                log.info("게임 중 퇴장으로 로비로 돌아감: room={}, player={}", roomCode, member.getId());
            }

            responseSender.broadcastState(room);
            log.info("방 퇴장 처리 완료: session={}, room={}", sessionId, roomCode);
        });

        if (result.isLockFailed()) {
            if (notify) responseSender.sendError(sessionId, ErrorCode.ROOM_BUSY);
            return;
        }
        if (roomRepository.findRoomByCode(roomCode).isEmpty()) {
            lockFacade.forget(roomCode);
        }
    }

    private void startFromJoinOrder(Room room, RoomMember requester) {
        if (!room.isHost(requester.getId())) {
            responseSender.sendError(requester.getSessionId(), ErrorCode.NOT_HOST);
            return;
        }
        if (room.size() < gameProperties.minPlayerCount()) {
            responseSender.sendError(requester.getSessionId(), ErrorCode.NOT_ENOUGH_PLAYERS);
            return;
        }

        try {
            room.startGame(gameService.newGame(room.seats()));
            log.info("게임 시작: room={}, players={}", room.getRoomCode(), room.size());
        } catch (GameSetupException e) {
            log.warn("게임 시작 실패: room={}, msg={}", room.getRoomCode(), e.getMessage());
            room.resetToLobby();
            responseSender.sendError(requester.getSessionId(), ErrorCode.START_FAILED);
        }
        responseSender.broadcastState(room);
    }

    /**
     * 진행 중인 게임. 이미 끝났으면 방을 종료 상태로 바꾸고 null.
     */
    private Game activeGame(Room room) {
        Game game = room.getGame();
        if (room.getStatus() != RoomStatus.PLAYING || game == null) return null;

        if (game.isGameOver()) {
            room.markEnded();
            responseSender.broadcastState(room);
            return null;
        }
        return game;
    }

    private void afterEngineCall(Room room, String sessionId, EngineResult result) {
        if (room.getGame().isGameOver()) {
            room.markEnded();
            log.info("게임 종료: room={}, winner={}", room.getRoomCode(), room.getGame().getWinnerId());
        }
        if (!result.isAccepted()) {
            responseSender.sendRejected(sessionId, result.rejection());
        }

        responseSender.broadcastState(room);
        responseSender.sendPrivateMessages(room, result.privateMessages());
    }

    private void renameMember(Room room, RoomMember member, String name) {
        member.setName(name);
        if (room.getGame() != null) {
            room.getGame().findPlayer(member.getId()).ifPresent(p -> p.setName(name));
        }
    }

    private String sanitizeRoomCode(String raw) {
        if (raw == null) return "";
        String letters = raw.trim().toUpperCase(Locale.ROOT).replaceAll("[^A-Z]", "");
        int length = gameProperties.roomCodeLength();
        return letters.length() > length ? letters.substring(0, length) : letters;
    }

    private String sanitizeName(String raw) {
        if (raw == null) return "";
        String trimmed = raw.trim();
        int max = gameProperties.nameMaxLength();
        return trimmed.length() > max ? trimmed.substring(0, max) : trimmed;
    }
}

package com.copyleft.Coup.infra.persistence;

import com.copyleft.Coup.domain.Room;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 방과 세션 연결 정보를 프로세스 메모리에만 보관한다.
 * 방 내부 상태 변경은 방 락 안에서만 일어난다.
 */
@Repository
public class RoomRepository {

    private final ConcurrentMap<String, Room> rooms = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, SessionBinding> sessions = new ConcurrentHashMap<>();

    /** 세션이 어느 방의 어느 플레이어인지 */
    public record SessionBinding(String roomCode, String playerId) {}

    public void saveRoom(Room room) {
        rooms.put(room.getRoomCode(), room);
    }

    public Optional<Room> findRoomByCode(String roomCode) {
        return Optional.ofNullable(rooms.get(roomCode));
    }

    public void deleteRoom(String roomCode) {
        rooms.remove(roomCode);
    }

    public void saveSessionBinding(String sessionId, String roomCode, String playerId) {
        sessions.put(sessionId, new SessionBinding(roomCode, playerId));
    }

    public Optional<SessionBinding> findSessionBinding(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public void deleteSessionBinding(String sessionId) {
        sessions.remove(sessionId);
    }
}

package com.copyleft.Coup.domain;

import com.copyleft.Coup.domain.type.RoomStatus;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 방 하나. 참가 순서대로 멤버를 두고, 진행 중인 게임이 있으면 함께 들고 있다.
 */
@Getter
@ToString(exclude = "game")
public class Room {

    private final String roomCode;
    private final List<RoomMember> members = new ArrayList<>();

    private String hostId;
    private RoomStatus status = RoomStatus.LOBBY;

    private Game game;

    public Room(String roomCode) {
        this.roomCode = roomCode;
    }

    public Optional<RoomMember> findMember(String playerId) {
        return members.stream().filter(m -> Objects.equals(m.getId(), playerId)).findFirst();
    }

    public void addMember(RoomMember member) {
        members.add(member);
        if (hostId == null) {
            hostId = member.getId();
        }
    }

    public void removeMember(String playerId) {
        members.removeIf(m -> Objects.equals(m.getId(), playerId));
        if (Objects.equals(hostId, playerId)) {
            delegateHost();
        }
    }

    /**
     * 가장 먼저 들어온 남은 멤버에게 방장을 넘긴다.
     */
    private void delegateHost() {
        this.hostId = members.isEmpty() ? null : members.get(0).getId();
    }

    public boolean isHost(String playerId) {
        return hostId != null && hostId.equals(playerId);
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public int size() {
        return members.size();
    }

    public List<Seat> seats() {
        return members.stream().map(RoomMember::toSeat).toList();
    }

    public void startGame(Game game) {
        this.game = game;
        this.status = RoomStatus.PLAYING;
    }

    public void markEnded() {
        this.status = RoomStatus.ENDED;
    }

    public void resetToLobby() {
        this.game = null;
        this.status = RoomStatus.LOBBY;
    }
}

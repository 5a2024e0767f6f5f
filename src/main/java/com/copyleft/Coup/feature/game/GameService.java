package com.copyleft.Coup.feature.game;

import com.copyleft.Coup.config.GameProperties;
import com.copyleft.Coup.domain.Game;
import com.copyleft.Coup.domain.Seat;
import com.copyleft.Coup.feature.game.dto.ActionRequest;
import com.copyleft.Coup.feature.game.dto.ResponseRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 규칙 엔진의 진입점. 호출한 쪽이 방 단위로 순서를 보장한다고 가정한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameService {

    private final ActionInitiator actionInitiator;
    private final ResponseResolver responseResolver;
    private final GameProperties gameProperties;

    /**
     * @throws GameSetupException 플레이어 목록으로 게임을 만들 수 없을 때
     */
    public Game newGame(List<Seat> seats) {
        try {
            return Game.start(seats);
        } catch (IllegalArgumentException e) {
            throw new GameSetupException(e.getMessage(), e);
        }
    }

    public EngineResult initiate(Game game, ActionRequest request) {
        Resolution resolution = actionInitiator.initiate(game, request);
        if (resolution.isRejected()) {
            log.debug("행동 거절: actorId={}, action={}, reason={}",
                    request.actorId(), request.actionType(), resolution.rejection());
        }
        return toResult(game, resolution);
    }

    public EngineResult respond(Game game, ResponseRequest request) {
        Resolution resolution = responseResolver.respond(game, request);
        if (resolution.isRejected()) {
            log.debug("응답 거절: playerId={}, response={}, reason={}",
                    request.playerId(), request.responseType(), resolution.rejection());
        }
        return toResult(game, resolution);
    }

    private EngineResult toResult(Game game, Resolution resolution) {
        return new EngineResult(
                game.recentLog(gameProperties.logRetention()),
                resolution.privateMessages(),
                resolution.rejection());
    }
}

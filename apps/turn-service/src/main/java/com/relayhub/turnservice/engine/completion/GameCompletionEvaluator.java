package com.relayhub.turnservice.engine.completion;

import com.relayhub.turnservice.domain.enums.GameStatus;
import com.relayhub.turnservice.domain.enums.SeasonStatus;
import com.relayhub.turnservice.domain.enums.TurnStatus;
import com.relayhub.turnservice.domain.model.Game;
import com.relayhub.turnservice.domain.model.SeasonPlayer;
import com.relayhub.turnservice.domain.repository.GameRepository;
import com.relayhub.turnservice.domain.repository.SeasonPlayerRepository;
import com.relayhub.turnservice.domain.repository.SeasonRepository;
import com.relayhub.turnservice.domain.repository.TurnRepository;
import com.relayhub.turnservice.engine.core.EngineException;
import com.relayhub.turnservice.engine.core.GameProgressEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * 对局完成判定：赛季全部成员在本局都有一个已结束（COMPLETED/SKIPPED）的回合即完成。
 * 首次判定完成时翻转对局状态并继续判定赛季。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameCompletionEvaluator {

    private static final Set<GameStatus> OPEN_GAME = EnumSet.of(GameStatus.PENDING_START, GameStatus.ACTIVE);
    private static final Set<GameStatus> CLOSED_GAME = EnumSet.of(GameStatus.COMPLETED, GameStatus.TERMINATED);

    private final GameRepository gameRepository;
    private final SeasonRepository seasonRepository;
    private final SeasonPlayerRepository seasonPlayerRepository;
    private final TurnRepository turnRepository;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * @throws EngineException NOT_FOUND 对局不存在
     */
    @Transactional(rollbackFor = Exception.class)
    public boolean isComplete(UUID gameId) {
        Game game = gameRepository.findById(gameId)
                .orElseThrow(() -> EngineException.notFound("对局不存在: " + gameId));
        if (game.getStatus() == GameStatus.COMPLETED) {
            return true;
        }
        if (game.getStatus() == GameStatus.TERMINATED) {
            return false;
        }

        List<SeasonPlayer> members = seasonPlayerRepository.findBySeasonIdOrderByJoinedAtAsc(game.getSeasonId());
        Set<UUID> finished = new HashSet<>(turnRepository.findPlayerIdsByGameAndStatusIn(gameId, TurnStatus.FINISHED));
        boolean complete = !members.isEmpty()
                && members.stream().allMatch(m -> finished.contains(m.getPlayerId()));
        if (!complete) {
            return false;
        }

        OffsetDateTime now = OffsetDateTime.now();
        if (gameRepository.finish(gameId, OPEN_GAME, GameStatus.COMPLETED, now) == 1) {
            log.info("对局完成: gameId={}, seasonId={}, players={}", gameId, game.getSeasonId(), members.size());
            eventPublisher.publishEvent(GameProgressEvent.gameCompleted(game.getSeasonId(), gameId));
            evaluateSeason(game.getSeasonId(), now);
        }
        return true;
    }

    /**
     * 赛季下全部对局都已结束时，ACTIVE → COMPLETED
     */
    private void evaluateSeason(UUID seasonId, OffsetDateTime now) {
        long open = gameRepository.countBySeasonIdAndStatusNotIn(seasonId, CLOSED_GAME);
        if (open > 0) {
            return;
        }
        if (seasonRepository.transition(seasonId, SeasonStatus.ACTIVE, SeasonStatus.COMPLETED, now) == 1) {
            log.info("赛季完成: seasonId={}", seasonId);
            eventPublisher.publishEvent(GameProgressEvent.seasonCompleted(seasonId));
        }
    }
}

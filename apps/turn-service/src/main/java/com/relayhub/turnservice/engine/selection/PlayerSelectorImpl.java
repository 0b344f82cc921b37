package com.relayhub.turnservice.engine.selection;

import com.relayhub.turnservice.domain.enums.TurnStatus;
import com.relayhub.turnservice.domain.enums.TurnType;
import com.relayhub.turnservice.domain.model.Game;
import com.relayhub.turnservice.domain.model.Player;
import com.relayhub.turnservice.domain.model.SeasonPlayer;
import com.relayhub.turnservice.domain.model.Turn;
import com.relayhub.turnservice.domain.repository.GameRepository;
import com.relayhub.turnservice.domain.repository.PlayerRepository;
import com.relayhub.turnservice.domain.repository.SeasonPlayerRepository;
import com.relayhub.turnservice.domain.repository.SeasonRepository;
import com.relayhub.turnservice.domain.repository.TurnRepository;
import com.relayhub.turnservice.engine.core.EngineResult;
import com.relayhub.turnservice.engine.core.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 选人服务：从存储中汇总赛季统计，交给 {@link PlayerSelectionPipeline} 计算。
 */
@Slf4j
@Service
public class PlayerSelectorImpl implements PlayerSelector {

    private final GameRepository gameRepository;
    private final SeasonRepository seasonRepository;
    private final SeasonPlayerRepository seasonPlayerRepository;
    private final TurnRepository turnRepository;
    private final PlayerRepository playerRepository;
    private final PlayerSelectionPipeline pipeline = PlayerSelectionPipeline.standard();

    public PlayerSelectorImpl(GameRepository gameRepository,
                              SeasonRepository seasonRepository,
                              SeasonPlayerRepository seasonPlayerRepository,
                              TurnRepository turnRepository,
                              PlayerRepository playerRepository) {
        this.gameRepository = gameRepository;
        this.seasonRepository = seasonRepository;
        this.seasonPlayerRepository = seasonPlayerRepository;
        this.turnRepository = turnRepository;
        this.playerRepository = playerRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public EngineResult<Player> selectNextPlayer(UUID gameId, TurnType turnType) {
        Game game = gameRepository.findById(gameId).orElse(null);
        if (game == null) {
            return EngineResult.fail(ErrorCode.NOT_FOUND, "对局不存在: " + gameId);
        }
        if (!seasonRepository.existsById(game.getSeasonId())) {
            return EngineResult.fail(ErrorCode.NOT_FOUND, "赛季不存在: " + game.getSeasonId());
        }

        List<SeasonPlayer> members = seasonPlayerRepository.findBySeasonIdOrderByJoinedAtAsc(game.getSeasonId());
        List<Turn> seasonTurns = turnRepository.findAllInSeason(game.getSeasonId());
        List<PlayerTurnStats> stats = collectStats(members, seasonTurns, gameId);
        SelectionContext context = new SelectionContext(gameId, turnType, members.size(),
                previousPlayer(seasonTurns, gameId));

        Optional<PlayerTurnStats> chosen = pipeline.select(stats, context);
        if (chosen.isEmpty()) {
            log.warn("无可分配玩家: gameId={}, turnType={}, members={}", gameId, turnType, members.size());
            return EngineResult.fail(ErrorCode.NO_ELIGIBLE_PLAYERS, "没有可分配的玩家: " + gameId);
        }
        UUID playerId = chosen.get().playerId();
        return playerRepository.findById(playerId)
                .map(EngineResult::ok)
                .orElseGet(() -> EngineResult.fail(ErrorCode.NOT_FOUND, "玩家不存在: " + playerId));
    }

    /**
     * 汇总每个成员的赛季统计
     */
    static List<PlayerTurnStats> collectStats(List<SeasonPlayer> members, List<Turn> seasonTurns, UUID gameId) {
        List<PlayerTurnStats> stats = new ArrayList<>(members.size());
        for (SeasonPlayer member : members) {
            UUID pid = member.getPlayerId();
            int writing = 0;
            int drawing = 0;
            int pending = 0;
            boolean playedInGame = false;
            for (Turn t : seasonTurns) {
                if (!pid.equals(t.getPlayerId()) || !TurnStatus.ASSIGNED.contains(t.getStatus())) {
                    continue;
                }
                if (t.getType() == TurnType.WRITING) {
                    writing++;
                } else {
                    drawing++;
                }
                if (t.getStatus() == TurnStatus.PENDING) {
                    pending++;
                }
                if (gameId.equals(t.getGameId())) {
                    playedInGame = true;
                }
            }
            stats.add(new PlayerTurnStats(pid, writing, drawing, pending, playedInGame));
        }
        return stats;
    }

    /**
     * 本局序号最大的已结束回合的玩家
     */
    static UUID previousPlayer(List<Turn> seasonTurns, UUID gameId) {
        return seasonTurns.stream()
                .filter(t -> gameId.equals(t.getGameId()) && t.getStatus().isFinished())
                .max(Comparator.comparingInt(Turn::getTurnNumber))
                .map(Turn::getPlayerId)
                .orElse(null);
    }
}

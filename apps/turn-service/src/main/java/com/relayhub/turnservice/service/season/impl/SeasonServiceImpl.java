package com.relayhub.turnservice.service.season.impl;

import com.relayhub.turnservice.clock.scheduler.TimeoutScheduler;
import com.relayhub.turnservice.config.SeasonDefaultsProperties;
import com.relayhub.turnservice.domain.enums.GameStatus;
import com.relayhub.turnservice.domain.enums.SeasonStatus;
import com.relayhub.turnservice.domain.enums.TimeoutPhase;
import com.relayhub.turnservice.domain.enums.TurnStatus;
import com.relayhub.turnservice.domain.enums.TurnType;
import com.relayhub.turnservice.domain.model.Game;
import com.relayhub.turnservice.domain.model.Player;
import com.relayhub.turnservice.domain.model.Season;
import com.relayhub.turnservice.domain.model.SeasonConfig;
import com.relayhub.turnservice.domain.model.SeasonPlayer;
import com.relayhub.turnservice.domain.model.TimeoutPayload;
import com.relayhub.turnservice.domain.model.Turn;
import com.relayhub.turnservice.domain.repository.GameRepository;
import com.relayhub.turnservice.domain.repository.SeasonPlayerRepository;
import com.relayhub.turnservice.domain.repository.SeasonRepository;
import com.relayhub.turnservice.domain.repository.TurnRepository;
import com.relayhub.turnservice.dto.request.CreateSeasonRequest;
import com.relayhub.turnservice.dto.response.GameView;
import com.relayhub.turnservice.dto.response.SeasonView;
import com.relayhub.turnservice.dto.response.TurnView;
import com.relayhub.turnservice.engine.core.EngineException;
import com.relayhub.turnservice.engine.offering.OfferReason;
import com.relayhub.turnservice.engine.offering.TurnOfferingOrchestrator;
import com.relayhub.turnservice.service.player.PlayerService;
import com.relayhub.turnservice.service.season.SeasonService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 赛季服务实现类
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SeasonServiceImpl implements SeasonService {

    private final SeasonRepository seasonRepository;
    private final SeasonPlayerRepository seasonPlayerRepository;
    private final GameRepository gameRepository;
    private final TurnRepository turnRepository;
    private final PlayerService playerService;
    private final TurnOfferingOrchestrator orchestrator;
    private final TimeoutScheduler timeoutScheduler;
    private final SeasonDefaultsProperties defaults;
    private final TransactionTemplate transactionTemplate;

    @Override
    @Transactional(rollbackFor = Exception.class)
    public Season createSeason(CreateSeasonRequest request) {
        SeasonConfig config = resolveConfig(request);
        Player creator = playerService.getOrCreate(request.getCreatorExternalId(), request.getCreatorName());

        Season season = seasonRepository.save(Season.builder()
                .name(request.getName().trim())
                .creatorId(creator.getId())
                .status(SeasonStatus.OPEN)
                .config(config)
                .build());
        seasonPlayerRepository.save(SeasonPlayer.builder()
                .seasonId(season.getId())
                .playerId(creator.getId())
                .build());

        if (config.hasOpenDuration()) {
            // 报名期结束自动开赛（或人数不足时终止）
            timeoutScheduler.schedule(TimeoutPhase.SEASON_OPEN.jobId(season.getId()),
                    Instant.now().plusSeconds(config.getOpenDurationMinutes() * 60L),
                    TimeoutPayload.forSeason(season.getId()),
                    TimeoutPhase.SEASON_OPEN);
        }

        log.info("创建赛季: seasonId={}, name={}, creatorId={}, pattern={}, openDurationMinutes={}",
                season.getId(), season.getName(), creator.getId(), config.getTurnPattern(),
                config.getOpenDurationMinutes());
        return season;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public SeasonPlayer joinSeason(UUID seasonId, String externalId, String displayName) {
        Season season = seasonRepository.lockById(seasonId)
                .orElseThrow(() -> EngineException.notFound("赛季不存在: " + seasonId));
        Player player = playerService.getOrCreate(externalId, displayName);

        Optional<SeasonPlayer> existing = seasonPlayerRepository.findBySeasonIdAndPlayerId(seasonId, player.getId());
        if (existing.isPresent()) {
            return existing.get();
        }
        if (!season.getStatus().acceptsPlayers()) {
            throw EngineException.invalidState("赛季状态为 " + season.getStatus() + "，不能加入");
        }
        long count = seasonPlayerRepository.countBySeasonId(seasonId);
        if (count >= season.getConfig().getMaxPlayers()) {
            throw EngineException.invalidState("赛季人数已满: " + season.getConfig().getMaxPlayers());
        }

        SeasonPlayer member = seasonPlayerRepository.save(SeasonPlayer.builder()
                .seasonId(seasonId)
                .playerId(player.getId())
                .build());
        log.info("加入赛季: seasonId={}, playerId={}, members={}", seasonId, player.getId(), count + 1);
        return member;
    }

    @Override
    public List<Game> activateSeason(UUID seasonId) {
        // 建局与第 1 回合在一个事务内；分配放在提交之后，每局各自一个事务
        List<Game> games = transactionTemplate.execute(status -> {
            Season season = seasonRepository.lockById(seasonId)
                    .orElseThrow(() -> EngineException.notFound("赛季不存在: " + seasonId));
            if (season.getStatus() != SeasonStatus.OPEN) {
                throw EngineException.invalidState("赛季状态为 " + season.getStatus() + "，不能开赛");
            }
            List<SeasonPlayer> members = seasonPlayerRepository.findBySeasonIdOrderByJoinedAtAsc(seasonId);
            if (members.size() < season.getConfig().getMinPlayers()) {
                throw EngineException.invalidState("人数不足: " + members.size() + " < " + season.getConfig().getMinPlayers());
            }

            season.setStatus(SeasonStatus.ACTIVE);
            seasonRepository.save(season);
            timeoutScheduler.cancel(TimeoutPhase.SEASON_OPEN.jobId(seasonId));

            List<Game> created = new ArrayList<>(members.size());
            for (int i = 0; i < members.size(); i++) {
                Game game = gameRepository.save(Game.builder()
                        .seasonId(seasonId)
                        .status(GameStatus.ACTIVE)
                        .build());
                orchestrator.createInitialTurn(game);
                created.add(game);
            }
            log.info("赛季开赛: seasonId={}, games={}", seasonId, created.size());
            return created;
        });

        for (Game game : games) {
            orchestrator.offerNext(game.getId(), OfferReason.GAME_CREATED);
        }
        return games;
    }

    @Override
    public void handleOpenDurationTimeout(UUID seasonId) {
        Season season = seasonRepository.findById(seasonId).orElse(null);
        if (season == null || season.getStatus() != SeasonStatus.OPEN) {
            log.info("报名期到期时赛季已不在报名中，忽略: seasonId={}, status={}",
                    seasonId, season == null ? null : season.getStatus());
            return;
        }
        long members = seasonPlayerRepository.countBySeasonId(seasonId);
        int minPlayers = season.getConfig().getMinPlayers();
        try {
            if (members >= minPlayers) {
                List<Game> games = activateSeason(seasonId);
                log.info("报名期结束，自动开赛: seasonId={}, members={}, games={}", seasonId, members, games.size());
            } else {
                // 自调用不经过代理，显式开启事务
                transactionTemplate.executeWithoutResult(status -> terminateSeason(seasonId));
                log.info("报名期结束人数不足，赛季终止: seasonId={}, members={}, minPlayers={}",
                        seasonId, members, minPlayers);
            }
        } catch (EngineException e) {
            // 与手动开赛/终止并发时，后到的一方被状态检查拒绝
            log.warn("报名期到期处理被拒绝: seasonId={}, code={}, reason={}", seasonId, e.getCode(), e.getMessage());
        }
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public Season terminateSeason(UUID seasonId) {
        Season season = seasonRepository.lockById(seasonId)
                .orElseThrow(() -> EngineException.notFound("赛季不存在: " + seasonId));
        if (season.getStatus().isFinished()) {
            throw EngineException.invalidState("赛季已结束: " + season.getStatus());
        }

        OffsetDateTime now = OffsetDateTime.now();
        List<Turn> outstanding = turnRepository.findInSeasonByStatusIn(seasonId,
                EnumSet.of(TurnStatus.OFFERED, TurnStatus.PENDING));
        // 未认领的邀请撤回，进行中的回合跳过：终止后不留 OFFERED/PENDING 回合
        for (Turn turn : outstanding) {
            if (turn.getStatus() == TurnStatus.OFFERED) {
                turnRepository.markDismissed(turn.getId(), now);
                timeoutScheduler.cancel(TimeoutPhase.CLAIM.jobId(turn.getId()));
            } else {
                turnRepository.markSkipped(turn.getId(), TurnStatus.PENDING, now);
                timeoutScheduler.cancel(TimeoutPhase.SUBMISSION.jobId(turn.getId()));
            }
        }
        timeoutScheduler.cancel(TimeoutPhase.SEASON_OPEN.jobId(seasonId));
        int games = gameRepository.finishAllInSeason(seasonId,
                EnumSet.of(GameStatus.PENDING_START, GameStatus.ACTIVE), GameStatus.TERMINATED, now);
        seasonRepository.transition(seasonId, season.getStatus(), SeasonStatus.TERMINATED, now);

        log.info("赛季已终止: seasonId={}, terminatedGames={}, cancelledTimeouts={}", seasonId, games, outstanding.size());
        return seasonRepository.findById(seasonId).orElseThrow();
    }

    @Override
    @Transactional(readOnly = true)
    public SeasonView getSeason(UUID seasonId) {
        Season season = seasonRepository.findById(seasonId)
                .orElseThrow(() -> EngineException.notFound("赛季不存在: " + seasonId));
        List<UUID> playerIds = seasonPlayerRepository.findBySeasonIdOrderByJoinedAtAsc(seasonId).stream()
                .map(SeasonPlayer::getPlayerId)
                .toList();
        List<SeasonView.GameSummary> games = gameRepository.findBySeasonIdOrderByCreatedAtAsc(seasonId).stream()
                .map(g -> new SeasonView.GameSummary(g.getId(), g.getStatus()))
                .toList();
        return SeasonView.builder()
                .id(season.getId())
                .name(season.getName())
                .status(season.getStatus())
                .creatorId(season.getCreatorId())
                .config(season.getConfig())
                .playerIds(playerIds)
                .games(games)
                .build();
    }

    @Override
    @Transactional(readOnly = true)
    public GameView getGame(UUID gameId) {
        Game game = gameRepository.findById(gameId)
                .orElseThrow(() -> EngineException.notFound("对局不存在: " + gameId));
        List<TurnView> turns = turnRepository.findByGameIdOrderByTurnNumberAsc(gameId).stream()
                .map(TurnView::from)
                .toList();
        return GameView.builder()
                .id(game.getId())
                .seasonId(game.getSeasonId())
                .status(game.getStatus())
                .createdAt(game.getCreatedAt())
                .completedAt(game.getCompletedAt())
                .turns(turns)
                .build();
    }

    /**
     * 默认配置 + 请求中的覆盖项
     */
    private SeasonConfig resolveConfig(CreateSeasonRequest request) {
        SeasonConfig config = defaults.toConfig();
        if (request.getMinPlayers() != null) {
            config.setMinPlayers(request.getMinPlayers());
        }
        if (request.getMaxPlayers() != null) {
            config.setMaxPlayers(request.getMaxPlayers());
        }
        if (request.getTurnPattern() != null) {
            config.setTurnPattern(request.getTurnPattern());
        }
        if (request.getClaimTimeoutMinutes() != null) {
            config.setClaimTimeoutMinutes(request.getClaimTimeoutMinutes());
        }
        if (request.getWritingTimeoutMinutes() != null) {
            config.setWritingTimeoutMinutes(request.getWritingTimeoutMinutes());
        }
        if (request.getDrawingTimeoutMinutes() != null) {
            config.setDrawingTimeoutMinutes(request.getDrawingTimeoutMinutes());
        }
        if (request.getOpenDurationMinutes() != null) {
            config.setOpenDurationMinutes(request.getOpenDurationMinutes());
        }

        if (config.getMinPlayers() < 1 || config.getMaxPlayers() > 100) {
            throw EngineException.validation("人数范围必须在 1..100 之间");
        }
        if (config.getClaimTimeoutMinutes() <= 0
                || config.getWritingTimeoutMinutes() <= 0
                || config.getDrawingTimeoutMinutes() <= 0) {
            throw EngineException.validation("超时时长必须大于0");
        }
        if (config.getOpenDurationMinutes() != null && config.getOpenDurationMinutes() < 0) {
            throw EngineException.validation("报名期不能为负数");
        }
        if (config.getMinPlayers() > config.getMaxPlayers()) {
            throw EngineException.validation("最少人数不能大于最多人数: "
                    + config.getMinPlayers() + " > " + config.getMaxPlayers());
        }
        List<TurnType> pattern;
        try {
            pattern = config.patternTypes();
        } catch (IllegalArgumentException e) {
            throw EngineException.validation("回合序列不合法: " + config.getTurnPattern());
        }
        if (pattern.isEmpty()) {
            throw EngineException.validation("回合序列不能为空");
        }
        return config;
    }
}

package com.relayhub.turnservice.engine.lifecycle;

import com.relayhub.turnservice.clock.scheduler.TimeoutScheduler;
import com.relayhub.turnservice.domain.enums.ContentType;
import com.relayhub.turnservice.domain.enums.GameStatus;
import com.relayhub.turnservice.domain.enums.TimeoutPhase;
import com.relayhub.turnservice.domain.enums.TurnStatus;
import com.relayhub.turnservice.domain.model.Game;
import com.relayhub.turnservice.domain.model.Season;
import com.relayhub.turnservice.domain.model.SeasonConfig;
import com.relayhub.turnservice.domain.model.TimeoutPayload;
import com.relayhub.turnservice.domain.model.Turn;
import com.relayhub.turnservice.domain.repository.GameRepository;
import com.relayhub.turnservice.domain.repository.PlayerRepository;
import com.relayhub.turnservice.domain.repository.SeasonRepository;
import com.relayhub.turnservice.domain.repository.TurnRepository;
import com.relayhub.turnservice.engine.core.EngineException;
import com.relayhub.turnservice.engine.core.EngineResult;
import com.relayhub.turnservice.engine.core.ErrorCode;
import com.relayhub.turnservice.engine.core.TurnLifecycleEvent;
import com.relayhub.turnservice.engine.offering.TurnOfferingOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Lazy;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * 回合状态机默认实现。
 *
 * 约定：
 *  - 状态判断以 TurnRepository 的条件更新结果为准，读取到的实体只用于提前给出可读的拒绝原因；
 *  - 认领前对玩家行加写锁，同一玩家的认领串行执行，保证赛季内至多一个 PENDING；
 *  - offer/claim/submit 只接受 ACTIVE 对局中的回合；
 *  - submit/skip 成功提交后（事务外）交给编排器推进对局。
 */
@Slf4j
@Service
public class TurnLifecycleManagerImpl implements TurnLifecycleManager {

    static final int MAX_TEXT_LENGTH = 2000;
    static final int MAX_URL_LENGTH = 1000;

    private final TurnRepository turnRepository;
    private final GameRepository gameRepository;
    private final SeasonRepository seasonRepository;
    private final PlayerRepository playerRepository;
    private final TimeoutScheduler timeoutScheduler;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    // 编排器反过来依赖本类，延迟注入
    private final TurnOfferingOrchestrator orchestrator;

    public TurnLifecycleManagerImpl(TurnRepository turnRepository,
                                    GameRepository gameRepository,
                                    SeasonRepository seasonRepository,
                                    PlayerRepository playerRepository,
                                    TimeoutScheduler timeoutScheduler,
                                    ApplicationEventPublisher eventPublisher,
                                    TransactionTemplate transactionTemplate,
                                    @Lazy TurnOfferingOrchestrator orchestrator) {
        this.turnRepository = turnRepository;
        this.gameRepository = gameRepository;
        this.seasonRepository = seasonRepository;
        this.playerRepository = playerRepository;
        this.timeoutScheduler = timeoutScheduler;
        this.eventPublisher = eventPublisher;
        this.transactionTemplate = transactionTemplate;
        this.orchestrator = orchestrator;
    }

    @Override
    public EngineResult<Turn> offer(UUID turnId, UUID playerId) {
        return inTransaction("offer", turnId, () -> {
            Turn turn = loadTurn(turnId);
            requireStatus(turn, TurnStatus.AVAILABLE);
            if (!playerRepository.existsById(playerId)) {
                throw EngineException.notFound("玩家不存在: " + playerId);
            }
            SeasonConfig config = loadSeason(loadActiveGame(turn)).getConfig();

            OffsetDateTime now = OffsetDateTime.now();
            int rows = turnRepository.markOffered(turnId, turn.getGameId(), playerId, now);
            if (rows == 0) {
                throw EngineException.invalidState("回合不可邀请，或玩家在本局已有回合: turnId=" + turnId);
            }
            timeoutScheduler.schedule(TimeoutPhase.CLAIM.jobId(turnId),
                    now.toInstant().plusSeconds(config.getClaimTimeoutMinutes() * 60L),
                    new TimeoutPayload(turnId, playerId),
                    TimeoutPhase.CLAIM);

            log.info("回合已邀请: turnId={}, gameId={}, turnNumber={}, playerId={}",
                    turnId, turn.getGameId(), turn.getTurnNumber(), playerId);
            eventPublisher.publishEvent(TurnLifecycleEvent.of(
                    TurnLifecycleEvent.EventType.OFFERED, turnId, turn.getGameId(), playerId));
            return reload(turnId);
        });
    }

    @Override
    public EngineResult<Turn> claim(UUID turnId, UUID playerId) {
        return inTransaction("claim", turnId, () -> {
            Turn turn = loadTurn(turnId);
            requireStatus(turn, TurnStatus.OFFERED);
            if (turn.getPlayerId() != null && !turn.getPlayerId().equals(playerId)) {
                throw EngineException.invalidState("回合邀请的不是该玩家: turnId=" + turnId);
            }
            Game game = loadActiveGame(turn);
            playerRepository.lockById(playerId)
                    .orElseThrow(() -> EngineException.notFound("玩家不存在: " + playerId));
            Season season = loadSeason(game);
            if (turnRepository.countInSeasonByPlayerAndStatus(season.getId(), playerId, TurnStatus.PENDING) > 0) {
                throw EngineException.invalidState("玩家在本赛季已有进行中的回合: playerId=" + playerId);
            }

            OffsetDateTime now = OffsetDateTime.now();
            int rows = turnRepository.markClaimed(turnId, turn.getGameId(), playerId, now);
            if (rows == 0) {
                throw EngineException.invalidState("回合已不处于可认领状态: turnId=" + turnId);
            }
            timeoutScheduler.cancel(TimeoutPhase.CLAIM.jobId(turnId));
            int minutes = season.getConfig().submissionTimeoutMinutes(turn.getType());
            timeoutScheduler.schedule(TimeoutPhase.SUBMISSION.jobId(turnId),
                    now.toInstant().plusSeconds(minutes * 60L),
                    new TimeoutPayload(turnId, playerId),
                    TimeoutPhase.SUBMISSION);

            log.info("回合已认领: turnId={}, playerId={}, submitWithinMinutes={}", turnId, playerId, minutes);
            eventPublisher.publishEvent(TurnLifecycleEvent.of(
                    TurnLifecycleEvent.EventType.CLAIMED, turnId, turn.getGameId(), playerId));
            return reload(turnId);
        });
    }

    @Override
    public EngineResult<Turn> submit(UUID turnId, UUID playerId, String content, ContentType contentType) {
        EngineResult<Turn> result = inTransaction("submit", turnId, () -> {
            Turn turn = loadTurn(turnId);
            requireStatus(turn, TurnStatus.PENDING);
            if (!Objects.equals(turn.getPlayerId(), playerId)) {
                throw EngineException.invalidState("只有认领者可以提交: turnId=" + turnId);
            }
            validateContent(turn, content, contentType);
            loadActiveGame(turn);

            String text = contentType == ContentType.TEXT ? content.trim() : null;
            String image = contentType == ContentType.IMAGE ? content.trim() : null;
            int rows = turnRepository.markCompleted(turnId, playerId, text, image, OffsetDateTime.now());
            if (rows == 0) {
                throw EngineException.invalidState("回合已不处于可提交状态: turnId=" + turnId);
            }
            timeoutScheduler.cancel(TimeoutPhase.SUBMISSION.jobId(turnId));

            log.info("回合已提交: turnId={}, playerId={}, contentType={}", turnId, playerId, contentType);
            eventPublisher.publishEvent(TurnLifecycleEvent.of(
                    TurnLifecycleEvent.EventType.COMPLETED, turnId, turn.getGameId(), playerId));
            return reload(turnId);
        });
        if (result.isOk()) {
            advance(result.value());
        }
        return result;
    }

    @Override
    public EngineResult<Turn> dismiss(UUID turnId) {
        return inTransaction("dismiss", turnId, () -> {
            Turn turn = loadTurn(turnId);
            requireStatus(turn, TurnStatus.OFFERED);
            UUID previousPlayer = turn.getPlayerId();

            int rows = turnRepository.markDismissed(turnId, OffsetDateTime.now());
            if (rows == 0) {
                throw EngineException.invalidState("回合已不处于邀请状态: turnId=" + turnId);
            }
            timeoutScheduler.cancel(TimeoutPhase.CLAIM.jobId(turnId));

            log.info("回合邀请已撤回: turnId={}, playerId={}", turnId, previousPlayer);
            eventPublisher.publishEvent(TurnLifecycleEvent.of(
                    TurnLifecycleEvent.EventType.DISMISSED, turnId, turn.getGameId(), previousPlayer));
            return reload(turnId);
        });
    }

    @Override
    public EngineResult<Turn> skip(UUID turnId) {
        // 幂等返回时不推进对局
        AtomicBoolean transitioned = new AtomicBoolean(false);
        EngineResult<Turn> result = inTransaction("skip", turnId, () -> {
            Turn turn = loadTurn(turnId);
            if (turn.getStatus().isFinished()) {
                return turn;
            }
            if (turn.getStatus() != TurnStatus.OFFERED && turn.getStatus() != TurnStatus.PENDING) {
                throw EngineException.invalidState("回合状态为 " + turn.getStatus() + "，不能跳过: turnId=" + turnId);
            }
            TimeoutPhase phase = turn.getStatus() == TurnStatus.OFFERED ? TimeoutPhase.CLAIM : TimeoutPhase.SUBMISSION;

            int rows = turnRepository.markSkipped(turnId, turn.getStatus(), OffsetDateTime.now());
            if (rows == 0) {
                Turn latest = reload(turnId);
                if (latest.getStatus().isFinished()) {
                    // 并发的另一次 skip/submit 已先完成
                    return latest;
                }
                throw EngineException.invalidState("回合状态已改变，不能跳过: turnId=" + turnId);
            }
            timeoutScheduler.cancel(phase.jobId(turnId));
            transitioned.set(true);

            log.info("回合已跳过: turnId={}, playerId={}, from={}", turnId, turn.getPlayerId(), turn.getStatus());
            eventPublisher.publishEvent(TurnLifecycleEvent.of(
                    TurnLifecycleEvent.EventType.SKIPPED, turnId, turn.getGameId(), turn.getPlayerId()));
            return reload(turnId);
        });
        if (result.isOk() && transitioned.get()) {
            advance(result.value());
        }
        return result;
    }

    /**
     * 在事务中执行迁移；业务拒绝与并发冲突都转换为失败结果（事务回滚）
     */
    private EngineResult<Turn> inTransaction(String op, UUID turnId, Supplier<Turn> work) {
        try {
            return EngineResult.ok(transactionTemplate.execute(status -> work.get()));
        } catch (EngineException e) {
            log.warn("回合 {} 被拒绝: turnId={}, code={}, reason={}", op, turnId, e.getCode(), e.getMessage());
            return EngineResult.fail(e);
        } catch (ConcurrencyFailureException e) {
            log.warn("回合 {} 并发冲突: turnId={}, cause={}", op, turnId, e.getMessage());
            return EngineResult.fail(ErrorCode.INVALID_STATE, "并发冲突，请重试: turnId=" + turnId);
        }
    }

    private void advance(Turn finished) {
        try {
            orchestrator.advanceAfter(finished);
        } catch (EngineException e) {
            // 回合本身已结束，推进失败不影响本次结果
            log.warn("对局推进失败: gameId={}, turnId={}, code={}, reason={}",
                    finished.getGameId(), finished.getId(), e.getCode(), e.getMessage());
        } catch (RuntimeException e) {
            // 数据库等异常同样只记录，不改变本次结果
            log.error("对局推进异常: gameId={}, turnId={}", finished.getGameId(), finished.getId(), e);
        }
    }

    /**
     * 内容校验：类型匹配、非空、长度；图片必须是 http(s) 地址
     */
    static void validateContent(Turn turn, String content, ContentType contentType) {
        if (contentType == null || contentType != turn.getType().expectedContent()) {
            throw EngineException.validation(turn.getType() + " 回合只接受 " + turn.getType().expectedContent() + " 内容");
        }
        if (content == null || content.isBlank()) {
            throw EngineException.validation("提交内容不能为空");
        }
        String trimmed = content.trim();
        if (contentType == ContentType.TEXT) {
            if (trimmed.length() > MAX_TEXT_LENGTH) {
                throw EngineException.validation("文本长度不能超过 " + MAX_TEXT_LENGTH);
            }
            return;
        }
        if (trimmed.length() > MAX_URL_LENGTH || !isHttpUrl(trimmed)) {
            throw EngineException.validation("图片必须是有效的 http(s) 地址");
        }
    }

    private static boolean isHttpUrl(String value) {
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme();
            return ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme)) && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private Turn loadTurn(UUID turnId) {
        return turnRepository.findById(turnId)
                .orElseThrow(() -> EngineException.notFound("回合不存在: " + turnId));
    }

    private Turn reload(UUID turnId) {
        return loadTurn(turnId);
    }

    private Game loadActiveGame(Turn turn) {
        Game game = gameRepository.findById(turn.getGameId())
                .orElseThrow(() -> EngineException.notFound("对局不存在: " + turn.getGameId()));
        if (game.getStatus() != GameStatus.ACTIVE) {
            throw EngineException.invalidState("对局状态为 " + game.getStatus() + "，回合不可操作: turnId=" + turn.getId());
        }
        return game;
    }

    private Season loadSeason(Game game) {
        return seasonRepository.findById(game.getSeasonId())
                .orElseThrow(() -> EngineException.notFound("赛季不存在: " + game.getSeasonId()));
    }

    private static void requireStatus(Turn turn, TurnStatus expected) {
        if (turn.getStatus() != expected) {
            throw EngineException.invalidState("回合状态为 " + turn.getStatus() + "，需要 " + expected + ": turnId=" + turn.getId());
        }
    }
}

package com.relayhub.turnservice.engine.offering;

import com.relayhub.turnservice.domain.enums.TurnStatus;
import com.relayhub.turnservice.domain.model.Game;
import com.relayhub.turnservice.domain.model.Player;
import com.relayhub.turnservice.domain.model.Season;
import com.relayhub.turnservice.domain.model.SeasonConfig;
import com.relayhub.turnservice.domain.model.Turn;
import com.relayhub.turnservice.domain.repository.GameRepository;
import com.relayhub.turnservice.domain.repository.SeasonRepository;
import com.relayhub.turnservice.domain.repository.TurnRepository;
import com.relayhub.turnservice.engine.completion.GameCompletionEvaluator;
import com.relayhub.turnservice.engine.core.EngineException;
import com.relayhub.turnservice.engine.core.EngineResult;
import com.relayhub.turnservice.engine.core.ErrorCode;
import com.relayhub.turnservice.engine.lifecycle.TurnLifecycleManager;
import com.relayhub.turnservice.engine.selection.PlayerSelector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;
import java.util.UUID;

/**
 * 回合分配编排默认实现。
 *
 * 流程：
 *  1) offerNext：取序号最小的 AVAILABLE 回合 → 选人 → offer；
 *  2) advanceAfter：判定对局是否完成 → 未完成则创建 n+1 回合（类型按 pattern 循环）→ offerNext；
 *  3) 无人可选只记录日志并返回，不重试，等待下一次触发（或手动 MANUAL_RECHECK）。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TurnOfferingOrchestratorImpl implements TurnOfferingOrchestrator {

    private final GameRepository gameRepository;
    private final SeasonRepository seasonRepository;
    private final TurnRepository turnRepository;
    private final PlayerSelector playerSelector;
    private final TurnLifecycleManager lifecycleManager;
    private final GameCompletionEvaluator completionEvaluator;
    private final TransactionTemplate transactionTemplate;

    @Override
    public EngineResult<Turn> offerNext(UUID gameId, OfferReason reason) {
        Game game = gameRepository.findById(gameId).orElse(null);
        if (game == null) {
            return EngineResult.fail(ErrorCode.NOT_FOUND, "对局不存在: " + gameId);
        }
        if (game.getStatus().isFinished()) {
            return EngineResult.fail(ErrorCode.INVALID_STATE, "对局已结束: " + gameId + " (" + game.getStatus() + ")");
        }

        Optional<Turn> available = turnRepository.findFirstByGameIdAndStatusOrderByTurnNumberAsc(gameId, TurnStatus.AVAILABLE);
        if (available.isEmpty()) {
            boolean complete = completionEvaluator.isComplete(gameId);
            log.debug("offerNext 无可分配回合: gameId={}, reason={}, complete={}", gameId, reason, complete);
            return EngineResult.fail(ErrorCode.NOT_FOUND, "没有可分配的回合: " + gameId);
        }
        Turn turn = available.get();

        EngineResult<Player> selected = playerSelector.selectNextPlayer(gameId, turn.getType());
        if (!selected.isOk()) {
            if (selected.error() == ErrorCode.NO_ELIGIBLE_PLAYERS) {
                log.warn("回合暂无可分配玩家，等待下次触发: gameId={}, turnNumber={}, reason={}",
                        gameId, turn.getTurnNumber(), reason);
            }
            return EngineResult.fail(selected.error(), selected.message());
        }

        Player player = selected.value();
        EngineResult<Turn> offered = lifecycleManager.offer(turn.getId(), player.getId());
        if (offered.isOk()) {
            log.info("offerNext: gameId={}, turnNumber={}, type={}, playerId={}, reason={}",
                    gameId, turn.getTurnNumber(), turn.getType(), player.getId(), reason);
        }
        return offered;
    }

    @Override
    public void advanceAfter(Turn finished) {
        UUID gameId = finished.getGameId();
        if (completionEvaluator.isComplete(gameId)) {
            log.info("对局已完成，不再创建回合: gameId={}, lastTurn={}", gameId, finished.getTurnNumber());
            return;
        }
        Game game = gameRepository.findById(gameId)
                .orElseThrow(() -> EngineException.notFound("对局不存在: " + gameId));
        if (game.getStatus().isFinished()) {
            return;
        }

        createNextTurn(game);
        OfferReason reason = finished.getStatus() == TurnStatus.SKIPPED ? OfferReason.TURN_SKIPPED : OfferReason.TURN_COMPLETED;
        offerNext(gameId, reason);
    }

    @Override
    public EngineResult<Turn> dismissAndReoffer(UUID turnId, OfferReason reason) {
        EngineResult<Turn> dismissed = lifecycleManager.dismiss(turnId);
        if (dismissed.isOk()) {
            offerNext(dismissed.value().getGameId(), reason);
        }
        return dismissed;
    }

    @Override
    public Turn createInitialTurn(Game game) {
        SeasonConfig config = loadConfig(game);
        Turn turn = Turn.builder()
                .gameId(game.getId())
                .turnNumber(1)
                .type(config.typeForTurn(1))
                .status(TurnStatus.AVAILABLE)
                .build();
        return turnRepository.save(turn);
    }

    /**
     * 最新回合已结束时创建下一回合；最新回合仍未结束说明下一回合已存在
     */
    private void createNextTurn(Game game) {
        SeasonConfig config = loadConfig(game);
        try {
            transactionTemplate.executeWithoutResult(status -> {
                Turn latest = turnRepository.findFirstByGameIdOrderByTurnNumberDesc(game.getId()).orElse(null);
                if (latest != null && !latest.getStatus().isFinished()) {
                    return;
                }
                int next = latest == null ? 1 : latest.getTurnNumber() + 1;
                turnRepository.saveAndFlush(Turn.builder()
                        .gameId(game.getId())
                        .turnNumber(next)
                        .type(config.typeForTurn(next))
                        .status(TurnStatus.AVAILABLE)
                        .build());
                log.info("已创建回合: gameId={}, turnNumber={}, type={}", game.getId(), next, config.typeForTurn(next));
            });
        } catch (DataIntegrityViolationException e) {
            // (game_id, turn_number) 唯一约束：并发推进时另一方已创建
            log.debug("下一回合已由并发请求创建: gameId={}", game.getId());
        }
    }

    private SeasonConfig loadConfig(Game game) {
        Season season = seasonRepository.findById(game.getSeasonId())
                .orElseThrow(() -> EngineException.notFound("赛季不存在: " + game.getSeasonId()));
        return season.getConfig();
    }
}

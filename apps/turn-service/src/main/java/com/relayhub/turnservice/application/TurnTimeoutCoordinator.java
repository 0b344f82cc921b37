package com.relayhub.turnservice.application;

import com.relayhub.turnservice.clock.scheduler.TimeoutScheduler;
import com.relayhub.turnservice.domain.enums.TimeoutPhase;
import com.relayhub.turnservice.domain.enums.TurnStatus;
import com.relayhub.turnservice.domain.model.TimeoutPayload;
import com.relayhub.turnservice.domain.model.Turn;
import com.relayhub.turnservice.domain.repository.TurnRepository;
import com.relayhub.turnservice.engine.core.EngineResult;
import com.relayhub.turnservice.engine.lifecycle.TurnLifecycleManager;
import com.relayhub.turnservice.engine.offering.OfferReason;
import com.relayhub.turnservice.engine.offering.TurnOfferingOrchestrator;
import com.relayhub.turnservice.service.season.SeasonService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * TurnTimeoutCoordinator
 * -------------------------------------------------
 * 超时业务协调器（应用编排层）：把通用超时调度器与回合规则对接。
 *
 * 1) 应用启动（ApplicationReady）时注册认领超时 / 提交超时 / 报名期三个回调，再让调度器全量恢复；
 * 2) 认领超时：回合仍邀请着载荷中的玩家 → 撤回邀请 → 重新分配（CLAIM_TIMEOUT）；
 * 3) 提交超时：回合仍由载荷中的玩家进行中 → 跳过（skip 内部会推进对局）；
 * 4) 报名期结束：交给赛季服务决定开赛或终止。
 *
 * 回合状态与载荷不一致时说明任务已过时（玩家已认领/已提交），直接忽略。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TurnTimeoutCoordinator {

    private final TimeoutScheduler scheduler;
    private final TurnRepository turnRepository;
    private final TurnLifecycleManager lifecycleManager;
    private final TurnOfferingOrchestrator orchestrator;
    private final SeasonService seasonService;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("超时协调器启动：注册超时回调并恢复持久化任务");
        scheduler.registerHandler(TimeoutPhase.CLAIM, (jobId, payload) -> handleClaimTimeout(payload));
        scheduler.registerHandler(TimeoutPhase.SUBMISSION, (jobId, payload) -> handleSubmissionTimeout(payload));
        scheduler.registerHandler(TimeoutPhase.SEASON_OPEN, (jobId, payload) -> handleSeasonOpenTimeout(payload));
        int recovered = scheduler.recover();
        log.info("超时协调器启动完成：恢复任务 {} 个", recovered);
    }

    /**
     * 认领超时：撤回邀请并重新分配
     */
    public void handleClaimTimeout(TimeoutPayload payload) {
        Turn turn = turnRepository.findById(payload.turnId()).orElse(null);
        if (!stillHeldBy(turn, TurnStatus.OFFERED, payload)) {
            log.info("认领超时已过时，忽略: turnId={}", payload.turnId());
            return;
        }
        EngineResult<Turn> result = orchestrator.dismissAndReoffer(turn.getId(), OfferReason.CLAIM_TIMEOUT);
        log.info("认领超时处理: turnId={}, playerId={}, dismissed={}", turn.getId(), payload.playerId(), result.isOk());
    }

    /**
     * 提交超时：跳过该回合
     */
    public void handleSubmissionTimeout(TimeoutPayload payload) {
        Turn turn = turnRepository.findById(payload.turnId()).orElse(null);
        if (!stillHeldBy(turn, TurnStatus.PENDING, payload)) {
            log.info("提交超时已过时，忽略: turnId={}", payload.turnId());
            return;
        }
        EngineResult<Turn> result = lifecycleManager.skip(turn.getId());
        log.info("提交超时处理: turnId={}, playerId={}, skipped={}", turn.getId(), payload.playerId(), result.isOk());
    }

    /**
     * 报名期结束：人数足够开赛，否则终止
     */
    public void handleSeasonOpenTimeout(TimeoutPayload payload) {
        if (payload.seasonId() == null) {
            log.warn("报名期任务缺少赛季ID，忽略: payload={}", payload);
            return;
        }
        seasonService.handleOpenDurationTimeout(payload.seasonId());
    }

    private static boolean stillHeldBy(Turn turn, TurnStatus expected, TimeoutPayload payload) {
        return turn != null
                && turn.getStatus() == expected
                && Objects.equals(turn.getPlayerId(), payload.playerId());
    }
}

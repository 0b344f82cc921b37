package com.relayhub.turnservice.engine.offering;

import com.relayhub.turnservice.domain.model.Game;
import com.relayhub.turnservice.domain.model.Turn;
import com.relayhub.turnservice.engine.core.EngineResult;

import java.util.UUID;

/**
 * 回合分配编排：决定下一个要邀请的回合并驱动选人与状态机
 */
public interface TurnOfferingOrchestrator {

    /**
     * 为对局中序号最小的 AVAILABLE 回合挑选玩家并发出邀请。
     * 没有 AVAILABLE 回合时转交完成判定，并返回 NOT_FOUND。
     */
    EngineResult<Turn> offerNext(UUID gameId, OfferReason reason);

    /**
     * 回合结束（COMPLETED/SKIPPED）后推进对局：未完成则创建下一回合并邀请
     */
    void advanceAfter(Turn finished);

    /**
     * 撤回邀请后重新分配同一回合
     * @return 撤回后的回合
     */
    EngineResult<Turn> dismissAndReoffer(UUID turnId, OfferReason reason);

    /**
     * 新对局的第 1 回合（AVAILABLE）
     */
    Turn createInitialTurn(Game game);
}

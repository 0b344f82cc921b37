package com.relayhub.turnservice.engine.selection.rule;

import com.relayhub.turnservice.engine.selection.PlayerTurnStats;
import com.relayhub.turnservice.engine.selection.SelectionContext;

import java.util.List;

/**
 * 赛季内手上已有 PENDING 回合的玩家不再分配
 */
public class NoPendingTurnRule implements CandidateRule {

    @Override
    public String name() {
        return "no-pending-turn";
    }

    @Override
    public boolean mandatory() {
        return true;
    }

    @Override
    public List<PlayerTurnStats> apply(List<PlayerTurnStats> candidates, SelectionContext context) {
        return candidates.stream().filter(s -> s.pendingTurns() == 0).toList();
    }
}

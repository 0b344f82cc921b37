package com.relayhub.turnservice.engine.selection.rule;

import com.relayhub.turnservice.engine.selection.PlayerTurnStats;
import com.relayhub.turnservice.engine.selection.SelectionContext;

import java.util.List;

public class FewestPendingRule implements CandidateRule {

    @Override
    public String name() {
        return "fewest-pending";
    }

    @Override
    public boolean mandatory() {
        return false;
    }

    @Override
    public List<PlayerTurnStats> apply(List<PlayerTurnStats> candidates, SelectionContext context) {
        int min = candidates.stream().mapToInt(PlayerTurnStats::pendingTurns).min().orElse(0);
        return candidates.stream().filter(s -> s.pendingTurns() == min).toList();
    }
}

package com.relayhub.turnservice.engine.selection.rule;

import com.relayhub.turnservice.engine.selection.PlayerTurnStats;
import com.relayhub.turnservice.engine.selection.SelectionContext;

import java.util.List;

/**
 * 保留该类型回合数最少的候选人
 */
public class MinimumTypeCountRule implements CandidateRule {

    @Override
    public String name() {
        return "minimum-type-count";
    }

    @Override
    public boolean mandatory() {
        return false;
    }

    @Override
    public List<PlayerTurnStats> apply(List<PlayerTurnStats> candidates, SelectionContext context) {
        int min = candidates.stream()
                .mapToInt(s -> s.count(context.turnType()))
                .min()
                .orElse(0);
        return candidates.stream()
                .filter(s -> s.count(context.turnType()) == min)
                .toList();
    }
}

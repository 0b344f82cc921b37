package com.relayhub.turnservice.engine.selection.rule;

import com.relayhub.turnservice.engine.selection.PlayerTurnStats;
import com.relayhub.turnservice.engine.selection.SelectionContext;

import java.util.List;

/**
 * 同类型回合配额：单个玩家某类型回合数达到 floor(赛季人数 / 2) 后优先让给别人
 */
public class TypeQuotaRule implements CandidateRule {

    @Override
    public String name() {
        return "type-quota";
    }

    @Override
    public boolean mandatory() {
        return false;
    }

    @Override
    public List<PlayerTurnStats> apply(List<PlayerTurnStats> candidates, SelectionContext context) {
        int cap = context.totalSeasonPlayers() / 2;
        return candidates.stream()
                .filter(s -> s.count(context.turnType()) < cap)
                .toList();
    }
}

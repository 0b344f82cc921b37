package com.relayhub.turnservice.engine.selection.rule;

import com.relayhub.turnservice.engine.selection.PlayerTurnStats;
import com.relayhub.turnservice.engine.selection.SelectionContext;

import java.util.List;

/**
 * 避免同一玩家紧接在上一回合的玩家之后。
 * 只看本局上一个已结束的回合。
 */
public class AntiRepeatRule implements CandidateRule {

    @Override
    public String name() {
        return "anti-repeat";
    }

    @Override
    public boolean mandatory() {
        return false;
    }

    @Override
    public List<PlayerTurnStats> apply(List<PlayerTurnStats> candidates, SelectionContext context) {
        if (context.previousPlayerId() == null) {
            return candidates;
        }
        return candidates.stream()
                .filter(s -> !s.playerId().equals(context.previousPlayerId()))
                .toList();
    }
}

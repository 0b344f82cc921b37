package com.relayhub.turnservice.engine.selection.rule;

import com.relayhub.turnservice.engine.selection.PlayerTurnStats;
import com.relayhub.turnservice.engine.selection.SelectionContext;

import java.util.List;

/**
 * 同一局中每个玩家至多一个回合
 */
public class NotPlayedInGameRule implements CandidateRule {

    @Override
    public String name() {
        return "not-played-in-game";
    }

    @Override
    public boolean mandatory() {
        return true;
    }

    @Override
    public List<PlayerTurnStats> apply(List<PlayerTurnStats> candidates, SelectionContext context) {
        return candidates.stream().filter(s -> !s.hasPlayedInGame()).toList();
    }
}

package com.relayhub.turnservice.engine.selection;

import com.relayhub.turnservice.engine.selection.rule.AntiRepeatRule;
import com.relayhub.turnservice.engine.selection.rule.CandidateRule;
import com.relayhub.turnservice.engine.selection.rule.FewestPendingRule;
import com.relayhub.turnservice.engine.selection.rule.MinimumTypeCountRule;
import com.relayhub.turnservice.engine.selection.rule.NoPendingTurnRule;
import com.relayhub.turnservice.engine.selection.rule.NotPlayedInGameRule;
import com.relayhub.turnservice.engine.selection.rule.TypeQuotaRule;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 选人规则流水线（纯计算，无 IO）。
 *
 * 按顺序执行规则：
 *  1) 强制规则直接过滤，过滤后为空即无人可选；
 *  2) 非强制规则如果会把候选人过滤为空，则跳过该规则，保留原集合；
 *  3) 剩余候选人按 playerId 字符串升序，取第一个。
 */
@Slf4j
public class PlayerSelectionPipeline {

    private static final Comparator<PlayerTurnStats> TIE_BREAK =
            Comparator.comparing(s -> s.playerId().toString());

    private final List<CandidateRule> rules;

    public PlayerSelectionPipeline(List<CandidateRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * 默认规则顺序
     */
    public static PlayerSelectionPipeline standard() {
        return new PlayerSelectionPipeline(List.of(
                new NotPlayedInGameRule(),
                new NoPendingTurnRule(),
                new AntiRepeatRule(),
                new TypeQuotaRule(),
                new MinimumTypeCountRule(),
                new FewestPendingRule()));
    }

    public List<CandidateRule> rules() {
        return rules;
    }

    /**
     * @return 选中的玩家统计；强制规则过滤后无人时为空
     */
    public Optional<PlayerTurnStats> select(List<PlayerTurnStats> candidates, SelectionContext context) {
        List<PlayerTurnStats> current = candidates;
        for (CandidateRule rule : rules) {
            List<PlayerTurnStats> next = rule.apply(current, context);
            if (rule.mandatory()) {
                current = next;
                if (current.isEmpty()) {
                    log.debug("选人：强制规则 {} 过滤后无候选人, gameId={}", rule.name(), context.gameId());
                    return Optional.empty();
                }
            } else if (next.isEmpty()) {
                log.debug("选人：规则 {} 会清空候选人，跳过, gameId={}", rule.name(), context.gameId());
            } else {
                current = next;
            }
        }
        return current.stream().min(TIE_BREAK);
    }
}

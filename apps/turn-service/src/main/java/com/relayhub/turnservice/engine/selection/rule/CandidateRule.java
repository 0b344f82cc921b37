package com.relayhub.turnservice.engine.selection.rule;

import com.relayhub.turnservice.engine.selection.PlayerTurnStats;
import com.relayhub.turnservice.engine.selection.SelectionContext;

import java.util.List;

/**
 * 候选人过滤规则。实现必须是纯函数：不访问存储，不修改入参。
 */
public interface CandidateRule {

    /**
     * 规则名（日志用）
     */
    String name();

    /**
     * 强制规则永不放宽；非强制规则在会过滤掉全部候选人时被跳过
     */
    boolean mandatory();

    List<PlayerTurnStats> apply(List<PlayerTurnStats> candidates, SelectionContext context);
}

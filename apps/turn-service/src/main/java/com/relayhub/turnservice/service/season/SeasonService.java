package com.relayhub.turnservice.service.season;

import com.relayhub.turnservice.domain.model.Game;
import com.relayhub.turnservice.domain.model.Season;
import com.relayhub.turnservice.domain.model.SeasonPlayer;
import com.relayhub.turnservice.dto.request.CreateSeasonRequest;
import com.relayhub.turnservice.dto.response.GameView;
import com.relayhub.turnservice.dto.response.SeasonView;

import java.util.List;
import java.util.UUID;

/**
 * 赛季服务：创建、报名、开赛、终止，以及赛季/对局查询。
 * 业务拒绝统一抛出 {@link com.relayhub.turnservice.engine.core.EngineException}。
 */
public interface SeasonService {

    /**
     * 创建 OPEN 状态的赛季，创建者自动加入
     */
    Season createSeason(CreateSeasonRequest request);

    /**
     * 加入赛季（玩家不存在时自动创建）；已是成员时直接返回原记录
     */
    SeasonPlayer joinSeason(UUID seasonId, String externalId, String displayName);

    /**
     * 开赛：每个成员对应一局，每局创建第 1 回合并立即分配
     */
    List<Game> activateSeason(UUID seasonId);

    /**
     * 报名期到期：仍在报名中时，人数达到下限则开赛，否则终止；赛季已开赛/已结束时忽略
     */
    void handleOpenDurationTimeout(UUID seasonId);

    /**
     * 终止赛季：未结束的对局全部终止，取消所有待触发的超时
     */
    Season terminateSeason(UUID seasonId);

    SeasonView getSeason(UUID seasonId);

    GameView getGame(UUID gameId);
}

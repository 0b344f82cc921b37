package com.relayhub.turnservice.engine.selection;

import com.relayhub.turnservice.domain.enums.TurnType;
import com.relayhub.turnservice.domain.model.Player;
import com.relayhub.turnservice.engine.core.EngineResult;

import java.util.UUID;

/**
 * 为对局的下一个回合挑选玩家
 */
public interface PlayerSelector {

    /**
     * @return 选中的玩家；无人可选时为 NO_ELIGIBLE_PLAYERS，对局或赛季不存在时为 NOT_FOUND
     */
    EngineResult<Player> selectNextPlayer(UUID gameId, TurnType turnType);
}

package com.relayhub.turnservice.controller.turn;

import com.relayhub.turnservice.domain.model.Player;
import com.relayhub.turnservice.dto.request.PlayerActionRequest;
import com.relayhub.turnservice.dto.request.SubmitTurnRequest;
import com.relayhub.turnservice.dto.response.TurnView;
import com.relayhub.turnservice.engine.core.EngineException;
import com.relayhub.turnservice.engine.lifecycle.TurnLifecycleManager;
import com.relayhub.turnservice.engine.offering.OfferReason;
import com.relayhub.turnservice.engine.offering.TurnOfferingOrchestrator;
import com.relayhub.turnservice.service.player.PlayerService;
import com.relayhub.web.common.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * 回合操作控制器：认领 / 提交 / 撤回 / 跳过
 */
@RestController
@RequestMapping("/api/turns")
@RequiredArgsConstructor
public class TurnRestController {

    private final TurnLifecycleManager lifecycleManager;
    private final TurnOfferingOrchestrator orchestrator;
    private final PlayerService playerService;

    @PostMapping("/{turnId}/claim")
    public ResponseEntity<ApiResponse<TurnView>> claim(@PathVariable UUID turnId,
                                                       @Valid @RequestBody PlayerActionRequest request) {
        Player player = requirePlayer(request.getExternalId());
        TurnView turn = TurnView.from(lifecycleManager.claim(turnId, player.getId()).orThrow());
        return ResponseEntity.ok(ApiResponse.success("认领成功", turn));
    }

    @PostMapping("/{turnId}/submit")
    public ResponseEntity<ApiResponse<TurnView>> submit(@PathVariable UUID turnId,
                                                        @Valid @RequestBody SubmitTurnRequest request) {
        Player player = requirePlayer(request.getExternalId());
        TurnView turn = TurnView.from(lifecycleManager
                .submit(turnId, player.getId(), request.getContent(), request.getContentType())
                .orThrow());
        return ResponseEntity.ok(ApiResponse.success("提交成功", turn));
    }

    /**
     * 撤回邀请，并重新分配该回合
     */
    @PostMapping("/{turnId}/dismiss")
    public ResponseEntity<ApiResponse<TurnView>> dismiss(@PathVariable UUID turnId) {
        TurnView turn = TurnView.from(orchestrator.dismissAndReoffer(turnId, OfferReason.PLAYER_DISMISSED).orThrow());
        return ResponseEntity.ok(ApiResponse.success(turn));
    }

    @PostMapping("/{turnId}/skip")
    public ResponseEntity<ApiResponse<TurnView>> skip(@PathVariable UUID turnId) {
        TurnView turn = TurnView.from(lifecycleManager.skip(turnId).orThrow());
        return ResponseEntity.ok(ApiResponse.success(turn));
    }

    private Player requirePlayer(String externalId) {
        return playerService.findByExternalId(externalId)
                .orElseThrow(() -> EngineException.notFound("玩家不存在: " + externalId));
    }
}

package com.relayhub.turnservice.controller.game;

import com.relayhub.turnservice.dto.response.GameView;
import com.relayhub.turnservice.dto.response.TurnView;
import com.relayhub.turnservice.engine.completion.GameCompletionEvaluator;
import com.relayhub.turnservice.engine.offering.OfferReason;
import com.relayhub.turnservice.engine.offering.TurnOfferingOrchestrator;
import com.relayhub.turnservice.service.season.SeasonService;
import com.relayhub.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * 对局控制器
 */
@RestController
@RequestMapping("/api/games")
@RequiredArgsConstructor
public class GameRestController {

    private final SeasonService seasonService;
    private final TurnOfferingOrchestrator orchestrator;
    private final GameCompletionEvaluator completionEvaluator;

    @GetMapping("/{gameId}")
    public ResponseEntity<ApiResponse<GameView>> get(@PathVariable UUID gameId) {
        return ResponseEntity.ok(ApiResponse.success(seasonService.getGame(gameId)));
    }

    /**
     * 手动重新触发分配（之前因无人可选而停住的对局）
     */
    @PostMapping("/{gameId}/offer-next")
    public ResponseEntity<ApiResponse<TurnView>> offerNext(@PathVariable UUID gameId) {
        TurnView turn = TurnView.from(orchestrator.offerNext(gameId, OfferReason.MANUAL_RECHECK).orThrow());
        return ResponseEntity.ok(ApiResponse.success(turn));
    }

    @GetMapping("/{gameId}/completion")
    public ResponseEntity<ApiResponse<Boolean>> completion(@PathVariable UUID gameId) {
        return ResponseEntity.ok(ApiResponse.success(completionEvaluator.isComplete(gameId)));
    }
}

package com.relayhub.turnservice.controller.season;

import com.relayhub.turnservice.domain.model.Game;
import com.relayhub.turnservice.domain.model.Season;
import com.relayhub.turnservice.dto.request.CreateSeasonRequest;
import com.relayhub.turnservice.dto.request.JoinSeasonRequest;
import com.relayhub.turnservice.dto.response.SeasonView;
import com.relayhub.turnservice.service.season.SeasonService;
import com.relayhub.web.common.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * 赛季控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/seasons")
@RequiredArgsConstructor
public class SeasonRestController {

    private final SeasonService seasonService;

    @PostMapping
    public ResponseEntity<ApiResponse<SeasonView>> create(@Valid @RequestBody CreateSeasonRequest request) {
        Season season = seasonService.createSeason(request);
        return ResponseEntity.ok(ApiResponse.success("赛季已创建", seasonService.getSeason(season.getId())));
    }

    @PostMapping("/{seasonId}/join")
    public ResponseEntity<ApiResponse<SeasonView>> join(@PathVariable UUID seasonId,
                                                        @Valid @RequestBody JoinSeasonRequest request) {
        seasonService.joinSeason(seasonId, request.getExternalId(), request.getDisplayName());
        return ResponseEntity.ok(ApiResponse.success(seasonService.getSeason(seasonId)));
    }

    /**
     * 开赛：为每个成员建一局并分配第 1 回合
     */
    @PostMapping("/{seasonId}/activate")
    public ResponseEntity<ApiResponse<SeasonView>> activate(@PathVariable UUID seasonId) {
        List<Game> games = seasonService.activateSeason(seasonId);
        log.info("开赛请求完成: seasonId={}, games={}", seasonId, games.size());
        return ResponseEntity.ok(ApiResponse.success(seasonService.getSeason(seasonId)));
    }

    @PostMapping("/{seasonId}/terminate")
    public ResponseEntity<ApiResponse<SeasonView>> terminate(@PathVariable UUID seasonId) {
        seasonService.terminateSeason(seasonId);
        return ResponseEntity.ok(ApiResponse.success(seasonService.getSeason(seasonId)));
    }

    @GetMapping("/{seasonId}")
    public ResponseEntity<ApiResponse<SeasonView>> get(@PathVariable UUID seasonId) {
        return ResponseEntity.ok(ApiResponse.success(seasonService.getSeason(seasonId)));
    }
}

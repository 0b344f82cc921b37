package com.relayhub.turnservice.service.season;

import com.relayhub.turnservice.EngineIntegrationSupport;
import com.relayhub.turnservice.domain.enums.GameStatus;
import com.relayhub.turnservice.domain.enums.SeasonStatus;
import com.relayhub.turnservice.domain.enums.TimeoutPhase;
import com.relayhub.turnservice.domain.enums.TurnStatus;
import com.relayhub.turnservice.domain.enums.TurnType;
import com.relayhub.turnservice.domain.model.Game;
import com.relayhub.turnservice.domain.model.ScheduledJob;
import com.relayhub.turnservice.domain.model.Season;
import com.relayhub.turnservice.domain.model.SeasonPlayer;
import com.relayhub.turnservice.domain.model.Turn;
import com.relayhub.turnservice.dto.request.CreateSeasonRequest;
import com.relayhub.turnservice.dto.response.GameView;
import com.relayhub.turnservice.dto.response.SeasonView;
import com.relayhub.turnservice.engine.core.EngineException;
import com.relayhub.turnservice.engine.core.EngineResult;
import com.relayhub.turnservice.engine.core.ErrorCode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeasonServiceIntegrationTest extends EngineIntegrationSupport {

    private CreateSeasonRequest.CreateSeasonRequestBuilder request() {
        return CreateSeasonRequest.builder()
                .name("autumn")
                .creatorExternalId("creator-" + System.nanoTime())
                .creatorName("creator");
    }

    @Test
    void createAppliesDefaultsAndJoinsCreator() {
        Season season = seasonService.createSeason(request().build());

        assertThat(season.getStatus()).isEqualTo(SeasonStatus.OPEN);
        assertThat(season.getConfig().getTurnPattern()).isEqualTo("writing,drawing");
        assertThat(season.getConfig().getClaimTimeoutMinutes()).isEqualTo(1440);
        assertThat(seasonPlayerRepository.existsBySeasonIdAndPlayerId(season.getId(), season.getCreatorId())).isTrue();
    }

    @Test
    void createRejectsInvalidConfig() {
        assertThatThrownBy(() -> seasonService.createSeason(request().minPlayers(5).maxPlayers(3).build()))
                .isInstanceOfSatisfying(EngineException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.VALIDATION));
        assertThatThrownBy(() -> seasonService.createSeason(request().turnPattern("writing,painting").build()))
                .isInstanceOfSatisfying(EngineException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.VALIDATION));
        assertThatThrownBy(() -> seasonService.createSeason(request().claimTimeoutMinutes(0).build()))
                .isInstanceOfSatisfying(EngineException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.VALIDATION));
    }

    @Test
    void joinIsIdempotent() {
        Season season = seasonService.createSeason(request().build());

        SeasonPlayer first = seasonService.joinSeason(season.getId(), "guest", "Guest");
        SeasonPlayer again = seasonService.joinSeason(season.getId(), "guest", "Guest");

        assertThat(again.getId()).isEqualTo(first.getId());
        assertThat(seasonPlayerRepository.countBySeasonId(season.getId())).isEqualTo(2);
    }

    @Test
    void joinRefusedWhenFull() {
        Season season = seasonService.createSeason(request().minPlayers(2).maxPlayers(2).build());
        seasonService.joinSeason(season.getId(), "second", "Second");

        assertThatThrownBy(() -> seasonService.joinSeason(season.getId(), "third", "Third"))
                .isInstanceOfSatisfying(EngineException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.INVALID_STATE));
    }

    @Test
    void joinUnknownSeasonIsNotFound() {
        assertThatThrownBy(() -> seasonService.joinSeason(UUID.randomUUID(), "nobody", null))
                .isInstanceOfSatisfying(EngineException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.NOT_FOUND));
    }

    @Test
    void activateRequiresMinimumPlayers() {
        Season season = seasonService.createSeason(request().minPlayers(3).build());
        seasonService.joinSeason(season.getId(), "second", "Second");

        assertThatThrownBy(() -> seasonService.activateSeason(season.getId()))
                .isInstanceOfSatisfying(EngineException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.INVALID_STATE));
        assertThat(seasonRepository.findById(season.getId()).orElseThrow().getStatus()).isEqualTo(SeasonStatus.OPEN);
        assertThat(gameRepository.findBySeasonIdOrderByCreatedAtAsc(season.getId())).isEmpty();
    }

    @Test
    void activateCreatesOneGamePerMemberAndOffersFirstTurns() {
        Season season = seasonWithPlayers(3, "writing,drawing");

        List<Game> games = seasonService.activateSeason(season.getId());

        assertThat(games).hasSize(3);
        assertThat(seasonRepository.findById(season.getId()).orElseThrow().getStatus()).isEqualTo(SeasonStatus.ACTIVE);
        for (Game game : games) {
            List<Turn> turns = turnRepository.findByGameIdOrderByTurnNumberAsc(game.getId());
            assertThat(turns).hasSize(1);
            Turn first = turns.get(0);
            assertThat(first.getTurnNumber()).isEqualTo(1);
            assertThat(first.getType()).isEqualTo(TurnType.WRITING);
            assertThat(first.getStatus()).isEqualTo(TurnStatus.OFFERED);
            assertThat(jobExists(TimeoutPhase.CLAIM.jobId(first.getId()))).isTrue();
        }

        assertThatThrownBy(() -> seasonService.activateSeason(season.getId()))
                .isInstanceOfSatisfying(EngineException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.INVALID_STATE));
        assertThatThrownBy(() -> seasonService.joinSeason(season.getId(), "late", "Late"))
                .isInstanceOfSatisfying(EngineException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.INVALID_STATE));
    }

    @Test
    void terminateClosesGamesAndCancelsTimeouts() {
        Season season = seasonWithPlayers(2, "writing");
        List<Game> games = seasonService.activateSeason(season.getId());
        assertThat(jobRepository.count()).isEqualTo(2);

        Season terminated = seasonService.terminateSeason(season.getId());

        assertThat(terminated.getStatus()).isEqualTo(SeasonStatus.TERMINATED);
        assertThat(jobRepository.count()).isZero();
        for (Game game : games) {
            assertThat(gameRepository.findById(game.getId()).orElseThrow().getStatus()).isEqualTo(GameStatus.TERMINATED);
        }
        assertThatThrownBy(() -> seasonService.terminateSeason(season.getId()))
                .isInstanceOfSatisfying(EngineException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.INVALID_STATE));
    }

    @Test
    void terminateLeavesNoOutstandingTurnsAndClosedGamesRejectMoves() {
        Season season = seasonWithPlayers(2, "writing");
        seasonService.activateSeason(season.getId());
        List<Turn> offered = turnsIn(season, TurnStatus.OFFERED);
        assertThat(offered).hasSize(2);
        Turn claimed = offered.get(0);
        Turn stillOffered = offered.get(1);
        lifecycleManager.claim(claimed.getId(), claimed.getPlayerId()).orThrow();

        seasonService.terminateSeason(season.getId());

        assertThat(turnsIn(season, TurnStatus.OFFERED)).isEmpty();
        assertThat(turnsIn(season, TurnStatus.PENDING)).isEmpty();
        assertThat(reload(claimed).getStatus()).isEqualTo(TurnStatus.SKIPPED);
        assertThat(reload(stillOffered).getStatus()).isEqualTo(TurnStatus.AVAILABLE);
        assertThat(jobRepository.count()).isZero();

        EngineResult<Turn> claim = lifecycleManager.claim(stillOffered.getId(), stillOffered.getPlayerId());
        assertThat(claim.isOk()).isFalse();
        assertThat(claim.error()).isEqualTo(ErrorCode.INVALID_STATE);

        // 终止对局中的空闲回合也不能再发邀请
        EngineResult<Turn> offer = lifecycleManager.offer(stillOffered.getId(), stillOffered.getPlayerId());
        assertThat(offer.isOk()).isFalse();
        assertThat(offer.error()).isEqualTo(ErrorCode.INVALID_STATE);
        assertThat(reload(stillOffered).getStatus()).isEqualTo(TurnStatus.AVAILABLE);
        assertThat(jobRepository.count()).isZero();
    }

    @Test
    void createSchedulesOpenDurationTimeout() {
        Instant before = Instant.now();
        Season season = seasonService.createSeason(request().openDurationMinutes(60).build());

        ScheduledJob job = jobRepository.findById(TimeoutPhase.SEASON_OPEN.jobId(season.getId())).orElseThrow();
        assertThat(job.getPhase()).isEqualTo(TimeoutPhase.SEASON_OPEN);
        assertThat(job.getRunAt()).isAfter(before.plusSeconds(3599));
        assertThat(job.getRunAt()).isBefore(Instant.now().plusSeconds(3601));

        Season unlimited = seasonService.createSeason(request().openDurationMinutes(0).build());
        assertThat(jobExists(TimeoutPhase.SEASON_OPEN.jobId(unlimited.getId()))).isFalse();
        assertThatThrownBy(() -> seasonService.createSeason(request().openDurationMinutes(-1).build()))
                .isInstanceOfSatisfying(EngineException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.VALIDATION));
    }

    @Test
    void openDurationTimeoutActivatesSeasonWithEnoughPlayers() {
        Season season = seasonService.createSeason(request().minPlayers(2).openDurationMinutes(60).build());
        seasonService.joinSeason(season.getId(), "second", "Second");

        seasonService.handleOpenDurationTimeout(season.getId());

        assertThat(seasonRepository.findById(season.getId()).orElseThrow().getStatus()).isEqualTo(SeasonStatus.ACTIVE);
        assertThat(gameRepository.findBySeasonIdOrderByCreatedAtAsc(season.getId())).hasSize(2);
        assertThat(jobExists(TimeoutPhase.SEASON_OPEN.jobId(season.getId()))).isFalse();
        assertThat(turnsIn(season, TurnStatus.OFFERED)).hasSize(2);
    }

    @Test
    void openDurationTimeoutTerminatesSeasonWithTooFewPlayers() {
        Season season = seasonService.createSeason(request().minPlayers(3).openDurationMinutes(60).build());
        seasonService.joinSeason(season.getId(), "second", "Second");

        seasonService.handleOpenDurationTimeout(season.getId());

        assertThat(seasonRepository.findById(season.getId()).orElseThrow().getStatus()).isEqualTo(SeasonStatus.TERMINATED);
        assertThat(gameRepository.findBySeasonIdOrderByCreatedAtAsc(season.getId())).isEmpty();
        assertThat(jobRepository.count()).isZero();
    }

    @Test
    void manualActivationCancelsOpenDurationTimeout() {
        Season season = seasonService.createSeason(request().minPlayers(2).openDurationMinutes(60).build());
        seasonService.joinSeason(season.getId(), "second", "Second");

        seasonService.activateSeason(season.getId());
        assertThat(jobExists(TimeoutPhase.SEASON_OPEN.jobId(season.getId()))).isFalse();

        // 迟到的触发被忽略
        seasonService.handleOpenDurationTimeout(season.getId());
        assertThat(seasonRepository.findById(season.getId()).orElseThrow().getStatus()).isEqualTo(SeasonStatus.ACTIVE);
        assertThat(gameRepository.findBySeasonIdOrderByCreatedAtAsc(season.getId())).hasSize(2);
    }

    @Test
    void readModelsReflectState() {
        Season season = seasonWithPlayers(2, "writing,drawing");
        List<Game> games = seasonService.activateSeason(season.getId());

        SeasonView view = seasonService.getSeason(season.getId());
        assertThat(view.getPlayerIds()).hasSize(2);
        assertThat(view.getGames()).extracting(SeasonView.GameSummary::getStatus)
                .containsOnly(GameStatus.ACTIVE);

        GameView game = seasonService.getGame(games.get(0).getId());
        assertThat(game.getTurns()).hasSize(1);
        assertThat(game.getTurns().get(0).getStatus()).isEqualTo(TurnStatus.OFFERED);

        assertThatThrownBy(() -> seasonService.getGame(UUID.randomUUID()))
                .isInstanceOfSatisfying(EngineException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.NOT_FOUND));
    }
}

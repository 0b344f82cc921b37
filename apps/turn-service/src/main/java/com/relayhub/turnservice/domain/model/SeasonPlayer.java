package com.relayhub.turnservice.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * 赛季成员关系
 * 对应数据库表：season_player
 * 成员顺序按 joined_at 升序。
 */
@Entity
@Table(name = "season_player",
        uniqueConstraints = @UniqueConstraint(name = "uk_season_player", columnNames = {"season_id", "player_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeasonPlayer {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "season_id", nullable = false, updatable = false)
    private UUID seasonId;

    @Column(name = "player_id", nullable = false, updatable = false)
    private UUID playerId;

    @CreationTimestamp
    @Column(name = "joined_at", nullable = false, updatable = false)
    private OffsetDateTime joinedAt;
}

package com.relayhub.turnservice.domain.model;

import com.relayhub.turnservice.domain.enums.TurnStatus;
import com.relayhub.turnservice.domain.enums.TurnType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * 回合实体
 * 对应数据库表：turn
 *
 * 状态字段只通过 TurnRepository 中的条件更新（CAS）修改，
 * 各时间戳在进入对应状态时写入一次，回到 AVAILABLE 时才清空。
 */
@Entity
@Table(name = "turn",
        uniqueConstraints = @UniqueConstraint(name = "uk_turn_game_number", columnNames = {"game_id", "turn_number"}),
        indexes = {
                @Index(name = "idx_turn_game_status", columnList = "game_id, status"),
                @Index(name = "idx_turn_player_status", columnList = "player_id, status")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Turn {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "game_id", nullable = false, updatable = false)
    private UUID gameId;

    /**
     * 回合序号（1..N，连续）
     */
    @Column(name = "turn_number", nullable = false, updatable = false)
    private int turnNumber;

    @Column(name = "type", length = 20, nullable = false, updatable = false)
    @Enumerated(EnumType.STRING)
    private TurnType type;

    @Column(name = "status", length = 20, nullable = false)
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private TurnStatus status = TurnStatus.AVAILABLE;

    /**
     * 当前被分配的玩家（AVAILABLE 时为空）
     */
    @Column(name = "player_id")
    private UUID playerId;

    @Column(name = "offered_at")
    private OffsetDateTime offeredAt;

    @Column(name = "claimed_at")
    private OffsetDateTime claimedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "skipped_at")
    private OffsetDateTime skippedAt;

    /**
     * 写作回合的文本内容
     */
    @Column(name = "text_content", length = 2000)
    private String textContent;

    /**
     * 绘画回合的图片地址
     */
    @Column(name = "image_url", length = 1000)
    private String imageUrl;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;
}

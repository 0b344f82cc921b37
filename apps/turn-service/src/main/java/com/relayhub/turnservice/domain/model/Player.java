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
 * 玩家实体
 * 对应数据库表：player
 * 首次交互时惰性创建，身份（externalId）不可变。
 */
@Entity
@Table(name = "player")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Player {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    /**
     * 外部平台用户ID（如聊天平台的 userId）
     */
    @Column(name = "external_id", length = 64, nullable = false, unique = true, updatable = false)
    private String externalId;

    /**
     * 展示名
     */
    @Column(name = "display_name", length = 100, nullable = false)
    private String displayName;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}

package com.relayhub.turnservice.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 创建赛季请求 DTO
 * 配置项均可选，未填写时取 relay.season.defaults。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSeasonRequest {

    @NotBlank(message = "赛季名称不能为空")
    @Size(max = 100, message = "赛季名称长度不能超过100个字符")
    private String name;

    /**
     * 创建者的外部平台ID（必填，创建者自动加入赛季）
     */
    @NotBlank(message = "创建者不能为空")
    @Size(max = 64, message = "外部ID长度不能超过64个字符")
    private String creatorExternalId;

    @Size(max = 100, message = "展示名长度不能超过100个字符")
    private String creatorName;

    @Min(value = 1, message = "最少人数至少为1")
    @Max(value = 100, message = "最少人数不能超过100")
    private Integer minPlayers;

    @Min(value = 1, message = "最多人数至少为1")
    @Max(value = 100, message = "最多人数不能超过100")
    private Integer maxPlayers;

    @Pattern(regexp = "^(writing|drawing)(,(writing|drawing))*$",
            message = "回合序列必须是逗号分隔的 writing / drawing")
    private String turnPattern;

    @Positive(message = "认领窗口必须大于0")
    private Integer claimTimeoutMinutes;

    @Positive(message = "写作窗口必须大于0")
    private Integer writingTimeoutMinutes;

    @Positive(message = "绘画窗口必须大于0")
    private Integer drawingTimeoutMinutes;

    /**
     * 报名期（分钟），0 表示不自动开赛
     */
    @PositiveOrZero(message = "报名期不能为负数")
    private Integer openDurationMinutes;
}

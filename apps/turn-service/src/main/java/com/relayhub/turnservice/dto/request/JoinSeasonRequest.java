package com.relayhub.turnservice.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 加入赛季请求 DTO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class JoinSeasonRequest {

    @NotBlank(message = "externalId 不能为空")
    @Size(max = 64, message = "外部ID长度不能超过64个字符")
    private String externalId;

    @Size(max = 100, message = "展示名长度不能超过100个字符")
    private String displayName;
}

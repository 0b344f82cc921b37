package com.relayhub.turnservice.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 玩家对回合的操作（认领）请求 DTO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlayerActionRequest {

    /**
     * 操作者的外部平台ID
     */
    @NotBlank(message = "externalId 不能为空")
    private String externalId;
}

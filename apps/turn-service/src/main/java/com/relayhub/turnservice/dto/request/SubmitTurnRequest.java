package com.relayhub.turnservice.dto.request;

import com.relayhub.turnservice.domain.enums.ContentType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 提交回合内容请求 DTO
 * 内容本身的校验（类型匹配、长度、图片地址）在状态机中完成。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubmitTurnRequest {

    @NotBlank(message = "externalId 不能为空")
    private String externalId;

    @NotNull(message = "contentType 不能为空")
    private ContentType contentType;

    /**
     * 文本内容或图片地址
     */
    private String content;
}

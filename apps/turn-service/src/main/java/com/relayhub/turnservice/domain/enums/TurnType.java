package com.relayhub.turnservice.domain.enums;

import java.util.Locale;

/**
 * 回合类型：写作 / 绘画，按赛季配置的 pattern 循环出现
 */
public enum TurnType {
    WRITING,
    DRAWING;

    /** 与该回合类型匹配的提交内容类型 */
    public ContentType expectedContent() {
        return this == WRITING ? ContentType.TEXT : ContentType.IMAGE;
    }

    /**
     * 解析配置中的小写写法（"writing" / "drawing"）
     */
    public static TurnType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("回合类型不能为空");
        }
        return TurnType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}

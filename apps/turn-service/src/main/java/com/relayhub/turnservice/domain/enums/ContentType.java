package com.relayhub.turnservice.domain.enums;

/**
 * 提交内容类型
 */
public enum ContentType {
    TEXT,
    IMAGE
}

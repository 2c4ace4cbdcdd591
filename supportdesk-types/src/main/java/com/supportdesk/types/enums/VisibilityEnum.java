package com.supportdesk.types.enums;

import java.util.Locale;

/**
 * 知识库文档可见性标签。
 */
public enum VisibilityEnum {

    PUBLIC,
    INTERNAL,
    CONFIDENTIAL;

    public static VisibilityEnum fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        return VisibilityEnum.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}

package com.advertis.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 模块运行触发来源枚举
 */
public enum ModuleTriggerEnum {

    /** 手动触发 */
    MANUAL("manual"),

    /** 槽位变更后自动触发 */
    AUTO("auto"),

    /** 外部回调触发 */
    WEBHOOK("webhook");

    private final String code;

    ModuleTriggerEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ModuleTriggerEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ModuleTriggerEnum value : ModuleTriggerEnum.values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown module trigger code: " + code);
    }
}

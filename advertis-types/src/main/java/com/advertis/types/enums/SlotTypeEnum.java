package com.advertis.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 策略内容槽位类型枚举（A-D-V-E 品牌四支柱，R-T 审计，I 实施，S 综合）。
 */
public enum SlotTypeEnum {

    /** 真实性：品牌 ADN、价值观、英雄之旅 */
    A("A", "Authenticité"),

    /** 区隔：定位、用户画像、视觉识别 */
    D("D", "Distinction"),

    /** 价值：产品阶梯、单位经济 */
    V("V", "Valeur"),

    /** 参与：触点、仪式、AARRR */
    E("E", "Engagement"),

    /** 风险审计 */
    R("R", "Risk"),

    /** 市场验证审计 */
    T("T", "Track"),

    /** 实施数据 */
    I("I", "Implémentation"),

    /** 战略综合 */
    S("S", "Stratégie");

    private final String code;
    private final String title;

    SlotTypeEnum(String code, String title) {
        this.code = code;
        this.title = title;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getTitle() {
        return title;
    }

    public static SlotTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (SlotTypeEnum type : SlotTypeEnum.values()) {
            if (type.code.equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown slot type code: " + code);
    }
}

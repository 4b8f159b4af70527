package com.advertis.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * 策略流水线阶段枚举，声明顺序即流水线顺序。
 */
public enum PhaseEnum {

    FICHE("fiche", "Fiche de Marque", false, List.of(SlotTypeEnum.A, SlotTypeEnum.D, SlotTypeEnum.V, SlotTypeEnum.E)),

    FICHE_REVIEW("fiche-review", "Validation Fiche", false, List.of(SlotTypeEnum.A, SlotTypeEnum.D, SlotTypeEnum.V, SlotTypeEnum.E)),

    AUDIT_R("audit-r", "Audit Risk", false, List.of(SlotTypeEnum.R)),

    /**
     * 市场研究为可跳过阶段：audit-r 可直接推进到 audit-t。
     */
    MARKET_STUDY("market-study", "Étude de Marché", true, List.of()),

    AUDIT_T("audit-t", "Audit Track", false, List.of(SlotTypeEnum.T)),

    AUDIT_REVIEW("audit-review", "Validation Audit", false, List.of(SlotTypeEnum.R, SlotTypeEnum.T)),

    IMPLEMENTATION("implementation", "Données Stratégiques", false, List.of(SlotTypeEnum.I)),

    COCKPIT("cockpit", "Cockpit", false, List.of(SlotTypeEnum.S)),

    COMPLETE("complete", "Terminé", false, List.of());

    /**
     * 历史阶段名到当前阶段的映射。
     */
    private static final Map<String, PhaseEnum> LEGACY_CODES = Map.of("audit", AUDIT_R);

    private final String code;
    private final String title;
    private final boolean skippable;
    private final List<SlotTypeEnum> slotTypes;

    PhaseEnum(String code, String title, boolean skippable, List<SlotTypeEnum> slotTypes) {
        this.code = code;
        this.title = title;
        this.skippable = skippable;
        this.slotTypes = slotTypes;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getTitle() {
        return title;
    }

    public boolean isSkippable() {
        return skippable;
    }

    public List<SlotTypeEnum> getSlotTypes() {
        return slotTypes;
    }

    public boolean isTerminal() {
        return this == COMPLETE;
    }

    /**
     * 解析阶段编码，历史编码先映射为当前编码。
     *
     * @param code 存储的阶段编码
     * @return 对应阶段；未知编码抛出 IllegalArgumentException
     */
    public static PhaseEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        PhaseEnum legacy = LEGACY_CODES.get(code);
        if (legacy != null) {
            return legacy;
        }
        for (PhaseEnum phase : PhaseEnum.values()) {
            if (phase.code.equals(code)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown phase code: " + code);
    }

    public static List<PhaseEnum> ordered() {
        return Arrays.asList(PhaseEnum.values());
    }
}

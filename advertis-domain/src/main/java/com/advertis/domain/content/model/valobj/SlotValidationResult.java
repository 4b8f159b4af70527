package com.advertis.domain.content.model.valobj;

import java.util.List;

/**
 * 严格校验结果，valid=false 时 value 可能为 null。
 */
public record SlotValidationResult(boolean valid, SlotDocument value, List<String> errors) {

    public SlotValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static SlotValidationResult valid(SlotDocument value) {
        return new SlotValidationResult(true, value, List.of());
    }

    public static SlotValidationResult invalid(List<String> errors) {
        return new SlotValidationResult(false, null, errors);
    }
}

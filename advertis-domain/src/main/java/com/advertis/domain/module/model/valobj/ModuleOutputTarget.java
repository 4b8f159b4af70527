package com.advertis.domain.module.model.valobj;

import com.advertis.types.enums.MergeStrategyEnum;
import com.advertis.types.enums.SlotTypeEnum;
import org.apache.commons.lang3.StringUtils;

/**
 * 模块输出写回目标：槽位类型 + 点分路径 + 合并策略。
 */
public record ModuleOutputTarget(SlotTypeEnum slotType, String path, MergeStrategyEnum mergeStrategy) {

    public ModuleOutputTarget {
        if (slotType == null) {
            throw new IllegalArgumentException("Output target requires a slot type");
        }
        if (StringUtils.isBlank(path)) {
            throw new IllegalArgumentException("Output target requires a path");
        }
        if (mergeStrategy == null) {
            mergeStrategy = MergeStrategyEnum.REPLACE;
        }
    }

    public static ModuleOutputTarget of(SlotTypeEnum slotType, String path, MergeStrategyEnum mergeStrategy) {
        return new ModuleOutputTarget(slotType, path, mergeStrategy);
    }

    /**
     * 模块输出中承载该目标值的键：路径最后一段。
     */
    public String incomingKey() {
        int idx = path.lastIndexOf('.');
        return idx < 0 ? path : path.substring(idx + 1);
    }
}

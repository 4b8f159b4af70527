package com.advertis.domain.module.model.valobj;

import com.advertis.types.enums.SlotTypeEnum;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * 模块输入来源。每种来源解析后以 {@link #label()} 为键放入模块输入。
 */
public interface ModuleInputSource {

    String label();

    static SlotSource slot(SlotTypeEnum slotType) {
        return new SlotSource(slotType, null);
    }

    static SlotSource slot(SlotTypeEnum slotType, String path) {
        return new SlotSource(slotType, path);
    }

    static AnswersSource answers(String... keys) {
        return new AnswersSource(List.of(keys));
    }

    static StrategyFieldsSource strategyFields(String... fields) {
        return new StrategyFieldsSource(List.of(fields));
    }

    static MarketStudySource marketStudy(String... fields) {
        return new MarketStudySource(fields.length == 0 ? null : List.of(fields));
    }

    static ModuleOutputSource moduleOutput(String moduleId) {
        return new ModuleOutputSource(moduleId);
    }

    /**
     * 槽位内容，path 为空时取整个文档。
     */
    record SlotSource(SlotTypeEnum slotType, String path) implements ModuleInputSource {

        public SlotSource {
            if (slotType == null) {
                throw new IllegalArgumentException("Slot source requires a slot type");
            }
            path = StringUtils.trimToNull(path);
        }

        @Override
        public String label() {
            if (path == null) {
                return "slot_" + slotType.getCode();
            }
            return "slot_" + slotType.getCode() + "_" + path.replace('.', '_');
        }
    }

    /**
     * 问卷答案子集，缺失的键取空字符串。
     */
    record AnswersSource(List<String> keys) implements ModuleInputSource {

        public AnswersSource {
            keys = keys == null ? List.of() : List.copyOf(keys);
        }

        @Override
        public String label() {
            return "answers";
        }
    }

    /**
     * 策略元数据字段，解析后还会平铺到输入顶层。
     */
    record StrategyFieldsSource(List<String> fields) implements ModuleInputSource {

        public StrategyFieldsSource {
            fields = fields == null ? List.of() : List.copyOf(fields);
        }

        @Override
        public String label() {
            return "entity";
        }
    }

    /**
     * 市场研究记录，fields 为 null 时取整条记录。
     */
    record MarketStudySource(List<String> fields) implements ModuleInputSource {

        public MarketStudySource {
            fields = fields == null ? null : List.copyOf(fields);
        }

        @Override
        public String label() {
            return "study";
        }
    }

    /**
     * 另一个模块最近一次成功运行的输出。
     */
    record ModuleOutputSource(String moduleId) implements ModuleInputSource {

        public ModuleOutputSource {
            if (StringUtils.isBlank(moduleId)) {
                throw new IllegalArgumentException("Module output source requires a module id");
            }
        }

        @Override
        public String label() {
            return "module_" + moduleId;
        }
    }
}

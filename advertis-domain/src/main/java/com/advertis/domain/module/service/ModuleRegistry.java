package com.advertis.domain.module.service;

import com.advertis.domain.content.service.SlotSchemaRegistry;
import com.advertis.domain.module.handler.IModuleHandler;
import com.advertis.domain.module.model.valobj.ModuleDescriptor;
import com.advertis.domain.module.model.valobj.ModuleInputSource;
import com.advertis.domain.module.model.valobj.ModuleOutputTarget;
import com.advertis.types.common.Constants;
import com.advertis.types.enums.ModuleCategoryEnum;
import com.advertis.types.enums.SlotTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 模块注册表。
 * <p>
 * 显式对象而非全局单例：应用启动时由配置类用全部 {@link IModuleHandler} Bean 构建，测试可自行构建独立实例。
 * 注册时校验描述符中声明的槽位路径与问卷键，拼写错误在启动阶段暴露。同 ID 重复注册时后者覆盖前者。
 * </p>
 */
@Slf4j
public class ModuleRegistry {

    private final SlotSchemaRegistry schemaRegistry;
    private final Map<String, IModuleHandler> handlers = new LinkedHashMap<>();

    public ModuleRegistry(SlotSchemaRegistry schemaRegistry) {
        this.schemaRegistry = schemaRegistry;
    }

    public ModuleRegistry(SlotSchemaRegistry schemaRegistry, Collection<? extends IModuleHandler> initial) {
        this(schemaRegistry);
        if (initial != null) {
            initial.forEach(this::register);
        }
    }

    public synchronized void register(IModuleHandler handler) {
        ModuleDescriptor descriptor = handler.descriptor();
        checkDescriptor(descriptor);
        if (handlers.containsKey(descriptor.id())) {
            log.warn("Overwriting module registration. moduleId: {}", descriptor.id());
        }
        handlers.put(descriptor.id(), handler);
        log.info("Module registered. moduleId: {}, category: {}, autoTrigger: {}",
                descriptor.id(), descriptor.category().getCode(), descriptor.autoTrigger());
    }

    /**
     * 根据 ID 查询，不存在时返回 null
     */
    public synchronized IModuleHandler get(String moduleId) {
        return moduleId == null ? null : handlers.get(moduleId);
    }

    public synchronized List<IModuleHandler> getAll() {
        return new ArrayList<>(handlers.values());
    }

    /**
     * 输出写入指定槽位的模块
     */
    public List<IModuleHandler> getForSlot(SlotTypeEnum slotType) {
        return getAll().stream()
                .filter(h -> h.descriptor().outputs().stream().anyMatch(o -> o.slotType() == slotType))
                .toList();
    }

    public List<IModuleHandler> getByCategory(ModuleCategoryEnum category) {
        return getAll().stream()
                .filter(h -> h.descriptor().category() == category)
                .toList();
    }

    /**
     * 开启自动触发且以指定槽位为输入的模块
     */
    public List<IModuleHandler> getAutoTriggeredBy(SlotTypeEnum slotType) {
        return getAll().stream()
                .filter(h -> h.descriptor().autoTrigger())
                .filter(h -> h.descriptor().inputs().stream()
                        .anyMatch(s -> s instanceof ModuleInputSource.SlotSource slot && slot.slotType() == slotType))
                .toList();
    }

    private void checkDescriptor(ModuleDescriptor descriptor) {
        if (descriptor == null || StringUtils.isBlank(descriptor.id())) {
            throw new IllegalArgumentException("Module descriptor must declare an id");
        }
        if (descriptor.category() == null) {
            throw new IllegalArgumentException("Module " + descriptor.id() + " must declare a category");
        }
        for (ModuleOutputTarget target : descriptor.outputs()) {
            if (!schemaRegistry.isKnownPath(target.slotType(), target.path())) {
                throw new IllegalArgumentException("Module " + descriptor.id() + " declares unknown output path "
                        + target.slotType().getCode() + "." + target.path());
            }
        }
        for (ModuleInputSource source : descriptor.inputs()) {
            if (source instanceof ModuleInputSource.SlotSource slot && slot.path() != null
                    && !schemaRegistry.isKnownPath(slot.slotType(), slot.path())) {
                throw new IllegalArgumentException("Module " + descriptor.id() + " declares unknown input path "
                        + slot.slotType().getCode() + "." + slot.path());
            }
            if (source instanceof ModuleInputSource.AnswersSource answers) {
                for (String key : answers.keys()) {
                    if (!Constants.isKnownAnswerKey(key)) {
                        throw new IllegalArgumentException("Module " + descriptor.id() + " declares unknown answer key " + key);
                    }
                }
            }
        }
    }
}

package com.advertis.domain.module.service;

import com.advertis.domain.content.model.valobj.ParseResult;
import com.advertis.domain.content.model.valobj.SlotDocument;
import com.advertis.domain.content.service.SlotContentParser;
import com.advertis.domain.content.service.SlotSchemaRegistry;
import com.advertis.domain.module.adapter.repository.IModuleRunRepository;
import com.advertis.domain.module.model.entity.ModuleRunEntity;
import com.advertis.domain.module.model.valobj.ModuleDescriptor;
import com.advertis.domain.module.model.valobj.ModuleInputSource;
import com.advertis.domain.strategy.adapter.repository.IMarketStudyRepository;
import com.advertis.domain.strategy.adapter.repository.ISlotRepository;
import com.advertis.domain.strategy.model.entity.MarketStudyEntity;
import com.advertis.domain.strategy.model.entity.SlotEntity;
import com.advertis.domain.strategy.model.entity.StrategyEntity;
import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * 模块输入解析：按描述符声明的来源并发读取数据，组装成以来源标签为键的输入 Map。
 * <p>
 * 值均为普通 Java 结构（Map / List / 标量），可原样写入运行记录的输入快照。
 * 来源缺失时对应值为 null；策略字段除了放在 entity 键下，还会平铺到顶层。
 * </p>
 */
@Slf4j
@Service
public class ModuleInputResolver {

    private final ISlotRepository slotRepository;
    private final IMarketStudyRepository marketStudyRepository;
    private final IModuleRunRepository moduleRunRepository;
    private final SlotContentParser contentParser;
    private final SlotSchemaRegistry schemaRegistry;
    private final ObjectMapper objectMapper;
    private final Executor commonThreadPoolExecutor;

    public ModuleInputResolver(ISlotRepository slotRepository,
                               IMarketStudyRepository marketStudyRepository,
                               IModuleRunRepository moduleRunRepository,
                               SlotContentParser contentParser,
                               SlotSchemaRegistry schemaRegistry,
                               ObjectMapper objectMapper,
                               @Qualifier("commonThreadPoolExecutor") Executor commonThreadPoolExecutor) {
        this.slotRepository = slotRepository;
        this.marketStudyRepository = marketStudyRepository;
        this.moduleRunRepository = moduleRunRepository;
        this.contentParser = contentParser;
        this.schemaRegistry = schemaRegistry;
        this.objectMapper = objectMapper;
        this.commonThreadPoolExecutor = commonThreadPoolExecutor;
    }

    public Map<String, Object> resolve(ModuleDescriptor descriptor, StrategyEntity strategy) {
        List<CompletableFuture<Map.Entry<String, Object>>> futures = new ArrayList<>();
        for (ModuleInputSource source : descriptor.inputs()) {
            futures.add(CompletableFuture.supplyAsync(() -> resolveSource(source, strategy), commonThreadPoolExecutor));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw ex;
        }

        Map<String, Object> inputs = new LinkedHashMap<>();
        for (CompletableFuture<Map.Entry<String, Object>> future : futures) {
            Map.Entry<String, Object> entry = future.join();
            inputs.put(entry.getKey(), entry.getValue());
        }
        if (inputs.get("entity") instanceof Map<?, ?> entityFields) {
            entityFields.forEach((key, value) -> inputs.put(String.valueOf(key), value));
        }
        log.debug("Module inputs resolved. moduleId: {}, strategyId: {}, keys: {}",
                descriptor.id(), strategy.getId(), inputs.keySet());
        return inputs;
    }

    private Map.Entry<String, Object> resolveSource(ModuleInputSource source, StrategyEntity strategy) {
        Object value;
        if (source instanceof ModuleInputSource.SlotSource slot) {
            value = resolveSlot(slot, strategy.getId());
        } else if (source instanceof ModuleInputSource.AnswersSource answers) {
            Map<String, Object> extracted = new LinkedHashMap<>();
            for (String key : answers.keys()) {
                extracted.put(key, strategy.answerOf(key));
            }
            value = extracted;
        } else if (source instanceof ModuleInputSource.StrategyFieldsSource entity) {
            Map<String, Object> fields = strategy.toFieldMap();
            Map<String, Object> extracted = new LinkedHashMap<>();
            for (String field : entity.fields()) {
                extracted.put(field, fields.get(field));
            }
            value = extracted;
        } else if (source instanceof ModuleInputSource.MarketStudySource study) {
            value = resolveMarketStudy(study, strategy.getId());
        } else if (source instanceof ModuleInputSource.ModuleOutputSource moduleOutput) {
            ModuleRunEntity run = moduleRunRepository.findLatestComplete(strategy.getId(), moduleOutput.moduleId());
            value = run == null ? null : run.getOutputData();
        } else {
            throw new IllegalArgumentException("Unsupported module input source: " + source.getClass().getSimpleName());
        }
        return new AbstractMap.SimpleEntry<>(source.label(), value);
    }

    private Object resolveSlot(ModuleInputSource.SlotSource source, Long strategyId) {
        SlotEntity slot = slotRepository.findByStrategyIdAndType(strategyId, source.slotType());
        ParseResult<SlotDocument> parsed = contentParser.parseStored(source.slotType(), slot == null ? null : slot.getContent());
        JsonNode tree = schemaRegistry.toTree(parsed.data());
        if (source.path() != null) {
            tree = tree.at(JsonPointer.compile("/" + source.path().replace('.', '/')));
        }
        if (tree.isMissingNode() || tree.isNull()) {
            return null;
        }
        return objectMapper.convertValue(tree, Object.class);
    }

    private Object resolveMarketStudy(ModuleInputSource.MarketStudySource source, Long strategyId) {
        MarketStudyEntity study = marketStudyRepository.findLatestByStrategyId(strategyId);
        if (study == null) {
            return null;
        }
        if (source.fields() == null) {
            return study.toFieldMap();
        }
        Map<String, Object> extracted = new LinkedHashMap<>();
        for (String field : source.fields()) {
            extracted.put(field, study.fieldValue(field));
        }
        return extracted;
    }
}

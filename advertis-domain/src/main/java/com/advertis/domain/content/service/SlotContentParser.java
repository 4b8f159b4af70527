package com.advertis.domain.content.service;

import com.advertis.domain.content.model.valobj.ParseResult;
import com.advertis.domain.content.model.valobj.SlotCoercionException;
import com.advertis.domain.content.model.valobj.SlotDocument;
import com.advertis.domain.content.model.valobj.SlotValidationResult;
import com.advertis.types.enums.SlotTypeEnum;
import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 槽位内容解析器：把存储内容或生成文本转换为结构完整的槽位文档。
 * <p>
 * 四级降级链：严格校验 → 宽松转换 → 原始字段深度合并到默认骨架 → 完整默认值。
 * 所有公开方法都不抛异常，调用方总能拿到可用的文档。
 * </p>
 */
@Slf4j
@Service
public class SlotContentParser {

    public static final String ERROR_NULL_CONTENT = "Content is null";
    public static final String ERROR_LEGACY_STRING = "Content is a legacy string, not structured JSON";
    public static final String ERROR_JSON_PARSE = "JSON parse failed";
    public static final String NOTE_LEGACY_SKIPPED = "Content is a legacy string, structural validation skipped";

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```");

    /**
     * 深度合并后逐个剔除无法映射的节点，单次解析的剔除上限。
     */
    private static final int MAX_SALVAGE_ATTEMPTS = 100;

    private final SlotSchemaRegistry schemaRegistry;
    private final ObjectMapper objectMapper;

    public SlotContentParser(SlotSchemaRegistry schemaRegistry, ObjectMapper objectMapper) {
        this.schemaRegistry = schemaRegistry;
        this.objectMapper = objectMapper;
    }

    /**
     * 解析数据库中存储的槽位内容。
     *
     * @param type 槽位类型
     * @param raw 存储内容：null、历史遗留字符串（TextNode）或 JSON 对象
     */
    public ParseResult<SlotDocument> parseStored(SlotTypeEnum type, JsonNode raw) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            return ParseResult.degraded(schemaRegistry.defaultsFor(type), ERROR_NULL_CONTENT);
        }
        JsonNode resolved = raw;
        if (raw.isTextual()) {
            resolved = readQuietly(raw.textValue());
            if (resolved == null) {
                return ParseResult.degraded(schemaRegistry.defaultsFor(type), ERROR_LEGACY_STRING);
            }
        }
        return resolve(type, resolved);
    }

    public <T extends SlotDocument> ParseResult<T> parseStored(SlotTypeEnum type, JsonNode raw, Class<T> documentType) {
        requireDocumentType(type, documentType);
        return parseStored(type, raw).as(documentType);
    }

    /**
     * 解析文本生成服务返回的原始文本，若被 ``` 代码块包裹则先剥离。
     */
    public ParseResult<SlotDocument> parseGenerated(SlotTypeEnum type, String text) {
        String jsonText = StringUtils.trimToEmpty(text);
        Matcher matcher = FENCED_BLOCK.matcher(jsonText);
        if (matcher.find() && StringUtils.isNotBlank(matcher.group(1))) {
            jsonText = matcher.group(1).trim();
        }
        JsonNode parsed = readQuietly(jsonText);
        if (parsed == null) {
            log.error("Failed to parse generated JSON for slot {}: {}", type, StringUtils.abbreviate(text, 200));
            return ParseResult.degraded(schemaRegistry.defaultsFor(type), ERROR_JSON_PARSE);
        }
        return resolve(type, parsed);
    }

    public <T extends SlotDocument> ParseResult<T> parseGenerated(SlotTypeEnum type, String text, Class<T> documentType) {
        requireDocumentType(type, documentType);
        return parseGenerated(type, text).as(documentType);
    }

    /**
     * 保存前的严格校验。历史遗留字符串内容不做结构校验，直接放行。
     */
    public SlotValidationResult validateForSave(SlotTypeEnum type, JsonNode content) {
        if (content != null && content.isTextual()) {
            return new SlotValidationResult(true, null, List.of(NOTE_LEGACY_SKIPPED));
        }
        return schemaRegistry.validate(type, content);
    }

    private ParseResult<SlotDocument> resolve(SlotTypeEnum type, JsonNode resolved) {
        SlotValidationResult strict = schemaRegistry.validate(type, resolved);
        if (strict.valid()) {
            return ParseResult.ok(strict.value());
        }

        try {
            SlotDocument coerced = schemaRegistry.coerce(type, resolved);
            return ParseResult.degraded(coerced, strict.errors());
        } catch (SlotCoercionException ex) {
            if (resolved.isObject()) {
                List<String> diagnostics = new ArrayList<>(strict.errors());
                SlotDocument salvaged = salvage(type, (ObjectNode) resolved, diagnostics);
                if (salvaged != null) {
                    log.warn("Slot {} failed schema mapping, using deep-merge of raw content and defaults. issues={}",
                            type, String.join("; ", strict.errors()));
                    return ParseResult.degraded(salvaged, diagnostics);
                }
            }
            log.warn("Slot {} content unusable, falling back to defaults. cause={}", type, ex.getMessage());
            return ParseResult.degraded(schemaRegistry.defaultsFor(type), strict.errors());
        }
    }

    private SlotDocument salvage(SlotTypeEnum type, ObjectNode raw, List<String> diagnostics) {
        ObjectNode merged = deepMerge(schemaRegistry.toTree(schemaRegistry.defaultsFor(type)), raw);
        for (int attempt = 0; attempt < MAX_SALVAGE_ATTEMPTS; attempt++) {
            try {
                return schemaRegistry.coerce(type, merged);
            } catch (SlotCoercionException ex) {
                if (!drop(merged, ex.getPointer())) {
                    return null;
                }
                diagnostics.add("Dropped malformed value at " + SlotSchemaRegistry.displayPath(ex.getPointer()));
            }
        }
        return null;
    }

    /**
     * 把 raw 的字段递归合并进 defaults；两侧都是对象时递归，否则 raw 的非 null 值胜出。
     */
    static ObjectNode deepMerge(ObjectNode defaults, ObjectNode raw) {
        ObjectNode result = defaults.deepCopy();
        Iterator<Map.Entry<String, JsonNode>> fields = raw.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode rawValue = field.getValue();
            JsonNode defaultValue = result.get(field.getKey());
            if (rawValue.isObject() && defaultValue != null && defaultValue.isObject()) {
                result.set(field.getKey(), deepMerge((ObjectNode) defaultValue, (ObjectNode) rawValue));
            } else if (!rawValue.isNull()) {
                result.set(field.getKey(), rawValue.deepCopy());
            }
        }
        return result;
    }

    private boolean drop(ObjectNode root, JsonPointer pointer) {
        if (pointer == null || pointer.matches()) {
            return false;
        }
        JsonNode parent = root.at(pointer.head());
        JsonPointer last = pointer.last();
        if (parent.isObject()) {
            return ((ObjectNode) parent).remove(last.getMatchingProperty()) != null;
        }
        if (parent.isArray() && last.mayMatchElement() && last.getMatchingIndex() < parent.size()) {
            ((ArrayNode) parent).remove(last.getMatchingIndex());
            return true;
        }
        return false;
    }

    private JsonNode readQuietly(String text) {
        if (StringUtils.isBlank(text)) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(text);
            return node == null || node.isMissingNode() ? null : node;
        } catch (JsonProcessingException ex) {
            return null;
        }
    }

    private void requireDocumentType(SlotTypeEnum type, Class<?> documentType) {
        if (!schemaRegistry.documentClass(type).equals(documentType)) {
            throw new IllegalArgumentException("Slot " + type + " is not mapped to " + documentType.getSimpleName());
        }
    }
}

package com.advertis.domain.content.service;

import com.advertis.domain.content.model.valobj.AuthenticiteDocument;
import com.advertis.domain.content.model.valobj.DistinctionDocument;
import com.advertis.domain.content.model.valobj.EngagementDocument;
import com.advertis.domain.content.model.valobj.ImplementationDocument;
import com.advertis.domain.content.model.valobj.RiskAuditDocument;
import com.advertis.domain.content.model.valobj.SlotCoercionException;
import com.advertis.domain.content.model.valobj.SlotDocument;
import com.advertis.domain.content.model.valobj.SlotValidationResult;
import com.advertis.domain.content.model.valobj.SyntheseDocument;
import com.advertis.domain.content.model.valobj.TrackAuditDocument;
import com.advertis.domain.content.model.valobj.ValeurDocument;
import com.advertis.types.enums.SlotTypeEnum;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.util.ClassUtil;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 槽位 Schema 注册表：每个槽位类型对应一个带完整默认值的文档类。
 * <p>
 * 宽松转换规则：数字字符串转为数字，未知枚举值回退为声明的默认值，未知字段丢弃，null 保留默认值。
 * 严格校验在宽松转换的基础上比对原始 JSON 与转换结果，任何被修正的值或越界数值都视为问题。
 * </p>
 */
@Service
public class SlotSchemaRegistry {

    private final ObjectMapper mapper;
    private final Validator validator;

    public SlotSchemaRegistry(ObjectMapper objectMapper, Validator validator) {
        this.mapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE, true)
                .setDefaultSetterInfo(JsonSetter.Value.construct(Nulls.SKIP, Nulls.SKIP));
        this.validator = validator;
    }

    /**
     * 槽位类型到文档类的映射。新增槽位类型时此处不补全将无法编译。
     */
    private SlotSchema schemaOf(SlotTypeEnum type) {
        return switch (type) {
            case A -> new SlotSchema(AuthenticiteDocument.class, AuthenticiteDocument::new);
            case D -> new SlotSchema(DistinctionDocument.class, DistinctionDocument::new);
            case V -> new SlotSchema(ValeurDocument.class, ValeurDocument::new);
            case E -> new SlotSchema(EngagementDocument.class, EngagementDocument::new);
            case R -> new SlotSchema(RiskAuditDocument.class, RiskAuditDocument::new);
            case T -> new SlotSchema(TrackAuditDocument.class, TrackAuditDocument::new);
            case I -> new SlotSchema(ImplementationDocument.class, ImplementationDocument::new);
            case S -> new SlotSchema(SyntheseDocument.class, SyntheseDocument::new);
        };
    }

    public Class<? extends SlotDocument> documentClass(SlotTypeEnum type) {
        return schemaOf(type).documentClass();
    }

    /**
     * 返回全新的默认文档实例。
     */
    public SlotDocument defaultsFor(SlotTypeEnum type) {
        return schemaOf(type).defaults().get();
    }

    /**
     * 严格校验。
     *
     * @param type 槽位类型
     * @param raw 待校验 JSON
     * @return 通过时携带转换后的文档，失败时携带 "path: message" 形式的问题列表
     */
    public SlotValidationResult validate(SlotTypeEnum type, JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            return SlotValidationResult.invalid(List.of("Expected object, received " + nodeType(raw)));
        }
        SlotDocument converted;
        try {
            converted = mapper.treeToValue(raw, documentClass(type));
        } catch (JsonProcessingException ex) {
            return SlotValidationResult.invalid(List.of(describe(ex)));
        }
        List<String> issues = new ArrayList<>();
        collectDrift(raw, mapper.valueToTree(converted), "", issues);
        issues.addAll(constraintIssues(converted));
        return issues.isEmpty() ? SlotValidationResult.valid(converted) : SlotValidationResult.invalid(issues);
    }

    /**
     * 宽松转换：修正标量类型与枚举，越界数值重置为回退值。
     *
     * @throws SlotCoercionException 结构无法映射时抛出
     */
    public SlotDocument coerce(SlotTypeEnum type, JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            throw new SlotCoercionException(type, JsonPointer.empty(),
                    "Expected object, received " + nodeType(raw), null);
        }
        SlotDocument document;
        try {
            document = mapper.treeToValue(raw, documentClass(type));
        } catch (JsonMappingException ex) {
            throw new SlotCoercionException(type, pointerOf(ex), describe(ex), ex);
        } catch (JsonProcessingException ex) {
            throw new SlotCoercionException(type, JsonPointer.empty(), ex.getOriginalMessage(), ex);
        }
        document.repair();
        List<String> remaining = constraintIssues(document);
        if (!remaining.isEmpty()) {
            throw new SlotCoercionException(type, JsonPointer.empty(), String.join("; ", remaining), null);
        }
        return document;
    }

    /**
     * 判断点路径是否为槽位文档中声明的字段，路径不可穿过数组。
     */
    public boolean isKnownPath(SlotTypeEnum type, String dotPath) {
        if (type == null || StringUtils.isBlank(dotPath)) {
            return false;
        }
        JavaType current = mapper.constructType(documentClass(type));
        for (String segment : StringUtils.split(dotPath, '.')) {
            if (!isBean(current)) {
                return false;
            }
            BeanDescription description = mapper.getSerializationConfig().introspect(current);
            Optional<BeanPropertyDefinition> property = description.findProperties().stream()
                    .filter(candidate -> candidate.getName().equals(segment))
                    .findFirst();
            if (property.isEmpty()) {
                return false;
            }
            current = property.get().getPrimaryType();
        }
        return true;
    }

    public ObjectNode toTree(SlotDocument document) {
        return mapper.valueToTree(document);
    }

    private boolean isBean(JavaType type) {
        return !type.isContainerType()
                && !type.isPrimitive()
                && !type.isEnumType()
                && !ClassUtil.isJDKClass(type.getRawClass());
    }

    private void collectDrift(JsonNode raw, JsonNode converted, String path, List<String> issues) {
        if (raw.isObject()) {
            if (!converted.isObject()) {
                issues.add(issue(path, "Expected " + nodeType(converted) + ", received object"));
                return;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = raw.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode target = converted.get(field.getKey());
                if (target != null) {
                    collectDrift(field.getValue(), target, join(path, field.getKey()), issues);
                }
            }
            return;
        }
        if (raw.isArray()) {
            if (!converted.isArray()) {
                issues.add(issue(path, "Expected " + nodeType(converted) + ", received array"));
                return;
            }
            if (raw.size() != converted.size()) {
                issues.add(issue(path, "Array contains null or invalid elements"));
                return;
            }
            for (int i = 0; i < raw.size(); i++) {
                collectDrift(raw.get(i), converted.get(i), join(path, String.valueOf(i)), issues);
            }
            return;
        }
        if (raw.isNull()) {
            issues.add(issue(path, "Expected " + nodeType(converted) + ", received null"));
            return;
        }
        if (raw.isNumber() && converted.isNumber()) {
            if (raw.decimalValue().compareTo(converted.decimalValue()) != 0) {
                issues.add(issue(path, "Number " + raw.asText() + " coerced to " + converted.asText()));
            }
            return;
        }
        if (raw.getNodeType() != converted.getNodeType()) {
            issues.add(issue(path, "Expected " + nodeType(converted) + ", received " + nodeType(raw)));
            return;
        }
        if (!raw.equals(converted)) {
            issues.add(issue(path, "Invalid value '" + raw.asText() + "', expected one of the declared values"));
        }
    }

    private List<String> constraintIssues(SlotDocument document) {
        List<String> issues = new ArrayList<>();
        for (ConstraintViolation<SlotDocument> violation : validator.validate(document)) {
            issues.add(violation.getPropertyPath() + ": " + violation.getMessage());
        }
        issues.sort(String::compareTo);
        return issues;
    }

    private JsonPointer pointerOf(JsonMappingException ex) {
        StringBuilder pointer = new StringBuilder();
        for (JsonMappingException.Reference reference : ex.getPath()) {
            if (reference.getFieldName() != null) {
                pointer.append('/').append(reference.getFieldName().replace("~", "~0").replace("/", "~1"));
            } else if (reference.getIndex() >= 0) {
                pointer.append('/').append(reference.getIndex());
            }
        }
        return JsonPointer.compile(pointer.toString());
    }

    private String describe(JsonProcessingException ex) {
        if (ex instanceof JsonMappingException mappingException) {
            return issue(displayPath(pointerOf(mappingException)), ex.getOriginalMessage());
        }
        return ex.getOriginalMessage();
    }

    /**
     * JSON Pointer 转为 a.b.0 形式的展示路径。
     */
    static String displayPath(JsonPointer pointer) {
        String text = pointer.toString();
        return text.isEmpty() ? "" : text.substring(1).replace('/', '.');
    }

    private static String issue(String path, String message) {
        return path.isEmpty() ? message : path + ": " + message;
    }

    private static String join(String path, String segment) {
        return path.isEmpty() ? segment : path + "." + segment;
    }

    private static String nodeType(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "undefined";
        }
        return node.getNodeType().name().toLowerCase();
    }

    private record SlotSchema(Class<? extends SlotDocument> documentClass, Supplier<? extends SlotDocument> defaults) {
    }
}

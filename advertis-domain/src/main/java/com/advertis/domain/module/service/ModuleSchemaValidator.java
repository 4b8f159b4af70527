package com.advertis.domain.module.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 模块输入/输出校验：先按 schema 类做 Jackson 绑定，再做 Bean Validation。
 * <p>
 * 返回的错误形如 {@code path: message}，为空表示通过。
 * </p>
 */
@Service
public class ModuleSchemaValidator {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public ModuleSchemaValidator(ObjectMapper objectMapper, Validator validator) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.validator = validator;
    }

    public List<String> validate(Object value, Class<?> schema) {
        if (schema == null) {
            return List.of();
        }
        if (value == null) {
            return List.of("(root): Required");
        }
        Object bound;
        try {
            bound = objectMapper.convertValue(value, schema);
        } catch (IllegalArgumentException ex) {
            return List.of(describeBindingFailure(ex));
        }
        if (bound == null) {
            return List.of("(root): Required");
        }
        List<String> errors = new ArrayList<>();
        validator.validate(bound).stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .forEach(v -> errors.add(format(v)));
        return errors;
    }

    private String format(ConstraintViolation<Object> violation) {
        String path = violation.getPropertyPath().toString();
        return (path.isEmpty() ? "(root)" : path) + ": " + violation.getMessage();
    }

    private String describeBindingFailure(IllegalArgumentException ex) {
        if (ex.getCause() instanceof JsonMappingException mappingException) {
            String path = mappingException.getPath().stream()
                    .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : String.valueOf(ref.getIndex()))
                    .collect(Collectors.joining("."));
            return (path.isEmpty() ? "(root)" : path) + ": " + mappingException.getOriginalMessage();
        }
        return "(root): " + ex.getMessage();
    }
}

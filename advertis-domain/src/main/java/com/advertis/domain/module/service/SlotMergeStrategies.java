package com.advertis.domain.module.service;

import com.advertis.types.enums.MergeStrategyEnum;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * 槽位文档的点分路径读写与三种合并策略。
 */
public final class SlotMergeStrategies {

    private SlotMergeStrategies() {
    }

    /**
     * 合并规则：
     * replace 新值胜出；
     * append 两侧都是数组时拼接（原有在前），都是字符串时以换行连接，否则新值胜出；
     * merge 两侧都是对象时浅合并（同名键新值优先），否则新值胜出。
     */
    public static JsonNode apply(JsonNode existing, JsonNode incoming, MergeStrategyEnum strategy) {
        switch (strategy) {
            case APPEND:
                if (existing != null && existing.isArray() && incoming.isArray()) {
                    ArrayNode merged = JsonNodeFactory.instance.arrayNode();
                    merged.addAll((ArrayNode) existing.deepCopy());
                    merged.addAll((ArrayNode) incoming.deepCopy());
                    return merged;
                }
                if (existing != null && existing.isTextual() && incoming.isTextual()) {
                    return TextNode.valueOf(existing.asText() + "\n" + incoming.asText());
                }
                return incoming.deepCopy();
            case MERGE:
                if (existing != null && existing.isObject() && incoming.isObject()) {
                    ObjectNode merged = ((ObjectNode) existing).deepCopy();
                    merged.setAll((ObjectNode) incoming.deepCopy());
                    return merged;
                }
                return incoming.deepCopy();
            case REPLACE:
            default:
                return incoming.deepCopy();
        }
    }

    /**
     * 读取点分路径上的值，路径中断时返回 null。
     */
    public static JsonNode get(JsonNode root, String dotPath) {
        JsonNode current = root;
        for (String part : dotPath.split("\\.")) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(part);
        }
        return current;
    }

    /**
     * 写入点分路径，中间缺失或非对象的节点替换为空对象。
     */
    public static void set(ObjectNode root, String dotPath, JsonNode value) {
        String[] parts = dotPath.split("\\.");
        ObjectNode current = root;
        for (int i = 0; i < parts.length - 1; i++) {
            JsonNode next = current.get(parts[i]);
            if (next == null || !next.isObject()) {
                next = current.putObject(parts[i]);
            }
            current = (ObjectNode) next;
        }
        current.set(parts[parts.length - 1], value);
    }
}

package com.advertis.test.domain;

import com.advertis.domain.module.service.SlotMergeStrategies;
import com.advertis.types.enums.MergeStrategyEnum;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class SlotMergeStrategiesTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    public void shouldAppendArraysKeepingExistingFirst() throws Exception {
        JsonNode merged = SlotMergeStrategies.apply(objectMapper.readTree("[\"a\",\"b\"]"),
                objectMapper.readTree("[\"c\"]"), MergeStrategyEnum.APPEND);

        assertEquals(objectMapper.readTree("[\"a\",\"b\",\"c\"]"), merged);
    }

    @Test
    public void shouldAppendStringsWithNewline() {
        JsonNode merged = SlotMergeStrategies.apply(TextNode.valueOf("Premiere ligne"),
                TextNode.valueOf("Seconde ligne"), MergeStrategyEnum.APPEND);

        assertEquals("Premiere ligne\nSeconde ligne", merged.asText());
    }

    @Test
    public void shouldLetIncomingWinWhenAppendShapesDiffer() throws Exception {
        JsonNode merged = SlotMergeStrategies.apply(TextNode.valueOf("texte"),
                objectMapper.readTree("[\"x\"]"), MergeStrategyEnum.APPEND);

        assertEquals(objectMapper.readTree("[\"x\"]"), merged);
    }

    @Test
    public void shouldShallowMergeObjectsWithIncomingPrecedence() throws Exception {
        JsonNode merged = SlotMergeStrategies.apply(
                objectMapper.readTree("{\"strengths\":[\"savoir-faire\"],\"threats\":[\"inflation\"]}"),
                objectMapper.readTree("{\"threats\":[\"concurrence\"],\"opportunities\":[\"export\"]}"),
                MergeStrategyEnum.MERGE);

        assertEquals(objectMapper.readTree("{\"strengths\":[\"savoir-faire\"],\"threats\":[\"concurrence\"],"
                + "\"opportunities\":[\"export\"]}"), merged);
    }

    @Test
    public void shouldReplaceRegardlessOfExisting() throws Exception {
        JsonNode existing = objectMapper.readTree("{\"a\":1}");
        JsonNode merged = SlotMergeStrategies.apply(existing, objectMapper.readTree("42"), MergeStrategyEnum.REPLACE);

        assertEquals(42, merged.asInt());
        assertEquals(objectMapper.readTree("{\"a\":1}"), existing);
    }

    @Test
    public void shouldReadAndWriteDottedPaths() throws Exception {
        ObjectNode root = (ObjectNode) objectMapper.readTree("{\"riskSynthesis\":{\"riskScore\":10},\"flat\":\"v\"}");

        assertEquals(10, SlotMergeStrategies.get(root, "riskSynthesis.riskScore").asInt());
        assertNull(SlotMergeStrategies.get(root, "flat.child"));
        assertNull(SlotMergeStrategies.get(root, "marketValidation.trends"));

        SlotMergeStrategies.set(root, "marketValidation.trends", objectMapper.readTree("[\"slow living\"]"));
        SlotMergeStrategies.set(root, "flat.child", TextNode.valueOf("w"));

        assertEquals("slow living", root.at("/marketValidation/trends/0").asText());
        assertEquals("w", root.at("/flat/child").asText());
        assertEquals(10, root.at("/riskSynthesis/riskScore").asInt());
    }
}

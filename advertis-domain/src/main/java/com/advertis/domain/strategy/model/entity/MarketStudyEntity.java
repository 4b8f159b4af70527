package com.advertis.domain.strategy.model.entity;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 市场研究记录（由外部流程写入，本服务只读）。
 */
@Data
public class MarketStudyEntity {

    private Long id;

    private Long strategyId;

    private String status;

    /**
     * 研究数据，结构由外部定义
     */
    private Map<String, Object> data;

    private LocalDateTime createdAt;

    /**
     * 以字段名为键导出记录；字段投影时先查记录列，再查 data 内的键。
     */
    public Map<String, Object> toFieldMap() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", id);
        fields.put("strategyId", strategyId);
        fields.put("status", status);
        fields.put("data", data);
        fields.put("createdAt", createdAt == null ? null : createdAt.toString());
        return fields;
    }

    public Object fieldValue(String field) {
        Map<String, Object> fields = toFieldMap();
        if (fields.containsKey(field)) {
            return fields.get(field);
        }
        return data == null ? null : data.get(field);
    }
}

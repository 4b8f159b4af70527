package com.advertis.domain.content.model.valobj;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 槽位 R（Risk Audit）：微观/全局 SWOT、风险评分、概率影响矩阵与缓解优先级。
 * <p>
 * riskScore 取值 0-100，越界回退为 50；矩阵 priority 取值 1-5，越界回退为 3。
 * </p>
 */
@Data
public class RiskAuditDocument implements SlotDocument {

    public static final int DEFAULT_RISK_SCORE = 50;
    public static final int DEFAULT_PRIORITY = 3;

    private List<MicroSwot> microSwots = new ArrayList<>();
    private SwotQuadrants globalSwot = new SwotQuadrants();

    @Min(0)
    @Max(100)
    private int riskScore = DEFAULT_RISK_SCORE;

    private String riskScoreJustification = "";

    @Valid
    private List<MatrixEntry> probabilityImpactMatrix = new ArrayList<>();

    private List<Mitigation> mitigationPriorities = new ArrayList<>();
    private String summary = "";

    @Override
    public void repair() {
        if (riskScore < 0 || riskScore > 100) {
            riskScore = DEFAULT_RISK_SCORE;
        }
        for (MatrixEntry entry : probabilityImpactMatrix) {
            if (entry.getPriority() < 1 || entry.getPriority() > 5) {
                entry.setPriority(DEFAULT_PRIORITY);
            }
        }
    }

    public enum RiskLevel {
        @JsonProperty("low")
        LOW,
        @JsonEnumDefaultValue
        @JsonProperty("medium")
        MEDIUM,
        @JsonProperty("high")
        HIGH
    }

    public enum Urgency {
        @JsonProperty("immediate")
        IMMEDIATE,
        @JsonProperty("short_term")
        SHORT_TERM,
        @JsonEnumDefaultValue
        @JsonProperty("medium_term")
        MEDIUM_TERM
    }

    @Data
    public static class MicroSwot {
        private String variableId = "";
        private String variableLabel = "";
        private List<String> strengths = new ArrayList<>();
        private List<String> weaknesses = new ArrayList<>();
        private List<String> opportunities = new ArrayList<>();
        private List<String> threats = new ArrayList<>();
        private RiskLevel riskLevel = RiskLevel.MEDIUM;
        private String commentary = "";
    }

    @Data
    public static class MatrixEntry {
        private String risk = "";
        private RiskLevel probability = RiskLevel.MEDIUM;
        private RiskLevel impact = RiskLevel.MEDIUM;

        @Min(1)
        @Max(5)
        private int priority = DEFAULT_PRIORITY;
    }

    @Data
    public static class Mitigation {
        private String risk = "";
        private String action = "";
        private Urgency urgency = Urgency.MEDIUM_TERM;
        private RiskLevel effort = RiskLevel.MEDIUM;
    }
}

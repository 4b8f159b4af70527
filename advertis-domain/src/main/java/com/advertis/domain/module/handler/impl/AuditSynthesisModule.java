package com.advertis.domain.module.handler.impl;

import com.advertis.domain.content.model.valobj.ImplementationDocument;
import com.advertis.domain.content.model.valobj.RiskAuditDocument;
import com.advertis.domain.content.model.valobj.SwotQuadrants;
import com.advertis.domain.content.model.valobj.TrackAuditDocument;
import com.advertis.domain.module.handler.AbstractModuleHandler;
import com.advertis.domain.module.model.valobj.ModuleContext;
import com.advertis.domain.module.model.valobj.ModuleDescriptor;
import com.advertis.domain.module.model.valobj.ModuleInputSource;
import com.advertis.domain.module.model.valobj.ModuleOutputTarget;
import com.advertis.types.enums.MergeStrategyEnum;
import com.advertis.types.enums.ModuleCategoryEnum;
import com.advertis.types.enums.SlotTypeEnum;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 审计综合：把风险审计 (R) 与市场验证 (T) 的结论汇总进实施方案 (I) 的风险与市场两个章节。
 */
@Component
public class AuditSynthesisModule extends AbstractModuleHandler<AuditSynthesisModule.Input, AuditSynthesisModule.Output> {

    public static final String MODULE_ID = "audit-synthesis";

    static final int MAX_TOP_RISKS = 5;

    private static final ModuleDescriptor DESCRIPTOR = ModuleDescriptor.builder()
            .id(MODULE_ID)
            .name("Synthese des Audits")
            .description("Reporte le score de risque, la SWOT globale, les risques prioritaires et la validation marche dans le pilier I")
            .category(ModuleCategoryEnum.DEDUCE)
            .inputs(List.of(
                    ModuleInputSource.slot(SlotTypeEnum.R),
                    ModuleInputSource.slot(SlotTypeEnum.T)))
            .outputs(List.of(
                    ModuleOutputTarget.of(SlotTypeEnum.I, "riskSynthesis.riskScore", MergeStrategyEnum.REPLACE),
                    ModuleOutputTarget.of(SlotTypeEnum.I, "riskSynthesis.globalSwot", MergeStrategyEnum.MERGE),
                    ModuleOutputTarget.of(SlotTypeEnum.I, "riskSynthesis.topRisks", MergeStrategyEnum.APPEND),
                    ModuleOutputTarget.of(SlotTypeEnum.I, "marketValidation.brandMarketFitScore", MergeStrategyEnum.REPLACE),
                    ModuleOutputTarget.of(SlotTypeEnum.I, "marketValidation.recommendations", MergeStrategyEnum.APPEND),
                    ModuleOutputTarget.of(SlotTypeEnum.I, "marketValidation.trends", MergeStrategyEnum.APPEND)))
            .autoTrigger(false)
            .inputSchema(Input.class)
            .outputSchema(Output.class)
            .build();

    public AuditSynthesisModule(ObjectMapper objectMapper) {
        super(objectMapper, Input.class);
    }

    @Override
    public ModuleDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    protected Output compute(Input input, ModuleContext context) {
        RiskAuditDocument risk = input.getRiskAudit();
        TrackAuditDocument track = input.getTrackAudit();

        Output output = new Output();
        output.setRiskScore(risk.getRiskScore());
        output.setGlobalSwot(risk.getGlobalSwot());
        output.setTopRisks(topRisks(risk));
        output.setBrandMarketFitScore(track.getBrandMarketFitScore());
        output.setRecommendations(track.getStrategicRecommendations().stream()
                .filter(StringUtils::isNotBlank)
                .toList());
        output.setTrends(new ArrayList<>(track.getMarketReality().getMacroTrends()));
        return output;
    }

    /**
     * 按矩阵优先级降序取前几项风险，缓解措施取同名风险的第一条行动。
     */
    static List<ImplementationDocument.TopRisk> topRisks(RiskAuditDocument risk) {
        return risk.getProbabilityImpactMatrix().stream()
                .filter(entry -> StringUtils.isNotBlank(entry.getRisk()))
                .sorted(Comparator.comparingInt(RiskAuditDocument.MatrixEntry::getPriority).reversed())
                .limit(MAX_TOP_RISKS)
                .map(entry -> {
                    ImplementationDocument.TopRisk top = new ImplementationDocument.TopRisk();
                    top.setRisk(entry.getRisk());
                    top.setImpact(entry.getImpact().name().toLowerCase());
                    top.setMitigation(mitigationFor(risk, entry.getRisk()));
                    return top;
                })
                .toList();
    }

    private static String mitigationFor(RiskAuditDocument risk, String riskLabel) {
        return risk.getMitigationPriorities().stream()
                .filter(m -> riskLabel.equalsIgnoreCase(StringUtils.trimToEmpty(m.getRisk())))
                .map(RiskAuditDocument.Mitigation::getAction)
                .findFirst()
                .orElse("");
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Input {

        @NotNull
        @Valid
        @JsonProperty("slot_R")
        private RiskAuditDocument riskAudit;

        @NotNull
        @Valid
        @JsonProperty("slot_T")
        private TrackAuditDocument trackAudit;
    }

    @Data
    public static class Output {

        @Min(0)
        @Max(100)
        private int riskScore;

        @NotNull
        private SwotQuadrants globalSwot;

        @NotNull
        private List<ImplementationDocument.TopRisk> topRisks;

        @Min(0)
        @Max(100)
        private int brandMarketFitScore;

        @NotNull
        private List<String> recommendations;

        @NotNull
        private List<String> trends;
    }
}

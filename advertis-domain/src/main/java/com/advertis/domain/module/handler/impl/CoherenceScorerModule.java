package com.advertis.domain.module.handler.impl;

import com.advertis.domain.content.model.valobj.ImplementationDocument;
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
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * 一致性评分：结合最近一次数据质量评分与实施方案自带的一致性分，写入综合槽位 S。
 */
@Component
public class CoherenceScorerModule extends AbstractModuleHandler<CoherenceScorerModule.Input, CoherenceScorerModule.Output> {

    public static final String MODULE_ID = "coherence-scorer";

    private static final ModuleDescriptor DESCRIPTOR = ModuleDescriptor.builder()
            .id(MODULE_ID)
            .name("Score de Coherence")
            .description("Combine le score qualite des piliers A-D-V-E et le score de coherence du pilier I")
            .category(ModuleCategoryEnum.COMPUTE)
            .inputs(List.of(
                    ModuleInputSource.moduleOutput(DataQualityScorerModule.MODULE_ID),
                    ModuleInputSource.slot(SlotTypeEnum.I)))
            .outputs(List.of(
                    ModuleOutputTarget.of(SlotTypeEnum.S, "scoreCoherence", MergeStrategyEnum.REPLACE)))
            .autoTrigger(false)
            .inputSchema(Input.class)
            .outputSchema(Output.class)
            .build();

    public CoherenceScorerModule(ObjectMapper objectMapper) {
        super(objectMapper, Input.class);
    }

    @Override
    public ModuleDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    protected Output compute(Input input, ModuleContext context) {
        int quality = qualityScore(input.getDataQuality());
        int implementation = input.getImplementation().getCoherenceScore();
        Output output = new Output();
        output.setScoreCoherence(implementation > 0 ? (int) Math.round((quality + implementation) / 2.0) : quality);
        return output;
    }

    /**
     * 依赖模块尚未成功运行过时记为 0。
     */
    private int qualityScore(Map<String, Object> dataQuality) {
        if (dataQuality == null || !(dataQuality.get("globalScore") instanceof Number score)) {
            return 0;
        }
        return Math.max(0, Math.min(100, score.intValue()));
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Input {

        @JsonProperty("module_" + DataQualityScorerModule.MODULE_ID)
        private Map<String, Object> dataQuality;

        @NotNull
        @Valid
        @JsonProperty("slot_I")
        private ImplementationDocument implementation;
    }

    @Data
    public static class Output {

        @Min(0)
        @Max(100)
        private int scoreCoherence;
    }
}

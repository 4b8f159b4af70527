package com.advertis.domain.module.handler.impl;

import com.advertis.domain.module.handler.AbstractModuleHandler;
import com.advertis.domain.module.model.valobj.ModuleContext;
import com.advertis.domain.module.model.valobj.ModuleDescriptor;
import com.advertis.domain.module.model.valobj.ModuleInputSource;
import com.advertis.domain.module.model.valobj.ModuleOutputTarget;
import com.advertis.types.enums.MergeStrategyEnum;
import com.advertis.types.enums.ModuleCategoryEnum;
import com.advertis.types.enums.SlotTypeEnum;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 问卷采集：把问卷中的定位陈述、品牌主承诺和身份内核写入 D / A 槽位。空白答案不写。
 */
@Slf4j
@Component
public class FichePositioningCollectorModule
        extends AbstractModuleHandler<FichePositioningCollectorModule.Input, FichePositioningCollectorModule.Output> {

    public static final String MODULE_ID = "fiche-positioning-collector";

    private static final ModuleDescriptor DESCRIPTOR = ModuleDescriptor.builder()
            .id(MODULE_ID)
            .name("Collecte Positionnement")
            .description("Reporte les reponses D4, D3 et A1 de la fiche dans les piliers D et A")
            .category(ModuleCategoryEnum.COLLECT)
            .inputs(List.of(
                    ModuleInputSource.answers("D4", "D3", "A1"),
                    ModuleInputSource.strategyFields("name", "sector")))
            .outputs(List.of(
                    ModuleOutputTarget.of(SlotTypeEnum.D, "positionnement", MergeStrategyEnum.REPLACE),
                    ModuleOutputTarget.of(SlotTypeEnum.D, "promessesDeMarque.promesseMaitre", MergeStrategyEnum.REPLACE),
                    ModuleOutputTarget.of(SlotTypeEnum.A, "identite.noyauIdentitaire", MergeStrategyEnum.REPLACE)))
            .autoTrigger(false)
            .inputSchema(Input.class)
            .outputSchema(Output.class)
            .build();

    public FichePositioningCollectorModule(ObjectMapper objectMapper) {
        super(objectMapper, Input.class);
    }

    @Override
    public ModuleDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    protected Output compute(Input input, ModuleContext context) {
        Map<String, String> answers = input.getAnswers();
        Output output = new Output();
        output.setPositionnement(StringUtils.trimToNull(answers.get("D4")));
        output.setPromesseMaitre(StringUtils.trimToNull(answers.get("D3")));
        output.setNoyauIdentitaire(StringUtils.trimToNull(answers.get("A1")));
        log.info("Fiche answers collected. strategyId: {}, brand: {}, sector: {}",
                context.strategyId(), input.getName(), input.getSector());
        return output;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Input {

        @NotNull
        private Map<String, String> answers = new LinkedHashMap<>();

        /**
         * 策略字段平铺到顶层后的品牌名
         */
        @NotBlank
        private String name;

        private String sector;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Output {

        private String positionnement;

        private String promesseMaitre;

        private String noyauIdentitaire;
    }
}

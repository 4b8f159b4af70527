package com.advertis.trigger.application.query;

import com.advertis.api.dto.SlotContentDTO;
import com.advertis.api.dto.SlotVersionDTO;
import com.advertis.domain.strategy.adapter.repository.ISlotVersionRepository;
import com.advertis.domain.strategy.model.entity.SlotEntity;
import com.advertis.trigger.application.common.StrategyAccessGuard;
import com.advertis.trigger.application.common.StrategyViewAssembler;
import com.advertis.types.enums.SlotTypeEnum;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 槽位读用例：解析后的内容与历史版本。
 */
@Service
public class SlotQueryService {

    private final ISlotVersionRepository slotVersionRepository;
    private final StrategyAccessGuard strategyAccessGuard;
    private final StrategyViewAssembler strategyViewAssembler;

    public SlotQueryService(ISlotVersionRepository slotVersionRepository,
                            StrategyAccessGuard strategyAccessGuard,
                            StrategyViewAssembler strategyViewAssembler) {
        this.slotVersionRepository = slotVersionRepository;
        this.strategyAccessGuard = strategyAccessGuard;
        this.strategyViewAssembler = strategyViewAssembler;
    }

    public SlotContentDTO getSlot(Long strategyId, String userId, String slotType) {
        strategyAccessGuard.requireOwned(strategyId, userId);
        SlotTypeEnum type = StrategyAccessGuard.parseSlotType(slotType);
        return strategyViewAssembler.toSlotContentDTO(strategyAccessGuard.requireSlot(strategyId, type));
    }

    public List<SlotVersionDTO> listVersions(Long strategyId, String userId, String slotType) {
        strategyAccessGuard.requireOwned(strategyId, userId);
        SlotTypeEnum type = StrategyAccessGuard.parseSlotType(slotType);
        SlotEntity slot = strategyAccessGuard.requireSlot(strategyId, type);
        return slotVersionRepository.findBySlotId(slot.getId()).stream()
                .map(strategyViewAssembler::toSlotVersionDTO)
                .collect(Collectors.toList());
    }
}

package com.advertis.trigger.application.query;

import com.advertis.api.dto.PhaseDTO;
import com.advertis.api.dto.StrategyDetailDTO;
import com.advertis.domain.strategy.adapter.repository.ISlotRepository;
import com.advertis.domain.strategy.model.entity.StrategyEntity;
import com.advertis.trigger.application.common.StrategyAccessGuard;
import com.advertis.trigger.application.common.StrategyViewAssembler;
import com.advertis.types.enums.PhaseEnum;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 策略读用例。
 */
@Service
public class StrategyQueryService {

    private final ISlotRepository slotRepository;
    private final StrategyAccessGuard strategyAccessGuard;
    private final StrategyViewAssembler strategyViewAssembler;

    public StrategyQueryService(ISlotRepository slotRepository,
                                StrategyAccessGuard strategyAccessGuard,
                                StrategyViewAssembler strategyViewAssembler) {
        this.slotRepository = slotRepository;
        this.strategyAccessGuard = strategyAccessGuard;
        this.strategyViewAssembler = strategyViewAssembler;
    }

    public StrategyDetailDTO getDetail(Long strategyId, String userId) {
        StrategyEntity strategy = strategyAccessGuard.requireOwned(strategyId, userId);
        return strategyViewAssembler.toStrategyDetailDTO(strategy, slotRepository.findByStrategyId(strategyId));
    }

    public List<PhaseDTO> listPhases() {
        return PhaseEnum.ordered().stream()
                .map(strategyViewAssembler::toPhaseDTO)
                .collect(Collectors.toList());
    }
}

package com.advertis.trigger.application.command;

import com.advertis.api.dto.StrategyCreateRequestDTO;
import com.advertis.api.dto.StrategyDetailDTO;
import com.advertis.domain.strategy.adapter.repository.ISlotRepository;
import com.advertis.domain.strategy.adapter.repository.IStrategyRepository;
import com.advertis.domain.strategy.model.entity.SlotEntity;
import com.advertis.domain.strategy.model.entity.StrategyEntity;
import com.advertis.trigger.application.common.StrategyViewAssembler;
import com.advertis.types.common.Constants;
import com.advertis.types.enums.ResponseCode;
import com.advertis.types.enums.SlotTypeEnum;
import com.advertis.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * 策略创建写用例：草稿策略与 8 个空槽位在同一事务中写入。
 */
@Slf4j
@Service
public class StrategyCommandService {

    private final IStrategyRepository strategyRepository;
    private final ISlotRepository slotRepository;
    private final StrategyViewAssembler strategyViewAssembler;

    public StrategyCommandService(IStrategyRepository strategyRepository,
                                  ISlotRepository slotRepository,
                                  StrategyViewAssembler strategyViewAssembler) {
        this.strategyRepository = strategyRepository;
        this.slotRepository = slotRepository;
        this.strategyViewAssembler = strategyViewAssembler;
    }

    @Transactional(rollbackFor = Exception.class)
    public StrategyDetailDTO create(String userId, StrategyCreateRequestDTO request) {
        if (StringUtils.isBlank(userId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "userId 不能为空");
        }
        if (request == null || StringUtils.isBlank(request.getName())) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "策略名称不能为空");
        }
        if (request.getAnswers() != null) {
            for (String key : request.getAnswers().keySet()) {
                if (!Constants.isKnownAnswerKey(key)) {
                    throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "未知的问卷答案键: " + key);
                }
            }
        }

        StrategyEntity strategy = StrategyEntity.draft(userId.trim(), request.getName().trim(),
                request.getDescription(), request.getSector(), request.getAnswers());
        strategy.validate();
        strategy = strategyRepository.save(strategy);

        List<SlotEntity> slots = new ArrayList<>();
        for (SlotTypeEnum type : SlotTypeEnum.values()) {
            slots.add(slotRepository.save(SlotEntity.empty(strategy.getId(), type)));
        }
        log.info("Strategy created. strategyId: {}, userId: {}, slots: {}", strategy.getId(), strategy.getUserId(), slots.size());
        return strategyViewAssembler.toStrategyDetailDTO(strategy, slots);
    }
}

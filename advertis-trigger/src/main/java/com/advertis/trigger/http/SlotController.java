package com.advertis.trigger.http;

import com.advertis.api.dto.GeneratedContentRequestDTO;
import com.advertis.api.dto.SlotContentDTO;
import com.advertis.api.dto.SlotSaveRequestDTO;
import com.advertis.api.dto.SlotSaveResponseDTO;
import com.advertis.api.dto.SlotVersionDTO;
import com.advertis.api.response.Response;
import com.advertis.trigger.application.command.ModuleCommandService;
import com.advertis.trigger.application.command.SlotContentCommandService;
import com.advertis.trigger.application.common.StrategyAccessGuard;
import com.advertis.trigger.application.query.SlotQueryService;
import com.advertis.types.common.Constants;
import com.advertis.types.enums.ResponseCode;
import com.advertis.types.enums.SlotTypeEnum;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 槽位内容 API。
 * <p>
 * 写操作在内容事务提交后再分发自动触发模块，模块输入解析才能读到新内容。
 * </p>
 */
@RestController
@RequestMapping("/api/strategies/{id}/slots")
public class SlotController {

    private final SlotQueryService slotQueryService;
    private final SlotContentCommandService slotContentCommandService;
    private final ModuleCommandService moduleCommandService;

    public SlotController(SlotQueryService slotQueryService,
                          SlotContentCommandService slotContentCommandService,
                          ModuleCommandService moduleCommandService) {
        this.slotQueryService = slotQueryService;
        this.slotContentCommandService = slotContentCommandService;
        this.moduleCommandService = moduleCommandService;
    }

    @GetMapping("/{type}")
    public Response<SlotContentDTO> getSlot(
            @RequestHeader(value = Constants.USER_ID_HEADER, required = false) String userId,
            @PathVariable("id") Long strategyId,
            @PathVariable("type") String slotType) {
        return success(slotQueryService.getSlot(strategyId, userId, slotType));
    }

    @PutMapping("/{type}")
    public Response<SlotSaveResponseDTO> save(
            @RequestHeader(value = Constants.USER_ID_HEADER, required = false) String userId,
            @PathVariable("id") Long strategyId,
            @PathVariable("type") String slotType,
            @RequestBody SlotSaveRequestDTO request) {
        SlotSaveResponseDTO saved = slotContentCommandService.save(strategyId, userId, slotType, request);
        saved.setAutoTriggeredRunIds(dispatch(strategyId, userId, slotType));
        return success(saved);
    }

    @PostMapping("/{type}/generated")
    public Response<SlotContentDTO> ingestGenerated(
            @RequestHeader(value = Constants.USER_ID_HEADER, required = false) String userId,
            @PathVariable("id") Long strategyId,
            @PathVariable("type") String slotType,
            @RequestBody GeneratedContentRequestDTO request) {
        SlotContentDTO content = slotContentCommandService.ingestGenerated(strategyId, userId, slotType,
                request == null ? null : request.getText());
        dispatch(strategyId, userId, slotType);
        return success(content);
    }

    @GetMapping("/{type}/versions")
    public Response<List<SlotVersionDTO>> listVersions(
            @RequestHeader(value = Constants.USER_ID_HEADER, required = false) String userId,
            @PathVariable("id") Long strategyId,
            @PathVariable("type") String slotType) {
        return success(slotQueryService.listVersions(strategyId, userId, slotType));
    }

    @PostMapping("/{type}/versions/{versionId}/restore")
    public Response<SlotContentDTO> restore(
            @RequestHeader(value = Constants.USER_ID_HEADER, required = false) String userId,
            @PathVariable("id") Long strategyId,
            @PathVariable("type") String slotType,
            @PathVariable("versionId") Long versionId) {
        SlotContentDTO content = slotContentCommandService.restore(strategyId, userId, slotType, versionId);
        dispatch(strategyId, userId, slotType);
        return success(content);
    }

    private List<Long> dispatch(Long strategyId, String userId, String slotType) {
        SlotTypeEnum type = StrategyAccessGuard.parseSlotType(slotType);
        return moduleCommandService.dispatchAutoTriggers(strategyId, userId, type);
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}

package com.advertis.trigger.http;

import com.advertis.api.dto.ModuleExecuteRequestDTO;
import com.advertis.api.dto.ModuleExecuteResponseDTO;
import com.advertis.api.dto.ModuleRunDTO;
import com.advertis.api.dto.ModuleSummaryDTO;
import com.advertis.api.response.Response;
import com.advertis.trigger.application.command.ModuleCommandService;
import com.advertis.trigger.application.query.ModuleQueryService;
import com.advertis.types.common.Constants;
import com.advertis.types.enums.ResponseCode;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 模块目录、执行与运行历史 API。
 */
@RestController
@RequestMapping("/api")
public class ModuleController {

    private final ModuleCommandService moduleCommandService;
    private final ModuleQueryService moduleQueryService;

    public ModuleController(ModuleCommandService moduleCommandService, ModuleQueryService moduleQueryService) {
        this.moduleCommandService = moduleCommandService;
        this.moduleQueryService = moduleQueryService;
    }

    @GetMapping("/modules")
    public Response<List<ModuleSummaryDTO>> listModules(
            @RequestParam(value = "slotType", required = false) String slotType,
            @RequestParam(value = "category", required = false) String category) {
        return success(moduleQueryService.listModules(slotType, category));
    }

    /**
     * 执行失败时仍返回运行记录 ID，响应码为未知失败。
     */
    @PostMapping("/modules/{moduleId}/execute")
    public Response<ModuleExecuteResponseDTO> execute(
            @RequestHeader(value = Constants.USER_ID_HEADER, required = false) String userId,
            @PathVariable("moduleId") String moduleId,
            @RequestBody ModuleExecuteRequestDTO request) {
        ModuleExecuteResponseDTO result = moduleCommandService.execute(moduleId,
                request == null ? null : request.getStrategyId(), userId);
        if (Boolean.TRUE.equals(result.getSuccess())) {
            return success(result);
        }
        return Response.<ModuleExecuteResponseDTO>builder()
                .code(ResponseCode.UN_ERROR.getCode())
                .info(StringUtils.defaultIfBlank(result.getError(), ResponseCode.UN_ERROR.getInfo()))
                .data(result)
                .build();
    }

    @GetMapping("/strategies/{id}/module-runs")
    public Response<List<ModuleRunDTO>> listRuns(
            @RequestHeader(value = Constants.USER_ID_HEADER, required = false) String userId,
            @PathVariable("id") Long strategyId,
            @RequestParam(value = "moduleId", required = false) String moduleId,
            @RequestParam(value = "limit", required = false) Integer limit) {
        return success(moduleQueryService.listRuns(strategyId, userId, moduleId, limit));
    }

    @GetMapping("/module-runs/{runId}")
    public Response<ModuleRunDTO> getRun(
            @RequestHeader(value = Constants.USER_ID_HEADER, required = false) String userId,
            @PathVariable("runId") Long runId) {
        return success(moduleQueryService.getRun(runId, userId));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}

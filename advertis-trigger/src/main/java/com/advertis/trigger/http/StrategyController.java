package com.advertis.trigger.http;

import com.advertis.api.dto.StrategyCreateRequestDTO;
import com.advertis.api.dto.StrategyDetailDTO;
import com.advertis.api.response.Response;
import com.advertis.trigger.application.command.StrategyCommandService;
import com.advertis.trigger.application.query.StrategyQueryService;
import com.advertis.types.common.Constants;
import com.advertis.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 策略创建与详情 API。
 */
@RestController
@RequestMapping("/api/strategies")
public class StrategyController {

    private final StrategyCommandService strategyCommandService;
    private final StrategyQueryService strategyQueryService;

    public StrategyController(StrategyCommandService strategyCommandService,
                              StrategyQueryService strategyQueryService) {
        this.strategyCommandService = strategyCommandService;
        this.strategyQueryService = strategyQueryService;
    }

    @PostMapping
    public Response<StrategyDetailDTO> create(
            @RequestHeader(value = Constants.USER_ID_HEADER, required = false) String userId,
            @RequestBody StrategyCreateRequestDTO request) {
        return success(strategyCommandService.create(userId, request));
    }

    @GetMapping("/{id}")
    public Response<StrategyDetailDTO> getDetail(
            @RequestHeader(value = Constants.USER_ID_HEADER, required = false) String userId,
            @PathVariable("id") Long strategyId) {
        return success(strategyQueryService.getDetail(strategyId, userId));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}

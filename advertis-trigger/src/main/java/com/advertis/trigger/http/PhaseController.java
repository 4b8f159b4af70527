package com.advertis.trigger.http;

import com.advertis.api.dto.AuditReviewRequestDTO;
import com.advertis.api.dto.FicheReviewRequestDTO;
import com.advertis.api.dto.PhaseDTO;
import com.advertis.api.dto.PhaseTransitionRequestDTO;
import com.advertis.api.dto.PhaseTransitionResponseDTO;
import com.advertis.api.response.Response;
import com.advertis.trigger.application.command.PhaseTransitionCommandService;
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

import java.util.List;

/**
 * 阶段列表与阶段迁移 API。
 */
@RestController
@RequestMapping("/api")
public class PhaseController {

    private final PhaseTransitionCommandService phaseTransitionCommandService;
    private final StrategyQueryService strategyQueryService;

    public PhaseController(PhaseTransitionCommandService phaseTransitionCommandService,
                           StrategyQueryService strategyQueryService) {
        this.phaseTransitionCommandService = phaseTransitionCommandService;
        this.strategyQueryService = strategyQueryService;
    }

    @GetMapping("/phases")
    public Response<List<PhaseDTO>> listPhases() {
        return success(strategyQueryService.listPhases());
    }

    @PostMapping("/strategies/{id}/phase/advance")
    public Response<PhaseTransitionResponseDTO> advance(
            @RequestHeader(value = Constants.USER_ID_HEADER, required = false) String userId,
            @PathVariable("id") Long strategyId,
            @RequestBody PhaseTransitionRequestDTO request) {
        return success(phaseTransitionCommandService.advance(strategyId, userId, targetOf(request)));
    }

    @PostMapping("/strategies/{id}/phase/revert")
    public Response<PhaseTransitionResponseDTO> revert(
            @RequestHeader(value = Constants.USER_ID_HEADER, required = false) String userId,
            @PathVariable("id") Long strategyId,
            @RequestBody PhaseTransitionRequestDTO request) {
        return success(phaseTransitionCommandService.revert(strategyId, userId, targetOf(request)));
    }

    @PostMapping("/strategies/{id}/phase/validate-fiche-review")
    public Response<PhaseTransitionResponseDTO> validateFicheReview(
            @RequestHeader(value = Constants.USER_ID_HEADER, required = false) String userId,
            @PathVariable("id") Long strategyId,
            @RequestBody FicheReviewRequestDTO request) {
        return success(phaseTransitionCommandService.validateFicheReview(strategyId, userId, request));
    }

    @PostMapping("/strategies/{id}/phase/validate-audit-review")
    public Response<PhaseTransitionResponseDTO> validateAuditReview(
            @RequestHeader(value = Constants.USER_ID_HEADER, required = false) String userId,
            @PathVariable("id") Long strategyId,
            @RequestBody AuditReviewRequestDTO request) {
        return success(phaseTransitionCommandService.validateAuditReview(strategyId, userId, request));
    }

    private String targetOf(PhaseTransitionRequestDTO request) {
        return request == null ? null : request.getTargetPhase();
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}

package com.trusty.decisionservice.api;

import com.trusty.decisionservice.api.dto.IsAllowedRequestBody;
import com.trusty.decisionservice.api.dto.IsAllowedResponse;
import com.trusty.decisionservice.domain.DecisionService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * {@code POST /v1/isallowed}: {@code 200 {"result": bool}} on a decision, {@code 400} for a missing
 * field, {@code 503} when the directory cannot be read. A store failure is never answered with
 * {@code false}.
 */
@RestController
public class IsAllowedController {

    private final DecisionService decisionService;

    public IsAllowedController(DecisionService decisionService) {
        this.decisionService = decisionService;
    }

    @PostMapping("/v1/isallowed")
    public IsAllowedResponse isAllowed(@RequestBody IsAllowedRequestBody body) {
        return IsAllowedResponse.from(decisionService.decide(body.toRequest()));
    }
}

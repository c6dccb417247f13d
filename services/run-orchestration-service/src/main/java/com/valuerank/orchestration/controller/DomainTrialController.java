package com.valuerank.orchestration.controller;

import com.valuerank.orchestration.service.domaintrial.DomainTrialRunResult;
import com.valuerank.orchestration.service.domaintrial.DomainTrialService;
import com.valuerank.orchestration.service.domaintrial.RetryDomainTrialCellResult;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/domains/{domainId}/trials")
public class DomainTrialController {

    private final DomainTrialService domainTrialService;

    public DomainTrialController(DomainTrialService domainTrialService) {
        this.domainTrialService = domainTrialService;
    }

    @PostMapping
    public DomainTrialRunResult runTrials(
        @PathVariable String domainId,
        @Valid @RequestBody(required = false) DomainTrialRequest request,
        @RequestHeader(name = RequestHeaders.USER_ID, required = false) String userId
    ) {
        DomainTrialRequest body = request == null ? new DomainTrialRequest(null, null) : request;
        return domainTrialService.runTrialsForDomain(domainId, body.temperature(), body.maxBudgetUsd(), userId);
    }

    @PostMapping("/retry")
    public RetryDomainTrialCellResult retryCell(
        @PathVariable String domainId,
        @Valid @RequestBody RetryCellRequest request,
        @RequestHeader(name = RequestHeaders.USER_ID, required = false) String userId
    ) {
        return domainTrialService.retryDomainTrialCell(
            domainId, request.definitionId(), request.modelId(), request.temperature(), userId);
    }
}

package com.valuerank.orchestration.controller;

import com.valuerank.orchestration.service.aggregate.AggregateAnalysisCoordinator;
import com.valuerank.orchestration.service.aggregate.AggregateUpdate;
import java.util.List;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/aggregates")
public class AggregateController {

    private final AggregateAnalysisCoordinator coordinator;

    public AggregateController(AggregateAnalysisCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @PostMapping("/{definitionId}")
    public List<AggregateUpdate> aggregate(
        @PathVariable String definitionId,
        @RequestBody(required = false) AggregateRequest request
    ) {
        AggregateRequest body = request == null ? new AggregateRequest(null, null) : request;
        return coordinator.aggregate(definitionId, body.preambleVersionId(), body.definitionVersion());
    }
}

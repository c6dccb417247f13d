package com.valuerank.orchestration.controller;

import com.valuerank.orchestration.service.provider.ProviderLimits;
import com.valuerank.orchestration.service.provider.ProviderRouter;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/providers")
public class ProviderController {

    private final ProviderRouter providerRouter;

    public ProviderController(ProviderRouter providerRouter) {
        this.providerRouter = providerRouter;
    }

    @GetMapping("/queues")
    public List<ProviderLimits> queues() {
        return providerRouter.allProviderQueues();
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> clearCache() {
        providerRouter.clearCache();
        return ResponseEntity.noContent().build();
    }
}

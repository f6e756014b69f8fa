package com.dealbot.api.controller;

import com.dealbot.api.dto.response.DealResponse;
import com.dealbot.api.dto.response.RetrievalResponse;
import com.dealbot.api.dto.response.ScheduleResponse;
import com.dealbot.client.provider.ProviderInfo;
import com.dealbot.client.provider.ProviderRegistry;
import com.dealbot.common.cancel.CancellationSignal;
import com.dealbot.common.constants.JobType;
import com.dealbot.common.exception.ResourceNotFoundException;
import com.dealbot.common.util.LogFormat;
import com.dealbot.core.deal.DealService;
import com.dealbot.core.jobs.JobScheduleService;
import com.dealbot.core.orchestrator.ProbeOrchestrator;
import com.dealbot.core.retrieval.RetrievalService;
import com.dealbot.core.retrieval.RetrievalTestResult;
import com.dealbot.data.entity.Deal;
import com.dealbot.data.entity.JobScheduleState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Manual triggers for deals and retrievals. Only registered when {@code dealbot.dev-tools.enabled} is true.
 */
@RestController
@RequestMapping("/api/dev")
@ConditionalOnProperty(prefix = "dealbot.dev-tools", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class DevToolsController {

    private final ProviderRegistry providerRegistry;
    private final DealService dealService;
    private final RetrievalService retrievalService;
    private final JobScheduleService jobScheduleService;
    private final ProbeOrchestrator probeOrchestrator;

    @GetMapping("/providers")
    public ResponseEntity<List<ProviderInfo>> getProviders() {
        return ResponseEntity.ok(providerRegistry.getAllProviders());
    }

    @PostMapping("/deal")
    public ResponseEntity<DealResponse> createDeal(@RequestParam String spAddress) {
        log.info("[DEV] Manual deal requested | spAddress={}", LogFormat.abbreviate(spAddress));
        Deal deal = dealService.createDeal(provider(spAddress), CancellationSignal.create());
        return ResponseEntity.ok(DealResponse.from(deal));
    }

    @PostMapping("/deals/create-all")
    public ResponseEntity<List<DealResponse>> createDealsForAllProviders() {
        log.info("[DEV] Manual deal batch requested");
        List<Deal> deals = dealService.createDealsForAllProviders(CancellationSignal.create());
        return ResponseEntity.ok(deals.stream().map(DealResponse::from).toList());
    }

    @GetMapping("/deals/{dealId}")
    public ResponseEntity<DealResponse> getDeal(@PathVariable UUID dealId) {
        return ResponseEntity.ok(DealResponse.from(dealService.getDeal(dealId)));
    }

    /**
     * Retrieves one deal by id, or the latest completed deal of a provider.
     */
    @PostMapping("/retrieval")
    public ResponseEntity<RetrievalResponse> retrieve(
            @RequestParam(required = false) UUID dealId,
            @RequestParam(required = false) String spAddress
    ) {
        RetrievalTestResult result;
        if (dealId != null) {
            log.info("[DEV] Manual retrieval requested | dealId={}", dealId);
            result = retrievalService.retrieveDeal(dealId);
        } else if (spAddress != null && !spAddress.isBlank()) {
            log.info("[DEV] Manual retrieval requested | spAddress={}", LogFormat.abbreviate(spAddress));
            result = retrievalService.performRetrievals(
                    provider(spAddress), probeOrchestrator.getRetrievalTimeout(), CancellationSignal.create())
                .orElseThrow(() -> new ResourceNotFoundException("Completed deal for provider", spAddress));
        } else {
            throw new IllegalArgumentException("Either dealId or spAddress is required");
        }
        return ResponseEntity.ok(RetrievalResponse.from(result));
    }

    @GetMapping("/schedules")
    public ResponseEntity<List<ScheduleResponse>> getSchedules(@RequestParam(defaultValue = "false") boolean due) {
        List<JobScheduleState> schedules = due ? jobScheduleService.listDueSchedules() : jobScheduleService.listSchedules();
        return ResponseEntity.ok(schedules.stream().map(ScheduleResponse::from).toList());
    }

    @PostMapping("/schedules/pause")
    public ResponseEntity<Void> setPaused(
            @RequestParam String jobType,
            @RequestParam String spAddress,
            @RequestParam(defaultValue = "true") boolean paused
    ) {
        jobScheduleService.setPaused(JobType.fromString(jobType), spAddress, paused);
        return ResponseEntity.noContent().build();
    }

    private ProviderInfo provider(String spAddress) {
        return providerRegistry.findByAddress(spAddress)
            .orElseThrow(() -> new ResourceNotFoundException("Provider", spAddress));
    }
}

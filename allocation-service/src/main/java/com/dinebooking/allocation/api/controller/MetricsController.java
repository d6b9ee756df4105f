package com.dinebooking.allocation.api.controller;

import com.dinebooking.allocation.domain.metrics.AllocationMetrics;
import com.dinebooking.allocation.domain.metrics.MetricsSnapshot;
import com.dinebooking.common.dto.BaseResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Commit counters and latency percentiles of this instance since startup.
 */
@RestController
@RequestMapping("/api/v1/allocation/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private final AllocationMetrics metrics;

    @GetMapping
    public ResponseEntity<BaseResponse<MetricsSnapshot>> getMetrics() {
        return ResponseEntity.ok(BaseResponse.success(metrics.snapshot()));
    }
}

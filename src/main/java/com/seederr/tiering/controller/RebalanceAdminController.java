package com.seederr.tiering.controller;

import com.seederr.tiering.config.SeederrProperties;
import com.seederr.tiering.dto.ApiResponse;
import com.seederr.tiering.model.CycleReport;
import com.seederr.tiering.service.RebalanceCycleOrchestrator;
import com.seederr.tiering.service.RebalanceScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 调度运维 API
 * 提供：
 * 1. 最近一轮报告与当前配置
 * 2. 演练预览（不执行、不持久化）
 * 3. 手动触发一轮
 */
@Slf4j
@RestController
@RequestMapping("/api/rebalance")
@RequiredArgsConstructor
@Tag(name = "Rebalance", description = "缓存 / 主存储调度运维接口")
public class RebalanceAdminController {

    private final RebalanceCycleOrchestrator orchestrator;
    private final RebalanceScheduler scheduler;
    private final SeederrProperties properties;

    /**
     * 当前状态、配置摘要和最近一轮报告
     */
    @GetMapping("/status")
    @Operation(summary = "调度状态")
    public ApiResponse<Map<String, Object>> status() {
        SeederrProperties.Rebalance rebalance = properties.getRebalance();

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("dryRun", rebalance.isDryRun());
        config.put("checkIntervalSeconds", rebalance.getCheckInterval().toSeconds());
        config.put("targetFillPercent", rebalance.getTargetFillPercent());
        config.put("maxOperationsPerCycle", rebalance.getMaxOperationsPerCycle());
        config.put("schedulerEnabled", rebalance.isSchedulerEnabled());

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("state", orchestrator.getState());
        status.put("config", config);
        orchestrator.getLastReport().ifPresent(report -> status.put("lastReport", report));
        return ApiResponse.success(status);
    }

    @GetMapping("/preview")
    @Operation(summary = "演练预览", description = "在调度线程上计算放置方案和本轮将执行的操作，不执行也不写指标")
    public ApiResponse<CycleReport> preview() {
        return ApiResponse.success(scheduler.preview());
    }

    @PostMapping("/trigger")
    @ResponseStatus(HttpStatus.ACCEPTED)
    @Operation(summary = "立即触发一轮调度")
    public ApiResponse<String> trigger() {
        scheduler.triggerNow();
        return ApiResponse.success("rebalance cycle queued");
    }
}

package com.seederr.tiering.health;

import com.seederr.tiering.model.CycleOutcome;
import com.seederr.tiering.model.CycleReport;
import com.seederr.tiering.model.OperationStatus;
import com.seederr.tiering.service.RebalanceCycleOrchestrator;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 调度健康检查，依据最近一轮的结果
 */
@Component("rebalanceHealthIndicator")
@RequiredArgsConstructor
public class RebalanceHealthIndicator implements HealthIndicator {

    private final RebalanceCycleOrchestrator orchestrator;

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("state", orchestrator.getState());

        Optional<CycleReport> last = orchestrator.getLastReport();
        if (last.isEmpty()) {
            details.put("lastCycle", "none yet");
            return Health.up().withDetails(details).build();
        }

        CycleReport report = last.get();
        details.put("lastCycleId", report.getCycleId());
        details.put("lastOutcome", report.getOutcome());
        details.put("lastFinishedAt", report.getFinishedAt());
        details.put("dryRun", report.isDryRun());
        details.put("operationsCompleted", report.countByStatus(OperationStatus.COMPLETED));
        details.put("operationsFailed", report.countByStatus(OperationStatus.FAILED));
        details.put("metricsPersisted", report.isPersisted());
        if (report.getMessage() != null) {
            details.put("message", report.getMessage());
        }

        boolean healthy = report.getOutcome() != CycleOutcome.SOURCE_UNAVAILABLE
            && report.getOutcome() != CycleOutcome.FAILED;
        return (healthy ? Health.up() : Health.down()).withDetails(details).build();
    }
}

package com.ivamare.exchange.output;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of running every output handler attached to a result.
 *
 * @param results per-handler results in attachment order
 */
public record DeliveryReport(List<OutputHandlerResult> results) {

    public DeliveryReport {
        results = List.copyOf(results);
    }

    public static DeliveryReport empty() {
        return new DeliveryReport(List.of());
    }

    public int total() {
        return results.size();
    }

    public long successful() {
        return results.stream().filter(OutputHandlerResult::success).count();
    }

    public long failed() {
        return total() - successful();
    }

    public boolean allSucceeded() {
        return failed() == 0;
    }

    public List<OutputHandlerResult> failures() {
        return results.stream().filter(r -> !r.success()).toList();
    }

    /**
     * Counts recorded next to the per-handler results.
     */
    public Map<String, Object> toSummary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_handlers", total());
        summary.put("successful_handlers", successful());
        summary.put("failed_handlers", failed());
        summary.put("success_rate", total() == 0 ? 100.0 : successful() * 100.0 / total());
        return summary;
    }
}

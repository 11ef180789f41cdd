package io.herald.core.delivery;

import io.herald.core.model.DeliveryStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

public record DeliveryReport(
    String deliveryId,
    DeliveryStatus status,
    int totalRecipients,
    int successfulDeliveries,
    int failedDeliveries,
    List<DeliveryResult> results,
    Instant startedAt,
    Instant completedAt,
    Duration duration
) {

    public DeliveryReport {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static DeliveryReport of(
        String deliveryId,
        int total,
        List<DeliveryResult> results,
        Instant startedAt,
        Instant completedAt,
        Duration duration
    ) {
        int successful = (int) results.stream().filter(DeliveryResult::success).count();
        int failed = total - successful;
        return new DeliveryReport(
            deliveryId,
            aggregate(total, successful, failed),
            total,
            successful,
            failed,
            results,
            startedAt,
            completedAt,
            duration
        );
    }

    static DeliveryStatus aggregate(int total, int successful, int failed) {
        if (failed == 0) {
            return DeliveryStatus.DELIVERED;
        }
        if (successful == 0) {
            return DeliveryStatus.FAILED;
        }
        return DeliveryStatus.PARTIAL;
    }

    public List<DeliveryResult> failures() {
        return results.stream().filter(result -> !result.success()).toList();
    }

    public String failureSummary() {
        List<DeliveryResult> failures = failures();
        if (failures.isEmpty()) {
            return null;
        }
        DeliveryResult first = failures.get(0);
        String summary = failures.size() + " of " + totalRecipients + " deliveries failed; first: "
            + first.channel() + " -> " + first.recipient() + " [" + first.errorCode() + "] " + first.errorMessage();
        return summary.trim();
    }
}

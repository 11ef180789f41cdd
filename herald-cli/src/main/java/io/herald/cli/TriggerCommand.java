package io.herald.cli;

import io.herald.core.model.Delivery;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "trigger", description = "Execute one schedule now, outside its cron timing")
public final class TriggerCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Schedule id")
    String scheduleId;

    public TriggerCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Delivery delivery = context.runtime().trigger(scheduleId);
            if (delivery == null) {
                System.err.println("Trigger failed: schedule " + scheduleId + " produced no delivery");
                return 1;
            }
            System.out.println("Delivery " + delivery.id() + ": " + delivery.status().wireName());
            System.out.println(
                "Delivered " + delivery.recipientsDelivered() + "/" + delivery.recipientsTotal()
                    + ", failed " + delivery.recipientsFailed()
            );
            if (delivery.errorMessage() != null && !delivery.errorMessage().isBlank()) {
                System.out.println("Errors: " + delivery.errorMessage());
            }
            return switch (delivery.status()) {
                case DELIVERED, PARTIAL -> 0;
                default -> 2;
            };
        } catch (Exception e) {
            System.err.println("Trigger failed: " + e.getMessage());
            return 1;
        }
    }
}

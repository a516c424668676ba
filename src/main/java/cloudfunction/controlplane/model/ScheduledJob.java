package cloudfunction.controlplane.model;

import cloudfunction.controlplane.scheduler.CronTrigger;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A cron-triggered task template. Each firing creates a task for
 * {@code (project, function)} with {@code args} as payload.
 */
public record ScheduledJob(String id, String project, String function, JsonNode args, CronTrigger trigger) {
}

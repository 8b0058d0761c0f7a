package com.flagship.ad_escrow.posting;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * At most one pending background task (posting attempt or confirmation) per campaign.
 * Scheduling replaces the previous task; running tasks are never interrupted.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CampaignTaskRegistry {

    private final TaskScheduler taskScheduler;
    private final Map<UUID, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

    public void schedule(UUID campaignId, Runnable task, Instant runAt) {
        tasks.compute(campaignId, (id, previous) -> {
            if (previous != null) {
                previous.cancel(false);
            }
            return taskScheduler.schedule(task, runAt);
        });
        log.debug("Scheduled task for campaign {} at {}", campaignId, runAt);
    }

    public boolean cancel(UUID campaignId) {
        ScheduledFuture<?> task = tasks.remove(campaignId);
        if (task == null) {
            return false;
        }
        boolean cancelled = task.cancel(false);
        log.debug("Cancelled task for campaign {}: {}", campaignId, cancelled);
        return cancelled;
    }

    public boolean hasTask(UUID campaignId) {
        ScheduledFuture<?> task = tasks.get(campaignId);
        return task != null && !task.isDone();
    }

    public int activeCount() {
        tasks.values().removeIf(ScheduledFuture::isDone);
        return tasks.size();
    }
}

package com.autobot.engine;

import java.util.Objects;

/**
 * A registered job: id, schedule and task. Immutable once built.
 */
public record JobDefinition(String id, JobSchedule schedule, JobTask task) {

    public JobDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(schedule, "schedule");
        Objects.requireNonNull(task, "task");
    }
}

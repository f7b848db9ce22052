package io.backup4j.internal.schedule;

import io.backup4j.core.ScheduledRun;

import java.util.List;

@FunctionalInterface
public interface ScheduleListener {

    void onScheduleChanged(List<ScheduledRun> schedule);
}

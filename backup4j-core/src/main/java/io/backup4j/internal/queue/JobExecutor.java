package io.backup4j.internal.queue;

import io.backup4j.core.JobRequest;

@FunctionalInterface
public interface JobExecutor {

    void execute(JobRequest job) throws Exception;
}

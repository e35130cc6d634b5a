package io.jobqueue.spring.boot;

import io.jobqueue.JobQueue;
import io.jobqueue.jdbc.purge.DeduplicationPurgeScheduler;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the job queue (and the deduplication purge, when configured) once the
 * context is refreshed and shuts both down when it stops.
 */
public class JobQueueLifecycle implements SmartLifecycle {

    private final JobQueue jobQueue;
    private final DeduplicationPurgeScheduler purgeScheduler;
    private volatile boolean running;

    public JobQueueLifecycle(JobQueue jobQueue, DeduplicationPurgeScheduler purgeScheduler) {
        this.jobQueue = jobQueue;
        this.purgeScheduler = purgeScheduler;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        jobQueue.start();
        if (purgeScheduler != null) {
            purgeScheduler.start();
        }
        running = true;
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        try {
            jobQueue.close();
        } finally {
            if (purgeScheduler != null) {
                purgeScheduler.close();
            }
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}

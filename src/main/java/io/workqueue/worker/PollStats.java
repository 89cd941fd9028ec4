package io.workqueue.worker;

/**
 * Poll counters of one worker since it was created.
 */
public record PollStats(
        String workerId,
        boolean running,
        long pollsTotal,
        long pollsSuccessful,
        long pollsEmpty,
        long consecutiveEmpty,
        double successRate
) {
    static PollStats of(String workerId, boolean running, long total, long successful, long empty, long consecutiveEmpty) {
        double rate = total == 0 ? 0.0 : (double) successful / total;
        return new PollStats(workerId, running, total, successful, empty, consecutiveEmpty, rate);
    }
}

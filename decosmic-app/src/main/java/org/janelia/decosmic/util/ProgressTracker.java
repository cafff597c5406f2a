package org.janelia.decosmic.util;

import org.slf4j.Logger;

/**
 * Tracks completion of a fixed number of work items (e.g. frames) and
 * periodically logs progress so that long runs do not log every item.
 */
public class ProgressTracker {

    public static final long DEFAULT_INTERVAL = 5000;

    private final Logger log;
    private final String context;
    private final int totalCount;
    private final long interval;
    private final long start;
    private long lastIntervalStart;
    private int completedCount;

    public ProgressTracker(final Logger log,
                           final String context,
                           final int totalCount) {
        this(log, context, totalCount, DEFAULT_INTERVAL);
    }

    public ProgressTracker(final Logger log,
                           final String context,
                           final int totalCount,
                           final long interval) {
        this.log = log;
        this.context = context;
        this.totalCount = totalCount;
        this.interval = interval;
        this.start = System.currentTimeMillis();
        this.lastIntervalStart = this.start;
        this.completedCount = 0;
    }

    /**
     * Records completion of one item and logs progress if the logging interval has passed
     * or if all items are complete.
     */
    public synchronized void itemCompleted() {
        completedCount++;
        final long now = System.currentTimeMillis();
        if (completedCount == totalCount) {
            log.debug("{}: completed {} of {} items in {}", context, completedCount, totalCount, this);
        } else if ((now - lastIntervalStart) > interval) {
            lastIntervalStart = now;
            log.info("{}: completed {} of {} items ({}%)",
                     context, completedCount, totalCount, getPercentComplete());
        }
    }

    public synchronized int getCompletedCount() {
        return completedCount;
    }

    public synchronized int getPercentComplete() {
        return totalCount == 0 ? 100 : (int) ((completedCount * 100L) / totalCount);
    }

    /**
     * @return time since the tracker was created, formatted like "2 minutes, 5 seconds".
     */
    @Override
    public String toString() {
        final long totalSeconds = (System.currentTimeMillis() - start) / 1000;
        final long minutes = totalSeconds / 60;
        final long seconds = totalSeconds % 60;
        return minutes + " minutes, " + seconds + " seconds";
    }
}

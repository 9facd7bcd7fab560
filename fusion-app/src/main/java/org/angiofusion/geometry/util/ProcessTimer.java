package org.angiofusion.geometry.util;

/**
 * Tracks elapsed time for command line runs.
 */
public class ProcessTimer {

    private final long start;

    public ProcessTimer() {
        this.start = System.currentTimeMillis();
    }

    public long getElapsedMilliseconds() {
        return System.currentTimeMillis() - start;
    }

    @Override
    public String toString() {
        final long elapsed = getElapsedMilliseconds();
        final long totalSeconds = elapsed / 1000;
        final long minutes = totalSeconds / 60;
        final long seconds = totalSeconds % 60;
        final long milliseconds = elapsed % 1000;
        return minutes + " minutes, " + seconds + " seconds, " + milliseconds + " milliseconds";
    }
}

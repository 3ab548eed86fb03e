package appraiser.core.model.ratelimit;

/**
 * Counter state for a fixed window.
 *
 * @param windowStartMillis start of the current window (epoch millis, aligned to the window size)
 * @param windowEndMillis end of the current window (exclusive, epoch millis)
 * @param count requests admitted or attempted in the current window
 */
public record WindowState(long windowStartMillis, long windowEndMillis, long count) {

    /**
     * Start a new window containing a single request.
     *
     * @param windowStartMillis aligned window start
     * @param windowMillis window length
     * @return the new state
     */
    public static WindowState first(long windowStartMillis, long windowMillis) {
        return new WindowState(windowStartMillis, windowStartMillis + windowMillis, 1);
    }

    public WindowState increment() {
        return new WindowState(windowStartMillis, windowEndMillis, count + 1);
    }
}

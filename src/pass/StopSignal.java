package pass;

/**
 * Cooperative cancellation flag for one pipeline run. Owned by the driver and
 * shared with every pass it creates.
 */
public final class StopSignal {
    private volatile boolean requested = false;

    public void request() {
        requested = true;
    }

    public boolean isRequested() {
        return requested;
    }
}

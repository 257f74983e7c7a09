package in.imagen.application.service;

/**
 * Prediction poller lifecycle.
 *
 * Flow: POLLING → SUCCEEDED/FAILED/CANCELED/TIMED_OUT
 */
public enum PollerState {
    POLLING,
    SUCCEEDED,
    FAILED,
    CANCELED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this != POLLING;
    }
}

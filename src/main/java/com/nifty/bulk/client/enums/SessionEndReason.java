package com.nifty.bulk.client.enums;

public enum SessionEndReason {

    LOGOUT(SessionState.INVALIDATED, "You have been logged out."),
    LOGOUT_ALL_DEVICES(SessionState.INVALIDATED, "You have been logged out from all devices."),
    CONCURRENT_SESSION(SessionState.INVALIDATED,
            "You have been logged out because your account was logged in from another device."),
    REFRESH_FAILED(SessionState.EXPIRED, "Your session has expired. Please log in again.");

    private final SessionState terminalState;
    private final String notice;

    SessionEndReason(SessionState terminalState, String notice) {
        this.terminalState = terminalState;
        this.notice = notice;
    }

    public SessionState getTerminalState() {
        return terminalState;
    }

    /** User-visible text for the view layer. */
    public String getNotice() {
        return notice;
    }

    /**
     * Persisted session fields belong to the newer owner after a takeover and must be left alone.
     */
    public boolean clearsPersistedState() {
        return this != CONCURRENT_SESSION;
    }
}

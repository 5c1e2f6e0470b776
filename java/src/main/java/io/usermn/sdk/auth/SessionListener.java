package io.usermn.sdk.auth;

/**
 * Receives session state transitions. Called on the thread that caused the transition.
 */
@FunctionalInterface
public interface SessionListener {

    void onStateChange(SessionState previous, SessionState current);
}

package io.usermn.sdk.auth;

/**
 * States of a {@link SessionManager}.
 *
 * <pre>
 * ANONYMOUS -&gt; AUTHENTICATING -&gt; AUTHENTICATED -&gt; REFRESHING -&gt; AUTHENTICATED | ANONYMOUS
 * AUTHENTICATED -&gt; LOGGED_OUT -&gt; ANONYMOUS
 * </pre>
 */
public enum SessionState {
    ANONYMOUS,
    AUTHENTICATING,
    AUTHENTICATED,
    REFRESHING,
    LOGGED_OUT
}

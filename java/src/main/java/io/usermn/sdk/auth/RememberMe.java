package io.usermn.sdk.auth;

/**
 * Remember-me preference. Survives logout when enabled.
 */
public record RememberMe(boolean enabled, String rememberedEmail) {

    public static final RememberMe DISABLED = new RememberMe(false, null);
}

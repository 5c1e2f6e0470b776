package io.usermn.sdk.http;

/**
 * One dispatch of a logical request. Exists only for the duration of the retry loop and is used in log lines.
 */
public record AuditableRequest(String method, String path, int attempt, String idempotencyKey) {

    @Override
    public String toString() {
        String base = method + " " + path + " attempt " + attempt;
        return idempotencyKey == null ? base : base + " idempotency-key " + idempotencyKey;
    }
}

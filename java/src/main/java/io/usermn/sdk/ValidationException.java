package io.usermn.sdk;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 4xx response carrying field-level errors. Never retried; form consumers render {@link #getFieldErrors()} inline.
 */
public final class ValidationException extends ApiException {

    private static final long serialVersionUID = 1L;

    private final Map<String, List<String>> fieldErrors;

    public ValidationException(int statusCode, String code, String message, String requestId,
                               Map<String, List<String>> fieldErrors) {
        super(statusCode, code, message, requestId, null);
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (fieldErrors != null) {
            fieldErrors.forEach((field, messages) -> copy.put(field, List.copyOf(messages)));
        }
        this.fieldErrors = Collections.unmodifiableMap(copy);
    }

    public Map<String, List<String>> getFieldErrors() {
        return fieldErrors;
    }

    public List<String> errorsFor(String field) {
        return fieldErrors.getOrDefault(field, List.of());
    }
}

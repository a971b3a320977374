package me.golemcore.receipts.security;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Strips credentials from text and parameter maps before they reach error
 * payloads, hook payloads or receipts.
 *
 * <p>
 * Detected patterns include:
 * <ul>
 * <li>Passwords, secrets and API keys in {@code key=value} or
 * {@code key: "value"} form</li>
 * <li>Bearer authentication tokens</li>
 * <li>Provider-style secret keys ({@code sk-...}, {@code sk_live_...})</li>
 * </ul>
 */
public class SensitiveDataRedactor {

    public static final String REDACTED = "[REDACTED]";

    private static final int MAX_CAUSE_DEPTH = 16;

    private static final List<String> SENSITIVE_KEY_MARKERS = List.of(
            "password", "passwd", "secret", "token", "apikey", "api_key", "api-key", "authorization",
            "credential", "private_key");

    private static final Pattern QUOTED_ASSIGNMENT = Pattern.compile(
            "((?:password|passwd|secret|token|api[_-]?key)['\"]?\\s*[:=]\\s*['\"])[^'\"]+(['\"])",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern BARE_ASSIGNMENT = Pattern.compile(
            "((?:password|passwd|secret|token|api[_-]?key)['\"]?\\s*[:=]\\s*)[^\\s'\",;&]+",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern BEARER = Pattern.compile(
            "Bearer\\s+[A-Za-z0-9\\-._~+/]+=*", Pattern.CASE_INSENSITIVE);
    private static final Pattern SECRET_KEY = Pattern.compile("\\bsk[-_][A-Za-z0-9_\\-]{8,}");

    /**
     * Redacts sensitive fragments of free text. Returns {@code null} for
     * {@code null} input.
     */
    public String redact(String content) {
        if (content == null) {
            return null;
        }
        String result = QUOTED_ASSIGNMENT.matcher(content).replaceAll("$1" + REDACTED + "$2");
        result = BARE_ASSIGNMENT.matcher(result).replaceAll("$1" + REDACTED);
        result = BEARER.matcher(result).replaceAll("Bearer " + REDACTED);
        result = SECRET_KEY.matcher(result).replaceAll(REDACTED);
        return result;
    }

    public boolean isSensitiveKey(String key) {
        if (key == null) {
            return false;
        }
        String normalized = key.toLowerCase(Locale.ROOT);
        for (String marker : SENSITIVE_KEY_MARKERS) {
            if (normalized.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Copies a parameter map, masking values under sensitive keys and redacting
     * string values.
     */
    public Map<String, Object> redactParameters(Map<String, Object> parameters) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (parameters == null) {
            return result;
        }
        for (Map.Entry<String, Object> entry : parameters.entrySet()) {
            Object value = entry.getValue();
            if (isSensitiveKey(entry.getKey())) {
                result.put(entry.getKey(), REDACTED);
            } else if (value instanceof String text) {
                result.put(entry.getKey(), redact(text));
            } else {
                result.put(entry.getKey(), value);
            }
        }
        return result;
    }

    /**
     * Describes the innermost cause of an error with credentials removed.
     */
    public String describe(Throwable error) {
        if (error == null) {
            return "unknown";
        }
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && cause != cursor) {
            cursor = cause;
            cause = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return redact(message);
    }

    /**
     * Copies an exception chain into {@link RedactedException}s with every
     * message redacted, so the result can be chained, logged or handed to hooks.
     * Returns {@code null} for {@code null} input.
     */
    public RedactedException sanitize(Throwable error) {
        return sanitize(error, MAX_CAUSE_DEPTH);
    }

    private RedactedException sanitize(Throwable error, int depth) {
        if (error == null) {
            return null;
        }
        if (error instanceof RedactedException redacted) {
            return redacted;
        }
        Throwable cause = error.getCause();
        RedactedException sanitizedCause = cause != null && cause != error && depth > 0
                ? sanitize(cause, depth - 1)
                : null;
        RedactedException result = new RedactedException(error.getClass().getName(), redact(error.getMessage()),
                sanitizedCause);
        result.setStackTrace(error.getStackTrace());
        return result;
    }
}

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

/**
 * Stand-in for an exception whose message may carry credentials. Keeps the
 * original type name, stack trace and cause chain; every message in the chain
 * is redacted.
 */
public class RedactedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String originalType;

    RedactedException(String originalType, String message, RedactedException cause) {
        super(message, cause);
        this.originalType = originalType;
    }

    /**
     * Fully qualified class name of the replaced exception.
     */
    public String getOriginalType() {
        return originalType;
    }

    @Override
    public synchronized RedactedException getCause() {
        return (RedactedException) super.getCause();
    }

    @Override
    public String toString() {
        String message = getMessage();
        return message != null ? originalType + ": " + message : originalType;
    }
}

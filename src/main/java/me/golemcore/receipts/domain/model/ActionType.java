package me.golemcore.receipts.domain.model;

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

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Enumerated tag resolved from the free-form action type of a tool call, e.g.
 * {@code update_lead -> UPDATE}, {@code send_sms -> SEND}.
 */
public enum ActionType {

    CREATE(List.of("create", "add", "insert", "register")),
    READ(List.of("get", "read", "fetch", "list", "retrieve")),
    UPDATE(List.of("update", "modify", "edit", "patch")),
    DELETE(List.of("delete", "remove", "cancel")),
    SEND(List.of("send", "post", "notify", "message")),
    SEARCH(List.of("search", "find", "query", "lookup")),
    PAYMENT(List.of("charge", "refund", "payment", "payout", "invoice")),
    OTHER(List.of());

    private static final Pattern WORD_SEPARATOR = Pattern.compile("[_\\-.\\s]+|(?<=[a-z0-9])(?=[A-Z])");
    private static final Map<String, ActionType> BY_KEYWORD = indexKeywords();

    private final List<String> keywords;

    ActionType(List<String> keywords) {
        this.keywords = keywords;
    }

    /**
     * Resolves the tag of an action string such as {@code update_lead},
     * {@code delete-playlist} or {@code createContact}. The action is split into
     * words on underscores, hyphens, dots, whitespace and camelCase boundaries;
     * the first word that equals a keyword decides, so the leading verb wins.
     * Unknown or blank actions resolve to {@link #OTHER}.
     */
    public static ActionType resolve(String action) {
        if (action == null || action.isBlank()) {
            return OTHER;
        }
        for (String word : WORD_SEPARATOR.split(action.trim())) {
            ActionType type = BY_KEYWORD.get(word.toLowerCase(Locale.ROOT));
            if (type != null) {
                return type;
            }
        }
        return OTHER;
    }

    private static Map<String, ActionType> indexKeywords() {
        Map<String, ActionType> index = new HashMap<>();
        for (ActionType type : values()) {
            for (String keyword : type.keywords) {
                index.putIfAbsent(keyword, type);
            }
        }
        return Map.copyOf(index);
    }
}

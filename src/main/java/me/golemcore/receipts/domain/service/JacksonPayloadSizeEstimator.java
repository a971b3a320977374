package me.golemcore.receipts.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

/**
 * Measures payloads as their UTF-8 JSON encoding. Payloads Jackson cannot
 * serialize are measured through {@link String#valueOf(Object)}.
 */
@RequiredArgsConstructor
@Slf4j
public class JacksonPayloadSizeEstimator implements PayloadSizeEstimator {

    private final ObjectMapper objectMapper;

    @Override
    public long estimateBytes(Object payload) {
        if (payload == null) {
            return 0;
        }
        try {
            return objectMapper.writeValueAsBytes(payload).length;
        } catch (JsonProcessingException e) {
            log.debug("[Receipts] Payload {} is not JSON-serializable, measuring its text form",
                    payload.getClass().getSimpleName());
            return String.valueOf(payload).getBytes(StandardCharsets.UTF_8).length;
        }
    }
}

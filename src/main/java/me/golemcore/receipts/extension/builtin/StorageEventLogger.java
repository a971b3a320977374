package me.golemcore.receipts.extension.builtin;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.receipts.domain.model.StorageEvent;
import me.golemcore.receipts.domain.model.StorageEventType;
import me.golemcore.receipts.domain.storage.MediatedStorageService;
import me.golemcore.receipts.domain.storage.StorageEventListener;
import org.springframework.stereotype.Component;

/**
 * Logs storage events. Values are never logged.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StorageEventLogger implements StorageEventListener {

    private final MediatedStorageService storage;

    @PostConstruct
    public void register() {
        storage.addListener(this);
    }

    @Override
    public void onStorageEvent(StorageEvent event) {
        if (event.type() == StorageEventType.ERROR) {
            log.warn("[Storage] {} {}/{} failed on {}: {}", event.operation().label(), event.namespace(),
                    event.key(), event.providerId(), event.errorMessage());
            return;
        }
        log.debug("[Storage] {} {}/{} on {} at {}", event.type(), event.namespace(), event.key(),
                event.providerId(), event.timestamp());
    }
}

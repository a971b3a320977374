package me.golemcore.receipts.domain.extension;

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

import me.golemcore.receipts.security.RedactedException;

/**
 * Isolated failure of one handler during an invocation.
 *
 * @param extensionId
 *            owner of the failing handler
 * @param slotName
 *            invoked slot
 * @param position
 *            zero-based position of the handler in registration order
 * @param message
 *            redacted failure message
 * @param error
 *            redacted copy of the thrown exception
 */
public record HandlerFailure(
        String extensionId,
        String slotName,
        int position,
        String message,
        RedactedException error
) {
}

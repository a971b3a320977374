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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.receipts.security.SensitiveDataRedactor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry and executor of extension points.
 *
 * <p>
 * Slots are declared once with {@link #registerSlot}; handlers are appended to
 * a slot with {@link #registerHandler} and run by {@link #invoke} strictly in
 * registration order. A failing handler never stops the handlers after it:
 * exceptions and errors (except {@link VirtualMachineError}) are collected
 * into the returned {@link InvocationOutcome} and counted in the slot's
 * {@link SlotStatistics}.
 *
 * <p>
 * Slot and handler tables are meant to be filled during startup. Reads during
 * steady-state traffic are lock-free.
 */
@Slf4j
public class ExtensionPointRegistry {

    private static final String LOG_PREFIX = "[Extensions]";

    private final DuplicateSlotPolicy duplicateSlotPolicy;
    private final SensitiveDataRedactor redactor;

    private final Map<String, ExtensionPointSlot> slots = new ConcurrentHashMap<>();
    private final Map<String, List<RegisteredHandler>> handlersBySlot = new ConcurrentHashMap<>();
    private final Map<String, SlotStatistics> statisticsBySlot = new ConcurrentHashMap<>();

    public ExtensionPointRegistry(DuplicateSlotPolicy duplicateSlotPolicy, SensitiveDataRedactor redactor) {
        this.duplicateSlotPolicy = Objects.requireNonNull(duplicateSlotPolicy, "duplicateSlotPolicy must not be null");
        this.redactor = Objects.requireNonNull(redactor, "redactor must not be null");
    }

    public ExtensionPointSlot registerSlot(String name, String description, List<String> parameterNames) {
        return registerSlot(new ExtensionPointSlot(name, description, parameterNames));
    }

    /**
     * Declares a slot.
     *
     * @return the slot definition in effect after the call; under
     *         {@link DuplicateSlotPolicy#IGNORE} this is the first definition
     * @throws DuplicateSlotException
     *             if the name is taken and the policy is
     *             {@link DuplicateSlotPolicy#REJECT}
     */
    public synchronized ExtensionPointSlot registerSlot(ExtensionPointSlot slot) {
        ExtensionPointSlot existing = slots.get(slot.name());
        if (existing != null) {
            if (duplicateSlotPolicy == DuplicateSlotPolicy.REJECT) {
                throw new DuplicateSlotException(slot.name());
            }
            log.warn("{} Ignoring duplicate registration of slot '{}'", LOG_PREFIX, slot.name());
            return existing;
        }
        slots.put(slot.name(), slot);
        handlersBySlot.put(slot.name(), new CopyOnWriteArrayList<>());
        statisticsBySlot.put(slot.name(), SlotStatistics.empty());
        log.debug("{} Registered slot '{}' {}", LOG_PREFIX, slot.name(), slot.parameterNames());
        return slot;
    }

    /**
     * Appends a handler owned by the handler's class.
     */
    public RegisteredHandler registerHandler(String slotName, ExtensionHandler handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        return registerHandler(slotName, handler.getClass().getSimpleName(), handler);
    }

    /**
     * Appends a handler to the slot's handler list.
     *
     * @throws UnknownSlotException
     *             if the slot has not been registered
     */
    public synchronized RegisteredHandler registerHandler(String slotName, String extensionId,
            ExtensionHandler handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        List<RegisteredHandler> handlers = requireHandlers(slotName);
        RegisteredHandler registered = new RegisteredHandler(extensionId, slotName, handler);
        handlers.add(registered);
        log.debug("{} Bound handler from '{}' to slot '{}' at position {}",
                LOG_PREFIX, extensionId, slotName, handlers.size() - 1);
        return registered;
    }

    /**
     * Runs every handler of the slot in registration order.
     *
     * @throws UnknownSlotException
     *             if the slot has not been registered
     */
    public InvocationOutcome invoke(String slotName, Map<String, Object> payload) {
        List<RegisteredHandler> handlers = requireHandlers(slotName);
        Map<String, Object> safePayload = payload != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(payload))
                : Map.of();

        List<HandlerFailure> failures = new ArrayList<>();
        int position = 0;
        int invoked = 0;
        for (RegisteredHandler registered : handlers) {
            invoked++;
            try {
                registered.handler().handle(safePayload);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Exception | Error e) { // NOSONAR - handler failures are isolated and reported
                String message = redactor.describe(e);
                log.warn("{} Handler from '{}' failed on slot '{}': {}",
                        LOG_PREFIX, registered.extensionId(), slotName, message);
                failures.add(new HandlerFailure(registered.extensionId(), slotName, position, message,
                        redactor.sanitize(e)));
            }
            position++;
        }

        recordStatistics(slotName, failures);
        return new InvocationOutcome(slotName, invoked, failures);
    }

    public boolean hasSlot(String slotName) {
        return slotName != null && slots.containsKey(slotName);
    }

    public Optional<ExtensionPointSlot> getSlot(String slotName) {
        return slotName == null ? Optional.empty() : Optional.ofNullable(slots.get(slotName));
    }

    public List<ExtensionPointSlot> getSlots() {
        return List.copyOf(slots.values());
    }

    public List<RegisteredHandler> getHandlers(String slotName) {
        return List.copyOf(requireHandlers(slotName));
    }

    public SlotStatistics getStatistics(String slotName) {
        requireHandlers(slotName);
        return statisticsBySlot.getOrDefault(slotName, SlotStatistics.empty());
    }

    /**
     * Drops every slot, handler and counter.
     */
    public synchronized void clear() {
        slots.clear();
        handlersBySlot.clear();
        statisticsBySlot.clear();
        log.debug("{} Registry cleared", LOG_PREFIX);
    }

    private List<RegisteredHandler> requireHandlers(String slotName) {
        List<RegisteredHandler> handlers = slotName != null ? handlersBySlot.get(slotName) : null;
        if (handlers == null) {
            throw new UnknownSlotException(slotName);
        }
        return handlers;
    }

    private void recordStatistics(String slotName, List<HandlerFailure> failures) {
        statisticsBySlot.computeIfPresent(slotName, (name, current) -> new SlotStatistics(
                current.invocations() + 1,
                current.handlerFailures() + failures.size(),
                failures.isEmpty() ? current.lastError() : failures.get(failures.size() - 1).message()));
    }
}

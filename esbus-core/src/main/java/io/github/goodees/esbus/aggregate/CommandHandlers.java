package io.github.goodees.esbus.aggregate;

/*-
 * #%L
 * esbus
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.esbus.Bus;
import io.github.goodees.esbus.CommandBusException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Name-keyed table of the commands an aggregate accepts. Built once per aggregate instance:
 * <pre>
 *     protected CommandHandlers commandHandlers() {
 *         return CommandHandlers.builder()
 *                 .on("AddNumbers", this::addNumbers)
 *                 .on("SubtractNumbers", this::subtractNumbers)
 *                 .build();
 *     }
 * </pre>
 */
public class CommandHandlers {
    private final Map<String, Handler> handlers;

    private CommandHandlers(Builder builder) {
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.handlers));
    }

    /**
     * Names of all accepted commands, in order of declaration.
     * @return command names
     */
    public Set<String> names() {
        return handlers.keySet();
    }

    /**
     * Handler for a command.
     * @param command command name
     * @return the handler or null if the command is not accepted
     */
    public Handler handler(String command) {
        return handlers.get(command);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, Handler> handlers = new LinkedHashMap<>();

        /**
         * When command of this name arrives, invoke the handler.
         * @param command the name of the command
         * @param handler the handler
         * @return this builder
         */
        public Builder on(String command, Handler handler) {
            Objects.requireNonNull(command, "Command name must be defined");
            Objects.requireNonNull(handler, "Handler must be defined");
            if (handlers.putIfAbsent(command, handler) != null) {
                throw new IllegalArgumentException("Command " + command + " is already handled");
            }
            return this;
        }

        public CommandHandlers build() {
            return new CommandHandlers(this);
        }
    }

    /**
     * Command logic. It validates the payload against current state and records new events via
     * {@link Aggregate#addEvent(String, Map)}. It may consult other aggregates through the bus.
     */
    @FunctionalInterface
    public interface Handler {
        void handle(Actor actor, Map<String, Object> payload, Bus bus) throws CommandBusException;
    }
}

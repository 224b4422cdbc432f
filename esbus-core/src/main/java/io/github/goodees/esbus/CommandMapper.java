package io.github.goodees.esbus;

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

import io.github.goodees.esbus.aggregate.AggregateType;
import io.github.goodees.esbus.store.VersionPadder;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Routes command names to the aggregate type declaring them. Built and validated once, read only afterwards.
 */
public class CommandMapper {
    private final Map<String, AggregateType<?>> commands;

    /**
     * Validate the types and index their commands.
     * @param types registered aggregate types
     * @throws CommandBusException with {@code PRECONDITION} fault when a type does not provide commands, has
     *         unsupported maximum of events, or when a name of type or command is used twice
     */
    public CommandMapper(Collection<? extends AggregateType<?>> types) throws CommandBusException {
        Map<String, AggregateType<?>> index = new HashMap<>();
        Set<String> names = new HashSet<>();
        for (AggregateType<?> type : types) {
            if (type == null) {
                throw CommandBusException.precondition("aggregate type must not be null");
            }
            if (!names.add(type.getName())) {
                throw CommandBusException.precondition("aggregate type " + type.getName() + " registered twice");
            }
            VersionPadder.forMaxEvents(type.getMaxEvents());
            for (String command : type.commands()) {
                AggregateType<?> previous = index.putIfAbsent(command, type);
                if (previous != null) {
                    throw CommandBusException.precondition("command " + command + " is declared by both "
                            + previous.getName() + " and " + type.getName());
                }
            }
        }
        this.commands = Collections.unmodifiableMap(index);
    }

    /**
     * Find the type handling a command.
     * @param command command name
     * @return the aggregate type
     * @throws CommandBusException with {@code INVALID_ARGUMENTS} fault for unknown command
     */
    public AggregateType<?> map(String command) throws CommandBusException {
        AggregateType<?> type = commands.get(command);
        if (type == null) {
            throw CommandBusException.invalidArguments("command " + command + " not found");
        }
        return type;
    }

    public Set<String> getCommands() {
        return commands.keySet();
    }
}

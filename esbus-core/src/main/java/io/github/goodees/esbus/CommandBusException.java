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

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Exception raised by the bus, its event stores and streams. The {@link Fault} tells the caller whether it makes
 * sense to try again: only {@link Fault#CONCURRENCY} is worth retrying, after reloading the aggregate.
 */
public class CommandBusException extends Exception {
    private final Fault fault;

    public enum Fault {
        /** Required argument was absent. Caller bug, never retried. */
        MISSING_ARGUMENTS,
        /** Unknown command or aggregate type, malformed collaborator. Caller bug. */
        INVALID_ARGUMENTS,
        /** Registration-time misconfiguration or max events overflow. Fatal. */
        PRECONDITION,
        /** Optimistic lock lost. The caller may reload and retry. */
        CONCURRENCY,
        /** Contract method not supplied by a concrete implementation. */
        NOT_IMPLEMENTED,
        /** Backing store failure. */
        TX_ERROR
    }

    protected CommandBusException(Fault fault, String message, Throwable cause) {
        super(message, cause);
        this.fault = fault;
    }

    public Fault getFault() {
        return fault;
    }

    public static CommandBusException missingArguments(String argument) {
        return new CommandBusException(Fault.MISSING_ARGUMENTS, "Missing arguments: " + argument, null);
    }

    public static CommandBusException invalidArguments(String message) {
        return new CommandBusException(Fault.INVALID_ARGUMENTS, "Invalid arguments: " + message, null);
    }

    public static CommandBusException precondition(String message) {
        return new CommandBusException(Fault.PRECONDITION, "Precondition failed: " + message, null);
    }

    public static CommandBusException concurrency(String aggregateId, long expectedVersion) {
        return new CommandBusException(Fault.CONCURRENCY, "Aggregate " + aggregateId
                + " has been changed past expected version " + expectedVersion, null);
    }

    public static CommandBusException concurrency(String aggregateId, long expectedVersion, long actualVersion) {
        return new CommandBusException(Fault.CONCURRENCY, "Aggregate " + aggregateId + " is at version "
                + actualVersion + " while version " + expectedVersion + " was expected", null);
    }

    public static CommandBusException notImplemented(String method) {
        return new CommandBusException(Fault.NOT_IMPLEMENTED, "Not implemented: " + method, null);
    }

    public static CommandBusException storeFailed(String what, Throwable cause) {
        return new CommandBusException(Fault.TX_ERROR, what + " failed. " + cause.getMessage(), cause);
    }

    public static CommandBusException contention(String what, int attempts) {
        return new CommandBusException(Fault.TX_ERROR, what + " failed after " + attempts
                + " attempts due to concurrent writers", null);
    }

    /**
     * Recover the bus exception out of the wrappers a future puts around it.
     * @param t throwable the future completed with
     * @return the original bus exception, or a {@code TX_ERROR} wrapping anything else
     */
    public static CommandBusException unwrap(Throwable t) {
        Throwable cause = t;
        while ((cause instanceof ExecutionException || cause instanceof CompletionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof CommandBusException) {
            return (CommandBusException) cause;
        }
        if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return storeFailed("Asynchronous invocation", cause);
    }
}

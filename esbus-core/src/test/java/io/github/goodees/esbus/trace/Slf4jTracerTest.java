package io.github.goodees.esbus.trace;

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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class Slf4jTracerTest {
    Logger logger;
    ListAppender<ILoggingEvent> appender;

    @Before
    public void setUp() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        logger = ctx.getLogger(Slf4jTracerTest.class.getName() + ".traces");
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        logger.setLevel(Level.DEBUG);
    }

    @After
    public void tearDown() {
        logger.detachAppender(appender);
    }

    @Test
    public void records_are_logged_at_debug() {
        new Slf4jTracer(logger).trace(() -> Tracer.record("command", "command", "AddNumbers"));

        assertEquals(1, appender.list.size());
        assertEquals(Level.DEBUG, appender.list.get(0).getLevel());
        assertEquals("command: {command=AddNumbers}", appender.list.get(0).getFormattedMessage());
    }

    @Test
    public void handler_failures_are_logged_as_warnings() {
        new Slf4jTracer(logger).trace(() -> Tracer.record("handlerFailed", "tenant", "t", "stream", "main",
            "handler", "counter", "event", 3, "error", new IllegalStateException()));

        assertEquals(Level.WARN, appender.list.get(0).getLevel());
        assertTrue(appender.list.get(0).getFormattedMessage().contains("counter"));
    }

    @Test
    public void record_is_not_built_without_debug() {
        logger.setLevel(Level.INFO);
        AtomicBoolean built = new AtomicBoolean();

        new Slf4jTracer(logger).trace(() -> {
            built.set(true);
            return Tracer.record("command");
        });

        assertFalse(built.get());
        assertTrue(appender.list.isEmpty());
    }
}

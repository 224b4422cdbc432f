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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Tracer writing records to a logger at debug level, failed handlers as warnings. Records are only built when debug
 * is enabled.
 */
public class Slf4jTracer implements Tracer {
    private final Logger logger;

    public Slf4jTracer() {
        this(LoggerFactory.getLogger(Slf4jTracer.class));
    }

    public Slf4jTracer(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void trace(Supplier<Map<String, Object>> record) {
        if (!logger.isDebugEnabled()) {
            return;
        }
        try {
            Map<String, Object> fields = record.get();
            Object error = fields.get("error");
            if (error != null) {
                logger.warn("{}: {} on tenant {} - stream {} failed on {}", fields.get("method"),
                    fields.get("handler"), fields.get("tenant"), fields.get("stream"), fields.get("event"));
            } else {
                Map<String, Object> context = new LinkedHashMap<>(fields);
                Object method = context.remove("method");
                logger.debug("{}: {}", method, context);
            }
        } catch (RuntimeException e) {
            logger.warn("Trace record could not be rendered", e);
        }
    }
}

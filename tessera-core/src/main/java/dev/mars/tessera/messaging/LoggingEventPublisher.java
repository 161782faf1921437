/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

package dev.mars.tessera.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes each event as a single JSON line to the {@code dev.mars.tessera.events} logger.
 */
public class LoggingEventPublisher implements EventPublisher {

    private static final Logger logger = Logger.getLogger(LoggingEventPublisher.class.getName());
    private static final Logger eventLog = Logger.getLogger("dev.mars.tessera.events");

    private final ObjectMapper objectMapper;
    private final Level level;

    public LoggingEventPublisher() {
        this(Level.INFO);
    }

    public LoggingEventPublisher(Level level) {
        this.level = level;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void publish(RoutingEvent event) {
        if (!eventLog.isLoggable(level)) {
            return;
        }
        eventLog.log(level, toJson(event));
    }

    String toJson(RoutingEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            logger.warning("Could not serialize event " + event.eventType() + ": " + e.getMessage());
            return event.toString();
        }
    }
}

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.nosqlbench.phaseinit;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the events written to one class's logger while attached. Close it to
 * detach and restore the logger's level.
 */
final class CapturingAppender extends AbstractAppender implements AutoCloseable {

    private final List<LogEvent> events = new ArrayList<>();
    private final Logger logger;
    private final Level previousLevel;

    private CapturingAppender(Class<?> type, Level level) {
        super("capture-" + type.getSimpleName(), null, null, false, Property.EMPTY_ARRAY);
        this.logger = (Logger) LogManager.getLogger(type);
        this.previousLevel = logger.getLevel();
        start();
        logger.addAppender(this);
        logger.setLevel(level);
    }

    static CapturingAppender attach(Class<?> type, Level level) {
        return new CapturingAppender(type, level);
    }

    @Override
    public synchronized void append(LogEvent event) {
        events.add(event.toImmutable());
    }

    synchronized List<String> messagesAt(Level level) {
        return events.stream()
            .filter(e -> e.getLevel().equals(level))
            .map(e -> e.getMessage().getFormattedMessage())
            .collect(Collectors.toList());
    }

    @Override
    public void close() {
        logger.removeAppender(this);
        logger.setLevel(previousLevel);
        stop();
    }
}

/*
 *  Copyright 2025-present The original author or authors.
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *       https://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package plus.wcj.c2flowchart.settings;

import lombok.Data;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Process-wide defaults. Loaded once from the bundled {@code c2flowchart.properties}, then overridden by the file
 * named in the {@code c2flowchart.config} system property or, when that is unset, {@code ~/.c2flowchart.properties}.
 */
public final class C2FlowchartSettings {
    private static final Logger LOG = LoggerFactory.getLogger(C2FlowchartSettings.class);

    public static final String CONFIG_PROPERTY = "c2flowchart.config";
    static final String DEFAULTS_RESOURCE = "/c2flowchart.properties";
    static final String USER_FILE = ".c2flowchart.properties";

    private static volatile C2FlowchartSettings instance;

    private final State state;

    private C2FlowchartSettings(State state) {
        this.state = state;
    }

    public static C2FlowchartSettings getInstance() {
        C2FlowchartSettings local = instance;
        if (local == null) {
            synchronized (C2FlowchartSettings.class) {
                local = instance;
                if (local == null) {
                    local = load(userConfigPath());
                    instance = local;
                }
            }
        }
        return local;
    }

    /**
     * Loads the bundled defaults and applies {@code overrides} on top when the file exists.
     */
    public static C2FlowchartSettings load(Path overrides) {
        Properties properties = new Properties();
        try (InputStream in = C2FlowchartSettings.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                properties.load(in);
            } else {
                LOG.debug("No bundled {} on the classpath, using built-in defaults", DEFAULTS_RESOURCE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULTS_RESOURCE, e);
        }
        if (overrides != null && Files.isRegularFile(overrides)) {
            try (Reader reader = Files.newBufferedReader(overrides, StandardCharsets.UTF_8)) {
                properties.load(reader);
                LOG.debug("Applied settings overrides from {}", overrides);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read settings file " + overrides, e);
            }
        }
        return new C2FlowchartSettings(State.fromProperties(properties));
    }

    public static C2FlowchartSettings of(@NotNull State state) {
        return new C2FlowchartSettings(state.copy());
    }

    static Path userConfigPath() {
        String explicit = System.getProperty(CONFIG_PROPERTY);
        if (explicit != null && !explicit.isBlank()) {
            return Path.of(explicit);
        }
        return Path.of(System.getProperty("user.home", "."), USER_FILE);
    }

    /**
     * Returns a copy; callers may adjust it without affecting other users of the settings.
     */
    public State getState() {
        return state.copy();
    }

    @Data
    @Accessors(chain = true)
    public static class State {
        public static final int DEFAULT_LABEL_MAX_LENGTH = 50;
        public static final String DEFAULT_DO_WHILE_FALLBACK = "do-while (?)";
        public static final String DEFAULT_DIRECTION = "TD";
        public static final String DEFAULT_FORMAT = "dump";

        private int labelMaxLength = DEFAULT_LABEL_MAX_LENGTH;
        private String doWhileFallbackCondition = DEFAULT_DO_WHILE_FALLBACK;
        private String direction = DEFAULT_DIRECTION;
        private String format = DEFAULT_FORMAT;
        private boolean stripComments = true;

        static State fromProperties(Properties properties) {
            State state = new State();
            String maxLength = properties.getProperty("label.maxLength");
            if (maxLength != null && !maxLength.isBlank()) {
                try {
                    state.setLabelMaxLength(Integer.parseInt(maxLength.trim()));
                } catch (NumberFormatException e) {
                    LOG.warn("Ignoring invalid label.maxLength '{}'", maxLength);
                }
            }
            state.setDoWhileFallbackCondition(properties.getProperty("extract.doWhileFallbackCondition", DEFAULT_DO_WHILE_FALLBACK));
            state.setStripComments(Boolean.parseBoolean(properties.getProperty("extract.stripComments", "true").trim()));
            state.setDirection(properties.getProperty("render.direction", DEFAULT_DIRECTION).trim());
            state.setFormat(properties.getProperty("output.format", DEFAULT_FORMAT).trim());
            return state;
        }

        public State copy() {
            return new State()
                    .setLabelMaxLength(labelMaxLength)
                    .setDoWhileFallbackCondition(doWhileFallbackCondition)
                    .setDirection(direction)
                    .setFormat(format)
                    .setStripComments(stripComments);
        }
    }
}

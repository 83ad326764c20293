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

package plus.wcj.c2flowchart.extract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import plus.wcj.c2flowchart.settings.C2FlowchartSettings;

import java.io.UncheckedIOException;
import java.util.function.Supplier;

public record ExtractOptions(boolean stripComments, String doWhileFallbackCondition) {
    private static final Logger LOG = LoggerFactory.getLogger(ExtractOptions.class);

    public ExtractOptions {
        if (doWhileFallbackCondition == null || doWhileFallbackCondition.isBlank()) {
            doWhileFallbackCondition = C2FlowchartSettings.State.DEFAULT_DO_WHILE_FALLBACK;
        }
    }

    public static ExtractOptions defaultOptions() {
        return defaultOptions(C2FlowchartSettings::getInstance);
    }

    /**
     * Options from the loaded settings, or the built-in defaults when the settings cannot be read.
     */
    static ExtractOptions defaultOptions(Supplier<C2FlowchartSettings> settings) {
        try {
            return fromState(settings.get().getState());
        } catch (UncheckedIOException e) {
            LOG.warn("Settings could not be loaded, using built-in extraction defaults", e);
            return fromState(new C2FlowchartSettings.State());
        }
    }

    public static ExtractOptions fromState(C2FlowchartSettings.State state) {
        return new ExtractOptions(state.isStripComments(), state.getDoWhileFallbackCondition());
    }
}

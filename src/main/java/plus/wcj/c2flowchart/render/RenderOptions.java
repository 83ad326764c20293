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

package plus.wcj.c2flowchart.render;

import plus.wcj.c2flowchart.settings.C2FlowchartSettings;

import java.util.Locale;

public record RenderOptions(String direction, int labelMaxLength) {
    public RenderOptions {
        direction = direction == null || direction.isBlank() ? "TD" : direction.trim().toUpperCase(Locale.ROOT);
        if (labelMaxLength < 4) {
            throw new IllegalArgumentException("labelMaxLength must be at least 4, was " + labelMaxLength);
        }
    }

    public static RenderOptions topDown() {
        return new RenderOptions("TD", C2FlowchartSettings.State.DEFAULT_LABEL_MAX_LENGTH);
    }

    public static RenderOptions leftRight() {
        return new RenderOptions("LR", C2FlowchartSettings.State.DEFAULT_LABEL_MAX_LENGTH);
    }

    public static RenderOptions fromState(C2FlowchartSettings.State state) {
        return new RenderOptions(state.getDirection(), state.getLabelMaxLength());
    }

    /**
     * Cuts {@code content} to {@code labelMaxLength - 3} characters followed by {@code ...} when it is longer than
     * {@code labelMaxLength}.
     */
    public String truncate(String content) {
        if (content == null) {
            return "";
        }
        if (content.length() > labelMaxLength) {
            return content.substring(0, labelMaxLength - 3) + "...";
        }
        return content;
    }
}

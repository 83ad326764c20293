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

import java.util.regex.Pattern;

public final class CommentStripper {
    private static final Pattern LINE_COMMENT = Pattern.compile("//.*");
    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);

    private CommentStripper() {
    }

    /**
     * Removes line comments to end of line, then block comments up to the nearest terminator.
     * String literals are not protected.
     */
    public static String strip(String code) {
        if (code == null || code.isEmpty()) {
            return "";
        }
        String withoutLines = LINE_COMMENT.matcher(code).replaceAll("");
        return BLOCK_COMMENT.matcher(withoutLines).replaceAll("");
    }
}

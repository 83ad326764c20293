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

import java.util.Objects;

/**
 * One unit of the heuristic statement stream. Header tokens carry the full keyword-through-closing-paren text,
 * for example {@code for (int i = 0; i < n; i++)}.
 */
public record Token(Kind kind, String text) {
    public enum Kind {
        IF("if"),
        FOR("for"),
        WHILE("while"),
        DO("do"),
        ELSE("else"),
        OPEN_BRACE("{"),
        CLOSE_BRACE("}"),
        STATEMENT(null);

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        public boolean isHeader() {
            return this == IF || this == FOR || this == WHILE;
        }
    }

    public Token {
        Objects.requireNonNull(kind, "kind");
        text = text == null ? "" : text.trim();
    }

    public static Token of(Kind kind) {
        return new Token(kind, kind.keyword());
    }

    public static Token statement(String text) {
        return new Token(Kind.STATEMENT, text);
    }

    public boolean is(Kind other) {
        return kind == other;
    }

    public boolean isBlank() {
        return text.isBlank();
    }

    public boolean isBreak() {
        return kind == Kind.STATEMENT && compact().equals("break;");
    }

    public boolean isContinue() {
        return kind == Kind.STATEMENT && compact().equals("continue;");
    }

    private String compact() {
        return text.replaceAll("\\s+", "");
    }
}

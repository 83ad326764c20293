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

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a function body into {@link Token}s without a grammar.
 * <p>
 * Keywords are recognized only on identifier boundaries. {@code if}, {@code for} and {@code while} swallow their
 * balanced parenthesized header; {@code do}, {@code else} and braces stand alone; everything else accumulates up to
 * and including the next {@code ;}.
 */
public final class StatementTokenizer {
    private static final Token.Kind[] KEYWORDS = {
            Token.Kind.IF, Token.Kind.FOR, Token.Kind.WHILE, Token.Kind.DO, Token.Kind.ELSE
    };

    private StatementTokenizer() {
    }

    public static List<Token> tokenize(String code) {
        List<Token> tokens = new ArrayList<>();
        if (code == null || code.isEmpty()) {
            return tokens;
        }
        StringBuilder current = new StringBuilder();
        int length = code.length();
        int i = 0;
        while (i < length) {
            Token.Kind keyword = keywordAt(code, i);
            if (keyword != null) {
                int end = keyword.isHeader()
                        ? headerEnd(code, i + keyword.keyword().length())
                        : i + keyword.keyword().length();
                if (end > 0) {
                    flush(current, tokens);
                    tokens.add(new Token(keyword, code.substring(i, end)));
                    i = end;
                    continue;
                }
            }
            char c = code.charAt(i);
            if (c == '{' || c == '}') {
                flush(current, tokens);
                tokens.add(Token.of(c == '{' ? Token.Kind.OPEN_BRACE : Token.Kind.CLOSE_BRACE));
            } else if (c == ';') {
                current.append(c);
                tokens.add(Token.statement(current.toString()));
                current.setLength(0);
            } else {
                current.append(c);
            }
            i++;
        }
        flush(current, tokens);
        return tokens;
    }

    private static Token.Kind keywordAt(String code, int index) {
        if (index > 0 && isIdentifierPart(code.charAt(index - 1))) {
            return null;
        }
        for (Token.Kind kind : KEYWORDS) {
            String word = kind.keyword();
            int after = index + word.length();
            if (code.startsWith(word, index) && (after >= code.length() || !isIdentifierPart(code.charAt(after)))) {
                return kind;
            }
        }
        return null;
    }

    /**
     * Returns the offset just past the parenthesis closing the header that starts scanning at {@code from}, the end
     * of input when the parentheses never balance, or -1 when there is no opening parenthesis at all.
     */
    private static int headerEnd(String code, int from) {
        int open = code.indexOf('(', from);
        if (open < 0) {
            return -1;
        }
        int depth = 1;
        int j = open + 1;
        while (j < code.length() && depth > 0) {
            char c = code.charAt(j);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            }
            j++;
        }
        return j;
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static void flush(StringBuilder current, List<Token> tokens) {
        if (!current.toString().isBlank()) {
            tokens.add(Token.statement(current.toString()));
        }
        current.setLength(0);
    }
}

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

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Isolates the clauses that belong to a structural token: the body of a loop or branch, the else-clause of an
 * {@code if}, and the trailing condition of a {@code do}. Bodies are sub-lists of the token stream; every
 * {@code next} index points at the first token not consumed.
 */
public final class ClauseExtractor {
    private static final Pattern DO_WHILE_CONDITION = Pattern.compile("while\\s*\\((.*)\\)", Pattern.DOTALL);

    private ClauseExtractor() {
    }

    public record Clause(List<Token> body, int next) {
        public Clause {
            body = List.copyOf(body);
        }

        public boolean isEmpty() {
            return isBlank(body);
        }
    }

    public record IfElse(List<Token> thenBody, List<Token> elseBody, int next) {
        public IfElse {
            thenBody = List.copyOf(thenBody);
            elseBody = List.copyOf(elseBody);
        }
    }

    public record DoWhile(List<Token> body, String condition, int next) {
        public DoWhile {
            body = List.copyOf(body);
            condition = condition == null ? "" : condition;
        }
    }

    /**
     * Extracts the body following the token at {@code index}. A brace opens a balanced block whose inner tokens form
     * the body. Without a brace the body is the next statement: a single token, or the whole nested construct when
     * that token starts one ({@code if}, a loop header or {@code do}).
     */
    public static Clause body(List<Token> tokens, int index) {
        int i = index + 1;
        if (i >= tokens.size()) {
            return new Clause(List.of(), tokens.size());
        }
        if (tokens.get(i).is(Token.Kind.OPEN_BRACE)) {
            int start = i + 1;
            int depth = 1;
            int j = start;
            while (j < tokens.size() && depth > 0) {
                Token token = tokens.get(j);
                if (token.is(Token.Kind.OPEN_BRACE)) {
                    depth++;
                } else if (token.is(Token.Kind.CLOSE_BRACE)) {
                    depth--;
                }
                j++;
            }
            int end = depth == 0 ? j - 1 : j;
            return new Clause(tokens.subList(start, end), j);
        }
        int end = statementEnd(tokens, i);
        return new Clause(tokens.subList(i, end), end);
    }

    /**
     * Extracts the then- and else-bodies of the {@code if} header at {@code index}. For {@code else if} the
     * else-body is the complete nested {@code if} statement including its own else-chain.
     */
    public static IfElse ifElse(List<Token> tokens, int index) {
        Clause then = body(tokens, index);
        int next = then.next();
        List<Token> elseBody = List.of();
        if (next < tokens.size() && tokens.get(next).is(Token.Kind.ELSE)) {
            Clause otherwise = body(tokens, next);
            elseBody = otherwise.body();
            next = otherwise.next();
        }
        return new IfElse(then.body(), elseBody, next);
    }

    /**
     * Extracts the body of the {@code do} at {@code index} and the condition of the {@code while} that closes it.
     * The terminating {@code ;} is consumed. The condition is empty when the trailing header is missing or has no
     * parenthesized condition.
     */
    public static DoWhile doWhile(List<Token> tokens, int index) {
        Clause clause = body(tokens, index);
        int next = clause.next();
        String condition = "";
        if (next < tokens.size() && tokens.get(next).is(Token.Kind.WHILE)) {
            Matcher matcher = DO_WHILE_CONDITION.matcher(tokens.get(next).text());
            if (matcher.find()) {
                condition = matcher.group(1).trim();
            }
            next++;
            if (next < tokens.size() && tokens.get(next).is(Token.Kind.STATEMENT) && tokens.get(next).text().equals(";")) {
                next++;
            }
        }
        return new DoWhile(clause.body(), condition, next);
    }

    public static boolean isBlank(List<Token> tokens) {
        return tokens.stream().allMatch(Token::isBlank);
    }

    private static int statementEnd(List<Token> tokens, int index) {
        return switch (tokens.get(index).kind()) {
            case IF -> ifElse(tokens, index).next();
            case FOR, WHILE -> body(tokens, index).next();
            case DO -> doWhile(tokens, index).next();
            default -> index + 1;
        };
    }
}

package com.deepansh.orchestrator.tool.impl;

import com.deepansh.orchestrator.config.ToolProperties;
import com.deepansh.orchestrator.tool.AgentTool;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;

/**
 * Safe arithmetic evaluator. Never evaluates code: the expression is parsed by a
 * small recursive-descent parser that only knows numbers, parentheses and
 * {@code + - * / % ^ **} (power binds tighter than unary minus, and is right-associative).
 */
@Slf4j
public class CalculatorTool implements AgentTool {

    private final int scale;

    public CalculatorTool() {
        this(new ToolProperties.Calculator());
    }

    public CalculatorTool(ToolProperties.Calculator properties) {
        this.scale = properties.getScale();
    }

    @Override
    public String getName() {
        return "calculator";
    }

    @Override
    public String getDescription() {
        return "Perform mathematical calculations. Supports + - * / % and ^ (power) with parentheses, "
                + "e.g. '(15 * 8) + 32'.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "expression", Map.of(
                                "type", "string",
                                "description", "The arithmetic expression to evaluate"
                        )
                ),
                "required", List.of("expression")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        Object expression = arguments.get("expression");
        if (expression == null || expression.toString().isBlank()) {
            return "ERROR: 'expression' argument is required";
        }
        try {
            double value = new Parser(expression.toString()).parse();
            String result = format(value);
            log.debug("Evaluated '{}' = {}", expression, result);
            return result;
        } catch (ArithmeticException | IllegalArgumentException e) {
            return "ERROR: Calculation error: " + e.getMessage();
        }
    }

    private String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ArithmeticException("result is not a finite number");
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value)
                .setScale(scale, RoundingMode.HALF_UP)
                .stripTrailingZeros()
                .toPlainString();
    }

    private static final class Parser {

        static final int MAX_DEPTH = 200;

        private final String input;
        private int pos;
        private int depth;

        private Parser(String input) {
            this.input = input;
        }

        double parse() {
            double value = expression();
            skipWhitespace();
            if (pos < input.length()) {
                throw new IllegalArgumentException("Unexpected character '" + input.charAt(pos) + "' at position " + pos);
            }
            return value;
        }

        private double expression() {
            double value = term();
            while (true) {
                if (consume('+')) {
                    value += term();
                } else if (consume('-')) {
                    value -= term();
                } else {
                    return value;
                }
            }
        }

        private double term() {
            double value = unary();
            while (true) {
                if (consume('*')) {
                    value *= unary();
                } else if (consume('/')) {
                    double divisor = unary();
                    if (divisor == 0) {
                        throw new ArithmeticException("division by zero");
                    }
                    value /= divisor;
                } else if (consume('%')) {
                    double divisor = unary();
                    if (divisor == 0) {
                        throw new ArithmeticException("modulo by zero");
                    }
                    value %= divisor;
                } else {
                    return value;
                }
            }
        }

        private double unary() {
            enter();
            try {
                if (consume('-')) {
                    return -unary();
                }
                if (consume('+')) {
                    return unary();
                }
                return power();
            } finally {
                depth--;
            }
        }

        /** Nested parentheses, signs and powers all count towards the depth limit */
        private void enter() {
            if (++depth > MAX_DEPTH) {
                throw new IllegalArgumentException("Expression nested deeper than " + MAX_DEPTH + " levels");
            }
        }

        private double power() {
            double base = primary();
            if (consumePower()) {
                return Math.pow(base, unary());
            }
            return base;
        }

        private double primary() {
            if (consume('(')) {
                enter();
                double value;
                try {
                    value = expression();
                } finally {
                    depth--;
                }
                if (!consume(')')) {
                    throw new IllegalArgumentException("Missing closing parenthesis");
                }
                return value;
            }
            skipWhitespace();
            int start = pos;
            while (pos < input.length() && (Character.isDigit(input.charAt(pos)) || input.charAt(pos) == '.')) {
                pos++;
            }
            if (start == pos) {
                throw new IllegalArgumentException(pos < input.length()
                        ? "Unexpected character '" + input.charAt(pos) + "' at position " + pos
                        : "Unexpected end of expression");
            }
            try {
                return Double.parseDouble(input.substring(start, pos));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number '" + input.substring(start, pos) + "'");
            }
        }

        private boolean consumePower() {
            skipWhitespace();
            if (input.startsWith("**", pos)) {
                pos += 2;
                return true;
            }
            return consume('^');
        }

        private boolean consume(char expected) {
            skipWhitespace();
            if (pos < input.length() && input.charAt(pos) == expected) {
                // a single '*' must not swallow the first half of '**'
                if (expected == '*' && input.startsWith("**", pos)) {
                    return false;
                }
                pos++;
                return true;
            }
            return false;
        }

        private void skipWhitespace() {
            while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
                pos++;
            }
        }
    }
}

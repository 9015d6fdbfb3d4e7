/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.dxwdl.wdlCompiler.frontend.values;

import org.dxwdl.wdlCompiler.frontend.ast.*;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Evaluates the subset of WDL expressions that can be computed at compile time:
 * literals, arithmetic, comparisons, collections, and a few pure library functions.
 * Everything else raises an EvaluationException.
 */
public class ConstantEvaluator implements ExpressionEvaluator {
    @Override
    public WdlValue evaluate(WdlExpression expression, Function<String, WdlValue> lookup) {
        Evaluator evaluator = new Evaluator(lookup);
        return evaluator.evaluate(expression);
    }

    static class Evaluator extends ExpressionVisitor {
        final Function<String, WdlValue> lookup;
        /**
         * Value of the last expression visited.
         */
        @Nullable
        WdlValue result;

        Evaluator(Function<String, WdlValue> lookup) {
            super(false);
            this.lookup = lookup;
            this.result = null;
        }

        WdlValue evaluate(WdlExpression expression) {
            this.result = null;
            expression.accept(this);
            return Objects.requireNonNull(this.result);
        }

        static EvaluationException error(WdlExpression expression, String message) {
            return new EvaluationException(message + ": " + expression.toWdlString());
        }

        long asInt(WdlExpression expression, WdlValue value) {
            WdlIntValue i = value.as(WdlIntValue.class);
            if (i == null)
                throw error(expression, "Expected an Int value, got " + value);
            return i.value;
        }

        boolean asBoolean(WdlExpression expression, WdlValue value) {
            WdlBooleanValue b = value.as(WdlBooleanValue.class);
            if (b == null)
                throw error(expression, "Expected a Boolean value, got " + value);
            return b.value;
        }

        static boolean isNumeric(WdlValue value) {
            return value.is(WdlIntValue.class) || value.is(WdlFloatValue.class);
        }

        static double asDouble(WdlValue value) {
            if (value.is(WdlIntValue.class))
                return value.to(WdlIntValue.class).value;
            return value.to(WdlFloatValue.class).value;
        }

        @Override
        public boolean preorder(WdlIdentifier expression) {
            this.result = this.lookup.apply(expression.name);
            return false;
        }

        @Override
        public boolean preorder(WdlMemberAccess expression) {
            if (expression.isMemberAccess()) {
                try {
                    this.result = this.lookup.apply(expression.toWdlString());
                    return false;
                } catch (EvaluationException ex) {
                    // Not a variable; may be a pair member
                    this.result = null;
                }
            }
            WdlValue value = this.evaluate(expression.lhs);
            WdlPairValue pair = value.as(WdlPairValue.class);
            if (pair != null) {
                if (expression.member.equals("left")) {
                    this.result = pair.left;
                    return false;
                } else if (expression.member.equals("right")) {
                    this.result = pair.right;
                    return false;
                }
            }
            throw error(expression, "Cannot evaluate member access");
        }

        @Override
        public boolean preorder(WdlIntLiteral expression) {
            this.result = new WdlIntValue(expression.value);
            return false;
        }

        @Override
        public boolean preorder(WdlFloatLiteral expression) {
            this.result = new WdlFloatValue(expression.value);
            return false;
        }

        @Override
        public boolean preorder(WdlBoolLiteral expression) {
            this.result = WdlBooleanValue.get(expression.value);
            return false;
        }

        @Override
        public boolean preorder(WdlStringLiteral expression) {
            StringBuilder builder = new StringBuilder();
            for (int i = 0; i < expression.fragments.size(); i++) {
                builder.append(expression.fragments.get(i));
                if (i < expression.placeholders.size())
                    builder.append(this.evaluate(expression.placeholders.get(i)).asString());
            }
            this.result = new WdlStringValue(builder.toString());
            return false;
        }

        @Override
        public boolean preorder(WdlUnaryExpression expression) {
            WdlValue operand = this.evaluate(expression.operand);
            switch (expression.operation) {
                case "!":
                    this.result = WdlBooleanValue.get(!this.asBoolean(expression, operand));
                    break;
                case "+":
                    if (!isNumeric(operand))
                        throw error(expression, "Expected a numeric value");
                    this.result = operand;
                    break;
                case "-":
                    if (operand.is(WdlIntValue.class))
                        this.result = new WdlIntValue(-operand.to(WdlIntValue.class).value);
                    else if (operand.is(WdlFloatValue.class))
                        this.result = new WdlFloatValue(-operand.to(WdlFloatValue.class).value);
                    else
                        throw error(expression, "Expected a numeric value");
                    break;
                default:
                    throw error(expression, "Unknown operation " + expression.operation);
            }
            return false;
        }

        WdlValue arithmetic(WdlBinaryExpression expression, WdlValue left, WdlValue right) {
            String op = expression.operation;
            if (op.equals("+") && (left.is(WdlStringValue.class) || right.is(WdlStringValue.class)))
                return new WdlStringValue(left.asString() + right.asString());
            if (!isNumeric(left) || !isNumeric(right))
                throw error(expression, "Expected numeric operands");
            if (left.is(WdlIntValue.class) && right.is(WdlIntValue.class)) {
                long l = left.to(WdlIntValue.class).value;
                long r = right.to(WdlIntValue.class).value;
                switch (op) {
                    case "+":
                        return new WdlIntValue(l + r);
                    case "-":
                        return new WdlIntValue(l - r);
                    case "*":
                        return new WdlIntValue(l * r);
                    case "/":
                        if (r == 0)
                            throw error(expression, "Division by zero");
                        return new WdlIntValue(l / r);
                    case "%":
                        if (r == 0)
                            throw error(expression, "Division by zero");
                        return new WdlIntValue(l % r);
                    default:
                        break;
                }
            } else {
                double l = asDouble(left);
                double r = asDouble(right);
                switch (op) {
                    case "+":
                        return new WdlFloatValue(l + r);
                    case "-":
                        return new WdlFloatValue(l - r);
                    case "*":
                        return new WdlFloatValue(l * r);
                    case "/":
                        return new WdlFloatValue(l / r);
                    case "%":
                        return new WdlFloatValue(l % r);
                    default:
                        break;
                }
            }
            throw error(expression, "Unknown operation " + op);
        }

        static boolean valueEquals(WdlValue left, WdlValue right) {
            if (isNumeric(left) && isNumeric(right))
                return asDouble(left) == asDouble(right);
            return left.equals(right);
        }

        WdlValue comparison(WdlBinaryExpression expression, WdlValue left, WdlValue right) {
            String op = expression.operation;
            if (op.equals("=="))
                return WdlBooleanValue.get(valueEquals(left, right));
            if (op.equals("!="))
                return WdlBooleanValue.get(!valueEquals(left, right));
            int compare;
            if (isNumeric(left) && isNumeric(right))
                compare = Double.compare(asDouble(left), asDouble(right));
            else if (left.is(WdlStringValue.class) && right.is(WdlStringValue.class))
                compare = left.to(WdlStringValue.class).value.compareTo(right.to(WdlStringValue.class).value);
            else if (left.is(WdlBooleanValue.class) && right.is(WdlBooleanValue.class))
                compare = Boolean.compare(left.to(WdlBooleanValue.class).value, right.to(WdlBooleanValue.class).value);
            else
                throw error(expression, "Cannot compare " + left + " and " + right);
            switch (op) {
                case "<":
                    return WdlBooleanValue.get(compare < 0);
                case "<=":
                    return WdlBooleanValue.get(compare <= 0);
                case ">":
                    return WdlBooleanValue.get(compare > 0);
                case ">=":
                    return WdlBooleanValue.get(compare >= 0);
                default:
                    throw error(expression, "Unknown operation " + op);
            }
        }

        @Override
        public boolean preorder(WdlBinaryExpression expression) {
            String op = expression.operation;
            WdlValue left = this.evaluate(expression.left);
            switch (op) {
                case "&&":
                    if (!this.asBoolean(expression.left, left))
                        this.result = WdlBooleanValue.FALSE;
                    else
                        this.result = WdlBooleanValue.get(
                                this.asBoolean(expression.right, this.evaluate(expression.right)));
                    return false;
                case "||":
                    if (this.asBoolean(expression.left, left))
                        this.result = WdlBooleanValue.TRUE;
                    else
                        this.result = WdlBooleanValue.get(
                                this.asBoolean(expression.right, this.evaluate(expression.right)));
                    return false;
                default:
                    break;
            }
            WdlValue right = this.evaluate(expression.right);
            switch (op) {
                case "+":
                case "-":
                case "*":
                case "/":
                case "%":
                    this.result = this.arithmetic(expression, left, right);
                    break;
                default:
                    this.result = this.comparison(expression, left, right);
                    break;
            }
            return false;
        }

        @Override
        public boolean preorder(WdlIfThenElse expression) {
            boolean condition = this.asBoolean(expression.condition, this.evaluate(expression.condition));
            this.result = this.evaluate(condition ? expression.positive : expression.negative);
            return false;
        }

        @Override
        public boolean preorder(WdlArrayLiteral expression) {
            List<WdlValue> elements = new ArrayList<>();
            for (WdlExpression e: expression.elements)
                elements.add(this.evaluate(e));
            this.result = new WdlArrayValue(elements);
            return false;
        }

        @Override
        public boolean preorder(WdlMapLiteral expression) {
            LinkedHashMap<WdlValue, WdlValue> entries = new LinkedHashMap<>();
            for (int i = 0; i < expression.keys.size(); i++) {
                WdlValue key = this.evaluate(expression.keys.get(i));
                WdlValue value = this.evaluate(expression.values.get(i));
                entries.put(key, value);
            }
            this.result = new WdlMapValue(entries);
            return false;
        }

        @Override
        public boolean preorder(WdlPairLiteral expression) {
            WdlValue left = this.evaluate(expression.left);
            WdlValue right = this.evaluate(expression.right);
            this.result = new WdlPairValue(left, right);
            return false;
        }

        @Override
        public boolean preorder(WdlIndexExpression expression) {
            WdlValue collection = this.evaluate(expression.collection);
            WdlValue index = this.evaluate(expression.index);
            WdlArrayValue array = collection.as(WdlArrayValue.class);
            if (array != null) {
                long i = this.asInt(expression.index, index);
                if (i < 0 || i >= array.elements.size())
                    throw error(expression, "Index " + i + " out of bounds");
                this.result = array.elements.get((int) i);
                return false;
            }
            WdlMapValue map = collection.as(WdlMapValue.class);
            if (map != null) {
                WdlValue value = map.entries.get(index);
                if (value == null)
                    throw error(expression, "Key " + index + " not found");
                this.result = value;
                return false;
            }
            throw error(expression, "Cannot index into " + collection);
        }

        @Override
        public boolean preorder(WdlApplyExpression expression) {
            List<WdlExpression> args = expression.arguments;
            switch (expression.function) {
                case "length": {
                    if (args.size() != 1)
                        throw error(expression, "length expects one argument");
                    WdlValue value = this.evaluate(args.get(0));
                    WdlArrayValue array = value.as(WdlArrayValue.class);
                    if (array == null)
                        throw error(expression, "length expects an array");
                    this.result = new WdlIntValue(array.elements.size());
                    return false;
                }
                case "defined": {
                    if (args.size() != 1)
                        throw error(expression, "defined expects one argument");
                    // Every value that can be computed at compile time is defined
                    this.evaluate(args.get(0));
                    this.result = WdlBooleanValue.TRUE;
                    return false;
                }
                case "select_first": {
                    if (args.size() != 1)
                        throw error(expression, "select_first expects one argument");
                    WdlValue value = this.evaluate(args.get(0));
                    WdlArrayValue array = value.as(WdlArrayValue.class);
                    if (array == null || array.elements.isEmpty())
                        throw error(expression, "select_first expects a non-empty array");
                    this.result = array.elements.get(0);
                    return false;
                }
                default:
                    throw error(expression, "Function " + expression.function + " cannot be evaluated at compile time");
            }
        }
    }
}

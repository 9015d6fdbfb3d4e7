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

package org.dxwdl.wdlCompiler.frontend;

import org.dxwdl.wdlCompiler.frontend.ast.*;

import javax.annotation.Nullable;
import java.util.Map;

/**
 * Computes the type of an expression, for the expressions whose type can be
 * determined from the types of the variables and the WDL standard library.
 * Returns null when the type cannot be determined.
 */
public class TypeInference {
    final Map<String, WdlType> variables;

    /**
     * @param variables  Types of the visible variables, indexed by name;
     *                   call outputs are indexed by their qualified name, e.g. A.x.
     */
    public TypeInference(Map<String, WdlType> variables) {
        this.variables = variables;
    }

    static boolean isArithmetic(String operation) {
        switch (operation) {
            case "+":
            case "-":
            case "*":
            case "/":
            case "%":
                return true;
            default:
                return false;
        }
    }

    @Nullable
    WdlType function(WdlApplyExpression expression) {
        switch (expression.function) {
            case "range":
                return new WdlArrayType(WdlPrimitiveType.INT);
            case "length":
            case "read_int":
                return WdlPrimitiveType.INT;
            case "defined":
            case "read_boolean":
                return WdlPrimitiveType.BOOLEAN;
            case "read_string":
            case "sub":
            case "basename":
                return WdlPrimitiveType.STRING;
            case "read_float":
            case "size":
                return WdlPrimitiveType.FLOAT;
            case "read_lines":
                return new WdlArrayType(WdlPrimitiveType.STRING);
            case "glob":
                return new WdlArrayType(WdlPrimitiveType.FILE);
            case "select_first": {
                if (expression.arguments.size() != 1)
                    return null;
                WdlType array = this.infer(expression.arguments.get(0));
                if (array == null || !array.is(WdlArrayType.class))
                    return null;
                return array.to(WdlArrayType.class).elementType.stripOptional();
            }
            case "select_all": {
                if (expression.arguments.size() != 1)
                    return null;
                WdlType array = this.infer(expression.arguments.get(0));
                if (array == null || !array.is(WdlArrayType.class))
                    return null;
                return new WdlArrayType(array.to(WdlArrayType.class).elementType.stripOptional());
            }
            default:
                return null;
        }
    }

    @Nullable
    public WdlType infer(WdlExpression expression) {
        if (expression.is(WdlIntLiteral.class))
            return WdlPrimitiveType.INT;
        if (expression.is(WdlFloatLiteral.class))
            return WdlPrimitiveType.FLOAT;
        if (expression.is(WdlBoolLiteral.class))
            return WdlPrimitiveType.BOOLEAN;
        if (expression.is(WdlStringLiteral.class))
            return WdlPrimitiveType.STRING;
        if (expression.is(WdlIdentifier.class))
            return this.variables.get(expression.to(WdlIdentifier.class).name);
        if (expression.is(WdlMemberAccess.class)) {
            WdlMemberAccess access = expression.to(WdlMemberAccess.class);
            if (access.isMemberAccess()) {
                WdlType type = this.variables.get(access.toWdlString());
                if (type != null)
                    return type;
            }
            WdlType lhs = this.infer(access.lhs);
            if (lhs == null || !lhs.stripOptional().is(WdlPairType.class))
                return null;
            WdlPairType pair = lhs.stripOptional().to(WdlPairType.class);
            if (access.member.equals("left"))
                return pair.leftType;
            if (access.member.equals("right"))
                return pair.rightType;
            return null;
        }
        if (expression.is(WdlArrayLiteral.class)) {
            WdlArrayLiteral array = expression.to(WdlArrayLiteral.class);
            if (array.elements.isEmpty())
                return null;
            WdlType element = this.infer(array.elements.get(0));
            return element == null ? null : new WdlArrayType(element);
        }
        if (expression.is(WdlPairLiteral.class)) {
            WdlPairLiteral pair = expression.to(WdlPairLiteral.class);
            WdlType left = this.infer(pair.left);
            WdlType right = this.infer(pair.right);
            if (left == null || right == null)
                return null;
            return new WdlPairType(left, right);
        }
        if (expression.is(WdlMapLiteral.class)) {
            WdlMapLiteral map = expression.to(WdlMapLiteral.class);
            if (map.keys.isEmpty())
                return null;
            WdlType key = this.infer(map.keys.get(0));
            WdlType value = this.infer(map.values.get(0));
            if (key == null || value == null)
                return null;
            return new WdlMapType(key, value);
        }
        if (expression.is(WdlUnaryExpression.class)) {
            WdlUnaryExpression unary = expression.to(WdlUnaryExpression.class);
            if (unary.operation.equals("!"))
                return WdlPrimitiveType.BOOLEAN;
            return this.infer(unary.operand);
        }
        if (expression.is(WdlBinaryExpression.class)) {
            WdlBinaryExpression binary = expression.to(WdlBinaryExpression.class);
            if (!isArithmetic(binary.operation))
                return WdlPrimitiveType.BOOLEAN;
            WdlType left = this.infer(binary.left);
            WdlType right = this.infer(binary.right);
            if (left == null || right == null)
                return null;
            left = left.stripOptional();
            right = right.stripOptional();
            if (left.equals(WdlPrimitiveType.STRING) || right.equals(WdlPrimitiveType.STRING))
                return WdlPrimitiveType.STRING;
            if (left.equals(WdlPrimitiveType.INT) && right.equals(WdlPrimitiveType.INT))
                return WdlPrimitiveType.INT;
            return WdlPrimitiveType.FLOAT;
        }
        if (expression.is(WdlIfThenElse.class))
            return this.infer(expression.to(WdlIfThenElse.class).positive);
        if (expression.is(WdlIndexExpression.class)) {
            WdlType collection = this.infer(expression.to(WdlIndexExpression.class).collection);
            if (collection == null)
                return null;
            collection = collection.stripOptional();
            if (collection.is(WdlArrayType.class))
                return collection.to(WdlArrayType.class).elementType;
            if (collection.is(WdlMapType.class))
                return collection.to(WdlMapType.class).valueType;
            return null;
        }
        if (expression.is(WdlApplyExpression.class))
            return this.function(expression.to(WdlApplyExpression.class));
        return null;
    }
}

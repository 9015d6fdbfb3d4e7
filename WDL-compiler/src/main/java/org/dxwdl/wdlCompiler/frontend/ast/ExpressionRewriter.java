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

package org.dxwdl.wdlCompiler.frontend.ast;

import org.dxwdl.util.IModule;
import org.dxwdl.util.Linq;
import org.dxwdl.util.Logger;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Base class for visitors that rewrite an expression tree into a new tree.
 * Nodes whose children are unchanged are reused; the default
 * implementation of each preorder method rebuilds the node from its
 * rewritten children.
 */
public abstract class ExpressionRewriter
        extends ExpressionVisitor
        implements Function<WdlExpression, WdlExpression>, IModule {
    /**
     * Result produced by the last preorder invocation.
     */
    @Nullable
    protected WdlExpression lastResult;

    protected ExpressionRewriter() {
        super(false);
    }

    WdlExpression getResult() {
        return Objects.requireNonNull(this.lastResult);
    }

    @Override
    public WdlExpression apply(WdlExpression expression) {
        expression.accept(this);
        return this.getResult();
    }

    @Nullable
    public WdlExpression applyN(@Nullable WdlExpression expression) {
        if (expression == null)
            return null;
        return this.apply(expression);
    }

    /**
     * Replace the 'old' expression with the 'newExpression'.
     * @param old  only used for debugging.
     */
    protected void map(WdlExpression old, WdlExpression newExpression) {
        if (old != newExpression)
            Logger.INSTANCE.from(this, 2)
                    .append(old.toString())
                    .append(" -> ")
                    .append(newExpression.toString())
                    .newline();
        this.lastResult = newExpression;
    }

    protected WdlExpression transform(WdlExpression expression) {
        expression.accept(this);
        return this.getResult();
    }

    protected List<WdlExpression> transform(List<WdlExpression> expressions) {
        return Linq.map(expressions, this::transform);
    }

    @Override
    public boolean preorder(WdlExpression expression) {
        this.map(expression, expression);
        return false;
    }

    @Override
    public boolean preorder(WdlIdentifier expression) {
        this.map(expression, expression);
        return false;
    }

    @Override
    public boolean preorder(WdlIntLiteral expression) {
        this.map(expression, expression);
        return false;
    }

    @Override
    public boolean preorder(WdlFloatLiteral expression) {
        this.map(expression, expression);
        return false;
    }

    @Override
    public boolean preorder(WdlBoolLiteral expression) {
        this.map(expression, expression);
        return false;
    }

    @Override
    public boolean preorder(WdlMemberAccess expression) {
        WdlExpression lhs = this.transform(expression.lhs);
        WdlExpression result = expression;
        if (lhs != expression.lhs)
            result = new WdlMemberAccess(expression.getPositionOrNull(), lhs, expression.member);
        this.map(expression, result);
        return false;
    }

    @Override
    public boolean preorder(WdlStringLiteral expression) {
        List<WdlExpression> placeholders = this.transform(expression.placeholders);
        WdlExpression result = expression;
        if (Linq.different(placeholders, expression.placeholders))
            result = new WdlStringLiteral(expression.getPositionOrNull(), expression.fragments, placeholders);
        this.map(expression, result);
        return false;
    }

    @Override
    public boolean preorder(WdlUnaryExpression expression) {
        WdlExpression operand = this.transform(expression.operand);
        WdlExpression result = expression;
        if (operand != expression.operand)
            result = new WdlUnaryExpression(expression.getPositionOrNull(), expression.operation, operand);
        this.map(expression, result);
        return false;
    }

    @Override
    public boolean preorder(WdlBinaryExpression expression) {
        WdlExpression left = this.transform(expression.left);
        WdlExpression right = this.transform(expression.right);
        WdlExpression result = expression;
        if (left != expression.left || right != expression.right)
            result = new WdlBinaryExpression(expression.getPositionOrNull(), expression.operation, left, right);
        this.map(expression, result);
        return false;
    }

    @Override
    public boolean preorder(WdlApplyExpression expression) {
        List<WdlExpression> arguments = this.transform(expression.arguments);
        WdlExpression result = expression;
        if (Linq.different(arguments, expression.arguments))
            result = new WdlApplyExpression(expression.getPositionOrNull(), expression.function, arguments);
        this.map(expression, result);
        return false;
    }

    @Override
    public boolean preorder(WdlIndexExpression expression) {
        WdlExpression collection = this.transform(expression.collection);
        WdlExpression index = this.transform(expression.index);
        WdlExpression result = expression;
        if (collection != expression.collection || index != expression.index)
            result = new WdlIndexExpression(expression.getPositionOrNull(), collection, index);
        this.map(expression, result);
        return false;
    }

    @Override
    public boolean preorder(WdlArrayLiteral expression) {
        List<WdlExpression> elements = this.transform(expression.elements);
        WdlExpression result = expression;
        if (Linq.different(elements, expression.elements))
            result = new WdlArrayLiteral(expression.getPositionOrNull(), elements);
        this.map(expression, result);
        return false;
    }

    @Override
    public boolean preorder(WdlMapLiteral expression) {
        List<WdlExpression> keys = this.transform(expression.keys);
        List<WdlExpression> values = this.transform(expression.values);
        WdlExpression result = expression;
        if (Linq.different(keys, expression.keys) || Linq.different(values, expression.values))
            result = new WdlMapLiteral(expression.getPositionOrNull(), keys, values);
        this.map(expression, result);
        return false;
    }

    @Override
    public boolean preorder(WdlPairLiteral expression) {
        WdlExpression left = this.transform(expression.left);
        WdlExpression right = this.transform(expression.right);
        WdlExpression result = expression;
        if (left != expression.left || right != expression.right)
            result = new WdlPairLiteral(expression.getPositionOrNull(), left, right);
        this.map(expression, result);
        return false;
    }

    @Override
    public boolean preorder(WdlIfThenElse expression) {
        WdlExpression condition = this.transform(expression.condition);
        WdlExpression positive = this.transform(expression.positive);
        WdlExpression negative = this.transform(expression.negative);
        WdlExpression result = expression;
        if (condition != expression.condition ||
                positive != expression.positive ||
                negative != expression.negative)
            result = new WdlIfThenElse(expression.getPositionOrNull(), condition, positive, negative);
        this.map(expression, result);
        return false;
    }
}

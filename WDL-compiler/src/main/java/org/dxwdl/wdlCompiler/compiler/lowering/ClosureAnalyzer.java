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

package org.dxwdl.wdlCompiler.compiler.lowering;

import org.dxwdl.wdlCompiler.compiler.errors.LoweringException;
import org.dxwdl.wdlCompiler.frontend.ast.ExpressionVisitor;
import org.dxwdl.wdlCompiler.frontend.ast.IdentifierCollector;
import org.dxwdl.wdlCompiler.frontend.ast.WdlExpression;
import org.dxwdl.wdlCompiler.frontend.ast.WdlIdentifier;
import org.dxwdl.wdlCompiler.frontend.ast.WdlMemberAccess;
import org.dxwdl.wdlCompiler.ir.CallEnv;
import org.dxwdl.wdlCompiler.ir.LinkedVar;

import javax.annotation.Nullable;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Computes the subset of an environment that an expression reads.
 *
 * <p>WDL uses the same syntax A.B.C for member access and for qualified names,
 * so dotted names are resolved by trying successively shorter prefixes:
 * A.B.C, then A.B, then A.
 */
public class ClosureAnalyzer {
    private ClosureAnalyzer() {}

    /**
     * Collects the names an expression reads: all maximal dotted chains
     * and all identifiers, including the roots of the dotted chains.
     */
    static class ReferenceCollector extends ExpressionVisitor {
        final List<WdlExpression> memberAccesses = new ArrayList<>();
        final List<String> identifiers = new ArrayList<>();

        ReferenceCollector() {
            super(false);
        }

        @Override
        public boolean preorder(WdlMemberAccess expression) {
            if (expression.isMemberAccess())
                this.memberAccesses.add(expression);
            // Continue to find the root identifier
            return true;
        }

        @Override
        public boolean preorder(WdlIdentifier expression) {
            this.identifiers.add(expression.name);
            return false;
        }
    }

    /**
     * Names of all identifiers that appear in the expression,
     * including the roots of dotted chains and identifiers in string placeholders.
     */
    public static List<String> referencedIdentifiers(WdlExpression expression) {
        return IdentifierCollector.collect(expression);
    }

    /**
     * Look for A.B.C, A.B, and A, in this order.
     * @return the first name that is bound in the environment, with its binding,
     * or null if there is none.
     */
    @Nullable
    public static Map.Entry<String, LinkedVar> trailSearch(CallEnv env, WdlExpression expression) {
        WdlExpression current = expression;
        while (true) {
            String name = current.toWdlString();
            LinkedVar var = env.get(name);
            if (var != null)
                return new AbstractMap.SimpleImmutableEntry<>(name, var);
            if (!current.isMemberAccess())
                return null;
            current = current.to(WdlMemberAccess.class).lhs;
        }
    }

    /**
     * The subset of the environment read by an expression.
     */
    public static CallEnv closure(CallEnv env, WdlExpression expression) {
        return updateClosure(CallEnv.EMPTY, env, expression);
    }

    /**
     * Add to 'closure' all the bindings of 'env' read by 'expression'.
     * Names that are not in the environment are assumed to be local
     * variables and are ignored.
     */
    public static CallEnv updateClosure(CallEnv closure, CallEnv env, WdlExpression expression) {
        WdlIdentifier identifier = expression.as(WdlIdentifier.class);
        if (identifier != null) {
            LinkedVar var = env.get(identifier.name);
            if (var == null)
                return closure;
            return closure.plus(identifier.name, var);
        }
        if (expression.isMemberAccess()) {
            Map.Entry<String, LinkedVar> found = trailSearch(env, expression);
            if (found == null)
                return closure;
            return closure.plus(found.getKey(), found.getValue());
        }

        ReferenceCollector collector = new ReferenceCollector();
        expression.accept(collector);
        CallEnv result = closure;
        for (WdlExpression access: collector.memberAccesses) {
            Map.Entry<String, LinkedVar> found = trailSearch(env, access);
            if (found != null)
                result = result.plus(found.getKey(), found.getValue());
        }
        for (String name: collector.identifiers) {
            LinkedVar var = env.get(name);
            if (var != null)
                result = result.plus(name, var);
        }
        return result;
    }

    /**
     * Resolve an expression that must denote a bound variable:
     * an identifier or a dotted chain.
     * @throws LoweringException MissingVariableReference if it cannot be resolved.
     */
    public static LinkedVar lookupExact(CallEnv env, WdlExpression expression) {
        if (expression.is(WdlIdentifier.class) || expression.isMemberAccess()) {
            Map.Entry<String, LinkedVar> found = trailSearch(env, expression);
            if (found != null)
                return found.getValue();
        }
        throw new LoweringException(LoweringException.Kind.MissingVariableReference, expression,
                "Reference to undefined variable " + expression.toWdlString());
    }
}

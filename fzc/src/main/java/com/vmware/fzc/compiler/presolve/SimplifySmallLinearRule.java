/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler.presolve;

import com.google.common.collect.ImmutableList;
import com.vmware.fzc.model.ConstraintKind;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.Node;
import com.vmware.fzc.model.Nodes;

/**
 * One- and two-term linear constraints become plain comparisons:
 * {@code int_lin_xx([c], [x], r)} turns into {@code int_xx(x, r / c)} when {@code c} divides {@code r}
 * and is positive, and {@code int_lin_xx([1, -1], [x, y], 0)} turns into {@code int_xx(x, y)}.
 */
final class SimplifySmallLinearRule implements RewriteRule {

    @Override
    public boolean rewrite(final ConstraintSpec ct, final PresolveContext context) {
        final LinearExpression linear = LinearExpression.of(ct);
        if (linear == null) {
            return false;
        }
        final ConstraintKind target = ConstraintKind.valueOf(ct.getKind().name().replace("INT_LIN_", "INT_"));
        if (linear.size() == 1 && linear.terms.get(0).isVarRef()) {
            final long c = linear.coefficients[0];
            if (c == 1 || (c > 0 && linear.rhs % c == 0)) {
                ct.transition(target, withLiteral(linear, linear.terms.get(0), Nodes.literal(linear.rhs / c)));
                return true;
            }
            return false;
        }
        if (linear.size() == 2 && linear.rhs == 0 && linear.terms.get(0).isVarRef()
                && linear.terms.get(1).isVarRef()) {
            final long c0 = linear.coefficients[0];
            final long c1 = linear.coefficients[1];
            if (c0 == 1 && c1 == -1) {
                ct.transition(target, withLiteral(linear, linear.terms.get(0), linear.terms.get(1)));
                return true;
            }
            if (c0 == -1 && c1 == 1) {
                ct.transition(target, withLiteral(linear, linear.terms.get(1), linear.terms.get(0)));
                return true;
            }
        }
        return false;
    }

    private static ImmutableList<Node> withLiteral(final LinearExpression linear, final Node left, final Node right) {
        return linear.literal == null ? ImmutableList.of(left, right) : ImmutableList.of(left, right, linear.literal);
    }
}

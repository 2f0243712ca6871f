/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler.presolve;

import com.google.common.math.LongMath;
import com.vmware.fzc.model.ConstraintKind;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.Domain;
import com.vmware.fzc.model.Node;
import com.vmware.fzc.model.VariableSpec.NarrowResult;

import java.math.RoundingMode;

/**
 * Bound propagation on linear constraints.
 *
 * A single-term {@code int_lin_eq/le/ge} is absorbed into the domain of its variable. For an
 * {@code int_lin_le} whose coefficients are positive and whose variables are non-negative, every variable
 * is bounded above by what the others leave of the right-hand side at their minimum.
 */
final class PositiveLinearBoundsRule implements RewriteRule {

    @Override
    public boolean rewrite(final ConstraintSpec ct, final PresolveContext context) {
        final ConstraintKind kind = ct.getKind();
        if (kind != ConstraintKind.INT_LIN_LE && kind != ConstraintKind.INT_LIN_GE
                && kind != ConstraintKind.INT_LIN_EQ) {
            return false;
        }
        final LinearExpression linear = LinearExpression.of(ct);
        if (linear == null || linear.size() == 0) {
            return false;
        }
        if (linear.size() == 1) {
            return absorbSingleTerm(ct, linear, context);
        }
        if (kind != ConstraintKind.INT_LIN_LE) {
            return false;
        }
        for (int i = 0; i < linear.size(); i++) {
            if (linear.coefficients[i] <= 0 || context.min(linear.terms.get(i)) < 0) {
                return false;
            }
        }
        boolean changed = false;
        for (int i = 0; i < linear.size(); i++) {
            long rest = linear.rhs;
            for (int j = 0; j < linear.size(); j++) {
                if (j != i) {
                    rest = LongMath.saturatedSubtract(rest, LongMath.saturatedMultiply(linear.coefficients[j],
                                                                                 context.min(linear.terms.get(j))));
                }
            }
            final long bound = LongMath.divide(rest, linear.coefficients[i], RoundingMode.FLOOR);
            final NarrowResult result = context.narrow(ct, linear.terms.get(i), Domain.interval(Long.MIN_VALUE, bound));
            if (result == NarrowResult.EMPTY) {
                return true;
            }
            changed |= result == NarrowResult.NARROWED;
        }
        return changed;
    }

    private static boolean absorbSingleTerm(final ConstraintSpec ct, final LinearExpression linear,
                                            final PresolveContext context) {
        final Node x = linear.terms.get(0);
        final long c = linear.coefficients[0];
        if (c == 0) {
            return false;
        }
        final Domain values;
        switch (ct.getKind()) {
            case INT_LIN_EQ:
                values = linear.rhs % c == 0 ? Domain.singleton(linear.rhs / c) : Domain.empty();
                break;
            case INT_LIN_LE:
                values = c > 0 ? Domain.interval(Long.MIN_VALUE, LongMath.divide(linear.rhs, c, RoundingMode.FLOOR))
                               : Domain.interval(LongMath.divide(linear.rhs, c, RoundingMode.CEILING), Long.MAX_VALUE);
                break;
            case INT_LIN_GE:
                values = c > 0 ? Domain.interval(LongMath.divide(linear.rhs, c, RoundingMode.CEILING), Long.MAX_VALUE)
                               : Domain.interval(Long.MIN_VALUE, LongMath.divide(linear.rhs, c, RoundingMode.FLOOR));
                break;
            default:
                return false;
        }
        if (context.narrow(ct, x, values) != NarrowResult.EMPTY) {
            context.nullify(ct);
        }
        return true;
    }
}

/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler.presolve;

import com.google.common.collect.ImmutableList;
import com.google.common.math.LongMath;
import com.vmware.fzc.model.BoolLiteral;
import com.vmware.fzc.model.ConstraintKind;
import com.vmware.fzc.model.ConstraintSpec;

/**
 * Evaluates a linear constraint whose terms are all fixed. A reified one becomes
 * {@code bool_eq(b, result)}.
 */
final class ConstantLinearRule implements RewriteRule {

    @Override
    public boolean rewrite(final ConstraintSpec ct, final PresolveContext context) {
        final LinearExpression linear = LinearExpression.of(ct);
        final Comparison comparison = Comparison.of(ct.getKind());
        if (linear == null || comparison == null) {
            return false;
        }
        long sum = 0;
        for (int i = 0; i < linear.size(); i++) {
            if (!context.isFixed(linear.terms.get(i))) {
                return false;
            }
            sum = LongMath.saturatedAdd(sum, LongMath.saturatedMultiply(linear.coefficients[i],
                                                                        context.value(linear.terms.get(i))));
        }
        final boolean holds = comparison.holds(sum, linear.rhs);
        if (linear.literal != null) {
            ct.transition(ConstraintKind.BOOL_EQ, ImmutableList.of(linear.literal, BoolLiteral.of(holds)));
        } else if (holds) {
            context.nullify(ct);
        } else {
            context.fail(ct);
        }
        return true;
    }
}

/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler.presolve;

import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.Domain;
import com.vmware.fzc.model.VariableSpec.NarrowResult;

/**
 * Decides a reified linear constraint from the bounds of its left-hand side: when the comparison holds
 * for every, or for no, value the sum can take, the literal is fixed and the constraint goes away.
 */
final class LinearReifBoundsRule implements RewriteRule {

    @Override
    public boolean rewrite(final ConstraintSpec ct, final PresolveContext context) {
        if (!ct.getKind().isReified()) {
            return false;
        }
        final LinearExpression linear = LinearExpression.of(ct);
        final Comparison comparison = Comparison.of(ct.getKind());
        if (linear == null || comparison == null || linear.literal == null || context.isFixed(linear.literal)) {
            return false;
        }
        final long[] bounds = linear.bounds(context);
        if (bounds == null) {
            return false;
        }
        final Boolean decided = comparison.decide(bounds[0], bounds[1], linear.rhs);
        if (decided == null) {
            return false;
        }
        if (context.narrow(ct, linear.literal, Domain.singleton(decided ? 1 : 0)) != NarrowResult.EMPTY) {
            context.nullify(ct);
        }
        return true;
    }
}

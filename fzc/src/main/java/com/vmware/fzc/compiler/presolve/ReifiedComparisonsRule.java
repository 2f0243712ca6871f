/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler.presolve;

import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.Domain;
import com.vmware.fzc.model.Node;
import com.vmware.fzc.model.VariableSpec.NarrowResult;

/**
 * Decides {@code int_xx_reif(a, b, r)} and {@code bool_le/lt_reif} from the domains of {@code a} and
 * {@code b}, fixing {@code r} when the comparison is entailed or disentailed.
 */
final class ReifiedComparisonsRule implements RewriteRule {

    @Override
    public boolean rewrite(final ConstraintSpec ct, final PresolveContext context) {
        switch (ct.getKind()) {
            case INT_EQ_REIF:
            case INT_NE_REIF:
            case INT_LE_REIF:
            case INT_LT_REIF:
            case INT_GE_REIF:
            case INT_GT_REIF:
            case BOOL_LE_REIF:
            case BOOL_LT_REIF:
                break;
            default:
                return false;
        }
        final Comparison comparison = Comparison.of(ct.getKind());
        if (comparison == null || ct.arity() != 3 || context.isFixed(ct.arg(2))) {
            return false;
        }
        final Node a = ct.arg(0);
        final Node b = ct.arg(1);
        final Domain da = context.domain(a);
        final Domain db = context.domain(b);
        Boolean decided = null;
        if ((comparison == Comparison.EQ || comparison == Comparison.NE) && !da.intersects(db)) {
            decided = comparison == Comparison.NE;
        } else if (da.isBounded() && db.isBounded()) {
            decided = comparison.decide(da.min() - db.max(), da.max() - db.min(), 0);
        }
        if (decided == null) {
            return false;
        }
        if (context.narrow(ct, ct.arg(2), Domain.singleton(decided ? 1 : 0)) != NarrowResult.EMPTY) {
            context.nullify(ct);
        }
        return true;
    }
}

/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler.presolve;

import com.vmware.fzc.model.ConstraintKind;
import com.vmware.fzc.model.ConstraintSpec;

/**
 * {@code int_lin_lt(c, x, r)} becomes {@code int_lin_le(c, x, r - 1)} and {@code int_lin_gt(c, x, r)}
 * becomes {@code int_lin_ge(c, x, r + 1)}, reified or not. A right-hand side at the end of the long range
 * is left alone.
 */
final class StrictLinearRule implements RewriteRule {

    @Override
    public boolean rewrite(final ConstraintSpec ct, final PresolveContext context) {
        final ConstraintKind target;
        final long shift;
        switch (ct.getKind()) {
            case INT_LIN_LT:
                target = ConstraintKind.INT_LIN_LE;
                shift = -1;
                break;
            case INT_LIN_LT_REIF:
                target = ConstraintKind.INT_LIN_LE_REIF;
                shift = -1;
                break;
            case INT_LIN_GT:
                target = ConstraintKind.INT_LIN_GE;
                shift = 1;
                break;
            case INT_LIN_GT_REIF:
                target = ConstraintKind.INT_LIN_GE_REIF;
                shift = 1;
                break;
            default:
                return false;
        }
        final LinearExpression linear = LinearExpression.of(ct);
        if (linear == null || linear.rhs == (shift < 0 ? Long.MIN_VALUE : Long.MAX_VALUE)) {
            return false;
        }
        ct.transition(target, linear.withRhs(linear.rhs + shift).toArgs());
        return true;
    }
}

/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler.presolve;

import com.vmware.fzc.model.ConstraintKind;
import com.vmware.fzc.model.ConstraintSpec;

/**
 * Multiplies a linear constraint with no positive coefficient by -1, so that every linear constraint has at
 * least one positive coefficient. {@code int_lin_le} turns into {@code int_lin_ge} in the process.
 * Constraints that define one of their variables keep their orientation.
 */
final class LinearOrientationRule implements RewriteRule {

    @Override
    public boolean rewrite(final ConstraintSpec ct, final PresolveContext context) {
        final ConstraintKind target;
        switch (ct.getKind()) {
            case INT_LIN_LE:
                target = ConstraintKind.INT_LIN_GE;
                break;
            case INT_LIN_LE_REIF:
                target = ConstraintKind.INT_LIN_GE_REIF;
                break;
            case INT_LIN_EQ:
            case INT_LIN_NE:
            case INT_LIN_EQ_REIF:
            case INT_LIN_NE_REIF:
                target = ct.getKind();
                break;
            default:
                return false;
        }
        final LinearExpression linear = LinearExpression.of(ct);
        if (linear == null || ct.definesVar() != null || linear.hasPositiveCoefficient()
                || !linear.hasNegativeCoefficient()) {
            return false;
        }
        final LinearExpression negated = linear.negate();
        if (negated == null) {
            return false;
        }
        ct.transition(target, negated.toArgs());
        return true;
    }
}

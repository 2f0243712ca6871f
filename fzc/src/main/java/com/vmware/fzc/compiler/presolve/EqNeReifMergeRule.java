/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler.presolve;

import com.google.common.collect.ImmutableList;
import com.vmware.fzc.model.BoolVarRef;
import com.vmware.fzc.model.ConstraintKind;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.IntLiteral;
import com.vmware.fzc.model.VarRef;

/**
 * Two reified tests of the same variable against the same value share their literal:
 * a repeated {@code int_eq_reif(x, c, b2)} becomes {@code bool_eq(b1, b2)} and an
 * {@code int_ne_reif(x, c, b2)} after {@code int_eq_reif(x, c, b1)} becomes {@code bool_not(b1, b2)}.
 * The first test of each pair is kept.
 */
final class EqNeReifMergeRule implements RewriteRule {

    @Override
    public boolean rewrite(final ConstraintSpec ct, final PresolveContext context) {
        final boolean equality = ct.getKind() == ConstraintKind.INT_EQ_REIF;
        if ((!equality && ct.getKind() != ConstraintKind.INT_NE_REIF) || ct.arity() != 3
                || !ct.arg(0).isVarRef() || !(ct.arg(1) instanceof IntLiteral) || !(ct.arg(2) instanceof BoolVarRef)
                || context.isFixed(ct.arg(2))) {
            return false;
        }
        final VarRef x = (VarRef) ct.arg(0);
        final long value = ((IntLiteral) ct.arg(1)).getValue();
        final VarRef b = (VarRef) ct.arg(2);
        final VarRef sameTest = equality ? context.eqReif(x, value) : context.neReif(x, value);
        if (sameTest != null && !sameTest.equals(b)) {
            ct.transition(ConstraintKind.BOOL_EQ, ImmutableList.of(sameTest, b));
            return true;
        }
        final VarRef oppositeTest = equality ? context.neReif(x, value) : context.eqReif(x, value);
        if (oppositeTest != null && !oppositeTest.equals(b)) {
            ct.transition(ConstraintKind.BOOL_NOT, ImmutableList.of(oppositeTest, b));
            return true;
        }
        if (equality) {
            context.recordEqReif(x, value, b);
        } else {
            context.recordNeReif(x, value, b);
        }
        return false;
    }
}

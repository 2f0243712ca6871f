/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler.presolve;

import com.google.common.collect.ImmutableList;
import com.vmware.fzc.model.ConstraintKind;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.Domain;
import com.vmware.fzc.model.IntLiteral;
import com.vmware.fzc.model.Node;
import com.vmware.fzc.model.Nodes;
import com.vmware.fzc.model.VarRef;
import com.vmware.fzc.model.VariableSpec.NarrowResult;

/**
 * Absolute values. {@code int_abs(x, y)} bounds {@code y}; tests of {@code y} against zero are moved onto
 * {@code x}, and {@code int_le_reif(y, c, b)} becomes a membership test of {@code x} in {@code -c..c}.
 */
final class AbsRule implements RewriteRule {

    @Override
    public boolean rewrite(final ConstraintSpec ct, final PresolveContext context) {
        switch (ct.getKind()) {
            case INT_ABS:
                return propagate(ct, context);
            case INT_EQ_REIF:
            case INT_NE_REIF:
            case INT_LE_REIF:
                return substitute(ct, context);
            default:
                return false;
        }
    }

    private static boolean propagate(final ConstraintSpec ct, final PresolveContext context) {
        if (ct.arity() != 2) {
            return false;
        }
        final Node x = ct.arg(0);
        final Node y = ct.arg(1);
        if (context.isFixed(x)) {
            if (context.narrow(ct, y, Domain.singleton(Math.abs(context.value(x)))) != NarrowResult.EMPTY) {
                context.nullify(ct);
            }
            return true;
        }
        Domain bound = Domain.interval(0, Long.MAX_VALUE);
        if (context.isBounded(x)) {
            bound = bound.intersectInterval(0, Math.max(Math.abs(context.min(x)), Math.abs(context.max(x))));
        }
        return context.narrow(ct, y, bound) != NarrowResult.UNCHANGED;
    }

    private static boolean substitute(final ConstraintSpec ct, final PresolveContext context) {
        if (ct.arity() != 3 || !ct.arg(0).isVarRef() || !(ct.arg(1) instanceof IntLiteral)) {
            return false;
        }
        final VarRef x = context.absArgument((VarRef) ct.arg(0));
        if (x == null) {
            return false;
        }
        final long c = ((IntLiteral) ct.arg(1)).getValue();
        final Node b = ct.arg(2);
        if (ct.getKind() != ConstraintKind.INT_LE_REIF) {
            if (c != 0) {
                return false;
            }
            ct.transition(ct.getKind(), ImmutableList.of(x, Nodes.literal(0), b));
            return true;
        }
        if (c < 0) {
            return false;
        }
        if (c == 0) {
            ct.transition(ConstraintKind.INT_EQ_REIF, ImmutableList.of(x, Nodes.literal(0), b));
        } else {
            ct.transition(ConstraintKind.SET_IN_REIF, ImmutableList.of(x, Nodes.set(-c, c), b));
        }
        return true;
    }
}

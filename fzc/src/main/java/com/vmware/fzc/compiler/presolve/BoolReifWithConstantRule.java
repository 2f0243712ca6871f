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
import com.vmware.fzc.model.Node;
import com.vmware.fzc.model.VariableSpec.NarrowResult;

/**
 * {@code bool_eq_reif(a, b, r)} and {@code bool_ne_reif(a, b, r)} with one constant operand become
 * {@code bool_eq} or {@code bool_not} between the other operand and {@code r}.
 */
final class BoolReifWithConstantRule implements RewriteRule {

    @Override
    public boolean rewrite(final ConstraintSpec ct, final PresolveContext context) {
        final ConstraintKind kind = ct.getKind();
        if ((kind != ConstraintKind.BOOL_EQ_REIF && kind != ConstraintKind.BOOL_NE_REIF) || ct.arity() != 3) {
            return false;
        }
        final Node a = ct.arg(0);
        final Node b = ct.arg(1);
        final Node r = ct.arg(2);
        if (context.isFixed(r) || (!context.isFixed(a) && !context.isFixed(b))) {
            return false;
        }
        final boolean equality = kind == ConstraintKind.BOOL_EQ_REIF;
        if (context.isFixed(a) && context.isFixed(b)) {
            final boolean holds = (context.value(a) == context.value(b)) == equality;
            if (context.narrow(ct, r, Domain.singleton(holds ? 1 : 0)) != NarrowResult.EMPTY) {
                context.nullify(ct);
            }
            return true;
        }
        final Node other = context.isFixed(a) ? b : a;
        final boolean constant = context.value(context.isFixed(a) ? a : b) != 0;
        // r <-> (other == constant) is r == other when constant is true, r != other otherwise
        final boolean same = constant == equality;
        ct.transition(same ? ConstraintKind.BOOL_EQ : ConstraintKind.BOOL_NOT, ImmutableList.of(other, r));
        return true;
    }
}

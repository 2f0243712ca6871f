/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler.presolve;

import com.vmware.fzc.model.ConstraintKind;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.Domain;
import com.vmware.fzc.model.Node;
import com.vmware.fzc.model.VariableSpec.NarrowResult;

/**
 * {@code bool2int(b, i)}: {@code i} is a 0/1 variable, and once either side is fixed so is the other.
 */
final class Bool2IntRule implements RewriteRule {

    @Override
    public boolean rewrite(final ConstraintSpec ct, final PresolveContext context) {
        if (ct.getKind() != ConstraintKind.BOOL2INT || ct.arity() != 2) {
            return false;
        }
        final Node b = ct.arg(0);
        final Node i = ct.arg(1);
        if (context.isFixed(b) || context.isFixed(i)) {
            final Node fixed = context.isFixed(b) ? b : i;
            final Node other = fixed == b ? i : b;
            if (context.narrow(ct, other, Domain.singleton(context.value(fixed))) != NarrowResult.EMPTY) {
                context.nullify(ct);
            }
            return true;
        }
        return context.narrow(ct, i, Domain.booleans()) != NarrowResult.UNCHANGED;
    }
}

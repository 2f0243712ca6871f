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
 * {@code int_ne} and {@code bool_not} against a constant remove the constant from the other side.
 */
final class IntNeRule implements RewriteRule {

    @Override
    public boolean rewrite(final ConstraintSpec ct, final PresolveContext context) {
        final boolean isBool = ct.getKind() == ConstraintKind.BOOL_NOT;
        if ((!isBool && ct.getKind() != ConstraintKind.INT_NE) || ct.arity() != 2) {
            return false;
        }
        final Node a = ct.arg(0);
        final Node b = ct.arg(1);
        if (a.equals(b)) {
            context.fail(ct);
            return true;
        }
        if (context.isFixed(a) && context.isFixed(b)) {
            if (context.value(a) != context.value(b)) {
                context.nullify(ct);
            } else {
                context.fail(ct);
            }
            return true;
        }
        if (!context.isFixed(a) && !context.isFixed(b)) {
            return false;
        }
        final Node variable = context.isFixed(b) ? a : b;
        final long value = context.value(context.isFixed(b) ? b : a);
        final Domain remaining = isBool ? Domain.singleton(1 - value) : context.domain(variable).removeValue(value);
        if (context.narrow(ct, variable, remaining) != NarrowResult.EMPTY) {
            context.nullify(ct);
        }
        return true;
    }
}

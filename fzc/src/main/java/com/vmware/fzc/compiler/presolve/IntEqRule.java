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
import com.vmware.fzc.model.VarRef;
import com.vmware.fzc.model.VariableSpec.NarrowResult;

/**
 * {@code int_eq} and {@code bool_eq}. Against a constant the variable is fixed; between two variables the
 * constraint becomes an alias, unless it was designated to define one of them, in which case only the
 * domains are intersected.
 */
final class IntEqRule implements RewriteRule {

    @Override
    public boolean rewrite(final ConstraintSpec ct, final PresolveContext context) {
        if ((ct.getKind() != ConstraintKind.INT_EQ && ct.getKind() != ConstraintKind.BOOL_EQ) || ct.arity() != 2) {
            return false;
        }
        final Node a = ct.arg(0);
        final Node b = ct.arg(1);
        if (a.equals(b)) {
            context.nullify(ct);
            return true;
        }
        if (context.isFixed(a) && context.isFixed(b)) {
            if (context.value(a) == context.value(b)) {
                context.nullify(ct);
            } else {
                context.fail(ct);
            }
            return true;
        }
        if (context.isFixed(b) || context.isFixed(a)) {
            final Node variable = context.isFixed(b) ? a : b;
            final Node constant = context.isFixed(b) ? b : a;
            if (context.narrow(ct, variable, Domain.singleton(context.value(constant))) != NarrowResult.EMPTY) {
                context.nullify(ct);
            }
            return true;
        }
        if (!a.isVarRef() || !b.isVarRef() || ((VarRef) a).getKind() != ((VarRef) b).getKind()) {
            return false;
        }
        final VarRef x = (VarRef) a;
        final VarRef y = (VarRef) b;
        if (ct.definesVar() != null) {
            final Domain common = context.domain(x).intersect(context.domain(y));
            final NarrowResult left = context.narrow(ct, x, common);
            if (left == NarrowResult.EMPTY) {
                return true;
            }
            return context.narrow(ct, y, common) != NarrowResult.UNCHANGED || left == NarrowResult.NARROWED;
        }
        context.nullify(ct);
        if (context.spec(x).isIntroduced() && !context.spec(y).isIntroduced()) {
            context.requestAlias(x, y);
        } else {
            context.requestAlias(y, x);
        }
        return true;
    }
}

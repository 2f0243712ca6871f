/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler.presolve;

import com.vmware.fzc.model.ConstraintKind;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.Node;
import com.vmware.fzc.model.SetLiteral;
import com.vmware.fzc.model.VariableSpec.NarrowResult;

import java.util.List;

/**
 * A reified constraint whose literal is known becomes its plain form when the literal is true and the
 * negated plain form when it is false.
 */
final class UnreifyRule implements RewriteRule {

    @Override
    public boolean rewrite(final ConstraintSpec ct, final PresolveContext context) {
        final ConstraintKind kind = ct.getKind();
        if (!kind.isReified() || ct.arity() == 0) {
            return false;
        }
        final Node literal = ct.arg(ct.arity() - 1);
        if (!context.isFixed(literal)) {
            return false;
        }
        final List<Node> args = ct.getArgs().subList(0, ct.arity() - 1);
        final boolean holds = context.value(literal) != 0;
        if (holds) {
            ct.transition(kind.unreified(), args);
            return true;
        }
        final ConstraintKind negated = kind.negated();
        if (negated != null) {
            ct.transition(negated, args);
            return true;
        }
        if (kind == ConstraintKind.SET_IN_REIF && args.get(1) instanceof SetLiteral) {
            final Node x = args.get(0);
            final SetLiteral excluded = (SetLiteral) args.get(1);
            if (context.narrow(ct, x, context.domain(x).difference(excluded.getValues())) != NarrowResult.EMPTY) {
                context.nullify(ct);
            }
            return true;
        }
        return false;
    }
}

/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler.presolve;

import com.vmware.fzc.model.ArrayNode;
import com.vmware.fzc.model.ConstraintKind;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.Domain;
import com.vmware.fzc.model.Node;
import com.vmware.fzc.model.VariableSpec.NarrowResult;

/**
 * {@code array_bool_and(as, r)} and {@code array_bool_or(as, r)}: a fixed result that forces every operand
 * fixes them, and a single operand (or all of them) that decides the result fixes it.
 */
final class BoolArrayRule implements RewriteRule {

    @Override
    public boolean rewrite(final ConstraintSpec ct, final PresolveContext context) {
        final boolean conjunction = ct.getKind() == ConstraintKind.ARRAY_BOOL_AND;
        if ((!conjunction && ct.getKind() != ConstraintKind.ARRAY_BOOL_OR) || ct.arity() != 2
                || !(ct.arg(0) instanceof ArrayNode)) {
            return false;
        }
        final ArrayNode operands = (ArrayNode) ct.arg(0);
        final Node result = ct.arg(1);
        // the operand value that decides the result on its own: false for a conjunction, true for a disjunction
        final long decisive = conjunction ? 0 : 1;
        if (context.isFixed(result) && context.value(result) != decisive) {
            for (final Node operand: operands.getElements()) {
                if (context.narrow(ct, operand, Domain.singleton(1 - decisive)) == NarrowResult.EMPTY) {
                    return true;
                }
            }
            context.nullify(ct);
            return true;
        }
        boolean allFixed = true;
        for (final Node operand: operands.getElements()) {
            if (!context.isFixed(operand)) {
                allFixed = false;
            } else if (context.value(operand) == decisive) {
                return fixResult(ct, result, decisive, context);
            }
        }
        if (allFixed) {
            return fixResult(ct, result, 1 - decisive, context);
        }
        return false;
    }

    private static boolean fixResult(final ConstraintSpec ct, final Node result, final long value,
                                     final PresolveContext context) {
        if (context.narrow(ct, result, Domain.singleton(value)) != NarrowResult.EMPTY) {
            context.nullify(ct);
        }
        return true;
    }
}

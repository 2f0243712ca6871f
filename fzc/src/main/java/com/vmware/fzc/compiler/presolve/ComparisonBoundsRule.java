/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler.presolve;

import com.google.common.math.LongMath;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.Domain;
import com.vmware.fzc.model.Node;
import com.vmware.fzc.model.VariableSpec.NarrowResult;

/**
 * Bound propagation for {@code int_/bool_ le, lt, ge, gt}. A comparison against a constant is absorbed
 * into the variable's domain; one between two variables narrows both and disappears once entailed.
 */
final class ComparisonBoundsRule implements RewriteRule {

    @Override
    public boolean rewrite(final ConstraintSpec ct, final PresolveContext context) {
        final Node left;
        final Node right;
        final boolean strict;
        switch (ct.getKind()) {
            case INT_LE:
            case BOOL_LE:
                left = ct.arg(0);
                right = ct.arg(1);
                strict = false;
                break;
            case INT_LT:
            case BOOL_LT:
                left = ct.arg(0);
                right = ct.arg(1);
                strict = true;
                break;
            case INT_GE:
            case BOOL_GE:
                left = ct.arg(1);
                right = ct.arg(0);
                strict = false;
                break;
            case INT_GT:
            case BOOL_GT:
                left = ct.arg(1);
                right = ct.arg(0);
                strict = true;
                break;
            default:
                return false;
        }
        final long offset = strict ? 1 : 0;
        if (left.equals(right)) {
            if (strict) {
                context.fail(ct);
            } else {
                context.nullify(ct);
            }
            return true;
        }
        if (context.isFixed(left) && context.isFixed(right)) {
            if (context.value(left) + offset <= context.value(right)) {
                context.nullify(ct);
            } else {
                context.fail(ct);
            }
            return true;
        }
        if (context.isFixed(right)) {
            final long bound = LongMath.saturatedSubtract(context.value(right), offset);
            if (context.narrow(ct, left, Domain.interval(Long.MIN_VALUE, bound)) != NarrowResult.EMPTY) {
                context.nullify(ct);
            }
            return true;
        }
        if (context.isFixed(left)) {
            final long bound = LongMath.saturatedAdd(context.value(left), offset);
            if (context.narrow(ct, right, Domain.interval(bound, Long.MAX_VALUE)) != NarrowResult.EMPTY) {
                context.nullify(ct);
            }
            return true;
        }
        boolean changed = false;
        final long maxRight = context.max(right);
        if (maxRight != Long.MAX_VALUE) {
            final NarrowResult result = context.narrow(ct, left, Domain.interval(Long.MIN_VALUE,
                                                                                 maxRight - offset));
            if (result == NarrowResult.EMPTY) {
                return true;
            }
            changed = result == NarrowResult.NARROWED;
        }
        final long minLeft = context.min(left);
        if (minLeft != Long.MIN_VALUE) {
            final NarrowResult result = context.narrow(ct, right, Domain.interval(minLeft + offset,
                                                                                  Long.MAX_VALUE));
            if (result == NarrowResult.EMPTY) {
                return true;
            }
            changed |= result == NarrowResult.NARROWED;
        }
        final long maxLeft = context.max(left);
        final long minRight = context.min(right);
        if (maxLeft != Long.MAX_VALUE && minRight != Long.MIN_VALUE && maxLeft + offset <= minRight) {
            context.nullify(ct);
            changed = true;
        }
        return changed;
    }
}

/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler.presolve;

import com.vmware.fzc.model.ConstraintKind;

import javax.annotation.Nullable;

/**
 * The relational operator behind a comparison, linear or reified constraint kind.
 */
enum Comparison {
    EQ,
    NE,
    LE,
    LT,
    GE,
    GT;

    @Nullable
    static Comparison of(final ConstraintKind kind) {
        final String name = kind.name();
        for (final Comparison comparison: values()) {
            final String suffix = "_" + comparison.name();
            if (name.endsWith(suffix) || name.endsWith(suffix + "_REIF")) {
                return comparison;
            }
        }
        return null;
    }

    boolean holds(final long left, final long right) {
        switch (this) {
            case EQ:
                return left == right;
            case NE:
                return left != right;
            case LE:
                return left <= right;
            case LT:
                return left < right;
            case GE:
                return left >= right;
            case GT:
                return left > right;
            default:
                throw new IllegalStateException("Unknown comparison " + this);
        }
    }

    /**
     * Decides {@code value OP rhs} for every value in {@code [lo, hi]}: TRUE when it holds for all of
     * them, FALSE when it holds for none, null otherwise.
     */
    @Nullable
    Boolean decide(final long lo, final long hi, final long rhs) {
        switch (this) {
            case EQ:
                return lo == hi && lo == rhs ? Boolean.TRUE : (rhs < lo || rhs > hi ? Boolean.FALSE : null);
            case NE:
                final Boolean eq = EQ.decide(lo, hi, rhs);
                return eq == null ? null : !eq;
            case LE:
                return hi <= rhs ? Boolean.TRUE : (lo > rhs ? Boolean.FALSE : null);
            case LT:
                return hi < rhs ? Boolean.TRUE : (lo >= rhs ? Boolean.FALSE : null);
            case GE:
                return lo >= rhs ? Boolean.TRUE : (hi < rhs ? Boolean.FALSE : null);
            case GT:
                return lo > rhs ? Boolean.TRUE : (hi <= rhs ? Boolean.FALSE : null);
            default:
                throw new IllegalStateException("Unknown comparison " + this);
        }
    }
}

/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler.presolve;

import com.google.common.collect.ImmutableList;
import com.google.common.math.LongMath;
import com.vmware.fzc.model.ArrayNode;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.IntLiteral;
import com.vmware.fzc.model.Node;
import com.vmware.fzc.model.Nodes;

import java.util.List;

import javax.annotation.Nullable;

/**
 * The arguments of an {@code int_lin_*} constraint: {@code sum(coefficients[i] * terms[i]) OP rhs},
 * followed by the reification literal for reified kinds.
 */
final class LinearExpression {
    final long[] coefficients;
    final List<Node> terms;
    final long rhs;
    @Nullable final Node literal;

    LinearExpression(final long[] coefficients, final List<Node> terms, final long rhs,
                     @Nullable final Node literal) {
        this.coefficients = coefficients;
        this.terms = ImmutableList.copyOf(terms);
        this.rhs = rhs;
        this.literal = literal;
    }

    /**
     * Reads the arguments of a linear constraint, or returns null when they do not have the expected
     * shape.
     */
    @Nullable
    static LinearExpression of(final ConstraintSpec ct) {
        if (!ct.getKind().isLinear()) {
            return null;
        }
        final int expectedArity = ct.getKind().isReified() ? 4 : 3;
        if (ct.arity() != expectedArity || !Nodes.isIntArray(ct.arg(0)) || !(ct.arg(1) instanceof ArrayNode)
                || !(ct.arg(2) instanceof IntLiteral)) {
            return null;
        }
        final long[] coefficients = Nodes.intValues(ct.arg(0));
        final List<Node> terms = ((ArrayNode) ct.arg(1)).getElements();
        if (coefficients.length != terms.size()) {
            return null;
        }
        final Node literal = expectedArity == 4 ? ct.arg(3) : null;
        return new LinearExpression(coefficients, terms, ((IntLiteral) ct.arg(2)).getValue(), literal);
    }

    int size() {
        return coefficients.length;
    }

    LinearExpression withRhs(final long newRhs) {
        return new LinearExpression(coefficients, terms, newRhs, literal);
    }

    /**
     * Multiplies both sides by -1, or returns null if a coefficient or the right-hand side is
     * {@code Long.MIN_VALUE}.
     */
    @Nullable
    LinearExpression negate() {
        if (rhs == Long.MIN_VALUE) {
            return null;
        }
        final long[] negated = new long[coefficients.length];
        for (int i = 0; i < negated.length; i++) {
            if (coefficients[i] == Long.MIN_VALUE) {
                return null;
            }
            negated[i] = -coefficients[i];
        }
        return new LinearExpression(negated, terms, -rhs, literal);
    }

    boolean hasPositiveCoefficient() {
        for (final long c: coefficients) {
            if (c > 0) {
                return true;
            }
        }
        return false;
    }

    boolean hasNegativeCoefficient() {
        for (final long c: coefficients) {
            if (c < 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Smallest and largest value the left-hand side can take, saturated at the long range, or null if
     * any term is unbounded.
     */
    @Nullable
    long[] bounds(final PresolveContext context) {
        long lo = 0;
        long hi = 0;
        for (int i = 0; i < coefficients.length; i++) {
            final Node term = terms.get(i);
            final long min = context.min(term);
            final long max = context.max(term);
            if (min == Long.MIN_VALUE || max == Long.MAX_VALUE) {
                return null;
            }
            final long c = coefficients[i];
            final long a = LongMath.saturatedMultiply(c, min);
            final long b = LongMath.saturatedMultiply(c, max);
            lo = LongMath.saturatedAdd(lo, Math.min(a, b));
            hi = LongMath.saturatedAdd(hi, Math.max(a, b));
        }
        return new long[]{lo, hi};
    }

    List<Node> toArgs() {
        final ImmutableList.Builder<Node> args = ImmutableList.builder();
        args.add(Nodes.ints(coefficients), new ArrayNode(terms), Nodes.literal(rhs));
        if (literal != null) {
            args.add(literal);
        }
        return args.build();
    }
}

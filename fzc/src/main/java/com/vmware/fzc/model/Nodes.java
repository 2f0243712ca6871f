/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.model;

import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.List;

import javax.annotation.Nullable;

/**
 * Factories and accessors for the argument shapes that recur in constraints.
 */
public final class Nodes {
    public static final String DEFINES_VAR = "defines_var";

    private Nodes() {
    }

    public static IntLiteral literal(final long value) {
        return new IntLiteral(value);
    }

    public static ArrayNode array(final Node... elements) {
        return new ArrayNode(Arrays.asList(elements));
    }

    public static ArrayNode array(final List<? extends Node> elements) {
        return new ArrayNode(elements);
    }

    public static ArrayNode ints(final long... values) {
        final ImmutableList.Builder<Node> builder = ImmutableList.builder();
        for (final long value: values) {
            builder.add(new IntLiteral(value));
        }
        return new ArrayNode(builder.build());
    }

    public static SetLiteral set(final long lo, final long hi) {
        return new SetLiteral(Domain.interval(lo, hi));
    }

    public static CallNode definesVar(final VarRef var) {
        return new CallNode(DEFINES_VAR, ImmutableList.of(var));
    }

    /**
     * Returns the variable named by a {@code defines_var(x)} annotation, or null for any other node.
     */
    @Nullable
    public static VarRef definesVarTarget(final Node annotation) {
        if (annotation instanceof CallNode) {
            final CallNode call = (CallNode) annotation;
            if (call.getName().equals(DEFINES_VAR) && call.getArguments().size() == 1
                    && call.getArguments().get(0).isVarRef()) {
                return (VarRef) call.getArguments().get(0);
            }
        }
        return null;
    }

    public static boolean isIntLiteral(final Node node) {
        return node instanceof IntLiteral;
    }

    /**
     * Values of an array of integer literals.
     */
    public static long[] intValues(final Node node) {
        final ArrayNode array = (ArrayNode) node;
        final long[] values = new long[array.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = ((IntLiteral) array.get(i)).getValue();
        }
        return values;
    }

    public static boolean isIntArray(final Node node) {
        return node instanceof ArrayNode
                && ((ArrayNode) node).getElements().stream().allMatch(Nodes::isIntLiteral);
    }
}

/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.model;

import com.google.common.collect.ImmutableList;
import com.vmware.fzc.ModelException;

import java.util.EnumMap;
import java.util.Map;

/**
 * The one interned {@link VarRef} per declared variable. Every pass that needs to put a variable in a
 * set or map, or to compare two variables, obtains the reference from here rather than constructing one.
 *
 * Built once from the variable tables before the first pass runs and never modified afterwards.
 */
public final class CanonicalReferences {
    private final Map<VarKind, ImmutableList<VarRef>> refs;

    private CanonicalReferences(final Map<VarKind, ImmutableList<VarRef>> refs) {
        this.refs = refs;
    }

    public static CanonicalReferences of(final FlatModel model) {
        final Map<VarKind, ImmutableList<VarRef>> refs = new EnumMap<>(VarKind.class);
        for (final VarKind kind: VarKind.values()) {
            final ImmutableList.Builder<VarRef> builder = ImmutableList.builder();
            for (final VariableSpec spec: model.variables(kind)) {
                builder.add(spec.getRef());
            }
            refs.put(kind, builder.build());
        }
        return new CanonicalReferences(refs);
    }

    public VarRef canonical(final VarKind kind, final int index) {
        final ImmutableList<VarRef> table = refs.get(kind);
        if (index < 0 || index >= table.size()) {
            throw ModelException.invariant("canonical-references",
                                           "no " + kind.name().toLowerCase() + " variable declared at", index);
        }
        return table.get(index);
    }

    /**
     * Returns the interned instance equal to {@code ref}, failing if the reference points outside the
     * declared variables.
     */
    public VarRef canonical(final VarRef ref) {
        return canonical(ref.getKind(), ref.getIndex());
    }

    public int size(final VarKind kind) {
        return refs.get(kind).size();
    }
}

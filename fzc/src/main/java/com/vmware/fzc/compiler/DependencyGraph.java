/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.vmware.fzc.model.VarRef;

import java.util.Map;
import java.util.Set;

/**
 * Result of {@link DependencyGraphBuilder}: the variables some constraint defines, which constraint
 * defines each of them, and the per-variable constraint index. The {@code requires} edges live on the
 * constraints themselves.
 */
public final class DependencyGraph {
    private final ImmutableSet<VarRef> candidates;
    private final ImmutableMap<VarRef, Integer> definers;
    private final VariableOccurrences occurrences;

    DependencyGraph(final Set<VarRef> candidates, final Map<VarRef, Integer> definers,
                    final VariableOccurrences occurrences) {
        this.candidates = ImmutableSet.copyOf(candidates);
        this.definers = ImmutableMap.copyOf(definers);
        this.occurrences = occurrences;
    }

    public Set<VarRef> candidates() {
        return candidates;
    }

    /**
     * Index of the constraint that defines each candidate.
     */
    public Map<VarRef, Integer> definers() {
        return definers;
    }

    public VariableOccurrences occurrences() {
        return occurrences;
    }
}

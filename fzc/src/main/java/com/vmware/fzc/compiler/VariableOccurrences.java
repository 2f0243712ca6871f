/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.FlatModel;
import com.vmware.fzc.model.VarRef;

import java.util.Set;

/**
 * For each variable, the indices of the active constraints whose arguments reference it, and whether the
 * solve goal references it. A snapshot: it is not updated as constraints change.
 */
public final class VariableOccurrences {
    private final ImmutableSetMultimap<VarRef, Integer> constraintsByVariable;
    private final ImmutableSet<VarRef> goalVariables;

    private VariableOccurrences(final ImmutableSetMultimap<VarRef, Integer> constraintsByVariable,
                                final ImmutableSet<VarRef> goalVariables) {
        this.constraintsByVariable = constraintsByVariable;
        this.goalVariables = goalVariables;
    }

    public static VariableOccurrences of(final FlatModel model) {
        final ImmutableSetMultimap.Builder<VarRef, Integer> builder = ImmutableSetMultimap.builder();
        for (final ConstraintSpec ct: model.constraints()) {
            if (ct.isActive()) {
                for (final VarRef var: ct.variables()) {
                    builder.put(var, ct.getIndex());
                }
            }
        }
        return new VariableOccurrences(builder.build(), ImmutableSet.copyOf(model.getGoal().variables()));
    }

    public Set<Integer> constraintsOf(final VarRef var) {
        return constraintsByVariable.get(var);
    }

    public int count(final VarRef var) {
        return constraintsByVariable.get(var).size();
    }

    public boolean inGoal(final VarRef var) {
        return goalVariables.contains(var);
    }

    /**
     * Whether any active constraint or the goal references the variable.
     */
    public boolean isReferenced(final VarRef var) {
        return constraintsByVariable.containsKey(var) || goalVariables.contains(var);
    }
}

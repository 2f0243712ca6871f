/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.model;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A flat constraint model: the variables of each kind, the constraints and the solve goal.
 *
 * This is what a FlatZinc parser produces and what the compiler rewrites in place. A model is owned
 * by a single compilation at a time.
 */
public final class FlatModel {
    private final Map<VarKind, VariableTable> variables = new EnumMap<>(VarKind.class);
    private final ConstraintTable constraints = new ConstraintTable();
    private SolveGoal goal = SolveGoal.satisfy();

    public FlatModel() {
        for (final VarKind kind: VarKind.values()) {
            variables.put(kind, new VariableTable(kind));
        }
    }

    public IntVarRef newIntVar(final String name) {
        return (IntVarRef) addVariable(VariableSpec.builder(VarKind.INT, name));
    }

    public IntVarRef newIntVar(final String name, final long lo, final long hi) {
        return newIntVar(name, Domain.interval(lo, hi));
    }

    public IntVarRef newIntVar(final String name, final Domain domain) {
        return (IntVarRef) addVariable(VariableSpec.builder(VarKind.INT, name).setDomain(domain));
    }

    public BoolVarRef newBoolVar(final String name) {
        return (BoolVarRef) addVariable(VariableSpec.builder(VarKind.BOOL, name));
    }

    /**
     * Declares a set variable whose elements are drawn from {@code universe}.
     */
    public SetVarRef newSetVar(final String name, final Domain universe) {
        return (SetVarRef) addVariable(VariableSpec.builder(VarKind.SET, name).setDomain(universe));
    }

    public VarRef addVariable(final VariableSpec.Builder builder) {
        return variables.get(builder.getKind()).add(builder).getRef();
    }

    @CanIgnoreReturnValue
    public ConstraintSpec addConstraint(final String name, final Node... args) {
        return addConstraint(name, Arrays.asList(args), ImmutableList.of());
    }

    @CanIgnoreReturnValue
    public ConstraintSpec addConstraint(final String name, final List<Node> args, final List<Node> annotations) {
        return constraints.add(name, args, annotations);
    }

    public VariableTable variables(final VarKind kind) {
        return variables.get(kind);
    }

    public VariableSpec variable(final VarRef ref) {
        return variables.get(ref.getKind()).get(ref.getIndex());
    }

    public ConstraintTable constraints() {
        return constraints;
    }

    public SolveGoal getGoal() {
        return goal;
    }

    public void setGoal(final SolveGoal goal) {
        this.goal = goal;
    }
}

/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.vmware.fzc.ModelDefect;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.FlatModel;
import com.vmware.fzc.model.SolveGoal;
import com.vmware.fzc.model.VarKind;
import com.vmware.fzc.model.VarRef;
import com.vmware.fzc.model.VariableSpec;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The output of {@link ModelCompiler}: the scheduled constraints, the status of every variable, the domain
 * constraints a backend must add, the solve goal and the defects found along the way.
 */
public final class CompiledModel {
    private final FlatModel model;
    private final ImmutableList<ConstraintSpec> constraints;
    private final ImmutableSet<VarRef> forced;
    private final ImmutableList<DomainConstraint> domainConstraints;
    private final ImmutableList<ModelDefect> defects;
    private final AliasMap aliasMap;
    private final Map<VarKind, VariableStatus[]> statuses = new EnumMap<>(VarKind.class);

    CompiledModel(final FlatModel model, final Schedule schedule, final Set<VarRef> computed,
                  final AliasMap aliasMap, final List<DomainConstraint> sideConstraints,
                  final List<ModelDefect> defects) {
        this.model = model;
        this.constraints = ImmutableList.copyOf(schedule.order());
        this.forced = ImmutableSet.copyOf(schedule.forced());
        this.aliasMap = aliasMap;
        this.defects = ImmutableList.copyOf(defects);

        final VariableOccurrences occurrences = VariableOccurrences.of(model);
        for (final VarKind kind: VarKind.values()) {
            final VariableStatus[] status = new VariableStatus[model.variables(kind).size()];
            for (final VariableSpec spec: model.variables(kind)) {
                final VarRef ref = spec.getRef();
                if (spec.isAliased() || aliasMap.isAliased(ref)) {
                    status[spec.getIndex()] = VariableStatus.ALIASED;
                } else if (computed.contains(ref)) {
                    status[spec.getIndex()] = VariableStatus.COMPUTED;
                } else if (spec.isIntroduced() && !occurrences.isReferenced(ref)) {
                    status[spec.getIndex()] = VariableStatus.UNUSED;
                } else {
                    status[spec.getIndex()] = VariableStatus.ACTIVE;
                }
            }
            statuses.put(kind, status);
        }

        final List<DomainConstraint> allDomainConstraints = new ArrayList<>(sideConstraints);
        for (final VarRef var: computed) {
            final VariableSpec spec = model.variable(var);
            if (var.getKind() == VarKind.INT && !spec.effectiveDomain().isAll()) {
                allDomainConstraints.add(new DomainConstraint(var, spec.effectiveDomain()));
            }
        }
        this.domainConstraints = ImmutableList.copyOf(allDomainConstraints);
    }

    public FlatModel getModel() {
        return model;
    }

    /**
     * The active constraints, in schedule order.
     */
    public List<ConstraintSpec> constraints() {
        return constraints;
    }

    /**
     * Variables declared defined to break dependency cycles.
     */
    public Set<VarRef> forced() {
        return forced;
    }

    public List<DomainConstraint> domainConstraints() {
        return domainConstraints;
    }

    public SolveGoal getGoal() {
        return model.getGoal();
    }

    public List<ModelDefect> defects() {
        return defects;
    }

    public boolean isInfeasible() {
        return !defects.isEmpty();
    }

    public VariableStatus status(final VarRef var) {
        return statuses.get(var.getKind())[var.getIndex()];
    }

    public List<VariableSpec> variables(final VarKind kind, final VariableStatus status) {
        final List<VariableSpec> result = new ArrayList<>();
        for (final VariableSpec spec: model.variables(kind)) {
            if (status(spec.getRef()) == status) {
                result.add(spec);
            }
        }
        return result;
    }

    public VarRef aliasRoot(final VarRef var) {
        return aliasMap.find(var);
    }
}

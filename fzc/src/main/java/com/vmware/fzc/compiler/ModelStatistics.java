/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler;

import com.google.common.collect.ImmutableSortedMap;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.FlatModel;
import com.vmware.fzc.model.VarKind;
import com.vmware.fzc.model.VariableSpec;

import java.util.EnumMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Constraint counts per constraint name and variable counts per kind, and per status once compiled.
 */
public final class ModelStatistics {
    private final ImmutableSortedMap<String, Integer> constraintsByName;
    private final Map<VarKind, Map<VariableStatus, Integer>> variablesByStatus;

    private ModelStatistics(final SortedMap<String, Integer> constraintsByName,
                            final Map<VarKind, Map<VariableStatus, Integer>> variablesByStatus) {
        this.constraintsByName = ImmutableSortedMap.copyOfSorted(constraintsByName);
        this.variablesByStatus = variablesByStatus;
    }

    /**
     * Statistics of a model before compilation. Aliased variables are the ones declared as aliases, all
     * others count as active.
     */
    public static ModelStatistics of(final FlatModel model) {
        final SortedMap<String, Integer> byName = new TreeMap<>();
        for (final ConstraintSpec ct: model.constraints()) {
            if (ct.isActive()) {
                byName.merge(ct.getName(), 1, Integer::sum);
            }
        }
        final Map<VarKind, Map<VariableStatus, Integer>> byStatus = new EnumMap<>(VarKind.class);
        for (final VarKind kind: VarKind.values()) {
            final Map<VariableStatus, Integer> counts = new EnumMap<>(VariableStatus.class);
            for (final VariableSpec spec: model.variables(kind)) {
                counts.merge(spec.isAliased() ? VariableStatus.ALIASED : VariableStatus.ACTIVE, 1, Integer::sum);
            }
            byStatus.put(kind, counts);
        }
        return new ModelStatistics(byName, byStatus);
    }

    public static ModelStatistics of(final CompiledModel compiled) {
        final SortedMap<String, Integer> byName = new TreeMap<>();
        for (final ConstraintSpec ct: compiled.constraints()) {
            byName.merge(ct.getName(), 1, Integer::sum);
        }
        final Map<VarKind, Map<VariableStatus, Integer>> byStatus = new EnumMap<>(VarKind.class);
        for (final VarKind kind: VarKind.values()) {
            final Map<VariableStatus, Integer> counts = new EnumMap<>(VariableStatus.class);
            for (final VariableSpec spec: compiled.getModel().variables(kind)) {
                counts.merge(compiled.status(spec.getRef()), 1, Integer::sum);
            }
            byStatus.put(kind, counts);
        }
        return new ModelStatistics(byName, byStatus);
    }

    public Map<String, Integer> constraintsByName() {
        return constraintsByName;
    }

    public int constraintCount() {
        return constraintsByName.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int variableCount(final VarKind kind, final VariableStatus status) {
        return variablesByStatus.get(kind).getOrDefault(status, 0);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append(constraintCount()).append(" constraints");
        constraintsByName.forEach((name, count) -> sb.append("\n  ").append(name).append(": ").append(count));
        for (final VarKind kind: VarKind.values()) {
            sb.append("\n").append(kind.name().toLowerCase()).append(" variables: ")
              .append(variablesByStatus.get(kind));
        }
        return sb.toString();
    }
}

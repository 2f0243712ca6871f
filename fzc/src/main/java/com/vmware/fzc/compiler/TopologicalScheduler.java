/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler;

import com.vmware.fzc.ModelException;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.FlatModel;
import com.vmware.fzc.model.VarRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Orders the active constraints so that each constraint comes after the constraints defining the variables
 * it requires.
 *
 * Constraints that define a variable and require nothing go first, in index order. The ones that both define
 * and require are then emitted as their requirements become defined. When no further progress is possible
 * the remaining ones form cycles: the constraint with the fewest undefined requirements is picked, and those
 * requirements are forced into the defined set. Constraints that define nothing come last, in index order.
 */
public final class TopologicalScheduler {
    static final String PHASE = "scheduling";
    private static final Logger LOG = LoggerFactory.getLogger(TopologicalScheduler.class);
    private final Comparator<ConstraintSpec> tieBreak;

    /**
     * @param tieBreak orders cycle-breaking candidates that have the same number of undefined requirements
     */
    public TopologicalScheduler(final Comparator<ConstraintSpec> tieBreak) {
        this.tieBreak = tieBreak;
    }

    public Schedule apply(final FlatModel model, final AliasMap aliasMap) {
        final List<ConstraintSpec> definesOnly = new ArrayList<>();
        final List<ConstraintSpec> noDefines = new ArrayList<>();
        final List<ConstraintSpec> definesAndRequires = new ArrayList<>();
        final Map<VarRef, ConstraintSpec> definers = new HashMap<>();
        for (final ConstraintSpec ct: model.constraints()) {
            if (ct.isNullified()) {
                continue;
            }
            final VarRef defined = ct.getDefinedArg();
            if (defined == null) {
                noDefines.add(ct);
                continue;
            }
            checkDefinedArg(model, aliasMap, ct, defined);
            definers.put(defined, ct);
            if (ct.getRequires().isEmpty()) {
                definesOnly.add(ct);
            } else {
                definesAndRequires.add(ct);
            }
        }

        final List<ConstraintSpec> order = new ArrayList<>();
        final Set<VarRef> defined = new LinkedHashSet<>();
        final Set<VarRef> forced = new LinkedHashSet<>();
        for (final ConstraintSpec ct: definesOnly) {
            order.add(ct);
            defined.add(ct.getDefinedArg());
        }

        int cyclesBroken = 0;
        while (!definesAndRequires.isEmpty()) {
            if (emitReady(definesAndRequires, defined, order)) {
                continue;
            }
            final ConstraintSpec breakPoint = pickBreakPoint(definesAndRequires, defined, aliasMap);
            final Set<VarRef> unsatisfied = unsatisfied(breakPoint, defined);
            LOG.debug("Dependency cycle: forcing {} as defined to schedule {}", unsatisfied, breakPoint);
            for (final VarRef var: unsatisfied) {
                defined.add(var);
                forced.add(var);
                final ConstraintSpec nominal = definers.remove(var);
                if (nominal != null && nominal != breakPoint) {
                    nominal.setDefinedArg(null);
                    nominal.getRequires().clear();
                    if (definesAndRequires.remove(nominal)) {
                        noDefines.add(nominal);
                    }
                }
            }
            cyclesBroken++;
        }

        noDefines.sort(Comparator.comparingInt(ConstraintSpec::getIndex));
        order.addAll(noDefines);
        LOG.debug("Scheduled {} constraints, {} defining, {} cycles broken",
                  order.size(), order.size() - noDefines.size(), cyclesBroken);
        return new Schedule(order, forced, cyclesBroken);
    }

    /**
     * Emits, in order, every pending constraint whose requirements are all defined.
     *
     * @return whether anything was emitted
     */
    private static boolean emitReady(final List<ConstraintSpec> pending, final Set<VarRef> defined,
                                     final List<ConstraintSpec> order) {
        boolean progress = false;
        final Iterator<ConstraintSpec> it = pending.iterator();
        while (it.hasNext()) {
            final ConstraintSpec ct = it.next();
            if (defined.containsAll(ct.getRequires())) {
                order.add(ct);
                defined.add(ct.getDefinedArg());
                it.remove();
                progress = true;
            }
        }
        return progress;
    }

    /**
     * The pending constraint with the fewest undefined requirements. Constraints requiring a variable that
     * other variables alias are only picked when every candidate does.
     */
    private ConstraintSpec pickBreakPoint(final List<ConstraintSpec> pending, final Set<VarRef> defined,
                                          final AliasMap aliasMap) {
        final Comparator<ConstraintSpec> fewestUnsatisfied =
                Comparator.<ConstraintSpec>comparingInt(ct -> unsatisfied(ct, defined).size()).thenComparing(tieBreak);
        ConstraintSpec best = pending.get(0);
        ConstraintSpec bestQualified = null;
        for (final ConstraintSpec ct: pending) {
            if (fewestUnsatisfied.compare(ct, best) < 0) {
                best = ct;
            }
            final boolean qualified = unsatisfied(ct, defined).stream().noneMatch(aliasMap::hasAliases);
            if (qualified && (bestQualified == null || fewestUnsatisfied.compare(ct, bestQualified) < 0)) {
                bestQualified = ct;
            }
        }
        return bestQualified != null ? bestQualified : best;
    }

    private static Set<VarRef> unsatisfied(final ConstraintSpec ct, final Set<VarRef> defined) {
        final Set<VarRef> result = new LinkedHashSet<>();
        for (final VarRef var: ct.getRequires()) {
            if (!defined.contains(var)) {
                result.add(var);
            }
        }
        return result;
    }

    private static void checkDefinedArg(final FlatModel model, final AliasMap aliasMap, final ConstraintSpec ct,
                                        final VarRef defined) {
        if (!ct.variables().contains(defined) || aliasMap.isAliased(defined)
                || model.variable(defined).isAliased()) {
            throw ModelException.invariant(PHASE, "dangling defined variable " + defined + " in constraint",
                                           ct.getIndex());
        }
    }
}

/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler;

import com.vmware.fzc.model.ArrayNode;
import com.vmware.fzc.model.ConstraintKind;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.FlatModel;
import com.vmware.fzc.model.IntLiteral;
import com.vmware.fzc.model.Node;
import com.vmware.fzc.model.Nodes;
import com.vmware.fzc.model.VarKind;
import com.vmware.fzc.model.VarRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

/**
 * Decides which variable, if any, each active constraint defines, and which defined variables it requires.
 *
 * A constraint's {@code defines_var} annotation is honoured first. Constraints without one may still define
 * a variable nothing else defines: a reified constraint its literal, and a two-term {@code int_lin_eq} the
 * term with coefficient -1. The first constraint to claim a variable gets it.
 */
final class DependencyGraphBuilder {
    static final String PHASE = "dependency-graph";
    private static final Logger LOG = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private DependencyGraphBuilder() {
    }

    static DependencyGraph apply(final FlatModel model) {
        final Set<VarRef> candidates = new LinkedHashSet<>();
        final Map<Integer, VarRef> proposals = computeViableTargets(model, candidates);
        final Map<VarRef, Integer> definers = new LinkedHashMap<>();
        for (final ConstraintSpec ct: model.constraints()) {
            if (ct.isActive()) {
                computeDependencies(candidates, ct, proposals.get(ct.getIndex()));
                if (ct.getDefinedArg() != null) {
                    definers.put(ct.getDefinedArg(), ct.getIndex());
                }
            }
        }
        LOG.debug("{} of {} constraints define a variable", definers.size(), model.constraints().active().size());
        return new DependencyGraph(candidates, definers, VariableOccurrences.of(model));
    }

    /**
     * Proposes a variable to define for each active constraint that can define one, and adds it to
     * {@code candidates}.
     *
     * @return the proposed variable per constraint index
     */
    static Map<Integer, VarRef> computeViableTargets(final FlatModel model, final Set<VarRef> candidates) {
        final Map<Integer, VarRef> proposals = new LinkedHashMap<>();
        for (final ConstraintSpec ct: model.constraints()) {
            final VarRef target = ct.isActive() ? annotatedTarget(model, ct) : null;
            if (target != null && candidates.add(target)) {
                proposals.put(ct.getIndex(), target);
            }
        }
        for (final ConstraintSpec ct: model.constraints()) {
            if (ct.isNullified() || proposals.containsKey(ct.getIndex()) || ct.definesVar() != null) {
                continue;
            }
            final VarRef target = defaultTarget(model, ct);
            if (target != null && candidates.add(target)) {
                LOG.trace("{} defines {} by default", ct, model.variable(target).getName());
                proposals.put(ct.getIndex(), target);
            }
        }
        return proposals;
    }

    /**
     * Sets what {@code ct} defines, the proposal if it is a candidate, and what it requires: every other
     * candidate among its arguments.
     */
    static void computeDependencies(final Set<VarRef> candidates, final ConstraintSpec ct,
                                    @Nullable final VarRef proposal) {
        final VarRef defined = proposal != null && candidates.contains(proposal) ? proposal : null;
        ct.setDefinedArg(defined);
        ct.getRequires().clear();
        for (final VarRef var: ct.variables()) {
            if (candidates.contains(var) && !var.equals(defined)) {
                ct.getRequires().add(var);
            }
        }
    }

    @Nullable
    private static VarRef annotatedTarget(final FlatModel model, final ConstraintSpec ct) {
        final VarRef target = ct.definesVar();
        if (target == null || !ct.getKind().canDefine() || model.variable(target).isFixed()
                || !ct.variables().contains(target)) {
            return null;
        }
        return target;
    }

    @Nullable
    private static VarRef defaultTarget(final FlatModel model, final ConstraintSpec ct) {
        if (ct.getKind().isReified() && ct.arity() > 0) {
            final Node literal = ct.arg(ct.arity() - 1);
            if (literal.isVarRef() && ((VarRef) literal).getKind() == VarKind.BOOL
                    && !model.variable((VarRef) literal).isFixed()) {
                return (VarRef) literal;
            }
            return null;
        }
        if (ct.getKind() == ConstraintKind.INT_LIN_EQ && ct.arity() == 3 && Nodes.isIntArray(ct.arg(0))
                && ct.arg(1) instanceof ArrayNode && ct.arg(2) instanceof IntLiteral) {
            final long[] coefficients = Nodes.intValues(ct.arg(0));
            final ArrayNode terms = (ArrayNode) ct.arg(1);
            if (coefficients.length != 2 || terms.size() != 2) {
                return null;
            }
            for (int i = 0; i < 2; i++) {
                final Node term = terms.get(i);
                if (coefficients[i] == -1 && term.isVarRef() && !term.equals(terms.get(1 - i))
                        && !model.variable((VarRef) term).isFixed()) {
                    return (VarRef) term;
                }
            }
        }
        return null;
    }
}

/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler.presolve;

import com.google.common.collect.ImmutableList;
import com.vmware.fzc.ModelDefect;
import com.vmware.fzc.compiler.AliasUnifier;
import com.vmware.fzc.compiler.AliasUnifier.MergeResult;
import com.vmware.fzc.model.BoolLiteral;
import com.vmware.fzc.model.ConstraintKind;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.Domain;
import com.vmware.fzc.model.FlatModel;
import com.vmware.fzc.model.IntLiteral;
import com.vmware.fzc.model.Node;
import com.vmware.fzc.model.VarKind;
import com.vmware.fzc.model.VarRef;
import com.vmware.fzc.model.VariableSpec;
import com.vmware.fzc.model.VariableSpec.NarrowResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import javax.annotation.Nullable;

/**
 * What a {@link RewriteRule} may read and do besides rewriting its own constraint: query and narrow
 * domains, nullify the constraint, record defects and request aliases.
 *
 * The lookup tables for {@code int_abs} and reified equalities are rebuilt at the start of every sweep and
 * whenever an alias is applied, so they only hold root variables. Filling them does not count as a change.
 */
public final class PresolveContext {
    private static final Logger LOG = LoggerFactory.getLogger(PresolveContext.class);
    private final FlatModel model;
    private final AliasUnifier unifier;
    private final List<ModelDefect> defects;
    private final Map<VarRef, VarRef> absArguments = new HashMap<>();
    private final Map<ReifKey, VarRef> eqReifs = new HashMap<>();
    private final Map<ReifKey, VarRef> neReifs = new HashMap<>();
    private final List<VarRef[]> pendingAliases = new ArrayList<>();

    PresolveContext(final FlatModel model, final AliasUnifier unifier, final List<ModelDefect> defects) {
        this.model = model;
        this.unifier = unifier;
        this.defects = defects;
    }

    void startSweep() {
        rebuildTables();
    }

    private void rebuildTables() {
        absArguments.clear();
        eqReifs.clear();
        neReifs.clear();
        for (final ConstraintSpec ct: model.constraints()) {
            if (ct.isActive() && ct.getKind() == ConstraintKind.INT_ABS && ct.arity() == 2
                    && ct.arg(0).isVarRef() && ct.arg(1).isVarRef()) {
                absArguments.putIfAbsent((VarRef) ct.arg(1), (VarRef) ct.arg(0));
            }
        }
    }

    public FlatModel model() {
        return model;
    }

    public VariableSpec spec(final VarRef ref) {
        return model.variable(ref);
    }

    public boolean isFixed(final Node node) {
        if (node instanceof IntLiteral || node instanceof BoolLiteral) {
            return true;
        }
        return node.isVarRef() && spec((VarRef) node).isFixed();
    }

    public long value(final Node node) {
        if (node instanceof IntLiteral) {
            return ((IntLiteral) node).getValue();
        }
        if (node instanceof BoolLiteral) {
            return ((BoolLiteral) node).getValue() ? 1 : 0;
        }
        if (node.isVarRef()) {
            return spec((VarRef) node).fixedValue();
        }
        throw new IllegalArgumentException("Not an integer or Boolean term: " + node);
    }

    /**
     * The values an integer or Boolean term can take. Terms of any other type have the full range.
     */
    public Domain domain(final Node node) {
        if (node instanceof IntLiteral || node instanceof BoolLiteral) {
            return Domain.singleton(value(node));
        }
        if (node.isVarRef() && ((VarRef) node).getKind() != VarKind.SET) {
            return spec((VarRef) node).effectiveDomain();
        }
        return Domain.all();
    }

    public long min(final Node node) {
        return domain(node).min();
    }

    public long max(final Node node) {
        return domain(node).max();
    }

    public boolean isBounded(final Node node) {
        return domain(node).isBounded();
    }

    /**
     * Narrows a term to {@code values}. A narrowing that would empty the domain is a defect: it is recorded,
     * the constraint is nullified and the domain is left as it was. A literal outside {@code values} is
     * treated the same way.
     */
    public NarrowResult narrow(final ConstraintSpec ct, final Node target, final Domain values) {
        final NarrowResult result;
        if (target.isVarRef()) {
            result = spec((VarRef) target).narrow(values);
        } else {
            result = values.contains(value(target)) ? NarrowResult.UNCHANGED : NarrowResult.EMPTY;
        }
        if (result == NarrowResult.EMPTY) {
            defect(ct, "no value of " + describe(target) + " is in " + values);
            ct.nullify();
        } else if (result == NarrowResult.NARROWED) {
            LOG.trace("Narrowed {} to {} from {}", describe(target), domain(target), ct);
        }
        return result;
    }

    public void nullify(final ConstraintSpec ct) {
        LOG.trace("Nullified {}", ct);
        ct.nullify();
    }

    /**
     * Marks a constraint that always evaluates to false: it becomes {@code false_constraint} and a defect
     * is recorded.
     */
    public void fail(final ConstraintSpec ct) {
        defect(ct, ct.getName() + " can never hold");
        ct.transition(ConstraintKind.FALSE_CONSTRAINT, ImmutableList.of());
    }

    public void defect(final ConstraintSpec ct, final String message) {
        final ModelDefect defect = new ModelDefect(RewriteEngine.PHASE, ct.getIndex(), message);
        LOG.warn("Model defect: {}", defect);
        defects.add(defect);
    }

    /**
     * Requests that {@code from} become an alias of {@code to}. The alias is applied to the whole model
     * once the current rule returns.
     */
    public void requestAlias(final VarRef from, final VarRef to) {
        pendingAliases.add(new VarRef[]{from, to});
    }

    /**
     * Applies the aliases requested by {@code rule} while rewriting {@code ct}. Merging two variables with
     * disjoint domains has already been recorded as a defect by the unifier.
     */
    void flushAliases(final RewriteRule rule, final ConstraintSpec ct) {
        if (pendingAliases.isEmpty()) {
            return;
        }
        for (final VarRef[] alias: pendingAliases) {
            final MergeResult result = unifier.alias(alias[0], alias[1]);
            if (result == MergeResult.EMPTY) {
                LOG.warn("{} aliased {} to {} from {}, but their domains do not intersect",
                         rule.getClass().getSimpleName(), describe(alias[0]), describe(alias[1]), ct);
            } else {
                LOG.trace("{} aliased {} to {} from {} ({})", rule.getClass().getSimpleName(), describe(alias[0]),
                          describe(alias[1]), ct, result);
            }
        }
        pendingAliases.clear();
        rebuildTables();
    }

    private VarRef root(final VarRef var) {
        return unifier.aliasMap().find(var);
    }

    /**
     * If {@code y} is the result of an {@code int_abs(x, y)} constraint, returns {@code x}.
     */
    @Nullable
    public VarRef absArgument(final VarRef y) {
        final VarRef x = absArguments.get(root(y));
        return x == null ? null : root(x);
    }

    /**
     * Records {@code b <-> (x == value)} unless an equivalent literal is already known, which is returned.
     */
    @Nullable
    VarRef recordEqReif(final VarRef x, final long value, final VarRef b) {
        return lookup(eqReifs.putIfAbsent(new ReifKey(root(x), value), root(b)));
    }

    @Nullable
    VarRef recordNeReif(final VarRef x, final long value, final VarRef b) {
        return lookup(neReifs.putIfAbsent(new ReifKey(root(x), value), root(b)));
    }

    @Nullable
    VarRef eqReif(final VarRef x, final long value) {
        return lookup(eqReifs.get(new ReifKey(root(x), value)));
    }

    @Nullable
    VarRef neReif(final VarRef x, final long value) {
        return lookup(neReifs.get(new ReifKey(root(x), value)));
    }

    @Nullable
    private VarRef lookup(@Nullable final VarRef var) {
        return var == null ? null : root(var);
    }

    String describe(final Node node) {
        return node.isVarRef() ? spec((VarRef) node).getName() : node.toString();
    }

    private static final class ReifKey {
        private final VarRef var;
        private final long value;

        private ReifKey(final VarRef var, final long value) {
            this.var = var;
            this.value = value;
        }

        @Override
        public boolean equals(final Object o) {
            if (!(o instanceof ReifKey)) {
                return false;
            }
            final ReifKey that = (ReifKey) o;
            return value == that.value && var.equals(that.var);
        }

        @Override
        public int hashCode() {
            return Objects.hash(var, value);
        }
    }
}

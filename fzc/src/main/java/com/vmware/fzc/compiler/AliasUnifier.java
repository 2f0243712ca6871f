/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler;

import com.vmware.fzc.ModelDefect;
import com.vmware.fzc.ModelException;
import com.vmware.fzc.model.ConstraintKind;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.Domain;
import com.vmware.fzc.model.FlatModel;
import com.vmware.fzc.model.Node;
import com.vmware.fzc.model.NodeRewriter;
import com.vmware.fzc.model.VarKind;
import com.vmware.fzc.model.VarRef;
import com.vmware.fzc.model.VariableSpec;
import com.vmware.fzc.model.VariableSpec.NarrowResult;
import com.vmware.fzc.model.VariableTable;
import com.vmware.fzc.model.VoidType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Identifies variables that are equal by construction and collapses each group onto one root variable.
 *
 * Aliases come from declarations ({@code var int: y = x}), from {@link #discoverAliases(Targets)} and from
 * the rewrite rules. Once applied, no active constraint and no goal term references a non-root variable.
 */
public final class AliasUnifier {
    public static final String PHASE = "alias-unification";
    private static final Logger LOG = LoggerFactory.getLogger(AliasUnifier.class);
    private final FlatModel model;
    private final AliasMap aliasMap;
    private final List<ModelDefect> defects;
    private final List<DomainConstraint> domainConstraints;
    private final Set<Integer> considered = new HashSet<>();

    public AliasUnifier(final FlatModel model, final AliasMap aliasMap, final List<ModelDefect> defects,
                        final List<DomainConstraint> domainConstraints) {
        this.model = model;
        this.aliasMap = aliasMap;
        this.defects = defects;
        this.domainConstraints = domainConstraints;
    }

    public AliasMap aliasMap() {
        return aliasMap;
    }

    /**
     * Looks at each undesignated {@code int_eq}/{@code bool_eq} between two variables once. If one side is
     * an orphan it becomes an alias of the other and the constraint goes away. Otherwise, when neither side
     * is a candidate, the first introduced side is designated as defined by the constraint.
     *
     * @return the number of aliases recorded
     */
    public int discoverAliases(final Targets targets) {
        int found = 0;
        for (final ConstraintSpec ct: model.constraints()) {
            if (!ct.isActive() || (ct.getKind() != ConstraintKind.INT_EQ && ct.getKind() != ConstraintKind.BOOL_EQ)
                    || ct.arity() != 2 || ct.definesVar() != null || !considered.add(ct.getIndex())) {
                continue;
            }
            if (!ct.arg(0).isVarRef() || !ct.arg(1).isVarRef()) {
                continue;
            }
            final VarRef a = (VarRef) ct.arg(0);
            final VarRef b = (VarRef) ct.arg(1);
            if (a.getKind() != b.getKind()) {
                continue;
            }
            if (a.equals(b)) {
                ct.nullify();
                continue;
            }
            if (targets.isOrphan(a) && !resolvesTo(b, a)) {
                recordAlias(ct, a, b, targets);
                found++;
            } else if (targets.isOrphan(b) && !resolvesTo(a, b)) {
                recordAlias(ct, b, a, targets);
                found++;
            } else if (!targets.isCandidate(a) && !targets.isCandidate(b)) {
                final VarRef designated = model.variable(a).isIntroduced() ? a
                                        : model.variable(b).isIntroduced() ? b : null;
                if (designated != null && !model.variable(designated).isFixed()) {
                    LOG.debug("Designating {} as defined by {}", model.variable(designated).getName(), ct);
                    ct.setDefinesVar(designated);
                    targets.addCandidate(designated);
                }
            }
        }
        return found;
    }

    private void recordAlias(final ConstraintSpec ct, final VarRef alias, final VarRef target, final Targets targets) {
        LOG.debug("{} is an alias of {}, dropping {}", model.variable(alias).getName(),
                  model.variable(target).getName(), ct);
        model.variable(alias).setAlias(target.getIndex());
        targets.removeOrphan(alias);
        ct.nullify();
    }

    /**
     * Intersects {@code dest}'s domain with {@code source}'s.
     *
     * @return {@link MergeResult#SKIPPED} when {@code dest} does not own its domain, in which case the
     *         merged domain is recorded as a domain constraint instead; {@link MergeResult#EMPTY} when the
     *         domains do not intersect, which is recorded as a defect
     */
    public MergeResult mergeDomain(final VariableSpec source, final VariableSpec dest) {
        final Domain merged = dest.effectiveDomain().intersect(source.effectiveDomain());
        if (merged.isEmpty()) {
            final ModelDefect defect = new ModelDefect(PHASE, ModelDefect.NO_CONSTRAINT,
                    "domains of " + source.getName() + " and " + dest.getName() + " do not intersect");
            LOG.warn("Model defect: {}", defect);
            defects.add(defect);
            return MergeResult.EMPTY;
        }
        if (!dest.ownsDomain()) {
            if (!merged.equals(dest.effectiveDomain())) {
                domainConstraints.add(new DomainConstraint(dest.getRef(), merged));
            }
            return MergeResult.SKIPPED;
        }
        final NarrowResult result = dest.narrow(merged);
        return result == NarrowResult.EMPTY ? MergeResult.EMPTY : MergeResult.APPLIED;
    }

    /**
     * Chases every declared alias to its root, merges the domains into the roots and rewrites all
     * references to the roots.
     *
     * @throws ModelException on an alias cycle or an alias to an undeclared variable
     */
    public AliasMap resolveAndApplyAliases() {
        for (final VarKind kind: VarKind.values()) {
            final VariableTable table = model.variables(kind);
            for (final VariableSpec spec: table) {
                if (!spec.isAliased()) {
                    continue;
                }
                final VariableSpec root = chase(table, spec);
                aliasMap.union(spec.getRef(), root.getRef());
                if (spec.getAlias() != root.getIndex()) {
                    spec.setAlias(root.getIndex());
                }
                mergeDomain(spec, root);
            }
        }
        substitute();
        verify(PHASE);
        LOG.debug("Resolved {} aliases", aliasMap.size());
        return aliasMap;
    }

    /**
     * Makes {@code from} an alias of {@code to} and rewrites the model accordingly.
     */
    public MergeResult alias(final VarRef from, final VarRef to) {
        final VarRef fromRoot = aliasMap.find(from);
        final VarRef toRoot = aliasMap.find(to);
        if (fromRoot.equals(toRoot)) {
            return MergeResult.APPLIED;
        }
        final VariableSpec source = model.variable(fromRoot);
        final VariableSpec dest = model.variable(toRoot);
        LOG.debug("{} is an alias of {}", source.getName(), dest.getName());
        source.setAlias(toRoot.getIndex());
        aliasMap.union(fromRoot, toRoot);
        final MergeResult result = mergeDomain(source, dest);
        substitute();
        return result;
    }

    private VariableSpec chase(final VariableTable table, final VariableSpec start) {
        final Set<Integer> seen = new HashSet<>();
        VariableSpec current = start;
        while (current.isAliased()) {
            if (!seen.add(current.getIndex())) {
                throw ModelException.invariant(PHASE, "alias cycle through " + table.getKind().name().toLowerCase()
                                                      + " variable", current.getIndex());
            }
            final int next = current.getAlias();
            if (next < 0 || next >= table.size()) {
                throw ModelException.invariant(PHASE, "alias to undeclared variable from", current.getIndex());
            }
            current = table.get(next);
        }
        return current;
    }

    /**
     * Whether following declared aliases from {@code var} leads to {@code target}.
     */
    private boolean resolvesTo(final VarRef var, final VarRef target) {
        return chase(model.variables(var.getKind()), model.variable(var)).getRef().equals(target);
    }

    private void substitute() {
        final NodeRewriter toRoots = new AliasSubstitution(aliasMap);
        for (final ConstraintSpec ct: model.constraints()) {
            if (ct.isNullified()) {
                continue;
            }
            final List<Node> annotations = toRoots.visitAll(ct.getAnnotations());
            if (!annotations.equals(ct.getAnnotations())) {
                ct.setAnnotations(annotations);
            }
            final List<Node> args = toRoots.visitAll(ct.getArgs());
            if (!args.equals(ct.getArgs())) {
                ct.transition(ct.getKind(), args);
            }
        }
        model.setGoal(model.getGoal().rewrite(toRoots));
    }

    /**
     * Checks that no active constraint and no goal term references an aliased variable.
     *
     * @param phase the phase reported if the check fails
     * @throws ModelException if an aliased variable is still referenced
     */
    public void verify(final String phase) {
        for (final ConstraintSpec ct: model.constraints()) {
            if (ct.isNullified()) {
                continue;
            }
            for (final VarRef var: ct.variables()) {
                if (model.variable(var).isAliased()) {
                    throw ModelException.invariant(phase, "aliased variable " + model.variable(var).getName()
                                                          + " still referenced by constraint", ct.getIndex());
                }
            }
        }
        for (final VarRef var: model.getGoal().variables()) {
            if (model.variable(var).isAliased()) {
                throw ModelException.invariant(phase, "aliased variable still referenced by the goal, index",
                                               var.getIndex());
            }
        }
    }

    public enum MergeResult {
        APPLIED,
        SKIPPED,
        EMPTY
    }

    private static final class AliasSubstitution extends NodeRewriter {
        private final AliasMap aliasMap;

        private AliasSubstitution(final AliasMap aliasMap) {
            this.aliasMap = aliasMap;
        }

        @Override
        protected Node visitVarRef(final VarRef node, final VoidType context) {
            return aliasMap.find(node);
        }
    }
}

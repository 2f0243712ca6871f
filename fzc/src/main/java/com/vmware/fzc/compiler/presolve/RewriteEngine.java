/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler.presolve;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.vmware.fzc.ModelDefect;
import com.vmware.fzc.ModelException;
import com.vmware.fzc.compiler.AliasUnifier;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.FlatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Applies the local rewrite rules to every active constraint, sweep after sweep, until a sweep changes
 * nothing.
 *
 * Rules only shrink domains, nullify constraints or move constraint kinds forward along an acyclic graph,
 * so a fixpoint is always reached; the sweep bound only guards against a rule that breaks this.
 */
public class RewriteEngine {
    public static final String PHASE = "presolve";
    private static final Logger LOG = LoggerFactory.getLogger(RewriteEngine.class);
    private final List<RewriteRule> rules;
    private final int maxSweeps;

    public RewriteEngine(final int maxSweeps) {
        this(defaultRules(), maxSweeps);
    }

    @VisibleForTesting
    RewriteEngine(final List<RewriteRule> rules, final int maxSweeps) {
        Preconditions.checkArgument(maxSweeps > 0, "maxSweeps must be positive, got %s", maxSweeps);
        this.rules = ImmutableList.copyOf(rules);
        this.maxSweeps = maxSweeps;
    }

    /**
     * The rules, in the order they are tried on each constraint.
     */
    public static List<RewriteRule> defaultRules() {
        return ImmutableList.of(new UnreifyRule(),
                                new ComparisonBoundsRule(),
                                new IntEqRule(),
                                new IntNeRule(),
                                new SetInRule(),
                                new StrictLinearRule(),
                                new LinearOrientationRule(),
                                new ConstantLinearRule(),
                                new RegroupLinearTermsRule(),
                                new SimplifySmallLinearRule(),
                                new PositiveLinearBoundsRule(),
                                new LinearReifBoundsRule(),
                                new BoolReifWithConstantRule(),
                                new ReifiedComparisonsRule(),
                                new AbsRule(),
                                new EqNeReifMergeRule(),
                                new BoolXorRule(),
                                new Bool2IntRule(),
                                new ElementIndexBoundsRule(),
                                new BoolArrayRule(),
                                new FixedTargetReleaseRule());
    }

    /**
     * Rewrites the model in place until a fixpoint is reached.
     *
     * @param unifier applies the aliases that rules discover
     * @param defects receives the infeasibilities found along the way
     * @return the number of sweeps, including the final one that changed nothing
     */
    public int apply(final FlatModel model, final AliasUnifier unifier, final List<ModelDefect> defects) {
        final PresolveContext context = new PresolveContext(model, unifier, defects);
        int sweeps = 0;
        boolean changed;
        do {
            if (sweeps == maxSweeps) {
                throw ModelException.invariant(PHASE, "no fixpoint reached after sweeps:", sweeps);
            }
            sweeps++;
            changed = false;
            context.startSweep();
            for (final ConstraintSpec ct: model.constraints()) {
                if (ct.isActive()) {
                    changed |= presolveOne(ct, context);
                }
            }
            LOG.trace("Presolve sweep {} changed={}", sweeps, changed);
        } while (changed);
        LOG.debug("Presolve reached a fixpoint after {} sweeps", sweeps);
        return sweeps;
    }

    private boolean presolveOne(final ConstraintSpec ct, final PresolveContext context) {
        boolean changed = false;
        for (final RewriteRule rule: rules) {
            if (ct.isNullified()) {
                break;
            }
            if (rule.rewrite(ct, context)) {
                LOG.trace("{} rewrote {}", rule.getClass().getSimpleName(), ct);
                changed = true;
            }
            context.flushAliases(rule, ct);
        }
        return changed;
    }
}

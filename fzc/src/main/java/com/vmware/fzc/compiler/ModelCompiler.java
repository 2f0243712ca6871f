/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler;

import com.vmware.fzc.ModelDefect;
import com.vmware.fzc.compiler.presolve.RewriteEngine;
import com.vmware.fzc.model.CanonicalReferences;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.FlatModel;
import com.vmware.fzc.model.VarRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Compiles a {@link FlatModel} in place into a {@link CompiledModel}.
 *
 * The passes run in a fixed order, each relying on what the previous ones established:
 *
 *   1. annotation sanitation
 *   2. regrouping of max/min chains
 *   3. orphan and target marking
 *   4. alias discovery and resolution
 *   5. local rewriting to a fixpoint
 *   6. dependency graph construction
 *   7. scheduling
 *   8. computed variable classification
 *   9. handoff
 *
 * A compiler instance holds no state between compilations. A model must not be compiled twice.
 */
public class ModelCompiler {
    private static final Logger LOG = LoggerFactory.getLogger(ModelCompiler.class);
    private final CompilerOptions options;

    public ModelCompiler() {
        this(CompilerOptions.defaults());
    }

    public ModelCompiler(final CompilerOptions options) {
        this.options = options;
    }

    /**
     * Entry point to compile a model
     * @param model a flat model, which is modified in place
     * @return the compiled model
     * @throws com.vmware.fzc.ModelException if an invariant between passes does not hold
     */
    public CompiledModel compile(final FlatModel model) {
        final long start = System.nanoTime();
        if (options.printStatistics()) {
            LOG.info("Input model: {}", ModelStatistics.of(model));
        }
        final List<ModelDefect> defects = new ArrayList<>();
        final List<DomainConstraint> domainConstraints = new ArrayList<>();

        final int sanitized = AnnotationSanitizer.apply(model);
        LOG.debug("Phase 1: dropped {} defines_var annotations", sanitized);

        if (options.regroupChains()) {
            final int folded = ChainRegrouper.apply(model, VariableOccurrences.of(model));
            LOG.debug("Phase 2: folded {} max/min chains", folded);
        }

        final Targets targets = TargetMarker.apply(model);
        LOG.debug("Phase 3: {} candidates, {} orphans", targets.candidates().size(), targets.orphans().size());

        final AliasMap aliasMap = new AliasMap(CanonicalReferences.of(model));
        final AliasUnifier unifier = new AliasUnifier(model, aliasMap, defects, domainConstraints);
        if (options.discoverAliases()) {
            final int discovered = unifier.discoverAliases(targets);
            LOG.debug("Phase 4: discovered {} aliases", discovered);
        }
        unifier.resolveAndApplyAliases();

        final RewriteEngine engine = new RewriteEngine(options.maxPresolveSweeps());
        final int sweeps = engine.apply(model, unifier, defects);
        unifier.verify(RewriteEngine.PHASE);
        LOG.debug("Phase 5: rewrite fixpoint reached after {} sweeps", sweeps);

        final DependencyGraph graph = DependencyGraphBuilder.apply(model);
        LOG.debug("Phase 6: {} variables defined by constraints", graph.candidates().size());

        final Schedule schedule = new TopologicalScheduler(options.cycleBreakTieBreak()).apply(model, aliasMap);
        LOG.debug("Phase 7: scheduled {} constraints, broke {} cycles", schedule.order().size(),
                  schedule.cyclesBroken());

        final Set<VarRef> computed = ComputedVariableClassifier.apply(model, schedule, options.detectHiddenSums());
        LOG.debug("Phase 8: {} computed variables", computed.size());

        for (final ConstraintSpec ct: schedule.order()) {
            final VarRef defined = ct.getDefinedArg();
            if (defined != null && ct.getKind().canDefine()) {
                ct.setDefinesVar(defined);
            } else {
                ct.removeDefinesVar();
            }
        }
        final CompiledModel compiled = new CompiledModel(model, schedule, computed, aliasMap, domainConstraints,
                                                         defects);
        if (!defects.isEmpty()) {
            LOG.warn("Model is infeasible: {} defects found", defects.size());
        }
        if (options.printStatistics()) {
            LOG.info("Compiled model: {}", ModelStatistics.of(compiled));
        }
        LOG.info("Compilation took {}ns", System.nanoTime() - start);
        return compiled;
    }
}

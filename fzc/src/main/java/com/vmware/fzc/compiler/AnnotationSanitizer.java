/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler;

import com.vmware.fzc.model.ConstraintKind;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.FlatModel;
import com.vmware.fzc.model.Node;
import com.vmware.fzc.model.Nodes;
import com.vmware.fzc.model.ReferenceCollector;
import com.vmware.fzc.model.VarRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

/**
 * Removes {@code defines_var} annotations that cannot be honoured, so that every variable is claimed by at
 * most one constraint and every constraint claims at most one variable.
 */
final class AnnotationSanitizer {
    private static final Logger LOG = LoggerFactory.getLogger(AnnotationSanitizer.class);

    private AnnotationSanitizer() {
    }

    /**
     * @return the number of annotations removed
     */
    static int apply(final FlatModel model) {
        int removed = 0;
        final Map<VarRef, List<ConstraintSpec>> claims = new LinkedHashMap<>();
        for (final ConstraintSpec ct: model.constraints()) {
            if (ct.isNullified()) {
                continue;
            }
            removed += keepFirstDefinesVar(ct);
            final VarRef target = ct.definesVar();
            if (target == null) {
                continue;
            }
            final String reason = rejection(model, ct, target);
            if (reason != null) {
                LOG.debug("Dropping defines_var({}) from {}: {}", model.variable(target).getName(), ct, reason);
                ct.removeDefinesVar();
                removed++;
                continue;
            }
            claims.computeIfAbsent(target, k -> new ArrayList<>()).add(ct);
        }
        for (final Map.Entry<VarRef, List<ConstraintSpec>> entry: claims.entrySet()) {
            final List<ConstraintSpec> claimants = entry.getValue();
            if (claimants.size() < 2) {
                continue;
            }
            claimants.sort(Comparator.comparingInt(AnnotationSanitizer::weight)
                                     .thenComparingInt(ConstraintSpec::getIndex));
            for (final ConstraintSpec ct: claimants.subList(1, claimants.size())) {
                LOG.debug("Dropping duplicate defines_var({}) from {}", model.variable(entry.getKey()).getName(), ct);
                ct.removeDefinesVar();
                removed++;
            }
        }
        return removed;
    }

    /**
     * Preference among constraints claiming the same variable, lowest first: the number of variable
     * arguments, plus 100 unless the constraint is reified.
     */
    static int weight(final ConstraintSpec ct) {
        int weight = ct.getKind().isReified() ? 0 : 100;
        for (final Node arg: ct.getArgs()) {
            weight += ReferenceCollector.collect(arg).size();
        }
        return weight;
    }

    private static int keepFirstDefinesVar(final ConstraintSpec ct) {
        final List<Node> kept = new ArrayList<>();
        boolean seen = false;
        int dropped = 0;
        for (final Node annotation: ct.getAnnotations()) {
            if (Nodes.definesVarTarget(annotation) != null) {
                if (seen) {
                    dropped++;
                    continue;
                }
                seen = true;
            }
            kept.add(annotation);
        }
        if (dropped > 0) {
            ct.setAnnotations(kept);
        }
        return dropped;
    }

    @Nullable
    private static String rejection(final FlatModel model, final ConstraintSpec ct, final VarRef target) {
        if (!ct.getKind().canDefine()) {
            return "constraint cannot define a variable";
        }
        if (!ct.variables().contains(target)) {
            return "variable is not an argument";
        }
        if (model.variable(target).isFixed()) {
            return "variable is fixed";
        }
        final ConstraintKind kind = ct.getKind();
        if ((kind == ConstraintKind.ARRAY_VAR_INT_ELEMENT || kind == ConstraintKind.ARRAY_VAR_BOOL_ELEMENT)
                && ct.arity() > 1 && ReferenceCollector.collect(ct.arg(1)).contains(target)) {
            return "variable is an element of the array";
        }
        return null;
    }
}

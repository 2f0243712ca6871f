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
import com.vmware.fzc.model.VarRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

import javax.annotation.Nullable;

/**
 * Finds the variables whose value follows from a scheduled constraint, so that they need not become
 * decision variables.
 *
 * Every scheduled constraint's defined variable is computed. In addition, an {@code int_lin_eq} that defines
 * nothing but has a hidden sum shape, a first or last term with coefficient +1 or -1 while all other
 * coefficients share one sign, computes that term, provided no earlier constraint in the schedule uses it.
 */
final class ComputedVariableClassifier {
    private static final Logger LOG = LoggerFactory.getLogger(ComputedVariableClassifier.class);

    private ComputedVariableClassifier() {
    }

    static Set<VarRef> apply(final FlatModel model, final Schedule schedule, final boolean detectHiddenSums) {
        final Set<VarRef> computed = new LinkedHashSet<>();
        for (final ConstraintSpec ct: schedule.order()) {
            if (ct.getDefinedArg() != null) {
                computed.add(ct.getDefinedArg());
            }
        }
        if (!detectHiddenSums) {
            return computed;
        }
        final Set<VarRef> seen = new HashSet<>();
        for (final ConstraintSpec ct: schedule.order()) {
            if (ct.getDefinedArg() == null) {
                final VarRef hidden = hiddenSumTarget(model, ct);
                if (hidden != null && !seen.contains(hidden) && !computed.contains(hidden)
                        && !schedule.forced().contains(hidden)) {
                    LOG.debug("{} computes {}", ct, model.variable(hidden).getName());
                    ct.setDefinedArg(hidden);
                    computed.add(hidden);
                }
            }
            seen.addAll(ct.variables());
        }
        return computed;
    }

    @Nullable
    static VarRef hiddenSumTarget(final FlatModel model, final ConstraintSpec ct) {
        if (ct.getKind() != ConstraintKind.INT_LIN_EQ || ct.arity() != 3 || !Nodes.isIntArray(ct.arg(0))
                || !(ct.arg(1) instanceof ArrayNode) || !(ct.arg(2) instanceof IntLiteral)) {
            return null;
        }
        final long[] coefficients = Nodes.intValues(ct.arg(0));
        final ArrayNode terms = (ArrayNode) ct.arg(1);
        final int n = coefficients.length;
        if (n < 2 || terms.size() != n) {
            return null;
        }
        final VarRef first = candidate(model, coefficients, terms, 0);
        return first != null ? first : candidate(model, coefficients, terms, n - 1);
    }

    @Nullable
    private static VarRef candidate(final FlatModel model, final long[] coefficients, final ArrayNode terms,
                                    final int position) {
        if (Math.abs(coefficients[position]) != 1 || !terms.get(position).isVarRef()) {
            return null;
        }
        int sign = 0;
        for (int i = 0; i < coefficients.length; i++) {
            if (i == position) {
                continue;
            }
            final int s = Long.signum(coefficients[i]);
            if (s == 0 || (sign != 0 && s != sign)) {
                return null;
            }
            sign = s;
        }
        final VarRef var = (VarRef) terms.get(position);
        for (int i = 0; i < terms.size(); i++) {
            final Node term = terms.get(i);
            if (i != position && term.equals(var)) {
                return null;
            }
        }
        return model.variable(var).isFixed() ? null : var;
    }
}

/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler.presolve;

import com.google.common.math.LongMath;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.Node;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Puts a linear constraint in normal form: repeated variables are merged into one term, fixed terms are
 * moved to the right-hand side and terms with a zero coefficient are dropped.
 */
final class RegroupLinearTermsRule implements RewriteRule {

    @Override
    public boolean rewrite(final ConstraintSpec ct, final PresolveContext context) {
        final LinearExpression linear = LinearExpression.of(ct);
        if (linear == null) {
            return false;
        }
        final Map<Node, Long> merged = new LinkedHashMap<>();
        long rhs = linear.rhs;
        for (int i = 0; i < linear.size(); i++) {
            final Node term = linear.terms.get(i);
            final long c = linear.coefficients[i];
            if (context.isFixed(term)) {
                rhs = LongMath.saturatedSubtract(rhs, LongMath.saturatedMultiply(c, context.value(term)));
            } else {
                merged.merge(term, c, Long::sum);
            }
        }
        merged.values().removeIf(c -> c == 0);
        if (merged.size() == linear.size() && rhs == linear.rhs) {
            return false;
        }
        final long[] coefficients = new long[merged.size()];
        final List<Node> terms = new ArrayList<>(merged.size());
        int i = 0;
        for (final Map.Entry<Node, Long> entry: merged.entrySet()) {
            terms.add(entry.getKey());
            coefficients[i++] = entry.getValue();
        }
        ct.transition(ct.getKind(), new LinearExpression(coefficients, terms, rhs, linear.literal).toArgs());
        return true;
    }
}

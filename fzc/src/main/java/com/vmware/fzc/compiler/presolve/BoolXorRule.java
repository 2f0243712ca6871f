/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler.presolve;

import com.google.common.collect.ImmutableList;
import com.vmware.fzc.model.ConstraintKind;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.Node;

/**
 * {@code bool_xor(a, b, c)} with one constant operand becomes {@code bool_not} or {@code bool_eq} between
 * the two others.
 */
final class BoolXorRule implements RewriteRule {

    @Override
    public boolean rewrite(final ConstraintSpec ct, final PresolveContext context) {
        if (ct.getKind() != ConstraintKind.BOOL_XOR || ct.arity() != 3) {
            return false;
        }
        for (int i = 2; i >= 0; i--) {
            final Node constant = ct.arg(i);
            if (!context.isFixed(constant)) {
                continue;
            }
            final ImmutableList.Builder<Node> others = ImmutableList.builder();
            for (int j = 0; j < 3; j++) {
                if (j != i) {
                    others.add(ct.arg(j));
                }
            }
            ct.transition(context.value(constant) != 0 ? ConstraintKind.BOOL_NOT : ConstraintKind.BOOL_EQ,
                          others.build());
            return true;
        }
        return false;
    }
}

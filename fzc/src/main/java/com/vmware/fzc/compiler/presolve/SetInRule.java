/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler.presolve;

import com.vmware.fzc.model.ConstraintKind;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.SetLiteral;
import com.vmware.fzc.model.VariableSpec.NarrowResult;

/**
 * {@code set_in(x, S)} with a constant set is absorbed into the domain of {@code x}.
 */
final class SetInRule implements RewriteRule {

    @Override
    public boolean rewrite(final ConstraintSpec ct, final PresolveContext context) {
        if (ct.getKind() != ConstraintKind.SET_IN || ct.arity() != 2 || !(ct.arg(1) instanceof SetLiteral)) {
            return false;
        }
        final SetLiteral values = (SetLiteral) ct.arg(1);
        if (context.isFixed(ct.arg(0)) && !values.getValues().contains(context.value(ct.arg(0)))) {
            context.fail(ct);
            return true;
        }
        if (context.narrow(ct, ct.arg(0), values.getValues()) != NarrowResult.EMPTY) {
            context.nullify(ct);
        }
        return true;
    }
}

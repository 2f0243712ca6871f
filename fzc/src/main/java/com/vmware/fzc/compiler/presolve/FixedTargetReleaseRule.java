/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler.presolve;

import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.VarRef;

/**
 * A constraint stops defining a variable once that variable is fixed.
 */
final class FixedTargetReleaseRule implements RewriteRule {

    @Override
    public boolean rewrite(final ConstraintSpec ct, final PresolveContext context) {
        final VarRef target = ct.definesVar();
        if (target == null || !context.spec(target).isFixed()) {
            return false;
        }
        return ct.removeDefinesVar();
    }
}

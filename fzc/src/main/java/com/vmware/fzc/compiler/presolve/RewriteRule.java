/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler.presolve;

import com.vmware.fzc.model.ConstraintSpec;

/**
 * A local rewrite of one constraint. A rule may narrow the domains of the constraint's variables,
 * nullify the constraint, or change its kind and arguments; it must not touch other constraints.
 *
 * Rules are idempotent: applied to their own output they report no change.
 */
public interface RewriteRule {

    /**
     * Applies the rule to an active constraint.
     *
     * @return true if the constraint or the domain of one of its variables changed
     */
    boolean rewrite(ConstraintSpec ct, PresolveContext context);
}

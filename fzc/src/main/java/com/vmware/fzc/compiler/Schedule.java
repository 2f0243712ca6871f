/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.VarRef;

import java.util.List;
import java.util.Set;

/**
 * A total order of the active constraints. Every constraint's requirements are defined by an earlier
 * constraint, except for the {@link #forced() forced} variables, which were declared defined to break a
 * dependency cycle and are no longer defined by any constraint.
 */
public final class Schedule {
    private final ImmutableList<ConstraintSpec> order;
    private final ImmutableSet<VarRef> forced;
    private final int cyclesBroken;

    Schedule(final List<ConstraintSpec> order, final Set<VarRef> forced, final int cyclesBroken) {
        this.order = ImmutableList.copyOf(order);
        this.forced = ImmutableSet.copyOf(forced);
        this.cyclesBroken = cyclesBroken;
    }

    public List<ConstraintSpec> order() {
        return order;
    }

    public Set<VarRef> forced() {
        return forced;
    }

    public int cyclesBroken() {
        return cyclesBroken;
    }

    /**
     * Position of the constraint with the given index in the schedule, or -1.
     */
    public int positionOf(final int constraintIndex) {
        for (int i = 0; i < order.size(); i++) {
            if (order.get(i).getIndex() == constraintIndex) {
                return i;
            }
        }
        return -1;
    }
}

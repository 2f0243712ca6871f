/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler;

import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.FlatModel;
import com.vmware.fzc.model.VarKind;
import com.vmware.fzc.model.VarRef;
import com.vmware.fzc.model.VariableSpec;

import java.util.LinkedHashSet;
import java.util.Set;

final class TargetMarker {

    private TargetMarker() {
    }

    static Targets apply(final FlatModel model) {
        final Set<VarRef> candidates = new LinkedHashSet<>();
        for (final ConstraintSpec ct: model.constraints()) {
            final VarRef target = ct.isActive() ? ct.definesVar() : null;
            if (target != null) {
                candidates.add(target);
            }
        }
        final Set<VarRef> orphans = new LinkedHashSet<>();
        for (final VarKind kind: new VarKind[]{VarKind.INT, VarKind.BOOL}) {
            for (final VariableSpec spec: model.variables(kind)) {
                if (spec.isIntroduced() && !spec.isAliased() && !spec.isFixed()
                        && !candidates.contains(spec.getRef())) {
                    orphans.add(spec.getRef());
                }
            }
        }
        return new Targets(candidates, orphans);
    }
}

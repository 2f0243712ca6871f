/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler;

import com.vmware.fzc.model.VarRef;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Variables some constraint proposes to define (candidates), and introduced variables nothing defines yet
 * (orphans).
 */
public final class Targets {
    private final Set<VarRef> candidates;
    private final Set<VarRef> orphans;

    Targets(final Set<VarRef> candidates, final Set<VarRef> orphans) {
        this.candidates = new LinkedHashSet<>(candidates);
        this.orphans = new LinkedHashSet<>(orphans);
    }

    public boolean isCandidate(final VarRef var) {
        return candidates.contains(var);
    }

    public boolean isOrphan(final VarRef var) {
        return orphans.contains(var);
    }

    public Set<VarRef> candidates() {
        return Collections.unmodifiableSet(candidates);
    }

    public Set<VarRef> orphans() {
        return Collections.unmodifiableSet(orphans);
    }

    void addCandidate(final VarRef var) {
        candidates.add(var);
        orphans.remove(var);
    }

    void removeOrphan(final VarRef var) {
        orphans.remove(var);
    }
}

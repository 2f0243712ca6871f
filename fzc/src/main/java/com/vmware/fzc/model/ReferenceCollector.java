/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.model;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects every variable referenced from a term, in order of first appearance.
 */
public final class ReferenceCollector extends NodeVisitor<Void, Set<VarRef>> {
    private static final ReferenceCollector INSTANCE = new ReferenceCollector();

    private ReferenceCollector() {
    }

    public static Set<VarRef> collect(final Node node) {
        final Set<VarRef> refs = new LinkedHashSet<>();
        INSTANCE.visit(node, refs);
        return refs;
    }

    public static Set<VarRef> collect(final Collection<Node> nodes) {
        final Set<VarRef> refs = new LinkedHashSet<>();
        for (final Node node: nodes) {
            INSTANCE.visit(node, refs);
        }
        return refs;
    }

    @Override
    protected Void visitVarRef(final VarRef node, final Set<VarRef> context) {
        context.add(node);
        return null;
    }
}

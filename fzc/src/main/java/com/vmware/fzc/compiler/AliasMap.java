/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler;

import com.vmware.fzc.ModelException;
import com.vmware.fzc.model.CanonicalReferences;
import com.vmware.fzc.model.VarKind;
import com.vmware.fzc.model.VarRef;

import java.util.EnumMap;
import java.util.Map;

/**
 * Union-find over the variables of each kind: {@link #find(VarRef)} returns the root a variable is an
 * alias of, or the variable itself. Paths are compressed on lookup.
 */
public final class AliasMap {
    private final CanonicalReferences references;
    private final Map<VarKind, int[]> parents = new EnumMap<>(VarKind.class);
    private final Map<VarKind, boolean[]> hasAliases = new EnumMap<>(VarKind.class);
    private int size = 0;

    public AliasMap(final CanonicalReferences references) {
        this.references = references;
        for (final VarKind kind: VarKind.values()) {
            final int[] parent = new int[references.size(kind)];
            for (int i = 0; i < parent.length; i++) {
                parent[i] = i;
            }
            parents.put(kind, parent);
            hasAliases.put(kind, new boolean[parent.length]);
        }
    }

    public VarRef find(final VarRef var) {
        final VarRef canonical = references.canonical(var);
        final int root = find(parents.get(var.getKind()), canonical.getIndex());
        return root == canonical.getIndex() ? canonical : references.canonical(var.getKind(), root);
    }

    private static int find(final int[] parent, final int index) {
        int root = index;
        while (parent[root] != root) {
            root = parent[root];
        }
        int current = index;
        while (parent[current] != root) {
            final int next = parent[current];
            parent[current] = root;
            current = next;
        }
        return root;
    }

    /**
     * Records {@code alias} as an alias of {@code target}'s root.
     *
     * @return false if both already have the same root
     * @throws ModelException if the variables are of different kinds
     */
    public boolean union(final VarRef alias, final VarRef target) {
        if (alias.getKind() != target.getKind()) {
            throw ModelException.invariant("alias-map", "cannot alias variables of different kinds, index",
                                           alias.getIndex());
        }
        final int[] parent = parents.get(alias.getKind());
        final int from = find(parent, references.canonical(alias).getIndex());
        final int to = find(parent, references.canonical(target).getIndex());
        if (from == to) {
            return false;
        }
        parent[from] = to;
        hasAliases.get(alias.getKind())[to] = true;
        size++;
        return true;
    }

    public boolean isAliased(final VarRef var) {
        return !find(var).equals(var);
    }

    /**
     * Whether some other variable resolves to this root.
     */
    public boolean hasAliases(final VarRef root) {
        return isRoot(root) && hasAliases.get(root.getKind())[root.getIndex()];
    }

    private boolean isRoot(final VarRef var) {
        return find(var).equals(var);
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Number of variables that are aliases of another one.
     */
    public int size() {
        return size;
    }
}

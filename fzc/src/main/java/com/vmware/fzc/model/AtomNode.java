/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.model;

public final class AtomNode extends Node {
    private final String name;

    public AtomNode(final String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    <T, C> T acceptVisitor(final NodeVisitor<T, C> visitor, final C context) {
        return visitor.visitAtom(this, context);
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof AtomNode && ((AtomNode) o).name.equals(name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}

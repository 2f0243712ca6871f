/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.model;

import com.google.common.collect.ImmutableList;

import java.util.List;

public final class ArrayNode extends Node {
    private final ImmutableList<Node> elements;

    public ArrayNode(final List<? extends Node> elements) {
        this.elements = ImmutableList.copyOf(elements);
    }

    public List<Node> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    public Node get(final int i) {
        return elements.get(i);
    }

    @Override
    <T, C> T acceptVisitor(final NodeVisitor<T, C> visitor, final C context) {
        return visitor.visitArray(this, context);
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof ArrayNode && ((ArrayNode) o).elements.equals(elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return elements.toString();
    }
}

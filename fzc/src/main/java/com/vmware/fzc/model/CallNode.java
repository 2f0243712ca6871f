/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.model;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * A function-call term, {@code name(arg, ...)}. Used for annotations such as {@code defines_var(x)}.
 */
public final class CallNode extends Node {
    private final String name;
    private final ImmutableList<Node> arguments;

    public CallNode(final String name, final List<? extends Node> arguments) {
        this.name = name;
        this.arguments = ImmutableList.copyOf(arguments);
    }

    public String getName() {
        return name;
    }

    public List<Node> getArguments() {
        return arguments;
    }

    @Override
    <T, C> T acceptVisitor(final NodeVisitor<T, C> visitor, final C context) {
        return visitor.visitCall(this, context);
    }

    @Override
    public boolean equals(final Object o) {
        if (!(o instanceof CallNode)) {
            return false;
        }
        final CallNode that = (CallNode) o;
        return name.equals(that.name) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arguments);
    }

    @Override
    public String toString() {
        return name + arguments;
    }
}

/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.model;

/**
 * A constant set of integers, either an interval or an explicit list of values.
 */
public final class SetLiteral extends Node {
    private final Domain values;

    public SetLiteral(final Domain values) {
        this.values = values;
    }

    public Domain getValues() {
        return values;
    }

    @Override
    public boolean isLiteral() {
        return true;
    }

    @Override
    <T, C> T acceptVisitor(final NodeVisitor<T, C> visitor, final C context) {
        return visitor.visitSetLiteral(this, context);
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof SetLiteral && ((SetLiteral) o).values.equals(values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}

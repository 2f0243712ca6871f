/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.model;

public final class BoolLiteral extends Node {
    public static final BoolLiteral TRUE = new BoolLiteral(true);
    public static final BoolLiteral FALSE = new BoolLiteral(false);
    private final boolean value;

    private BoolLiteral(final boolean value) {
        this.value = value;
    }

    public static BoolLiteral of(final boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public boolean isLiteral() {
        return true;
    }

    @Override
    <T, C> T acceptVisitor(final NodeVisitor<T, C> visitor, final C context) {
        return visitor.visitBoolLiteral(this, context);
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof BoolLiteral && ((BoolLiteral) o).value == value;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}

/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.model;

/**
 * A reference to a declared variable. It carries nothing but the variable's kind and its index in
 * the {@link VariableTable} of that kind, and compares by exactly those two values.
 *
 * Instances are only created when a variable is declared; every later lookup goes through
 * {@link CanonicalReferences}.
 */
public abstract class VarRef extends Node {
    private final int index;

    VarRef(final int index) {
        this.index = index;
    }

    public int getIndex() {
        return index;
    }

    public abstract VarKind getKind();

    @Override
    public boolean isVarRef() {
        return true;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return index == ((VarRef) o).index;
    }

    @Override
    public int hashCode() {
        return 31 * getKind().ordinal() + index;
    }

    @Override
    public String toString() {
        return getKind().name().toLowerCase() + "#" + index;
    }
}

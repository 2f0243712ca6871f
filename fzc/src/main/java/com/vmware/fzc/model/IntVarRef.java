/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.model;

public final class IntVarRef extends VarRef {

    IntVarRef(final int index) {
        super(index);
    }

    @Override
    public VarKind getKind() {
        return VarKind.INT;
    }

    @Override
    <T, C> T acceptVisitor(final NodeVisitor<T, C> visitor, final C context) {
        return visitor.visitIntVarRef(this, context);
    }
}

/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.model;

import javax.annotation.Nullable;

/**
 * Walks a {@link Node} tree. The default implementation descends into arrays and calls and returns
 * {@link #defaultReturn()} everywhere else.
 */
public class NodeVisitor<T, C> {

    @Nullable
    public T visit(final Node node, final C context) {
        return node.acceptVisitor(this, context);
    }

    @Nullable
    protected T visitIntLiteral(final IntLiteral node, final C context) {
        return defaultReturn();
    }

    @Nullable
    protected T visitBoolLiteral(final BoolLiteral node, final C context) {
        return defaultReturn();
    }

    @Nullable
    protected T visitFloatLiteral(final FloatLiteral node, final C context) {
        return defaultReturn();
    }

    @Nullable
    protected T visitSetLiteral(final SetLiteral node, final C context) {
        return defaultReturn();
    }

    @Nullable
    protected T visitIntVarRef(final IntVarRef node, final C context) {
        return visitVarRef(node, context);
    }

    @Nullable
    protected T visitBoolVarRef(final BoolVarRef node, final C context) {
        return visitVarRef(node, context);
    }

    @Nullable
    protected T visitSetVarRef(final SetVarRef node, final C context) {
        return visitVarRef(node, context);
    }

    @Nullable
    protected T visitVarRef(final VarRef node, final C context) {
        return defaultReturn();
    }

    @Nullable
    protected T visitArray(final ArrayNode node, final C context) {
        for (final Node element: node.getElements()) {
            element.acceptVisitor(this, context);
        }
        return defaultReturn();
    }

    @Nullable
    protected T visitCall(final CallNode node, final C context) {
        for (final Node argument: node.getArguments()) {
            argument.acceptVisitor(this, context);
        }
        return defaultReturn();
    }

    @Nullable
    protected T visitAtom(final AtomNode node, final C context) {
        return defaultReturn();
    }

    @Nullable
    protected T visitString(final StringNode node, final C context) {
        return defaultReturn();
    }

    @Nullable
    protected T defaultReturn() {
        return null;
    }
}

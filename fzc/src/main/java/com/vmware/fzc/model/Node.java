/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.model;

/**
 * A term of a flat model: a literal, a variable reference, an array, a call, an atom or a string.
 * Nodes are immutable; passes that change a term build a new one (see {@link NodeRewriter}).
 */
public abstract class Node {

    abstract <T, C> T acceptVisitor(NodeVisitor<T, C> visitor, C context);

    public boolean isVarRef() {
        return false;
    }

    public boolean isLiteral() {
        return false;
    }
}

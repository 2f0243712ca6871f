/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rebuilds a {@link Node} tree bottom-up. Leaves are returned as they are; arrays and calls are
 * rebuilt only when one of their children changed, so an untouched tree comes back identical.
 */
public class NodeRewriter extends NodeVisitor<Node, VoidType> {

    public Node visit(final Node node) {
        return Objects.requireNonNull(super.visit(node, VoidType.getAbsent()));
    }

    public List<Node> visitAll(final List<Node> nodes) {
        final List<Node> result = new ArrayList<>(nodes.size());
        for (final Node node: nodes) {
            result.add(visit(node));
        }
        return result;
    }

    @Override
    protected Node visitIntLiteral(final IntLiteral node, final VoidType context) {
        return node;
    }

    @Override
    protected Node visitBoolLiteral(final BoolLiteral node, final VoidType context) {
        return node;
    }

    @Override
    protected Node visitFloatLiteral(final FloatLiteral node, final VoidType context) {
        return node;
    }

    @Override
    protected Node visitSetLiteral(final SetLiteral node, final VoidType context) {
        return node;
    }

    @Override
    protected Node visitVarRef(final VarRef node, final VoidType context) {
        return node;
    }

    @Override
    protected Node visitArray(final ArrayNode node, final VoidType context) {
        final List<Node> elements = visitAll(node.getElements());
        return elements.equals(node.getElements()) ? node : new ArrayNode(elements);
    }

    @Override
    protected Node visitCall(final CallNode node, final VoidType context) {
        final List<Node> arguments = visitAll(node.getArguments());
        return arguments.equals(node.getArguments()) ? node : new CallNode(node.getName(), arguments);
    }

    @Override
    protected Node visitAtom(final AtomNode node, final VoidType context) {
        return node;
    }

    @Override
    protected Node visitString(final StringNode node, final VoidType context) {
        return node;
    }
}

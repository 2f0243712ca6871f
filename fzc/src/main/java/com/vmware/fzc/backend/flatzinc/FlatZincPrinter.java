/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.backend.flatzinc;

import com.vmware.fzc.model.ArrayNode;
import com.vmware.fzc.model.AtomNode;
import com.vmware.fzc.model.BoolLiteral;
import com.vmware.fzc.model.CallNode;
import com.vmware.fzc.model.Domain;
import com.vmware.fzc.model.FlatModel;
import com.vmware.fzc.model.FloatLiteral;
import com.vmware.fzc.model.IntLiteral;
import com.vmware.fzc.model.Node;
import com.vmware.fzc.model.NodeVisitor;
import com.vmware.fzc.model.SetLiteral;
import com.vmware.fzc.model.StringNode;
import com.vmware.fzc.model.VarRef;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders a node as FlatZinc text. Variable references print as the variable's name.
 */
class FlatZincPrinter extends NodeVisitor<String, FlatModel> {

    @Override
    public String visit(final Node node, final FlatModel model) {
        return Objects.requireNonNull(super.visit(node, model));
    }

    String visitAll(final List<Node> nodes, final FlatModel model, final String separator) {
        return nodes.stream().map(n -> visit(n, model)).collect(Collectors.joining(separator));
    }

    @Override
    protected String visitIntLiteral(final IntLiteral node, final FlatModel model) {
        return String.valueOf(node.getValue());
    }

    @Override
    protected String visitBoolLiteral(final BoolLiteral node, final FlatModel model) {
        return String.valueOf(node.getValue());
    }

    @Override
    protected String visitFloatLiteral(final FloatLiteral node, final FlatModel model) {
        return String.valueOf(node.getValue());
    }

    @Override
    protected String visitSetLiteral(final SetLiteral node, final FlatModel model) {
        return domain(node.getValues());
    }

    @Override
    protected String visitVarRef(final VarRef node, final FlatModel model) {
        return model.variable(node).getName();
    }

    @Override
    protected String visitArray(final ArrayNode node, final FlatModel model) {
        return "[" + visitAll(node.getElements(), model, ", ") + "]";
    }

    @Override
    protected String visitCall(final CallNode node, final FlatModel model) {
        return node.getName() + "(" + visitAll(node.getArguments(), model, ", ") + ")";
    }

    @Override
    protected String visitAtom(final AtomNode node, final FlatModel model) {
        return node.getName();
    }

    @Override
    protected String visitString(final StringNode node, final FlatModel model) {
        return "\"" + node.getValue().replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    /**
     * FlatZinc has no syntax for a partially bounded or unbounded set of values, so such domains print as
     * {@code int}.
     */
    static String domain(final Domain domain) {
        if (domain.isEmpty()) {
            return "{}";
        }
        if (domain.isInterval() && domain.isBounded()) {
            return domain.min() + ".." + domain.max();
        }
        if (!domain.isBounded()) {
            return "int";
        }
        return domain.values().stream().map(String::valueOf).collect(Collectors.joining(",", "{", "}"));
    }
}

/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler.presolve;

import com.google.common.collect.ImmutableList;
import com.vmware.fzc.model.ArrayNode;
import com.vmware.fzc.model.ConstraintKind;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.Domain;
import com.vmware.fzc.model.Node;
import com.vmware.fzc.model.VariableSpec.NarrowResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Element constraints {@code array_*_element(index, array, result)}, with a 1-based index. The index is
 * kept within the array; over a constant array the result is kept to the reachable values and the index to
 * the positions that hold a possible result. A fixed index over an array of variables turns the constraint
 * into an equality.
 */
final class ElementIndexBoundsRule implements RewriteRule {

    @Override
    public boolean rewrite(final ConstraintSpec ct, final PresolveContext context) {
        final ConstraintKind kind = ct.getKind();
        final boolean variableArray = kind == ConstraintKind.ARRAY_VAR_INT_ELEMENT
                || kind == ConstraintKind.ARRAY_VAR_BOOL_ELEMENT;
        if ((!variableArray && kind != ConstraintKind.ARRAY_INT_ELEMENT && kind != ConstraintKind.ARRAY_BOOL_ELEMENT)
                || ct.arity() != 3 || !(ct.arg(1) instanceof ArrayNode)) {
            return false;
        }
        final Node index = ct.arg(0);
        final ArrayNode array = (ArrayNode) ct.arg(1);
        final Node result = ct.arg(2);
        final NarrowResult inRange = context.narrow(ct, index, Domain.interval(1, array.size()));
        if (inRange == NarrowResult.EMPTY) {
            return true;
        }
        boolean changed = inRange == NarrowResult.NARROWED;
        if (variableArray) {
            if (context.isFixed(index)) {
                final Node selected = array.get((int) context.value(index) - 1);
                ct.transition(kind == ConstraintKind.ARRAY_VAR_INT_ELEMENT ? ConstraintKind.INT_EQ
                                                                           : ConstraintKind.BOOL_EQ,
                              ImmutableList.of(selected, result));
                return true;
            }
            return changed;
        }
        if (!array.getElements().stream().allMatch(context::isFixed)) {
            return changed;
        }
        final List<Long> reachable = new ArrayList<>();
        for (final long position: context.domain(index).values()) {
            reachable.add(context.value(array.get((int) position - 1)));
        }
        final NarrowResult values = context.narrow(ct, result, Domain.of(reachable));
        if (values == NarrowResult.EMPTY) {
            return true;
        }
        changed |= values == NarrowResult.NARROWED;
        if (context.isFixed(index)) {
            context.nullify(ct);
            return true;
        }
        final Domain results = context.domain(result);
        final List<Long> positions = new ArrayList<>();
        for (final long position: context.domain(index).values()) {
            if (results.contains(context.value(array.get((int) position - 1)))) {
                positions.add(position);
            }
        }
        final NarrowResult supported = context.narrow(ct, index, Domain.of(positions));
        return changed || supported != NarrowResult.UNCHANGED;
    }
}

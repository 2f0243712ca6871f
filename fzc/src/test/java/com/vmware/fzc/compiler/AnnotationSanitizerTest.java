/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler;

import com.vmware.fzc.model.AtomNode;
import com.vmware.fzc.model.BoolVarRef;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.FlatModel;
import com.vmware.fzc.model.IntVarRef;
import com.vmware.fzc.model.Node;
import com.vmware.fzc.model.Nodes;
import com.vmware.fzc.model.VarKind;
import com.vmware.fzc.model.VariableSpec;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class AnnotationSanitizerTest {

    private static ConstraintSpec add(final FlatModel model, final String name, final List<Node> args,
                                      final Node... annotations) {
        return model.addConstraint(name, args, List.of(annotations));
    }

    @Test
    public void keepsOnlyTheFirstDesignation() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x");
        final IntVarRef y = model.newIntVar("y");
        final IntVarRef z = model.newIntVar("z");
        final AtomNode domain = new AtomNode("domain");
        final ConstraintSpec ct = add(model, "int_plus", List.of(x, y, z), Nodes.definesVar(z), domain,
                                      Nodes.definesVar(x));
        assertEquals(1, AnnotationSanitizer.apply(model));
        assertEquals(List.of(Nodes.definesVar(z), domain), ct.getAnnotations());
    }

    @Test
    public void dropsDesignationsThatCannotBeHonoured() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x", 0, 10);
        final IntVarRef y = model.newIntVar("y", 0, 10);
        final IntVarRef fixed = (IntVarRef) model.addVariable(VariableSpec.builder(VarKind.INT, "c").setValue(4));
        final IntVarRef i = model.newIntVar("i", 1, 2);
        final ConstraintSpec comparison = add(model, "int_le", List.of(x, y), Nodes.definesVar(x));
        final ConstraintSpec notAnArgument = add(model, "int_eq", List.of(x, y), Nodes.definesVar(i));
        final ConstraintSpec onFixed = add(model, "int_plus", List.of(x, y, fixed), Nodes.definesVar(fixed));
        final ConstraintSpec onElement = add(model, "array_var_int_element", List.of(i, Nodes.array(x, y), y),
                                             Nodes.definesVar(y));

        assertEquals(4, AnnotationSanitizer.apply(model));
        assertNull(comparison.definesVar());
        assertNull(notAnArgument.definesVar());
        assertNull(onFixed.definesVar());
        assertNull(onElement.definesVar());
    }

    @Test
    public void lightestClaimWins() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x");
        final IntVarRef y = model.newIntVar("y");
        final IntVarRef z = model.newIntVar("z");
        final BoolVarRef b = model.newBoolVar("b");
        final ConstraintSpec plus = add(model, "int_plus", List.of(y, z, x), Nodes.definesVar(x));
        final ConstraintSpec eq = add(model, "int_eq", List.of(x, y), Nodes.definesVar(x));
        final ConstraintSpec first = add(model, "int_eq_reif", List.of(y, Nodes.literal(1), b), Nodes.definesVar(b));
        final ConstraintSpec second = add(model, "int_eq_reif", List.of(z, Nodes.literal(1), b), Nodes.definesVar(b));

        assertEquals(103, AnnotationSanitizer.weight(plus));
        assertEquals(102, AnnotationSanitizer.weight(eq));
        assertEquals(2, AnnotationSanitizer.weight(first));
        assertEquals(2, AnnotationSanitizer.apply(model));
        assertNull(plus.definesVar());
        assertEquals(x, eq.definesVar());
        assertEquals(b, first.definesVar());
        assertNull(second.definesVar());
    }
}

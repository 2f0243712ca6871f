/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler;

import com.vmware.fzc.model.ConstraintKind;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.Domain;
import com.vmware.fzc.model.FlatModel;
import com.vmware.fzc.model.IntVarRef;
import com.vmware.fzc.model.Nodes;
import com.vmware.fzc.model.SolveGoal;
import com.vmware.fzc.model.VarKind;
import com.vmware.fzc.model.VariableSpec;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ChainRegrouperTest {

    private static IntVarRef introduced(final FlatModel model, final String name) {
        return (IntVarRef) model.addVariable(VariableSpec.builder(VarKind.INT, name).setIntroduced(true)
                                                         .setDomain(Domain.interval(0, 100)));
    }

    private static List<ConstraintSpec> maxChain(final FlatModel model, final IntVarRef... values) {
        final IntVarRef m = model.newIntVar("m", 0, 100);
        final IntVarRef t1 = introduced(model, "t1");
        final IntVarRef t2 = introduced(model, "t2");
        return List.of(model.addConstraint("int_max", values[0], values[0], t1),
                       model.addConstraint("int_max", values[1], t1, t2),
                       model.addConstraint("int_max", values[2], t2, m));
    }

    @Test
    public void chainIsFolded() {
        final FlatModel model = new FlatModel();
        final IntVarRef a = model.newIntVar("a", 0, 100);
        final IntVarRef b = model.newIntVar("b", 0, 100);
        final IntVarRef c = model.newIntVar("c", 0, 100);
        final List<ConstraintSpec> chain = maxChain(model, a, b, c);
        final IntVarRef m = (IntVarRef) chain.get(2).arg(2);

        assertEquals(1, ChainRegrouper.apply(model, VariableOccurrences.of(model)));

        final ConstraintSpec folded = chain.get(0);
        assertEquals(ConstraintKind.MAXIMUM_INT, folded.getKind());
        assertEquals(List.of(m, Nodes.array(a, b, c)), folded.getArgs());
        assertEquals(m, folded.definesVar());
        assertFalse(chain.get(1).isActive());
        assertFalse(chain.get(2).isActive());
        assertEquals(1, model.constraints().active().size());
    }

    @Test
    public void minChainIsFolded() {
        final FlatModel model = new FlatModel();
        final IntVarRef a = model.newIntVar("a", 0, 100);
        final IntVarRef b = model.newIntVar("b", 0, 100);
        final IntVarRef t = introduced(model, "t");
        final IntVarRef m = model.newIntVar("m", 0, 100);
        final ConstraintSpec start = model.addConstraint("int_min", a, a, t);
        model.addConstraint("int_min", b, t, m);

        assertEquals(1, ChainRegrouper.apply(model, VariableOccurrences.of(model)));
        assertEquals(ConstraintKind.MINIMUM_INT, start.getKind());
        assertEquals(List.of(m, Nodes.array(a, b)), start.getArgs());
    }

    @Test
    public void chainUsedElsewhereIsNotFolded() {
        final FlatModel model = new FlatModel();
        final IntVarRef a = model.newIntVar("a", 0, 100);
        final IntVarRef b = model.newIntVar("b", 0, 100);
        final IntVarRef c = model.newIntVar("c", 0, 100);
        final List<ConstraintSpec> chain = maxChain(model, a, b, c);
        final IntVarRef t1 = (IntVarRef) chain.get(0).arg(2);
        final ConstraintSpec unrelated = model.addConstraint("int_le", t1, Nodes.literal(50));

        assertEquals(0, ChainRegrouper.apply(model, VariableOccurrences.of(model)));
        for (final ConstraintSpec ct: chain) {
            assertTrue(ct.isActive());
            assertEquals(ConstraintKind.INT_MAX, ct.getKind());
        }
        assertTrue(unrelated.isActive());
    }

    @Test
    public void chainThroughTheGoalIsNotFolded() {
        final FlatModel model = new FlatModel();
        final IntVarRef a = model.newIntVar("a", 0, 100);
        final IntVarRef b = model.newIntVar("b", 0, 100);
        final IntVarRef c = model.newIntVar("c", 0, 100);
        final List<ConstraintSpec> chain = maxChain(model, a, b, c);
        model.setGoal(SolveGoal.maximize(chain.get(1).arg(2)));

        assertEquals(0, ChainRegrouper.apply(model, VariableOccurrences.of(model)));
        assertEquals(ConstraintKind.INT_MAX, chain.get(0).getKind());
    }

    @Test
    public void userNamedCarryIsNotFolded() {
        final FlatModel model = new FlatModel();
        final IntVarRef a = model.newIntVar("a", 0, 100);
        final IntVarRef b = model.newIntVar("b", 0, 100);
        final IntVarRef named = model.newIntVar("named", 0, 100);
        final IntVarRef m = model.newIntVar("m", 0, 100);
        model.addConstraint("int_max", a, a, named);
        model.addConstraint("int_max", b, named, m);

        assertEquals(0, ChainRegrouper.apply(model, VariableOccurrences.of(model)));
        assertEquals(2, model.constraints().active().size());
    }

    @Test
    public void carryReusedAsAnElementIsNotFolded() {
        final FlatModel model = new FlatModel();
        final IntVarRef a = model.newIntVar("a", 0, 100);
        final IntVarRef t1 = introduced(model, "t1");
        final IntVarRef m = model.newIntVar("m", 0, 100);
        final ConstraintSpec first = model.addConstraint("int_max", a, a, t1);
        final ConstraintSpec second = model.addConstraint("int_max", t1, t1, m);

        assertEquals(0, ChainRegrouper.apply(model, VariableOccurrences.of(model)));
        assertTrue(first.isActive());
        assertTrue(second.isActive());
        assertEquals(List.of(a, a, t1), first.getArgs());
        assertEquals(List.of(t1, t1, m), second.getArgs());
    }
}

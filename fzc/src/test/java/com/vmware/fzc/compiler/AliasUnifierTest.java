/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler;

import com.vmware.fzc.ModelDefect;
import com.vmware.fzc.ModelException;
import com.vmware.fzc.model.CanonicalReferences;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.Domain;
import com.vmware.fzc.model.FlatModel;
import com.vmware.fzc.model.IntVarRef;
import com.vmware.fzc.model.Nodes;
import com.vmware.fzc.model.SolveGoal;
import com.vmware.fzc.model.VarKind;
import com.vmware.fzc.model.VarRef;
import com.vmware.fzc.model.VariableSpec;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AliasUnifierTest {
    private final List<ModelDefect> defects = new ArrayList<>();
    private final List<DomainConstraint> domainConstraints = new ArrayList<>();

    private AliasUnifier unifier(final FlatModel model) {
        return new AliasUnifier(model, new AliasMap(CanonicalReferences.of(model)), defects, domainConstraints);
    }

    private static IntVarRef introduced(final FlatModel model, final String name, final long lo, final long hi) {
        return (IntVarRef) model.addVariable(VariableSpec.builder(VarKind.INT, name).setIntroduced(true)
                                                         .setDomain(Domain.interval(lo, hi)));
    }

    @Test
    public void declaredAliasesAreChasedToTheRoot() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x", 0, 10);
        final VarRef y = model.addVariable(VariableSpec.builder(VarKind.INT, "y").setAlias(x));
        final VarRef z = model.addVariable(VariableSpec.builder(VarKind.INT, "z").setAlias(y)
                                                       .setDomain(Domain.interval(3, 20)));
        final ConstraintSpec ct = model.addConstraint("int_le", z, Nodes.literal(5));
        model.setGoal(SolveGoal.minimize(y));

        final AliasMap map = unifier(model).resolveAndApplyAliases();

        assertEquals(x, map.find(z));
        assertEquals(x, map.find(y));
        assertEquals(x.getIndex(), (int) model.variable(z).getAlias());
        assertEquals(Domain.interval(3, 10), model.variable(x).getDomain());
        assertEquals(x, ct.arg(0));
        assertEquals(x, model.getGoal().getObjective());
        assertTrue(defects.isEmpty());
    }

    @Test
    public void aliasCycleIsFatal() {
        final FlatModel model = new FlatModel();
        final IntVarRef a = model.newIntVar("a");
        final IntVarRef b = model.newIntVar("b");
        model.variable(a).setAlias(b.getIndex());
        model.variable(b).setAlias(a.getIndex());
        final ModelException e = assertThrows(ModelException.class, () -> unifier(model).resolveAndApplyAliases());
        assertTrue(e.getMessage().startsWith("[alias-unification] alias cycle"));
    }

    @Test
    public void aliasToUndeclaredVariableIsFatal() {
        final FlatModel model = new FlatModel();
        final IntVarRef a = model.newIntVar("a");
        model.variable(a).setAlias(7);
        assertThrows(ModelException.class, () -> unifier(model).resolveAndApplyAliases());
    }

    @Test
    public void leftoverReferenceToAnAliasIsFatal() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x", 0, 10);
        final IntVarRef y = model.newIntVar("y", 0, 10);
        model.variable(y).setAlias(x.getIndex());
        final ConstraintSpec stale = model.addConstraint("int_le", y, Nodes.literal(5));

        final ModelException e = assertThrows(ModelException.class, () -> unifier(model).verify("presolve"));
        assertEquals("[presolve] aliased variable y still referenced by constraint " + stale.getIndex(),
                     e.getMessage());
    }

    @Test
    public void orphansBecomeAliases() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x", 0, 10);
        final IntVarRef y = model.newIntVar("y", 0, 10);
        final IntVarRef t = introduced(model, "t", 5, 20);
        final ConstraintSpec first = model.addConstraint("int_eq", t, x);
        final ConstraintSpec second = model.addConstraint("int_eq", t, y);
        final ConstraintSpec user = model.addConstraint("int_plus", x, y, t);

        final Targets targets = TargetMarker.apply(model);
        assertTrue(targets.isOrphan(t));
        final AliasUnifier unifier = unifier(model);
        assertEquals(1, unifier.discoverAliases(targets));
        assertFalse(first.isActive());
        assertTrue(model.variable(t).isAliased());
        assertEquals(t, second.definesVar());
        // looked at once only
        assertEquals(0, unifier.discoverAliases(targets));

        unifier.resolveAndApplyAliases();
        assertEquals(Domain.interval(5, 10), model.variable(x).getDomain());
        assertEquals(x, user.arg(2));
        assertEquals(x, second.arg(0));
        assertEquals(x, second.definesVar());
    }

    @Test
    public void userVariablesAreNotDesignated() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x", 0, 10);
        final IntVarRef y = model.newIntVar("y", 0, 10);
        final ConstraintSpec ct = model.addConstraint("int_eq", x, y);
        assertEquals(0, unifier(model).discoverAliases(TargetMarker.apply(model)));
        assertTrue(ct.isActive());
        assertEquals(null, ct.definesVar());
    }

    @Test
    public void mergeIntoSharedDomainIsSkipped() {
        final FlatModel model = new FlatModel();
        final VarRef shared = model.addVariable(VariableSpec.builder(VarKind.INT, "s")
                                                            .setSharedDomain(Domain.interval(0, 10)));
        final IntVarRef x = model.newIntVar("x", 2, 4);
        final AliasUnifier unifier = unifier(model);

        assertEquals(AliasUnifier.MergeResult.SKIPPED, unifier.mergeDomain(model.variable(x), model.variable(shared)));
        assertEquals(Domain.interval(0, 10), model.variable(shared).getDomain());
        assertEquals(List.of(new DomainConstraint(shared, Domain.interval(2, 4))), domainConstraints);
    }

    @Test
    public void emptyMergeIsADefect() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x", 0, 3);
        final IntVarRef y = model.newIntVar("y", 5, 8);
        final AliasUnifier unifier = unifier(model);

        assertEquals(AliasUnifier.MergeResult.EMPTY, unifier.mergeDomain(model.variable(x), model.variable(y)));
        assertEquals(1, defects.size());
        assertEquals(AliasUnifier.PHASE, defects.get(0).getPhase());
        assertEquals(Domain.interval(5, 8), model.variable(y).getDomain());
    }

    @Test
    public void aliasRewritesEveryReference() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x", 0, 10);
        final IntVarRef y = model.newIntVar("y", 3, 12);
        final ConstraintSpec ct = model.addConstraint("int_lin_le", Nodes.ints(1, 1), Nodes.array(x, y),
                                                      Nodes.literal(4));
        final AliasUnifier unifier = unifier(model);

        assertEquals(AliasUnifier.MergeResult.APPLIED, unifier.alias(y, x));
        assertEquals(Nodes.array(x, x), ct.arg(1));
        assertEquals(Domain.interval(3, 10), model.variable(x).getDomain());
        assertTrue(unifier.aliasMap().isAliased(y));
    }
}

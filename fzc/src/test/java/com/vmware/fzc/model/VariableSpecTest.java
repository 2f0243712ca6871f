/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class VariableSpecTest {

    @Test
    public void narrowingOnlyShrinks() {
        final FlatModel model = new FlatModel();
        final VariableSpec x = model.variable(model.newIntVar("x", 0, 10));
        assertEquals(VariableSpec.NarrowResult.NARROWED, x.narrow(Domain.interval(2, 20)));
        assertEquals(Domain.interval(2, 10), x.getDomain());
        assertEquals(VariableSpec.NarrowResult.UNCHANGED, x.narrow(Domain.interval(0, 100)));
        assertEquals(VariableSpec.NarrowResult.EMPTY, x.narrow(Domain.interval(11, 12)));
        assertEquals(Domain.interval(2, 10), x.getDomain());
        assertFalse(x.isFixed());
        x.narrow(Domain.singleton(7));
        assertTrue(x.isFixed());
        assertEquals(7, x.fixedValue());
    }

    @Test
    public void effectiveDomains() {
        final FlatModel model = new FlatModel();
        final VariableSpec b = model.variable(model.newBoolVar("b"));
        final VariableSpec i = model.variable(model.newIntVar("i"));
        assertEquals(Domain.booleans(), b.effectiveDomain());
        assertTrue(i.effectiveDomain().isAll());
        assertTrue(i.ownsDomain());
    }

    @Test
    public void sharedDomainIsNotOwnedUntilNarrowed() {
        final FlatModel model = new FlatModel();
        final VariableSpec x = model.variable(model.addVariable(
                VariableSpec.builder(VarKind.INT, "x").setSharedDomain(Domain.interval(0, 5))));
        assertFalse(x.ownsDomain());
        x.narrow(Domain.interval(1, 5));
        assertTrue(x.ownsDomain());
    }

    @Test
    public void builderChecks() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x");
        final VariableSpec c = model.variable(model.addVariable(VariableSpec.builder(VarKind.INT, "c").setValue(3)));
        assertTrue(c.isFixed());
        assertEquals(3, c.fixedValue());
        final VariableSpec y = model.variable(model.addVariable(VariableSpec.builder(VarKind.INT, "y").setAlias(x)));
        assertTrue(y.isAliased());
        assertEquals(x.getIndex(), (int) y.getAlias());
        assertThrows(IllegalArgumentException.class, () -> VariableSpec.builder(VarKind.BOOL, "b").setAlias(x));
        assertThrows(IllegalArgumentException.class,
                () -> VariableSpec.builder(VarKind.INT, "z").setDomain(Domain.interval(0, 2)).setValue(5));
        assertThrows(IllegalArgumentException.class, () -> y.setAlias(y.getIndex()));
    }
}

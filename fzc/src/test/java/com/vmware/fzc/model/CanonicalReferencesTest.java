/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.model;

import com.vmware.fzc.ModelException;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class CanonicalReferencesTest {

    @Test
    public void sameIndexSameReference() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x");
        final BoolVarRef b = model.newBoolVar("b");
        final CanonicalReferences refs = CanonicalReferences.of(model);

        assertSame(refs.canonical(VarKind.INT, 0), refs.canonical(VarKind.INT, 0));
        assertSame(model.variable(x).getRef(), refs.canonical(x));
        assertEquals(x, refs.canonical(VarKind.INT, 0));
        assertNotEquals(x, refs.canonical(VarKind.BOOL, 0));

        final Set<VarRef> set = new HashSet<>();
        set.add(x);
        set.add(refs.canonical(VarKind.INT, 0));
        set.add(b);
        assertEquals(2, set.size());
        assertEquals(1, refs.size(VarKind.INT));
    }

    @Test
    public void missingEntryFails() {
        final FlatModel model = new FlatModel();
        model.newIntVar("x");
        final CanonicalReferences refs = CanonicalReferences.of(model);
        final ModelException e = assertThrows(ModelException.class, () -> refs.canonical(VarKind.INT, 1));
        assertEquals("[canonical-references] no int variable declared at 1", e.getMessage());
        assertThrows(ModelException.class, () -> refs.canonical(VarKind.SET, 0));
    }
}

/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler;

import com.vmware.fzc.ModelException;
import com.vmware.fzc.model.BoolVarRef;
import com.vmware.fzc.model.CanonicalReferences;
import com.vmware.fzc.model.FlatModel;
import com.vmware.fzc.model.IntVarRef;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AliasMapTest {

    @Test
    public void chainsResolveToTheRoot() {
        final FlatModel model = new FlatModel();
        final IntVarRef a = model.newIntVar("a");
        final IntVarRef b = model.newIntVar("b");
        final IntVarRef c = model.newIntVar("c");
        final IntVarRef d = model.newIntVar("d");
        final AliasMap map = new AliasMap(CanonicalReferences.of(model));
        assertTrue(map.isEmpty());

        assertTrue(map.union(a, b));
        assertTrue(map.union(b, c));
        assertFalse(map.union(a, c));
        assertEquals(c, map.find(a));
        assertEquals(c, map.find(b));
        assertEquals(d, map.find(d));
        assertTrue(map.isAliased(a));
        assertFalse(map.isAliased(c));
        assertTrue(map.hasAliases(c));
        assertFalse(map.hasAliases(d));
        assertFalse(map.hasAliases(a));
        assertEquals(2, map.size());
    }

    @Test
    public void kindsDoNotMix() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x");
        final BoolVarRef b = model.newBoolVar("b");
        final AliasMap map = new AliasMap(CanonicalReferences.of(model));
        assertThrows(ModelException.class, () -> map.union(x, b));
    }
}

/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DomainTest {

    @Test
    public void intervalsAndSets() {
        final Domain d = Domain.interval(0, 10);
        assertTrue(d.isInterval());
        assertTrue(d.isBounded());
        assertEquals(11, d.size());
        assertEquals("0..10", d.toString());

        final Domain sparse = Domain.of(5, 1, 3);
        assertFalse(sparse.isInterval());
        assertEquals(List.of(1L, 3L, 5L), sparse.values());
        assertEquals("{1,3,5}", sparse.toString());

        assertEquals(Domain.interval(1, 3), Domain.of(1, 2, 3));
        assertTrue(Domain.singleton(4).hasOneValue());
        assertTrue(Domain.empty().isEmpty());
        assertEquals("int", Domain.all().toString());
    }

    @Test
    public void algebra() {
        final Domain d = Domain.interval(0, 10);
        assertEquals(Domain.interval(5, 10), d.intersect(Domain.interval(5, 20)));
        assertEquals(Domain.interval(0, 4), d.intersectInterval(Long.MIN_VALUE, 4));
        assertEquals(Domain.of(0, 1, 2, 4, 5), Domain.interval(0, 5).removeValue(3));
        assertEquals(d, d.removeValue(42));
        assertEquals(Domain.interval(-10, 0), d.negate());
        assertEquals(Domain.of(0, 10), d.difference(Domain.interval(1, 9)));
        assertTrue(d.intersect(Domain.interval(11, 12)).isEmpty());
        assertTrue(Domain.interval(2, 3).isSubsetOf(d));
        assertFalse(d.isSubsetOf(Domain.interval(2, 3)));
        assertTrue(d.intersects(Domain.of(10, 11)));
    }

    @Test
    public void unboundedDomains() {
        final Domain nonNegative = Domain.interval(0, Long.MAX_VALUE);
        assertFalse(nonNegative.isBounded());
        assertEquals(0, nonNegative.min());
        assertEquals(Long.MAX_VALUE, nonNegative.max());
        assertEquals(Long.MAX_VALUE, Domain.all().size());
        assertTrue(Domain.all().isAll());
        assertThrows(IllegalStateException.class, nonNegative::values);
        assertThrows(IllegalStateException.class, () -> Domain.empty().min());
    }
}

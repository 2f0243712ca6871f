/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.BoundType;
import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableRangeSet;
import com.google.common.collect.Range;
import com.google.common.collect.TreeRangeSet;
import com.google.common.math.LongMath;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An immutable set of 64-bit integers, stored as a union of disjoint intervals.
 *
 * Every range is kept in the canonical closed-open form over {@link DiscreteDomain#longs()} so that
 * adjacent intervals coalesce and two domains holding the same values are always equal.
 */
public final class Domain {
    private static final Domain ALL = new Domain(ImmutableRangeSet.of(range(Long.MIN_VALUE, Long.MAX_VALUE)));
    private static final Domain EMPTY = new Domain(ImmutableRangeSet.of());
    private static final Domain BOOLEAN = interval(0, 1);
    private final ImmutableRangeSet<Long> ranges;

    private Domain(final ImmutableRangeSet<Long> ranges) {
        this.ranges = ranges;
    }

    public static Domain all() {
        return ALL;
    }

    public static Domain empty() {
        return EMPTY;
    }

    public static Domain booleans() {
        return BOOLEAN;
    }

    public static Domain interval(final long lo, final long hi) {
        if (lo > hi) {
            return EMPTY;
        }
        return new Domain(ImmutableRangeSet.of(range(lo, hi)));
    }

    public static Domain singleton(final long value) {
        return interval(value, value);
    }

    public static Domain of(final long... values) {
        final TreeRangeSet<Long> set = TreeRangeSet.create();
        for (final long value: values) {
            set.add(range(value, value));
        }
        return new Domain(ImmutableRangeSet.copyOf(set));
    }

    public static Domain of(final Collection<Long> values) {
        final TreeRangeSet<Long> set = TreeRangeSet.create();
        values.forEach(value -> set.add(range(value, value)));
        return new Domain(ImmutableRangeSet.copyOf(set));
    }

    public Domain intersect(final Domain other) {
        if (this == other || other == ALL) {
            return this;
        }
        return new Domain(ranges.intersection(other.ranges));
    }

    public Domain intersectInterval(final long lo, final long hi) {
        return intersect(interval(lo, hi));
    }

    public Domain difference(final Domain other) {
        return new Domain(ranges.difference(other.ranges));
    }

    public Domain removeValue(final long value) {
        if (!contains(value)) {
            return this;
        }
        return new Domain(ranges.difference(ImmutableRangeSet.of(range(value, value))));
    }

    public Domain negate() {
        final TreeRangeSet<Long> set = TreeRangeSet.create();
        for (final Range<Long> r: ranges.asRanges()) {
            final long lo = lower(r);
            final long hi = upper(r);
            // -Long.MIN_VALUE does not exist, clamp to the largest value instead
            set.add(range(hi == Long.MIN_VALUE ? Long.MAX_VALUE : -hi,
                          lo == Long.MIN_VALUE ? Long.MAX_VALUE : -lo));
        }
        return new Domain(ImmutableRangeSet.copyOf(set));
    }

    public boolean contains(final long value) {
        return ranges.contains(value);
    }

    public boolean isEmpty() {
        return ranges.isEmpty();
    }

    public boolean isAll() {
        return equals(ALL);
    }

    public boolean hasOneValue() {
        return !isEmpty() && min() == max();
    }

    public boolean isInterval() {
        return ranges.asRanges().size() <= 1;
    }

    public boolean isBounded() {
        return !isEmpty() && min() != Long.MIN_VALUE && max() != Long.MAX_VALUE;
    }

    public boolean isSubsetOf(final Domain other) {
        return other.ranges.enclosesAll(ranges);
    }

    public boolean intersects(final Domain other) {
        return !intersect(other).isEmpty();
    }

    /**
     * Smallest value, or {@link Long#MIN_VALUE} when the domain is unbounded below.
     */
    public long min() {
        Preconditions.checkState(!isEmpty(), "empty domain has no minimum");
        return lower(ranges.span());
    }

    /**
     * Largest value, or {@link Long#MAX_VALUE} when the domain is unbounded above.
     */
    public long max() {
        Preconditions.checkState(!isEmpty(), "empty domain has no maximum");
        return upper(ranges.span());
    }

    /**
     * Number of values, saturated at {@link Long#MAX_VALUE}.
     */
    public long size() {
        long size = 0;
        for (final Range<Long> r: ranges.asRanges()) {
            final long width = LongMath.saturatedSubtract(upper(r), lower(r));
            size = LongMath.saturatedAdd(size, LongMath.saturatedAdd(width, 1));
        }
        return size;
    }

    public List<Long> values() {
        Preconditions.checkState(isBounded() || isEmpty(), "cannot enumerate unbounded domain %s", this);
        return ranges.asRanges().stream()
                     .flatMap(r -> ContiguousSet.create(r, DiscreteDomain.longs()).stream())
                     .collect(ImmutableList.toImmutableList());
    }

    /**
     * FlatZinc rendering: {@code lo..hi} for intervals, {@code {a,b,c}} for sparse bounded domains
     * and {@code int} for the full integer range. Partially bounded domains print their infinite
     * bounds symbolically.
     */
    @Override
    public String toString() {
        if (isEmpty()) {
            return "{}";
        }
        if (isInterval()) {
            if (isBounded()) {
                return min() + ".." + max();
            }
            return isAll() ? "int" : bound(min()) + ".." + bound(max());
        }
        if (!isBounded()) {
            return ranges.asRanges().stream()
                         .map(r -> bound(lower(r)) + ".." + bound(upper(r)))
                         .collect(Collectors.joining(" union "));
        }
        return values().stream().map(String::valueOf).collect(Collectors.joining(",", "{", "}"));
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return ranges.equals(((Domain) o).ranges);
    }

    @Override
    public int hashCode() {
        return ranges.hashCode();
    }

    private static String bound(final long value) {
        if (value == Long.MIN_VALUE) {
            return "-infinity";
        }
        if (value == Long.MAX_VALUE) {
            return "infinity";
        }
        return String.valueOf(value);
    }

    private static Range<Long> range(final long lo, final long hi) {
        return Range.closed(lo, hi).canonical(DiscreteDomain.longs());
    }

    private static long lower(final Range<Long> r) {
        if (!r.hasLowerBound()) {
            return Long.MIN_VALUE;
        }
        return r.lowerBoundType() == BoundType.CLOSED ? r.lowerEndpoint() : r.lowerEndpoint() + 1;
    }

    private static long upper(final Range<Long> r) {
        if (!r.hasUpperBound()) {
            return Long.MAX_VALUE;
        }
        return r.upperBoundType() == BoundType.CLOSED ? r.upperEndpoint() : r.upperEndpoint() - 1;
    }
}

/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.model;

import com.google.common.collect.Iterators;
import com.vmware.fzc.ModelException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The constraints of a model, in input order. Constraints are appended during ingestion and never
 * physically removed.
 */
public final class ConstraintTable implements Iterable<ConstraintSpec> {
    private final List<ConstraintSpec> constraints = new ArrayList<>();

    ConstraintSpec add(final String name, final List<Node> args, final List<Node> annotations) {
        final ConstraintSpec spec = new ConstraintSpec(constraints.size(), name, args, annotations);
        constraints.add(spec);
        return spec;
    }

    public ConstraintSpec get(final int index) {
        if (index < 0 || index >= constraints.size()) {
            throw ModelException.invariant("constraint-table", "no constraint at", index);
        }
        return constraints.get(index);
    }

    public int size() {
        return constraints.size();
    }

    public Stream<ConstraintSpec> stream() {
        return constraints.stream();
    }

    /**
     * The constraints that are not nullified, in input order.
     */
    public List<ConstraintSpec> active() {
        return constraints.stream().filter(ConstraintSpec::isActive).collect(Collectors.toList());
    }

    public List<ConstraintSpec> asList() {
        return Collections.unmodifiableList(constraints);
    }

    @Override
    public Iterator<ConstraintSpec> iterator() {
        return Iterators.unmodifiableIterator(constraints.iterator());
    }
}

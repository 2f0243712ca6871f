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

/**
 * The ordered variables of one kind. Variables are appended during ingestion and never removed.
 */
public final class VariableTable implements Iterable<VariableSpec> {
    private final VarKind kind;
    private final List<VariableSpec> variables = new ArrayList<>();

    VariableTable(final VarKind kind) {
        this.kind = kind;
    }

    public VarKind getKind() {
        return kind;
    }

    VariableSpec add(final VariableSpec.Builder builder) {
        final VariableSpec spec = builder.build(variables.size());
        variables.add(spec);
        return spec;
    }

    public VariableSpec get(final int index) {
        if (index < 0 || index >= variables.size()) {
            throw ModelException.invariant("variable-table",
                                           "no " + kind.name().toLowerCase() + " variable at", index);
        }
        return variables.get(index);
    }

    public int size() {
        return variables.size();
    }

    public List<VariableSpec> asList() {
        return Collections.unmodifiableList(variables);
    }

    @Override
    public Iterator<VariableSpec> iterator() {
        return Iterators.unmodifiableIterator(variables.iterator());
    }
}

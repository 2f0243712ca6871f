/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Set;

import javax.annotation.Nullable;

/**
 * The solve item of a model: satisfy, or minimize/maximize an objective term, plus search annotations.
 */
public final class SolveGoal {
    private final Type type;
    @Nullable private final Node objective;
    private final ImmutableList<Node> annotations;

    private SolveGoal(final Type type, @Nullable final Node objective, final List<Node> annotations) {
        Preconditions.checkArgument((type == Type.SATISFY) == (objective == null),
                                    "%s goal with objective %s", type, objective);
        this.type = type;
        this.objective = objective;
        this.annotations = ImmutableList.copyOf(annotations);
    }

    public static SolveGoal satisfy() {
        return new SolveGoal(Type.SATISFY, null, ImmutableList.of());
    }

    public static SolveGoal minimize(final Node objective) {
        return new SolveGoal(Type.MINIMIZE, objective, ImmutableList.of());
    }

    public static SolveGoal maximize(final Node objective) {
        return new SolveGoal(Type.MAXIMIZE, objective, ImmutableList.of());
    }

    public SolveGoal withAnnotations(final List<Node> newAnnotations) {
        return new SolveGoal(type, objective, newAnnotations);
    }

    /**
     * Applies {@code rewriter} to the objective and the annotations.
     */
    public SolveGoal rewrite(final NodeRewriter rewriter) {
        final Node newObjective = objective == null ? null : rewriter.visit(objective);
        return new SolveGoal(type, newObjective, rewriter.visitAll(annotations));
    }

    public Type getType() {
        return type;
    }

    @Nullable
    public Node getObjective() {
        return objective;
    }

    public List<Node> getAnnotations() {
        return annotations;
    }

    /**
     * Variables referenced by the objective or the search annotations.
     */
    public Set<VarRef> variables() {
        final Set<VarRef> refs = ReferenceCollector.collect(annotations);
        if (objective != null) {
            refs.addAll(ReferenceCollector.collect(objective));
        }
        return refs;
    }

    @Override
    public String toString() {
        return type == Type.SATISFY ? "satisfy" : type.name().toLowerCase() + " " + objective;
    }

    public enum Type {
        SATISFY,
        MINIMIZE,
        MAXIMIZE
    }
}

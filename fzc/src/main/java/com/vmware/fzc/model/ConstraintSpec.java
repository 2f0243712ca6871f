/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.vmware.fzc.ModelException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import javax.annotation.Nullable;

/**
 * One constraint application. The {@link #getIndex() index} is its position in the input and never
 * changes; a constraint that is no longer needed is {@link #nullify() nullified} rather than removed.
 *
 * The kind and arguments only change through {@link #transition(ConstraintKind, List)}, which rejects
 * any kind change that is not an edge of {@link ConstraintKind#transitions()}.
 */
public final class ConstraintSpec {
    private final int index;
    private final String inputName;
    private ConstraintKind kind;
    private ImmutableList<Node> args;
    private final List<Node> annotations;
    private boolean nullified = false;
    @Nullable private VarRef definedArg = null;
    private final Set<VarRef> requires = new LinkedHashSet<>();

    ConstraintSpec(final int index, final String name, final List<Node> args, final List<Node> annotations) {
        this.index = index;
        this.inputName = name;
        this.kind = ConstraintKind.fromName(name);
        this.args = ImmutableList.copyOf(args);
        this.annotations = new ArrayList<>(annotations);
    }

    public int getIndex() {
        return index;
    }

    public ConstraintKind getKind() {
        return kind;
    }

    /**
     * The constraint name: the input name for constraints of unknown kind, the kind's name otherwise.
     */
    public String getName() {
        return kind == ConstraintKind.OTHER ? inputName : kind.fznName();
    }

    public List<Node> getArgs() {
        return args;
    }

    public Node arg(final int i) {
        return args.get(i);
    }

    public int arity() {
        return args.size();
    }

    public List<Node> getAnnotations() {
        return Collections.unmodifiableList(annotations);
    }

    public void setAnnotations(final List<Node> annotations) {
        this.annotations.clear();
        this.annotations.addAll(annotations);
    }

    public boolean isNullified() {
        return nullified;
    }

    public boolean isActive() {
        return !nullified;
    }

    public void nullify() {
        nullified = true;
        definedArg = null;
        requires.clear();
    }

    /**
     * Replaces this constraint's kind and arguments.
     *
     * @throws ModelException if the constraint is nullified or the kind change is not a known rewrite
     */
    public void transition(final ConstraintKind target, final List<Node> newArgs) {
        if (nullified) {
            throw ModelException.invariant("rewrite", "rewrite of nullified constraint", index);
        }
        if (kind == ConstraintKind.OTHER ? target != ConstraintKind.OTHER : !kind.canTransitionTo(target)) {
            throw ModelException.invariant("rewrite", "illegal retag of " + getName() + " to "
                                                      + target.fznName() + " in constraint", index);
        }
        this.kind = target;
        this.args = ImmutableList.copyOf(newArgs);
        final VarRef defined = definesVar();
        if (defined != null && (!kind.canDefine() || !ReferenceCollector.collect(args).contains(defined))) {
            removeDefinesVar();
        }
    }

    /**
     * The variable named by this constraint's {@code defines_var} annotation, if any.
     */
    @Nullable
    public VarRef definesVar() {
        for (final Node annotation: annotations) {
            final VarRef target = Nodes.definesVarTarget(annotation);
            if (target != null) {
                return target;
            }
        }
        return null;
    }

    public void setDefinesVar(final VarRef var) {
        Preconditions.checkArgument(kind.canDefine(), "%s cannot define a variable", getName());
        removeDefinesVar();
        annotations.add(Nodes.definesVar(var));
    }

    @CanIgnoreReturnValue
    public boolean removeDefinesVar() {
        return annotations.removeIf(annotation -> Nodes.definesVarTarget(annotation) != null);
    }

    @Nullable
    public VarRef getDefinedArg() {
        return definedArg;
    }

    public void setDefinedArg(@Nullable final VarRef definedArg) {
        this.definedArg = definedArg;
    }

    public Set<VarRef> getRequires() {
        return requires;
    }

    /**
     * Variables referenced from the arguments, in order of first appearance.
     */
    public Set<VarRef> variables() {
        return ReferenceCollector.collect(args);
    }

    @Override
    public String toString() {
        final String body = getName() + args.stream().map(Node::toString)
                                            .collect(Collectors.joining(", ", "(", ")"));
        return "#" + index + " " + body + (nullified ? " [nullified]" : "");
    }
}

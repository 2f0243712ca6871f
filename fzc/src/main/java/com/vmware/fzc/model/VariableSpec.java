/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.model;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

import javax.annotation.Nullable;

/**
 * A declared integer, Boolean or set variable.
 *
 * The domain may only shrink over the lifetime of a compilation. A variable whose domain is shared
 * with other declarations does not own it, and alias merges leave it untouched (see
 * {@link #ownsDomain()}).
 */
public final class VariableSpec {
    private final VarRef ref;
    private final String name;
    private final boolean introduced;
    @Nullable private Integer alias;
    @Nullable private final Node assigned;
    @Nullable private Domain domain;
    private boolean ownsDomain;

    private VariableSpec(final VarRef ref, final Builder builder) {
        this.ref = ref;
        this.name = builder.name;
        this.introduced = builder.introduced;
        this.alias = builder.alias;
        this.assigned = builder.assigned;
        this.domain = builder.domain;
        this.ownsDomain = !builder.sharedDomain;
    }

    public static Builder builder(final VarKind kind, final String name) {
        return new Builder(kind, name);
    }

    public VarRef getRef() {
        return ref;
    }

    public VarKind getKind() {
        return ref.getKind();
    }

    public int getIndex() {
        return ref.getIndex();
    }

    public String getName() {
        return name;
    }

    public boolean isIntroduced() {
        return introduced;
    }

    @Nullable
    public Integer getAlias() {
        return alias;
    }

    public boolean isAliased() {
        return alias != null;
    }

    public void setAlias(final int target) {
        Preconditions.checkArgument(target != getIndex(), "variable %s cannot alias itself", name);
        this.alias = target;
    }

    @Nullable
    public Node getAssigned() {
        return assigned;
    }

    @Nullable
    public Domain getDomain() {
        return domain;
    }

    /**
     * The declared domain, or the implicit one of the variable's kind when none was declared.
     */
    public Domain effectiveDomain() {
        if (domain != null) {
            return domain;
        }
        return getKind() == VarKind.BOOL ? Domain.booleans() : Domain.all();
    }

    public boolean ownsDomain() {
        return ownsDomain;
    }

    public boolean isFixed() {
        return getKind() != VarKind.SET && effectiveDomain().hasOneValue();
    }

    public long fixedValue() {
        Preconditions.checkState(isFixed(), "variable %s is not fixed", name);
        return effectiveDomain().min();
    }

    /**
     * Intersects the domain with {@code other}. An empty intersection is reported and not applied.
     */
    @CanIgnoreReturnValue
    public NarrowResult narrow(final Domain other) {
        final Domain current = effectiveDomain();
        final Domain next = current.intersect(other);
        if (next.isEmpty()) {
            return NarrowResult.EMPTY;
        }
        if (next.equals(current)) {
            return NarrowResult.UNCHANGED;
        }
        domain = next;
        ownsDomain = true;
        return NarrowResult.NARROWED;
    }

    @Override
    public String toString() {
        return name + ":" + effectiveDomain() + (alias != null ? " -> " + alias : "");
    }

    public enum NarrowResult {
        UNCHANGED,
        NARROWED,
        EMPTY
    }

    public static final class Builder {
        private final VarKind kind;
        private final String name;
        private boolean introduced = false;
        private boolean sharedDomain = false;
        @Nullable private Integer alias = null;
        @Nullable private Node assigned = null;
        @Nullable private Domain domain = null;

        private Builder(final VarKind kind, final String name) {
            this.kind = kind;
            this.name = name;
        }

        public VarKind getKind() {
            return kind;
        }

        /**
         * Marks the variable as synthesized by the model flattener rather than named by the user.
         */
        public Builder setIntroduced(final boolean introduced) {
            this.introduced = introduced;
            return this;
        }

        public Builder setDomain(final Domain domain) {
            Preconditions.checkArgument(!domain.isEmpty(), "variable %s declared with an empty domain", name);
            this.domain = domain;
            return this;
        }

        /**
         * Declares a domain the variable shares with other declarations and therefore does not own.
         */
        public Builder setSharedDomain(final Domain domain) {
            setDomain(domain);
            this.sharedDomain = true;
            return this;
        }

        public Builder setAlias(final VarRef target) {
            Preconditions.checkArgument(target.getKind() == kind, "alias of %s must be a %s variable", name, kind);
            this.alias = target.getIndex();
            return this;
        }

        /**
         * Assigns a constant initial value, which also fixes the domain.
         */
        public Builder setValue(final long value) {
            Preconditions.checkArgument(kind != VarKind.SET, "set variable %s cannot take an integer value", name);
            this.assigned = kind == VarKind.BOOL ? BoolLiteral.of(value != 0) : new IntLiteral(value);
            this.domain = (domain == null ? Domain.all() : domain).intersect(Domain.singleton(value));
            Preconditions.checkArgument(!domain.isEmpty(), "value %s is outside the domain of %s", value, name);
            return this;
        }

        VariableSpec build(final int index) {
            final VarRef ref;
            switch (kind) {
                case INT:
                    ref = new IntVarRef(index);
                    break;
                case BOOL:
                    ref = new BoolVarRef(index);
                    break;
                case SET:
                    ref = new SetVarRef(index);
                    break;
                default:
                    throw new IllegalStateException("Unknown variable kind " + kind);
            }
            return new VariableSpec(ref, this);
        }
    }
}

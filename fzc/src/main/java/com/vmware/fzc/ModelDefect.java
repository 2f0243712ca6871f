/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc;

import java.util.Objects;

/**
 * A provable infeasibility found while compiling, such as a narrowing that would empty a domain.
 * Defects do not stop the compilation; they are collected and reported with its result.
 */
public final class ModelDefect {
    public static final int NO_CONSTRAINT = -1;
    private final String phase;
    private final int constraintIndex;
    private final String message;

    public ModelDefect(final String phase, final int constraintIndex, final String message) {
        this.phase = phase;
        this.constraintIndex = constraintIndex;
        this.message = message;
    }

    public String getPhase() {
        return phase;
    }

    /**
     * Index of the offending constraint, or {@link #NO_CONSTRAINT} for defects found while merging
     * variables.
     */
    public int getConstraintIndex() {
        return constraintIndex;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final ModelDefect that = (ModelDefect) o;
        return constraintIndex == that.constraintIndex && phase.equals(that.phase) && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(phase, constraintIndex, message);
    }

    @Override
    public String toString() {
        return "[" + phase + "] constraint " + constraintIndex + ": " + message;
    }
}

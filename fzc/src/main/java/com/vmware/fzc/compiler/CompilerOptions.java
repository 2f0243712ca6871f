/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler;

import com.google.common.base.Preconditions;
import com.vmware.fzc.model.ConstraintSpec;

import java.util.Comparator;

/**
 * Settings of a {@link ModelCompiler}. Use {@link Builder} to override the defaults.
 */
public final class CompilerOptions {
    private static final Comparator<ConstraintSpec> LOWEST_INDEX = Comparator.comparingInt(ConstraintSpec::getIndex);
    private final boolean regroupChains;
    private final boolean discoverAliases;
    private final boolean detectHiddenSums;
    private final int maxPresolveSweeps;
    private final boolean printStatistics;
    private final Comparator<ConstraintSpec> cycleBreakTieBreak;

    private CompilerOptions(final Builder builder) {
        this.regroupChains = builder.regroupChains;
        this.discoverAliases = builder.discoverAliases;
        this.detectHiddenSums = builder.detectHiddenSums;
        this.maxPresolveSweeps = builder.maxPresolveSweeps;
        this.printStatistics = builder.printStatistics;
        this.cycleBreakTieBreak = builder.cycleBreakTieBreak;
    }

    public static CompilerOptions defaults() {
        return new Builder().build();
    }

    public boolean regroupChains() {
        return regroupChains;
    }

    public boolean discoverAliases() {
        return discoverAliases;
    }

    public boolean detectHiddenSums() {
        return detectHiddenSums;
    }

    public int maxPresolveSweeps() {
        return maxPresolveSweeps;
    }

    public boolean printStatistics() {
        return printStatistics;
    }

    public Comparator<ConstraintSpec> cycleBreakTieBreak() {
        return cycleBreakTieBreak;
    }

    public static class Builder {
        private boolean regroupChains = true;
        private boolean discoverAliases = true;
        private boolean detectHiddenSums = true;
        private int maxPresolveSweeps = 1000;
        private boolean printStatistics = false;
        private Comparator<ConstraintSpec> cycleBreakTieBreak = LOWEST_INDEX;

        /**
         * Fold chains of binary {@code int_max}/{@code int_min} back into n-ary constraints.
         *
         * @param regroupChains Defaults to true.
         * @return the current Builder object with `regroupChains` set
         */
        public Builder setRegroupChains(final boolean regroupChains) {
            this.regroupChains = regroupChains;
            return this;
        }

        /**
         * Turn {@code int_eq}/{@code bool_eq} constraints over undefined introduced variables into aliases.
         * Aliases declared in the input are resolved either way.
         *
         * @param discoverAliases Defaults to true.
         * @return the current Builder object with `discoverAliases` set
         */
        public Builder setDiscoverAliases(final boolean discoverAliases) {
            this.discoverAliases = discoverAliases;
            return this;
        }

        /**
         * Let {@code int_lin_eq} constraints with a unit coefficient at either end compute that variable.
         *
         * @param detectHiddenSums Defaults to true.
         * @return the current Builder object with `detectHiddenSums` set
         */
        public Builder setDetectHiddenSums(final boolean detectHiddenSums) {
            this.detectHiddenSums = detectHiddenSums;
            return this;
        }

        /**
         * Upper bound on the rewrite sweeps. Exceeding it aborts the compilation.
         *
         * @param maxPresolveSweeps Defaults to 1000.
         * @return the current Builder object with `maxPresolveSweeps` set
         */
        public Builder setMaxPresolveSweeps(final int maxPresolveSweeps) {
            Preconditions.checkArgument(maxPresolveSweeps > 0);
            this.maxPresolveSweeps = maxPresolveSweeps;
            return this;
        }

        /**
         * Log model statistics before and after compilation at INFO level.
         *
         * @param printStatistics Defaults to false.
         * @return the current Builder object with `printStatistics` set
         */
        public Builder setPrintStatistics(final boolean printStatistics) {
            this.printStatistics = printStatistics;
            return this;
        }

        /**
         * Orders the constraints that are equally good places to break a dependency cycle, i.e. that have
         * the same number of unsatisfied requirements. The first one is picked.
         *
         * @param cycleBreakTieBreak Defaults to lowest constraint index first.
         * @return the current Builder object with `cycleBreakTieBreak` set
         */
        public Builder setCycleBreakTieBreak(final Comparator<ConstraintSpec> cycleBreakTieBreak) {
            this.cycleBreakTieBreak = cycleBreakTieBreak;
            return this;
        }

        public CompilerOptions build() {
            return new CompilerOptions(this);
        }
    }
}

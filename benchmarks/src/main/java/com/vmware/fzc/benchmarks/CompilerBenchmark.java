/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.benchmarks;

import com.vmware.fzc.Model;
import com.vmware.fzc.compiler.CompilerOptions;
import com.vmware.fzc.model.BoolVarRef;
import com.vmware.fzc.model.Domain;
import com.vmware.fzc.model.FlatModel;
import com.vmware.fzc.model.IntVarRef;
import com.vmware.fzc.model.Nodes;
import com.vmware.fzc.model.SolveGoal;
import com.vmware.fzc.model.VarKind;
import com.vmware.fzc.model.VariableSpec;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import javax.annotation.Nullable;
import java.util.Random;
import java.util.concurrent.TimeUnit;

@Warmup(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 20, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)

public class CompilerBenchmark {
    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Nullable FlatModel model = null;
        @Nullable CompilerOptions options = null;

        @Param({"100", "1000"})
        int numGroups;

        @Param({"true", "false"})
        boolean regroupChains;

        @Setup(Level.Invocation)
        public void setUp() {
            options = new CompilerOptions.Builder().setRegroupChains(regroupChains).build();
            model = generate(numGroups, new Random(42));
        }
    }

    /*
     * Each group has a max-chain over three values, a sum of the chain's result and two other values that
     * is only visible as a linear equality, an alias of an introduced variable, a reified comparison and a
     * comparison that the presolve absorbs.
     */
    static FlatModel generate(final int numGroups, final Random random) {
        final FlatModel model = new FlatModel();
        IntVarRef total = null;
        for (int g = 0; g < numGroups; g++) {
            final IntVarRef a = model.newIntVar("a" + g, 0, 100);
            final IntVarRef b = model.newIntVar("b" + g, 0, 100);
            final IntVarRef c = model.newIntVar("c" + g, 0, 100);
            final IntVarRef max = model.newIntVar("max" + g, 0, 100);
            final IntVarRef t1 = introduced(model, "t1_" + g);
            final IntVarRef t2 = introduced(model, "t2_" + g);
            model.addConstraint("int_max", a, a, t1);
            model.addConstraint("int_max", b, t1, t2);
            model.addConstraint("int_max", c, t2, max);

            final IntVarRef sum = introduced(model, "sum" + g);
            model.addConstraint("int_lin_eq", Nodes.ints(1, -1, -2), Nodes.array(sum, max, b), Nodes.literal(0));

            final IntVarRef copy = introduced(model, "copy" + g);
            model.addConstraint("int_eq", copy, c);
            model.addConstraint("int_le", copy, Nodes.literal(50 + random.nextInt(50)));

            final BoolVarRef small = model.newBoolVar("small" + g);
            model.addConstraint("int_le_reif", sum, Nodes.literal(random.nextInt(300)), small);
            if (total != null) {
                final IntVarRef next = introduced(model, "total" + g);
                model.addConstraint("int_lin_eq", Nodes.ints(1, 1, -1), Nodes.array(total, sum, next),
                                    Nodes.literal(0));
                total = next;
            } else {
                total = sum;
            }
        }
        if (total != null) {
            model.setGoal(SolveGoal.maximize(total));
        }
        return model;
    }

    private static IntVarRef introduced(final FlatModel model, final String name) {
        return (IntVarRef) model.addVariable(VariableSpec.builder(VarKind.INT, name).setIntroduced(true)
                                                         .setDomain(Domain.interval(0, 100_000)));
    }

    @Benchmark
    public Model compile(final BenchmarkState state) {
        assert state.model != null && state.options != null;
        return Model.build(state.model, state.options);
    }
}

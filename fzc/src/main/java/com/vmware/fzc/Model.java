/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc;

import com.vmware.fzc.backend.ISolverBackend;
import com.vmware.fzc.backend.flatzinc.FlatZincBackend;
import com.vmware.fzc.compiler.CompiledModel;
import com.vmware.fzc.compiler.CompilerOptions;
import com.vmware.fzc.compiler.ModelCompiler;
import com.vmware.fzc.model.FlatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Used to compile a flat constraint model and hand it to a solver backend.
 *
 * The public API for Model involves two narrow interfaces:
 *
 *   - build() to compile a FlatModel into Model instances, optionally with options and a backend.
 *   - compiledModel() and compilationOutput() to inspect the result and the backend's code.
 */
public class Model {
    private static final Logger LOG = LoggerFactory.getLogger(Model.class);
    private final CompiledModel compiledModel;
    private final List<String> compilationOutput;

    private Model(final FlatModel flatModel, final CompilerOptions options, final ISolverBackend backend) {
        final ModelCompiler compiler = new ModelCompiler(options);
        this.compiledModel = compiler.compile(flatModel);
        this.compilationOutput = backend.generateModelCode(compiledModel);
        LOG.debug("Generated model:\n{}", String.join("\n", compilationOutput));
    }

    /**
     * Compiles a model with the default options, rendering it as FlatZinc.
     *
     * @param flatModel the model to compile. It is modified in place.
     * @return An initialized Model instance
     */
    @SuppressWarnings({"WeakerAccess", "reason=Public API"})
    public static Model build(final FlatModel flatModel) {
        return build(flatModel, CompilerOptions.defaults());
    }

    /**
     * Compiles a model, rendering it as FlatZinc.
     *
     * @param flatModel the model to compile. It is modified in place.
     * @param options compiler options. See the CompilerOptions class.
     * @return An initialized Model instance
     */
    @SuppressWarnings({"WeakerAccess", "reason=Public API"})
    public static Model build(final FlatModel flatModel, final CompilerOptions options) {
        return build(flatModel, options, new FlatZincBackend());
    }

    /**
     * Compiles a model and hands it to the supplied backend.
     *
     * @param flatModel the model to compile. It is modified in place.
     * @param options compiler options. See the CompilerOptions class.
     * @param solverBackend A backend implementation. See the ISolverBackend class.
     * @return An initialized Model instance
     * @throws ModelException if the model breaks an invariant the compiler relies on
     */
    @SuppressWarnings({"WeakerAccess", "reason=Public API"})
    public static Model build(final FlatModel flatModel, final CompilerOptions options,
                              final ISolverBackend solverBackend) {
        return new Model(flatModel, options, solverBackend);
    }

    public CompiledModel compiledModel() {
        return compiledModel;
    }

    /**
     * The code generated by the backend, one item per element.
     */
    public List<String> compilationOutput() {
        return compilationOutput;
    }
}

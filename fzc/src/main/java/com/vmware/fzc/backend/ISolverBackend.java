/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.backend;

import com.vmware.fzc.compiler.CompiledModel;

import java.util.List;

/**
 * Receives a compiled model: scheduled constraints, variable statuses, domain constraints and the goal.
 */
public interface ISolverBackend {
    List<String> generateModelCode(final CompiledModel compiledModel);
}

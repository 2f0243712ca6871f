/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.backend.flatzinc;

import com.vmware.fzc.backend.ISolverBackend;
import com.vmware.fzc.compiler.CompiledModel;
import com.vmware.fzc.compiler.DomainConstraint;
import com.vmware.fzc.compiler.VariableStatus;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.FlatModel;
import com.vmware.fzc.model.Node;
import com.vmware.fzc.model.SolveGoal;
import com.vmware.fzc.model.VarKind;
import com.vmware.fzc.model.VarRef;
import com.vmware.fzc.model.VariableSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Outputs a compiled model as FlatZinc (https://www.minizinc.org/doc-latest/en/fzn-spec.html), one item
 * per line: variable declarations, then the constraints in schedule order, then the domain constraints,
 * then the solve item.
 *
 * Unused variables are not declared. Aliased variables are declared after all others, as
 * {@code var dom: name = root}.
 */
public class FlatZincBackend implements ISolverBackend {
    private static final Logger LOG = LoggerFactory.getLogger(FlatZincBackend.class);
    private static final VarKind[] DECLARATION_ORDER = {VarKind.BOOL, VarKind.INT, VarKind.SET};
    private final FlatZincPrinter printer = new FlatZincPrinter();

    @Override
    public List<String> generateModelCode(final CompiledModel compiledModel) {
        final FlatModel model = compiledModel.getModel();
        final List<String> output = new ArrayList<>();
        final Set<VarRef> aliasTargets = new HashSet<>();
        for (final VarKind kind: DECLARATION_ORDER) {
            for (final VariableSpec spec: compiledModel.variables(kind, VariableStatus.ALIASED)) {
                aliasTargets.add(compiledModel.aliasRoot(spec.getRef()));
            }
        }
        for (final VarKind kind: DECLARATION_ORDER) {
            for (final VariableSpec spec: model.variables(kind)) {
                final VariableStatus status = compiledModel.status(spec.getRef());
                if (status == VariableStatus.ACTIVE || status == VariableStatus.COMPUTED
                        || (status == VariableStatus.UNUSED && aliasTargets.contains(spec.getRef()))) {
                    output.add(declaration(spec, status == VariableStatus.COMPUTED) + ";");
                }
            }
        }
        for (final VarKind kind: DECLARATION_ORDER) {
            for (final VariableSpec spec: compiledModel.variables(kind, VariableStatus.ALIASED)) {
                final VarRef root = compiledModel.aliasRoot(spec.getRef());
                output.add(declaration(spec, false) + " = " + model.variable(root).getName() + ";");
            }
        }
        for (final ConstraintSpec ct: compiledModel.constraints()) {
            output.add("constraint " + ct.getName() + "(" + printer.visitAll(ct.getArgs(), model, ", ") + ")"
                       + annotations(ct.getAnnotations(), model) + ";");
        }
        for (final DomainConstraint dc: compiledModel.domainConstraints()) {
            output.add("constraint set_in(" + model.variable(dc.getVariable()).getName() + ", "
                       + FlatZincPrinter.domain(dc.getDomain()) + ");");
        }
        output.add(solve(compiledModel.getGoal(), model));
        LOG.debug("Generated {} FlatZinc items", output.size());
        return output;
    }

    private String declaration(final VariableSpec spec, final boolean computed) {
        final StringBuilder sb = new StringBuilder("var ");
        switch (spec.getKind()) {
            case BOOL:
                sb.append("bool");
                break;
            case INT:
                sb.append(FlatZincPrinter.domain(spec.effectiveDomain()));
                break;
            case SET:
                sb.append("set of ").append(FlatZincPrinter.domain(spec.effectiveDomain()));
                break;
            default:
                throw new IllegalArgumentException(spec.getKind().name());
        }
        sb.append(": ").append(spec.getName());
        if (spec.isIntroduced()) {
            sb.append(" :: var_is_introduced");
        }
        if (computed) {
            sb.append(" :: is_defined_var");
        }
        if (spec.getKind() == VarKind.BOOL && spec.isFixed() && !spec.isAliased()) {
            sb.append(" = ").append(spec.fixedValue() == 1);
        }
        return sb.toString();
    }

    private String annotations(final List<Node> annotations, final FlatModel model) {
        return annotations.isEmpty() ? "" : " :: " + printer.visitAll(annotations, model, " :: ");
    }

    private String solve(final SolveGoal goal, final FlatModel model) {
        final String prefix = "solve" + annotations(goal.getAnnotations(), model);
        final Node objective = goal.getObjective();
        switch (goal.getType()) {
            case SATISFY:
                return prefix + " satisfy;";
            case MINIMIZE:
                return prefix + " minimize " + printer.visit(Objects.requireNonNull(objective), model) + ";";
            case MAXIMIZE:
                return prefix + " maximize " + printer.visit(Objects.requireNonNull(objective), model) + ";";
            default:
                throw new IllegalArgumentException(goal.getType().name());
        }
    }
}

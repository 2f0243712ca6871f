/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler;

import com.vmware.fzc.model.Domain;
import com.vmware.fzc.model.VarRef;

import java.util.Objects;

/**
 * A domain the backend must enforce on a variable with an explicit {@code set_in} constraint, because
 * the variable's declaration does not carry it.
 */
public final class DomainConstraint {
    private final VarRef variable;
    private final Domain domain;

    public DomainConstraint(final VarRef variable, final Domain domain) {
        this.variable = variable;
        this.domain = domain;
    }

    public VarRef getVariable() {
        return variable;
    }

    public Domain getDomain() {
        return domain;
    }

    @Override
    public boolean equals(final Object o) {
        if (!(o instanceof DomainConstraint)) {
            return false;
        }
        final DomainConstraint that = (DomainConstraint) o;
        return variable.equals(that.variable) && domain.equals(that.domain);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, domain);
    }

    @Override
    public String toString() {
        return "set_in(" + variable + ", " + domain + ")";
    }
}

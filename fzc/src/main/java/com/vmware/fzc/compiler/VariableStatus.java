/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler;

/**
 * How a backend should realise a variable of a compiled model.
 */
public enum VariableStatus {
    /** A decision variable. */
    ACTIVE,
    /** A reference to its alias root. */
    ALIASED,
    /** Not a decision variable: its value follows from the constraint that defines it. */
    COMPUTED,
    /** Introduced and no longer referenced; need not be realised at all. */
    UNUSED
}

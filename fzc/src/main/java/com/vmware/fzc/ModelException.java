/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc;

/**
 * Raised when a compilation cannot continue: the input or an earlier pass broke an invariant that every
 * later pass relies on, so no partial result is safe to hand to a backend.
 */
public class ModelException extends RuntimeException {
    public ModelException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ModelException(final Exception e) {
        super(e);
    }

    public ModelException(final String message) {
        super(message);
    }

    public static ModelException invariant(final String phase, final String what, final int index) {
        return new ModelException(String.format("[%s] %s %d", phase, what, index));
    }
}

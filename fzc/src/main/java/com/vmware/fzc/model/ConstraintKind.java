/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.model;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSetMultimap;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;

import javax.annotation.Nullable;

/**
 * The constraint names the compiler knows about. Any other name is {@link #OTHER}: it is kept as-is,
 * never rewritten and never scheduled as defining a variable.
 *
 * Rewrites may only change a constraint's kind along the edges of {@link #transitions()}, a finite
 * acyclic graph. This is what bounds the number of retags a single constraint can go through.
 */
public enum ConstraintKind {
    INT_EQ("int_eq"),
    INT_NE("int_ne"),
    INT_LE("int_le"),
    INT_LT("int_lt"),
    INT_GE("int_ge"),
    INT_GT("int_gt"),
    INT_EQ_REIF("int_eq_reif"),
    INT_NE_REIF("int_ne_reif"),
    INT_LE_REIF("int_le_reif"),
    INT_LT_REIF("int_lt_reif"),
    INT_GE_REIF("int_ge_reif"),
    INT_GT_REIF("int_gt_reif"),
    INT_LIN_EQ("int_lin_eq"),
    INT_LIN_NE("int_lin_ne"),
    INT_LIN_LE("int_lin_le"),
    INT_LIN_LT("int_lin_lt"),
    INT_LIN_GE("int_lin_ge"),
    INT_LIN_GT("int_lin_gt"),
    INT_LIN_EQ_REIF("int_lin_eq_reif"),
    INT_LIN_NE_REIF("int_lin_ne_reif"),
    INT_LIN_LE_REIF("int_lin_le_reif"),
    INT_LIN_LT_REIF("int_lin_lt_reif"),
    INT_LIN_GE_REIF("int_lin_ge_reif"),
    INT_LIN_GT_REIF("int_lin_gt_reif"),
    INT_PLUS("int_plus"),
    INT_MINUS("int_minus"),
    INT_TIMES("int_times"),
    INT_DIV("int_div"),
    INT_MOD("int_mod"),
    INT_ABS("int_abs"),
    INT_MAX("int_max"),
    INT_MIN("int_min"),
    MAXIMUM_INT("maximum_int"),
    MINIMUM_INT("minimum_int"),
    BOOL_EQ("bool_eq"),
    BOOL_NOT("bool_not"),
    BOOL_LE("bool_le"),
    BOOL_LT("bool_lt"),
    BOOL_GE("bool_ge"),
    BOOL_GT("bool_gt"),
    BOOL_EQ_REIF("bool_eq_reif"),
    BOOL_NE_REIF("bool_ne_reif"),
    BOOL_LE_REIF("bool_le_reif"),
    BOOL_LT_REIF("bool_lt_reif"),
    BOOL_AND("bool_and"),
    BOOL_OR("bool_or"),
    BOOL_XOR("bool_xor"),
    BOOL_CLAUSE("bool_clause"),
    BOOL2INT("bool2int"),
    ARRAY_BOOL_AND("array_bool_and"),
    ARRAY_BOOL_OR("array_bool_or"),
    ARRAY_INT_ELEMENT("array_int_element"),
    ARRAY_VAR_INT_ELEMENT("array_var_int_element"),
    ARRAY_BOOL_ELEMENT("array_bool_element"),
    ARRAY_VAR_BOOL_ELEMENT("array_var_bool_element"),
    SET_IN("set_in"),
    SET_IN_REIF("set_in_reif"),
    ALL_DIFFERENT_INT("all_different_int"),
    FALSE_CONSTRAINT("false_constraint"),
    OTHER("");

    private static final Map<String, ConstraintKind> BY_NAME = Arrays.stream(values())
            .filter(kind -> kind != OTHER)
            .collect(ImmutableMap.toImmutableMap(ConstraintKind::fznName, Function.identity()));

    /*
     * Reified kinds and their plain counterparts: the kind used when the reification literal is
     * true, then the one used when it is false.
     */
    private static final Map<ConstraintKind, ConstraintKind[]> UNREIFIED =
            ImmutableMap.<ConstraintKind, ConstraintKind[]>builder()
            .put(INT_EQ_REIF, new ConstraintKind[]{INT_EQ, INT_NE})
            .put(INT_NE_REIF, new ConstraintKind[]{INT_NE, INT_EQ})
            .put(INT_LE_REIF, new ConstraintKind[]{INT_LE, INT_GT})
            .put(INT_LT_REIF, new ConstraintKind[]{INT_LT, INT_GE})
            .put(INT_GE_REIF, new ConstraintKind[]{INT_GE, INT_LT})
            .put(INT_GT_REIF, new ConstraintKind[]{INT_GT, INT_LE})
            .put(INT_LIN_EQ_REIF, new ConstraintKind[]{INT_LIN_EQ, INT_LIN_NE})
            .put(INT_LIN_NE_REIF, new ConstraintKind[]{INT_LIN_NE, INT_LIN_EQ})
            .put(INT_LIN_LE_REIF, new ConstraintKind[]{INT_LIN_LE, INT_LIN_GT})
            .put(INT_LIN_LT_REIF, new ConstraintKind[]{INT_LIN_LT, INT_LIN_GE})
            .put(INT_LIN_GE_REIF, new ConstraintKind[]{INT_LIN_GE, INT_LIN_LT})
            .put(INT_LIN_GT_REIF, new ConstraintKind[]{INT_LIN_GT, INT_LIN_LE})
            .put(BOOL_EQ_REIF, new ConstraintKind[]{BOOL_EQ, BOOL_NOT})
            .put(BOOL_NE_REIF, new ConstraintKind[]{BOOL_NOT, BOOL_EQ})
            .put(BOOL_LE_REIF, new ConstraintKind[]{BOOL_LE, BOOL_GT})
            .put(BOOL_LT_REIF, new ConstraintKind[]{BOOL_LT, BOOL_GE})
            .build();

    private static final ImmutableSetMultimap<ConstraintKind, ConstraintKind> TRANSITIONS =
            buildTransitions();

    private final String fznName;

    ConstraintKind(final String fznName) {
        this.fznName = fznName;
    }

    public String fznName() {
        return fznName;
    }

    /**
     * Maps a constraint name to its kind; names this compiler has no rules for map to {@link #OTHER}.
     */
    public static ConstraintKind fromName(final String name) {
        return BY_NAME.getOrDefault(name, OTHER);
    }

    /**
     * Reified kinds take their reification literal as the last argument.
     */
    public boolean isReified() {
        return this == SET_IN_REIF || UNREIFIED.containsKey(this);
    }

    /**
     * The kind this reified constraint becomes once its literal is known to be true.
     */
    @Nullable
    public ConstraintKind unreified() {
        if (this == SET_IN_REIF) {
            return SET_IN;
        }
        final ConstraintKind[] plain = UNREIFIED.get(this);
        return plain == null ? null : plain[0];
    }

    /**
     * The kind this reified constraint becomes once its literal is known to be false, when the
     * negation is itself a constraint kind.
     */
    @Nullable
    public ConstraintKind negated() {
        final ConstraintKind[] plain = UNREIFIED.get(this);
        return plain == null ? null : plain[1];
    }

    public boolean isLinear() {
        return name().startsWith("INT_LIN_");
    }

    /**
     * Whether a constraint of this kind functionally determines one of its arguments, and can thus
     * carry a {@code defines_var} designation.
     */
    public boolean canDefine() {
        if (isReified()) {
            return true;
        }
        switch (this) {
            case INT_EQ:
            case INT_LIN_EQ:
            case INT_PLUS:
            case INT_MINUS:
            case INT_TIMES:
            case INT_DIV:
            case INT_MOD:
            case INT_ABS:
            case INT_MAX:
            case INT_MIN:
            case MAXIMUM_INT:
            case MINIMUM_INT:
            case BOOL_EQ:
            case BOOL_NOT:
            case BOOL_AND:
            case BOOL_OR:
            case BOOL_XOR:
            case BOOL2INT:
            case ARRAY_BOOL_AND:
            case ARRAY_BOOL_OR:
            case ARRAY_INT_ELEMENT:
            case ARRAY_VAR_INT_ELEMENT:
            case ARRAY_BOOL_ELEMENT:
            case ARRAY_VAR_BOOL_ELEMENT:
                return true;
            default:
                return false;
        }
    }

    public boolean canTransitionTo(final ConstraintKind target) {
        return this == target || TRANSITIONS.containsEntry(this, target);
    }

    /**
     * Every kind change a rewrite may perform, as a {@code from -> to} multimap.
     */
    public static ImmutableSetMultimap<ConstraintKind, ConstraintKind> transitions() {
        return TRANSITIONS;
    }

    private static ImmutableSetMultimap<ConstraintKind, ConstraintKind> buildTransitions() {
        final ImmutableSetMultimap.Builder<ConstraintKind, ConstraintKind> builder =
                ImmutableSetMultimap.builder();
        UNREIFIED.forEach((reified, plain) -> builder.putAll(reified, plain));
        builder.put(SET_IN_REIF, SET_IN);

        // strict linear inequalities and orientation of linear inequalities
        builder.put(INT_LIN_LT, INT_LIN_LE);
        builder.put(INT_LIN_GT, INT_LIN_GE);
        builder.put(INT_LIN_LE, INT_LIN_GE);
        builder.put(INT_LIN_LT_REIF, INT_LIN_LE_REIF);
        builder.put(INT_LIN_GT_REIF, INT_LIN_GE_REIF);
        builder.put(INT_LIN_LE_REIF, INT_LIN_GE_REIF);

        // one- and two-term linear constraints become comparisons
        builder.put(INT_LIN_EQ, INT_EQ);
        builder.put(INT_LIN_NE, INT_NE);
        builder.put(INT_LIN_LE, INT_LE);
        builder.put(INT_LIN_LT, INT_LT);
        builder.put(INT_LIN_GE, INT_GE);
        builder.put(INT_LIN_GT, INT_GT);
        builder.put(INT_LIN_EQ_REIF, INT_EQ_REIF);
        builder.put(INT_LIN_NE_REIF, INT_NE_REIF);
        builder.put(INT_LIN_LE_REIF, INT_LE_REIF);
        builder.put(INT_LIN_LT_REIF, INT_LT_REIF);
        builder.put(INT_LIN_GE_REIF, INT_GE_REIF);
        builder.put(INT_LIN_GT_REIF, INT_GT_REIF);

        // constant evaluation
        for (final ConstraintKind kind: new ConstraintKind[]{INT_LIN_EQ, INT_LIN_NE, INT_LIN_LE, INT_LIN_LT,
                                                              INT_LIN_GE, INT_LIN_GT, INT_EQ, INT_NE, INT_LE,
                                                              INT_LT, INT_GE, INT_GT, BOOL_EQ, BOOL_NOT,
                                                              BOOL_LE, BOOL_LT, BOOL_GE, BOOL_GT, SET_IN}) {
            builder.put(kind, FALSE_CONSTRAINT);
        }
        for (final ConstraintKind kind: new ConstraintKind[]{INT_LIN_EQ_REIF, INT_LIN_NE_REIF, INT_LIN_LE_REIF,
                                                              INT_LIN_LT_REIF, INT_LIN_GE_REIF, INT_LIN_GT_REIF}) {
            builder.put(kind, BOOL_EQ);
        }

        // reified equalities over the same operands, and absolute value substitution
        builder.putAll(INT_EQ_REIF, BOOL_EQ, BOOL_NOT);
        builder.putAll(INT_NE_REIF, BOOL_EQ, BOOL_NOT);
        builder.putAll(INT_LE_REIF, INT_EQ_REIF, SET_IN_REIF);

        builder.putAll(BOOL_XOR, BOOL_EQ, BOOL_NOT);
        builder.put(ARRAY_VAR_INT_ELEMENT, INT_EQ);
        builder.put(ARRAY_VAR_BOOL_ELEMENT, BOOL_EQ);

        // chains of binary max/min folded into one n-ary constraint
        builder.put(INT_MAX, MAXIMUM_INT);
        builder.put(INT_MIN, MINIMUM_INT);
        return builder.build();
    }
}

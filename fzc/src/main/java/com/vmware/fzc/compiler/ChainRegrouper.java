/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.vmware.fzc.model.ConstraintKind;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.FlatModel;
import com.vmware.fzc.model.Node;
import com.vmware.fzc.model.Nodes;
import com.vmware.fzc.model.VarRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattening {@code m = max([v1, ..., vn])} produces a chain of binary constraints
 * <pre>
 *   int_max(v1, v1, t1)
 *   int_max(v2, t1, t2)
 *   ...
 *   int_max(vn, tn-1, m)
 * </pre>
 * This pass folds such a chain back into {@code maximum_int(m, [v1, ..., vn])} (likewise for
 * {@code int_min}). A chain is folded only if every intermediate {@code ti} is an introduced variable that
 * nothing but its two neighbouring links references, and no {@code ti} is also one of the {@code vi}.
 */
final class ChainRegrouper {
    private static final Logger LOG = LoggerFactory.getLogger(ChainRegrouper.class);

    private ChainRegrouper() {
    }

    /**
     * @return the number of chains folded
     */
    static int apply(final FlatModel model, final VariableOccurrences occurrences) {
        int folded = 0;
        final List<ConstraintSpec> chain = new ArrayList<>();
        for (final ConstraintSpec ct: model.constraints().active()) {
            if (!chain.isEmpty() && continuesChain(chain, ct)) {
                chain.add(ct);
                continue;
            }
            folded += fold(model, chain, occurrences);
            chain.clear();
            if (isStart(ct)) {
                chain.add(ct);
            }
        }
        folded += fold(model, chain, occurrences);
        return folded;
    }

    private static boolean isStart(final ConstraintSpec ct) {
        return (ct.getKind() == ConstraintKind.INT_MAX || ct.getKind() == ConstraintKind.INT_MIN)
                && ct.arity() == 3 && ct.arg(0).isVarRef() && ct.arg(0).equals(ct.arg(1)) && ct.arg(2).isVarRef();
    }

    /**
     * A link continues the chain if it consumes the last carry and none of the chain's carries is its
     * element or its result.
     */
    private static boolean continuesChain(final List<ConstraintSpec> chain, final ConstraintSpec ct) {
        final ConstraintSpec last = chain.get(chain.size() - 1);
        if (ct.getKind() != last.getKind() || ct.arity() != 3 || !ct.arg(1).equals(last.arg(2))
                || !ct.arg(2).isVarRef()) {
            return false;
        }
        for (final ConstraintSpec link: chain) {
            if (ct.arg(0).equals(link.arg(2)) || ct.arg(2).equals(link.arg(2))) {
                return false;
            }
        }
        return true;
    }

    private static int fold(final FlatModel model, final List<ConstraintSpec> chain,
                            final VariableOccurrences occurrences) {
        if (chain.size() < 2) {
            return 0;
        }
        for (int i = 0; i < chain.size() - 1; i++) {
            final VarRef carry = (VarRef) chain.get(i).arg(2);
            final ImmutableSet<Integer> links = ImmutableSet.of(chain.get(i).getIndex(), chain.get(i + 1).getIndex());
            if (!model.variable(carry).isIntroduced() || occurrences.inGoal(carry)
                    || !occurrences.constraintsOf(carry).equals(links)) {
                LOG.debug("Not regrouping chain starting at {}: {} is used outside the chain",
                          chain.get(0), model.variable(carry).getName());
                return 0;
            }
        }
        final ConstraintSpec start = chain.get(0);
        final ImmutableList.Builder<Node> elements = ImmutableList.builder();
        for (final ConstraintSpec link: chain) {
            elements.add(link.arg(0));
        }
        final VarRef out = (VarRef) chain.get(chain.size() - 1).arg(2);
        final ConstraintKind kind = start.getKind() == ConstraintKind.INT_MAX ? ConstraintKind.MAXIMUM_INT
                                                                              : ConstraintKind.MINIMUM_INT;
        start.transition(kind, ImmutableList.of(out, Nodes.array(elements.build())));
        start.setDefinesVar(out);
        for (final ConstraintSpec link: chain.subList(1, chain.size())) {
            link.nullify();
        }
        LOG.debug("Regrouped chain of {} {} constraints into {}", chain.size(),
                  kind == ConstraintKind.MAXIMUM_INT ? "int_max" : "int_min", start);
        return 1;
    }
}

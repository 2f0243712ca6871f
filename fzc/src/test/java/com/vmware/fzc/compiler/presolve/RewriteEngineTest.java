/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.fzc.compiler.presolve;

import com.google.common.collect.ImmutableList;
import com.vmware.fzc.ModelDefect;
import com.vmware.fzc.ModelException;
import com.vmware.fzc.compiler.AliasMap;
import com.vmware.fzc.compiler.AliasUnifier;
import com.vmware.fzc.compiler.DomainConstraint;
import com.vmware.fzc.model.BoolLiteral;
import com.vmware.fzc.model.BoolVarRef;
import com.vmware.fzc.model.CanonicalReferences;
import com.vmware.fzc.model.ConstraintKind;
import com.vmware.fzc.model.ConstraintSpec;
import com.vmware.fzc.model.Domain;
import com.vmware.fzc.model.FlatModel;
import com.vmware.fzc.model.IntVarRef;
import com.vmware.fzc.model.Nodes;
import com.vmware.fzc.model.VarKind;
import com.vmware.fzc.model.VarRef;
import com.vmware.fzc.model.VariableSpec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RewriteEngineTest {
    private final List<ModelDefect> defects = new ArrayList<>();

    private int presolve(final FlatModel model) {
        final AliasUnifier unifier = new AliasUnifier(model, new AliasMap(CanonicalReferences.of(model)), defects,
                                                      new ArrayList<DomainConstraint>());
        return new RewriteEngine(1000).apply(model, unifier, defects);
    }

    private static VarRef fixed(final FlatModel model, final VarKind kind, final String name, final long value) {
        return model.addVariable(VariableSpec.builder(kind, name).setValue(value));
    }

    static Stream<Arguments> linearNormalizations() {
        return Stream.of(
                Arguments.of("int_lin_lt", new long[]{1, 2, 3}, 5, ConstraintKind.INT_LIN_LE, new long[]{1, 2, 3}, 4),
                Arguments.of("int_lin_gt", new long[]{1, 1, 1}, 0, ConstraintKind.INT_LIN_GE, new long[]{1, 1, 1}, 1),
                Arguments.of("int_lin_le", new long[]{-1, -2, -3}, 5, ConstraintKind.INT_LIN_GE,
                             new long[]{1, 2, 3}, -5),
                Arguments.of("int_lin_eq", new long[]{-1, -2, -3}, 5, ConstraintKind.INT_LIN_EQ,
                             new long[]{1, 2, 3}, -5),
                Arguments.of("int_lin_le", new long[]{-1, 2, -3}, 5, ConstraintKind.INT_LIN_LE,
                             new long[]{-1, 2, -3}, 5)
        );
    }

    @ParameterizedTest
    @MethodSource("linearNormalizations")
    public void normalizesLinearConstraints(final String name, final long[] coefficients, final long rhs,
                                            final ConstraintKind expectedKind, final long[] expectedCoefficients,
                                            final long expectedRhs) {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x", -10, 10);
        final IntVarRef y = model.newIntVar("y", -10, 10);
        final IntVarRef z = model.newIntVar("z", -10, 10);
        final ConstraintSpec ct = model.addConstraint(name, Nodes.ints(coefficients), Nodes.array(x, y, z),
                                                      Nodes.literal(rhs));
        presolve(model);

        assertTrue(ct.isActive());
        assertEquals(expectedKind, ct.getKind());
        assertEquals(ImmutableList.of(Nodes.ints(expectedCoefficients), Nodes.array(x, y, z),
                                      Nodes.literal(expectedRhs)), ct.getArgs());
        assertTrue(defects.isEmpty());
    }

    @Test
    public void linearNormalizationStopsAtTheEndOfTheLongRange() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x", -10, 10);
        final IntVarRef y = model.newIntVar("y", -10, 10);
        final ConstraintSpec lessThanMin = model.addConstraint("int_lin_lt", Nodes.ints(1, 1), Nodes.array(x, y),
                                                               Nodes.literal(Long.MIN_VALUE));
        final ConstraintSpec greaterThanMax = model.addConstraint("int_lin_gt", Nodes.ints(1, 1), Nodes.array(x, y),
                                                                  Nodes.literal(Long.MAX_VALUE));
        final ConstraintSpec negativeMinRhs = model.addConstraint("int_lin_le", Nodes.ints(-1, -1),
                                                                  Nodes.array(x, y), Nodes.literal(Long.MIN_VALUE));
        final ConstraintSpec negativeMinCoefficient = model.addConstraint("int_lin_le",
                Nodes.ints(Long.MIN_VALUE, -1), Nodes.array(x, y), Nodes.literal(0));
        final AliasUnifier unifier = new AliasUnifier(model, new AliasMap(CanonicalReferences.of(model)), defects,
                                                      new ArrayList<DomainConstraint>());
        final PresolveContext context = new PresolveContext(model, unifier, defects);

        assertFalse(new StrictLinearRule().rewrite(lessThanMin, context));
        assertFalse(new StrictLinearRule().rewrite(greaterThanMax, context));
        assertFalse(new LinearOrientationRule().rewrite(negativeMinRhs, context));
        assertFalse(new LinearOrientationRule().rewrite(negativeMinCoefficient, context));
        assertEquals(ConstraintKind.INT_LIN_LT, lessThanMin.getKind());
        assertEquals(Nodes.literal(Long.MIN_VALUE), lessThanMin.arg(2));
        assertEquals(ConstraintKind.INT_LIN_GT, greaterThanMax.getKind());
        assertEquals(ImmutableList.of(Nodes.ints(-1, -1), Nodes.array(x, y), Nodes.literal(Long.MIN_VALUE)),
                     negativeMinRhs.getArgs());
        assertEquals(Nodes.ints(Long.MIN_VALUE, -1), negativeMinCoefficient.arg(0));
    }

    @Test
    public void boundsPositiveLinearSums() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x", 0, 10);
        final IntVarRef y = model.newIntVar("y", 0, 10);
        final IntVarRef z = model.newIntVar("z", 0, 10);
        final ConstraintSpec ct = model.addConstraint("int_lin_le", Nodes.ints(1, 2, 3), Nodes.array(x, y, z),
                                                      Nodes.literal(5));
        presolve(model);

        assertTrue(ct.isActive());
        assertEquals(Domain.interval(0, 5), model.variable(x).effectiveDomain());
        assertEquals(Domain.interval(0, 2), model.variable(y).effectiveDomain());
        assertEquals(Domain.interval(0, 1), model.variable(z).effectiveDomain());
    }

    @Test
    public void absorbsSingleTermConstraints() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x", 0, 10);
        final IntVarRef y = model.newIntVar("y", 0, 10);
        final ConstraintSpec odd = model.addConstraint("int_lin_le", Nodes.ints(2), Nodes.array(x), Nodes.literal(7));
        final ConstraintSpec even = model.addConstraint("int_lin_le", Nodes.ints(2), Nodes.array(y),
                                                        Nodes.literal(8));
        presolve(model);

        assertTrue(odd.isNullified());
        assertTrue(even.isNullified());
        assertEquals(Domain.interval(0, 3), model.variable(x).effectiveDomain());
        assertEquals(Domain.interval(0, 4), model.variable(y).effectiveDomain());
    }

    @Test
    public void regroupsRepeatedTerms() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x", -10, 10);
        final IntVarRef y = model.newIntVar("y", -10, 10);
        final VarRef three = fixed(model, VarKind.INT, "three", 3);
        final ConstraintSpec ct = model.addConstraint("int_lin_le", Nodes.ints(1, 1, -1, 2),
                                                      Nodes.array(x, x, y, three), Nodes.literal(9));
        presolve(model);

        assertEquals(ConstraintKind.INT_LIN_LE, ct.getKind());
        assertEquals(ImmutableList.of(Nodes.ints(2, -1), Nodes.array(x, y), Nodes.literal(3)), ct.getArgs());
    }

    @Test
    public void differenceOfTwoTermsBecomesComparison() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x", -10, 10);
        final IntVarRef y = model.newIntVar("y", -10, 10);
        final ConstraintSpec ct = model.addConstraint("int_lin_ne", Nodes.ints(-1, 1), Nodes.array(x, y),
                                                      Nodes.literal(0));
        presolve(model);

        assertEquals(ConstraintKind.INT_NE, ct.getKind());
        assertEquals(ImmutableList.of(y, x), ct.getArgs());
    }

    @Test
    public void constantLinearConstraints() {
        final FlatModel model = new FlatModel();
        final VarRef one = fixed(model, VarKind.INT, "one", 1);
        final VarRef two = fixed(model, VarKind.INT, "two", 2);
        final ConstraintSpec holds = model.addConstraint("int_lin_eq", Nodes.ints(1, 1), Nodes.array(one, two),
                                                         Nodes.literal(3));
        final ConstraintSpec fails = model.addConstraint("int_lin_eq", Nodes.ints(1, 1), Nodes.array(one, two),
                                                         Nodes.literal(5));
        presolve(model);

        assertTrue(holds.isNullified());
        assertTrue(fails.isActive());
        assertEquals(ConstraintKind.FALSE_CONSTRAINT, fails.getKind());
        assertTrue(fails.getArgs().isEmpty());
        assertEquals(1, defects.size());
        assertEquals(fails.getIndex(), defects.get(0).getConstraintIndex());
        assertEquals(RewriteEngine.PHASE, defects.get(0).getPhase());
    }

    @Test
    public void comparisonsNarrowDomains() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x", 0, 10);
        final IntVarRef y = model.newIntVar("y", 0, 10);
        final IntVarRef z = model.newIntVar("z", 0, 10);
        final ConstraintSpec lt = model.addConstraint("int_lt", x, y);
        final ConstraintSpec le = model.addConstraint("int_le", z, Nodes.literal(5));
        presolve(model);

        assertTrue(lt.isActive());
        assertTrue(le.isNullified());
        assertEquals(Domain.interval(0, 9), model.variable(x).effectiveDomain());
        assertEquals(Domain.interval(1, 10), model.variable(y).effectiveDomain());
        assertEquals(Domain.interval(0, 5), model.variable(z).effectiveDomain());
    }

    @Test
    public void emptyNarrowingIsADefect() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x", 0, 10);
        final ConstraintSpec ct = model.addConstraint("int_le", x, Nodes.literal(-1));
        presolve(model);

        assertTrue(ct.isNullified());
        assertEquals(Domain.interval(0, 10), model.variable(x).effectiveDomain());
        assertEquals(1, defects.size());
        assertEquals(ct.getIndex(), defects.get(0).getConstraintIndex());
    }

    @Test
    public void disequalitiesAndMembership() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x", 0, 5);
        final IntVarRef y = model.newIntVar("y", 0, 10);
        final ConstraintSpec ne = model.addConstraint("int_ne", x, Nodes.literal(3));
        final ConstraintSpec in = model.addConstraint("set_in", y, Nodes.set(2, 4));
        presolve(model);

        assertTrue(ne.isNullified());
        assertTrue(in.isNullified());
        assertEquals(Domain.of(0, 1, 2, 4, 5), model.variable(x).effectiveDomain());
        assertEquals(Domain.interval(2, 4), model.variable(y).effectiveDomain());
    }

    @Test
    public void equalityOfVariablesBecomesAnAlias() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x", 0, 10);
        final IntVarRef y = model.newIntVar("y", 5, 20);
        final ConstraintSpec eq = model.addConstraint("int_eq", x, y);
        final ConstraintSpec user = model.addConstraint("int_le", y, Nodes.literal(8));
        presolve(model);

        assertTrue(eq.isNullified());
        assertTrue(model.variable(y).isAliased());
        assertFalse(model.variable(x).isAliased());
        assertTrue(user.isNullified());
        assertEquals(Domain.interval(5, 8), model.variable(x).effectiveDomain());
    }

    @Test
    public void equalityOfDisjointVariablesIsADefect() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x", 0, 3);
        final IntVarRef y = model.newIntVar("y", 5, 9);
        final ConstraintSpec eq = model.addConstraint("int_eq", x, y);
        presolve(model);

        assertTrue(eq.isNullified());
        assertTrue(model.variable(y).isAliased());
        assertEquals(Domain.interval(0, 3), model.variable(x).effectiveDomain());
        assertEquals(1, defects.size());
        assertEquals(AliasUnifier.PHASE, defects.get(0).getPhase());
        assertEquals("domains of y and x do not intersect", defects.get(0).getMessage());
    }

    @Test
    public void fixedLiteralUnreifies() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x", 0, 10);
        final IntVarRef y = model.newIntVar("y", 0, 10);
        final VarRef no = fixed(model, VarKind.BOOL, "no", 0);
        final ConstraintSpec ct = model.addConstraint("int_le_reif", x, y, no);
        presolve(model);

        assertEquals(ConstraintKind.INT_GT, ct.getKind());
        assertEquals(ImmutableList.of(x, y), ct.getArgs());
        assertEquals(Domain.interval(1, 10), model.variable(x).effectiveDomain());
        assertEquals(Domain.interval(0, 9), model.variable(y).effectiveDomain());
    }

    @Test
    public void reifiedComparisonDecidedByDomains() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x", 0, 10);
        final BoolVarRef b = model.newBoolVar("b");
        final BoolVarRef c = model.newBoolVar("c");
        final ConstraintSpec always = model.addConstraint("int_le_reif", x, Nodes.literal(20), b);
        final ConstraintSpec never = model.addConstraint("int_eq_reif", x, Nodes.literal(11), c);
        presolve(model);

        assertTrue(always.isNullified());
        assertTrue(never.isNullified());
        assertEquals(1, model.variable(b).fixedValue());
        assertEquals(0, model.variable(c).fixedValue());
    }

    @Test
    public void absoluteValueIsSubstituted() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x", -5, 3);
        final IntVarRef y = model.newIntVar("y");
        final BoolVarRef b = model.newBoolVar("b");
        final BoolVarRef c = model.newBoolVar("c");
        model.addConstraint("int_abs", x, y);
        final ConstraintSpec isZero = model.addConstraint("int_eq_reif", y, Nodes.literal(0), b);
        final ConstraintSpec isSmall = model.addConstraint("int_le_reif", y, Nodes.literal(2), c);
        presolve(model);

        assertEquals(Domain.interval(0, 5), model.variable(y).effectiveDomain());
        assertEquals(ConstraintKind.INT_EQ_REIF, isZero.getKind());
        assertEquals(ImmutableList.of(x, Nodes.literal(0), b), isZero.getArgs());
        assertEquals(ConstraintKind.SET_IN_REIF, isSmall.getKind());
        assertEquals(ImmutableList.of(x, Nodes.set(-2, 2), c), isSmall.getArgs());
    }

    @Test
    public void repeatedReifiedTestsAreMerged() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x", 0, 10);
        final BoolVarRef b1 = model.newBoolVar("b1");
        final BoolVarRef b2 = model.newBoolVar("b2");
        final BoolVarRef b3 = model.newBoolVar("b3");
        model.addConstraint("int_eq_reif", x, Nodes.literal(3), b1);
        final ConstraintSpec opposite = model.addConstraint("int_ne_reif", x, Nodes.literal(3), b2);
        final ConstraintSpec same = model.addConstraint("int_eq_reif", x, Nodes.literal(3), b3);
        presolve(model);

        assertEquals(ConstraintKind.BOOL_NOT, opposite.getKind());
        assertEquals(ImmutableList.of(b1, b2), opposite.getArgs());
        assertTrue(same.isNullified());
        assertTrue(model.variable(b3).isAliased() || model.variable(b1).isAliased());
    }

    @Test
    public void xorWithConstant() {
        final FlatModel model = new FlatModel();
        final BoolVarRef a = model.newBoolVar("a");
        final BoolVarRef b = model.newBoolVar("b");
        final ConstraintSpec ct = model.addConstraint("bool_xor", a, b, BoolLiteral.TRUE);
        presolve(model);

        assertEquals(ConstraintKind.BOOL_NOT, ct.getKind());
        assertEquals(ImmutableList.of(a, b), ct.getArgs());
    }

    @Test
    public void booleanConjunctionWithTrueResult() {
        final FlatModel model = new FlatModel();
        final BoolVarRef a = model.newBoolVar("a");
        final BoolVarRef b = model.newBoolVar("b");
        final IntVarRef i = model.newIntVar("i");
        final ConstraintSpec and = model.addConstraint("array_bool_and", Nodes.array(a, b), BoolLiteral.TRUE);
        final ConstraintSpec toInt = model.addConstraint("bool2int", a, i);
        presolve(model);

        assertTrue(and.isNullified());
        assertTrue(toInt.isNullified());
        assertEquals(1, model.variable(a).fixedValue());
        assertEquals(1, model.variable(b).fixedValue());
        assertEquals(1, model.variable(i).fixedValue());
    }

    @Test
    public void elementBoundsIndexAndResult() {
        final FlatModel model = new FlatModel();
        final IntVarRef index = model.newIntVar("index", 0, 5);
        final IntVarRef result = model.newIntVar("result");
        final ConstraintSpec ct = model.addConstraint("array_int_element", index, Nodes.ints(10, 20, 30), result);
        presolve(model);

        assertTrue(ct.isActive());
        assertEquals(Domain.interval(1, 3), model.variable(index).effectiveDomain());
        assertEquals(Domain.of(10, 20, 30), model.variable(result).effectiveDomain());
    }

    @Test
    public void fixedTargetIsReleased() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x", 0, 10);
        final IntVarRef y = model.newIntVar("y", 0, 10);
        final VarRef z = fixed(model, VarKind.INT, "z", 4);
        final ConstraintSpec ct = model.addConstraint("int_plus", ImmutableList.of(x, y, z),
                                                      ImmutableList.of(Nodes.definesVar(z)));
        presolve(model);

        assertTrue(ct.isActive());
        assertNull(ct.definesVar());
    }

    private static FlatModel mixedModel() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x", 0, 10);
        final IntVarRef y = model.newIntVar("y", 0, 10);
        final IntVarRef z = model.newIntVar("z", -5, 5);
        final IntVarRef w = model.newIntVar("w");
        final BoolVarRef b = model.newBoolVar("b");
        final BoolVarRef c = model.newBoolVar("c");
        model.addConstraint("int_lin_lt", Nodes.ints(1, 1), Nodes.array(x, y), Nodes.literal(8));
        model.addConstraint("int_le", z, Nodes.literal(3));
        model.addConstraint("int_ne", x, Nodes.literal(0));
        model.addConstraint("int_abs", z, w);
        model.addConstraint("int_eq_reif", w, Nodes.literal(0), b);
        model.addConstraint("int_ne_reif", z, Nodes.literal(0), c);
        model.addConstraint("int_lin_le", Nodes.ints(-1, -1), Nodes.array(y, w), Nodes.literal(-2));
        return model;
    }

    private static Map<VarRef, Domain> domains(final FlatModel model) {
        final Map<VarRef, Domain> domains = new HashMap<>();
        for (final VarKind kind: VarKind.values()) {
            for (final VariableSpec spec: model.variables(kind)) {
                domains.put(spec.getRef(), spec.effectiveDomain());
            }
        }
        return domains;
    }

    private static List<String> constraints(final FlatModel model) {
        return model.constraints().stream().map(ct -> ct.isNullified() ? "-" : ct.toString())
                    .collect(Collectors.toList());
    }

    @Test
    public void domainsOnlyShrink() {
        final FlatModel model = mixedModel();
        final Map<VarRef, Domain> before = domains(model);
        presolve(model);

        final Map<VarRef, Domain> after = domains(model);
        assertEquals(before.keySet(), after.keySet());
        for (final Map.Entry<VarRef, Domain> entry: before.entrySet()) {
            assertTrue(after.get(entry.getKey()).isSubsetOf(entry.getValue()), entry.getKey().toString());
        }
        assertEquals(Domain.interval(1, 7), after.get(intVar(model, "x")));
        assertEquals(Domain.interval(0, 6), after.get(intVar(model, "y")));
        assertEquals(Domain.interval(0, 5), after.get(intVar(model, "w")));
        assertTrue(defects.isEmpty());
    }

    private static VarRef intVar(final FlatModel model, final String name) {
        for (final VariableSpec spec: model.variables(VarKind.INT)) {
            if (spec.getName().equals(name)) {
                return spec.getRef();
            }
        }
        throw new IllegalArgumentException(name);
    }

    @Test
    public void fixpointIsStable() {
        final FlatModel model = mixedModel();
        final AliasUnifier unifier = new AliasUnifier(model, new AliasMap(CanonicalReferences.of(model)), defects,
                                                      new ArrayList<DomainConstraint>());
        final RewriteEngine engine = new RewriteEngine(1000);
        assertTrue(engine.apply(model, unifier, defects) > 1);
        final Map<VarRef, Domain> domains = domains(model);
        final List<String> constraints = constraints(model);

        assertEquals(1, engine.apply(model, unifier, defects));
        assertEquals(domains, domains(model));
        assertEquals(constraints, constraints(model));
    }

    @Test
    public void sweepsAreBounded() {
        final FlatModel model = new FlatModel();
        final IntVarRef x = model.newIntVar("x");
        final IntVarRef y = model.newIntVar("y");
        model.addConstraint("int_le", x, y);
        final RewriteRule restless = (ct, context) -> true;
        final RewriteEngine engine = new RewriteEngine(ImmutableList.of(restless), 5);
        final AliasUnifier unifier = new AliasUnifier(model, new AliasMap(CanonicalReferences.of(model)), defects,
                                                      new ArrayList<DomainConstraint>());

        final ModelException e = assertThrows(ModelException.class, () -> engine.apply(model, unifier, defects));
        assertTrue(e.getMessage().contains(RewriteEngine.PHASE));
        assertThrows(IllegalArgumentException.class, () -> new RewriteEngine(ImmutableList.<RewriteRule>of(), 0));
    }
}

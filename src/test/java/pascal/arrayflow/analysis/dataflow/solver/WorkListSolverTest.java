/*
 * Tai-e: A Static Analysis Framework for Java
 *
 * Copyright (C) 2022 Tian Tan <tiantan@nju.edu.cn>
 * Copyright (C) 2022 Yue Li <yueli@nju.edu.cn>
 *
 * This file is part of Tai-e.
 *
 * Tai-e is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License
 * as published by the Free Software Foundation, either version 3
 * of the License, or (at your option) any later version.
 *
 * Tai-e is distributed in the hope that it will be useful,but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY
 * or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Lesser General
 * Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public
 * License along with Tai-e. If not, see <https://www.gnu.org/licenses/>.
 */

package pascal.arrayflow.analysis.dataflow.solver;

import org.junit.Test;
import pascal.arrayflow.analysis.dataflow.analysis.interval.Interval;
import pascal.arrayflow.analysis.dataflow.analysis.interval.IntervalAnalysis;
import pascal.arrayflow.analysis.dataflow.analysis.interval.IntervalFact;
import pascal.arrayflow.analysis.dataflow.analysis.interval.Property;
import pascal.arrayflow.analysis.dataflow.fact.Block;
import pascal.arrayflow.analysis.dataflow.fact.DataflowResult;
import pascal.arrayflow.analysis.graph.cfg.CFG;
import pascal.arrayflow.analysis.graph.cfg.CFGBuilder;
import pascal.arrayflow.analysis.graph.cfg.StmtCFG;
import pascal.arrayflow.config.AnalysisConfig;
import pascal.arrayflow.ir.NameResolver;
import pascal.arrayflow.ir.Program;
import pascal.arrayflow.ir.exp.ArithmeticExp;
import pascal.arrayflow.ir.exp.ArrayLength;
import pascal.arrayflow.ir.exp.ConditionExp;
import pascal.arrayflow.ir.exp.Exp;
import pascal.arrayflow.ir.exp.IntLiteral;
import pascal.arrayflow.ir.exp.Var;
import pascal.arrayflow.ir.exp.VarExp;
import pascal.arrayflow.ir.stmt.Assign;
import pascal.arrayflow.ir.stmt.DeleteArray;
import pascal.arrayflow.ir.stmt.If;
import pascal.arrayflow.ir.stmt.NewArray;
import pascal.arrayflow.ir.stmt.StoreArray;
import pascal.arrayflow.ir.stmt.While;
import pascal.arrayflow.util.AnalysisException;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class WorkListSolverTest {

    private final IntervalAnalysis analysis = new IntervalAnalysis();

    private final NameResolver resolver = new NameResolver();

    private final Var x = resolver.getVar("x");

    private final Var y = resolver.getVar("y");

    private static Exp<Var> lit(int value) {
        return new IntLiteral<>(value);
    }

    private static Exp<Var> ref(Var var) {
        return new VarExp<>(var);
    }

    private static Exp<Var> add(Exp<Var> e1, Exp<Var> e2) {
        return new ArithmeticExp<>(ArithmeticExp.Op.ADD, e1, e2);
    }

    private static Property num(int from, int to) {
        return Property.makeNum(Interval.of(from, to));
    }

    /**
     * x := 0; while (x < 5) x := x + 1
     */
    private CFG counterLoop() {
        Exp<Var> cond = new ConditionExp<>(ConditionExp.Op.LT, ref(x), lit(5));
        return CFGBuilder.build(new Program(List.of(
                new Assign(x, lit(0)),
                new While(cond, List.of(new Assign(x, add(ref(x), lit(1))))))));
    }

    @Test
    public void testStraightLineConverges() {
        CFG cfg = CFGBuilder.build(new Program(List.of(
                new Assign(x, lit(1)),
                new Assign(y, add(ref(x), lit(2))))));
        FixpointTrace trace = new WorkListSolver(analysis).solve(cfg);
        assertTrue(trace.isConverged());
        assertEquals(1, trace.getSnapshots().size());

        DataflowResult<IntervalFact> result = trace.getResult();
        assertTrue(result.getInFact(0).isEmpty());
        assertEquals(num(1, 1), result.getOutFact(0).get(x));
        assertEquals(num(3, 3), result.getOutFact(1).get(y));
        // virtual exit
        assertEquals(result.getOutFact(1), result.getInFact(2));
        assertTrue(result.getOutFact(2).isEmpty());
    }

    @Test
    public void testCounterLoopRunsOutOfFuel() {
        FixpointTrace trace = new WorkListSolver(analysis).solve(counterLoop());
        assertFalse(trace.isConverged());
        assertEquals(10, trace.getSnapshots().size());

        DataflowResult<IntervalFact> first = trace.getSnapshots().get(0);
        assertEquals(num(0, 0), first.getOutFact(0).get(x));
        assertEquals(num(0, 0), first.getInFact(1).get(x));
        assertEquals(num(1, 1), first.getOutFact(2).get(x));

        DataflowResult<IntervalFact> last = trace.getResult();
        assertEquals(num(0, 0), last.getOutFact(0).get(x));
        assertEquals(num(0, 9), last.getInFact(1).get(x));
        assertEquals(num(0, 9), last.getInFact(2).get(x));
        assertEquals(num(1, 10), last.getOutFact(2).get(x));
        assertEquals(num(0, 9), last.getInFact(3).get(x));
    }

    @Test
    public void testLoopBoundGrowsOncePerPass() {
        List<DataflowResult<IntervalFact>> snapshots =
                new WorkListSolver(analysis).solve(counterLoop()).getSnapshots();
        for (int pass = 0; pass < snapshots.size(); ++pass) {
            assertEquals(num(0, pass), snapshots.get(pass).getInFact(1).get(x));
        }
    }

    @Test
    public void testFuelBoundsSnapshots() {
        FixpointTrace trace = new WorkListSolver(analysis, 3).solve(counterLoop());
        assertFalse(trace.isConverged());
        assertEquals(3, trace.getSnapshots().size());
        assertEquals(num(0, 2), trace.getResult().getInFact(1).get(x));
    }

    @Test
    public void testFuelFromOptions() {
        IntervalAnalysis limited = new IntervalAnalysis(
                AnalysisConfig.of(IntervalAnalysis.ID).withOptions(Map.of("fuel", 4)));
        assertEquals(4, limited.analyze(counterLoop()).getSnapshots().size());
    }

    @Test
    public void testZeroFuel() {
        FixpointTrace trace = new WorkListSolver(analysis, 0).solve(counterLoop());
        assertFalse(trace.isConverged());
        assertTrue(trace.getSnapshots().isEmpty());
        assertEquals(trace.getInitial(), trace.getResult());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeFuel() {
        new WorkListSolver(analysis, -1);
    }

    @Test
    public void testInitialResult() {
        DataflowResult<IntervalFact> initial =
                new WorkListSolver(analysis).solve(counterLoop()).getInitial();
        assertEquals(List.of(0, 1, 2), List.copyOf(initial.getNodes()));
        for (int node : initial.getNodes()) {
            assertTrue(initial.getInFact(node).isEmpty());
            assertTrue(initial.getOutFact(node).isEmpty());
        }
    }

    @Test
    public void testSelfLoopOnWhileConverges() {
        // 0: x := 0; 1: while (x < 5) with a back edge to itself; 2: exit
        StmtCFG cfg = new StmtCFG(List.of(
                new Assign(x, lit(0)),
                new While(new ConditionExp<>(ConditionExp.Op.LT, ref(x), lit(5)), List.of())));
        cfg.addEdge(0, 1);
        cfg.addEdge(1, 1);
        cfg.addEdge(1, 2);
        FixpointTrace trace = new WorkListSolver(analysis).solve(cfg);
        assertTrue(trace.isConverged());
        assertEquals(1, trace.getSnapshots().size());
        assertEquals(num(0, 0), trace.getResult().getInFact(1).get(x));
    }

    @Test
    public void testBackEdgeIntoEntryIsIgnored() {
        StmtCFG cfg = new StmtCFG(List.of(
                new Assign(x, lit(0)),
                new Assign(x, add(ref(x), lit(1)))));
        cfg.addEdge(0, 1);
        cfg.addEdge(1, 0);
        cfg.addEdge(1, 2);
        FixpointTrace trace = new WorkListSolver(analysis).solve(cfg);
        assertTrue(trace.isConverged());
        assertTrue(trace.getResult().getInFact(0).isEmpty());
        assertEquals(num(1, 1), trace.getResult().getOutFact(1).get(x));
    }

    @Test
    public void testNothingChanges() {
        // single node without edges, its exit stays empty
        StmtCFG cfg = new StmtCFG(List.of(new DeleteArray(x)));
        FixpointTrace trace = new WorkListSolver(analysis).solve(cfg);
        assertTrue(trace.isConverged());
        assertTrue(trace.getSnapshots().isEmpty());
        assertEquals(trace.getInitial(), trace.getResult());
    }

    @Test
    public void testEmptyProgram() {
        FixpointTrace trace = new WorkListSolver(analysis)
                .solve(CFGBuilder.build(new Program(List.of())));
        assertTrue(trace.isConverged());
        assertEquals(1, trace.getSnapshots().size());
        assertTrue(trace.getResult().getInFact(0).isEmpty());
    }

    @Test
    public void testBranchesAreJoined() {
        // 0: c := 0; 1: if; 2: x := 1; 3: x := 5; 4: y := x
        Var c = resolver.getVar("c");
        Exp<Var> cond = new ConditionExp<>(ConditionExp.Op.LT, ref(c), lit(1));
        CFG cfg = CFGBuilder.build(new Program(List.of(
                new Assign(c, lit(0)),
                new If(cond, List.of(new Assign(x, lit(1))), List.of(new Assign(x, lit(5)))),
                new Assign(y, ref(x)))));
        FixpointTrace trace = new WorkListSolver(analysis).solve(cfg);
        assertTrue(trace.isConverged());
        assertEquals(num(1, 5), trace.getResult().getOutFact(4).get(y));
    }

    @Test
    public void testBranchesOfDifferentKinds() {
        Var c = resolver.getVar("c");
        Exp<Var> cond = new ConditionExp<>(ConditionExp.Op.LT, ref(c), lit(1));
        CFG cfg = CFGBuilder.build(new Program(List.of(
                new Assign(c, lit(0)),
                new If(cond, List.of(new Assign(x, lit(1))), List.of(new NewArray(x, lit(1)))),
                new Assign(y, ref(x)))));
        DataflowResult<IntervalFact> result = new WorkListSolver(analysis).solve(cfg).getResult();
        assertTrue(result.getOutFact(4).get(y).isUnknown());
    }

    @Test
    public void testArrays() {
        // 0: n := 3; 1: a := new Array[n + 1]; 2: i := len(a) + -1; 3: a[i] := 0; 4: delete a
        Var n = resolver.getVar("n");
        Var a = resolver.getVar("a");
        Var i = resolver.getVar("i");
        CFG cfg = CFGBuilder.build(new Program(List.of(
                new Assign(n, lit(3)),
                new NewArray(a, add(ref(n), lit(1))),
                new Assign(i, add(new ArrayLength<>(a), lit(-1))),
                new StoreArray(a, ref(i), lit(0)),
                new DeleteArray(a))));
        DataflowResult<IntervalFact> result = new WorkListSolver(analysis).solve(cfg).getResult();
        assertEquals(Property.makeArr(Interval.of(4, 4)), result.getInFact(4).get(a));
        assertEquals(num(3, 3), result.getOutFact(4).get(i));
        assertNull(result.getOutFact(4).get(a));
        assertNull(result.getInFact(5).get(a));
    }

    @Test
    public void testSnapshotsShareNoFacts() {
        // node 1 is unreachable, so no pass recomputes its facts
        StmtCFG cfg = new StmtCFG(List.of(
                new Assign(x, lit(0)),
                new Assign(y, lit(1))));
        cfg.addEdge(0, 2);
        FixpointTrace trace = new WorkListSolver(analysis).solve(cfg);
        assertTrue(trace.isConverged());
        assertEquals(1, trace.getSnapshots().size());

        DataflowResult<IntervalFact> result = trace.getResult();
        result.getOutFact(1).update(x, Property.getUnknown());
        result.getInFact(0).update(y, Property.getUnknown());
        assertTrue(trace.getInitial().getOutFact(1).isEmpty());
        assertTrue(trace.getResult().getOutFact(1).isEmpty());
        assertTrue(trace.getResult().getInFact(0).isEmpty());
        assertTrue(trace.getSnapshots().get(0).getOutFact(1).isEmpty());
    }

    @Test
    public void testTraceIgnoresChangesToReturnedResults() {
        FixpointTrace trace = new WorkListSolver(analysis).solve(counterLoop());
        DataflowResult<IntervalFact> first = trace.getSnapshots().get(0);
        first.setBlock(1, new Block<>(new IntervalFact(), new IntervalFact()));
        first.getOutFact(0).remove(x);
        assertEquals(num(0, 0), trace.getSnapshots().get(0).getInFact(1).get(x));
        assertEquals(num(0, 0), trace.getSnapshots().get(0).getOutFact(0).get(x));
        assertEquals(num(0, 1), trace.getSnapshots().get(1).getInFact(1).get(x));
    }

    @Test(expected = AnalysisException.class)
    public void testUndefinedVariableFails() {
        CFG cfg = CFGBuilder.build(new Program(List.of(new Assign(y, ref(x)))));
        new WorkListSolver(analysis).solve(cfg);
    }

    @Test
    public void testUndefinedVariableIsUnknownWhenLenient() {
        IntervalAnalysis lenient = new IntervalAnalysis(
                AnalysisConfig.of(IntervalAnalysis.ID).withOptions(Map.of("strict-lookup", false)));
        CFG cfg = CFGBuilder.build(new Program(List.of(new Assign(y, ref(x)))));
        FixpointTrace trace = lenient.analyze(cfg);
        assertTrue(trace.isConverged());
        assertTrue(trace.getResult().getOutFact(0).get(y).isUnknown());
    }
}

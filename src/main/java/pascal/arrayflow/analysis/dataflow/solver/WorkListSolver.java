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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import pascal.arrayflow.analysis.dataflow.analysis.interval.IntervalAnalysis;
import pascal.arrayflow.analysis.dataflow.analysis.interval.IntervalFact;
import pascal.arrayflow.analysis.dataflow.fact.Block;
import pascal.arrayflow.analysis.dataflow.fact.DataflowResult;
import pascal.arrayflow.analysis.graph.cfg.CFG;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;

/**
 * Forward work-list solver for {@link IntervalAnalysis}.
 * <p>
 * Each pass walks the CFG breadth-first from the entry and visits every
 * reachable node once, so a single pass does not reach a fixpoint on CFGs
 * with back edges. Passes are repeated until one changes nothing or the
 * fuel is used up. There is no widening: a value that keeps growing in a
 * loop grows by one join per pass until the fuel runs out.
 */
public class WorkListSolver {

    private static final Logger logger = LogManager.getLogger(WorkListSolver.class);

    private final IntervalAnalysis analysis;

    private final int fuel;

    /**
     * Creates a solver whose fuel is given by the {@code fuel} option
     * of the analysis.
     */
    public WorkListSolver(IntervalAnalysis analysis) {
        this(analysis, analysis.getOptions().getInt("fuel"));
    }

    public WorkListSolver(IntervalAnalysis analysis, int fuel) {
        if (fuel < 0) {
            throw new IllegalArgumentException("fuel should be non-negative, given: " + fuel);
        }
        this.analysis = analysis;
        this.fuel = fuel;
    }

    public FixpointTrace solve(CFG cfg) {
        DataflowResult<IntervalFact> initial = initialize(cfg);
        List<DataflowResult<IntervalFact>> snapshots = new ArrayList<>();
        DataflowResult<IntervalFact> previous = initial;
        boolean converged;
        for (int remaining = fuel; ; --remaining) {
            DataflowResult<IntervalFact> current = doSolve(cfg, previous);
            if (current.equals(previous)) {
                converged = true;
                break;
            }
            if (remaining == 0) {
                converged = false;
                break;
            }
            snapshots.add(current);
            logger.debug("Pass {} changed {} node(s)",
                    snapshots.size(), countChangedNodes(previous, current));
            previous = current;
        }
        if (converged) {
            logger.info("Interval analysis reached fixpoint after {} changing pass(es)",
                    snapshots.size());
        } else {
            logger.warn("Interval analysis did not converge within {} pass(es), "
                    + "returning the last result", fuel);
        }
        return new FixpointTrace(initial, snapshots, converged);
    }

    private DataflowResult<IntervalFact> initialize(CFG cfg) {
        DataflowResult<IntervalFact> result = new DataflowResult<>();
        for (int node = 0; node < cfg.getNumberOfNodes(); ++node) {
            result.setBlock(node, new Block<>(
                    analysis.newInitialFact(), analysis.newInitialFact()));
        }
        return result;
    }

    /**
     * Runs one pass starting from the result of the previous pass.
     * Predecessors not yet visited in this pass contribute their exit
     * facts of the previous pass.
     */
    private DataflowResult<IntervalFact> doSolve(CFG cfg,
                                                 DataflowResult<IntervalFact> previous) {
        DataflowResult<IntervalFact> result = previous.copy(IntervalFact::copy);
        Set<Integer> visited = new HashSet<>();
        Queue<Integer> workList = new ArrayDeque<>();
        workList.add(cfg.getEntry());
        while (!workList.isEmpty()) {
            int node = workList.poll();
            if (!visited.add(node)) {
                continue;
            }
            IntervalFact in;
            if (cfg.isEntry(node)) {
                // back edges into the entry are ignored
                in = analysis.newBoundaryFact();
            } else {
                List<IntervalFact> predOuts = new ArrayList<>();
                cfg.getPredsOf(node).forEach(pred -> predOuts.add(result.getOutFact(pred)));
                in = IntervalFact.joinList(predOuts);
            }
            IntervalFact out;
            if (cfg.isExit(node)) {
                out = analysis.newInitialFact();
            } else {
                out = analysis.analyzeStatement(in, cfg.getNode(node));
                workList.addAll(cfg.getSuccsOf(node));
            }
            result.setBlock(node, new Block<>(in, out));
        }
        return result;
    }

    private static int countChangedNodes(DataflowResult<IntervalFact> previous,
                                         DataflowResult<IntervalFact> current) {
        int changed = 0;
        for (int node : current.getNodes()) {
            if (!Objects.equals(previous.getInFact(node), current.getInFact(node))
                    || !Objects.equals(previous.getOutFact(node), current.getOutFact(node))) {
                ++changed;
            }
        }
        return changed;
    }
}

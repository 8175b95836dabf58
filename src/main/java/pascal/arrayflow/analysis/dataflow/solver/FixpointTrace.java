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

import pascal.arrayflow.analysis.dataflow.analysis.interval.IntervalFact;
import pascal.arrayflow.analysis.dataflow.fact.DataflowResult;

import java.util.List;

/**
 * Outcome of {@link WorkListSolver}: the initial result and the results of
 * all solver passes that changed it, oldest first.
 * <p>
 * The recorded results are never modified. Every getter returns fresh
 * copies of them, which the caller may modify freely.
 */
public class FixpointTrace {

    private final DataflowResult<IntervalFact> initial;

    private final List<DataflowResult<IntervalFact>> snapshots;

    private final boolean converged;

    FixpointTrace(DataflowResult<IntervalFact> initial,
                  List<DataflowResult<IntervalFact>> snapshots,
                  boolean converged) {
        this.initial = initial;
        this.snapshots = List.copyOf(snapshots);
        this.converged = converged;
    }

    /**
     * @return the result before the first pass, where every statement node
     * has empty entry and exit facts.
     */
    public DataflowResult<IntervalFact> getInitial() {
        return copyOf(initial);
    }

    public List<DataflowResult<IntervalFact>> getSnapshots() {
        return snapshots.stream()
                .map(FixpointTrace::copyOf)
                .toList();
    }

    /**
     * @return the most recent result, or the initial result if no pass
     * changed anything.
     */
    public DataflowResult<IntervalFact> getResult() {
        return copyOf(snapshots.isEmpty() ? initial : snapshots.get(snapshots.size() - 1));
    }

    private static DataflowResult<IntervalFact> copyOf(DataflowResult<IntervalFact> result) {
        return result.copy(IntervalFact::copy);
    }

    /**
     * @return true if the solver stopped because a pass changed nothing,
     * false if it ran out of fuel.
     */
    public boolean isConverged() {
        return converged;
    }

    @Override
    public String toString() {
        return "FixpointTrace{" +
                "passes=" + snapshots.size() +
                ", converged=" + converged +
                ", result=" + getResult() +
                '}';
    }
}

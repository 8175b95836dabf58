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

package pascal.arrayflow.analysis.graph.cfg;

import pascal.arrayflow.ir.stmt.Stmt;

import java.util.Set;

/**
 * Control-flow graph over statements. Nodes are identified by index:
 * statements occupy indexes {@code 0..n-1}, index 0 is the entry, and
 * index {@code n} is a virtual exit node without statement.
 */
public interface CFG {

    /**
     * @return index of the entry node.
     */
    int getEntry();

    /**
     * @return index of the virtual exit node.
     */
    int getExit();

    boolean isEntry(int node);

    boolean isExit(int node);

    /**
     * @return the statement at given node.
     * @throws IndexOutOfBoundsException if node is not a statement node
     */
    Stmt getNode(int node);

    /**
     * @return number of statement nodes, i.e., without the virtual exit.
     */
    int getNumberOfNodes();

    Set<Integer> getPredsOf(int node);

    Set<Integer> getSuccsOf(int node);
}

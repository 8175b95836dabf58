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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * CFG whose nodes are added one by one. The virtual exit always has the
 * index right after the last added statement.
 */
public class StmtCFG implements CFG {

    private final List<Stmt> nodes = new ArrayList<>();

    private final Map<Integer, Set<Integer>> preds = new HashMap<>();

    private final Map<Integer, Set<Integer>> succs = new HashMap<>();

    public StmtCFG() {
    }

    public StmtCFG(List<Stmt> nodes) {
        nodes.forEach(this::addNode);
    }

    /**
     * Appends a statement node.
     *
     * @return index of the new node.
     */
    public int addNode(Stmt stmt) {
        nodes.add(Objects.requireNonNull(stmt));
        return nodes.size() - 1;
    }

    /**
     * Adds an edge between two existing nodes; the target may be the
     * virtual exit. Adding an existing edge has no effect.
     */
    public void addEdge(int source, int target) {
        Objects.checkIndex(source, nodes.size());
        Objects.checkIndex(target, nodes.size() + 1);
        succs.computeIfAbsent(source, k -> new LinkedHashSet<>()).add(target);
        preds.computeIfAbsent(target, k -> new LinkedHashSet<>()).add(source);
    }

    @Override
    public int getEntry() {
        return 0;
    }

    @Override
    public int getExit() {
        return nodes.size();
    }

    @Override
    public boolean isEntry(int node) {
        return node == getEntry();
    }

    @Override
    public boolean isExit(int node) {
        return node == getExit();
    }

    @Override
    public Stmt getNode(int node) {
        return nodes.get(node);
    }

    @Override
    public int getNumberOfNodes() {
        return nodes.size();
    }

    @Override
    public Set<Integer> getPredsOf(int node) {
        return Collections.unmodifiableSet(preds.getOrDefault(node, Set.of()));
    }

    @Override
    public Set<Integer> getSuccsOf(int node) {
        return Collections.unmodifiableSet(succs.getOrDefault(node, Set.of()));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("CFG{");
        for (int i = 0; i < nodes.size(); ++i) {
            sb.append('\n').append(i).append(": ").append(nodes.get(i))
                    .append(" -> ").append(getSuccsOf(i));
        }
        return sb.append('\n').append(getExit()).append(": [exit]}").toString();
    }
}

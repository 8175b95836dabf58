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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import pascal.arrayflow.ir.Program;
import pascal.arrayflow.ir.stmt.If;
import pascal.arrayflow.ir.stmt.Stmt;
import pascal.arrayflow.ir.stmt.While;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the {@link CFG} of a {@link Program}.
 * Statements are numbered in pre-order, so a loop or conditional comes
 * right before the statements of its bodies:
 * <ul>
 *     <li>a {@code while} node flows into its body and, when the condition
 *     fails, to the statement after the loop; the end of the body flows
 *     back to the {@code while} node;</li>
 *     <li>an {@code if} node flows into both branches (an empty branch
 *     goes directly to the statement after the conditional), and both
 *     branches flow to the statement after the conditional.</li>
 * </ul>
 * The last statement flows to the virtual exit.
 */
public class CFGBuilder {

    private static final Logger logger = LogManager.getLogger(CFGBuilder.class);

    private final StmtCFG cfg = new StmtCFG();

    private CFGBuilder() {
    }

    public static CFG build(Program program) {
        CFGBuilder builder = new CFGBuilder();
        Collection<Integer> exits = builder.buildBlock(program.getStmts(), List.of());
        StmtCFG cfg = builder.cfg;
        exits.forEach(node -> cfg.addEdge(node, cfg.getExit()));
        logger.debug("Built CFG with {} node(s)", cfg.getNumberOfNodes());
        return cfg;
    }

    /**
     * Adds the nodes of a statement list.
     *
     * @param incoming nodes that flow into the first statement
     * @return nodes that flow into whatever follows the list.
     */
    private Collection<Integer> buildBlock(List<Stmt> stmts, Collection<Integer> incoming) {
        Collection<Integer> exits = incoming;
        for (Stmt stmt : stmts) {
            exits = buildStmt(stmt, exits);
        }
        return exits;
    }

    private Collection<Integer> buildStmt(Stmt stmt, Collection<Integer> incoming) {
        int node = cfg.addNode(stmt);
        incoming.forEach(pred -> cfg.addEdge(pred, node));
        if (stmt instanceof While loop) {
            // back edge from the end of the body
            buildBlock(loop.getBody(), List.of(node))
                    .forEach(pred -> cfg.addEdge(pred, node));
        } else if (stmt instanceof If branch) {
            Set<Integer> exits = new LinkedHashSet<>(
                    buildBlock(branch.getThenBody(), List.of(node)));
            exits.addAll(buildBlock(branch.getElseBody(), List.of(node)));
            return exits;
        }
        return List.of(node);
    }
}

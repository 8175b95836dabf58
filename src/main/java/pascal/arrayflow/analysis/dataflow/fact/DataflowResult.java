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

package pascal.arrayflow.analysis.dataflow.fact;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

/**
 * An object which manages the data-flow facts of all nodes of a CFG,
 * keyed by node index. Two results are equal if they bind the same
 * nodes to equal blocks.
 *
 * @param <Fact> type of data-flow facts
 */
public class DataflowResult<Fact> {

    private final Map<Integer, Block<Fact>> blocks;

    public DataflowResult() {
        this.blocks = new TreeMap<>();
    }

    public void setBlock(int node, Block<Fact> block) {
        blocks.put(node, block);
    }

    /**
     * @return the fact at the entry of given node, or null if the node
     * has no block.
     */
    public Fact getInFact(int node) {
        Block<Fact> block = blocks.get(node);
        return block == null ? null : block.getEntry();
    }

    /**
     * @return the fact at the exit of given node, or null if the node
     * has no block.
     */
    public Fact getOutFact(int node) {
        Block<Fact> block = blocks.get(node);
        return block == null ? null : block.getExit();
    }

    /**
     * @return indexes of all nodes that have a block, in ascending order.
     */
    public Set<Integer> getNodes() {
        return Collections.unmodifiableSet(blocks.keySet());
    }

    /**
     * @param factCopier copies a single fact
     * @return a new result binding the same nodes to blocks with copied
     * facts, which shares no fact with this result.
     */
    public DataflowResult<Fact> copy(UnaryOperator<Fact> factCopier) {
        DataflowResult<Fact> copy = new DataflowResult<>();
        blocks.forEach((node, block) -> copy.setBlock(node, new Block<>(
                factCopier.apply(block.getEntry()), factCopier.apply(block.getExit()))));
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DataflowResult<?> that)) {
            return false;
        }
        return blocks.equals(that.blocks);
    }

    @Override
    public int hashCode() {
        return blocks.hashCode();
    }

    @Override
    public String toString() {
        return blocks.toString();
    }
}

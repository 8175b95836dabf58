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

import java.util.Objects;

/**
 * Facts at the entry and at the exit of one CFG node.
 *
 * @param <Fact> type of data-flow facts
 */
public class Block<Fact> {

    private final Fact entry;

    private final Fact exit;

    public Block(Fact entry, Fact exit) {
        this.entry = Objects.requireNonNull(entry);
        this.exit = Objects.requireNonNull(exit);
    }

    public Fact getEntry() {
        return entry;
    }

    public Fact getExit() {
        return exit;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Block<?> block)) {
            return false;
        }
        return entry.equals(block.entry) && exit.equals(block.exit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entry, exit);
    }

    @Override
    public String toString() {
        return "{entry=" + entry + ", exit=" + exit + "}";
    }
}

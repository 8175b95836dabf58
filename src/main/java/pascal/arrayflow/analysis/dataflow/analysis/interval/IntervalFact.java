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

package pascal.arrayflow.analysis.dataflow.analysis.interval;

import pascal.arrayflow.analysis.dataflow.fact.MapFact;
import pascal.arrayflow.ir.exp.Var;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Data-flow fact of interval analysis: a map from variables to their
 * properties. A variable absent from the map is undefined at the program
 * point, which is different from being UNKNOWN.
 */
public class IntervalFact extends MapFact<Var, Property> {

    public IntervalFact() {
        this(Collections.emptyMap());
    }

    private IntervalFact(Map<Var, Property> map) {
        super(map);
    }

    @Override
    public IntervalFact copy() {
        return new IntervalFact(this.map);
    }

    /**
     * Joins two facts key-wise. A variable bound in only one of them keeps
     * its property; a variable bound in both gets the join of its properties.
     *
     * @return a new fact; the given facts are not modified.
     */
    public static IntervalFact join(IntervalFact fact1, IntervalFact fact2) {
        IntervalFact result = fact1.copy();
        fact2.forEach((key, property) -> {
            Property origin = result.get(key);
            result.update(key, origin == null ? property : Property.join(origin, property));
        });
        return result;
    }

    /**
     * Joins the given facts in order, starting from the empty fact.
     */
    public static IntervalFact joinList(List<IntervalFact> facts) {
        IntervalFact result = new IntervalFact();
        for (IntervalFact fact : facts) {
            result = join(result, fact);
        }
        return result;
    }
}

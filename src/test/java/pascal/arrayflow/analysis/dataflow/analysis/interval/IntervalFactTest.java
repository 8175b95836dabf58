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

import org.junit.Test;
import pascal.arrayflow.ir.exp.Var;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class IntervalFactTest {

    private final Var x = new Var("x", 0);

    private final Var y = new Var("y", 1);

    private final Var a = new Var("a", 2);

    private static Property num(int from, int to) {
        return Property.makeNum(Interval.of(from, to));
    }

    private static Property arr(int from, int to) {
        return Property.makeArr(Interval.of(from, to));
    }

    @Test
    public void testJoinIsKeyWise() {
        IntervalFact f1 = new IntervalFact();
        f1.update(x, num(0, 1));
        f1.update(a, arr(2, 2));
        IntervalFact f2 = new IntervalFact();
        f2.update(x, num(5, 6));
        f2.update(y, num(-1, -1));

        IntervalFact joined = IntervalFact.join(f1, f2);
        assertEquals(3, joined.size());
        assertEquals(num(0, 6), joined.get(x));
        assertEquals(num(-1, -1), joined.get(y));
        assertEquals(arr(2, 2), joined.get(a));
        assertEquals(joined, IntervalFact.join(f2, f1));
    }

    @Test
    public void testJoinLeavesInputsUntouched() {
        IntervalFact f1 = new IntervalFact();
        f1.update(x, num(0, 0));
        IntervalFact f2 = new IntervalFact();
        f2.update(x, num(3, 3));
        f2.update(y, num(1, 1));
        IntervalFact.join(f1, f2);
        assertEquals(1, f1.size());
        assertEquals(num(0, 0), f1.get(x));
        assertEquals(2, f2.size());
    }

    @Test
    public void testJoinList() {
        assertTrue(IntervalFact.joinList(List.of()).isEmpty());
        IntervalFact f1 = new IntervalFact();
        f1.update(x, num(1, 1));
        IntervalFact f2 = new IntervalFact();
        f2.update(x, num(4, 4));
        IntervalFact f3 = new IntervalFact();
        f3.update(x, arr(4, 4));
        assertEquals(num(1, 4), IntervalFact.joinList(List.of(f1, f2)).get(x));
        assertTrue(IntervalFact.joinList(List.of(f1, f2, f3)).get(x).isUnknown());
        assertEquals(IntervalFact.joinList(List.of(f1, f2, f3)),
                IntervalFact.joinList(List.of(f3, f1, f2)));
    }

    @Test
    public void testEqualityIgnoresInsertionOrder() {
        IntervalFact f1 = new IntervalFact();
        f1.update(x, num(1, 1));
        f1.update(y, num(2, 2));
        IntervalFact f2 = new IntervalFact();
        f2.update(y, num(2, 2));
        f2.update(x, num(1, 1));
        assertEquals(f1, f2);
        assertEquals(f1.hashCode(), f2.hashCode());
    }

    @Test
    public void testUpdateAndCopyFrom() {
        IntervalFact fact = new IntervalFact();
        assertTrue(fact.update(x, num(1, 1)));
        assertFalse(fact.update(x, num(1, 1)));
        assertNull(fact.get(y));

        IntervalFact other = new IntervalFact();
        other.update(y, num(2, 2));
        assertTrue(fact.copyFrom(other));
        assertNull(fact.get(x));
        assertFalse(fact.copyFrom(other));
    }
}

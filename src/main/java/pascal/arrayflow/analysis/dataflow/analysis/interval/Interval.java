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

import java.util.Objects;

/**
 * Inclusive range {@code [from, to]} of {@link Num}s.
 * The endpoints are not required to be ordered: negation keeps endpoint
 * positions, so {@code from > to} may occur and is passed on as is.
 */
public class Interval {

    private final Num from;

    private final Num to;

    public Interval(Num from, Num to) {
        this.from = Objects.requireNonNull(from);
        this.to = Objects.requireNonNull(to);
    }

    public static Interval of(int from, int to) {
        return new Interval(Num.of(from), Num.of(to));
    }

    public Num getFrom() {
        return from;
    }

    public Num getTo() {
        return to;
    }

    /**
     * @return the smallest interval containing both given intervals.
     */
    public static Interval join(Interval iv1, Interval iv2) {
        return new Interval(Num.min(iv1.from, iv2.from), Num.max(iv1.to, iv2.to));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Interval interval)) {
            return false;
        }
        return from.equals(interval.from) && to.equals(interval.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to);
    }

    @Override
    public String toString() {
        return "[" + from + ", " + to + "]";
    }
}

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
 * Abstract value of a variable in interval analysis.
 * A property is one of:
 * <ul>
 *     <li>NUM(iv): the variable holds an integer within iv</li>
 *     <li>ARR(iv): the variable holds an array whose length is within iv</li>
 *     <li>UNKNOWN: nothing is known (top of the lattice)</li>
 * </ul>
 */
public class Property {

    /**
     * The object representing UNKNOWN.
     */
    private static final Property UNKNOWN = new Property(Kind.UNKNOWN, null);

    private final Kind kind;

    private final Interval interval;

    private Property(Kind kind, Interval interval) {
        this.kind = kind;
        this.interval = interval;
    }

    /**
     * @return the UNKNOWN property.
     */
    public static Property getUnknown() {
        return UNKNOWN;
    }

    /**
     * @return a NUM property for the given range of values.
     */
    public static Property makeNum(Interval interval) {
        return new Property(Kind.NUM, Objects.requireNonNull(interval));
    }

    /**
     * @return an ARR property for the given range of lengths.
     */
    public static Property makeArr(Interval interval) {
        return new Property(Kind.ARR, Objects.requireNonNull(interval));
    }

    public boolean isNum() {
        return kind == Kind.NUM;
    }

    public boolean isArr() {
        return kind == Kind.ARR;
    }

    public boolean isUnknown() {
        return kind == Kind.UNKNOWN;
    }

    /**
     * @return the interval of a NUM or ARR property.
     * @throws UnsupportedOperationException if this property is UNKNOWN
     */
    public Interval getInterval() {
        if (isUnknown()) {
            throw new UnsupportedOperationException(this + " carries no interval");
        }
        return interval;
    }

    /**
     * Joins two properties. Properties of the same kind are joined on their
     * intervals; any other combination gives UNKNOWN.
     */
    public static Property join(Property p1, Property p2) {
        if (p1.isNum() && p2.isNum()) {
            return makeNum(Interval.join(p1.interval, p2.interval));
        } else if (p1.isArr() && p2.isArr()) {
            return makeArr(Interval.join(p1.interval, p2.interval));
        } else {
            return UNKNOWN;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Property property)) {
            return false;
        }
        return kind == property.kind && Objects.equals(interval, property.interval);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, interval);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case NUM -> "NUM" + interval;
            case ARR -> "ARR" + interval;
            case UNKNOWN -> "UNKNOWN";
        };
    }

    private enum Kind {
        NUM, // integer values
        ARR, // array lengths
        UNKNOWN, // top
    }
}

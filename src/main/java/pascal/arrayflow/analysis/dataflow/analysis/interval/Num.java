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

import java.util.Optional;

/**
 * Scalar carried by interval endpoints. Arithmetic follows Java {@code int}
 * semantics, i.e., it wraps around on overflow.
 */
public final class Num {

    private final int value;

    private Num(int value) {
        this.value = value;
    }

    public static Num of(int value) {
        return new Num(value);
    }

    public int getValue() {
        return value;
    }

    public static Num min(Num x, Num y) {
        return x.value <= y.value ? x : y;
    }

    public static Num max(Num x, Num y) {
        return x.value >= y.value ? x : y;
    }

    public static Optional<Num> add(Num x, Num y) {
        return Optional.of(of(x.value + y.value));
    }

    public static Optional<Num> sub(Num x, Num y) {
        return add(x, neg(y));
    }

    public static Num mul(Num x, Num y) {
        return of(x.value * y.value);
    }

    /**
     * @return the quotient of x and y, or empty if y is zero.
     */
    public static Optional<Num> div(Num x, Num y) {
        if (y.value == 0) {
            return Optional.empty();
        }
        return Optional.of(of(x.value / y.value));
    }

    public static Num neg(Num x) {
        return of(-x.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Num num)) {
            return false;
        }
        return value == num.value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}

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

package pascal.arrayflow.ir.stmt;

import pascal.arrayflow.ir.exp.Exp;
import pascal.arrayflow.ir.exp.Var;

/**
 * Representation of assignment, e.g., {@code x := x + 1}.
 */
public class Assign implements Stmt {

    private final Var lvalue;

    private final Exp<Var> rvalue;

    public Assign(Var lvalue, Exp<Var> rvalue) {
        this.lvalue = lvalue;
        this.rvalue = rvalue;
    }

    public Var getLValue() {
        return lvalue;
    }

    public Exp<Var> getRValue() {
        return rvalue;
    }

    @Override
    public <T> T accept(StmtVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return lvalue + " := " + rvalue;
    }
}

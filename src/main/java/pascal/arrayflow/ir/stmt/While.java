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

import java.util.List;

/**
 * Representation of loops, e.g., {@code while (x < 5) x := x + 1}.
 * The body is kept for CFG construction; once the CFG is built, the loop
 * is represented by its edges.
 */
public class While implements Stmt {

    private final Exp<Var> condition;

    private final List<Stmt> body;

    public While(Exp<Var> condition, List<Stmt> body) {
        this.condition = condition;
        this.body = List.copyOf(body);
    }

    public Exp<Var> getCondition() {
        return condition;
    }

    public List<Stmt> getBody() {
        return body;
    }

    @Override
    public <T> T accept(StmtVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "while (" + condition + ")";
    }
}

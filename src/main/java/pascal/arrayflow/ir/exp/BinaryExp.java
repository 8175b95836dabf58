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

package pascal.arrayflow.ir.exp;

/**
 * Representation of binary expressions.
 */
public abstract class BinaryExp<I> implements Exp<I> {

    /**
     * Representation of binary operators.
     */
    public interface Op {
    }

    private final Exp<I> operand1;

    private final Exp<I> operand2;

    protected BinaryExp(Exp<I> operand1, Exp<I> operand2) {
        this.operand1 = operand1;
        this.operand2 = operand2;
    }

    public abstract Op getOperator();

    public Exp<I> getOperand1() {
        return operand1;
    }

    public Exp<I> getOperand2() {
        return operand2;
    }

    @Override
    public String toString() {
        return operand1 + " " + getOperator() + " " + operand2;
    }
}

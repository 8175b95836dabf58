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
 * Comparison, e.g., {@code x < 5}.
 */
public class ConditionExp<I> extends BinaryExp<I> {

    public enum Op implements BinaryExp.Op {

        EQ("=="),
        LT("<"),
        GT(">");

        private final String symbol;

        Op(String symbol) {
            this.symbol = symbol;
        }

        @Override
        public String toString() {
            return symbol;
        }
    }

    private final Op op;

    public ConditionExp(Op op, Exp<I> operand1, Exp<I> operand2) {
        super(operand1, operand2);
        this.op = op;
    }

    @Override
    public Op getOperator() {
        return op;
    }

    @Override
    public <T> T accept(ExpVisitor<I, T> visitor) {
        return visitor.visit(this);
    }
}

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

package pascal.arrayflow.ir;

import pascal.arrayflow.ir.exp.ArithmeticExp;
import pascal.arrayflow.ir.exp.ArrayLength;
import pascal.arrayflow.ir.exp.ConditionExp;
import pascal.arrayflow.ir.exp.Exp;
import pascal.arrayflow.ir.exp.ExpVisitor;
import pascal.arrayflow.ir.exp.IntLiteral;
import pascal.arrayflow.ir.exp.LogicalExp;
import pascal.arrayflow.ir.exp.NegExp;
import pascal.arrayflow.ir.exp.NotExp;
import pascal.arrayflow.ir.exp.Var;
import pascal.arrayflow.ir.exp.VarExp;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves raw names to {@link Var}s. The same name is always resolved
 * to the same variable; indexes are assigned in order of first use.
 */
public class NameResolver {

    private final Map<String, Var> vars = new LinkedHashMap<>();

    private final Resolver resolver = new Resolver();

    public Var getVar(String name) {
        Var var = vars.get(name);
        if (var == null) {
            var = new Var(name, vars.size());
            vars.put(name, var);
        }
        return var;
    }

    /**
     * @return all variables resolved so far, in order of their indexes.
     */
    public Collection<Var> getVars() {
        return Collections.unmodifiableCollection(vars.values());
    }

    /**
     * Converts a name-keyed expression into the equivalent
     * variable-keyed expression.
     */
    public Exp<Var> resolve(Exp<String> exp) {
        return exp.accept(resolver);
    }

    private class Resolver implements ExpVisitor<String, Exp<Var>> {

        @Override
        public Exp<Var> visit(VarExp<String> exp) {
            return new VarExp<>(getVar(exp.getIdentifier()));
        }

        @Override
        public Exp<Var> visit(ArrayLength<String> exp) {
            return new ArrayLength<>(getVar(exp.getIdentifier()));
        }

        @Override
        public Exp<Var> visit(IntLiteral<String> exp) {
            return new IntLiteral<>(exp.getValue());
        }

        @Override
        public Exp<Var> visit(NegExp<String> exp) {
            return new NegExp<>(exp.getOperand().accept(this));
        }

        @Override
        public Exp<Var> visit(ArithmeticExp<String> exp) {
            return new ArithmeticExp<>(exp.getOperator(),
                    exp.getOperand1().accept(this),
                    exp.getOperand2().accept(this));
        }

        @Override
        public Exp<Var> visit(NotExp<String> exp) {
            return new NotExp<>(exp.getOperand().accept(this));
        }

        @Override
        public Exp<Var> visit(LogicalExp<String> exp) {
            return new LogicalExp<>(exp.getOperator(),
                    exp.getOperand1().accept(this),
                    exp.getOperand2().accept(this));
        }

        @Override
        public Exp<Var> visit(ConditionExp<String> exp) {
            return new ConditionExp<>(exp.getOperator(),
                    exp.getOperand1().accept(this),
                    exp.getOperand2().accept(this));
        }
    }
}

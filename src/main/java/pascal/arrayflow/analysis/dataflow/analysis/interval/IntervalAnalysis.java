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

import pascal.arrayflow.analysis.dataflow.solver.FixpointTrace;
import pascal.arrayflow.analysis.dataflow.solver.WorkListSolver;
import pascal.arrayflow.analysis.graph.cfg.CFG;
import pascal.arrayflow.config.AnalysisConfig;
import pascal.arrayflow.config.AnalysisOptions;
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
import pascal.arrayflow.ir.stmt.ArrayInit;
import pascal.arrayflow.ir.stmt.Assign;
import pascal.arrayflow.ir.stmt.DeleteArray;
import pascal.arrayflow.ir.stmt.If;
import pascal.arrayflow.ir.stmt.LoadArray;
import pascal.arrayflow.ir.stmt.NewArray;
import pascal.arrayflow.ir.stmt.Stmt;
import pascal.arrayflow.ir.stmt.StmtVisitor;
import pascal.arrayflow.ir.stmt.StoreArray;
import pascal.arrayflow.ir.stmt.While;
import pascal.arrayflow.util.AnalysisException;

import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Interval analysis of integer variables and array lengths.
 * <p>
 * Options:
 * <ul>
 *     <li>{@code fuel}: maximum number of changing solver passes</li>
 *     <li>{@code strict-lookup}: if true, reading a variable that is
 *     undefined at the program point raises {@link AnalysisException};
 *     otherwise the read gives UNKNOWN</li>
 * </ul>
 */
public class IntervalAnalysis {

    public static final String ID = "interval";

    private final AnalysisConfig config;

    private final boolean strictLookup;

    /**
     * Creates the analysis with its default configuration.
     */
    public IntervalAnalysis() {
        this(AnalysisConfig.of(ID));
    }

    public IntervalAnalysis(AnalysisConfig config) {
        this.config = config;
        this.strictLookup = config.getOptions().getBoolean("strict-lookup");
    }

    public AnalysisConfig getConfig() {
        return config;
    }

    public AnalysisOptions getOptions() {
        return config.getOptions();
    }

    /**
     * Runs the analysis on given CFG.
     */
    public FixpointTrace analyze(CFG cfg) {
        return new WorkListSolver(this).solve(cfg);
    }

    /**
     * @return the fact at the entry of the CFG entry node.
     */
    public IntervalFact newBoundaryFact() {
        return new IntervalFact();
    }

    public IntervalFact newInitialFact() {
        return new IntervalFact();
    }

    /**
     * Joins fact into target.
     */
    public void meetInto(IntervalFact fact, IntervalFact target) {
        target.copyFrom(IntervalFact.join(target, fact));
    }

    /**
     * Applies the transfer function of stmt to in and stores the outcome in out.
     *
     * @return true if out changed, otherwise false.
     */
    public boolean transferNode(Stmt stmt, IntervalFact in, IntervalFact out) {
        return out.copyFrom(analyzeStatement(in, stmt));
    }

    /**
     * Computes the fact after stmt.
     *
     * @param in fact before stmt, left unmodified
     * @return a new fact.
     */
    public IntervalFact analyzeStatement(IntervalFact in, Stmt stmt) {
        return stmt.accept(new StmtTransfer(in));
    }

    /**
     * Evaluates the {@link Property} of given expression.
     *
     * @param exp the expression to be evaluated
     * @param in  IN fact of the statement
     * @return the resulting {@link Property}
     */
    public Property evaluate(Exp<Var> exp, IntervalFact in) {
        return exp.accept(new Evaluator(in));
    }

    private Property lookup(Var var, IntervalFact in) {
        Property property = in.get(var);
        if (property == null) {
            if (strictLookup) {
                throw new AnalysisException("Variable '" + var
                        + "' is undefined at this program point, defined: " + in.keySet());
            }
            return Property.getUnknown();
        }
        return property;
    }

    /**
     * Combines two NUM properties endpoint by endpoint.
     * Positional combination is not the exact interval product or quotient,
     * e.g., [-2, 3] * [-2, 3] gives [4, 9].
     */
    private static Property combine(Property p1,
                                    BiFunction<Num, Num, Optional<Num>> op,
                                    Property p2) {
        if (p1.isNum() && p2.isNum()) {
            Interval iv1 = p1.getInterval();
            Interval iv2 = p2.getInterval();
            Optional<Num> from = op.apply(iv1.getFrom(), iv2.getFrom());
            Optional<Num> to = op.apply(iv1.getTo(), iv2.getTo());
            if (from.isPresent() && to.isPresent()) {
                return Property.makeNum(new Interval(from.get(), to.get()));
            }
        }
        return Property.getUnknown();
    }

    private class Evaluator implements ExpVisitor<Var, Property> {

        private final IntervalFact in;

        private Evaluator(IntervalFact in) {
            this.in = in;
        }

        @Override
        public Property visit(VarExp<Var> exp) {
            return lookup(exp.getIdentifier(), in);
        }

        @Override
        public Property visit(ArrayLength<Var> exp) {
            Property array = lookup(exp.getIdentifier(), in);
            return array.isArr()
                    ? Property.makeNum(array.getInterval())
                    : Property.getUnknown();
        }

        @Override
        public Property visit(IntLiteral<Var> exp) {
            return Property.makeNum(Interval.of(exp.getValue(), exp.getValue()));
        }

        @Override
        public Property visit(NegExp<Var> exp) {
            Property operand = exp.getOperand().accept(this);
            if (operand.isNum()) {
                Interval iv = operand.getInterval();
                // endpoints keep their positions
                return Property.makeNum(new Interval(Num.neg(iv.getFrom()), Num.neg(iv.getTo())));
            }
            return Property.getUnknown();
        }

        @Override
        public Property visit(ArithmeticExp<Var> exp) {
            Property p1 = exp.getOperand1().accept(this);
            Property p2 = exp.getOperand2().accept(this);
            return switch (exp.getOperator()) {
                case ADD -> combine(p1, Num::add, p2);
                case SUB -> combine(p1, Num::sub, p2);
                case MUL -> combine(p1, (x, y) -> Optional.of(Num.mul(x, y)), p2);
                case DIV -> combine(p1, Num::div, p2);
            };
        }

        @Override
        public Property visit(NotExp<Var> exp) {
            return Property.getUnknown();
        }

        @Override
        public Property visit(LogicalExp<Var> exp) {
            return Property.getUnknown();
        }

        @Override
        public Property visit(ConditionExp<Var> exp) {
            return Property.getUnknown();
        }
    }

    private class StmtTransfer implements StmtVisitor<IntervalFact> {

        private final IntervalFact in;

        private StmtTransfer(IntervalFact in) {
            this.in = in;
        }

        @Override
        public IntervalFact visit(Assign stmt) {
            return update(stmt.getLValue(), evaluate(stmt.getRValue(), in));
        }

        @Override
        public IntervalFact visit(While stmt) {
            return in.copy();
        }

        @Override
        public IntervalFact visit(If stmt) {
            return in.copy();
        }

        @Override
        public IntervalFact visit(NewArray stmt) {
            Property length = evaluate(stmt.getLength(), in);
            return update(stmt.getLValue(), length.isNum()
                    ? Property.makeArr(length.getInterval())
                    : Property.getUnknown());
        }

        @Override
        public IntervalFact visit(ArrayInit stmt) {
            int size = stmt.getValues().size();
            return update(stmt.getLValue(), Property.makeArr(Interval.of(size, size)));
        }

        @Override
        public IntervalFact visit(LoadArray stmt) { // x := a[e]
            return update(stmt.getLValue(), Property.getUnknown());
        }

        @Override
        public IntervalFact visit(StoreArray stmt) { // a[e] := v
            return in.copy();
        }

        @Override
        public IntervalFact visit(DeleteArray stmt) {
            IntervalFact out = in.copy();
            out.remove(stmt.getVar());
            return out;
        }

        private IntervalFact update(Var var, Property property) {
            IntervalFact out = in.copy();
            out.update(var, property);
            return out;
        }
    }
}

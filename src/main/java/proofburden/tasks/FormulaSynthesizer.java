// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package proofburden.tasks;

import static proofburden.core.SmtFile.AND;
import static proofburden.core.SmtFile.ATTRIBUTE;
import static proofburden.core.SmtFile.CONSTANT;
import static proofburden.core.SmtFile.EQ;
import static proofburden.core.SmtFile.OR;
import static proofburden.core.SmtFile.VAR;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

import proofburden.core.SmtFile.Formula;
import proofburden.logic.Clause;
import proofburden.logic.Predicate;
import proofburden.logic.Program;
import proofburden.logic.Substitution;
import proofburden.logic.Symbol;
import proofburden.logic.Term;
import proofburden.logic.Unification;
import proofburden.util.FreeVariables;

/**
 * <p>
 * Constructs a formula characterising a clause-defined relation. The relation
 * is invoked on a <i>call pattern</i> of canonical parameters (e.g.
 * <code>leq(x0, y0)</code>) which is then unified against the head of every
 * clause defining it. Each clause contributes one disjunct, in program order:
 * </p>
 * <ul>
 * <li>A fact whose head unifies contributes the conjunction of equalities
 * given by the resulting substitution.</li>
 * <li>A fact whose head does not unify contributes <code>true</code>.</li>
 * <li>A rule contributes <code>true</code>, regardless of its body.</li>
 * </ul>
 * <p>
 * Both <code>true</code> cases over-approximate the relation, since a
 * <code>true</code> disjunct makes the whole disjunction hold. Likewise, an
 * equality mentioning a variable which is neither a parameter nor bound by the
 * substitution is dropped, leaving the conjunction less constrained than the
 * clause.
 * </p>
 */
public class FormulaSynthesizer {
	private static final Logger LOGGER = Logger.getLogger(FormulaSynthesizer.class.getName());

	public static final Symbol.VariableSymbol X0 = new Symbol.VariableSymbol("x0");
	public static final Symbol.VariableSymbol Y0 = new Symbol.VariableSymbol("y0");
	public static final Symbol.VariableSymbol Z0 = new Symbol.VariableSymbol("z0");

	private final Program program;

	public FormulaSynthesizer(Program program) {
		this.program = program;
	}

	/**
	 * Synthesise the formula for a binary relation over the parameters
	 * <code>x0</code> and <code>y0</code>. Each clause head is unified against
	 * the call pattern (i.e. the head is the left operand).
	 *
	 * @param s
	 * @return
	 */
	public Formula.Disjunction relation2(Symbol.PredicateSymbol s) {
		return synthesise(s, Arrays.asList(X0, Y0), false);
	}

	/**
	 * Synthesise the formula for a ternary relation over the parameters
	 * <code>x0</code>, <code>y0</code> and <code>z0</code>. The call pattern is
	 * unified against each clause head (i.e. the pattern is the left operand).
	 *
	 * @param s
	 * @return
	 */
	public Formula.Disjunction relation3(Symbol.PredicateSymbol s) {
		return synthesise(s, Arrays.asList(X0, Y0, Z0), true);
	}

	private Formula.Disjunction synthesise(Symbol.PredicateSymbol s, List<Symbol.VariableSymbol> parameters,
			boolean patternFirst) {
		ArrayList<Term> arguments = new ArrayList<>();
		for (Symbol.VariableSymbol p : parameters) {
			arguments.add(new Term.Variable(p));
		}
		Predicate pattern = new Predicate(s, arguments);
		Set<Symbol.VariableSymbol> bound = new LinkedHashSet<>(parameters);
		//
		List<Formula> disjuncts = new ArrayList<>();
		for (Clause clause : program.getClauses(s)) {
			disjuncts.add(synthesise(pattern, bound, clause, patternFirst));
		}
		return OR(disjuncts, ATTRIBUTE(s));
	}

	private Formula synthesise(Predicate pattern, Set<Symbol.VariableSymbol> bound, Clause clause,
			boolean patternFirst) {
		Optional<Substitution> env;
		if (patternFirst) {
			env = Unification.unify(pattern, clause.getHead(), Substitution.EMPTY);
		} else {
			env = Unification.unify(clause.getHead(), pattern, Substitution.EMPTY);
		}
		if (!env.isPresent()) {
			LOGGER.finest(() -> "clause " + clause + " does not match " + pattern);
			return CONSTANT(true, ATTRIBUTE(clause));
		} else if (!clause.isFact()) {
			// FIXME: rules are not yet translated, hence are treated as unconstrained.
			LOGGER.fine(() -> "over-approximating rule " + clause + " as true");
			return CONSTANT(true, ATTRIBUTE(clause));
		} else {
			return asFormula(bound, env.get(), clause);
		}
	}

	/**
	 * Translate a substitution into a conjunction of equalities, one for each
	 * binding in the order the bindings were made. Any equality mentioning a free
	 * variable (i.e. one neither in <code>bound</code> nor bound by
	 * <code>env</code>) is omitted.
	 *
	 * @param bound
	 * @param env
	 * @param clause
	 * @return
	 */
	public static Formula.Conjunction asFormula(Set<Symbol.VariableSymbol> bound, Substitution env, Clause clause) {
		ArrayList<Formula> equalities = new ArrayList<>();
		for (Map.Entry<Symbol.VariableSymbol, Term> e : env.getBindings()) {
			Formula f = EQ(VAR(e.getKey().getName()), TermResolver.resolve(e.getValue(), env));
			String free = findFreeVariable(f, bound, env);
			if (free != null) {
				LOGGER.fine(() -> "dropping " + e.getKey() + " = " + e.getValue() + " from " + clause + " (" + free
						+ " is unconstrained)");
			} else {
				equalities.add(f);
			}
		}
		return AND(equalities, ATTRIBUTE(clause));
	}

	private static String findFreeVariable(Formula f, Set<Symbol.VariableSymbol> bound, Substitution env) {
		for (String v : FreeVariables.of(f)) {
			Symbol.VariableSymbol s = new Symbol.VariableSymbol(v);
			if (!bound.contains(s) && !env.isBound(s)) {
				return v;
			}
		}
		return null;
	}
}

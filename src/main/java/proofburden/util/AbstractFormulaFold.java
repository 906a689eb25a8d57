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
package proofburden.util;

import java.util.ArrayList;
import java.util.List;

import proofburden.core.SmtFile.Formula;

/**
 * Folds a formula bottom-up into a single value. Leaves produce
 * <code>BOTTOM()</code> by default and interior nodes <code>join</code> the
 * values of their children, so a subclass need only override the cases it
 * cares about.
 *
 * @param <E>
 */
public abstract class AbstractFormulaFold<E> {

	public E visitFormula(Formula f) {
		if (f instanceof Formula.Boolean) {
			return constructBoolean((Formula.Boolean) f);
		} else if (f instanceof Formula.Variable) {
			return constructVariable((Formula.Variable) f);
		} else if (f instanceof Formula.Constructor0) {
			return constructConstructor0((Formula.Constructor0) f);
		} else if (f instanceof Formula.Constructor) {
			Formula.Constructor c = (Formula.Constructor) f;
			return constructConstructor(c, visitFormulas(c.getOperands()));
		} else if (f instanceof Formula.Equals) {
			Formula.Equals e = (Formula.Equals) f;
			E lhs = visitFormula(e.getLeftHandSide());
			E rhs = visitFormula(e.getRightHandSide());
			return constructEquals(e, lhs, rhs);
		} else if (f instanceof Formula.Implies) {
			Formula.Implies i = (Formula.Implies) f;
			E antecedent = visitFormula(i.getAntecedent());
			E consequent = visitFormula(i.getConsequent());
			return constructImplies(i, antecedent, consequent);
		} else if (f instanceof Formula.Conjunction) {
			Formula.Conjunction c = (Formula.Conjunction) f;
			return constructConjunction(c, visitFormulas(c.getOperands()));
		} else if (f instanceof Formula.Disjunction) {
			Formula.Disjunction d = (Formula.Disjunction) f;
			return constructDisjunction(d, visitFormulas(d.getOperands()));
		} else if (f instanceof Formula.UniversalQuantifier) {
			Formula.UniversalQuantifier q = (Formula.UniversalQuantifier) f;
			return constructUniversalQuantifier(q, visitFormula(q.getBody()));
		} else if (f instanceof Formula.Invoke) {
			Formula.Invoke i = (Formula.Invoke) f;
			return constructInvoke(i, visitFormulas(i.getArguments()));
		} else {
			throw new IllegalArgumentException("unknown formula encountered (" + f.getClass().getName() + ")");
		}
	}

	protected List<E> visitFormulas(List<Formula> fs) {
		List<E> results = new ArrayList<>();
		for (int i = 0; i != fs.size(); ++i) {
			results.add(visitFormula(fs.get(i)));
		}
		return results;
	}

	protected E constructBoolean(Formula.Boolean f) {
		return BOTTOM();
	}

	protected E constructVariable(Formula.Variable f) {
		return BOTTOM();
	}

	protected E constructConstructor0(Formula.Constructor0 f) {
		return BOTTOM();
	}

	protected E constructConstructor(Formula.Constructor f, List<E> operands) {
		return join(operands);
	}

	protected E constructEquals(Formula.Equals f, E lhs, E rhs) {
		return join(lhs, rhs);
	}

	protected E constructImplies(Formula.Implies f, E antecedent, E consequent) {
		return join(antecedent, consequent);
	}

	protected E constructConjunction(Formula.Conjunction f, List<E> operands) {
		return join(operands);
	}

	protected E constructDisjunction(Formula.Disjunction f, List<E> operands) {
		return join(operands);
	}

	protected E constructUniversalQuantifier(Formula.UniversalQuantifier f, E body) {
		return body;
	}

	protected E constructInvoke(Formula.Invoke f, List<E> arguments) {
		return join(arguments);
	}

	protected abstract E BOTTOM();

	protected abstract E join(E lhs, E rhs);

	protected E join(List<E> operands) {
		E result = BOTTOM();
		for (int i = 0; i != operands.size(); ++i) {
			result = join(result, operands.get(i));
		}
		return result;
	}
}

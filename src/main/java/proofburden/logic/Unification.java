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
package proofburden.logic;

import java.util.List;
import java.util.Optional;

/**
 * <p>
 * Syntactic unification over the term language of lattice programs. Given two
 * terms (or two predicates) and a substitution, this either produces an
 * extension of the substitution under which both sides are equal, or fails.
 * Failure is an ordinary outcome and is reported as an empty
 * <code>Optional</code>.
 * </p>
 * <p>
 * Whilst success or failure does not depend upon the order of the two sides,
 * the resulting substitution does. For example, unifying <code>x</code> with
 * <code>y</code> binds <code>x</code>, whilst unifying <code>y</code> with
 * <code>x</code> binds <code>y</code>. Callers which care about which variables
 * end up bound must therefore choose the argument order deliberately.
 * </p>
 */
public class Unification {

	public static Optional<Substitution> unify(Term t1, Term t2) {
		return unify(t1, t2, Substitution.EMPTY);
	}

	public static Optional<Substitution> unify(Predicate p1, Predicate p2) {
		return unify(p1, p2, Substitution.EMPTY);
	}

	/**
	 * Unify two predicates by unifying their arguments pairwise from left to
	 * right, threading the substitution through. This fails if the predicates
	 * have different names or arities, or as soon as any pair of arguments fails
	 * to unify.
	 *
	 * @param p1
	 * @param p2
	 * @param env
	 * @return
	 */
	public static Optional<Substitution> unify(Predicate p1, Predicate p2, Substitution env) {
		if (!p1.getName().equals(p2.getName()) || p1.getArity() != p2.getArity()) {
			return Optional.empty();
		}
		List<Term> args1 = p1.getArguments();
		List<Term> args2 = p2.getArguments();
		for (int i = 0; i != args1.size(); ++i) {
			Optional<Substitution> r = unify(args1.get(i), args2.get(i), env);
			if (!r.isPresent()) {
				return r;
			}
			env = r.get();
		}
		return Optional.of(env);
	}

	public static Optional<Substitution> unify(Term t1, Term t2, Substitution env) {
		if (t1 instanceof Term.Variable) {
			return unifyVariable((Term.Variable) t1, t2, env);
		} else if (t2 instanceof Term.Variable) {
			return unifyVariable((Term.Variable) t2, t1, env);
		} else if (t1 instanceof Term.Bool && t2 instanceof Term.Bool) {
			return t1.equals(t2) ? Optional.of(env) : Optional.empty();
		} else if (t1 instanceof Term.Constructor0 && t2 instanceof Term.Constructor0) {
			return t1.equals(t2) ? Optional.of(env) : Optional.empty();
		} else if (isKnown(t1) && isKnown(t2)) {
			// Different kinds of term
			return Optional.empty();
		} else {
			Term t = isKnown(t1) ? t2 : t1;
			throw new IllegalArgumentException("unknown term encountered (" + t.getClass().getName() + ")");
		}
	}

	/**
	 * Unify a variable against an arbitrary term. If the variable is already
	 * bound then its binding is unified against the term, otherwise the variable
	 * is bound to the term.
	 *
	 * @param var
	 * @param term
	 * @param env
	 * @return
	 */
	private static Optional<Substitution> unifyVariable(Term.Variable var, Term term, Substitution env) {
		Symbol.VariableSymbol s = var.getSymbol();
		Term binding = env.get(s);
		if (binding != null) {
			return unify(binding, term, env);
		} else if (walk(term, env).equals(var)) {
			// Already equal, so nothing to bind. This also prevents cyclic bindings.
			return Optional.of(env);
		} else {
			return Optional.of(env.bind(s, term));
		}
	}

	/**
	 * Follow the bindings of a variable until reaching either an unbound variable
	 * or some other kind of term.
	 *
	 * @param term
	 * @param env
	 * @return
	 */
	private static Term walk(Term term, Substitution env) {
		while (term instanceof Term.Variable) {
			Term binding = env.get(((Term.Variable) term).getSymbol());
			if (binding == null) {
				break;
			}
			term = binding;
		}
		return term;
	}

	private static boolean isKnown(Term t) {
		return t instanceof Term.Bool || t instanceof Term.Variable || t instanceof Term.Constructor0;
	}
}

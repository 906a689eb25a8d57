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

import static proofburden.core.SmtFile.CONSTRUCTOR;
import static proofburden.core.SmtFile.FALSE;
import static proofburden.core.SmtFile.TRUE;
import static proofburden.core.SmtFile.VAR;

import proofburden.core.SmtFile.Formula;
import proofburden.logic.Substitution;
import proofburden.logic.Term;

public class TermResolver {

	/**
	 * Translate a term into a formula under a given substitution. Bound variables
	 * are replaced by (the translation of) whatever they are bound to, whilst
	 * unbound variables remain as free variables.
	 *
	 * @param term
	 * @param env
	 * @return
	 */
	public static Formula resolve(Term term, Substitution env) {
		if (term instanceof Term.Bool) {
			return ((Term.Bool) term).getValue() ? TRUE : FALSE;
		} else if (term instanceof Term.Variable) {
			Term.Variable v = (Term.Variable) term;
			Term binding = env.get(v.getSymbol());
			if (binding == null) {
				return VAR(v.getSymbol().getName());
			} else {
				return resolve(binding, env);
			}
		} else if (term instanceof Term.Constructor0) {
			return CONSTRUCTOR(((Term.Constructor0) term).getSymbol().getName());
		} else {
			throw new IllegalArgumentException("unknown term encountered (" + term.getClass().getName() + ")");
		}
	}
}

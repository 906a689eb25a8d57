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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * An immutable mapping from variables to terms, as produced by unification.
 * Binding a variable never modifies an existing substitution but returns a new
 * one. Iteration follows the order in which variables were bound, which keeps
 * anything generated from a substitution reproducible.
 */
public class Substitution {
	public static final Substitution EMPTY = new Substitution(new LinkedHashMap<>());

	private final LinkedHashMap<Symbol.VariableSymbol, Term> bindings;

	private Substitution(LinkedHashMap<Symbol.VariableSymbol, Term> bindings) {
		this.bindings = bindings;
	}

	/**
	 * Construct a substitution which extends this substitution with a binding of
	 * <code>variable</code> to <code>term</code>.
	 *
	 * @param variable
	 * @param term
	 * @return
	 */
	public Substitution bind(Symbol.VariableSymbol variable, Term term) {
		if (bindings.containsKey(variable)) {
			throw new IllegalArgumentException("variable " + variable + " already bound");
		} else if (term.equals(new Term.Variable(variable))) {
			throw new IllegalArgumentException("cannot bind variable " + variable + " to itself");
		}
		LinkedHashMap<Symbol.VariableSymbol, Term> nbindings = new LinkedHashMap<>(bindings);
		nbindings.put(variable, term);
		return new Substitution(nbindings);
	}

	/**
	 * Get the term bound to a given variable, or <code>null</code> if it is
	 * unbound.
	 *
	 * @param variable
	 * @return
	 */
	public Term get(Symbol.VariableSymbol variable) {
		return bindings.get(variable);
	}

	public boolean isBound(Symbol.VariableSymbol variable) {
		return bindings.containsKey(variable);
	}

	public Set<Symbol.VariableSymbol> getVariables() {
		return Collections.unmodifiableSet(bindings.keySet());
	}

	/**
	 * Get the bindings of this substitution in the order they were made.
	 *
	 * @return
	 */
	public Set<Map.Entry<Symbol.VariableSymbol, Term>> getBindings() {
		return Collections.unmodifiableMap(bindings).entrySet();
	}

	public int size() {
		return bindings.size();
	}

	public boolean isEmpty() {
		return bindings.isEmpty();
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Substitution && ((Substitution) o).bindings.equals(bindings);
	}

	@Override
	public int hashCode() {
		return bindings.hashCode();
	}

	@Override
	public String toString() {
		return bindings.toString();
	}
}

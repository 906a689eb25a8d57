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

/**
 * A user-declared lattice: a finite domain together with the (clause-defined)
 * relations implementing its partial order <code>⊑</code> and its join
 * <code>⊔</code>.
 */
public class Lattice {
	private final Symbol.LatticeSymbol name;
	private final Type domain;
	private final Symbol.PredicateSymbol leq;
	private final Symbol.PredicateSymbol join;

	public Lattice(Symbol.LatticeSymbol name, Type domain, Symbol.PredicateSymbol leq, Symbol.PredicateSymbol join) {
		if (name == null || domain == null || leq == null || join == null) {
			throw new IllegalArgumentException("lattice requires a name, domain, order and join");
		}
		this.name = name;
		this.domain = domain;
		this.leq = leq;
		this.join = join;
	}

	public Symbol.LatticeSymbol getName() {
		return name;
	}

	public Type getDomain() {
		return domain;
	}

	/**
	 * Get the symbol of the binary relation defining the order of this lattice.
	 *
	 * @return
	 */
	public Symbol.PredicateSymbol getLeq() {
		return leq;
	}

	/**
	 * Get the symbol of the ternary relation defining the join of this lattice.
	 *
	 * @return
	 */
	public Symbol.PredicateSymbol getJoin() {
		return join;
	}

	@Override
	public String toString() {
		return "lattice " + name + "<" + domain + ", " + leq + ", " + join + ">";
	}
}

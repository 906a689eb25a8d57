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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A fully loaded lattice program. Lattices are kept in declaration order, as
 * are clauses, since both orders determine the order of generated output.
 * Programs are never modified once constructed.
 */
public class Program {
	private final Map<Symbol.LatticeSymbol, Lattice> lattices;
	private final List<Clause> clauses;

	public Program(Collection<Lattice> lattices, List<Clause> clauses) {
		if (lattices == null || clauses == null) {
			throw new IllegalArgumentException("program requires lattices and clauses");
		}
		LinkedHashMap<Symbol.LatticeSymbol, Lattice> map = new LinkedHashMap<>();
		for (Lattice l : lattices) {
			if (map.put(l.getName(), l) != null) {
				throw new IllegalArgumentException("duplicate lattice " + l.getName());
			}
		}
		this.lattices = Collections.unmodifiableMap(map);
		this.clauses = Collections.unmodifiableList(new ArrayList<>(clauses));
	}

	public Map<Symbol.LatticeSymbol, Lattice> getLattices() {
		return lattices;
	}

	public List<Clause> getClauses() {
		return clauses;
	}

	/**
	 * Get all clauses whose head is the given predicate symbol, in program order.
	 *
	 * @param symbol
	 * @return
	 */
	public List<Clause> getClauses(Symbol.PredicateSymbol symbol) {
		ArrayList<Clause> result = new ArrayList<>();
		for (int i = 0; i != clauses.size(); ++i) {
			Clause ith = clauses.get(i);
			if (ith.getHead().getName().equals(symbol)) {
				result.add(ith);
			}
		}
		return result;
	}
}

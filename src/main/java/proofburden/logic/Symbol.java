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
 * A named entity within a lattice program. Symbols are compared by kind and
 * name, so two <code>VariableSymbol</code>s called <code>x</code> are the same
 * variable, whilst a <code>VariableSymbol</code> and a
 * <code>PredicateSymbol</code> called <code>x</code> are not.
 */
public interface Symbol {

	/**
	 * Get the textual name of this symbol, exactly as it should appear in
	 * generated output.
	 *
	 * @return
	 */
	public String getName();

	public static abstract class AbstractSymbol implements Symbol {
		private final String name;

		public AbstractSymbol(String name) {
			if (name == null) {
				throw new IllegalArgumentException("symbol requires a name");
			}
			this.name = name;
		}

		@Override
		public String getName() {
			return name;
		}

		@Override
		public boolean equals(Object o) {
			return o != null && o.getClass() == getClass() && ((AbstractSymbol) o).name.equals(name);
		}

		@Override
		public int hashCode() {
			return getClass().hashCode() ^ name.hashCode();
		}

		@Override
		public String toString() {
			return name;
		}
	}

	/**
	 * Names a declared lattice. This doubles as the sort name of the lattice's
	 * domain in generated declarations.
	 */
	public static class LatticeSymbol extends AbstractSymbol {
		public LatticeSymbol(String name) {
			super(name);
		}
	}

	/**
	 * Names a relation defined by clauses, such as a lattice's order or join.
	 */
	public static class PredicateSymbol extends AbstractSymbol {
		public PredicateSymbol(String name) {
			super(name);
		}
	}

	/**
	 * Names a logic variable.
	 */
	public static class VariableSymbol extends AbstractSymbol {
		public VariableSymbol(String name) {
			super(name);
		}
	}

	/**
	 * Names a constructor of an enumerated domain (e.g. <code>Top</code>).
	 */
	public static class NamedSymbol extends AbstractSymbol {
		public NamedSymbol(String name) {
			super(name);
		}
	}
}

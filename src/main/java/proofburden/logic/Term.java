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
 * A first-order term appearing as the argument of a predicate. Only boolean
 * literals, variables and nullary constructors are supported; in particular,
 * variables never occur nested inside a constructor.
 */
public interface Term {

	public static final Term.Bool True = new Term.Bool(true);
	public static final Term.Bool False = new Term.Bool(false);

	public static class Bool implements Term {
		private final boolean value;

		public Bool(boolean value) {
			this.value = value;
		}

		public boolean getValue() {
			return value;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Bool && ((Bool) o).value == value;
		}

		@Override
		public int hashCode() {
			return java.lang.Boolean.hashCode(value);
		}

		@Override
		public String toString() {
			return java.lang.Boolean.toString(value);
		}
	}

	public static class Variable implements Term {
		private final Symbol.VariableSymbol symbol;

		public Variable(Symbol.VariableSymbol symbol) {
			if (symbol == null) {
				throw new IllegalArgumentException("variable requires a symbol");
			}
			this.symbol = symbol;
		}

		public Symbol.VariableSymbol getSymbol() {
			return symbol;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Variable && ((Variable) o).symbol.equals(symbol);
		}

		@Override
		public int hashCode() {
			return symbol.hashCode();
		}

		@Override
		public String toString() {
			return symbol.getName();
		}
	}

	public static class Constructor0 implements Term {
		private final Symbol.NamedSymbol symbol;

		public Constructor0(Symbol.NamedSymbol symbol) {
			if (symbol == null) {
				throw new IllegalArgumentException("constructor requires a symbol");
			}
			this.symbol = symbol;
		}

		public Symbol.NamedSymbol getSymbol() {
			return symbol;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Constructor0 && ((Constructor0) o).symbol.equals(symbol);
		}

		@Override
		public int hashCode() {
			return 31 * symbol.hashCode();
		}

		@Override
		public String toString() {
			return symbol.getName();
		}
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	public static Term.Variable VAR(String name) {
		return new Term.Variable(new Symbol.VariableSymbol(name));
	}

	public static Term.Constructor0 CONST(String name) {
		return new Term.Constructor0(new Symbol.NamedSymbol(name));
	}
}

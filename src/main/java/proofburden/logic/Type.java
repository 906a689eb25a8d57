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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The type of a lattice's domain. A well-formed lattice has a
 * <code>Variant</code> domain whose every alternative is a
 * <code>Constructor0</code>; the remaining kinds exist because the program
 * loader may hand us any type at all.
 */
public interface Type {

	public static final Type Bool = new Bool();

	public static class Bool implements Type {
		@Override
		public String toString() {
			return "Bool";
		}
	}

	/**
	 * A nullary constructor type, such as <code>Top</code>.
	 */
	public static class Constructor0 implements Type {
		private final Symbol.NamedSymbol name;

		public Constructor0(Symbol.NamedSymbol name) {
			if (name == null) {
				throw new IllegalArgumentException("constructor requires a name");
			}
			this.name = name;
		}

		public Symbol.NamedSymbol getName() {
			return name;
		}

		@Override
		public String toString() {
			return name.getName();
		}
	}

	/**
	 * A constructor carrying one or more fields, such as
	 * <code>Const(Int)</code>.
	 */
	public static class Constructor implements Type {
		private final Symbol.NamedSymbol name;
		private final List<Type> fields;

		public Constructor(Symbol.NamedSymbol name, List<Type> fields) {
			if (name == null || fields == null) {
				throw new IllegalArgumentException("constructor requires a name and fields");
			}
			this.name = name;
			this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
		}

		public Symbol.NamedSymbol getName() {
			return name;
		}

		public List<Type> getFields() {
			return fields;
		}

		@Override
		public String toString() {
			return name.getName() + fields;
		}
	}

	/**
	 * A tagged union of alternatives, listed in declaration order.
	 */
	public static class Variant implements Type {
		private final List<Type> alternatives;

		public Variant(List<Type> alternatives) {
			if (alternatives == null) {
				throw new IllegalArgumentException("variant requires alternatives");
			}
			this.alternatives = Collections.unmodifiableList(new ArrayList<>(alternatives));
		}

		public List<Type> getAlternatives() {
			return alternatives;
		}

		@Override
		public String toString() {
			return "Variant" + alternatives;
		}
	}

	public static class Tuple implements Type {
		private final List<Type> elements;

		public Tuple(List<Type> elements) {
			if (elements == null) {
				throw new IllegalArgumentException("tuple requires elements");
			}
			this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
		}

		public List<Type> getElements() {
			return elements;
		}

		@Override
		public String toString() {
			return "Tuple" + elements;
		}
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	/**
	 * Construct an enumeration, i.e. a variant of nullary constructors with the
	 * given names.
	 *
	 * @param names
	 * @return
	 */
	public static Type.Variant ENUM(String... names) {
		ArrayList<Type> alternatives = new ArrayList<>();
		for (int i = 0; i != names.length; ++i) {
			alternatives.add(new Type.Constructor0(new Symbol.NamedSymbol(names[i])));
		}
		return new Type.Variant(alternatives);
	}

	public static Type.Variant VARIANT(Type... alternatives) {
		return new Type.Variant(Arrays.asList(alternatives));
	}
}

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
 * An atom <code>p(t1, ..., tn)</code>, used both as the head of a clause and as
 * an element of a clause body. The arity is given by the number of arguments.
 */
public class Predicate {
	private final Symbol.PredicateSymbol name;
	private final List<Term> arguments;

	public Predicate(Symbol.PredicateSymbol name, List<Term> arguments) {
		if (name == null || arguments == null) {
			throw new IllegalArgumentException("predicate requires a name and arguments");
		}
		this.name = name;
		this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
	}

	public Predicate(Symbol.PredicateSymbol name, Term... arguments) {
		this(name, Arrays.asList(arguments));
	}

	public Symbol.PredicateSymbol getName() {
		return name;
	}

	public List<Term> getArguments() {
		return arguments;
	}

	public int getArity() {
		return arguments.size();
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Predicate) {
			Predicate p = (Predicate) o;
			return name.equals(p.name) && arguments.equals(p.arguments);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return name.hashCode() ^ arguments.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder r = new StringBuilder(name.getName());
		r.append("(");
		for (int i = 0; i != arguments.size(); ++i) {
			if (i != 0) {
				r.append(", ");
			}
			r.append(arguments.get(i));
		}
		return r.append(")").toString();
	}
}

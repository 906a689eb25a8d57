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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import proofburden.core.SmtFile.Decl;
import proofburden.core.SmtFile.Formula;

/**
 * Determines the set of variables occurring free in a formula, in order of
 * first occurrence. Variables bound by a quantifier are not free within its
 * body.
 */
public class FreeVariables extends AbstractFormulaFold<Set<String>> {

	public static Set<String> of(Formula f) {
		return Collections.unmodifiableSet(new FreeVariables().visitFormula(f));
	}

	@Override
	protected Set<String> constructVariable(Formula.Variable f) {
		LinkedHashSet<String> r = new LinkedHashSet<>();
		r.add(f.getName());
		return r;
	}

	@Override
	protected Set<String> constructUniversalQuantifier(Formula.UniversalQuantifier f, Set<String> body) {
		LinkedHashSet<String> r = new LinkedHashSet<>(body);
		for (Decl.Parameter p : f.getParameters()) {
			r.remove(p.getName());
		}
		return r;
	}

	@Override
	protected Set<String> BOTTOM() {
		return new LinkedHashSet<>();
	}

	@Override
	protected Set<String> join(Set<String> lhs, Set<String> rhs) {
		LinkedHashSet<String> r = new LinkedHashSet<>(lhs);
		r.addAll(rhs);
		return r;
	}
}

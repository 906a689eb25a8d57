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

import static proofburden.core.SmtFile.AND;
import static proofburden.core.SmtFile.AXIOM;
import static proofburden.core.SmtFile.EQ;
import static proofburden.core.SmtFile.FORALL;
import static proofburden.core.SmtFile.IMPLIES;
import static proofburden.core.SmtFile.INVOKE;
import static proofburden.core.SmtFile.PARAMETER;
import static proofburden.core.SmtFile.VAR;

import java.util.Arrays;

import proofburden.core.SmtFile.Decl;
import proofburden.core.SmtFile.Formula;

/**
 * The axioms of a partial order, instantiated for a given sort and order
 * relation. These do not depend on how the relation is defined.
 */
public class OrderAxioms {

	public static final String REFLEXIVITY = "Reflexivity: ∀x. x ⊑ x";
	public static final String ANTI_SYMMETRY = "Anti-symmetri: ∀x, y. x ⊑ y ∧ x ⊒ y ⇒ x = y";
	public static final String TRANSITIVITY = "Transitivity: ∀x, y, z. x ⊑ y ∧ y ⊑ z ⇒ x ⊑ z.";

	/**
	 * Reflexivity: ∀x. x ⊑ x
	 *
	 * @param sort
	 * @param leq
	 * @return
	 */
	public static Decl.Axiom reflexivity(String sort, String leq) {
		Formula x = VAR("x");
		return AXIOM("reflexivity", FORALL(Arrays.asList(PARAMETER("x", sort)), INVOKE(leq, x, x)));
	}

	/**
	 * Anti-symmetri: ∀x, y. x ⊑ y ∧ x ⊒ y ⇒ x = y
	 *
	 * @param sort
	 * @param leq
	 * @return
	 */
	public static Decl.Axiom antiSymmetry(String sort, String leq) {
		Formula x = VAR("x");
		Formula y = VAR("y");
		Formula body = IMPLIES(AND(INVOKE(leq, x, y), INVOKE(leq, y, x)), EQ(x, y));
		return AXIOM("anti-symmetri", FORALL(Arrays.asList(PARAMETER("x", sort), PARAMETER("y", sort)), body));
	}

	/**
	 * Transitivity: ∀x, y, z. x ⊑ y ∧ y ⊑ z ⇒ x ⊑ z.
	 *
	 * @param sort
	 * @param leq
	 * @return
	 */
	public static Decl.Axiom transitivity(String sort, String leq) {
		Formula x = VAR("x");
		Formula y = VAR("y");
		Formula z = VAR("z");
		Formula body = IMPLIES(AND(INVOKE(leq, x, y), INVOKE(leq, y, z)), INVOKE(leq, x, z));
		return AXIOM("transitivity",
				FORALL(Arrays.asList(PARAMETER("x", sort), PARAMETER("y", sort), PARAMETER("z", sort)), body));
	}
}

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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static proofburden.logic.Clause.FACT;
import static proofburden.logic.Term.CONST;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

public class ProgramTests {
	private static final Symbol.LatticeSymbol SIGN = new Symbol.LatticeSymbol("Sign");
	private static final Symbol.PredicateSymbol LEQ = new Symbol.PredicateSymbol("leq");
	private static final Symbol.PredicateSymbol JOIN = new Symbol.PredicateSymbol("join");

	private static Lattice sign() {
		return new Lattice(SIGN, Type.ENUM("Top", "Bot"), LEQ, JOIN);
	}

	@Test
	public void test_clauses_01() {
		Clause c1 = FACT(new Predicate(LEQ, CONST("Bot"), CONST("Top")));
		Clause c2 = FACT(new Predicate(JOIN, CONST("Bot"), CONST("Top"), CONST("Top")));
		Clause c3 = FACT(new Predicate(LEQ, CONST("Top"), CONST("Top")));
		Program p = new Program(Arrays.asList(sign()), Arrays.asList(c1, c2, c3));
		assertEquals(Arrays.asList(c1, c3), p.getClauses(LEQ));
		assertEquals(Arrays.asList(c2), p.getClauses(JOIN));
		assertEquals(Arrays.asList(c1, c2, c3), p.getClauses());
	}

	@Test
	public void test_lattices_01() {
		Lattice other = new Lattice(new Symbol.LatticeSymbol("Other"), Type.ENUM("A"), LEQ, JOIN);
		Program p = new Program(Arrays.asList(other, sign()), Collections.emptyList());
		assertEquals(Arrays.asList(other.getName(), SIGN), new ArrayList<>(p.getLattices().keySet()));
	}

	@Test
	public void test_invalid_01() {
		assertThrows(IllegalArgumentException.class,
				() -> new Program(Arrays.asList(sign(), sign()), Collections.emptyList()));
	}

	@Test
	public void test_invalid_02() {
		// Missing components are rejected as invalid arguments
		assertThrows(IllegalArgumentException.class, () -> new Program(null, Collections.emptyList()));
		assertThrows(IllegalArgumentException.class, () -> new Program(Arrays.asList(sign()), null));
		assertThrows(IllegalArgumentException.class, () -> new Type.Variant(null));
		assertThrows(IllegalArgumentException.class, () -> new Type.Tuple(null));
		assertThrows(IllegalArgumentException.class,
				() -> new Type.Constructor(new Symbol.NamedSymbol("Const"), null));
		assertThrows(IllegalArgumentException.class, () -> new Type.Constructor(null, Collections.emptyList()));
	}
}

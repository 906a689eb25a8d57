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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static proofburden.tasks.TestPrograms.JOIN;
import static proofburden.tasks.TestPrograms.LEQ;
import static proofburden.tasks.TestPrograms.SIGN;
import static proofburden.tasks.TestPrograms.signProgram;

import java.util.Arrays;
import java.util.Collections;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import proofburden.core.SmtFile.Decl;
import proofburden.logic.Symbol;
import proofburden.logic.Type;

public class DeclarationBuilderTests {

	private static Type.Constructor0 constructor(String name) {
		return new Type.Constructor0(new Symbol.NamedSymbol(name));
	}

	/**
	 * Domains which are not enumerations of nullary constructors.
	 *
	 * @return
	 */
	private static Stream<Type> malformedDomains() {
		return Stream.of(
				Type.Bool,
				constructor("Top"),
				new Type.Tuple(Arrays.asList(Type.Bool, Type.Bool)),
				Type.VARIANT(),
				Type.VARIANT(constructor("Top"), Type.Bool),
				Type.VARIANT(constructor("Top"), new Type.Constructor(new Symbol.NamedSymbol("Const"),
						Collections.singletonList(Type.Bool))),
				Type.VARIANT(Type.ENUM("A", "B")),
				Type.VARIANT(new Type.Tuple(Collections.emptyList())));
	}

	@ParameterizedTest
	@MethodSource("malformedDomains")
	public void test_datatype_malformed(Type domain) {
		DeclarationBuilder builder = new DeclarationBuilder(signProgram());
		MalformedLatticeDomainException e = assertThrows(MalformedLatticeDomainException.class,
				() -> builder.datatype(SIGN, domain));
		assertEquals(SIGN, e.getLattice());
		assertSame(domain, e.getDomain());
		assertTrue(e.getMessage().contains("Sign"));
	}

	@Test
	public void test_datatype_01() {
		DeclarationBuilder builder = new DeclarationBuilder(signProgram());
		Decl.Datatype d = builder.datatype(SIGN, Type.ENUM("Top", "Pos", "Neg", "Zero", "Bot"));
		assertEquals("Sign", d.getName());
		assertEquals(Arrays.asList("Top", "Pos", "Neg", "Zero", "Bot"), d.getVariants());
		assertEquals(SIGN, d.getAttribute(Symbol.LatticeSymbol.class));
	}

	@Test
	public void test_datatype_02() {
		// Variant order is preserved, not sorted
		DeclarationBuilder builder = new DeclarationBuilder(signProgram());
		Decl.Datatype d = builder.datatype(SIGN, Type.ENUM("Z", "A", "M"));
		assertEquals(Arrays.asList("Z", "A", "M"), d.getVariants());
	}

	@Test
	public void test_relation2_01() {
		DeclarationBuilder builder = new DeclarationBuilder(signProgram());
		Decl.Relation2 r = builder.relation2(SIGN, LEQ);
		assertEquals("leq", r.getName());
		assertEquals("Sign", r.getSort());
		assertEquals(Arrays.asList("x0", "y0"), r.getParameters());
		assertEquals(new FormulaSynthesizer(signProgram()).relation2(LEQ), r.getBody());
	}

	@Test
	public void test_relation3_01() {
		DeclarationBuilder builder = new DeclarationBuilder(signProgram());
		Decl.Relation3 r = builder.relation3(SIGN, JOIN);
		assertEquals("join", r.getName());
		assertEquals("Sign", r.getSort());
		assertEquals(Arrays.asList("x0", "y0", "z0"), r.getParameters());
		assertEquals(new FormulaSynthesizer(signProgram()).relation3(JOIN), r.getBody());
	}
}

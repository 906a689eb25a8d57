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
package proofburden.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static proofburden.core.SmtFile.AND;
import static proofburden.core.SmtFile.ATTRIBUTE;
import static proofburden.core.SmtFile.AXIOM;
import static proofburden.core.SmtFile.COMMENT;
import static proofburden.core.SmtFile.CONSTRUCTOR;
import static proofburden.core.SmtFile.DATATYPE;
import static proofburden.core.SmtFile.EQ;
import static proofburden.core.SmtFile.FALSE;
import static proofburden.core.SmtFile.FORALL;
import static proofburden.core.SmtFile.IMPLIES;
import static proofburden.core.SmtFile.INVOKE;
import static proofburden.core.SmtFile.OR;
import static proofburden.core.SmtFile.PARAMETER;
import static proofburden.core.SmtFile.RELATION;
import static proofburden.core.SmtFile.TRUE;
import static proofburden.core.SmtFile.VAR;

import java.io.ByteArrayOutputStream;
import java.lang.reflect.Modifier;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import proofburden.core.SmtFile;
import proofburden.core.SmtFile.Decl;
import proofburden.core.SmtFile.Formula;
import proofburden.logic.Clause;
import proofburden.tasks.DeclarationBuilder;
import proofburden.tasks.OrderAxioms;
import proofburden.tasks.TestPrograms;
import proofburden.util.FreeVariables;
import proofburden.util.MappablePrintWriter;

public class SmtFilePrinterTests {

	@Test
	public void test_datatype_01() {
		Decl d = DATATYPE("Sign", Arrays.asList("Top", "Pos", "Neg", "Zero", "Bot"));
		assertEquals("(declare-datatypes () ((Sign Top, Pos, Neg, Zero, Bot)))\n", SmtFilePrinter.toString(d));
	}

	@Test
	public void test_datatype_02() {
		Decl d = DATATYPE("Unit", Collections.singletonList("One"));
		assertEquals("(declare-datatypes () ((Unit One)))\n", SmtFilePrinter.toString(d));
	}

	@Test
	public void test_relation2_01() {
		Decl d = RELATION("leq", "Sign", "x0", "y0", OR(AND(EQ(VAR("x0"), CONSTRUCTOR("Bot")))));
		assertEquals("(define-fun leq ((x0 Sign) (y0 Sign)) Bool\n    (or\n        (and (= x0 Bot))))\n",
				SmtFilePrinter.toString(d));
	}

	@Test
	public void test_relation3_01() {
		// All three parameters are declared
		Decl d = RELATION("join", "Sign", "x0", "y0", "z0", OR(TRUE));
		assertEquals("(define-fun join ((x0 Sign) (y0 Sign) (z0 Sign)) Bool\n    (or\n        true))\n",
				SmtFilePrinter.toString(d));
	}

	@Test
	public void test_relation_empty() {
		Decl d = RELATION("join", "Sign", "x0", "y0", "z0", OR());
		assertEquals("(define-fun join ((x0 Sign) (y0 Sign) (z0 Sign)) Bool\n    (or))\n",
				SmtFilePrinter.toString(d));
	}

	@Test
	public void test_relation_nested() {
		// Nested disjuncts are indented one level further
		Decl d = RELATION("leq", "S", "x0", "y0", OR(TRUE, OR(FALSE)));
		assertEquals("(define-fun leq ((x0 S) (y0 S)) Bool\n    (or\n        true\n        (or\n            false)))\n",
				SmtFilePrinter.toString(d));
	}

	@Test
	public void test_axiom_01() {
		Decl d = AXIOM("ax", TRUE);
		assertEquals("(define-fun ax () Bool true)\n", SmtFilePrinter.toString(d));
	}

	@Test
	public void test_comment_01() {
		assertEquals(";; Reflexivity: ∀x. x ⊑ x\n", SmtFilePrinter.toString(COMMENT(OrderAxioms.REFLEXIVITY)));
	}

	@Test
	public void test_formula_01() {
		assertEquals("(and)", SmtFilePrinter.toString(AND()));
		assertEquals("(or)", SmtFilePrinter.toString(OR()));
		assertEquals("(and true false)", SmtFilePrinter.toString(AND(TRUE, FALSE)));
	}

	@Test
	public void test_formula_02() {
		assertEquals("(=> (r x) (= x Top))",
				SmtFilePrinter.toString(IMPLIES(INVOKE("r", VAR("x")), EQ(VAR("x"), CONSTRUCTOR("Top")))));
	}

	@Test
	public void test_formula_03() {
		Formula f = CONSTRUCTOR("Pair", Arrays.asList(CONSTRUCTOR("Top"), VAR("y")));
		assertEquals("(Pair Top y)", SmtFilePrinter.toString(f));
	}

	@Test
	public void test_formula_04() {
		Formula f = FORALL(Arrays.asList(PARAMETER("x", "S"), PARAMETER("y", "T")), INVOKE("r", VAR("x"), VAR("y")));
		assertEquals("(forall ((x S) (y T)) (r x y))", SmtFilePrinter.toString(f));
	}

	@Test
	public void test_file_01() {
		// A file is written as the concatenation of its declarations
		SmtFile file = new SmtFile();
		Decl d1 = COMMENT("Sign");
		Decl d2 = DATATYPE("Sign", Arrays.asList("Top", "Bot"));
		Decl d3 = AXIOM("ax", FALSE);
		file.add(d1);
		file.add(d2);
		file.add(d3);
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		new SmtFilePrinter(buf).write(file);
		assertEquals(SmtFilePrinter.toString(d1) + SmtFilePrinter.toString(d2) + SmtFilePrinter.toString(d3),
				new String(buf.toByteArray(), StandardCharsets.UTF_8));
	}

	@Test
	public void test_balanced_01() {
		// Every generated declaration is a single well-formed s-expression
		DeclarationBuilder builder = new DeclarationBuilder(TestPrograms.signProgram());
		List<Decl> decls = Arrays.asList(
				builder.datatype(TestPrograms.SIGN, TestPrograms.sign().getDomain()),
				builder.relation2(TestPrograms.SIGN, TestPrograms.LEQ),
				builder.relation3(TestPrograms.SIGN, TestPrograms.JOIN),
				OrderAxioms.reflexivity("Sign", "leq"),
				OrderAxioms.antiSymmetry("Sign", "leq"),
				OrderAxioms.transitivity("Sign", "leq"),
				RELATION("join", "Sign", "x0", "y0", "z0", OR()));
		for (Decl d : decls) {
			assertBalanced(SmtFilePrinter.toString(d));
		}
	}

	@Test
	public void test_mapping_01() {
		// Positions in the output map back to the formula which printed them
		DeclarationBuilder builder = new DeclarationBuilder(TestPrograms.signProgram());
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		SmtFilePrinter printer = new SmtFilePrinter(buf);
		Decl.Relation2 leq = builder.relation2(TestPrograms.SIGN, TestPrograms.LEQ);
		printer.write(leq);
		MappablePrintWriter.Mapping<SmtFile.Item> mapping = printer.getMapping();
		assertSame(leq, mapping.get(1, 0));
		SmtFile.Item item = mapping.get(3, 8);
		assertTrue(item instanceof Formula.Conjunction);
		assertSame(TestPrograms.LEQ_BOT_TOP, item.getAttribute(Clause.class));
		assertTrue(mapping.get(3, 13) instanceof Formula.Equals);
		assertNull(mapping.get(3, 0));
		assertNull(mapping.get(100, 0));
	}

	@Test
	public void test_unknown_01() {
		Formula unknown = new Formula() {
			@Override
			public <T> T getAttribute(Class<T> kind) {
				return null;
			}

			@Override
			public SmtFile.Attribute[] getAttributes() {
				return new SmtFile.Attribute[0];
			}
		};
		assertThrows(IllegalArgumentException.class, () -> SmtFilePrinter.toString(unknown));
	}

	@Test
	public void test_exhaustive_01() {
		// Every kind of formula can be printed and folded over
		List<Formula> samples = Arrays.asList(
				TRUE,
				VAR("x"),
				CONSTRUCTOR("Top"),
				CONSTRUCTOR("Pair", Arrays.asList(VAR("x"), VAR("y"))),
				EQ(VAR("x"), VAR("y")),
				IMPLIES(TRUE, FALSE),
				AND(TRUE),
				OR(FALSE),
				FORALL(Arrays.asList(PARAMETER("x", "S")), VAR("x")),
				INVOKE("r", VAR("x")));
		Set<Class<?>> kinds = new HashSet<>();
		for (Formula f : samples) {
			kinds.add(f.getClass());
			assertTrue(SmtFilePrinter.toString(f).length() > 0);
			FreeVariables.of(f);
		}
		assertEquals(concreteKinds(Formula.class), kinds);
	}

	@Test
	public void test_exhaustive_02() {
		List<Decl> samples = Arrays.asList(
				DATATYPE("S", Arrays.asList("A")),
				RELATION("r", "S", "x0", "y0", OR()),
				RELATION("j", "S", "x0", "y0", "z0", OR()),
				AXIOM("a", TRUE),
				COMMENT("c", ATTRIBUTE("c")));
		Set<Class<?>> kinds = new HashSet<>();
		for (Decl d : samples) {
			kinds.add(d.getClass());
			assertTrue(SmtFilePrinter.toString(d).endsWith("\n"));
		}
		assertEquals(concreteKinds(Decl.class), kinds);
	}

	private static Set<Class<?>> concreteKinds(Class<?> kind) {
		Set<Class<?>> r = new HashSet<>();
		for (Class<?> c : kind.getDeclaredClasses()) {
			if (kind.isAssignableFrom(c) && !Modifier.isAbstract(c.getModifiers())) {
				r.add(c);
			}
		}
		return r;
	}

	private static void assertBalanced(String text) {
		assertTrue(text.endsWith("\n"));
		String body = text.substring(0, text.length() - 1);
		assertTrue(body.startsWith("("));
		int depth = 0;
		for (int i = 0; i != body.length(); ++i) {
			char c = body.charAt(i);
			if (c == '(') {
				depth++;
			} else if (c == ')') {
				depth--;
			}
			assertTrue(depth >= 0, text);
			if (depth == 0) {
				assertEquals(body.length() - 1, i, text);
			}
		}
		assertEquals(0, depth, text);
	}
}

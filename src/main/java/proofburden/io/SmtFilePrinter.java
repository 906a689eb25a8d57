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

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import proofburden.core.SmtFile;
import proofburden.core.SmtFile.Decl;
import proofburden.core.SmtFile.Formula;
import proofburden.util.MappablePrintWriter;

/**
 * Writes an <code>SmtFile</code> as SMT-LIB style s-expressions. Output is a
 * pure function of the declarations given, and every declaration is
 * terminated by a newline.
 */
public class SmtFilePrinter {
	private final MappablePrintWriter<SmtFile.Item> out;

	public SmtFilePrinter(OutputStream output) {
		this.out = new MappablePrintWriter<>(output);
	}

	public void flush() {
		out.flush();
	}

	public MappablePrintWriter.Mapping<SmtFile.Item> getMapping() {
		return out.getMapping();
	}

	public void write(SmtFile file) {
		for(Decl d : file.getDeclarations()) {
			writeDecl(0, d);
		}
		out.flush();
	}

	public void write(Decl d) {
		writeDecl(0, d);
		out.flush();
	}

	private void writeDecl(int indent, Decl d) {
		if(d instanceof Decl.Datatype) {
			writeDatatype(indent, (Decl.Datatype) d);
		} else if(d instanceof Decl.Relation) {
			writeRelation(indent, (Decl.Relation) d);
		} else if(d instanceof Decl.Axiom) {
			writeAxiom(indent, (Decl.Axiom) d);
		} else if(d instanceof Decl.LineComment) {
			writeLineComment(indent, (Decl.LineComment) d);
		} else {
			throw new IllegalArgumentException("unknown declaration encountered (" + d.getClass().getName() + ")");
		}
	}

	private void writeDatatype(int indent, Decl.Datatype d) {
		out.tab(indent);
		out.print("(declare-datatypes () ((", d);
		out.print(d.getName(), d);
		List<String> variants = d.getVariants();
		for(int i=0;i!=variants.size();++i) {
			out.print(i == 0 ? " " : ", ", d);
			out.print(variants.get(i), d);
		}
		out.println(")))", d);
	}

	private void writeRelation(int indent, Decl.Relation d) {
		out.tab(indent);
		out.print("(define-fun ", d);
		out.print(d.getName(), d);
		out.print(" (", d);
		List<String> parameters = d.getParameters();
		for(int i=0;i!=parameters.size();++i) {
			if(i != 0) {
				out.print(" ", d);
			}
			out.print("(", d);
			out.print(parameters.get(i), d);
			out.print(" ", d);
			out.print(d.getSort(), d);
			out.print(")", d);
		}
		out.println(") Bool", d);
		out.tab(indent + 1);
		writeFormula(indent + 1, d.getBody());
		out.println(")", d);
	}

	private void writeAxiom(int indent, Decl.Axiom d) {
		out.tab(indent);
		out.print("(define-fun ", d);
		out.print(d.getName(), d);
		out.print(" () Bool ", d);
		writeFormula(indent, d.getBody());
		out.println(")", d);
	}

	private void writeLineComment(int indent, Decl.LineComment d) {
		out.tab(indent);
		out.println(";; " + d.getMessage(), d);
	}

	/**
	 * Write a formula which begins at the current position, where
	 * <code>indent</code> is the indentation level of the line on which it
	 * begins. Only disjunctions span multiple lines, with each disjunct on its
	 * own line one level deeper than the enclosing line.
	 *
	 * @param indent
	 * @param f
	 */
	private void writeFormula(int indent, Formula f) {
		if(f instanceof Formula.Boolean) {
			writeBoolean((Formula.Boolean) f);
		} else if(f instanceof Formula.Variable) {
			out.print(((Formula.Variable) f).getName(), f);
		} else if(f instanceof Formula.Constructor0) {
			out.print(((Formula.Constructor0) f).getName(), f);
		} else if(f instanceof Formula.Constructor) {
			Formula.Constructor c = (Formula.Constructor) f;
			writeApplication(indent, c.getName(), c.getOperands(), f);
		} else if(f instanceof Formula.Equals) {
			writeEquals(indent, (Formula.Equals) f);
		} else if(f instanceof Formula.Implies) {
			writeImplies(indent, (Formula.Implies) f);
		} else if(f instanceof Formula.Conjunction) {
			writeApplication(indent, "and", ((Formula.Conjunction) f).getOperands(), f);
		} else if(f instanceof Formula.Disjunction) {
			writeDisjunction(indent, (Formula.Disjunction) f);
		} else if(f instanceof Formula.UniversalQuantifier) {
			writeQuantifier(indent, (Formula.UniversalQuantifier) f);
		} else if(f instanceof Formula.Invoke) {
			Formula.Invoke i = (Formula.Invoke) f;
			writeApplication(indent, i.getName(), i.getArguments(), f);
		} else {
			throw new IllegalArgumentException("unknown formula encountered (" + f.getClass().getName() + ")");
		}
	}

	private void writeBoolean(Formula.Boolean f) {
		out.print(f.getValue() ? "true" : "false", f);
	}

	private void writeEquals(int indent, Formula.Equals f) {
		out.print("(= ", f);
		writeFormula(indent, f.getLeftHandSide());
		out.print(" ", f);
		writeFormula(indent, f.getRightHandSide());
		out.print(")", f);
	}

	private void writeImplies(int indent, Formula.Implies f) {
		out.print("(=> ", f);
		writeFormula(indent, f.getAntecedent());
		out.print(" ", f);
		writeFormula(indent, f.getConsequent());
		out.print(")", f);
	}

	/**
	 * Write a prefix application <code>(head a1 a2 ...)</code> on one line.
	 *
	 * @param indent
	 * @param head
	 * @param operands
	 * @param f
	 */
	private void writeApplication(int indent, String head, List<Formula> operands, Formula f) {
		out.print("(", f);
		out.print(head, f);
		for(int i=0;i!=operands.size();++i) {
			out.print(" ", f);
			writeFormula(indent, operands.get(i));
		}
		out.print(")", f);
	}

	private void writeDisjunction(int indent, Formula.Disjunction f) {
		List<Formula> operands = f.getOperands();
		out.print("(or", f);
		for(int i=0;i!=operands.size();++i) {
			out.println();
			out.tab(indent + 1);
			writeFormula(indent + 1, operands.get(i));
		}
		out.print(")", f);
	}

	private void writeQuantifier(int indent, Formula.UniversalQuantifier f) {
		out.print("(forall (", f);
		List<Decl.Parameter> params = f.getParameters();
		for (int i = 0; i != params.size(); ++i) {
			Decl.Parameter ith = params.get(i);
			if (i != 0) {
				out.print(" ", f);
			}
			out.print("(", ith);
			out.print(ith.getName(), ith);
			out.print(" ", ith);
			out.print(ith.getSort(), ith);
			out.print(")", ith);
		}
		out.print(") ", f);
		writeFormula(indent, f.getBody());
		out.print(")", f);
	}

	/**
	 * Render a single declaration, including its terminating newline.
	 *
	 * @param decl
	 * @return
	 */
	public static String toString(Decl decl) {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		SmtFilePrinter p = new SmtFilePrinter(buf);
		p.write(decl);
		return new String(buf.toByteArray(), StandardCharsets.UTF_8);
	}

	public static String toString(Formula formula) {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		SmtFilePrinter p = new SmtFilePrinter(buf);
		p.writeFormula(0, formula);
		p.flush();
		return new String(buf.toByteArray(), StandardCharsets.UTF_8);
	}
}

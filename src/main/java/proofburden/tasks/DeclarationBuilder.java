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

import static proofburden.core.SmtFile.ATTRIBUTE;
import static proofburden.core.SmtFile.DATATYPE;
import static proofburden.core.SmtFile.RELATION;

import java.util.ArrayList;
import java.util.List;

import proofburden.core.SmtFile.Decl;
import proofburden.core.SmtFile.Formula;
import proofburden.logic.Program;
import proofburden.logic.Symbol;
import proofburden.logic.Type;

/**
 * Responsible for constructing the declarations which describe a lattice: the
 * datatype of its domain, and the relations defining its order and join.
 */
public class DeclarationBuilder {
	private final FormulaSynthesizer synthesizer;

	public DeclarationBuilder(Program program) {
		this.synthesizer = new FormulaSynthesizer(program);
	}

	/**
	 * Construct a datatype declaration for the domain of a given lattice. The
	 * domain must be a non-empty variant whose alternatives are all nullary
	 * constructors, and these become the variants of the datatype in the same
	 * order.
	 *
	 * @param l Lattice whose domain this is.
	 * @param t Domain of the lattice.
	 * @return
	 * @throws MalformedLatticeDomainException if the domain is not an enumeration.
	 */
	public Decl.Datatype datatype(Symbol.LatticeSymbol l, Type t) {
		if (!(t instanceof Type.Variant) || ((Type.Variant) t).getAlternatives().isEmpty()) {
			throw new MalformedLatticeDomainException(l, t);
		}
		List<String> variants = new ArrayList<>();
		for (Type alternative : ((Type.Variant) t).getAlternatives()) {
			if (!(alternative instanceof Type.Constructor0)) {
				throw new MalformedLatticeDomainException(l, t);
			}
			variants.add(((Type.Constructor0) alternative).getName().getName());
		}
		return DATATYPE(l.getName(), variants, ATTRIBUTE(l));
	}

	/**
	 * Construct the definition of a binary relation over the given sort, such as
	 * the order of a lattice.
	 *
	 * @param sort
	 * @param s
	 * @return
	 */
	public Decl.Relation2 relation2(Symbol.LatticeSymbol sort, Symbol.PredicateSymbol s) {
		Formula body = synthesizer.relation2(s);
		return RELATION(s.getName(), sort.getName(), FormulaSynthesizer.X0.getName(),
				FormulaSynthesizer.Y0.getName(), body, ATTRIBUTE(s));
	}

	/**
	 * Construct the definition of a ternary relation over the given sort, such as
	 * the join of a lattice.
	 *
	 * @param sort
	 * @param s
	 * @return
	 */
	public Decl.Relation3 relation3(Symbol.LatticeSymbol sort, Symbol.PredicateSymbol s) {
		Formula body = synthesizer.relation3(s);
		return RELATION(s.getName(), sort.getName(), FormulaSynthesizer.X0.getName(),
				FormulaSynthesizer.Y0.getName(), FormulaSynthesizer.Z0.getName(), body, ATTRIBUTE(s));
	}
}

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
package proofburden.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An in-memory representation of an SMT-LIB script made up of datatype
 * declarations, relation definitions and axioms. Declarations and formulae are
 * immutable once constructed and are compared structurally; attributes are
 * carried along for tooling but take no part in equality.
 */
public class SmtFile {
	/**
	 * The list of top-level declarations within this file.
	 */
	private final List<Decl> declarations;

	public SmtFile() {
		this.declarations = new ArrayList<>();
	}

	public List<Decl> getDeclarations() {
		return declarations;
	}

	public SmtFile add(Decl decl) {
		declarations.add(decl);
		return this;
	}

	// =========================================================================
	// Top-Level Item
	// =========================================================================

	public interface Item {
		/**
		 * Get a particular attribute associated with this item.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T getAttribute(Class<T> kind);

		/**
		 * Get all attributes within this item.
		 * @return
		 */
		public Attribute[] getAttributes();
	}

	public static class AbstractItem implements Item {
		private final Attribute[] attributes;

		public AbstractItem(Attribute[] attributes) {
			this.attributes = attributes;
		}

		@Override
		public <T> T getAttribute(Class<T> kind) {
			for(int i=0;i!=attributes.length;++i) {
				T ith = attributes[i].as(kind);
				if(ith != null) {
					return ith;
				}
			}
			return null;
		}

		@Override
		public Attribute[] getAttributes() {
			return attributes;
		}
	}

	// =========================================================================
	// Declarations
	// =========================================================================

	public interface Decl extends Item {

		/**
		 * Declares an enumerated sort, such as
		 * <code>(declare-datatypes () ((Sign Top, Pos, Neg)))</code>. Variants are
		 * kept in their declared order.
		 */
		public static class Datatype extends AbstractItem implements Decl {
			private final String name;
			private final List<String> variants;

			public Datatype(String name, List<String> variants, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.variants = Collections.unmodifiableList(new ArrayList<>(variants));
			}

			public String getName() {
				return name;
			}

			public List<String> getVariants() {
				return variants;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Datatype) {
					Datatype d = (Datatype) o;
					return name.equals(d.name) && variants.equals(d.variants);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return name.hashCode() ^ variants.hashCode();
			}
		}

		/**
		 * A boolean function defined over a single sort, whose body is given by a
		 * formula over its parameters.
		 */
		public static abstract class Relation extends AbstractItem implements Decl {
			private final String name;
			private final String sort;
			private final List<String> parameters;
			private final Formula body;

			public Relation(String name, String sort, List<String> parameters, Formula body, Attribute[] attributes) {
				super(attributes);
				this.name = name;
				this.sort = sort;
				this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
				this.body = body;
			}

			public String getName() {
				return name;
			}

			public String getSort() {
				return sort;
			}

			public List<String> getParameters() {
				return parameters;
			}

			public Formula getBody() {
				return body;
			}

			@Override
			public boolean equals(Object o) {
				if (o != null && o.getClass() == getClass()) {
					Relation r = (Relation) o;
					return name.equals(r.name) && sort.equals(r.sort) && parameters.equals(r.parameters)
							&& body.equals(r.body);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(name, sort, parameters, body);
			}
		}

		/**
		 * A binary relation, such as the order of a lattice.
		 */
		public static class Relation2 extends Relation {
			public Relation2(String name, String sort, String var1, String var2, Formula body, Attribute... attributes) {
				super(name, sort, Arrays.asList(var1, var2), body, attributes);
			}
		}

		/**
		 * A ternary relation, such as the join of a lattice.
		 */
		public static class Relation3 extends Relation {
			public Relation3(String name, String sort, String var1, String var2, String var3, Formula body,
					Attribute... attributes) {
				super(name, sort, Arrays.asList(var1, var2, var3), body, attributes);
			}
		}

		/**
		 * A named, closed boolean formula. This is emitted as a nullary function
		 * (e.g. <code>(define-fun reflexivity () Bool ...)</code>) so that its
		 * validity can be queried by name.
		 */
		public static class Axiom extends AbstractItem implements Decl {
			private final String name;
			private final Formula body;

			public Axiom(String name, Formula body, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.body = body;
			}

			public String getName() {
				return name;
			}

			public Formula getBody() {
				return body;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Axiom) {
					Axiom a = (Axiom) o;
					return name.equals(a.name) && body.equals(a.body);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return name.hashCode() ^ body.hashCode();
			}
		}

		/**
		 * Allows a line comment to be included in an <code>SmtFile</code>. This is
		 * helpful for annotating generated declarations with information about
		 * them.
		 */
		public static class LineComment extends AbstractItem implements Decl {
			private final String message;

			public LineComment(String message, Attribute... attributes) {
				super(attributes);
				this.message = message;
			}

			public String getMessage() {
				return message;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof LineComment && ((LineComment) o).message.equals(message);
			}

			@Override
			public int hashCode() {
				return message.hashCode();
			}
		}

		/**
		 * A variable binding of a given sort, as used by quantifiers.
		 */
		public static class Parameter extends AbstractItem implements Item {
			private final String name;
			private final String sort;

			public Parameter(String name, String sort, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.sort = sort;
			}

			public String getName() {
				return name;
			}

			public String getSort() {
				return sort;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Parameter) {
					Parameter p = (Parameter) o;
					return name.equals(p.name) && sort.equals(p.sort);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return name.hashCode() ^ sort.hashCode();
			}
		}
	}

	// =========================================================================
	// Formulae
	// =========================================================================

	public interface Formula extends Item {

		public static class Boolean extends AbstractItem implements Formula {
			private final boolean value;

			private Boolean(boolean v, Attribute[] attributes) {
				super(attributes);
				this.value = v;
			}

			public boolean getValue() {
				return value;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Boolean && ((Boolean) o).value == value;
			}

			@Override
			public int hashCode() {
				return value ? 1231 : 1237;
			}

			@Override
			public String toString() {
				return value ? "TRUE" : "FALSE";
			}
		}

		public static class Variable extends AbstractItem implements Formula {
			private final String name;

			private Variable(String name, Attribute[] attributes) {
				super(attributes);
				if (name == null) {
					throw new IllegalArgumentException();
				}
				this.name = name;
			}

			public String getName() {
				return name;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Variable && ((Variable) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}

			@Override
			public String toString() {
				return "VAR(" + name + ")";
			}
		}

		/**
		 * A reference to a nullary constructor of an enumerated sort.
		 */
		public static class Constructor0 extends AbstractItem implements Formula {
			private final String name;

			private Constructor0(String name, Attribute[] attributes) {
				super(attributes);
				if (name == null) {
					throw new IllegalArgumentException();
				}
				this.name = name;
			}

			public String getName() {
				return name;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Constructor0 && ((Constructor0) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return 31 * name.hashCode();
			}

			@Override
			public String toString() {
				return "CONST(" + name + ")";
			}
		}

		/**
		 * A constructor applied to one or more operands. Nothing generates these
		 * yet, since clause heads cannot contain compound terms.
		 */
		public static class Constructor extends AbstractItem implements Formula {
			private final String name;
			private final List<Formula> operands;

			private Constructor(String name, List<Formula> operands, Attribute[] attributes) {
				super(attributes);
				if (operands.isEmpty()) {
					throw new IllegalArgumentException("constructor requires at least one operand");
				}
				this.name = name;
				this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
			}

			public String getName() {
				return name;
			}

			public List<Formula> getOperands() {
				return operands;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Constructor) {
					Constructor c = (Constructor) o;
					return name.equals(c.name) && operands.equals(c.operands);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return name.hashCode() ^ operands.hashCode();
			}
		}

		public static class Equals extends AbstractItem implements Formula {
			private final Formula lhs;
			private final Formula rhs;

			private Equals(Formula lhs, Formula rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public Formula getLeftHandSide() {
				return lhs;
			}

			public Formula getRightHandSide() {
				return rhs;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Equals) {
					Equals e = (Equals) o;
					return lhs.equals(e.lhs) && rhs.equals(e.rhs);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(lhs, rhs);
			}

			@Override
			public String toString() {
				return "EQ(" + lhs + "," + rhs + ")";
			}
		}

		public static class Implies extends AbstractItem implements Formula {
			private final Formula antecedent;
			private final Formula consequent;

			private Implies(Formula antecedent, Formula consequent, Attribute[] attributes) {
				super(attributes);
				this.antecedent = antecedent;
				this.consequent = consequent;
			}

			public Formula getAntecedent() {
				return antecedent;
			}

			public Formula getConsequent() {
				return consequent;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Implies) {
					Implies i = (Implies) o;
					return antecedent.equals(i.antecedent) && consequent.equals(i.consequent);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(antecedent, consequent, Implies.class);
			}
		}

		public static class Conjunction extends AbstractItem implements Formula {
			private final List<Formula> operands;

			private Conjunction(List<Formula> operands, Attribute[] attributes) {
				super(attributes);
				this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
			}

			public List<Formula> getOperands() {
				return operands;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Conjunction && ((Conjunction) o).operands.equals(operands);
			}

			@Override
			public int hashCode() {
				return 3 * operands.hashCode();
			}

			@Override
			public String toString() {
				return "AND" + operands;
			}
		}

		public static class Disjunction extends AbstractItem implements Formula {
			private final List<Formula> operands;

			private Disjunction(List<Formula> operands, Attribute[] attributes) {
				super(attributes);
				this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
			}

			public List<Formula> getOperands() {
				return operands;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Disjunction && ((Disjunction) o).operands.equals(operands);
			}

			@Override
			public int hashCode() {
				return 5 * operands.hashCode();
			}

			@Override
			public String toString() {
				return "OR" + operands;
			}
		}

		public static class UniversalQuantifier extends AbstractItem implements Formula {
			private final List<Decl.Parameter> parameters;
			private final Formula body;

			private UniversalQuantifier(List<Decl.Parameter> parameters, Formula body, Attribute[] attributes) {
				super(attributes);
				this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
				this.body = body;
			}

			public List<Decl.Parameter> getParameters() {
				return parameters;
			}

			public Formula getBody() {
				return body;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof UniversalQuantifier) {
					UniversalQuantifier q = (UniversalQuantifier) o;
					return parameters.equals(q.parameters) && body.equals(q.body);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(parameters, body);
			}
		}

		/**
		 * An application of a relation to its arguments, such as
		 * <code>(leq x y)</code>.
		 */
		public static class Invoke extends AbstractItem implements Formula {
			private final String name;
			private final List<Formula> arguments;

			private Invoke(String name, List<Formula> arguments, Attribute[] attributes) {
				super(attributes);
				this.name = name;
				this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
			}

			public String getName() {
				return name;
			}

			public List<Formula> getArguments() {
				return arguments;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Invoke) {
					Invoke i = (Invoke) o;
					return name.equals(i.name) && arguments.equals(i.arguments);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return name.hashCode() ^ arguments.hashCode();
			}

			@Override
			public String toString() {
				return "FNCALL(" + name + "," + arguments + ")";
			}
		}
	}

	// =========================================================================
	// Attributes
	// =========================================================================

	public interface Attribute {
		/**
		 * Get the contents of this attribute as a given kind.  If that doesn't match, then return <code>null</code>.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T as(Class<T> kind);
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	private static final Attribute[] NONE = new Attribute[0];

	public static final Formula.Boolean TRUE = new Formula.Boolean(true, NONE);
	public static final Formula.Boolean FALSE = new Formula.Boolean(false, NONE);

	public static Attribute ATTRIBUTE(Object o) {
		return new Attribute() {
			@Override
			public <T> T as(Class<T> kind) {
				if(kind.isInstance(o)) {
					return kind.cast(o);
				} else {
					return null;
				}
			}

			@Override
			public String toString() {
				return "ATTR(" + o + ")";
			}
		};
	}

	// Declarations

	public static Decl.Datatype DATATYPE(String name, List<String> variants, Attribute... attributes) {
		return new Decl.Datatype(name, variants, attributes);
	}

	public static Decl.Relation2 RELATION(String name, String sort, String var1, String var2, Formula body,
			Attribute... attributes) {
		return new Decl.Relation2(name, sort, var1, var2, body, attributes);
	}

	public static Decl.Relation3 RELATION(String name, String sort, String var1, String var2, String var3,
			Formula body, Attribute... attributes) {
		return new Decl.Relation3(name, sort, var1, var2, var3, body, attributes);
	}

	public static Decl.Axiom AXIOM(String name, Formula body, Attribute... attributes) {
		return new Decl.Axiom(name, body, attributes);
	}

	public static Decl.LineComment COMMENT(String message, Attribute... attributes) {
		return new Decl.LineComment(message, attributes);
	}

	public static Decl.Parameter PARAMETER(String name, String sort) {
		return new Decl.Parameter(name, sort);
	}

	// Formulae

	public static Formula.Boolean CONSTANT(boolean value, Attribute... attributes) {
		return new Formula.Boolean(value, attributes);
	}

	public static Formula.Variable VAR(String name, Attribute... attributes) {
		return new Formula.Variable(name, attributes);
	}

	public static Formula.Constructor0 CONSTRUCTOR(String name, Attribute... attributes) {
		return new Formula.Constructor0(name, attributes);
	}

	public static Formula.Constructor CONSTRUCTOR(String name, List<Formula> operands, Attribute... attributes) {
		return new Formula.Constructor(name, operands, attributes);
	}

	public static Formula.Equals EQ(Formula lhs, Formula rhs, Attribute... attributes) {
		return new Formula.Equals(lhs, rhs, attributes);
	}

	public static Formula.Implies IMPLIES(Formula antecedent, Formula consequent, Attribute... attributes) {
		return new Formula.Implies(antecedent, consequent, attributes);
	}

	/**
	 * Construct a conjunction of zero or more operands. Unlike a simplifying
	 * constructor, this never drops or merges operands, so the resulting
	 * conjunction has exactly the operands given.
	 *
	 * @param operands
	 * @param attributes
	 * @return
	 */
	public static Formula.Conjunction AND(List<Formula> operands, Attribute... attributes) {
		return new Formula.Conjunction(operands, attributes);
	}

	public static Formula.Conjunction AND(Formula... operands) {
		return new Formula.Conjunction(Arrays.asList(operands), NONE);
	}

	/**
	 * Construct a disjunction of zero or more operands. As for
	 * <code>AND</code>, operands are kept exactly as given (including any
	 * <code>true</code> operands).
	 *
	 * @param operands
	 * @param attributes
	 * @return
	 */
	public static Formula.Disjunction OR(List<Formula> operands, Attribute... attributes) {
		return new Formula.Disjunction(operands, attributes);
	}

	public static Formula.Disjunction OR(Formula... operands) {
		return new Formula.Disjunction(Arrays.asList(operands), NONE);
	}

	public static Formula.UniversalQuantifier FORALL(List<Decl.Parameter> parameters, Formula body,
			Attribute... attributes) {
		return new Formula.UniversalQuantifier(parameters, body, attributes);
	}

	public static Formula.Invoke INVOKE(String name, Formula... arguments) {
		return new Formula.Invoke(name, Arrays.asList(arguments), NONE);
	}

	public static Formula.Invoke INVOKE(String name, List<Formula> arguments, Attribute... attributes) {
		return new Formula.Invoke(name, arguments, attributes);
	}
}

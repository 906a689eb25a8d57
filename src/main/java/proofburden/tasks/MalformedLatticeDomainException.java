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

import proofburden.logic.Symbol;
import proofburden.logic.Type;

/**
 * Signals that the domain of a lattice is not a finite enumeration of nullary
 * constructors, meaning no datatype can be declared for it.
 */
public class MalformedLatticeDomainException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	private final Symbol.LatticeSymbol lattice;
	private final Type domain;

	public MalformedLatticeDomainException(Symbol.LatticeSymbol lattice, Type domain) {
		super("lattice " + lattice.getName() + " has malformed domain " + domain
				+ " (expected an enumeration of nullary constructors)");
		this.lattice = lattice;
		this.domain = domain;
	}

	public Symbol.LatticeSymbol getLattice() {
		return lattice;
	}

	public Type getDomain() {
		return domain;
	}
}

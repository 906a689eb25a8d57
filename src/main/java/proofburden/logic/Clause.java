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
 * A horn clause <code>head :- b1, ..., bn</code>. A clause with an empty body
 * is a <i>fact</i>, otherwise it is a <i>rule</i>.
 */
public class Clause {
	private final Predicate head;
	private final List<Predicate> body;

	public Clause(Predicate head, List<Predicate> body) {
		if (head == null || body == null) {
			throw new IllegalArgumentException("clause requires a head and body");
		}
		this.head = head;
		this.body = Collections.unmodifiableList(new ArrayList<>(body));
	}

	public Predicate getHead() {
		return head;
	}

	public List<Predicate> getBody() {
		return body;
	}

	public boolean isFact() {
		return body.isEmpty();
	}

	@Override
	public String toString() {
		if (isFact()) {
			return head + ".";
		}
		StringBuilder r = new StringBuilder(head.toString());
		r.append(" :- ");
		for (int i = 0; i != body.size(); ++i) {
			if (i != 0) {
				r.append(", ");
			}
			r.append(body.get(i));
		}
		return r.append(".").toString();
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	public static Clause FACT(Predicate head) {
		return new Clause(head, Collections.emptyList());
	}

	public static Clause RULE(Predicate head, Predicate... body) {
		return new Clause(head, Arrays.asList(body));
	}
}

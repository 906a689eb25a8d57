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
import static proofburden.core.SmtFile.COMMENT;

import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import proofburden.core.SmtFile;
import proofburden.core.SmtFile.Decl;
import proofburden.io.SmtFilePrinter;
import proofburden.logic.Lattice;
import proofburden.logic.Program;

/**
 * Generates the proof burdens for every lattice declared in a program. For
 * each lattice, in program order, this produces the datatype of its domain,
 * the definitions of its order and join, and then the axioms of a partial
 * order for its order relation. The result is independent of any solver; it
 * is up to the caller what to do with it.
 */
public class ProofBurdenTask {
	/**
	 * The program whose lattices are being checked.
	 */
	private final Program program;
	/**
	 * Destination for progress messages.
	 */
	private Logger logger = Logger.getLogger(ProofBurdenTask.class.getName());
	/**
	 * Specify whether to log timing information for each lattice.
	 */
	private boolean verbose = false;
	/**
	 * Specify whether to annotate output with explanatory comments.
	 */
	private boolean comments = false;

	public ProofBurdenTask(Program program) {
		this.program = program;
	}

	public ProofBurdenTask setVerbose(boolean flag) {
		this.verbose = flag;
		return this;
	}

	public ProofBurdenTask setComments(boolean flag) {
		this.comments = flag;
		return this;
	}

	public ProofBurdenTask setLogger(Logger logger) {
		this.logger = logger;
		return this;
	}

	/**
	 * Generate the proof burdens for all lattices.
	 *
	 * @return
	 * @throws MalformedLatticeDomainException if any lattice has a domain which
	 *                                         is not an enumeration.
	 */
	public SmtFile run() {
		long start = System.currentTimeMillis();
		SmtFile target = new SmtFile();
		DeclarationBuilder builder = new DeclarationBuilder(program);
		if (comments) {
			target.add(COMMENT("Proof Burdens"));
		}
		for (Lattice lattice : program.getLattices().values()) {
			long time = System.currentTimeMillis();
			translate(lattice, builder, target);
			if (verbose) {
				logger.info("Generated proof burdens for " + lattice.getName() + " ("
						+ (System.currentTimeMillis() - time) + "ms)");
			}
		}
		if (verbose) {
			logger.info("Generated " + target.getDeclarations().size() + " declarations for "
					+ program.getLattices().size() + " lattice(s) (" + (System.currentTimeMillis() - start) + "ms)");
		}
		return target;
	}

	private void translate(Lattice lattice, DeclarationBuilder builder, SmtFile target) {
		String sort = lattice.getName().getName();
		String leq = lattice.getLeq().getName();
		if (comments) {
			target.add(COMMENT(sort, ATTRIBUTE(lattice)));
		}
		target.add(builder.datatype(lattice.getName(), lattice.getDomain()));
		target.add(builder.relation2(lattice.getName(), lattice.getLeq()));
		target.add(builder.relation3(lattice.getName(), lattice.getJoin()));
		if (comments) {
			target.add(COMMENT(OrderAxioms.REFLEXIVITY, ATTRIBUTE(lattice)));
		}
		target.add(OrderAxioms.reflexivity(sort, leq));
		if (comments) {
			target.add(COMMENT(OrderAxioms.ANTI_SYMMETRY, ATTRIBUTE(lattice)));
		}
		target.add(OrderAxioms.antiSymmetry(sort, leq));
		if (comments) {
			target.add(COMMENT(OrderAxioms.TRANSITIVITY, ATTRIBUTE(lattice)));
		}
		target.add(OrderAxioms.transitivity(sort, leq));
	}

	/**
	 * Generate the proof burdens and render each declaration as text, in order.
	 *
	 * @return
	 */
	public List<String> render() {
		List<String> result = new ArrayList<>();
		for (Decl d : run().getDeclarations()) {
			result.add(SmtFilePrinter.toString(d));
		}
		return result;
	}

	/**
	 * Generate the proof burdens and write them to a given output stream. The
	 * stream is flushed, but not closed.
	 *
	 * @param output
	 * @return The printer used, from which the mapping of output positions back
	 *         to declarations can be obtained.
	 */
	public SmtFilePrinter write(OutputStream output) {
		SmtFilePrinter printer = new SmtFilePrinter(output);
		printer.write(run());
		return printer;
	}
}

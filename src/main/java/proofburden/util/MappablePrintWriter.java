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
package proofburden.util;

import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes UTF-8 text whilst remembering which item produced each region of it.
 * A position reported against the generated text (e.g. by a solver) can then
 * be mapped back to the item responsible. Lines always end with a single
 * <code>'\n'</code> and indentation is never attributed to any item.
 *
 * @param <T>
 */
public class MappablePrintWriter<T> {
	/**
	 * The text used for one level of indentation.
	 */
	public static final String INDENT = "    ";

	private final PrintWriter out;
	private final Mapping<T> mapping = new Mapping<>();
	/**
	 * Column at which the next character will be written.
	 */
	private int column;

	public MappablePrintWriter(OutputStream os) {
		this.out = new PrintWriter(new OutputStreamWriter(os, StandardCharsets.UTF_8));
	}

	public Mapping<T> getMapping() {
		return mapping;
	}

	public void print(String text, T tag) {
		out.print(text);
		mapping.record(tag, column, text.length());
		column += text.length();
	}

	public void println() {
		out.print('\n');
		mapping.lines.add(new ArrayList<>());
		column = 0;
	}

	public void println(String text, T tag) {
		print(text, tag);
		println();
	}

	/**
	 * Indent the current line by <code>depth</code> levels.
	 *
	 * @param depth
	 */
	public void tab(int depth) {
		for (int i = 0; i != depth; ++i) {
			out.print(INDENT);
		}
		column += depth * INDENT.length();
	}

	public void flush() {
		out.flush();
	}

	/**
	 * Records, for each output line, the items which printed it along with the
	 * columns they occupy.
	 *
	 * @param <T>
	 */
	public static class Mapping<T> {
		private final List<List<Region<T>>> lines = new ArrayList<>();

		private Mapping() {
			lines.add(new ArrayList<>());
		}

		private void record(T tag, int start, int length) {
			if (tag != null && length > 0) {
				lines.get(lines.size() - 1).add(new Region<>(tag, start, start + length));
			}
		}

		/**
		 * Get the number of lines started so far. A trailing newline starts a
		 * final, empty line.
		 *
		 * @return
		 */
		public int getLineCount() {
			return lines.size();
		}

		/**
		 * Get the item which printed the text at a given position, or <code>null</code>
		 * if nothing was printed there.
		 *
		 * @param line Line number (starting from 1)
		 * @param col  Column number (starting from 0)
		 * @return
		 */
		public T get(int line, int col) {
			if (line < 1 || line > lines.size()) {
				return null;
			}
			for (Region<T> r : lines.get(line - 1)) {
				if (r.start <= col && col < r.end) {
					return r.tag;
				}
			}
			return null;
		}
	}

	/**
	 * Columns <code>[start, end)</code> of a line printed by a given item.
	 */
	private static class Region<T> {
		private final T tag;
		private final int start;
		private final int end;

		private Region(T tag, int start, int end) {
			this.tag = tag;
			this.start = start;
			this.end = end;
		}
	}
}

package org.metricshub.yiphthachl.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Yiphthachl
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.yiphthachl.frontend.ast.ProgramAst;

/**
 * What the {@link Parser} produced: the program tree, the errors (at most
 * one, since parsing stops at the first hard failure) and the warnings.
 */
public final class ParseResult {

	private final ProgramAst program;
	private final List<ParseError> errors;
	private final List<ParseWarning> warnings;

	public ParseResult(ProgramAst program, List<ParseError> errors, List<ParseWarning> warnings) {
		this.program = program;
		this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
		this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
	}

	/**
	 * @return the program; partial when there are errors
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public ProgramAst getProgram() {
		return program;
	}

	public List<ParseError> getErrors() {
		return errors;
	}

	public List<ParseWarning> getWarnings() {
		return warnings;
	}

	/**
	 * @return whether the program tree is complete and may be used
	 */
	public boolean isSuccessful() {
		return errors.isEmpty();
	}
}

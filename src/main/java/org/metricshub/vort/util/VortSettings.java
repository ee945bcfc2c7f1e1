package org.metricshub.vort.util;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Vortlang
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 - 2026 MetricsHub
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

/**
 * A simple container for the parameters of a single Vortlang compilation.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking the compiler programmatically, from within Java code.
 */
public class VortSettings implements VortCompileSettings {

	/** Default C compiler command */
	public static final String DEFAULT_C_COMPILER = "gcc";

	/**
	 * Whether {@code newfn $c} functions are rejected;
	 * <code>false</code> by default.
	 */
	private boolean sandbox = false;

	/**
	 * Whether unused variables are reported;
	 * <code>true</code> by default.
	 */
	private boolean warningsEnabled = true;

	private boolean dumpSyntaxTree = false;

	private boolean dumpTokens = false;

	/**
	 * Whether to stop after writing the generated C file,
	 * without invoking the C compiler.
	 */
	private boolean emitCOnly = false;

	/**
	 * Whether to keep the temporary C file after a native build.
	 */
	private boolean keepCFile = false;

	/**
	 * Path of the executable to produce.
	 * <code>null</code> means the source file stem followed by <code>.exe</code>.
	 */
	private String outputPath = null;

	/**
	 * C compiler executable, <code>gcc</code> by default.
	 */
	private String cCompiler = DEFAULT_C_COMPILER;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("sandbox = ").append(isSandbox()).append(newLine);
		desc.append("warningsEnabled = ").append(isWarningsEnabled()).append(newLine);
		desc.append("emitCOnly = ").append(isEmitCOnly()).append(newLine);
		desc.append("keepCFile = ").append(isKeepCFile()).append(newLine);
		desc.append("outputPath = ").append(getOutputPath()).append(newLine);
		desc.append("cCompiler = ").append(getCCompiler()).append(newLine);

		return desc.toString();
	}

	/** {@inheritDoc} */
	@Override
	public boolean isSandbox() {
		return sandbox;
	}

	public void setSandbox(boolean sandbox) {
		this.sandbox = sandbox;
	}

	/** {@inheritDoc} */
	@Override
	public boolean isWarningsEnabled() {
		return warningsEnabled;
	}

	public void setWarningsEnabled(boolean warningsEnabled) {
		this.warningsEnabled = warningsEnabled;
	}

	/** {@inheritDoc} */
	@Override
	public boolean isDumpSyntaxTree() {
		return dumpSyntaxTree;
	}

	public void setDumpSyntaxTree(boolean dumpSyntaxTree) {
		this.dumpSyntaxTree = dumpSyntaxTree;
	}

	/** {@inheritDoc} */
	@Override
	public boolean isDumpTokens() {
		return dumpTokens;
	}

	public void setDumpTokens(boolean dumpTokens) {
		this.dumpTokens = dumpTokens;
	}

	/**
	 * Whether to stop after writing the generated C file;
	 * <code>false</code> by default.
	 *
	 * @return the emitCOnly
	 */
	public boolean isEmitCOnly() {
		return emitCOnly;
	}

	public void setEmitCOnly(boolean emitCOnly) {
		this.emitCOnly = emitCOnly;
	}

	/**
	 * Whether to keep the temporary C file after a native build;
	 * <code>false</code> by default.
	 *
	 * @return the keepCFile
	 */
	public boolean isKeepCFile() {
		return keepCFile;
	}

	public void setKeepCFile(boolean keepCFile) {
		this.keepCFile = keepCFile;
	}

	/**
	 * @return the executable path, or <code>null</code> to derive it from the source
	 */
	public String getOutputPath() {
		return outputPath;
	}

	public void setOutputPath(String outputPath) {
		this.outputPath = outputPath;
	}

	/**
	 * Returns the executable path to produce.
	 *
	 * @param sourceStem file name of the source, without extension
	 * @return the configured output path, or {@code <sourceStem>.exe}
	 */
	public String getOutputPath(String sourceStem) {
		return outputPath != null ? outputPath : sourceStem + ".exe";
	}

	public String getCCompiler() {
		return cCompiler;
	}

	public void setCCompiler(String cCompiler) {
		this.cCompiler = cCompiler;
	}
}

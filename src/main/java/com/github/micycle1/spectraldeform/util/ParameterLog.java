package com.github.micycle1.spectraldeform.util;

import java.util.Map;

import org.slf4j.Logger;

import com.github.micycle1.spectraldeform.coordinate.ComplexCoordinate;

/**
 * Writes run parameters as a framed block at info level.
 */
public final class ParameterLog {

	static final String HEADER = "----- Parameters -----";
	static final String FOOTER = "----------------------";

	private ParameterLog() {
	}

	public static void show(Logger logger, Map<String, ?> parameters) {
		logger.info(HEADER);
		parameters.forEach((name, value) -> logger.info("{} = {}", name, value));
		logger.info(FOOTER);
	}

	public static void show(Logger logger, ComplexCoordinate coordinate) {
		show(logger, coordinate.getParams());
	}
}

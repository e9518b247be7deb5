/*-
 * #%L
 * This file is part of IcebergArea.
 * %%
 * Copyright (C) 2024 IcebergArea developers
 * %%
 * IcebergArea is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * IcebergArea is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with IcebergArea.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package icebergarea.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;

/**
 * Helper class to control the logging level of the command line tool.
 */
public class LogManager {
	
	private static final Logger logger = LoggerFactory.getLogger(LogManager.class);
	
	/**
	 * Available log levels.
	 */
	public static enum LogLevel {
		/**
		 * Trace logging (an awful lot of messages)
		 */
		TRACE,
		/**
		 * Debug logging (a lot of messages)
		 */
		DEBUG,
		/**
		 * Info logging (default)
		 */
		INFO,
		/**
		 * Warn logging (only if something is moderately important)
		 */
		WARN,
		/**
		 * Error logging (only if something goes recognizably wrong)
		 */
		ERROR,
		/**
		 * All log messages
		 */
		ALL,
		/**
		 * Turn off logging
		 */
		OFF;
	}
	
	private LogManager() {
		throw new AssertionError();
	}
	
	/**
	 * Set the root log level.
	 * @param level
	 */
	public static void setRootLogLevel(LogLevel level) {
		var root = getRootLogger();
		if (root != null)
			root.setLevel(getLevel(level));
		else
			logger.warn("Cannot get root logger!");
	}
	
	/**
	 * Get the current root log level.
	 * @return the level, or null if logback is not being used
	 */
	public static LogLevel getRootLogLevel() {
		var root = getRootLogger();
		if (root == null || root.getLevel() == null)
			return null;
		return LogLevel.valueOf(root.getLevel().toString());
	}
	
	static Level getLevel(LogLevel level) {
		switch (level) {
		case ALL:
			return Level.ALL;
		case DEBUG:
			return Level.DEBUG;
		case ERROR:
			return Level.ERROR;
		case INFO:
			return Level.INFO;
		case OFF:
			return Level.OFF;
		case TRACE:
			return Level.TRACE;
		case WARN:
			return Level.WARN;
		default:
			throw new IllegalArgumentException("Unknown log level " + level);
		}
	}
	
	private static ch.qos.logback.classic.Logger getRootLogger() {
		if (LoggerFactory.getILoggerFactory() instanceof LoggerContext)
			return ((LoggerContext)LoggerFactory.getILoggerFactory()).getLogger(Logger.ROOT_LOGGER_NAME);
		return null;
	}

}

/*-
 * #%L
 * This file is part of PixEdit.
 * %%
 * Copyright (C) 2025 PixEdit developers
 * %%
 * PixEdit is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * PixEdit is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with PixEdit.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package pixedit.lib.app.logging;

import java.io.File;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;

/**
 * Manage logging levels.
 * <p>
 * This requires logback; if another SLF4J binding is used, requests are logged and otherwise ignored.
 * 
 * @author PixEdit developers
 */
public class LogManager {
	
	private final static Logger logger = LoggerFactory.getLogger(LogManager.class);
	
	/**
	 * Pattern used when logging to a file.
	 */
	public static final String LOG_PATTERN = "%d{HH:mm:ss.SSS} [%thread] [%-5level] %logger{36} - %msg%n";
	
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
	
	private static LogLevel logLevel = LogLevel.INFO;
	
	// Suppress default constructor for non-instantiability
	private LogManager() {
		throw new AssertionError();
	}
	
	static Level getLevel(LogLevel logLevel) {
		return switch (logLevel) {
			case TRACE -> Level.TRACE;
			case DEBUG -> Level.DEBUG;
			case INFO -> Level.INFO;
			case WARN -> Level.WARN;
			case ERROR -> Level.ERROR;
			case ALL -> Level.ALL;
			case OFF -> Level.OFF;
		};
	}
	
	static LoggerContext getLoggerContext() {
		if (LoggerFactory.getILoggerFactory() instanceof LoggerContext)
			return (LoggerContext)LoggerFactory.getILoggerFactory();
		return null;
	}
	
	static ch.qos.logback.classic.Logger getRootLogger() {
		var context = getLoggerContext();
		return context == null ? null : context.getLogger(Logger.ROOT_LOGGER_NAME);
	}
	
	/**
	 * Set the root log level.
	 * @param level
	 */
	public static synchronized void setRootLogLevel(LogLevel level) {
		if (level == null)
			return;
		logLevel = level;
		var root = getRootLogger();
		if (root != null)
			root.setLevel(getLevel(level));
		else
			logger.warn("Cannot get root logger!");
	}
	
	/**
	 * Get the root log level, as set by this manager.
	 * This is not guaranteed to match the actual root log level, in case it has been set elsewhere.
	 * @return 
	 */
	public static synchronized LogLevel getRootLogLevel() {
		return logLevel;
	}
	
	/**
	 * Send logging messages to the specified file, in addition to any existing appenders.
	 * @param file
	 */
	public static void logToFile(File file) {
		var context = getLoggerContext();
		if (context == null) {
			logger.warn("Cannot log to file without logback!");
			return;
		}
		var encoder = new PatternLayoutEncoder();
		encoder.setContext(context);
		encoder.setPattern(LOG_PATTERN);
		encoder.start();
		
		var appender = new FileAppender<ILoggingEvent>();
		appender.setFile(file.getAbsolutePath());
		appender.setContext(context);
		appender.setEncoder(encoder);
		appender.setName(file.getName());
		appender.start();
		context.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(appender);
		logger.debug("Logging to {}", file);
	}

}

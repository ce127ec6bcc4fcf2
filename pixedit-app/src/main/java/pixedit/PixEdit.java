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

package pixedit;

import java.io.File;
import java.util.ArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;
import pixedit.lib.app.logging.LogManager;
import pixedit.lib.app.logging.LogManager.LogLevel;
import pixedit.lib.processing.ChannelMode;
import pixedit.lib.processing.MorphOperation;

/**
 * Main PixEdit launcher.
 * 
 * @author PixEdit developers
 */
@Command(name = "pixedit", 
	subcommands = {HelpCommand.class, InfoCommand.class, HistogramCommand.class, ApplyCommand.class, PresetsCommand.class},
	footer = {"", "Copyright(c) PixEdit developers (2025)"}, 
	mixinStandardHelpOptions = true, versionProvider = PixEdit.VersionProvider.class)
public class PixEdit {
	
	private final static Logger logger = LoggerFactory.getLogger(PixEdit.class);
	
	@Option(names = {"-l", "--log"}, description = {"Log level (default = INFO).", "Options: ${COMPLETION-CANDIDATES}"} )
	private LogLevel logLevel = LogLevel.INFO;
	
	@Option(names = {"--log-file"}, description = "Write log messages to the specified file.", paramLabel = "file")
	private File logFile;
	
	/**
	 * Main method to launch PixEdit.
	 * 
	 * @param args
	 */
	public static void main(String[] args) {
		PixEdit pixedit = new PixEdit();
		CommandLine cmd = createCommandLine(pixedit);
		
		ParseResult pr;
		try {
			pr = cmd.parseArgs(args);
		} catch (Exception e) {
			logger.error("An error has occurred, please type -h to display help message.\n" + e.getLocalizedMessage());
			System.exit(2);
			return;
		}
		
		// Catch -h/--help and -V/--version
		if (cmd.isUsageHelpRequested()) {
			cmd.usage(System.out);
			return;
		} else if (cmd.isVersionHelpRequested()) {
			cmd.printVersionHelp(System.out);
			return;
		}
		
		if (pixedit.logLevel != null)
			LogManager.setRootLogLevel(pixedit.logLevel);
		if (pixedit.logFile != null)
			LogManager.logToFile(pixedit.logFile);
		
		if (!pr.hasSubcommand()) {
			cmd.usage(System.out);
			return;
		}
		
		int exitCode = cmd.execute(args);
		if (exitCode != 0)
			logger.warn("Calling System.exit with exit code {}", exitCode);
		System.exit(exitCode);
	}
	
	/**
	 * Create a command line for the launcher, with converters registered for PixEdit types.
	 * @param pixedit
	 * @return
	 */
	static CommandLine createCommandLine(PixEdit pixedit) {
		CommandLine cmd = new CommandLine(pixedit);
		cmd.setCaseInsensitiveEnumValuesAllowed(true);
		cmd.setExpandAtFiles(false);
		cmd.registerConverter(ChannelMode.class, ChannelMode::fromString);
		cmd.registerConverter(MorphOperation.class, MorphOperation::fromString);
		cmd.setExitCodeExceptionMapper(t -> 1);
		return cmd;
	}
	
	static class VersionProvider implements IVersionProvider {

		@Override
		public String[] getVersion() throws Exception {
			var version = PixEdit.class.getPackage().getImplementationVersion();
			var strings = new ArrayList<String>();
			if (version != null) {
				if (!version.startsWith("v"))
					version = "v" + version;
				strings.add("PixEdit " + version);
			}
			strings.add("Java " + System.getProperty("java.version"));
			if (version == null)
				return new String[] {"Unknown PixEdit version!"};
			return strings.toArray(String[]::new);
		}
		
	}

}

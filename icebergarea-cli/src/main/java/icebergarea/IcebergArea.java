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

package icebergarea;

import java.util.ArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Main class for the command line tool.
 */
@Command(name = "icebergarea", subcommands = {HelpCommand.class, DetectCommand.class},
	description = "Estimate iceberg areas from SAR backscatter.",
	mixinStandardHelpOptions = true, versionProvider = IcebergArea.VersionProvider.class)
public class IcebergArea implements Runnable {
	
	private static final Logger logger = LoggerFactory.getLogger(IcebergArea.class);
	
	@Spec
	private CommandSpec spec;
	
	/**
	 * Launch the command line tool.
	 * @param args
	 */
	public static void main(String[] args) {
		int exitCode = execute(args);
		if (exitCode != 0)
			logger.warn("Calling System.exit with exit code {}", exitCode);
		System.exit(exitCode);
	}
	
	/**
	 * Run a command without exiting the JVM.
	 * @param args
	 * @return the exit code
	 */
	public static int execute(String... args) {
		var cmd = createCommandLine();
		return cmd.execute(args);
	}
	
	static CommandLine createCommandLine() {
		var cmd = new CommandLine(new IcebergArea());
		cmd.setCaseInsensitiveEnumValuesAllowed(true);
		cmd.setExpandAtFiles(false);
		cmd.setExecutionExceptionHandler((e, commandLine, parseResult) -> {
			logger.error(e.getLocalizedMessage(), e);
			return 1;
		});
		return cmd;
	}
	
	@Override
	public void run() {
		// Without a subcommand there is nothing to do
		spec.commandLine().usage(spec.commandLine().getOut());
	}
	
	
	static class VersionProvider implements IVersionProvider {

		@Override
		public String[] getVersion() throws Exception {
			var version = IcebergArea.class.getPackage().getImplementationVersion();
			var strings = new ArrayList<String>();
			if (version != null) {
				if (!version.startsWith("v"))
					version = "v" + version;
				strings.add("IcebergArea " + version);
			}
			strings.add("Java " + System.getProperty("java.version"));
			if (version == null)
				strings.add(0, "Unknown IcebergArea version!");
			return strings.toArray(String[]::new);
		}
		
	}
	
}

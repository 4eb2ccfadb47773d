package com.ikats;

import java.io.File;
import java.util.concurrent.Callable;

import org.slf4j.LoggerFactory;

import com.ikats.command.ImportCommand;
import com.ikats.command.InheritCommand;
import com.ikats.command.LookupCommand;
import com.ikats.command.MetadataCommand;
import com.ikats.command.ResolveCommand;
import com.ikats.config.IkatsConfiguration;
import com.ikats.config.IkatsSession;
import com.ikats.exception.IkatsException;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "ikats",
		mixinStandardHelpOptions = true,
		description = "Command line access to the IKATS timeseries, metadata and functional identifiers",
		subcommands = {
			ResolveCommand.class,
			LookupCommand.class,
			ImportCommand.class,
			MetadataCommand.class,
			InheritCommand.class
		})
public class IkatsApiApp implements Callable<Integer> {

	@Option(names = {"-c", "--config"}, description = "Configuration properties file",
			defaultValue = IkatsConfiguration.IKATS_PROPERTIES_FILE)
	private File configFile;

	@Option(names = {"-v", "--verbose"}, description = "Debug logging")
	private boolean verbose;

	@Option(names = {"--emulate"}, description = "Use in-memory backends instead of the configured ones")
	private boolean emulate;

	private IkatsApi api;

	public IkatsApiApp() {
	}

	/**
	 * Runs the commands against an existing API instead of the configured one.
	 */
	public IkatsApiApp(IkatsApi api) {
		this.api = api;
	}

	@Override
	public Integer call() throws Exception {
		CommandLine commandLine = new CommandLine(this);
		String subcommands = String.join(", ", commandLine.getSubcommands().keySet());
		System.out.println("Please specify a sub-command: " + subcommands);
		System.out.println("Use --help to see available options");
		return CommandLine.ExitCode.USAGE;
	}

	public IkatsApi getApi() {
		if (api == null) {
			LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
			loggerContext.getLogger("com.ikats").setLevel(verbose ? Level.DEBUG : Level.INFO);

			IkatsSession session = IkatsConfiguration.createSession(configFile);
			if (emulate) {
				session.setEmulate(true);
			}
			api = new IkatsApi(session);
		}
		return api;
	}

	/**
	 * IKATS errors exit with 1 and invalid arguments with 2, both reported by their message only.
	 */
	public static CommandLine commandLine(IkatsApiApp app) {
		CommandLine cmd = new CommandLine(app);
		cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
			if (ex instanceof IkatsException) {
				commandLine.getErr().println(ex.getClass().getSimpleName() + ": " + ex.getMessage());
				return CommandLine.ExitCode.SOFTWARE;
			}
			if (ex instanceof IllegalArgumentException) {
				commandLine.getErr().println(ex.getMessage());
				return CommandLine.ExitCode.USAGE;
			}
			throw ex;
		});
		return cmd;
	}

	public static void main(String[] args) {
		IkatsApiApp app = new IkatsApiApp();
		int exitCode = commandLine(app).execute(args);
		if (app.api != null) {
			app.api.close();
		}
		System.exit(exitCode);
	}
}

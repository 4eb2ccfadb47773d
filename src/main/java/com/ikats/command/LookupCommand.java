package com.ikats.command;

import java.util.concurrent.Callable;

import com.ikats.IkatsApiApp;

import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(name = "lookup", description = "Print the TSUID of a functional identifier, or the reverse")
public class LookupCommand implements Callable<Integer> {

	@ParentCommand
	private IkatsApiApp parent;

	@Spec
	private CommandSpec spec;

	@ArgGroup(exclusive = true, multiplicity = "1")
	private Identifier identifier;

	static class Identifier {

		@Option(names = {"--fid"}, required = true, description = "Functional identifier")
		String fid;

		@Option(names = {"--tsuid"}, required = true, description = "TSUID")
		String tsuid;
	}

	@Override
	public Integer call() throws Exception {
		String result;
		if (identifier.fid != null) {
			result = parent.getApi().ts().fidToTsuid(identifier.fid, true);
		} else {
			result = parent.getApi().ts().tsuidToFid(identifier.tsuid, true);
		}
		spec.commandLine().getOut().println(result);
		return 0;
	}
}

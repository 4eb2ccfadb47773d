package com.ikats.command;

import java.util.concurrent.Callable;

import com.ikats.IkatsApiApp;
import com.ikats.timeseries.Timeseries;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(name = "inherit", description = "Copy the non intrinsic metadata of a parent timeseries to a child")
public class InheritCommand implements Callable<Integer> {

	@ParentCommand
	private IkatsApiApp parent;

	@Spec
	private CommandSpec spec;

	@Parameters(index = "0", description = "TSUID of the child")
	private String childTsuid;

	@Parameters(index = "1", description = "TSUID of the parent")
	private String parentTsuid;

	@Override
	public Integer call() throws Exception {
		int copied = parent.getApi().ts().inherit(new Timeseries(childTsuid, null), new Timeseries(parentTsuid, null));
		spec.commandLine().getOut().println(copied + " metadata inherited");
		return 0;
	}
}

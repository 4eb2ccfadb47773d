package com.ikats.command;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;

import com.ikats.IkatsApiApp;
import com.ikats.model.MetadataEntry;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(name = "metadata", description = "Print the metadata of a timeseries")
public class MetadataCommand implements Callable<Integer> {

	@ParentCommand
	private IkatsApiApp parent;

	@Spec
	private CommandSpec spec;

	@Parameters(index = "0", description = "TSUID")
	private String tsuid;

	@Override
	public Integer call() throws Exception {
		Map<String, MetadataEntry> metadata = new TreeMap<>(parent.getApi().md().fetch(tsuid));
		for (MetadataEntry entry : metadata.values()) {
			spec.commandLine().getOut().printf("%s=%s (%s)%n", entry.getName(), entry.getValue(),
					entry.getType().getValue());
		}
		return 0;
	}
}

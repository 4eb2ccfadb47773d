package com.ikats.command;

import java.util.Map;
import java.util.concurrent.Callable;

import com.ikats.IkatsApiApp;
import com.ikats.model.ResolvedTsuid;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(name = "resolve", description = "Create the TSUID of a new functional identifier")
public class ResolveCommand implements Callable<Integer> {

	@ParentCommand
	private IkatsApiApp parent;

	@Spec
	private CommandSpec spec;

	@Parameters(index = "0", description = "Functional identifier")
	private String fid;

	@Option(names = {"--metric"}, description = "OpenTSDB metric, the import time by default")
	private String metric;

	@Option(names = {"--tag"}, description = "OpenTSDB tag, format: <key>=<value>")
	private Map<String, String> tags;

	@Option(names = {"--details"}, description = "Also print the metric and tags")
	private boolean details;

	@Override
	public Integer call() throws Exception {
		ResolvedTsuid resolved = parent.getApi().ts().createReference(fid, metric, tags);
		spec.commandLine().getOut().println(resolved.getTsuid());
		if (details) {
			spec.commandLine().getOut().println("metric: " + resolved.getMetricTags().getMetric());
			resolved.getMetricTags().getTags()
					.forEach((k, v) -> spec.commandLine().getOut().println("tag: " + k + "=" + v));
		}
		return 0;
	}
}

package com.ikats.command;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.apache.commons.lang3.math.NumberUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ikats.IkatsApiApp;
import com.ikats.manager.TimeseriesManager;
import com.ikats.model.DataPoint;
import com.ikats.timeseries.Timeseries;
import com.opencsv.CSVParser;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(name = "import", description = "Import the points of a CSV file (timestamp,value) into a timeseries")
public class ImportCommand implements Callable<Integer> {

	private static Logger logger = LoggerFactory.getLogger(ImportCommand.class);

	@ParentCommand
	private IkatsApiApp parent;

	@Spec
	private CommandSpec spec;

	@Parameters(index = "0", description = "Functional identifier, created when unknown")
	private String fid;

	@Parameters(index = "1", description = "CSV file, timestamps in milliseconds in ascending order")
	private File csvFile;

	@Option(names = {"--parent"}, description = "TSUID of the timeseries the metadata are inherited from")
	private String parentTsuid;

	@Option(names = {"--no-metadata"}, description = "Don't update the dates and point count of an existing timeseries")
	private boolean noMetadata;

	@Override
	public Integer call() throws Exception {
		List<DataPoint> points = readPoints(csvFile);
		logger.debug("{} points read from {}", points.size(), csvFile);

		TimeseriesManager manager = parent.getApi().ts();
		Timeseries ts = manager.newTimeseries(null, points);
		ts.setFid(fid);
		ts.setTsuid(manager.fidToTsuid(fid, false));
		Timeseries parentTs = parentTsuid == null ? null : new Timeseries(parentTsuid, null);

		manager.save(ts, parentTs, !noMetadata, true);
		spec.commandLine().getOut().println(ts.getTsuid() + " " + points.size() + " points");
		return 0;
	}

	/**
	 * A first line that does not start with a number is a header.
	 */
	static List<DataPoint> readPoints(File file) throws IOException {
		List<DataPoint> points = new ArrayList<>();
		try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
			CSVParser parser = new CSVParserBuilder().withSeparator(',').build();
			CSVReader csvReader = new CSVReaderBuilder(reader).withSkipLines(0).withCSVParser(parser).build();

			String[] line;
			int lineNumber = 0;
			while ((line = csvReader.readNext()) != null) {
				lineNumber++;
				if (line.length == 1 && line[0].isBlank()) {
					continue;
				}
				if (lineNumber == 1 && !NumberUtils.isCreatable(line[0].trim())) {
					continue;
				}
				if (line.length < 2) {
					throw new IllegalArgumentException(String.format("%s:%d: expected timestamp,value", file, lineNumber));
				}
				try {
					points.add(new DataPoint(Long.parseLong(line[0].trim()), Double.parseDouble(line[1].trim())));
				} catch (NumberFormatException e) {
					throw new IllegalArgumentException(String.format("%s:%d: %s", file, lineNumber, e.getMessage()), e);
				}
			}
		} catch (CsvValidationException e) {
			throw new IOException("Malformed CSV file " + file, e);
		}
		return points;
	}
}

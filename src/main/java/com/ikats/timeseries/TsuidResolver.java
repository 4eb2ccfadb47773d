package com.ikats.timeseries;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ikats.exception.IkatsConflictException;
import com.ikats.model.MetricTags;
import com.ikats.model.ResolvedTsuid;
import com.ikats.opentsdb.model.UidAssignment;
import com.ikats.store.FidRegistry;
import com.ikats.store.UidAssigner;
import com.ikats.util.IkatsChecks;

/**
 * Creates the TSUID of a new FID and registers the association.
 * <p>
 * Not safe against concurrent creation of the same FID: both callers may find no TSUID, one of them
 * then gets a conflict on registration. Nothing is retried, the caller re-resolves. A failure
 * between uid assignment and registration leaves an unregistered TSUID behind.
 */
public class TsuidResolver {

	private static Logger logger = LoggerFactory.getLogger(TsuidResolver.class);

	private final FidRegistry registry;
	private final UidAssigner uidAssigner;
	private final MetricTagsGenerator generator;

	public TsuidResolver(FidRegistry registry, UidAssigner uidAssigner, MetricTagsGenerator generator) {
		this.registry = registry;
		this.uidAssigner = uidAssigner;
		this.generator = generator;
	}

	/**
	 * @throws IkatsConflictException when the FID already has a TSUID
	 */
	public String resolveOrCreate(String fid) throws IOException {
		return resolveOrCreate(fid, null, null).getTsuid();
	}

	/**
	 * @param metric null for the default one
	 * @param tags null for the default ones
	 */
	public ResolvedTsuid resolveOrCreate(String fid, String metric, Map<String, String> tags) throws IOException {
		IkatsChecks.checkFid(fid);

		Optional<String> existing = registry.findTsuid(fid);
		if (existing.isPresent()) {
			throw new IkatsConflictException(
					String.format("%s already associated to an existing tsuid: %s", fid, existing.get()));
		}

		MetricTags metricTags = generator.generate(metric, tags);
		UidAssignment assignment = uidAssigner.assignUids(metricTags.getMetric(), metricTags.getTags());
		String tsuid = TsuidAssembler.assemble(assignment, metricTags);

		registry.registerFid(tsuid, fid);
		logger.debug("Created TSUID {} for {} ({})", tsuid, fid, metricTags);
		return new ResolvedTsuid(fid, tsuid, metricTags);
	}
}

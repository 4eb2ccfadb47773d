package com.ikats.store.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.ikats.exception.IkatsConflictException;
import com.ikats.exception.IkatsNotFoundException;
import com.ikats.model.DataPoint;
import com.ikats.model.MetadataType;
import com.ikats.model.MetricTags;
import com.ikats.opentsdb.model.UidAssignment;
import com.ikats.timeseries.TsuidAssembler;

class InMemoryStoresTest {

	private InMemoryFidRegistry registry;
	private InMemoryMetadataStore metadata;
	private InMemoryTimeseriesStore points;
	private InMemoryDatasetStore datasets;

	@BeforeEach
	void setUp() {
		registry = new InMemoryFidRegistry();
		metadata = new InMemoryMetadataStore();
		points = new InMemoryTimeseriesStore();
		datasets = new InMemoryDatasetStore(registry);
		registry.addRemovalListener(metadata::removeAll);
		registry.addRemovalListener(points::removeAll);
	}

	private String newTimeseries(String fid, String metric) {
		Map<String, String> tags = Map.of("flight", "12");
		String tsuid = TsuidAssembler.assemble(points.assignUids(metric, tags), metric, tags);
		registry.registerFid(tsuid, fid);
		return tsuid;
	}

	@Test
	@DisplayName("UIDs are sequential per type and reused for known names")
	void testAssignUids() {
		UidAssignment first = points.assignUids("m1", Map.of("flight", "12"));
		assertEquals("000001", first.metricUid("m1"));
		assertEquals("000001", first.tagKeyUid("flight"));
		assertEquals("000001", first.tagValueUid("12"));

		UidAssignment second = points.assignUids("m2", Map.of("flight", "13"));
		assertEquals("000002", second.metricUid("m2"));
		assertEquals("000001", second.tagKeyUid("flight"));
		assertTrue(second.toString().contains("tagk_errors"));

		assertEquals(new MetricTags("m2", Map.of("flight", "13")), points.metricTagsOf("000002000001000002"));
		assertThrows(IkatsNotFoundException.class, () -> points.metricTagsOf("000009000001000002"));
	}

	@Test
	void testPoints() {
		String tsuid = newTimeseries("FID_1", "m1");
		points.writePoints(tsuid, Arrays.asList(new DataPoint(3000, 3), new DataPoint(1000, 1)));
		points.writePoints(tsuid, List.of(new DataPoint(2000, 2)));

		assertEquals(3, points.countPoints(tsuid));
		assertEquals(Arrays.asList(new DataPoint(1000, 1), new DataPoint(2000, 2)),
				points.fetchPoints(tsuid, 1000, 2000L));
		assertThrows(IllegalArgumentException.class, () -> points.fetchPoints(tsuid, 2000, 1000L));
		assertThrows(IkatsNotFoundException.class, () -> points.countPoints("000009000009000009"));
	}

	@Test
	void testRegistry() {
		String tsuid = newTimeseries("FID_1", "m1");
		assertEquals(tsuid, registry.findTsuid("FID_1").get());
		assertThrows(IkatsConflictException.class, () -> registry.registerFid(tsuid, "FID_2"));
		assertThrows(IkatsConflictException.class, () -> registry.registerFid("000009000009000009", "FID_1"));
		assertEquals(1, registry.listTimeseries().size());

		assertTrue(registry.deleteFid(tsuid, true));
		assertFalse(registry.findTsuid("FID_1").isPresent());
		assertFalse(registry.deleteFid(tsuid, false));
	}

	@Test
	@DisplayName("Deleting a timeseries drops its points and metadata")
	void testDeleteTimeseries() {
		String tsuid = newTimeseries("FID_1", "m1");
		points.writePoints(tsuid, List.of(new DataPoint(1000, 1)));
		metadata.createMetadata(tsuid, "unit", "m", MetadataType.STRING, false);
		List<String> removed = new ArrayList<>();
		registry.addRemovalListener(removed::add);

		assertTrue(registry.deleteTimeseries(tsuid, true));
		assertEquals(List.of(tsuid), removed);
		assertTrue(metadata.getMetadata(List.of(tsuid)).get(tsuid).isEmpty());
		assertThrows(IkatsNotFoundException.class, () -> points.countPoints(tsuid));
		assertThrows(IkatsNotFoundException.class, () -> registry.deleteTimeseries(tsuid, true));
		assertFalse(registry.deleteTimeseries(tsuid, false));
	}

	@Test
	void testMetadata() {
		metadata.createMetadata("AAA", "unit", "m", MetadataType.STRING, false);
		metadata.createMetadata("BBB", "unit", "km", MetadataType.STRING, false);
		metadata.createMetadata("BBB", "flight", "12", MetadataType.NUMBER, false);

		assertThrows(IkatsConflictException.class,
				() -> metadata.createMetadata("AAA", "unit", "km", MetadataType.STRING, false));
		assertThrows(IkatsNotFoundException.class,
				() -> metadata.updateMetadata("AAA", "flight", "1", MetadataType.NUMBER, false));

		assertEquals(List.of("AAA", "BBB"), metadata.findFromMetadata(Map.of("unit", List.of("m", "km"))));
		assertEquals(List.of("BBB"), metadata.findFromMetadata(Map.of("unit", List.of("km"), "flight", List.of("12"))));

		assertTrue(metadata.deleteMetadata("AAA", "unit", true));
		assertFalse(metadata.deleteMetadata("AAA", "unit", false));
	}

	@Test
	@DisplayName("A deep dataset deletion keeps the timeseries shared with another dataset")
	void testDeepDatasetDeletion() throws Exception {
		String shared = newTimeseries("FID_1", "m1");
		String own = newTimeseries("FID_2", "m2");
		datasets.createDataset("DS_1", "first", Arrays.asList(shared, own));
		datasets.createDataset("DS_2", null, List.of(shared));

		assertEquals("FID_2", datasets.readDataset("DS_1").getFids().get(1).getFuncId());
		assertThrows(IkatsConflictException.class, () -> datasets.createDataset("DS_1", null, List.of(own)));

		assertTrue(datasets.deleteDataset("DS_1", true, true));
		assertTrue(registry.findTsuid("FID_1").isPresent());
		assertFalse(registry.findTsuid("FID_2").isPresent());
		assertEquals(1, datasets.listDatasets().size());

		assertThrows(IkatsNotFoundException.class, () -> datasets.readDataset("DS_1"));
		assertFalse(datasets.deleteDataset("DS_1", false, false));
	}
}

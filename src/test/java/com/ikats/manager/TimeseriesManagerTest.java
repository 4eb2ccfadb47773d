package com.ikats.manager;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.ikats.IkatsApi;
import com.ikats.TickingClock;
import com.ikats.config.IkatsSession;
import com.ikats.exception.IkatsConflictException;
import com.ikats.exception.IkatsNotFoundException;
import com.ikats.model.DataPoint;
import com.ikats.model.MetadataEntry;
import com.ikats.model.MetadataType;
import com.ikats.model.ResolvedTsuid;
import com.ikats.timeseries.MetricTagsGenerator;
import com.ikats.timeseries.Timeseries;

class TimeseriesManagerTest {

	private static final List<DataPoint> POINTS = Arrays.asList(new DataPoint(1000, 1.0), new DataPoint(2000, 2.0),
			new DataPoint(3000, 3.0));

	private IkatsApi api;
	private TimeseriesManager manager;

	@BeforeEach
	void setUp() {
		IkatsSession session = new IkatsSession();
		session.setEmulate(true);
		api = new IkatsApi(session, new TickingClock(Instant.parse("2016-11-05T14:05:35Z")));
		manager = api.ts();
	}

	@AfterEach
	void tearDown() {
		api.close();
	}

	@Test
	@DisplayName("Saved points come back with the generated metadata")
	void testSaveAndFetch() throws Exception {
		Timeseries ts = manager.newTimeseries("FID_1", POINTS);
		assertNotNull(ts.getTsuid());
		assertTrue(manager.save(ts, null, true, true));

		assertEquals("1000", ts.getMetadata(MetadataEntry.START_DATE).getValue());
		assertEquals("3000", ts.getMetadata(MetadataEntry.END_DATE).getValue());
		assertEquals("3", ts.getMetadata(MetadataEntry.NB_POINTS).getValue());
		assertEquals(3, manager.countPoints(ts));

		Timeseries loaded = manager.get("FID_1", null);
		assertEquals(ts.getTsuid(), loaded.getTsuid());
		assertEquals(POINTS, manager.fetch(loaded, null, null));
		assertEquals(POINTS.subList(1, 2), manager.fetch(loaded, 1500L, 2500L));
	}

	@Test
	@DisplayName("Saving without TSUID creates it and forces the metadata")
	void testSaveWithoutTsuid() throws Exception {
		Timeseries ts = manager.newTimeseries(null, POINTS);
		assertNull(ts.getTsuid());
		ts.setFid("FID_2");

		assertTrue(manager.save(ts, null, false, true));
		assertEquals(ts.getTsuid(), manager.fidToTsuid("FID_2", true));
		assertNotNull(ts.getMetadata(MetadataEntry.NB_POINTS));
	}

	@Test
	void testSaveAgainKnownFid() throws Exception {
		manager.newTimeseries("FID_1", POINTS);
		Timeseries duplicate = manager.newTimeseries(null, POINTS);
		duplicate.setFid("FID_1");

		assertFalse(manager.save(duplicate, null, true, false));
		assertThrows(IkatsConflictException.class, () -> manager.save(duplicate, null, true, true));
		assertThrows(IllegalArgumentException.class, () -> manager.save(new Timeseries(), null, true, true));
	}

	@Test
	@DisplayName("A new timeseries without points is rejected before its TSUID is created")
	void testSaveNoPoints() throws Exception {
		Timeseries empty = manager.newTimeseries(null, Collections.emptyList());
		empty.setFid("FID_EMPTY");

		assertThrows(IllegalArgumentException.class, () -> manager.save(empty, null, true, false));
		assertNull(empty.getTsuid());
		assertNull(manager.fidToTsuid("FID_EMPTY", false));

		empty.setData(POINTS);
		assertTrue(manager.save(empty, null, true, true));
		assertEquals(empty.getTsuid(), manager.fidToTsuid("FID_EMPTY", true));
	}

	@Test
	@DisplayName("A second import widens the range without generation on the caller side")
	void testChunkedImport() throws Exception {
		Timeseries ts = manager.newTimeseries("FID_1", POINTS);
		manager.save(ts, null, true, true);

		ts.setData(List.of(new DataPoint(500, 0.5)));
		manager.save(ts, null, true, true);
		Map<String, MetadataEntry> metadata = api.md().fetch(ts.getTsuid());
		assertEquals("500", metadata.get(MetadataEntry.START_DATE).getValue());
		assertEquals("3000", metadata.get(MetadataEntry.END_DATE).getValue());
		assertEquals("1", metadata.get(MetadataEntry.NB_POINTS).getValue());
		assertEquals(4, manager.countPoints(ts));
	}

	@Test
	void testInheritance() throws Exception {
		Timeseries parent = manager.newTimeseries("FID_PARENT", POINTS);
		manager.save(parent, null, true, true);
		api.md().save(parent.getTsuid(), "unit", "m", MetadataType.STRING, true);

		Timeseries child = manager.newTimeseries("FID_CHILD", POINTS);
		manager.save(child, parent, true, true);
		assertEquals("m", child.getMetadata("unit").getValue());
		assertEquals("3", child.getMetadata(MetadataEntry.NB_POINTS).getValue());

		Timeseries other = manager.newTimeseries("FID_OTHER", POINTS);
		manager.save(other, null, true, true);
		assertEquals(1, manager.inherit(other, parent));
	}

	@Test
	@DisplayName("References created by several jobs get distinct TSUIDs")
	void testCreateReference() throws Exception {
		Timeseries first = manager.createReference("FID_1");
		Timeseries second = manager.createReference("FID_2");
		assertNotEquals(first.getTsuid(), second.getTsuid());
		assertThrows(IkatsConflictException.class, () -> manager.createReference("FID_1"));

		ResolvedTsuid custom = manager.createReference("FID_3", "my.metric", Map.of(
				MetricTagsGenerator.IMPORT_YEAR, "2016"));
		assertEquals("my.metric", custom.getMetricTags().getMetric());
		assertEquals(custom.getTsuid(), manager.fidToTsuid("FID_3", true));
	}

	@Test
	void testGet() throws Exception {
		Timeseries ts = manager.newTimeseries("FID_1", POINTS);
		assertEquals("FID_1", manager.get(null, ts.getTsuid()).getFid());
		assertThrows(IllegalArgumentException.class, () -> manager.get(null, null));
		assertThrows(IllegalArgumentException.class, () -> manager.get("FID_1", ts.getTsuid()));
		assertThrows(IkatsNotFoundException.class, () -> manager.get("FID_UNKNOWN", null));
	}

	@Test
	void testFetchWithoutDates() throws Exception {
		Timeseries ts = manager.createReference("FID_1");
		assertThrows(IllegalArgumentException.class, () -> manager.fetch(ts, null, null));
	}

	@Test
	@DisplayName("Deleted timeseries leave nothing behind")
	void testDelete() throws Exception {
		Timeseries ts = manager.newTimeseries("FID_1", POINTS);
		manager.save(ts, null, true, true);
		String tsuid = ts.getTsuid();

		assertTrue(manager.delete(new Timeseries(null, "FID_1"), true));
		assertNull(manager.fidToTsuid("FID_1", false));
		assertNull(manager.tsuidToFid(tsuid, false));
		assertTrue(api.md().fetch(tsuid).isEmpty());
		assertFalse(manager.delete(tsuid, false));
		assertThrows(IkatsNotFoundException.class, () -> manager.delete(tsuid, true));
		assertFalse(manager.delete(new Timeseries(null, "FID_1"), false));
		assertThrows(IllegalArgumentException.class, () -> manager.delete(new Timeseries(), true));
	}

	@Test
	void testListAndFind() throws Exception {
		Timeseries ts1 = manager.newTimeseries("FID_1", POINTS);
		Timeseries ts2 = manager.newTimeseries("FID_2", POINTS);
		api.md().save(ts1.getTsuid(), "unit", "m", MetadataType.STRING, true);
		api.md().save(ts2.getTsuid(), "unit", "km", MetadataType.STRING, true);

		assertEquals(2, manager.list().size());
		assertEquals(List.of(ts2.getTsuid()), manager.findFromMeta(Map.of("unit", List.of("km"))));
	}
}

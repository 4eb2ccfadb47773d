package com.ikats.store.memory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

import com.ikats.exception.IkatsConflictException;
import com.ikats.exception.IkatsNotFoundException;
import com.ikats.model.FunctionalIdentifier;
import com.ikats.store.FidRegistry;
import com.ikats.util.IkatsChecks;

/**
 * FID registry kept in memory, one instance per emulated backend.
 */
public class InMemoryFidRegistry implements FidRegistry {

	private final Map<String, String> tsuidByFid = new LinkedHashMap<>();
	private final Map<String, String> fidByTsuid = new LinkedHashMap<>();
	private final List<Consumer<String>> removalListeners = new ArrayList<>();

	/**
	 * Called with the TSUID of every deleted timeseries, so the other stores drop what they hold.
	 */
	public void addRemovalListener(Consumer<String> listener) {
		removalListeners.add(listener);
	}

	@Override
	public Optional<String> findTsuid(String fid) {
		IkatsChecks.checkFid(fid);
		return Optional.ofNullable(tsuidByFid.get(fid));
	}

	@Override
	public String fidOf(String tsuid) {
		IkatsChecks.checkTsuid(tsuid);
		String fid = fidByTsuid.get(tsuid);
		if (fid == null) {
			throw new IkatsNotFoundException("No FID for TSUID " + tsuid);
		}
		return fid;
	}

	@Override
	public void registerFid(String tsuid, String fid) {
		IkatsChecks.checkTsuid(tsuid);
		IkatsChecks.checkFid(fid);
		if (tsuidByFid.containsKey(fid) || fidByTsuid.containsKey(tsuid)) {
			throw new IkatsConflictException(String.format("TSUID:%s - FID already exists (not updated) %s", tsuid, fid));
		}
		tsuidByFid.put(fid, tsuid);
		fidByTsuid.put(tsuid, fid);
	}

	@Override
	public boolean deleteFid(String tsuid, boolean raiseException) {
		IkatsChecks.checkTsuid(tsuid);
		String fid = fidByTsuid.remove(tsuid);
		if (fid == null) {
			if (raiseException) {
				throw new IkatsNotFoundException("No FID for TSUID " + tsuid);
			}
			return false;
		}
		tsuidByFid.remove(fid);
		return true;
	}

	@Override
	public List<FunctionalIdentifier> listTimeseries() {
		List<FunctionalIdentifier> result = new ArrayList<>();
		fidByTsuid.forEach((tsuid, fid) -> result.add(new FunctionalIdentifier(tsuid, fid)));
		return result;
	}

	@Override
	public boolean deleteTimeseries(String tsuid, boolean raiseException) {
		if (!deleteFid(tsuid, false)) {
			if (raiseException) {
				throw new IkatsNotFoundException(String.format("Timeseries %s not found in database", tsuid));
			}
			return false;
		}
		removalListeners.forEach(listener -> listener.accept(tsuid));
		return true;
	}
}

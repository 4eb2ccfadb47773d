package com.ikats.store;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import com.ikats.exception.IkatsNotFoundException;
import com.ikats.model.FunctionalIdentifier;

/**
 * FID / TSUID associations of the temporal data manager.
 */
public interface FidRegistry {

	/**
	 * Expected-absence lookup: empty when no TSUID is bound to the FID yet.
	 */
	Optional<String> findTsuid(String fid) throws IOException;

	/**
	 * @throws IkatsNotFoundException when the FID is unknown
	 */
	default String tsuidOf(String fid) throws IOException {
		return findTsuid(fid).orElseThrow(
				() -> new IkatsNotFoundException("No TSUID associated to FID " + fid));
	}

	String fidOf(String tsuid) throws IOException;

	/**
	 * @throws com.ikats.exception.IkatsConflictException when the FID is already bound
	 */
	void registerFid(String tsuid, String fid) throws IOException;

	boolean deleteFid(String tsuid, boolean raiseException) throws IOException;

	List<FunctionalIdentifier> listTimeseries() throws IOException;

	/**
	 * Removes the timeseries and everything attached to it.
	 *
	 * @return false when the deletion failed and {@code raiseException} is not set
	 */
	boolean deleteTimeseries(String tsuid, boolean raiseException) throws IOException;
}

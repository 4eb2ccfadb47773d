package com.ikats.model;

import java.util.Objects;

/**
 * FID / TSUID pair as stored by the temporal data manager.
 */
public class FunctionalIdentifier {

	private String tsuid;
	private String funcId;

	public FunctionalIdentifier() {
	}

	public FunctionalIdentifier(String tsuid, String funcId) {
		this.tsuid = tsuid;
		this.funcId = funcId;
	}

	public String getTsuid() {
		return tsuid;
	}

	public String getFuncId() {
		return funcId;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof FunctionalIdentifier)) {
			return false;
		}
		FunctionalIdentifier other = (FunctionalIdentifier) o;
		return Objects.equals(tsuid, other.tsuid) && Objects.equals(funcId, other.funcId);
	}

	@Override
	public int hashCode() {
		return Objects.hash(tsuid, funcId);
	}

	@Override
	public String toString() {
		return funcId + " (" + tsuid + ")";
	}
}

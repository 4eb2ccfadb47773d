package com.ikats.model;

/**
 * Outcome of a point write. {@code success < submitted} means the store rejected some points.
 */
public class ImportSummary {

	private final long startDate;
	private final long endDate;
	private final int submitted;
	private final int success;

	public ImportSummary(long startDate, long endDate, int submitted, int success) {
		this.startDate = startDate;
		this.endDate = endDate;
		this.submitted = submitted;
		this.success = success;
	}

	public long getStartDate() {
		return startDate;
	}

	public long getEndDate() {
		return endDate;
	}

	public int getSubmitted() {
		return submitted;
	}

	public int getSuccess() {
		return success;
	}

	public boolean isPartial() {
		return success < submitted;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		builder.append("ImportSummary [startDate=");
		builder.append(startDate);
		builder.append(", endDate=");
		builder.append(endDate);
		builder.append(", success=");
		builder.append(success);
		builder.append("/");
		builder.append(submitted);
		builder.append("]");
		return builder.toString();
	}
}

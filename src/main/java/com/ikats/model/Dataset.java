package com.ikats.model;

import java.util.ArrayList;
import java.util.List;

public class Dataset {

	private String name;
	private String description;
	private List<FunctionalIdentifier> fids = new ArrayList<>();

	public Dataset() {
	}

	public Dataset(String name, String description, List<FunctionalIdentifier> fids) {
		this.name = name;
		this.description = description;
		this.fids = fids;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getDescription() {
		return description;
	}

	public void setDescription(String description) {
		this.description = description;
	}

	public List<FunctionalIdentifier> getFids() {
		return fids == null ? new ArrayList<>() : fids;
	}

	public void setFids(List<FunctionalIdentifier> fids) {
		this.fids = fids;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		builder.append("Dataset [name=");
		builder.append(name);
		builder.append(", description=");
		builder.append(description);
		builder.append(", fids=");
		builder.append(getFids().size());
		builder.append("]");
		return builder.toString();
	}
}

package com.ikats.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Operator implementation registered in the catalog.
 */
public class Implementation {

	private Integer id;
	private String name;
	private String label;
	private String description;
	private String family;
	private List<Parameter> inputs;
	private List<Parameter> parameters;
	private List<Parameter> outputs;

	/**
	 * Input, parameter or output of an implementation.
	 */
	public static class Parameter {

		private String name;
		private String label;
		private String description;
		private String type;

		public String getName() {
			return name;
		}

		public String getLabel() {
			return label;
		}

		public String getDescription() {
			return description;
		}

		public String getType() {
			return type;
		}
	}

	public Integer getId() {
		return id;
	}

	public String getName() {
		return name;
	}

	public String getLabel() {
		return label;
	}

	public String getDescription() {
		return description;
	}

	public String getFamily() {
		return family;
	}

	public List<Parameter> getInputs() {
		return inputs == null ? new ArrayList<>() : inputs;
	}

	public List<Parameter> getParameters() {
		return parameters == null ? new ArrayList<>() : parameters;
	}

	public List<Parameter> getOutputs() {
		return outputs == null ? new ArrayList<>() : outputs;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		builder.append("Implementation [name=");
		builder.append(name);
		builder.append(", label=");
		builder.append(label);
		builder.append(", family=");
		builder.append(family);
		builder.append("]");
		return builder.toString();
	}
}

package com.ikats.manager;

import java.io.IOException;
import java.util.List;

import com.ikats.catalog.CatalogClient;
import com.ikats.model.Implementation;

/**
 * Operators of the catalog. Running them is left to the IKATS front end.
 */
public class OperatorManager {

	private final CatalogClient catalogClient;

	public OperatorManager(CatalogClient catalogClient) {
		this.catalogClient = catalogClient;
	}

	public List<Implementation> list() throws IOException {
		return catalogClient.listImplementations();
	}

	/**
	 * @throws com.ikats.exception.IkatsNotFoundException when no operator has this name
	 */
	public Implementation get(String name) throws IOException {
		return catalogClient.getImplementation(name);
	}
}

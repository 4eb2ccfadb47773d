package com.ikats.timeseries;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ikats.exception.IkatsException;
import com.ikats.model.MetadataEntry;
import com.ikats.store.MetadataStore;

/**
 * One-shot copy of the metadata of a parent timeseries to a child. Intrinsic metadata are not copied.
 */
public class MetadataInheritance {

	private static Logger logger = LoggerFactory.getLogger(MetadataInheritance.class);

	// matched from the start of the name only
	public static final Pattern NON_INHERITABLE_PATTERN = Pattern.compile("^qual.*|^ikats.*|funcId");

	private final MetadataStore metadataStore;

	public MetadataInheritance(MetadataStore metadataStore) {
		this.metadataStore = metadataStore;
	}

	public static boolean isInheritable(String name) {
		return !NON_INHERITABLE_PATTERN.matcher(name).lookingAt();
	}

	/**
	 * Never fails: errors are logged and the copy stops.
	 *
	 * @return the number of metadata copied
	 */
	public int inherit(String childTsuid, String parentTsuid) {
		int copied = 0;
		try {
			Map<String, MetadataEntry> parentMetadata = metadataStore
					.getMetadata(Collections.singletonList(parentTsuid))
					.getOrDefault(parentTsuid, Collections.emptyMap());
			for (MetadataEntry entry : parentMetadata.values()) {
				if (isInheritable(entry.getName())) {
					metadataStore.createMetadata(childTsuid, entry.getName(), entry.getValue(), entry.getType(), true);
					copied++;
				}
			}
		} catch (IkatsException | IOException | IllegalArgumentException e) {
			logger.warn("Inheritance from {} to {} stopped after {} metadata: {}", parentTsuid, childTsuid, copied,
					e.getMessage());
		}
		return copied;
	}
}

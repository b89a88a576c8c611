package works.arbor.schema;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.arbor.HostModel;
import works.arbor.exceptions.DefaultResolutionException;
import works.arbor.exceptions.NotInstantiableException;

/**
 * Discovers what a freshly created object of each class looks like,
 * so serialization only needs to store what differs.
 * <p>
 * Defaults are learned by creating a throwaway object through the {@link HostModel},
 * reading every schema property, and destroying it again.
 * This happens the first time a class is asked for, and never again:
 * entries are never invalidated.
 */
public final class DefaultResolver<O> {
	private final Schema schema;
	private final HostModel<O> host;
	private final Map<String, ClassDefaults> cache = new ConcurrentHashMap<>();
	private final Object resolutionLock = new Object();

	public DefaultResolver(Schema schema, HostModel<O> host) {
		this.schema = schema;
		this.host = host;
	}

	/**
	 * @throws NotInstantiableException if the class can't be created by name
	 * @throws DefaultResolutionException if the host fails to create the object or read a property
	 */
	public ClassDefaults resolveDefaults(String className) {
		ClassDefaults result = cache.get(className);
		if (result != null) {
			return result;
		}
		synchronized (resolutionLock) {
			result = cache.get(className);
			if (result == null) {
				result = instantiateAndRead(className);
				cache.put(className, result);
			}
			return result;
		}
	}

	public boolean isResolved(String className) {
		return cache.containsKey(className);
	}

	private ClassDefaults instantiateAndRead(String className) {
		if (!schema.isInstantiable(className)) {
			throw new NotInstantiableException(className);
		}
		ClassSchema classSchema = schema.classSchema(className)
			.orElseThrow(() -> new NotInstantiableException(className));

		O instance;
		try {
			instance = host.create(className);
		} catch (RuntimeException e) {
			throw new DefaultResolutionException(className, "host could not create an instance", e);
		}

		try {
			Map<String, Object> values = new LinkedHashMap<>();
			for (PropertySpec property : classSchema.properties().values()) {
				try {
					values.put(property.name(), host.get(instance, property.name()));
				} catch (RuntimeException e) {
					throw new DefaultResolutionException(className, "unable to read property " + property.name(), e);
				}
			}
			LOGGER.debug("Resolved {} defaults for {}", values.size(), className);
			return new ClassDefaults(className, values);
		} finally {
			host.destroy(instance);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DefaultResolver.class);
}

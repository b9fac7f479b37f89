package villagecompute.screening.services;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import villagecompute.screening.api.types.SourceDescriptorType;
import villagecompute.screening.config.JobsConfig;
import villagecompute.screening.data.stores.SourceStore;
import villagecompute.screening.exceptions.SourceNotFoundException;

/**
 * Source lookups for the ingestion job with a bounded descriptor cache.
 *
 * <p>
 * <b>Cache Policy:</b>
 * <ul>
 * <li>At most {@code screening.ingestion.source-cache-size} entries (default 128), size based eviction</li>
 * <li>Only sources that exist are cached; a miss always goes back to the store</li>
 * <li>{@link #delete} invalidates the entry before removing the artifact</li>
 * </ul>
 */
@ApplicationScoped
public class SourceResolver {

    private static final Logger LOG = Logger.getLogger(SourceResolver.class);

    @Inject
    SourceStore sourceStore;

    @Inject
    JobsConfig jobsConfig;

    private Cache<String, SourceDescriptorType> descriptors;

    public SourceResolver() {
    }

    public SourceResolver(SourceStore sourceStore, int cacheSize) {
        this.sourceStore = sourceStore;
        this.descriptors = buildCache(cacheSize);
    }

    @PostConstruct
    void init() {
        if (descriptors == null) {
            descriptors = buildCache(jobsConfig.getSourceCacheSize());
        }
    }

    /**
     * Resolves a source.
     *
     * @throws SourceNotFoundException
     *             if the store has no such source
     */
    public SourceDescriptorType resolve(String sourceRef) {
        SourceDescriptorType cached = descriptors.getIfPresent(sourceRef);
        if (cached != null) {
            return cached;
        }
        Optional<SourceDescriptorType> found = sourceStore.describe(sourceRef);
        if (found.isEmpty()) {
            throw new SourceNotFoundException("Source not found: " + sourceRef);
        }
        descriptors.put(sourceRef, found.get());
        return found.get();
    }

    public InputStream open(SourceDescriptorType source) throws IOException {
        return sourceStore.openStream(source.sourceRef());
    }

    /**
     * Invalidates the cached descriptor and deletes the artifact.
     *
     * @return {@code false} if the artifact was already gone
     */
    public boolean delete(String sourceRef) throws IOException {
        descriptors.invalidate(sourceRef);
        boolean deleted = sourceStore.delete(sourceRef);
        LOG.debugf("Source %s delete requested (removed: %s)", sourceRef, deleted);
        return deleted;
    }

    public boolean isCached(String sourceRef) {
        return descriptors.getIfPresent(sourceRef) != null;
    }

    long cachedCount() {
        descriptors.cleanUp();
        return descriptors.estimatedSize();
    }

    private static Cache<String, SourceDescriptorType> buildCache(int size) {
        return Caffeine.newBuilder().maximumSize(size).build();
    }
}

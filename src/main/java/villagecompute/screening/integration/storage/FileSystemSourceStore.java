package villagecompute.screening.integration.storage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.screening.api.types.SourceDescriptorType;
import villagecompute.screening.config.JobsConfig;
import villagecompute.screening.data.stores.SourceStore;
import villagecompute.screening.exceptions.SourceNotFoundException;

/**
 * {@link SourceStore} over a local upload directory ({@code screening.sources.directory}).
 *
 * <p>
 * Source references are file names relative to the root. References that resolve outside the root are treated as
 * missing.
 */
@ApplicationScoped
public class FileSystemSourceStore implements SourceStore {

    private static final Logger LOG = Logger.getLogger(FileSystemSourceStore.class);

    @Inject
    JobsConfig jobsConfig;

    private Path root;

    public FileSystemSourceStore() {
    }

    public FileSystemSourceStore(Path root) {
        this.root = root;
    }

    @Override
    public Optional<SourceDescriptorType> describe(String sourceRef) {
        Optional<Path> path = resolve(sourceRef);
        if (path.isEmpty() || !Files.isRegularFile(path.get())) {
            return Optional.empty();
        }
        try {
            BasicFileAttributes attributes = Files.readAttributes(path.get(), BasicFileAttributes.class);
            return Optional.of(
                    new SourceDescriptorType(sourceRef, attributes.size(), attributes.lastModifiedTime().toInstant()));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            LOG.warnf(e, "Could not read attributes of source %s", sourceRef);
            return Optional.empty();
        }
    }

    @Override
    public InputStream openStream(String sourceRef) throws IOException {
        Path path = resolve(sourceRef).orElseThrow(() -> new SourceNotFoundException("Source not found: " + sourceRef));
        try {
            return Files.newInputStream(path);
        } catch (NoSuchFileException e) {
            throw new SourceNotFoundException("Source not found: " + sourceRef, e);
        }
    }

    @Override
    public boolean delete(String sourceRef) throws IOException {
        Optional<Path> path = resolve(sourceRef);
        if (path.isEmpty()) {
            return false;
        }
        boolean deleted = Files.deleteIfExists(path.get());
        if (deleted) {
            LOG.debugf("Deleted source file: path=%s", path.get());
        }
        return deleted;
    }

    private Optional<Path> resolve(String sourceRef) {
        if (sourceRef == null || sourceRef.isBlank()) {
            return Optional.empty();
        }
        Path base = root().toAbsolutePath().normalize();
        Path candidate = base.resolve(sourceRef).normalize();
        if (!candidate.startsWith(base)) {
            LOG.warnf("Rejected source reference outside the upload directory: %s", sourceRef);
            return Optional.empty();
        }
        return Optional.of(candidate);
    }

    private Path root() {
        if (root == null) {
            root = jobsConfig.getSourcesDirectory();
        }
        return root;
    }
}

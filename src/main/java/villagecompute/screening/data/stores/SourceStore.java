package villagecompute.screening.data.stores;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

import villagecompute.screening.api.types.SourceDescriptorType;

/**
 * Uploaded source artifacts awaiting ingestion.
 */
public interface SourceStore {

    /**
     * Looks a source up without opening it.
     *
     * @return the descriptor, empty when no such source exists
     */
    Optional<SourceDescriptorType> describe(String sourceRef);

    /**
     * Opens a source for reading.
     *
     * @throws villagecompute.screening.exceptions.SourceNotFoundException
     *             if the source does not exist
     */
    InputStream openStream(String sourceRef) throws IOException;

    /**
     * Deletes a source.
     *
     * @return {@code false} if there was nothing to delete
     */
    boolean delete(String sourceRef) throws IOException;
}

package com.boardrag.pipeline.infra;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.Optional;

/**
 * Blob store addressed by opaque keys. Existence checks retry before reporting an object as absent
 * because freshly written objects may not be visible yet.
 */
public interface ObjectStore {

    void put(String key, Path source, String contentType);

    Optional<ObjectStat> stat(String key);

    boolean exists(String key);

    ObjectStream streamGet(String key);

    void delete(String key);

    DeleteResult deleteMany(Collection<String> keys);

    String presignGet(String key, Duration ttl);
}

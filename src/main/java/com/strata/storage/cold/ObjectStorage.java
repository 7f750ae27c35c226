package com.strata.storage.cold;

import java.util.List;

/**
 * Opaque object storage used for the cold tier.
 */
public interface ObjectStorage {

    void put(String key, byte[] content);

    /**
     * @throws com.strata.error.NotFoundException if no object exists under {@code key}
     */
    byte[] get(String key);

    /**
     * Keys starting with {@code prefix}, in lexicographic order.
     */
    List<String> list(String prefix);

    void delete(String key);
}

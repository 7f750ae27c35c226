package com.strata.support;

import com.strata.error.NotFoundException;
import com.strata.error.TransientStoreException;
import com.strata.storage.cold.ObjectStorage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;

public class InMemoryObjectStorage implements ObjectStorage {

    private final Map<String, byte[]> objects = new ConcurrentSkipListMap<>();
    private volatile boolean failPuts;

    @Override
    public void put(String key, byte[] content) {
        if (failPuts) {
            throw new TransientStoreException("object upload failed");
        }
        objects.put(key, content.clone());
    }

    @Override
    public byte[] get(String key) {
        byte[] content = objects.get(key);
        if (content == null) {
            throw new NotFoundException("archive", key);
        }
        return content.clone();
    }

    @Override
    public List<String> list(String prefix) {
        List<String> keys = new ArrayList<>();
        for (String key : objects.keySet()) {
            if (key.startsWith(prefix)) {
                keys.add(key);
            }
        }
        return keys;
    }

    @Override
    public void delete(String key) {
        objects.remove(key);
    }

    public int size() {
        return objects.size();
    }

    public void setFailPuts(boolean failPuts) {
        this.failPuts = failPuts;
    }
}

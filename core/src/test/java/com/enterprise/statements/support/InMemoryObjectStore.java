package com.enterprise.statements.support;

import com.enterprise.statements.exception.ResultWriteException;
import com.enterprise.statements.store.ObjectStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

public class InMemoryObjectStore implements ObjectStore {

    private final Map<String, byte[]> objects = new LinkedHashMap<>();
    private Predicate<String> failWhen = path -> false;

    public InMemoryObjectStore failWritesWhen(Predicate<String> predicate) {
        this.failWhen = predicate;
        return this;
    }

    @Override
    public void writeBytes(String path, byte[] bytes) {
        if (failWhen.test(path)) {
            throw new ResultWriteException("write refused: " + path);
        }
        objects.put(path, bytes.clone());
    }

    public byte[] get(String path) {
        return objects.get(path);
    }

    /**
     * Paths in write order.
     */
    public List<String> paths() {
        return new ArrayList<>(objects.keySet());
    }

    public boolean isEmpty() {
        return objects.isEmpty();
    }
}

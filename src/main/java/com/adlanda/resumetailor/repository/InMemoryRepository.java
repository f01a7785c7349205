package com.adlanda.resumetailor.repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Map-backed storage shared by the in-memory repositories.
 *
 * Keeps entities keyed by id; lookups return live references, so callers
 * that mutate an entity must still call {@link #save} to publish the change.
 */
abstract class InMemoryRepository<T> {

    private final Map<String, T> entities = new ConcurrentHashMap<>();
    private final Function<T, String> idOf;

    protected InMemoryRepository(Function<T, String> idOf) {
        this.idOf = idOf;
    }

    public T save(T entity) {
        entities.put(idOf.apply(entity), entity);
        return entity;
    }

    public Optional<T> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entities.get(id));
    }

    public boolean deleteById(String id) {
        return id != null && entities.remove(id) != null;
    }

    public int size() {
        return entities.size();
    }

    protected List<T> findAll(Predicate<T> filter, Comparator<T> order) {
        return entities.values().stream()
                .filter(filter)
                .sorted(order)
                .toList();
    }
}

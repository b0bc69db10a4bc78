package com.trustplatform.relationship.registry;

import com.trustplatform.core.relationship.EntityId;
import com.trustplatform.core.relationship.Relationship;
import com.trustplatform.core.relationship.RelationshipKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory store of relationships, one per unordered entity pair.
 *
 * <p>The map itself is thread-safe. Each {@link Relationship} is not: callers
 * synchronize on the instance before reading or mutating it.
 */
@Component
public class RelationshipRegistry {

    private static final Logger log = LoggerFactory.getLogger(RelationshipRegistry.class);

    private final ConcurrentHashMap<RelationshipKey, Relationship> store = new ConcurrentHashMap<>();

    public Optional<Relationship> find(RelationshipKey key) {
        return Optional.ofNullable(store.get(key));
    }

    /**
     * Registers the relationship unless its pair is already present.
     *
     * @return true when it was added
     */
    public boolean register(Relationship relationship) {
        Relationship existing = store.putIfAbsent(relationship.key(), relationship);
        if (existing != null) {
            return false;
        }
        log.info("RELATIONSHIP_REGISTERED id={} size={}", relationship.getId(), store.size());
        return true;
    }

    public boolean remove(RelationshipKey key) {
        return store.remove(key) != null;
    }

    /** Snapshot of all relationships, ordered by key. */
    public List<Relationship> all() {
        List<Relationship> result = new ArrayList<>(store.values());
        result.sort(Comparator.comparing((Relationship r) -> r.key().first())
                              .thenComparing(r -> r.key().second()));
        return result;
    }

    public List<Relationship> involving(EntityId entity) {
        return all().stream().filter(r -> r.key().involves(entity)).toList();
    }

    public int size() {
        return store.size();
    }

    public void clear() {
        store.clear();
    }
}

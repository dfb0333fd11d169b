package io.github.drompincen.elvtrack.persistence.store;

import io.github.drompincen.elvtrack.protocol.api.RecordFields;
import io.github.drompincen.elvtrack.protocol.api.RecordKind;
import org.bson.types.ObjectId;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Process-local {@link DocumentStore}. Each collection is guarded by its own
 * monitor, which makes every call (including read-modify-write updates) atomic
 * with respect to the others. Listing returns documents in insertion order unless
 * a sort is given. Data is lost on restart.
 */
@Component
@ConditionalOnProperty(name = "elvtrack.store.type", havingValue = "memory")
public class InMemoryDocumentStore implements DocumentStore {

    private final Map<RecordKind, LinkedHashMap<String, Map<String, Object>>> collections =
            new EnumMap<>(RecordKind.class);

    public InMemoryDocumentStore() {
        for (RecordKind kind : RecordKind.values()) {
            collections.put(kind, new LinkedHashMap<>());
        }
    }

    @Override
    public String insert(RecordKind kind, Map<String, Object> doc) {
        String id = new ObjectId().toHexString();
        Map<String, Object> stored = deepCopy(doc);
        stored.remove(RecordFields.ID);
        LinkedHashMap<String, Map<String, Object>> collection = collections.get(kind);
        synchronized (collection) {
            collection.put(id, stored);
        }
        return id;
    }

    @Override
    public Optional<Map<String, Object>> findOne(RecordKind kind, String id) {
        LinkedHashMap<String, Map<String, Object>> collection = collections.get(kind);
        synchronized (collection) {
            Map<String, Object> stored = collection.get(id);
            return stored == null ? Optional.empty() : Optional.of(view(id, stored));
        }
    }

    @Override
    public List<Map<String, Object>> findMany(RecordKind kind, Map<String, Object> filter, Sort sort, int limit) {
        List<Map<String, Object>> matches = new ArrayList<>();
        LinkedHashMap<String, Map<String, Object>> collection = collections.get(kind);
        synchronized (collection) {
            for (Map.Entry<String, Map<String, Object>> entry : collection.entrySet()) {
                if (matches(entry.getValue(), filter)) {
                    matches.add(view(entry.getKey(), entry.getValue()));
                }
            }
        }
        if (sort.isSorted()) {
            matches.sort(comparatorFor(sort));
        }
        if (limit > 0 && matches.size() > limit) {
            return new ArrayList<>(matches.subList(0, limit));
        }
        return matches;
    }

    @Override
    public boolean update(RecordKind kind, String id, Map<String, Object> patch) {
        LinkedHashMap<String, Map<String, Object>> collection = collections.get(kind);
        synchronized (collection) {
            Map<String, Object> stored = collection.get(id);
            if (stored == null) return false;
            for (Map.Entry<String, Object> entry : patch.entrySet()) {
                if (entry.getValue() == null) {
                    stored.remove(entry.getKey());
                } else {
                    stored.put(entry.getKey(), copyValue(entry.getValue()));
                }
            }
            return true;
        }
    }

    @Override
    public boolean isValidId(String id) {
        return id != null && ObjectId.isValid(id);
    }

    @Override
    public StoreDiagnostics describe() {
        List<String> names = collections.entrySet().stream()
                .filter(e -> { synchronized (e.getValue()) { return !e.getValue().isEmpty(); } })
                .map(e -> e.getKey().collection())
                .collect(Collectors.toList());
        return new StoreDiagnostics("memory", "in-memory", true, names, null);
    }

    private static boolean matches(Map<String, Object> doc, Map<String, Object> filter) {
        for (Map.Entry<String, Object> f : filter.entrySet()) {
            if (!Objects.equals(doc.get(f.getKey()), f.getValue())) return false;
        }
        return true;
    }

    private static Map<String, Object> view(String id, Map<String, Object> stored) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put(RecordFields.ID, id);
        view.putAll(deepCopy(stored));
        return view;
    }

    // Nested maps and lists are copied too so no caller shares state with the store.
    private static Map<String, Object> deepCopy(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put((String) k, copyValue(v)));
        return copy;
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return deepCopy(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(copyValue(item));
            }
            return copy;
        }
        return value;
    }

    private static Comparator<Map<String, Object>> comparatorFor(Sort sort) {
        Comparator<Map<String, Object>> result = null;
        for (Sort.Order order : sort) {
            String field = order.getProperty();
            Comparator<Map<String, Object>> c = (a, b) -> compareValues(a.get(field), b.get(field));
            if (order.isDescending()) c = c.reversed();
            result = result == null ? c : result.thenComparing(c);
        }
        return result;
    }

    // Missing values sort first, as in Mongo.
    @SuppressWarnings("unchecked")
    private static int compareValues(Object a, Object b) {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : -1) : 1;
        }
        if (a instanceof Number na && b instanceof Number nb) {
            return Double.compare(na.doubleValue(), nb.doubleValue());
        }
        if (a instanceof Comparable<?> && a.getClass().isInstance(b)) {
            return ((Comparable<Object>) a).compareTo(b);
        }
        return a.toString().compareTo(b.toString());
    }
}

package io.github.drompincen.elvtrack.runtime.record;

import io.github.drompincen.elvtrack.protocol.api.RecordFields;

import java.util.LinkedHashMap;
import java.util.Map;

final class Records {

    private Records() {}

    /** The stored shape of a freshly inserted document: id first, then its fields. */
    static Map<String, Object> withId(String id, Map<String, Object> doc) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put(RecordFields.ID, id);
        view.putAll(doc);
        return view;
    }
}

package io.github.drompincen.elvtrack.runtime.validation;

import io.github.drompincen.elvtrack.protocol.api.ConditionLevel;
import io.github.drompincen.elvtrack.protocol.api.DamageLevel;
import io.github.drompincen.elvtrack.protocol.api.VehicleStatus;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class VehicleValidator implements RecordValidator {

    // First production automobile.
    private static final int MIN_YEAR = 1886;

    @Override
    public Map<String, Object> normalize(Map<String, Object> raw) {
        PayloadReader in = new PayloadReader(raw);
        Map<String, Object> doc = new LinkedHashMap<>();
        putIfPresent(doc, "vin", in.optionalString("vin"));
        putIfPresent(doc, "make", in.optionalString("make"));
        putIfPresent(doc, "model", in.optionalString("model"));
        Integer year = in.optionalInteger("year");
        if (year != null && year < MIN_YEAR) {
            throw new ValidationException("year", "must be " + MIN_YEAR + " or later");
        }
        putIfPresent(doc, "year", year);
        doc.put("engine_condition", in.enumValue("engine_condition", ConditionLevel.class, ConditionLevel.UNKNOWN).wireValue());
        doc.put("body_condition", in.enumValue("body_condition", ConditionLevel.class, ConditionLevel.UNKNOWN).wireValue());
        doc.put("damage_level", in.enumValue("damage_level", DamageLevel.class, DamageLevel.UNKNOWN).wireValue());
        putIfPresent(doc, "photos", in.optionalUrlList("photos"));
        putIfPresent(doc, "last_known_location", in.optionalObject("last_known_location"));
        putIfPresent(doc, "owner_id", in.optionalString("owner_id"));
        doc.put("status", in.enumValue("status", VehicleStatus.class, VehicleStatus.UNKNOWN).wireValue());
        return doc;
    }

    static void putIfPresent(Map<String, Object> doc, String field, Object value) {
        if (value != null) doc.put(field, value);
    }
}

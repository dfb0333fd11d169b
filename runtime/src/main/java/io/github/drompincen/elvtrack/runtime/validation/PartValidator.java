package io.github.drompincen.elvtrack.runtime.validation;

import io.github.drompincen.elvtrack.protocol.api.PartCondition;
import io.github.drompincen.elvtrack.protocol.api.RecordFields;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

import static io.github.drompincen.elvtrack.runtime.validation.VehicleValidator.putIfPresent;

@Component
public class PartValidator implements RecordValidator {

    @Override
    public Map<String, Object> normalize(Map<String, Object> raw) {
        PayloadReader in = new PayloadReader(raw);
        Map<String, Object> doc = new LinkedHashMap<>();
        putIfPresent(doc, RecordFields.VEHICLE_ID, in.optionalString(RecordFields.VEHICLE_ID));
        doc.put("name", in.requiredString("name"));
        putIfPresent(doc, "serial_number", in.optionalString("serial_number"));
        doc.put("condition", in.enumValue("condition", PartCondition.class, PartCondition.UNKNOWN).wireValue());
        putIfPresent(doc, "location", in.optionalString("location"));
        Double price = in.optionalNumber("price_etb");
        if (price != null && (price.isNaN() || price.isInfinite() || price < 0)) {
            throw new ValidationException("price_etb", "must be a non-negative number");
        }
        putIfPresent(doc, "price_etb", price);
        return doc;
    }
}

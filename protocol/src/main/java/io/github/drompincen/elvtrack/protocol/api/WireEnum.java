package io.github.drompincen.elvtrack.protocol.api;

import java.util.Arrays;
import java.util.Optional;

/**
 * A closed enum whose members travel over the wire as lower-case literals.
 */
public interface WireEnum {

    String wireValue();

    static <E extends Enum<E> & WireEnum> Optional<E> fromWire(Class<E> type, String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(type.getEnumConstants())
                .filter(e -> e.wireValue().equals(value))
                .findFirst();
    }

    static <E extends Enum<E> & WireEnum> String allowedValues(Class<E> type) {
        return Arrays.stream(type.getEnumConstants())
                .map(WireEnum::wireValue)
                .reduce((a, b) -> a + ", " + b)
                .orElse("");
    }
}

package org.carball.sqladvisor.model.fact;

import lombok.Value;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@Value
public class AttributeSpec {
    String name;
    AttributeKind kind;
    List<String> allowedValues;

    public static AttributeSpec bool(String name) {
        return new AttributeSpec(name, AttributeKind.BOOLEAN, List.of());
    }

    public static AttributeSpec number(String name) {
        return new AttributeSpec(name, AttributeKind.NUMBER, List.of());
    }

    public static AttributeSpec enumerated(String name, Class<? extends Enum<?>> type) {
        List<String> names = Arrays.stream(type.getEnumConstants())
                .map(Enum::name)
                .collect(Collectors.toList());
        return new AttributeSpec(name, AttributeKind.ENUM, List.copyOf(names));
    }
}

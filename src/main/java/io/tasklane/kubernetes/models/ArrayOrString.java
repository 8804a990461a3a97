package io.tasklane.kubernetes.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A param value, written either as a plain string or as an array of strings.
 */
@Getter
@EqualsAndHashCode
public class ArrayOrString {
    private final ParamType type;
    private final String stringVal;
    private final List<String> arrayVal;

    private ArrayOrString(ParamType type, String stringVal, List<String> arrayVal) {
        this.type = type;
        this.stringVal = stringVal;
        this.arrayVal = arrayVal;
    }

    public static ArrayOrString of(String value) {
        return new ArrayOrString(ParamType.STRING, value, null);
    }

    public static ArrayOrString of(List<String> values) {
        return new ArrayOrString(ParamType.ARRAY, null, List.copyOf(values));
    }

    public static ArrayOrString of(String... values) {
        return of(List.of(values));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ArrayOrString fromJson(Object value) {
        if (value instanceof List) {
            List<String> values = new ArrayList<>();
            for (Object item : (List<?>) value) {
                values.add(item == null ? "" : String.valueOf(item));
            }
            return of(values);
        }

        return of(value == null ? "" : String.valueOf(value));
    }

    @JsonValue
    public Object toJson() {
        return type == ParamType.ARRAY ? arrayVal : stringVal;
    }

    @Override
    public String toString() {
        if (type == ParamType.ARRAY) {
            return arrayVal.stream().collect(Collectors.joining(", ", "[", "]"));
        }

        return stringVal;
    }
}

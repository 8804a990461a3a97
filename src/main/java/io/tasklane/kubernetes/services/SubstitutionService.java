package io.tasklane.kubernetes.services;

import io.tasklane.kubernetes.serializers.JacksonMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code $(name)} references in the string fields of an object tree. The object is walked
 * through its map representation so the original is never modified. Unknown references are left
 * as they are; a list element that is exactly a reference to an array value is expanded in place.
 */
public class SubstitutionService {
    private static final Pattern VARIABLE = Pattern.compile("\\$\\(([^()]+)\\)");

    private final Map<String, String> strings;
    private final Map<String, List<String>> arrays;

    private SubstitutionService(Map<String, String> strings, Map<String, List<String>> arrays) {
        this.strings = strings;
        this.arrays = arrays;
    }

    public static SubstitutionService of(Map<String, String> strings, Map<String, List<String>> arrays) {
        return new SubstitutionService(Map.copyOf(strings), Map.copyOf(arrays));
    }

    public <T> T apply(T object, Class<T> cls) {
        if (object == null) {
            return null;
        }

        Map<String, Object> render = render(JacksonMapper.toMap(object));

        return JacksonMapper.toObject(render, cls);
    }

    public <T> List<T> applyAll(List<T> objects, Class<T> cls) {
        List<T> copy = new ArrayList<>();

        if (objects != null) {
            for (T object : objects) {
                copy.add(apply(object, cls));
            }
        }

        return copy;
    }

    public String render(String value) {
        if (value == null || !value.contains("$(")) {
            return value;
        }

        Matcher matcher = VARIABLE.matcher(value);
        StringBuilder builder = new StringBuilder();

        while (matcher.find()) {
            String replacement = strings.get(matcher.group(1).trim());
            matcher.appendReplacement(builder, Matcher.quoteReplacement(replacement != null ? replacement : matcher.group()));
        }
        matcher.appendTail(builder);

        return builder.toString();
    }

    private List<String> expand(String value) {
        if (value == null) {
            return null;
        }

        Matcher matcher = VARIABLE.matcher(value.trim());
        if (!matcher.matches()) {
            return null;
        }

        return arrays.get(matcher.group(1).trim());
    }

    private Map<String, Object> render(Map<String, Object> map) {
        Map<String, Object> copy = new LinkedHashMap<>();

        for (Map.Entry<String, Object> entry : map.entrySet()) {
            copy.put(entry.getKey(), renderVar(entry.getValue()));
        }

        return copy;
    }

    private List<Object> render(List<Object> list) {
        List<Object> copy = new ArrayList<>();

        for (Object o : list) {
            List<String> expanded = o instanceof String ? expand((String) o) : null;

            if (expanded != null) {
                copy.addAll(expanded);
            } else {
                copy.add(renderVar(o));
            }
        }

        return copy;
    }

    @SuppressWarnings("unchecked")
    private Object renderVar(Object value) {
        if (value instanceof String) {
            return render((String) value);
        }

        if (value instanceof Map) {
            return render((Map<String, Object>) value);
        }

        else if (value instanceof List) {
            return render((List<Object>) value);
        }

        return value;
    }
}

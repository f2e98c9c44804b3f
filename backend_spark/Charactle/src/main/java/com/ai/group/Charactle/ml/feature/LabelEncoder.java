package com.ai.group.Charactle.ml.feature;

import com.ai.group.Charactle.ml.error.InvalidArgumentException;
import com.ai.group.Charactle.ml.error.NotFittedException;
import com.ai.group.Charactle.ml.error.UnknownCategoryException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Maps category labels to dense codes {@code 0..k-1} in sorted label order, and back.
 * An instance is fitted exactly once.
 */
public final class LabelEncoder {

    private final String field;
    private List<String> classes;
    private Map<String, Integer> codes;

    public LabelEncoder(String field) {
        this.field = field;
    }

    /** Rebuilds an already fitted encoder from its class list (sorted, unique). */
    public static LabelEncoder ofClasses(String field, List<String> classes) {
        LabelEncoder enc = new LabelEncoder(field);
        enc.install(new ArrayList<>(new TreeSet<>(classes)));
        if (enc.classes.size() != classes.size()) {
            throw new InvalidArgumentException("Classes for " + field + " contain duplicates");
        }
        return enc;
    }

    public void fit(Collection<String> values) {
        if (classes != null) {
            throw new IllegalStateException("Encoder for " + field + " is already fitted");
        }
        if (values.isEmpty()) {
            throw new InvalidArgumentException("Cannot fit encoder for " + field + " on no values");
        }
        install(new ArrayList<>(new TreeSet<>(values)));
    }

    public int[] fitTransform(List<String> values) {
        fit(values);
        return transform(values);
    }

    public int transform(String value) {
        requireFitted();
        Integer code = codes.get(value);
        if (code == null) {
            throw new UnknownCategoryException(field, value);
        }
        return code;
    }

    public int[] transform(List<String> values) {
        int[] out = new int[values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = transform(values.get(i));
        }
        return out;
    }

    public String inverse(int code) {
        requireFitted();
        if (code < 0 || code >= classes.size()) {
            throw new InvalidArgumentException("Code " + code + " out of range for " + field);
        }
        return classes.get(code);
    }

    public List<String> inverse(int[] codes) {
        List<String> out = new ArrayList<>(codes.length);
        for (int code : codes) out.add(inverse(code));
        return out;
    }

    public List<String> classes() {
        requireFitted();
        return classes;
    }

    public int size() {
        return classes().size();
    }

    public boolean isFitted() {
        return classes != null;
    }

    public String field() {
        return field;
    }

    private void install(List<String> sorted) {
        Map<String, Integer> m = new HashMap<>();
        for (int i = 0; i < sorted.size(); i++) m.put(sorted.get(i), i);
        this.classes = List.copyOf(sorted);
        this.codes = m;
    }

    private void requireFitted() {
        if (classes == null) throw new NotFittedException("Encoder for " + field);
    }
}

package com.ai.group.Charactle.ml.feature;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Term to column index lookup for a fitted vocabulary, indexed in the order the terms are given. */
final class Vocab {

    static final int MISSING = -1;

    private final List<String> terms;
    private final Map<String, Integer> map;

    private Vocab(List<String> terms) {
        this.terms = List.copyOf(terms);
        this.map = new HashMap<>();
        for (int i = 0; i < this.terms.size(); i++) {
            if (map.put(this.terms.get(i), i) != null) {
                throw new IllegalArgumentException("Duplicate vocabulary term: " + this.terms.get(i));
            }
        }
    }

    static Vocab of(List<String> terms) {
        return new Vocab(terms);
    }

    int idOrMissing(String term) {
        Integer v = map.get(term);
        return v == null ? MISSING : v;
    }

    String term(int id) { return terms.get(id); }

    List<String> terms() { return terms; }

    int size() { return terms.size(); }
}

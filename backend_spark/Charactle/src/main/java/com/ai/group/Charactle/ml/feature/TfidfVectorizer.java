package com.ai.group.Charactle.ml.feature;

import com.ai.group.Charactle.ml.error.InvalidArgumentException;
import com.ai.group.Charactle.ml.error.NotFittedException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bag of unigrams and bigrams weighted by TF-IDF, with a vocabulary capped at
 * {@code maxFeatures} terms. Output rows always have {@code maxFeatures} columns;
 * columns past the fitted vocabulary stay zero.
 *
 * <p>Weighting: raw term counts times smoothed idf {@code ln((1 + n) / (1 + df)) + 1},
 * then each row is scaled to unit L2 norm.
 */
public final class TfidfVectorizer {

    private static final Pattern WORD_RE = Pattern.compile("\\b\\w\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    private final int maxFeatures;
    private Vocab vocab;
    private double[] idf;

    public TfidfVectorizer(int maxFeatures) {
        if (maxFeatures < 1) {
            throw new InvalidArgumentException("maxFeatures must be >= 1, got " + maxFeatures);
        }
        this.maxFeatures = maxFeatures;
    }

    /** Rebuilds a fitted vectorizer from persisted vocabulary and idf weights. */
    public static TfidfVectorizer restore(int maxFeatures, List<String> terms, double[] idf) {
        if (terms.size() > maxFeatures || terms.size() != idf.length) {
            throw new InvalidArgumentException("Vocabulary of " + terms.size() + " terms does not fit "
                    + maxFeatures + " columns with " + idf.length + " idf weights");
        }
        TfidfVectorizer v = new TfidfVectorizer(maxFeatures);
        v.vocab = Vocab.of(terms);
        v.idf = idf.clone();
        return v;
    }

    public void fit(List<String> corpus) {
        if (vocab != null) {
            throw new IllegalStateException("Vectorizer is already fitted");
        }
        if (corpus.isEmpty()) {
            throw new InvalidArgumentException("Cannot fit vectorizer on an empty corpus");
        }
        List<Map<String, Integer>> counts = new ArrayList<>(corpus.size());
        Map<String, Integer> termFrequency = new TreeMap<>();
        for (String doc : corpus) {
            Map<String, Integer> c = countTerms(doc);
            counts.add(c);
            c.forEach((t, n) -> termFrequency.merge(t, n, Integer::sum));
        }

        // most frequent first; TreeMap iteration keeps ties alphabetical
        List<String> kept = new ArrayList<>(termFrequency.keySet());
        kept.sort(Comparator.comparingInt((String t) -> termFrequency.get(t)).reversed());
        if (kept.size() > maxFeatures) {
            kept = new ArrayList<>(kept.subList(0, maxFeatures));
        }
        kept.sort(Comparator.naturalOrder());

        Vocab fitted = Vocab.of(kept);
        double[] df = new double[fitted.size()];
        for (Map<String, Integer> c : counts) {
            for (String t : c.keySet()) {
                int id = fitted.idOrMissing(t);
                if (id != Vocab.MISSING) df[id] += 1;
            }
        }
        double n = corpus.size();
        double[] weights = new double[fitted.size()];
        for (int i = 0; i < weights.length; i++) {
            weights[i] = Math.log((1 + n) / (1 + df[i])) + 1;
        }
        this.vocab = fitted;
        this.idf = weights;
    }

    public double[][] transform(List<String> corpus) {
        requireFitted();
        double[][] out = new double[corpus.size()][];
        for (int i = 0; i < out.length; i++) {
            out[i] = transform(corpus.get(i));
        }
        return out;
    }

    public double[] transform(String doc) {
        requireFitted();
        double[] row = new double[maxFeatures];
        countTerms(doc).forEach((t, n) -> {
            int id = vocab.idOrMissing(t);
            if (id != Vocab.MISSING) row[id] = n * idf[id];
        });
        double norm = 0;
        for (double v : row) norm += v * v;
        if (norm > 0) {
            norm = Math.sqrt(norm);
            for (int i = 0; i < row.length; i++) row[i] /= norm;
        }
        return row;
    }

    public double[][] fitTransform(List<String> corpus) {
        fit(corpus);
        return transform(corpus);
    }

    /** Fitted terms in column order; may be shorter than {@link #maxFeatures()}. */
    public List<String> vocabulary() {
        requireFitted();
        return vocab.terms();
    }

    public double[] idf() {
        requireFitted();
        return idf.clone();
    }

    public int maxFeatures() {
        return maxFeatures;
    }

    public boolean isFitted() {
        return vocab != null;
    }

    static List<String> tokenize(String raw) {
        String text = raw == null ? "" : raw.toLowerCase(Locale.ROOT);
        List<String> out = new ArrayList<>();
        Matcher m = WORD_RE.matcher(text);
        while (m.find()) out.add(m.group());
        return out;
    }

    private static Map<String, Integer> countTerms(String doc) {
        List<String> w = tokenize(doc);
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String t : w) counts.merge(t, 1, Integer::sum);
        for (int i = 0; i + 1 < w.size(); i++) {
            counts.merge(w.get(i) + " " + w.get(i + 1), 1, Integer::sum);
        }
        return counts;
    }

    private void requireFitted() {
        if (vocab == null) throw new NotFittedException("Text vectorizer");
    }
}

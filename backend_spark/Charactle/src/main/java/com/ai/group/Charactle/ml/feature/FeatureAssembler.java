package com.ai.group.Charactle.ml.feature;

import com.ai.group.Charactle.character.model.CharacterRecord;
import com.ai.group.Charactle.ml.error.InvalidArgumentException;
import com.ai.group.Charactle.ml.error.NotFittedException;

import java.util.ArrayList;
import java.util.List;

/**
 * Single source of truth for the feature layout:
 * <pre>
 *   powers_count, name_length, quote_length, description_length,
 *   V text weights,
 *   universe code, genre code
 * </pre>
 * The vectorizer and both category encoders are fitted together by the one
 * {@code build(records, true)} call an assembler accepts; every later call only transforms,
 * so training and inference rows share width and column order.
 */
public final class FeatureAssembler {

    public static final List<String> SCALAR_FEATURES =
            List.of("powers_count", "name_length", "quote_length", "description_length");
    public static final String UNIVERSE = "universe";
    public static final String GENRE = "genre";

    private final TfidfVectorizer vectorizer;
    private final LabelEncoder universeEncoder;
    private final LabelEncoder genreEncoder;
    private List<String> featureNames;

    public FeatureAssembler(int maxTextFeatures) {
        this(new TfidfVectorizer(maxTextFeatures), new LabelEncoder(UNIVERSE), new LabelEncoder(GENRE));
    }

    private FeatureAssembler(TfidfVectorizer vectorizer, LabelEncoder universeEncoder, LabelEncoder genreEncoder) {
        this.vectorizer = vectorizer;
        this.universeEncoder = universeEncoder;
        this.genreEncoder = genreEncoder;
    }

    /** Reassembles a fitted assembler from already fitted parts (used when loading a saved model). */
    public static FeatureAssembler restore(TfidfVectorizer vectorizer, LabelEncoder universeEncoder, LabelEncoder genreEncoder) {
        if (!vectorizer.isFitted() || !universeEncoder.isFitted() || !genreEncoder.isFitted()) {
            throw new InvalidArgumentException("Feature assembler can only be restored from fitted parts");
        }
        FeatureAssembler a = new FeatureAssembler(vectorizer, universeEncoder, genreEncoder);
        a.featureNames = a.nameColumns();
        return a;
    }

    public FeatureSet build(List<CharacterRecord> records, boolean fit) {
        if (fit && isFitted()) {
            throw new IllegalStateException("Feature assembler is already fitted");
        }
        if (!fit && !isFitted()) {
            throw new NotFittedException("Feature assembler");
        }

        List<String> texts = new ArrayList<>(records.size());
        List<String> universes = new ArrayList<>(records.size());
        List<String> genres = new ArrayList<>(records.size());
        List<String> ids = new ArrayList<>(records.size());
        double[] difficulties = new double[records.size()];
        for (int i = 0; i < records.size(); i++) {
            CharacterRecord r = records.get(i);
            texts.add(r.text());
            universes.add(r.universe());
            genres.add(r.genre());
            ids.add(r.id());
            difficulties[i] = r.difficulty();
        }

        double[][] text;
        int[] universeCodes;
        int[] genreCodes;
        if (fit) {
            text = vectorizer.fitTransform(texts);
            universeCodes = universeEncoder.fitTransform(universes);
            genreCodes = genreEncoder.fitTransform(genres);
            featureNames = nameColumns();
        } else {
            text = vectorizer.transform(texts);
            universeCodes = universeEncoder.transform(universes);
            genreCodes = genreEncoder.transform(genres);
        }

        int w = width();
        double[][] x = new double[records.size()][];
        for (int i = 0; i < x.length; i++) {
            CharacterRecord r = records.get(i);
            double[] row = new double[w];
            row[0] = r.powers().size();
            row[1] = r.name().length();
            row[2] = r.quote().length();
            row[3] = r.description().length();
            System.arraycopy(text[i], 0, row, SCALAR_FEATURES.size(), text[i].length);
            row[w - 2] = universeCodes[i];
            row[w - 1] = genreCodes[i];
            x[i] = row;
        }
        return new FeatureSet(x, ids, difficulties);
    }

    /** Feature row of one record through the fitted layout. */
    public double[] transform(CharacterRecord record) {
        return build(List.of(record), false).x()[0];
    }

    public int width() {
        return SCALAR_FEATURES.size() + vectorizer.maxFeatures() + 2;
    }

    public List<String> featureNames() {
        if (featureNames == null) throw new NotFittedException("Feature assembler");
        return featureNames;
    }

    public boolean isFitted() {
        return featureNames != null;
    }

    public TfidfVectorizer vectorizer() { return vectorizer; }

    public LabelEncoder universeEncoder() { return universeEncoder; }

    public LabelEncoder genreEncoder() { return genreEncoder; }

    private List<String> nameColumns() {
        List<String> names = new ArrayList<>(width());
        names.addAll(SCALAR_FEATURES);
        List<String> terms = vectorizer.vocabulary();
        for (int i = 0; i < vectorizer.maxFeatures(); i++) {
            names.add(i < terms.size() ? "tfidf:" + terms.get(i) : "tfidf_" + i);
        }
        names.add(UNIVERSE);
        names.add(GENRE);
        return List.copyOf(names);
    }
}

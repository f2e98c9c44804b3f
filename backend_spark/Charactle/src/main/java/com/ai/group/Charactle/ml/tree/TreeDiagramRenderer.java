package com.ai.group.Charactle.ml.tree;

import com.ai.group.Charactle.ml.error.InvalidArgumentException;
import org.apache.commons.text.StringEscapeUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Draws a fitted tree, cut at {@code maxDepth}, as an SVG document. Nodes past the cut are shown
 * as a "(...)" stub. Classifier nodes are coloured by majority class and shaded by purity,
 * regressor nodes by their predicted value.
 */
public final class TreeDiagramRenderer {

    private static final int BOX_W = 200;
    private static final int LINE_H = 15;
    private static final int H_GAP = 20;
    private static final int LEVEL_H = 120;
    private static final int MARGIN = 30;
    private static final int MAX_LISTED_CLASSES = 6;

    private final TreeStructure tree;
    private final TreeKind kind;
    private final List<String> featureNames;
    private final List<String> classNames;
    private final int maxDepth;
    private final List<Placed> placed = new ArrayList<>();
    private double minValue = Double.POSITIVE_INFINITY;
    private double maxValue = Double.NEGATIVE_INFINITY;
    private int nextSlot;

    private TreeDiagramRenderer(TreeStructure tree, TreeKind kind, List<String> featureNames,
                                List<String> classNames, int maxDepth) {
        this.tree = tree;
        this.kind = kind;
        this.featureNames = featureNames;
        this.classNames = classNames;
        this.maxDepth = maxDepth;
    }

    public static byte[] render(TreeStructure tree, TreeKind kind, List<String> featureNames,
                                List<String> classNames, int maxDepth) {
        if (maxDepth < 0) {
            throw new InvalidArgumentException("max_depth must be >= 0, got " + maxDepth);
        }
        if (kind == TreeKind.CLASSIFIER && classNames == null) {
            throw new InvalidArgumentException("Classifier diagrams need class names");
        }
        TreeDiagramRenderer r = new TreeDiagramRenderer(tree, kind, featureNames, classNames, maxDepth);
        return r.draw().getBytes(StandardCharsets.UTF_8);
    }

    private String draw() {
        for (int node = 0; node < tree.nodeCount(); node++) {
            double[] v = tree.nodeValue(node);
            minValue = Math.min(minValue, v[0]);
            maxValue = Math.max(maxValue, v[0]);
        }
        place(0, 0, -1);

        int levels = 0;
        for (Placed p : placed) levels = Math.max(levels, p.depth);
        int width = Math.max(1, nextSlot) * (BOX_W + H_GAP) + 2 * MARGIN;
        int height = (levels + 1) * LEVEL_H + 2 * MARGIN + 30;

        StringBuilder svg = new StringBuilder();
        svg.append("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"").append(width)
                .append("\" height=\"").append(height).append("\" font-family=\"Helvetica, Arial, sans-serif\" font-size=\"11\">\n");
        svg.append("<rect width=\"100%\" height=\"100%\" fill=\"white\"/>\n");
        svg.append("<text x=\"").append(width / 2).append("\" y=\"24\" text-anchor=\"middle\" font-size=\"16\" font-weight=\"bold\">")
                .append(esc("Decision Tree - " + kind.label())).append("</text>\n");

        for (Placed p : placed) {
            if (p.parent >= 0) {
                Placed parent = placed.get(p.parent);
                svg.append(String.format(Locale.ROOT,
                        "<line x1=\"%.1f\" y1=\"%d\" x2=\"%.1f\" y2=\"%d\" stroke=\"#555\"/>%n",
                        cx(parent), top(parent) + boxHeight(parent), cx(p), top(p)));
            }
        }
        for (Placed p : placed) {
            double x = cx(p) - BOX_W / 2.0;
            int y = top(p);
            svg.append(String.format(Locale.ROOT,
                    "<rect x=\"%.1f\" y=\"%d\" width=\"%d\" height=\"%d\" rx=\"6\" ry=\"6\" fill=\"%s\" stroke=\"#333\"/>%n",
                    x, y, BOX_W, boxHeight(p), p.stub ? "white" : fill(p.node)));
            List<String> lines = p.lines;
            for (int i = 0; i < lines.size(); i++) {
                svg.append(String.format(Locale.ROOT, "<text x=\"%.1f\" y=\"%d\" text-anchor=\"middle\">",
                                cx(p), y + 15 + i * LINE_H))
                        .append(esc(lines.get(i))).append("</text>\n");
            }
        }
        svg.append("</svg>\n");
        return svg.toString();
    }

    /** Lays out the subtree under {@code node} and returns its index in {@link #placed}. */
    private int place(int node, int depth, int parent) {
        Placed p = new Placed(node, depth, parent);
        int idx = placed.size();
        placed.add(p);
        if (depth > maxDepth) {
            p.stub = true;
            p.lines = List.of("(...)");
            p.slot = nextSlot++;
            return idx;
        }
        p.lines = describe(node);
        if (tree.isLeaf(node)) {
            p.slot = nextSlot++;
        } else {
            int l = place(tree.left(node), depth + 1, idx);
            int r = place(tree.right(node), depth + 1, idx);
            p.slot = (placed.get(l).slot + placed.get(r).slot) / 2.0;
        }
        return idx;
    }

    private List<String> describe(int node) {
        List<String> lines = new ArrayList<>();
        if (!tree.isLeaf(node)) {
            lines.add(featureNames.get(tree.splitFeature(node)) + " <= " + fmt(tree.splitThreshold(node), 2));
        }
        String criterion = kind == TreeKind.CLASSIFIER ? "gini" : "squared_error";
        lines.add(criterion + " = " + fmt(tree.nodeImpurity(node), 3));
        lines.add("samples = " + tree.samples(node));
        double[] v = tree.nodeValue(node);
        if (kind == TreeKind.CLASSIFIER) {
            if (v.length <= MAX_LISTED_CLASSES) {
                StringBuilder sb = new StringBuilder("value = [");
                for (int i = 0; i < v.length; i++) {
                    if (i > 0) sb.append(", ");
                    sb.append((long) v[i]);
                }
                lines.add(sb.append(']').toString());
            }
            lines.add("class = " + classNames.get(TreeTextExporter.argmax(v)));
        } else {
            lines.add("value = " + fmt(v[0], 3));
        }
        return lines;
    }

    private String fill(int node) {
        double[] v = tree.nodeValue(node);
        if (kind == TreeKind.CLASSIFIER) {
            int top = TreeTextExporter.argmax(v);
            double total = 0, first = 0, second = 0;
            for (double c : v) {
                total += c;
                if (c > first) { second = first; first = c; }
                else if (c > second) second = c;
            }
            double alpha = total == 0 ? 0 : (first - second) / total;
            int hue = (int) Math.round(360.0 * top / Math.max(1, v.length));
            return String.format(Locale.ROOT, "hsla(%d, 70%%, 60%%, %.3f)", hue, alpha);
        }
        double span = maxValue - minValue;
        double alpha = span == 0 ? 0 : (v[0] - minValue) / span;
        return String.format(Locale.ROOT, "rgba(229, 129, 57, %.3f)", alpha);
    }

    private double cx(Placed p) {
        return MARGIN + p.slot * (BOX_W + H_GAP) + BOX_W / 2.0;
    }

    private int top(Placed p) {
        return MARGIN + 30 + p.depth * LEVEL_H;
    }

    private int boxHeight(Placed p) {
        return p.lines.size() * LINE_H + 8;
    }

    private static String fmt(double v, int decimals) {
        return String.format(Locale.ROOT, "%." + decimals + "f", v);
    }

    private static String esc(String s) {
        return StringEscapeUtils.escapeXml11(s);
    }

    private static final class Placed {
        final int node;
        final int depth;
        final int parent;
        boolean stub;
        double slot;
        List<String> lines;

        Placed(int node, int depth, int parent) {
            this.node = node;
            this.depth = depth;
            this.parent = parent;
        }
    }
}

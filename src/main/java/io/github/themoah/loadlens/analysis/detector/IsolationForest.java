package io.github.themoah.loadlens.analysis.detector;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Isolation forest over a small dense feature matrix.
 *
 * <p>Each tree isolates a random sub-sample by recursive random splits; points
 * that isolate in few splits are anomalous. Scores follow the usual convention
 * {@code -2^(-E[h(x)] / c(psi))}, so lower means more anomalous. All randomness
 * comes from the supplied {@link Random}.
 */
public final class IsolationForest {

  private static final double EULER_GAMMA = 0.5772156649015329;
  static final int MAX_SAMPLES = 256;

  private final List<Node> trees;
  private final int subsampleSize;

  private IsolationForest(List<Node> trees, int subsampleSize) {
    this.trees = trees;
    this.subsampleSize = subsampleSize;
  }

  /**
   * Grows a forest on {@code rows}.
   *
   * @param rows feature matrix, one row per sample, no {@code NaN}
   * @param treeCount number of trees
   * @param random source of randomness
   */
  public static IsolationForest fit(double[][] rows, int treeCount, Random random) {
    if (rows.length == 0) {
      throw new IllegalArgumentException("Cannot fit an isolation forest on zero rows");
    }
    int psi = Math.min(MAX_SAMPLES, rows.length);
    int maxDepth = (int) Math.ceil(Math.log(Math.max(psi, 2)) / Math.log(2));
    List<Node> trees = new ArrayList<>(treeCount);
    int[] indices = new int[rows.length];
    for (int t = 0; t < treeCount; t++) {
      for (int i = 0; i < indices.length; i++) {
        indices[i] = i;
      }
      // partial Fisher-Yates: the first psi entries are a sample without replacement
      for (int i = 0; i < psi; i++) {
        int j = i + random.nextInt(indices.length - i);
        int tmp = indices[i];
        indices[i] = indices[j];
        indices[j] = tmp;
      }
      int[] sample = new int[psi];
      System.arraycopy(indices, 0, sample, 0, psi);
      trees.add(grow(rows, sample, 0, maxDepth, random));
    }
    return new IsolationForest(trees, psi);
  }

  /**
   * Anomaly score per row; lower is more anomalous, range roughly (-1, -0.5].
   */
  public double[] scoreSamples(double[][] rows) {
    double normalizer = averagePathLength(subsampleSize);
    double[] scores = new double[rows.length];
    for (int r = 0; r < rows.length; r++) {
      double total = 0.0;
      for (Node tree : trees) {
        total += pathLength(tree, rows[r], 0);
      }
      double expected = total / trees.size();
      scores[r] = normalizer > 0 ? -Math.pow(2.0, -expected / normalizer) : -0.5;
    }
    return scores;
  }

  /**
   * Average path length of an unsuccessful BST search over {@code n} points.
   */
  static double averagePathLength(int n) {
    if (n <= 1) {
      return 0.0;
    }
    if (n == 2) {
      return 1.0;
    }
    double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
    return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
  }

  private static Node grow(double[][] rows, int[] sample, int depth, int maxDepth, Random random) {
    if (depth >= maxDepth || sample.length <= 1) {
      return Node.leaf(sample.length);
    }
    int features = rows[sample[0]].length;
    int start = random.nextInt(features);
    for (int attempt = 0; attempt < features; attempt++) {
      int feature = (start + attempt) % features;
      double min = Double.POSITIVE_INFINITY;
      double max = Double.NEGATIVE_INFINITY;
      for (int index : sample) {
        min = Math.min(min, rows[index][feature]);
        max = Math.max(max, rows[index][feature]);
      }
      if (max - min <= 0) {
        continue;
      }
      double threshold = min + random.nextDouble() * (max - min);
      int leftCount = 0;
      for (int index : sample) {
        if (rows[index][feature] < threshold) {
          leftCount++;
        }
      }
      int[] left = new int[leftCount];
      int[] right = new int[sample.length - leftCount];
      int l = 0;
      int r = 0;
      for (int index : sample) {
        if (rows[index][feature] < threshold) {
          left[l++] = index;
        } else {
          right[r++] = index;
        }
      }
      return Node.split(feature, threshold,
        grow(rows, left, depth + 1, maxDepth, random),
        grow(rows, right, depth + 1, maxDepth, random));
    }
    // every feature is constant in this node
    return Node.leaf(sample.length);
  }

  private static double pathLength(Node node, double[] row, int depth) {
    if (node.isLeaf()) {
      return depth + averagePathLength(node.size);
    }
    Node next = row[node.feature] < node.threshold ? node.left : node.right;
    return pathLength(next, row, depth + 1);
  }

  private static final class Node {
    final int feature;
    final double threshold;
    final Node left;
    final Node right;
    final int size;

    private Node(int feature, double threshold, Node left, Node right, int size) {
      this.feature = feature;
      this.threshold = threshold;
      this.left = left;
      this.right = right;
      this.size = size;
    }

    static Node leaf(int size) {
      return new Node(-1, Double.NaN, null, null, size);
    }

    static Node split(int feature, double threshold, Node left, Node right) {
      return new Node(feature, threshold, left, right, 0);
    }

    boolean isLeaf() {
      return left == null;
    }
  }
}

package com.scholary.transcripthub.metrics;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Diarization error rate: missed speech, false-alarm speech and speaker confusion over the total
 * reference speech time.
 *
 * <p>The timeline is cut at every turn boundary of either diarization. Within each elementary
 * interval the active reference and hypothesis label sets are compared. Reference labels are
 * mapped one-to-one onto hypothesis labels so that the total co-active time of mapped pairs is
 * maximal (Hungarian assignment); mapped pairs count as correct, everything else as an error.
 * No forgiveness collar is applied and overlapping speech is scored.
 */
public class DiarizationErrorRate {

  /**
   * Compute DER.
   *
   * @return error / total reference speech; 0 when there is neither reference nor hypothesis
   *     speech, 1 when only the hypothesis has speech
   */
  public double compute(List<SpeakerTurn> reference, List<SpeakerTurn> hypothesis) {
    Map<String, Integer> refLabels = labels(reference);
    Map<String, Integer> hypLabels = labels(hypothesis);

    TreeSet<Double> boundaries = new TreeSet<>();
    addBoundaries(reference, boundaries);
    addBoundaries(hypothesis, boundaries);

    double[][] overlap = new double[refLabels.size()][hypLabels.size()];
    double totalReference = 0.0;
    double maxActive = 0.0;

    Double previous = null;
    for (Double boundary : boundaries) {
      if (previous != null && boundary > previous) {
        double duration = boundary - previous;
        double midpoint = (previous + boundary) / 2.0;
        Set<Integer> activeRef = active(reference, refLabels, midpoint);
        Set<Integer> activeHyp = active(hypothesis, hypLabels, midpoint);

        totalReference += duration * activeRef.size();
        maxActive += duration * Math.max(activeRef.size(), activeHyp.size());
        for (int r : activeRef) {
          for (int h : activeHyp) {
            overlap[r][h] += duration;
          }
        }
      }
      previous = boundary;
    }

    double correct = 0.0;
    int[] assignment = HungarianAssignment.maximize(overlap);
    for (int r = 0; r < assignment.length; r++) {
      if (assignment[r] >= 0) {
        correct += overlap[r][assignment[r]];
      }
    }

    double error = maxActive - correct;
    if (totalReference == 0.0) {
      return error == 0.0 ? 0.0 : 1.0;
    }
    return error / totalReference;
  }

  private static Map<String, Integer> labels(List<SpeakerTurn> turns) {
    Map<String, Integer> labels = new LinkedHashMap<>();
    for (SpeakerTurn turn : turns) {
      labels.putIfAbsent(String.valueOf(turn.speaker()), labels.size());
    }
    return labels;
  }

  private static void addBoundaries(List<SpeakerTurn> turns, TreeSet<Double> boundaries) {
    for (SpeakerTurn turn : turns) {
      if (turn.end() > turn.start()) {
        boundaries.add(turn.start());
        boundaries.add(turn.end());
      }
    }
  }

  private static Set<Integer> active(
      List<SpeakerTurn> turns, Map<String, Integer> labels, double instant) {
    Set<Integer> active = new HashSet<>();
    for (SpeakerTurn turn : turns) {
      if (turn.start() <= instant && instant < turn.end()) {
        active.add(labels.get(String.valueOf(turn.speaker())));
      }
    }
    return active;
  }

  /** Kuhn-Munkres assignment on a rectangular weight matrix. */
  static final class HungarianAssignment {

    private HungarianAssignment() {}

    /**
     * Find the row-to-column assignment with maximal total weight.
     *
     * @param weights {@code rows x columns} non-negative weights
     * @return for each row the assigned column, or -1 when the row is left unassigned
     */
    static int[] maximize(double[][] weights) {
      int rows = weights.length;
      int columns = rows == 0 ? 0 : weights[0].length;
      int[] result = new int[rows];
      if (rows == 0 || columns == 0) {
        Arrays.fill(result, -1);
        return result;
      }

      int n = Math.max(rows, columns);
      double max = 0.0;
      for (double[] row : weights) {
        for (double w : row) {
          max = Math.max(max, w);
        }
      }
      // Square cost matrix; padding cells cost as much as a zero-weight pair.
      double[][] cost = new double[n + 1][n + 1];
      for (int i = 1; i <= n; i++) {
        for (int j = 1; j <= n; j++) {
          double w = (i <= rows && j <= columns) ? weights[i - 1][j - 1] : 0.0;
          cost[i][j] = max - w;
        }
      }

      double[] u = new double[n + 1];
      double[] v = new double[n + 1];
      int[] p = new int[n + 1];
      int[] way = new int[n + 1];
      for (int i = 1; i <= n; i++) {
        p[0] = i;
        int j0 = 0;
        double[] minv = new double[n + 1];
        boolean[] used = new boolean[n + 1];
        Arrays.fill(minv, Double.POSITIVE_INFINITY);
        do {
          used[j0] = true;
          int i0 = p[j0];
          double delta = Double.POSITIVE_INFINITY;
          int j1 = 0;
          for (int j = 1; j <= n; j++) {
            if (!used[j]) {
              double cur = cost[i0][j] - u[i0] - v[j];
              if (cur < minv[j]) {
                minv[j] = cur;
                way[j] = j0;
              }
              if (minv[j] < delta) {
                delta = minv[j];
                j1 = j;
              }
            }
          }
          for (int j = 0; j <= n; j++) {
            if (used[j]) {
              u[p[j]] += delta;
              v[j] -= delta;
            } else {
              minv[j] -= delta;
            }
          }
          j0 = j1;
        } while (p[j0] != 0);
        do {
          int j1 = way[j0];
          p[j0] = p[j1];
          j0 = j1;
        } while (j0 != 0);
      }

      Arrays.fill(result, -1);
      for (int j = 1; j <= n; j++) {
        int i = p[j];
        if (i >= 1 && i <= rows && j <= columns) {
          result[i - 1] = j - 1;
        }
      }
      return result;
    }
  }
}

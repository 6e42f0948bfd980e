package org.nrg.xnat.rtconvert.raster;

import java.util.Arrays;
import java.util.List;

/**
 * Even-odd scan-line polygon fill on a voxel slice.
 *
 * Samples are voxel centres at integer (column, row) coordinates. An edge crosses row {@code y} when
 * {@code min(y1, y2) <= y < max(y1, y2)}, and a span {@code [xa, xb)} covers columns
 * {@code ceil(xa) .. ceil(xb) - 1}. All polygons passed in one call share a single parity, so nested
 * polygons cut holes and disjoint polygons add up.
 */
final class ScanlineFiller {

    private static final double SNAP_EPSILON = 1e-6;

    private ScanlineFiller() {
    }

    /**
     * Set {@code target[row * columns + column]} for every voxel inside the polygons.
     *
     * @param polygons each polygon as {xs, ys} in fractional voxel coordinates
     * @return number of voxels set
     */
    static int fill(List<double[][]> polygons, int rows, int columns, boolean[] target) {
        double minY = Double.POSITIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        int edgeCount = 0;
        for (double[][] polygon : polygons) {
            for (double y : polygon[1]) {
                minY = Math.min(minY, y);
                maxY = Math.max(maxY, y);
            }
            edgeCount += polygon[0].length;
        }
        if (edgeCount == 0) {
            return 0;
        }

        int firstRow = Math.max(0, (int) Math.ceil(minY));
        int lastRow = Math.min(rows - 1, (int) Math.floor(maxY));
        double[] crossings = new double[edgeCount];
        int filled = 0;

        for (int y = firstRow; y <= lastRow; y++) {
            int n = 0;
            for (double[][] polygon : polygons) {
                double[] xs = polygon[0];
                double[] ys = polygon[1];
                int size = xs.length;
                for (int i = 0; i < size; i++) {
                    int j = (i + 1) % size;
                    double y1 = ys[i];
                    double y2 = ys[j];
                    if (y1 == y2) {
                        continue;
                    }
                    double low = Math.min(y1, y2);
                    double high = Math.max(y1, y2);
                    if (y < low || y >= high) {
                        continue;
                    }
                    crossings[n++] = xs[i] + (y - y1) * (xs[j] - xs[i]) / (y2 - y1);
                }
            }
            if (n < 2) {
                continue;
            }
            Arrays.sort(crossings, 0, n);
            int offset = y * columns;
            for (int c = 0; c + 1 < n; c += 2) {
                int start = Math.max(0, (int) Math.ceil(snap(crossings[c])));
                int end = Math.min(columns, (int) Math.ceil(snap(crossings[c + 1])));
                for (int x = start; x < end; x++) {
                    if (!target[offset + x]) {
                        target[offset + x] = true;
                        filled++;
                    }
                }
            }
        }
        return filled;
    }

    /**
     * Round values within floating point noise of an integer onto it.
     */
    static double snap(double value) {
        double rounded = Math.rint(value);
        return Math.abs(value - rounded) < SNAP_EPSILON ? rounded : value;
    }
}

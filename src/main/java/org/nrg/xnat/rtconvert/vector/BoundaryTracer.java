package org.nrg.xnat.rtconvert.vector;

import java.util.ArrayList;
import java.util.List;

/**
 * Crack-following boundary tracer for one binary slice.
 *
 * Pixel {@code (x, y)} covers the square {@code [x, x+1] x [y, y+1]} in corner coordinates. Every edge
 * between a foreground and a background pixel is walked with the foreground on its right (y pointing
 * down), which makes outer boundaries positive and holes negative under the shoelace formula. Where two
 * foreground pixels only touch at a corner the tracer turns right, so they end up in separate loops and
 * foreground is treated as 4-connected.
 */
final class BoundaryTracer {

    static final int EAST = 0;
    static final int SOUTH = 1;
    static final int WEST = 2;
    static final int NORTH = 3;

    private static final int[] DX = {1, 0, -1, 0};
    private static final int[] DY = {0, 1, 0, -1};

    private final boolean[] foreground;
    private final int rows;
    private final int columns;
    private final int vertexColumns;
    private final boolean[] edges;
    private final boolean[] used;

    BoundaryTracer(boolean[] foreground, int rows, int columns) {
        if (foreground.length != rows * columns) {
            throw new IllegalArgumentException("Slice data does not match " + rows + "x" + columns);
        }
        this.foreground = foreground;
        this.rows = rows;
        this.columns = columns;
        this.vertexColumns = columns + 1;
        this.edges = new boolean[(rows + 1) * vertexColumns * 4];
        this.used = new boolean[edges.length];
        collectEdges();
    }

    /**
     * Trace every boundary loop of the slice.
     *
     * Loops start at the first untraced edge in raster order of its start vertex and hold only the
     * vertices where the direction changes, beginning with the first such corner.
     *
     * @return loops as arrays of {x, y} corner coordinates
     */
    List<int[][]> trace() {
        List<int[][]> loops = new ArrayList<>();
        for (int index = 0; index < edges.length; index++) {
            if (edges[index] && !used[index]) {
                loops.add(traceLoop(index));
            }
        }
        return loops;
    }

    private void collectEdges() {
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < columns; x++) {
                if (!isForeground(x, y)) {
                    continue;
                }
                if (!isForeground(x, y - 1)) {
                    edges[edgeIndex(x, y, EAST)] = true;
                }
                if (!isForeground(x + 1, y)) {
                    edges[edgeIndex(x + 1, y, SOUTH)] = true;
                }
                if (!isForeground(x, y + 1)) {
                    edges[edgeIndex(x + 1, y + 1, WEST)] = true;
                }
                if (!isForeground(x - 1, y)) {
                    edges[edgeIndex(x, y + 1, NORTH)] = true;
                }
            }
        }
    }

    private int[][] traceLoop(int startIndex) {
        List<int[]> vertices = new ArrayList<>();
        List<Integer> directions = new ArrayList<>();

        int vertex = startIndex / 4;
        int direction = startIndex % 4;
        int index = startIndex;
        do {
            used[index] = true;
            int x = vertex % vertexColumns;
            int y = vertex / vertexColumns;
            vertices.add(new int[]{x, y});
            directions.add(direction);

            int nx = x + DX[direction];
            int ny = y + DY[direction];
            direction = nextDirection(nx, ny, direction);
            vertex = ny * vertexColumns + nx;
            index = vertex * 4 + direction;
        } while (index != startIndex);

        // vertex i is entered along directions[i - 1] and left along directions[i]
        int size = vertices.size();
        List<int[]> corners = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            int incoming = directions.get((i + size - 1) % size);
            if (incoming != directions.get(i)) {
                corners.add(vertices.get(i));
            }
        }
        return corners.toArray(new int[0][]);
    }

    private int nextDirection(int x, int y, int direction) {
        int right = (direction + 1) % 4;
        if (edges[edgeIndex(x, y, right)]) {
            return right;
        }
        if (edges[edgeIndex(x, y, direction)]) {
            return direction;
        }
        int left = (direction + 3) % 4;
        if (edges[edgeIndex(x, y, left)]) {
            return left;
        }
        throw new IllegalStateException("Open boundary at corner (" + x + ", " + y + ")");
    }

    private boolean isForeground(int x, int y) {
        return x >= 0 && y >= 0 && x < columns && y < rows && foreground[y * columns + x];
    }

    private int edgeIndex(int x, int y, int direction) {
        return (y * vertexColumns + x) * 4 + direction;
    }

    /**
     * Twice the signed area of a loop in corner coordinates.
     */
    static long doubleArea(int[][] loop) {
        long sum = 0;
        for (int i = 0; i < loop.length; i++) {
            int[] a = loop[i];
            int[] b = loop[(i + 1) % loop.length];
            sum += (long) a[0] * b[1] - (long) b[0] * a[1];
        }
        return sum;
    }
}

package org.nrg.xnat.rtconvert.vector;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class BoundaryTracerTest {

    @Test
    public void singlePixelIsAClockwiseSquareInImageCoordinates() {
        List<int[][]> loops = trace(new String[]{
                "...",
                ".#.",
                "..."});

        assertEquals(1, loops.size());
        assertArrayEquals(new int[][]{{1, 1}, {2, 1}, {2, 2}, {1, 2}}, loops.get(0));
        assertEquals(2, BoundaryTracer.doubleArea(loops.get(0)));
    }

    @Test
    public void straightRunsKeepOnlyCorners() {
        List<int[][]> loops = trace(new String[]{
                "####",
                "####"});

        assertArrayEquals(new int[][]{{0, 0}, {4, 0}, {4, 2}, {0, 2}}, loops.get(0));
    }

    @Test
    public void diagonalNeighboursAreSeparateRegions() {
        List<int[][]> loops = trace(new String[]{
                "#.",
                ".#"});

        assertEquals(2, loops.size());
        assertEquals(2, BoundaryTracer.doubleArea(loops.get(0)));
        assertEquals(2, BoundaryTracer.doubleArea(loops.get(1)));
    }

    @Test
    public void holesWindTheOtherWay() {
        List<int[][]> loops = trace(new String[]{
                "###",
                "#.#",
                "###"});

        assertEquals(2, loops.size());
        assertEquals(18, BoundaryTracer.doubleArea(loops.get(0)));
        assertEquals(-2, BoundaryTracer.doubleArea(loops.get(1)));
        assertArrayEquals(new int[][]{{1, 1}, {1, 2}, {2, 2}, {2, 1}}, loops.get(1));
    }

    @Test
    public void concaveShapeTracesOneLoop() {
        List<int[][]> loops = trace(new String[]{
                "#..#",
                "####"});

        assertEquals(1, loops.size());
        assertEquals(8, loops.get(0).length);
        assertEquals(12, BoundaryTracer.doubleArea(loops.get(0)));
    }

    private static List<int[][]> trace(String[] picture) {
        int rows = picture.length;
        int columns = picture[0].length();
        boolean[] foreground = new boolean[rows * columns];
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < columns; x++) {
                foreground[y * columns + x] = picture[y].charAt(x) == '#';
            }
        }
        return new BoundaryTracer(foreground, rows, columns).trace();
    }
}

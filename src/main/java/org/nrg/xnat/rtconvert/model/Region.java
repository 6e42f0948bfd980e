package org.nrg.xnat.rtconvert.model;

import org.nrg.xnat.rtconvert.geometry.Contour;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A named region of interest and its planar contours, as authored in a structure set.
 */
public final class Region {

    private final int number;
    private final String name;
    private final String frameOfReferenceUid;
    private final int[] displayColor;
    private final String interpretedType;
    private final List<Contour> contours;

    public Region(int number, String name, String frameOfReferenceUid, int[] displayColor,
                  String interpretedType, List<Contour> contours) {
        if (name == null) {
            throw new IllegalArgumentException("Region name must not be null");
        }
        this.number = number;
        this.name = name;
        this.frameOfReferenceUid = frameOfReferenceUid;
        this.displayColor = displayColor != null ? Arrays.copyOf(displayColor, 3) : null;
        this.interpretedType = interpretedType;
        this.contours = Collections.unmodifiableList(new ArrayList<>(contours));
    }

    public Region(String name, List<Contour> contours) {
        this(0, name, null, null, null, contours);
    }

    public int getNumber() {
        return number;
    }

    /**
     * Raw name as authored in the structure set.
     */
    public String getName() {
        return name;
    }

    public String getFrameOfReferenceUid() {
        return frameOfReferenceUid;
    }

    /**
     * RGB display color, or null when the structure set does not define one.
     */
    public int[] getDisplayColor() {
        return displayColor != null ? displayColor.clone() : null;
    }

    public String getInterpretedType() {
        return interpretedType;
    }

    public List<Contour> getContours() {
        return contours;
    }

    @Override
    public String toString() {
        return "Region[" + number + ": " + name + ", " + contours.size() + " contours]";
    }
}

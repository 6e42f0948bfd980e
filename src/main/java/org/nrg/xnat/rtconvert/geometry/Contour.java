package org.nrg.xnat.rtconvert.geometry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Closed planar polygon in patient coordinates. The last point connects back to the first.
 */
public final class Contour {

    private final List<PatientPoint> points;
    private final String referencedSopInstanceUid;

    public Contour(List<PatientPoint> points) {
        this(points, null);
    }

    public Contour(List<PatientPoint> points, String referencedSopInstanceUid) {
        if (points == null) {
            throw new IllegalArgumentException("Contour points must not be null");
        }
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
        this.referencedSopInstanceUid = referencedSopInstanceUid;
    }

    /**
     * Build a contour from a flat x/y/z triplet array, as stored in Contour Data (3006,0050).
     */
    public static Contour fromFlatCoordinates(double[] data, String referencedSopInstanceUid) {
        if (data == null || data.length % 3 != 0) {
            throw new IllegalArgumentException("Contour data must be a multiple of three values");
        }
        List<PatientPoint> points = new ArrayList<>(data.length / 3);
        for (int i = 0; i < data.length; i += 3) {
            points.add(new PatientPoint(data[i], data[i + 1], data[i + 2]));
        }
        return new Contour(points, referencedSopInstanceUid);
    }

    public List<PatientPoint> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public String getReferencedSopInstanceUid() {
        return referencedSopInstanceUid;
    }

    public double[] toFlatCoordinates() {
        double[] data = new double[points.size() * 3];
        int i = 0;
        for (PatientPoint p : points) {
            data[i++] = p.getX();
            data[i++] = p.getY();
            data[i++] = p.getZ();
        }
        return data;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Contour)) {
            return false;
        }
        Contour other = (Contour) o;
        return points.equals(other.points)
                && (referencedSopInstanceUid == null
                    ? other.referencedSopInstanceUid == null
                    : referencedSopInstanceUid.equals(other.referencedSopInstanceUid));
    }

    @Override
    public int hashCode() {
        return 31 * points.hashCode() + (referencedSopInstanceUid != null ? referencedSopInstanceUid.hashCode() : 0);
    }

    @Override
    public String toString() {
        return "Contour[" + points.size() + " points]";
    }
}

package org.nrg.xnat.rtconvert.config;

import org.nrg.xnat.rtconvert.exception.InvalidConversionConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

/**
 * Numeric tolerances and worker pool sizing for conversions.
 *
 * Defaults can be overridden with system properties:
 * {@code rtconvert.slice.tolerance}, {@code rtconvert.spacing.tolerance},
 * {@code rtconvert.geometry.tolerance} and {@code rtconvert.workers}.
 */
public final class ConversionSettings {

    private static final Logger logger = LoggerFactory.getLogger(ConversionSettings.class);

    public static final String SLICE_TOLERANCE_PROPERTY = "rtconvert.slice.tolerance";
    public static final String SPACING_TOLERANCE_PROPERTY = "rtconvert.spacing.tolerance";
    public static final String GEOMETRY_TOLERANCE_PROPERTY = "rtconvert.geometry.tolerance";
    public static final String WORKERS_PROPERTY = "rtconvert.workers";

    public static final double DEFAULT_SLICE_TOLERANCE = 0.25;
    public static final double DEFAULT_SPACING_TOLERANCE = 0.01;
    public static final double DEFAULT_GEOMETRY_TOLERANCE = 1e-4;

    private final double sliceTolerance;
    private final double spacingTolerance;
    private final double geometryTolerance;
    private final int workers;

    private ConversionSettings(Builder builder) {
        this.sliceTolerance = builder.sliceTolerance;
        this.spacingTolerance = builder.spacingTolerance;
        this.geometryTolerance = builder.geometryTolerance;
        this.workers = builder.workers;
    }

    public static ConversionSettings defaults() {
        return builder().build();
    }

    public static ConversionSettings fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    public static ConversionSettings fromProperties(Properties properties) {
        Builder builder = builder();
        builder.sliceTolerance(readDouble(properties, SLICE_TOLERANCE_PROPERTY, DEFAULT_SLICE_TOLERANCE));
        builder.spacingTolerance(readDouble(properties, SPACING_TOLERANCE_PROPERTY, DEFAULT_SPACING_TOLERANCE));
        builder.geometryTolerance(readDouble(properties, GEOMETRY_TOLERANCE_PROPERTY, DEFAULT_GEOMETRY_TOLERANCE));
        builder.workers(readInt(properties, WORKERS_PROPERTY, defaultWorkers()));
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Maximum distance of a contour point from its slice plane, in voxels along the slice axis.
     */
    public double getSliceTolerance() {
        return sliceTolerance;
    }

    /**
     * Maximum deviation of a slice gap from the mean slice spacing, in millimetres.
     */
    public double getSpacingTolerance() {
        return spacingTolerance;
    }

    /**
     * Tolerance for comparing pixel spacing and direction cosines across slices.
     */
    public double getGeometryTolerance() {
        return geometryTolerance;
    }

    public int getWorkers() {
        return workers;
    }

    private static double readDouble(Properties properties, String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid value '{}' for {}, using default {}", value, key, defaultValue);
            return defaultValue;
        }
    }

    private static int readInt(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid value '{}' for {}, using default {}", value, key, defaultValue);
            return defaultValue;
        }
    }

    private static int defaultWorkers() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    @Override
    public String toString() {
        return "ConversionSettings[sliceTolerance=" + sliceTolerance
                + ", spacingTolerance=" + spacingTolerance
                + ", geometryTolerance=" + geometryTolerance
                + ", workers=" + workers + "]";
    }

    public static final class Builder {
        private double sliceTolerance = DEFAULT_SLICE_TOLERANCE;
        private double spacingTolerance = DEFAULT_SPACING_TOLERANCE;
        private double geometryTolerance = DEFAULT_GEOMETRY_TOLERANCE;
        private int workers = defaultWorkers();

        private Builder() {
        }

        public Builder sliceTolerance(double sliceTolerance) {
            this.sliceTolerance = sliceTolerance;
            return this;
        }

        public Builder spacingTolerance(double spacingTolerance) {
            this.spacingTolerance = spacingTolerance;
            return this;
        }

        public Builder geometryTolerance(double geometryTolerance) {
            this.geometryTolerance = geometryTolerance;
            return this;
        }

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public ConversionSettings build() {
            if (sliceTolerance < 0 || sliceTolerance >= 0.5) {
                throw new InvalidConversionConfigException("Slice tolerance must be in [0, 0.5), got "
                        + sliceTolerance);
            }
            if (spacingTolerance < 0 || geometryTolerance < 0) {
                throw new InvalidConversionConfigException("Tolerances must not be negative");
            }
            if (workers < 1) {
                throw new InvalidConversionConfigException("At least one worker is required, got " + workers);
            }
            return new ConversionSettings(this);
        }
    }
}

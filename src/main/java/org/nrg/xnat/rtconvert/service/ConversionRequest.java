package org.nrg.xnat.rtconvert.service;

import org.nrg.xnat.rtconvert.association.AssociationRegistry;
import org.nrg.xnat.rtconvert.exception.InvalidConversionConfigException;
import org.nrg.xnat.rtconvert.model.ImageSeries;

import java.io.File;
import java.util.UUID;

/**
 * One structure set to paint onto one image series.
 *
 * The series is either given directly or located by UID in a directory scan.
 */
public final class ConversionRequest {

    private final String id;
    private final File scanRoot;
    private final String seriesInstanceUid;
    private final ImageSeries series;
    private final File structureSetFile;
    private final AssociationRegistry registry;

    private ConversionRequest(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.scanRoot = builder.scanRoot;
        this.seriesInstanceUid = builder.series != null ? builder.series.getSeriesInstanceUid() : builder.seriesInstanceUid;
        this.series = builder.series;
        this.structureSetFile = builder.structureSetFile;
        this.registry = builder.registry;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public File getScanRoot() {
        return scanRoot;
    }

    public String getSeriesInstanceUid() {
        return seriesInstanceUid;
    }

    /**
     * The series to assemble, or null when it has to be found under {@link #getScanRoot()}.
     */
    public ImageSeries getSeries() {
        return series;
    }

    public File getStructureSetFile() {
        return structureSetFile;
    }

    public AssociationRegistry getRegistry() {
        return registry;
    }

    @Override
    public String toString() {
        return "ConversionRequest[" + id + ": series " + seriesInstanceUid + ", " + structureSetFile + "]";
    }

    public static final class Builder {
        private String id;
        private File scanRoot;
        private String seriesInstanceUid;
        private ImageSeries series;
        private File structureSetFile;
        private AssociationRegistry registry;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder scanRoot(File scanRoot) {
            this.scanRoot = scanRoot;
            return this;
        }

        public Builder seriesInstanceUid(String seriesInstanceUid) {
            this.seriesInstanceUid = seriesInstanceUid;
            return this;
        }

        public Builder series(ImageSeries series) {
            this.series = series;
            return this;
        }

        public Builder structureSetFile(File structureSetFile) {
            this.structureSetFile = structureSetFile;
            return this;
        }

        public Builder registry(AssociationRegistry registry) {
            this.registry = registry;
            return this;
        }

        public ConversionRequest build() {
            if (registry == null) {
                throw new InvalidConversionConfigException("A conversion request needs an association registry");
            }
            if (structureSetFile == null) {
                throw new InvalidConversionConfigException("A conversion request needs a structure set file");
            }
            if (series == null && (scanRoot == null || seriesInstanceUid == null)) {
                throw new InvalidConversionConfigException(
                        "A conversion request needs either a series or a scan root and series UID");
            }
            return new ConversionRequest(this);
        }
    }
}

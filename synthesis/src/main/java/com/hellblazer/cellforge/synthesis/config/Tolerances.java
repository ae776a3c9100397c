/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Cellforge.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.cellforge.synthesis.config;

/**
 * Numerical tolerances of a conversion run. Distances are in model units, angles are expressed as 1 - |cos| between
 * unit directions, so 1e-4 admits about 0.8 degrees.
 *
 * @author hal.hildebrand
 */
public final class Tolerances {

    private final boolean relativeTolerance;
    private final double  relativePrecision;
    private final double  value;
    private final double  distance;
    private final double  angle;
    private final double  planeDistance;
    private final double  planeAngle;
    private final double  cylinderDistance;
    private final double  cylinderAngle;
    private final double  sphereDistance;
    private final double  coneDistance;
    private final double  coneAngle;
    private final double  torusDistance;
    private final double  torusAngle;

    private Tolerances(Builder builder) {
        this.relativeTolerance = builder.relativeTolerance;
        this.relativePrecision = builder.relativePrecision;
        this.value = builder.value;
        this.distance = builder.distance;
        this.angle = builder.angle;
        this.planeDistance = builder.planeDistance;
        this.planeAngle = builder.planeAngle;
        this.cylinderDistance = builder.cylinderDistance;
        this.cylinderAngle = builder.cylinderAngle;
        this.sphereDistance = builder.sphereDistance;
        this.coneDistance = builder.coneDistance;
        this.coneAngle = builder.coneAngle;
        this.torusDistance = builder.torusDistance;
        this.torusAngle = builder.torusAngle;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Tolerances getDefault() {
        return new Builder().build();
    }

    /**
     * Angular tolerance of face classification: a cone whose semi-angle is this close to 0 or to a right angle is
     * degenerate
     */
    public double angle() {
        return angle;
    }

    public double coneAngle() {
        return coneAngle;
    }

    public double coneDistance() {
        return coneDistance;
    }

    public double cylinderAngle() {
        return cylinderAngle;
    }

    public double cylinderDistance() {
        return cylinderDistance;
    }

    public double distance() {
        return distance;
    }

    public double planeAngle() {
        return planeAngle;
    }

    public double planeDistance() {
        return planeDistance;
    }

    public double relativePrecision() {
        return relativePrecision;
    }

    public boolean relativeTolerance() {
        return relativeTolerance;
    }

    /**
     * The distance tolerance for comparing quantities of the given magnitude. With relative tolerances enabled it
     * grows to {@code relativePrecision * |magnitude|} for large magnitudes and never drops below the absolute one.
     */
    public double scaled(double tolerance, double magnitude) {
        if (!relativeTolerance) {
            return tolerance;
        }
        return Math.max(tolerance, relativePrecision * Math.abs(magnitude));
    }

    public double sphereDistance() {
        return sphereDistance;
    }

    public Builder toBuilder() {
        return new Builder().withRelativeTolerance(relativeTolerance)
                            .withRelativePrecision(relativePrecision)
                            .withValue(value)
                            .withDistance(distance)
                            .withAngle(angle)
                            .withPlaneDistance(planeDistance)
                            .withPlaneAngle(planeAngle)
                            .withCylinderDistance(cylinderDistance)
                            .withCylinderAngle(cylinderAngle)
                            .withSphereDistance(sphereDistance)
                            .withConeDistance(coneDistance)
                            .withConeAngle(coneAngle)
                            .withTorusDistance(torusDistance)
                            .withTorusAngle(torusAngle);
    }

    @Override
    public String toString() {
        return String.format(
        "Tolerances[relative=%s, value=%g, distance=%g, angle=%g, plane=(%g,%g), cylinder=(%g,%g), sphere=%g, cone=(%g,%g), torus=(%g,%g)]",
        relativeTolerance, value, distance, angle, planeDistance, planeAngle, cylinderDistance, cylinderAngle,
        sphereDistance, coneDistance, coneAngle, torusDistance, torusAngle);
    }

    public double torusAngle() {
        return torusAngle;
    }

    public double torusDistance() {
        return torusDistance;
    }

    /**
     * Tolerance on implicit function values, used when classifying sample points against a surface
     */
    public double value() {
        return value;
    }

    public static class Builder {
        private boolean relativeTolerance = false;
        private double  relativePrecision = 1e-6;
        private double  value             = 1e-6;
        private double  distance          = 1e-4;
        private double  angle             = 1e-4;
        private double  planeDistance     = 1e-4;
        private double  planeAngle        = 1e-4;
        private double  cylinderDistance  = 1e-4;
        private double  cylinderAngle     = 1e-4;
        private double  sphereDistance    = 1e-4;
        private double  coneDistance      = 1e-4;
        private double  coneAngle         = 1e-4;
        private double  torusDistance     = 1e-4;
        private double  torusAngle        = 1e-4;

        public Tolerances build() {
            return new Tolerances(this);
        }

        public Builder withAngle(double angle) {
            this.angle = positive("angle", angle);
            return this;
        }

        public Builder withConeAngle(double coneAngle) {
            this.coneAngle = positive("coneAngle", coneAngle);
            return this;
        }

        public Builder withConeDistance(double coneDistance) {
            this.coneDistance = positive("coneDistance", coneDistance);
            return this;
        }

        public Builder withCylinderAngle(double cylinderAngle) {
            this.cylinderAngle = positive("cylinderAngle", cylinderAngle);
            return this;
        }

        public Builder withCylinderDistance(double cylinderDistance) {
            this.cylinderDistance = positive("cylinderDistance", cylinderDistance);
            return this;
        }

        public Builder withDistance(double distance) {
            this.distance = positive("distance", distance);
            return this;
        }

        public Builder withPlaneAngle(double planeAngle) {
            this.planeAngle = positive("planeAngle", planeAngle);
            return this;
        }

        public Builder withPlaneDistance(double planeDistance) {
            this.planeDistance = positive("planeDistance", planeDistance);
            return this;
        }

        public Builder withRelativePrecision(double relativePrecision) {
            this.relativePrecision = positive("relativePrecision", relativePrecision);
            return this;
        }

        public Builder withRelativeTolerance(boolean relativeTolerance) {
            this.relativeTolerance = relativeTolerance;
            return this;
        }

        public Builder withSphereDistance(double sphereDistance) {
            this.sphereDistance = positive("sphereDistance", sphereDistance);
            return this;
        }

        public Builder withTorusAngle(double torusAngle) {
            this.torusAngle = positive("torusAngle", torusAngle);
            return this;
        }

        public Builder withTorusDistance(double torusDistance) {
            this.torusDistance = positive("torusDistance", torusDistance);
            return this;
        }

        public Builder withValue(double value) {
            this.value = positive("value", value);
            return this;
        }

        private static double positive(String name, double value) {
            if (!(value >= 0) || Double.isInfinite(value)) {
                throw new IllegalArgumentException(name + " must be a finite, non negative tolerance: " + value);
            }
            return value;
        }
    }
}

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

import java.nio.file.Path;
import java.util.List;

/**
 * Run settings: numbering offsets, void generation controls, ordering and execution parameters.
 *
 * @author hal.hildebrand
 */
public final class Settings {

    private final Path                 outPath;
    private final boolean              voidGen;
    private final boolean              debug;
    private final SimplifyMode         simplify;
    private final double               minVoidSize;
    private final int                  maxSurf;
    private final int                  maxBracket;
    private final int                  maxSplitDepth;
    private final List<String>         voidExclude;
    private final int                  startCell;
    private final int                  startSurf;
    private final boolean              sortEnclosure;
    private final List<Integer>        skipSolids;
    private final SplineSurfaces       splineSurfaces;
    private final double               boxPadding;
    private final int                  parallelism;
    private final EnclosureAttribution enclosureAttribution;
    private final boolean              exportSuspicious;

    private Settings(Builder builder) {
        this.outPath = builder.outPath;
        this.voidGen = builder.voidGen;
        this.debug = builder.debug;
        this.simplify = builder.simplify;
        this.minVoidSize = builder.minVoidSize;
        this.maxSurf = builder.maxSurf;
        this.maxBracket = builder.maxBracket;
        this.maxSplitDepth = builder.maxSplitDepth;
        this.voidExclude = List.copyOf(builder.voidExclude);
        this.startCell = builder.startCell;
        this.startSurf = builder.startSurf;
        this.sortEnclosure = builder.sortEnclosure;
        this.skipSolids = List.copyOf(builder.skipSolids);
        this.splineSurfaces = builder.splineSurfaces;
        this.boxPadding = builder.boxPadding;
        this.parallelism = builder.parallelism;
        this.enclosureAttribution = builder.enclosureAttribution;
        this.exportSuspicious = builder.exportSuspicious;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Settings getDefault() {
        return new Builder().build();
    }

    public double boxPadding() {
        return boxPadding;
    }

    /**
     * Offset added to every final cell label, labels start at offset + 1
     */
    public int cellOffset() {
        return startCell - 1;
    }

    public boolean debug() {
        return debug;
    }

    public EnclosureAttribution enclosureAttribution() {
        return enclosureAttribution;
    }

    public boolean exportSuspicious() {
        return exportSuspicious;
    }

    public int maxBracket() {
        return maxBracket;
    }

    public int maxSplitDepth() {
        return maxSplitDepth;
    }

    public int maxSurf() {
        return maxSurf;
    }

    public double minVoidSize() {
        return minVoidSize;
    }

    public Path outPath() {
        return outPath;
    }

    public int parallelism() {
        return parallelism;
    }

    public SimplifyMode simplify() {
        return simplify;
    }

    public List<Integer> skipSolids() {
        return skipSolids;
    }

    public boolean sortEnclosure() {
        return sortEnclosure;
    }

    public SplineSurfaces splineSurfaces() {
        return splineSurfaces;
    }

    public int startCell() {
        return startCell;
    }

    public int startSurf() {
        return startSurf;
    }

    /**
     * Offset added to every surface id, ids start at offset + 1
     */
    public int surfaceOffset() {
        return startSurf - 1;
    }

    public Builder toBuilder() {
        return new Builder().withOutPath(outPath)
                            .withVoidGen(voidGen)
                            .withDebug(debug)
                            .withSimplify(simplify)
                            .withMinVoidSize(minVoidSize)
                            .withMaxSurf(maxSurf)
                            .withMaxBracket(maxBracket)
                            .withMaxSplitDepth(maxSplitDepth)
                            .withVoidExclude(voidExclude)
                            .withStartCell(startCell)
                            .withStartSurf(startSurf)
                            .withSortEnclosure(sortEnclosure)
                            .withSkipSolids(skipSolids)
                            .withSplineSurfaces(splineSurfaces)
                            .withBoxPadding(boxPadding)
                            .withParallelism(parallelism)
                            .withEnclosureAttribution(enclosureAttribution)
                            .withExportSuspicious(exportSuspicious);
    }

    @Override
    public String toString() {
        return String.format(
        "Settings[voidGen=%s, simplify=%s, maxSurf=%d, maxBracket=%d, startCell=%d, startSurf=%d, sortEnclosure=%s, parallelism=%d]",
        voidGen, simplify, maxSurf, maxBracket, startCell, startSurf, sortEnclosure, parallelism);
    }

    public List<String> voidExclude() {
        return voidExclude;
    }

    public boolean voidGen() {
        return voidGen;
    }

    public static class Builder {
        private Path                 outPath              = Path.of(".");
        private boolean              voidGen              = true;
        private boolean              debug                = false;
        private SimplifyMode         simplify             = SimplifyMode.VOID;
        private double               minVoidSize          = 200.0;
        private int                  maxSurf              = 50;
        private int                  maxBracket           = 30;
        private int                  maxSplitDepth        = 12;
        private List<String>         voidExclude          = List.of();
        private int                  startCell            = 1;
        private int                  startSurf            = 1;
        private boolean              sortEnclosure        = false;
        private List<Integer>        skipSolids           = List.of();
        private SplineSurfaces       splineSurfaces       = SplineSurfaces.STOP;
        private double               boxPadding           = 10.0;
        private int                  parallelism          = 1;
        private EnclosureAttribution enclosureAttribution = EnclosureAttribution.OUTERMOST_FIRST;
        private boolean              exportSuspicious     = true;

        public Settings build() {
            return new Settings(this);
        }

        public Builder withBoxPadding(double boxPadding) {
            if (!(boxPadding >= 0) || Double.isInfinite(boxPadding)) {
                throw new IllegalArgumentException("boxPadding must be finite and non negative: " + boxPadding);
            }
            this.boxPadding = boxPadding;
            return this;
        }

        public Builder withDebug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public Builder withEnclosureAttribution(EnclosureAttribution enclosureAttribution) {
            this.enclosureAttribution = nonNull("enclosureAttribution", enclosureAttribution);
            return this;
        }

        public Builder withExportSuspicious(boolean exportSuspicious) {
            this.exportSuspicious = exportSuspicious;
            return this;
        }

        public Builder withMaxBracket(int maxBracket) {
            this.maxBracket = atLeastOne("maxBracket", maxBracket);
            return this;
        }

        public Builder withMaxSplitDepth(int maxSplitDepth) {
            if (maxSplitDepth < 0) {
                throw new IllegalArgumentException("maxSplitDepth must not be negative: " + maxSplitDepth);
            }
            this.maxSplitDepth = maxSplitDepth;
            return this;
        }

        public Builder withMaxSurf(int maxSurf) {
            this.maxSurf = atLeastOne("maxSurf", maxSurf);
            return this;
        }

        public Builder withMinVoidSize(double minVoidSize) {
            if (!(minVoidSize >= 0)) {
                throw new IllegalArgumentException("minVoidSize must not be negative: " + minVoidSize);
            }
            this.minVoidSize = minVoidSize;
            return this;
        }

        public Builder withOutPath(Path outPath) {
            this.outPath = nonNull("outPath", outPath);
            return this;
        }

        public Builder withParallelism(int parallelism) {
            this.parallelism = atLeastOne("parallelism", parallelism);
            return this;
        }

        public Builder withSimplify(SimplifyMode simplify) {
            this.simplify = nonNull("simplify", simplify);
            return this;
        }

        public Builder withSkipSolids(List<Integer> skipSolids) {
            for (var index : nonNull("skipSolids", skipSolids)) {
                if (index == null || index < 0) {
                    throw new IllegalArgumentException("skipSolids must contain non negative indices: " + skipSolids);
                }
            }
            this.skipSolids = List.copyOf(skipSolids);
            return this;
        }

        public Builder withSortEnclosure(boolean sortEnclosure) {
            this.sortEnclosure = sortEnclosure;
            return this;
        }

        public Builder withSplineSurfaces(SplineSurfaces splineSurfaces) {
            this.splineSurfaces = nonNull("splineSurfaces", splineSurfaces);
            return this;
        }

        public Builder withStartCell(int startCell) {
            this.startCell = atLeastOne("startCell", startCell);
            return this;
        }

        public Builder withStartSurf(int startSurf) {
            this.startSurf = atLeastOne("startSurf", startSurf);
            return this;
        }

        public Builder withVoidExclude(List<String> voidExclude) {
            this.voidExclude = List.copyOf(nonNull("voidExclude", voidExclude));
            return this;
        }

        public Builder withVoidGen(boolean voidGen) {
            this.voidGen = voidGen;
            return this;
        }

        private static int atLeastOne(String name, int value) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be at least 1: " + value);
            }
            return value;
        }

        private static <T> T nonNull(String name, T value) {
            if (value == null) {
                throw new IllegalArgumentException(name + " must not be null");
            }
            return value;
        }
    }
}

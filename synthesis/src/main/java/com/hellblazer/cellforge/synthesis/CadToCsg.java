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
package com.hellblazer.cellforge.synthesis;

import com.hellblazer.cellforge.common.ParallelTasks;
import com.hellblazer.cellforge.geometry.Box;
import com.hellblazer.cellforge.synthesis.Diagnostic.Stage;
import com.hellblazer.cellforge.synthesis.UnsupportedGeometryException.Reason;
import com.hellblazer.cellforge.synthesis.bool.BooleanSimplifier;
import com.hellblazer.cellforge.synthesis.bool.ComparisonTableBuilder;
import com.hellblazer.cellforge.synthesis.bool.ExpressionFormatter;
import com.hellblazer.cellforge.synthesis.bool.SimplifyOutcome;
import com.hellblazer.cellforge.synthesis.build.BuildResult;
import com.hellblazer.cellforge.synthesis.build.CellDefinitionBuilder;
import com.hellblazer.cellforge.synthesis.build.ConeRecord;
import com.hellblazer.cellforge.synthesis.cell.SolidEntity;
import com.hellblazer.cellforge.synthesis.cone.ConePlanePostProcessor;
import com.hellblazer.cellforge.synthesis.config.ConversionConfig;
import com.hellblazer.cellforge.synthesis.config.NumericFormat;
import com.hellblazer.cellforge.synthesis.config.Options;
import com.hellblazer.cellforge.synthesis.config.Settings;
import com.hellblazer.cellforge.synthesis.config.SimplifyMode;
import com.hellblazer.cellforge.synthesis.config.Tolerances;
import com.hellblazer.cellforge.synthesis.kernel.SolidKernel;
import com.hellblazer.cellforge.synthesis.numbering.CellNumbering;
import com.hellblazer.cellforge.synthesis.numbering.OrderedEntry.CellEntry;
import com.hellblazer.cellforge.synthesis.overlap.OverlapResolver;
import com.hellblazer.cellforge.synthesis.surface.SurfaceFormatter;
import com.hellblazer.cellforge.synthesis.surface.SurfaceRegistry;
import com.hellblazer.cellforge.synthesis.voids.VoidGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts loaded CAD solids into numbered CSG cells. A run goes through the stages in a fixed order: cell building,
 * optional overlap removal, enclosure building, void generation, simplification, numbering and cone patching. Each
 * stage may work on several cells at once, but never starts before the previous one is done.
 * <p>
 * Problems confined to one cell are recorded as {@link Diagnostic}s and the run goes on; only unsupported enclosure
 * geometry, or unsupported solid geometry when so configured, stops it.
 *
 * @param <S> the kernel's solid type
 * @param <F> the kernel's face type
 * @author hal.hildebrand
 */
public class CadToCsg<S, F> {
    private static final Logger log       = LoggerFactory.getLogger(CadToCsg.class);
    private static final Logger solidsLog = LoggerFactory.getLogger("cellforge.solids");

    private final SolidKernel<S, F>    kernel;
    private final List<SolidEntity<S>> solids      = new ArrayList<>();
    private final List<SolidEntity<S>> enclosures  = new ArrayList<>();
    private final List<Diagnostic>     diagnostics = new ArrayList<>();
    private ConversionConfig           config;
    private int                        loadDiagnostics;

    public CadToCsg(SolidKernel<S, F> kernel) {
        this(kernel, ConversionConfig.getDefault());
    }

    public CadToCsg(SolidKernel<S, F> kernel, ConversionConfig config) {
        if (kernel == null) {
            throw new IllegalArgumentException("Kernel must not be null");
        }
        this.kernel = kernel;
        setConfig(config);
    }

    public ConversionConfig getConfig() {
        return config;
    }

    public List<SolidEntity<S>> getEnclosures() {
        return Collections.unmodifiableList(enclosures);
    }

    public List<SolidEntity<S>> getSolids() {
        return Collections.unmodifiableList(solids);
    }

    /**
     * Take in the solids and enclosures of one or more models. Identities are renumbered across the models: solids
     * first, 1 to n, then the enclosures. Indices of {@code Settings.skipSolids} refer to the joined solid list.
     *
     * @throws UnsupportedGeometryException if an enclosure, or with {@code splineSurfaces = STOP} a solid, has surfaces
     *                                      the engine cannot model
     */
    @SafeVarargs
    public final CadToCsg<S, F> load(LoadedModel<S>... models) {
        solids.clear();
        enclosures.clear();
        diagnostics.clear();
        loadDiagnostics = 0;
        for (var model : models) {
            solids.addAll(model.solids());
            enclosures.addAll(model.enclosures());
        }
        var identity = 0;
        for (var solid : solids) {
            solid.reset();
            solid.setIdentity(++identity);
        }
        for (var enclosure : enclosures) {
            enclosure.reset();
            enclosure.setIdentity(++identity);
        }

        var settings = config.settings();
        var skip = settings.skipSolids().stream().sorted(Collections.reverseOrder()).distinct().toList();
        for (var index : skip) {
            if (index < 0 || index >= solids.size()) {
                throw new IllegalArgumentException(
                "Skipped solid index " + index + " out of range, " + solids.size() + " solids loaded");
            }
            log.info("Removing solid index: {} from list of {} solids", index, solids.size());
            solids.remove((int) index);
        }

        for (var enclosure : enclosures) {
            if (kernel.hasUnsupportedSurfaces(enclosure.getSolid())) {
                throw new UnsupportedGeometryException(Reason.UNSUPPORTED_SURFACE_IN_ENCLOSURE,
                                                       enclosure.getIdentity(),
                                                       "Enclosure " + enclosure.getEnclosureId()
                                                       + " has surfaces that cannot be converted");
            }
        }
        var iterator = solids.iterator();
        while (iterator.hasNext()) {
            var solid = iterator.next();
            if (!kernel.hasUnsupportedSurfaces(solid.getSolid())) {
                continue;
            }
            switch (settings.splineSurfaces()) {
                case STOP -> throw new UnsupportedGeometryException(Reason.UNSUPPORTED_SURFACE_IN_SOLID,
                                                                    solid.getIdentity(), "Solid " + solid.getIdentity()
                                                                    + " has surfaces that cannot be converted");
                case REMOVE -> {
                    iterator.remove();
                    diagnose(solid, Stage.LOAD, "Removed, has surfaces that cannot be converted");
                }
                case IGNORE -> diagnose(solid, Stage.LOAD, "Has surfaces that cannot be converted, converting anyway");
            }
        }
        loadDiagnostics = diagnostics.size();
        log.info("Loaded {} solids and {} enclosures from {} models", solids.size(), enclosures.size(),
                 models.length);
        return this;
    }

    public void setConfig(ConversionConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Configuration must not be null");
        }
        this.config = config;
    }

    public void setNumericFormat(NumericFormat numericFormat) {
        setConfig(new ConversionConfig(config.options(), config.tolerances(), numericFormat, config.settings()));
    }

    public void setOptions(Options options) {
        setConfig(new ConversionConfig(options, config.tolerances(), config.numericFormat(), config.settings()));
    }

    public void setSettings(Settings settings) {
        setConfig(new ConversionConfig(config.options(), config.tolerances(), config.numericFormat(), settings));
    }

    public void setTolerances(Tolerances tolerances) {
        setConfig(new ConversionConfig(config.options(), tolerances, config.numericFormat(), config.settings()));
    }

    /**
     * Run the conversion of the loaded model. Each run starts from the loaded solids again; the cells are shared with
     * the results of earlier runs, which are relabelled by a later one.
     *
     * @throws IllegalStateException if no solid is loaded
     * @throws InterruptedException  if interrupted while parallel stages are running
     */
    public ConversionResult<S> start() throws InterruptedException {
        if (solids.isEmpty()) {
            throw new IllegalStateException("No solid selected to translate");
        }
        diagnostics.subList(loadDiagnostics, diagnostics.size()).clear();
        solids.forEach(SolidEntity::reset);
        enclosures.forEach(SolidEntity::reset);
        var settings = config.settings();
        var options = config.options();
        var timings = new EnumMap<Stage, Duration>(Stage.class);

        var box = Box.union(solids.stream().map(s -> kernel.boundingBox(s.getSolid())).toList())
                     .enlarged(settings.boxPadding());
        var registry = new SurfaceRegistry(config.tolerances(), settings.surfaceOffset());
        var builder = new CellDefinitionBuilder<>(kernel, registry);
        var cones = new HashMap<Integer, ConeRecord>();
        var warned = new ArrayList<SolidEntity<S>>();
        log.info("Bounding box of the model: {}", box);

        var mark = System.nanoTime();
        debugExport(solids, "origSolid_");
        var built = ParallelTasks.map(solids, s -> builder.build(s.getSolid()), settings.parallelism());
        for (int i = 0; i < solids.size(); i++) {
            accept(solids.get(i), i, built.get(i), cones, warned, "Solid_original_");
        }
        mark = time(timings, Stage.BUILD, mark);

        if (options.forceNoOverlap()) {
            var resolver = new OverlapResolver(kernel, registry, options);
            for (var emptied : resolver.resolve(solids, cones)) {
                diagnose(emptied, Stage.OVERLAP, "Fully covered by earlier cells, removed");
            }
            mark = time(timings, Stage.OVERLAP, mark);
        }

        var voids = new ArrayList<SolidEntity<S>>();
        if (settings.voidGen()) {
            if (!enclosures.isEmpty()) {
                debugExport(enclosures, "origEnclosure_");
                var enclosureResults = ParallelTasks.map(enclosures, e -> builder.build(e.getSolid()),
                                                         settings.parallelism());
                for (int i = 0; i < enclosures.size(); i++) {
                    accept(enclosures.get(i), i, enclosureResults.get(i), cones, warned, "Enclosure_original_");
                }
            }
            var startId = solids.size() + enclosures.size();
            for (var cell : solids) {
                startId = Math.max(startId, cell.getIdentity());
            }
            for (var cell : enclosures) {
                startId = Math.max(startId, cell.getIdentity());
            }
            var generator = new VoidGenerator(kernel, registry, settings);
            voids.addAll(generator.generate(solids, enclosures, box, startId));
            voids.stream()
                 .filter(SolidEntity::isNullCell)
                 .forEach(v -> diagnose(v, Stage.VOID, "Void cell is empty, removed"));
            mark = time(timings, Stage.VOID, mark);
        }

        if (settings.simplify() == SimplifyMode.FULL) {
            simplify(registry, options);
            mark = time(timings, Stage.SIMPLIFY, mark);
        }

        var numbering = new CellNumbering(settings.cellOffset(), settings.sortEnclosure(),
                                          settings.enclosureAttribution());
        var entries = numbering.number(solids, voids, enclosures);
        mark = time(timings, Stage.NUMBERING, mark);

        reportWarnings(warned);

        var cells = new ArrayList<SolidEntity<S>>(solids);
        cells.addAll(voids);
        var enclosureCones = new HashMap<Integer, ConeRecord>();
        for (var enclosure : enclosures) {
            var record = cones.get(enclosure.getIdentity());
            if (record != null) {
                enclosureCones.put(enclosure.getEnclosureId(), record);
            }
        }
        var patched = new ConePlanePostProcessor().patch(cells, cones, enclosureCones);
        if (patched > 0) {
            log.info("Restricted {} cone references to one nappe", patched);
        }
        time(timings, Stage.CONE, mark);

        if (settings.debug() && log.isDebugEnabled()) {
            var formatter = new SurfaceFormatter(config.numericFormat());
            registry.surfaces().forEach(surface -> log.debug("{}", formatter.format(surface)));
        }
        log.info("Conversion finished: {} surfaces, {} cells, {} diagnostics", registry.size(),
                 entries.stream().filter(CellEntry.class::isInstance).count(),
                 diagnostics.size());
        return new ConversionResult<>(entries, registry, box, diagnostics, timings);
    }

    private void accept(SolidEntity<S> cell, int index, BuildResult result, Map<Integer, ConeRecord> cones,
                        List<SolidEntity<S>> warned, String exportPrefix) {
        cell.setDefinition(result.definition());
        cell.setBounds(result.bounds());
        if (result.cones() != null) {
            cones.put(cell.getIdentity(), result.cones());
        }
        if (!result.warning()) {
            return;
        }
        warned.add(cell);
        for (var warning : result.warnings()) {
            diagnose(cell, Stage.BUILD, warning);
        }
        if (config.settings().exportSuspicious()) {
            export(cell, config.settings().outPath().resolve("suspicious_solids").resolve(exportPrefix + index));
        }
    }

    private void debugExport(List<SolidEntity<S>> cells, String prefix) {
        if (!config.settings().debug()) {
            return;
        }
        var folder = config.settings().outPath().resolve("debug");
        for (int i = 0; i < cells.size(); i++) {
            export(cells.get(i), folder.resolve(prefix + i));
        }
    }

    private void diagnose(SolidEntity<S> cell, Stage stage, String message) {
        var diagnostic = new Diagnostic(cell.getIdentity(), cell.getComment(), stage, message);
        log.warn("{}", diagnostic);
        diagnostics.add(diagnostic);
    }

    private void export(SolidEntity<S> cell, Path target) {
        try {
            kernel.export(List.of(cell.getSolid()), target);
        } catch (IOException e) {
            log.warn("Unable to export solid {} to {}: {}", cell.getIdentity(), target, e.getMessage(), e);
            diagnose(cell, Stage.DECOMPOSITION, "Export to " + target + " failed: " + e.getMessage());
        }
    }

    private void reportWarnings(List<SolidEntity<S>> warned) {
        if (warned.isEmpty()) {
            return;
        }
        var lines = new StringBuilder();
        for (var kind : new boolean[] { false, true }) {
            var group = warned.stream().filter(c -> c.isEnclosure() == kind).toList();
            if (group.isEmpty()) {
                continue;
            }
            lines.append(kind ? "Enclosures :" : "Solids :").append(System.lineSeparator());
            for (var cell : group) {
                lines.append(System.lineSeparator())
                     .append(cell.getLabel())
                     .append(System.lineSeparator())
                     .append(cell.getComment())
                     .append(System.lineSeparator())
                     .append(ExpressionFormatter.format(cell.getDefinition()))
                     .append(System.lineSeparator());
            }
        }
        solidsLog.info("{}", lines);
    }

    private void simplify(SurfaceRegistry registry, Options options) throws InterruptedException {
        var tables = new ComparisonTableBuilder(kernel, registry);
        var simplifier = new BooleanSimplifier();
        var candidates = solids.stream()
                               .filter(c -> !c.isNullCell() && c.getDefinition().level() > 0)
                               .toList();
        var outcomes = ParallelTasks.map(candidates, cell -> {
            var definition = cell.getDefinition();
            var region = cell.getBounds().enlarged(options.enlargeBox());
            return simplifier.simplify(definition, tables.build(definition.surfaces(), region));
        }, config.settings().parallelism());
        for (int i = 0; i < candidates.size(); i++) {
            var cell = candidates.get(i);
            if (outcomes.get(i) == SimplifyOutcome.EMPTY) {
                cell.markNull();
                diagnose(cell, Stage.SIMPLIFY, "Cell is empty after simplification, removed");
            } else if (outcomes.get(i) == SimplifyOutcome.UNIVERSE) {
                diagnose(cell, Stage.SIMPLIFY, "Unexpected constant cell, covers its whole region");
            }
        }
    }

    private long time(Map<Stage, Duration> timings, Stage stage, long since) {
        var now = System.nanoTime();
        timings.merge(stage, Duration.ofNanos(now - since), Duration::plus);
        log.info("{} stage took {} ms", stage, (now - since) / 1_000_000);
        return now;
    }
}

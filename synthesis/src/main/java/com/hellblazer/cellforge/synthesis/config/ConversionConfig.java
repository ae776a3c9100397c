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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * The four configuration groups of a conversion run, loadable from a JSON document whose top level keys are
 * {@code Tolerances}, {@code Options}, {@code NumericFormat} and {@code Settings}. Missing groups and missing fields
 * keep their defaults; unknown keys are rejected.
 *
 * @author hal.hildebrand
 */
public record ConversionConfig(Options options, Tolerances tolerances, NumericFormat numericFormat, Settings settings) {
    private static final Logger       log          = LoggerFactory.getLogger(ConversionConfig.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public ConversionConfig {
        if (options == null || tolerances == null || numericFormat == null || settings == null) {
            throw new IllegalArgumentException("Configuration groups must not be null");
        }
    }

    public static ConversionConfig getDefault() {
        return new ConversionConfig(Options.getDefault(), Tolerances.getDefault(), NumericFormat.getDefault(),
                                    Settings.getDefault());
    }

    /**
     * Load a configuration file
     *
     * @throws IOException              if the file cannot be read or is not JSON
     * @throws IllegalArgumentException if the document contains an invalid key or value
     */
    public static ConversionConfig fromJson(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Config file " + file + " not found");
        }
        try (var is = Files.newInputStream(file)) {
            var config = fromJson(is);
            log.info("Loaded configuration from {}", file);
            return config;
        }
    }

    public static ConversionConfig fromJson(InputStream is) throws IOException {
        var root = objectMapper.readTree(is);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Configuration must be a JSON object");
        }
        var config = getDefault();
        var iterator = root.fields();
        while (iterator.hasNext()) {
            var entry = iterator.next();
            var node = entry.getValue();
            config = switch (entry.getKey()) {
                case "Tolerances" -> new ConversionConfig(config.options, parseTolerances(node), config.numericFormat,
                                                          config.settings);
                case "Options" -> new ConversionConfig(parseOptions(node), config.tolerances, config.numericFormat,
                                                       config.settings);
                case "NumericFormat" -> new ConversionConfig(config.options, config.tolerances,
                                                             parseNumericFormat(node), config.settings);
                case "Settings" -> new ConversionConfig(config.options, config.tolerances, config.numericFormat,
                                                        parseSettings(node));
                default -> throw new IllegalArgumentException("Invalid key '" + entry.getKey()
                                                              + "' found in configuration. Acceptable key names are 'Tolerances', 'Options', 'NumericFormat' and 'Settings'");
            };
        }
        return config;
    }

    private static boolean bool(String key, JsonNode value) {
        if (!value.isBoolean()) {
            throw new IllegalArgumentException(key + " should be a boolean, not " + value.getNodeType());
        }
        return value.booleanValue();
    }

    private static <E extends Enum<E>> E enumValue(String key, JsonNode value, Class<E> type) {
        try {
            return Enum.valueOf(type, text(key, value).toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value.asText(), e);
        }
    }

    private static int integer(String key, JsonNode value) {
        if (!value.isIntegralNumber()) {
            throw new IllegalArgumentException(key + " should be an integer, not " + value.getNodeType());
        }
        return value.intValue();
    }

    private static double number(String key, JsonNode value) {
        if (!value.isNumber()) {
            throw new IllegalArgumentException(key + " should be a number, not " + value.getNodeType());
        }
        return value.doubleValue();
    }

    private static NumericFormat parseNumericFormat(JsonNode node) {
        requireObject("NumericFormat", node);
        var d = NumericFormat.getDefault();
        String[] values = { d.planeNormal(), d.planeDistance(), d.sphereCenter(), d.sphereRadius(), d.cylinderAxis(),
                            d.cylinderRadius(), d.coneApex(), d.coneAngle(), d.torusCenter(), d.torusRadii() };
        var names = List.of("planeNormal", "planeDistance", "sphereCenter", "sphereRadius", "cylinderAxis",
                            "cylinderRadius", "coneApex", "coneAngle", "torusCenter", "torusRadii");
        var fields = node.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            var index = names.indexOf(field.getKey());
            if (index < 0) {
                throw unknown("NumericFormat", field.getKey());
            }
            values[index] = text(field.getKey(), field.getValue());
        }
        return new NumericFormat(values[0], values[1], values[2], values[3], values[4], values[5], values[6],
                                 values[7], values[8], values[9]);
    }

    private static Options parseOptions(JsonNode node) {
        requireObject("Options", node);
        var options = Options.getDefault();
        var fields = node.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            var key = field.getKey();
            var value = field.getValue();
            options = switch (key) {
                case "enlargeBox" -> options.withEnlargeBox(number(key, value));
                case "forceNoOverlap" -> options.withForceNoOverlap(bool(key, value));
                default -> throw unknown("Options", key);
            };
        }
        return options;
    }

    private static Settings parseSettings(JsonNode node) {
        requireObject("Settings", node);
        var builder = Settings.builder();
        var fields = node.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            var key = field.getKey();
            var value = field.getValue();
            switch (key) {
                case "outPath" -> builder.withOutPath(Path.of(text(key, value)));
                case "voidGen" -> builder.withVoidGen(bool(key, value));
                case "debug" -> builder.withDebug(bool(key, value));
                case "simplify" -> builder.withSimplify(enumValue(key, value, SimplifyMode.class));
                case "minVoidSize" -> builder.withMinVoidSize(number(key, value));
                case "maxSurf" -> builder.withMaxSurf(integer(key, value));
                case "maxBracket" -> builder.withMaxBracket(integer(key, value));
                case "maxSplitDepth" -> builder.withMaxSplitDepth(integer(key, value));
                case "voidExclude" -> builder.withVoidExclude(textList(key, value));
                case "startCell" -> builder.withStartCell(integer(key, value));
                case "startSurf" -> builder.withStartSurf(integer(key, value));
                case "sortEnclosure" -> builder.withSortEnclosure(bool(key, value));
                case "skipSolids" -> builder.withSkipSolids(integerList(key, value));
                case "splineSurfaces" -> builder.withSplineSurfaces(enumValue(key, value, SplineSurfaces.class));
                case "boxPadding" -> builder.withBoxPadding(number(key, value));
                case "parallelism" -> builder.withParallelism(integer(key, value));
                case "enclosureAttribution" -> builder.withEnclosureAttribution(
                enumValue(key, value, EnclosureAttribution.class));
                case "exportSuspicious" -> builder.withExportSuspicious(bool(key, value));
                default -> throw unknown("Settings", key);
            }
        }
        return builder.build();
    }

    private static Tolerances parseTolerances(JsonNode node) {
        requireObject("Tolerances", node);
        var builder = Tolerances.builder();
        var fields = node.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            var key = field.getKey();
            var value = field.getValue();
            switch (key) {
                case "relativeTolerance" -> builder.withRelativeTolerance(bool(key, value));
                case "relativePrecision" -> builder.withRelativePrecision(number(key, value));
                case "value" -> builder.withValue(number(key, value));
                case "distance" -> builder.withDistance(number(key, value));
                case "angle" -> builder.withAngle(number(key, value));
                case "planeDistance" -> builder.withPlaneDistance(number(key, value));
                case "planeAngle" -> builder.withPlaneAngle(number(key, value));
                case "cylinderDistance" -> builder.withCylinderDistance(number(key, value));
                case "cylinderAngle" -> builder.withCylinderAngle(number(key, value));
                case "sphereDistance" -> builder.withSphereDistance(number(key, value));
                case "coneDistance" -> builder.withConeDistance(number(key, value));
                case "coneAngle" -> builder.withConeAngle(number(key, value));
                case "torusDistance" -> builder.withTorusDistance(number(key, value));
                case "torusAngle" -> builder.withTorusAngle(number(key, value));
                default -> throw unknown("Tolerances", key);
            }
        }
        return builder.build();
    }

    private static void requireObject(String group, JsonNode node) {
        if (!node.isObject()) {
            throw new IllegalArgumentException(group + " should be a JSON object, not " + node.getNodeType());
        }
    }

    private static String text(String key, JsonNode value) {
        if (!value.isTextual()) {
            throw new IllegalArgumentException(key + " should be a string, not " + value.getNodeType());
        }
        return value.textValue();
    }

    private static List<Integer> integerList(String key, JsonNode value) {
        if (!value.isArray()) {
            throw new IllegalArgumentException(key + " should be an array, not " + value.getNodeType());
        }
        var result = new ArrayList<Integer>();
        for (var element : value) {
            result.add(integer(key, element));
        }
        return result;
    }

    private static List<String> textList(String key, JsonNode value) {
        if (!value.isArray()) {
            throw new IllegalArgumentException(key + " should be an array, not " + value.getNodeType());
        }
        var result = new ArrayList<String>();
        for (var element : value) {
            result.add(text(key, element));
        }
        return result;
    }

    private static IllegalArgumentException unknown(String group, String key) {
        return new IllegalArgumentException("Invalid key '" + key + "' in " + group);
    }
}

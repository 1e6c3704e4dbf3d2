/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Arbiter.
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
package com.hellblazer.arbiter.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.hellblazer.arbiter.actor.LawFlag;
import com.hellblazer.arbiter.faction.FactionId;
import com.hellblazer.arbiter.faction.FactionRelation;
import com.hellblazer.arbiter.faction.FactionRelationMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Locale;

/**
 * Loads engagement tunables and the faction table from JSON classpath resources.
 * <p>
 * Resources:
 * <ul>
 *   <li>{@value #ENGAGEMENT_RESOURCE}: an {@code engagement} object; missing keys keep their defaults</li>
 *   <li>{@value #FACTIONS_RESOURCE}: {@code defaultRelation}, a {@code relations} list of
 *   {@code {viewer, target, relation}} and a {@code lawEnforcement} object mapping law flags to faction lists</li>
 * </ul>
 * A missing resource falls back to the built-in defaults. A resource that exists but cannot be parsed is a
 * configuration error and is reported, not guessed around.
 *
 * @author hal.hildebrand
 */
public class ArbiterConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ArbiterConfigLoader.class);

    public static final String ENGAGEMENT_RESOURCE = "/arbiter.json";
    public static final String FACTIONS_RESOURCE   = "/factions.json";

    private final ObjectMapper objectMapper;

    public ArbiterConfigLoader() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Load engagement tunables from {@value #ENGAGEMENT_RESOURCE}
     */
    public EngagementConfig loadEngagementConfig() {
        try (var is = ArbiterConfigLoader.class.getResourceAsStream(ENGAGEMENT_RESOURCE)) {
            if (is == null) {
                log.info("No {} on classpath, using default engagement tunables", ENGAGEMENT_RESOURCE);
                return EngagementConfig.defaults();
            }
            return parseEngagementConfig(is);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read " + ENGAGEMENT_RESOURCE, e);
        }
    }

    /**
     * Load the faction table from {@value #FACTIONS_RESOURCE}
     */
    public FactionRelationMatrix loadFactionMatrix() {
        try (var is = ArbiterConfigLoader.class.getResourceAsStream(FACTIONS_RESOURCE)) {
            if (is == null) {
                log.info("No {} on classpath, using the standard faction table", FACTIONS_RESOURCE);
                return FactionRelationMatrix.standard();
            }
            return parseFactionMatrix(is);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read " + FACTIONS_RESOURCE, e);
        }
    }

    /**
     * Parse engagement tunables from a stream
     */
    public EngagementConfig parseEngagementConfig(InputStream is) throws IOException {
        var root = objectMapper.readTree(is);
        var node = root.has("engagement") ? root.get("engagement") : root;
        var defaults = EngagementConfig.defaults();

        var sweepIntervalMillis = node.has("sweepIntervalMillis") ? node.get("sweepIntervalMillis").asLong()
                                                                  : defaults.sweepIntervalMillis();
        var targetedExtends = node.has("targetedExtendsEngagement")
                              ? node.get("targetedExtendsEngagement").asBoolean()
                              : defaults.targetedExtendsEngagement();

        var config = new EngagementConfig(doubleOr(node, "disengageSeconds", defaults.disengageSeconds()),
                                          sweepIntervalMillis, targetedExtends,
                                          doubleOr(node, "meleeRange", defaults.meleeRange()),
                                          doubleOr(node, "rangedRange", defaults.rangedRange()),
                                          doubleOr(node, "spellRange", defaults.spellRange()),
                                          doubleOr(node, "rangeBuffer", defaults.rangeBuffer()));
        log.info("Loaded engagement tunables: {}", config);
        if (config.targetedExtendsEngagement()) {
            log.warn("targetedExtendsEngagement is enabled: selection will extend the target's combat window");
        }
        return config;
    }

    /**
     * Parse a faction table from a stream
     */
    public FactionRelationMatrix parseFactionMatrix(InputStream is) throws IOException {
        var root = objectMapper.readTree(is);
        var builder = FactionRelationMatrix.builder();

        if (root.has("defaultRelation")) {
            builder.defaultRelation(parseEnum(FactionRelation.class, root.get("defaultRelation")));
        }

        var relations = root.get("relations");
        int count = 0;
        if (relations != null && relations.isArray()) {
            for (var entry : relations) {
                var viewer = parseEnum(FactionId.class, entry.get("viewer"));
                var target = parseEnum(FactionId.class, entry.get("target"));
                var relation = parseEnum(FactionRelation.class, entry.get("relation"));
                if (entry.has("symmetric") && entry.get("symmetric").asBoolean()) {
                    builder.symmetric(viewer, target, relation);
                } else {
                    builder.relation(viewer, target, relation);
                }
                count++;
            }
        }

        var law = root.get("lawEnforcement");
        if (law != null && law.isObject()) {
            var names = law.fieldNames();
            while (names.hasNext()) {
                var name = names.next();
                var flag = parseEnum(LawFlag.class, TextNode.valueOf(name));
                var enforcers = new ArrayList<FactionId>();
                for (var faction : law.get(name)) {
                    enforcers.add(parseEnum(FactionId.class, faction));
                }
                builder.lawEnforcement(flag, enforcers);
            }
        }

        var matrix = builder.build();
        log.info("Loaded faction table: {} relation entries, {}", count, matrix);
        return matrix;
    }

    private static double doubleOr(JsonNode node, String field, double fallback) {
        return node.has(field) ? node.get(field).asDouble() : fallback;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, JsonNode node) throws IOException {
        if (node == null || !node.isTextual()) {
            throw new IOException("Expected " + type.getSimpleName() + " name, got " + node);
        }
        try {
            return Enum.valueOf(type, node.asText().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IOException("Unknown " + type.getSimpleName() + ": " + node.asText(), e);
        }
    }
}

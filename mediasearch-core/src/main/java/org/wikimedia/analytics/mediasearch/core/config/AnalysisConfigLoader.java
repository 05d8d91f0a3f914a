/**
 * Copyright (C) 2020  Wikimedia Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.wikimedia.analytics.mediasearch.core.config;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.apache.log4j.Logger;
import org.wikimedia.analytics.mediasearch.core.RunWindow;
import org.wikimedia.analytics.mediasearch.core.aggregate.SessionDimension;
import org.wikimedia.analytics.mediasearch.core.analysis.Analysis;
import org.wikimedia.analytics.mediasearch.core.analysis.FilterUsageAnalysis;
import org.wikimedia.analytics.mediasearch.core.analysis.FunnelAnalysis;
import org.wikimedia.analytics.mediasearch.core.funnel.EventPredicate;
import org.wikimedia.analytics.mediasearch.core.funnel.EventPredicates;
import org.wikimedia.analytics.mediasearch.core.funnel.FunnelDefinition;
import org.wikimedia.analytics.mediasearch.core.funnel.FunnelStep;

/**
 * Loads analysis definitions from YAML (or JSON).
 *
 * Usage:
 *
 * AnalysisConfigLoader loader = new AnalysisConfigLoader();
 * // The definitions bundled with this library
 * List&lt;Analysis&gt; analyses = loader.loadDefault();
 * // Or definitions from a file
 * List&lt;Analysis&gt; analyses = loader.load(new File("/path/to/analyses.yaml"));
 *
 * Funnel steps and filters are predicates written as objects whose keys
 * are all required to match:
 * <ul>
 *   <li>action: an action name, or a list of alternative names</li>
 *   <li>attributes: attribute name to expected value</li>
 *   <li>has_attribute: an attribute name, or a list of them</li>
 *   <li>any_of, all_of: lists of predicates</li>
 *   <li>not: a predicate</li>
 * </ul>
 * See analyses.yaml for complete examples.
 */
public class AnalysisConfigLoader {

    public static final String DEFAULT_RESOURCE = "/analyses.yaml";

    public static final String TYPE_FUNNEL = "funnel";
    public static final String TYPE_FILTER_USAGE = "filter_usage";

    private static final Set<String> STEP_KEYS = new HashSet<>(Arrays.asList("name", "required", "anchor"));

    private static final Logger log = Logger.getLogger(AnalysisConfigLoader.class.getName());

    // Make sure to reuse, expensive to create.
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public List<Analysis> loadDefault() throws ConfigLoadingException {
        try (InputStream in = AnalysisConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new ConfigLoadingException("Resource " + DEFAULT_RESOURCE + " is not on the classpath");
            }
            return load(in, DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new ConfigLoadingException("Failed reading " + DEFAULT_RESOURCE, e);
        }
    }

    public List<Analysis> load(File file) throws ConfigLoadingException {
        try (InputStream in = new FileInputStream(file)) {
            return load(in, file.getPath());
        } catch (IOException e) {
            throw new ConfigLoadingException("Failed reading analysis definitions from " + file, e);
        }
    }

    public List<Analysis> load(InputStream in, String source) throws ConfigLoadingException {
        JsonNode root;
        try {
            root = yamlMapper.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadingException("Failed parsing analysis definitions from " + source, e);
        }
        if (root == null) {
            throw new ConfigLoadingException("No analysis definitions in " + source);
        }
        List<Analysis> analyses = parse(root);
        log.debug("Loaded " + analyses.size() + " analyses from " + source);
        return analyses;
    }

    public List<Analysis> parse(JsonNode root) throws ConfigLoadingException {
        JsonNode analysesNode = root.path("analyses");
        if (!analysesNode.isArray() || analysesNode.size() == 0) {
            throw new ConfigLoadingException("Expected a non empty 'analyses' list");
        }
        List<Analysis> analyses = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (JsonNode node : analysesNode) {
            Analysis analysis = parseAnalysis(node);
            if (!names.add(analysis.getName())) {
                throw new ConfigLoadingException("Analysis " + analysis.getName() + " is defined twice");
            }
            analyses.add(analysis);
        }
        return analyses;
    }

    private Analysis parseAnalysis(JsonNode node) throws ConfigLoadingException {
        String name = requiredText(node, "name", "analysis");
        String type = requiredText(node, "type", name);
        Duration grace = RunWindow.DEFAULT_CUTOFF_GRACE;
        if (node.has("cutoff_grace_minutes")) {
            JsonNode minutes = node.get("cutoff_grace_minutes");
            if (!minutes.canConvertToLong() || minutes.asLong() < 0) {
                throw new ConfigLoadingException("Analysis " + name
                    + " needs a non negative number of cutoff_grace_minutes, got " + minutes);
            }
            grace = Duration.ofMinutes(minutes.asLong());
        }

        try {
            if (TYPE_FUNNEL.equals(type)) {
                return parseFunnelAnalysis(node, name, grace);
            } else if (TYPE_FILTER_USAGE.equals(type)) {
                return new FilterUsageAnalysis(
                    name,
                    parsePredicate(required(node, "session_start", name), name + ".session_start"),
                    parsePredicate(required(node, "filter_change", name), name + ".filter_change"),
                    requiredText(node, "type_attribute", name),
                    requiredText(node, "value_attribute", name),
                    requiredText(node, "change_table", name),
                    requiredText(node, "session_table", name),
                    grace
                );
            }
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigLoadingException("Invalid analysis " + name + ": " + e.getMessage(), e);
        }
        throw new ConfigLoadingException("Analysis " + name + " has unknown type '" + type + "'");
    }

    private FunnelAnalysis parseFunnelAnalysis(JsonNode node, String name, Duration grace)
        throws ConfigLoadingException {

        JsonNode funnelsNode = required(node, "funnels", name);
        if (!funnelsNode.isArray() || funnelsNode.size() == 0) {
            throw new ConfigLoadingException("Analysis " + name + " needs a non empty 'funnels' list");
        }
        List<FunnelDefinition> variants = new ArrayList<>();
        List<String> variantNames = new ArrayList<>();
        for (JsonNode funnelNode : funnelsNode) {
            String variant = funnelNode.path("variant").asText(null);
            List<FunnelStep> steps = new ArrayList<>();
            for (JsonNode stepNode : required(funnelNode, "steps", name)) {
                steps.add(parseStep(stepNode, name));
            }
            variants.add(new FunnelDefinition(name, variant, steps));
            if (variant != null) {
                variantNames.add(variant);
            }
        }

        List<SessionDimension> dimensions = new ArrayList<>();
        if (node.has("variant_column")) {
            dimensions.add(SessionDimension.variant(node.get("variant_column").asText())
                .withDeclaredValues(variantNames));
        }
        for (JsonNode dimensionNode : node.path("dimensions")) {
            String column = requiredText(dimensionNode, "column", name);
            SessionDimension dimension = SessionDimension.stepAttribute(
                column,
                requiredText(dimensionNode, "step", name + "." + column),
                requiredText(dimensionNode, "attribute", name + "." + column),
                dimensionNode.path("default").asText(SessionDimension.UNKNOWN_LABEL)
            );
            if (dimensionNode.has("values")) {
                dimension = dimension.withDeclaredValues(textList(dimensionNode.get("values")));
            }
            dimensions.add(dimension);
        }

        FunnelAnalysis.ClickPositions clickPositions = null;
        if (node.has("click_positions")) {
            JsonNode positions = node.get("click_positions");
            clickPositions = new FunnelAnalysis.ClickPositions(
                requiredText(positions, "table", name + ".click_positions"),
                requiredText(positions, "step", name + ".click_positions"),
                requiredText(positions, "attribute", name + ".click_positions")
            );
        }

        return new FunnelAnalysis(name, requiredText(node, "table", name), variants, dimensions, grace,
            clickPositions);
    }

    private FunnelStep parseStep(JsonNode node, String analysis) throws ConfigLoadingException {
        String stepName = requiredText(node, "name", analysis + " step");
        EventPredicate predicate = parsePredicate(node, analysis + "." + stepName);
        if (node.path("required").asBoolean(true)) {
            return FunnelStep.required(stepName, predicate);
        }
        return FunnelStep.branch(stepName, predicate, requiredText(node, "anchor", analysis + "." + stepName));
    }

    /**
     * Parses a predicate object, all of its keys must match.
     */
    public EventPredicate parsePredicate(JsonNode node, String where) throws ConfigLoadingException {
        if (node == null || !node.isObject()) {
            throw new ConfigLoadingException("Expected a predicate object at " + where);
        }
        List<EventPredicate> predicates = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode value = field.getValue();
            switch (key) {
                case "action":
                    predicates.add(EventPredicates.action(textList(value)));
                    break;
                case "attributes":
                    Iterator<Map.Entry<String, JsonNode>> attributes = value.fields();
                    while (attributes.hasNext()) {
                        Map.Entry<String, JsonNode> attribute = attributes.next();
                        predicates.add(EventPredicates.attributeEquals(attribute.getKey(), attribute.getValue().asText()));
                    }
                    break;
                case "has_attribute":
                    for (String attribute : textList(value)) {
                        predicates.add(EventPredicates.hasAttribute(attribute));
                    }
                    break;
                case "any_of":
                    predicates.add(EventPredicates.anyOf(parsePredicates(value, where + ".any_of")));
                    break;
                case "all_of":
                    predicates.add(EventPredicates.allOf(parsePredicates(value, where + ".all_of")));
                    break;
                case "not":
                    predicates.add(EventPredicates.not(parsePredicate(value, where + ".not")));
                    break;
                default:
                    if (!STEP_KEYS.contains(key)) {
                        throw new ConfigLoadingException("Unknown predicate key '" + key + "' at " + where);
                    }
            }
        }
        if (predicates.isEmpty()) {
            throw new ConfigLoadingException("Empty predicate at " + where);
        }
        return EventPredicates.allOf(predicates);
    }

    private List<EventPredicate> parsePredicates(JsonNode node, String where) throws ConfigLoadingException {
        if (!node.isArray() || node.size() == 0) {
            throw new ConfigLoadingException("Expected a non empty predicate list at " + where);
        }
        List<EventPredicate> predicates = new ArrayList<>();
        for (JsonNode child : node) {
            predicates.add(parsePredicate(child, where));
        }
        return predicates;
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode child : node) {
                values.add(child.asText());
            }
        } else {
            values.add(node.asText());
        }
        return values;
    }

    private static JsonNode required(JsonNode node, String field, String where) throws ConfigLoadingException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new ConfigLoadingException("Missing '" + field + "' in " + where);
        }
        return value;
    }

    private static String requiredText(JsonNode node, String field, String where) throws ConfigLoadingException {
        String value = required(node, field, where).asText();
        if (value.isEmpty()) {
            throw new ConfigLoadingException("Empty '" + field + "' in " + where);
        }
        return value;
    }
}

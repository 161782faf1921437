/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.tessera.orchestration;

import dev.mars.tessera.core.exceptions.WorkflowValidationException;
import dev.mars.tessera.workflow.WorkflowParseException;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static dev.mars.tessera.workflow.DefinitionMaps.getDuration;
import static dev.mars.tessera.workflow.DefinitionMaps.getInt;
import static dev.mars.tessera.workflow.DefinitionMaps.getMapList;
import static dev.mars.tessera.workflow.DefinitionMaps.getString;
import static dev.mars.tessera.workflow.DefinitionMaps.getStringList;
import static dev.mars.tessera.workflow.DefinitionMaps.requireString;

/**
 * Loads coordination patterns from YAML. A document holds either a single pattern or a
 * {@code patterns} list.
 *
 * <pre>
 * patterns:
 *   - name: lead_to_booking
 *     expectedDuration: 5m
 *     successCriteria: [lead_qualified, booking_confirmed]
 *     fallbackActions: [escalate_to_human]
 *     steps:
 *       - worker: Nyra
 *         eventType: capture
 *       - worker: Solari
 *         eventType: book
 *         retryCount: 1
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class YamlCoordinationPatternParser {

    private final Yaml yaml;

    public YamlCoordinationPatternParser() {
        this.yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
    }

    public List<CoordinationPattern> parse(Path yamlFile) throws WorkflowParseException {
        try {
            return parseFromString(Files.readString(yamlFile));
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read YAML file: " + yamlFile, e);
        }
    }

    @SuppressWarnings("unchecked")
    public List<CoordinationPattern> parseFromString(String yamlContent) throws WorkflowParseException {
        Object data;
        try {
            data = yaml.load(yamlContent);
        } catch (YAMLException e) {
            throw new WorkflowParseException("YAML parsing failed", e);
        }
        if (!(data instanceof Map)) {
            throw new WorkflowParseException("Empty or invalid YAML content");
        }
        Map<String, Object> document = (Map<String, Object>) data;
        List<CoordinationPattern> patterns = new ArrayList<>();
        if (document.containsKey("patterns")) {
            List<Map<String, Object>> entries = getMapList(document, "patterns", "document");
            for (int i = 0; i < entries.size(); i++) {
                patterns.add(toPattern(entries.get(i), "patterns[" + i + "]"));
            }
        } else {
            patterns.add(toPattern(document, "pattern"));
        }
        return patterns;
    }

    private CoordinationPattern toPattern(Map<String, Object> data, String path) throws WorkflowParseException {
        String name = requireString(data, "name", path);
        CoordinationPattern.Builder builder = CoordinationPattern.builder(name)
                .expectedDuration(getDuration(data, "expectedDuration", null, path))
                .successCriteria(getStringList(data, "successCriteria"))
                .fallbackActions(getStringList(data, "fallbackActions"));

        List<Map<String, Object>> steps = getMapList(data, "steps", path);
        for (int i = 0; i < steps.size(); i++) {
            builder.step(toStep(steps.get(i), path + ".steps[" + i + "]"));
        }
        try {
            return builder.build();
        } catch (WorkflowValidationException e) {
            throw new WorkflowParseException("Pattern '" + name + "' is invalid: " +
                    e.getValidationResult().describeErrors(), e);
        }
    }

    private PatternStep toStep(Map<String, Object> data, String path) throws WorkflowParseException {
        PatternStep.Builder builder = PatternStep.builder(requireString(data, "worker", path),
                requireString(data, "eventType", path));
        String name = getString(data, "name");
        if (name != null) {
            builder.name(name);
        }
        if (data.containsKey("nextOnSuccess")) {
            builder.nextOnSuccess(getString(data, "nextOnSuccess"));
        }
        int retryCount = getInt(data, "retryCount", 0, path);
        if (retryCount < 0) {
            throw new WorkflowParseException(path + ".retryCount", "Retry count cannot be negative", null);
        }
        return builder.retryCount(retryCount).build();
    }
}

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

package dev.mars.tessera.workflow;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * YAML-based implementation of WorkflowDefinitionParser.
 * Parses YAML workflow definitions using SnakeYAML.
 *
 * <pre>
 * id: orders
 * initialState: start
 * states:
 *   - name: start
 *     transitions: [to_processing]
 *   - name: approved
 *     terminal: true
 * transitions:
 *   - name: approve
 *     from: processing
 *     to: approved
 *     retryCount: 3
 *     retryDelay: 500ms
 *     conditions:
 *       - operator: AND
 *         conditions:
 *           - field: orderValue
 *             operator: greater_than
 *             value: 1000
 *     routing:
 *       "priority == high": escalated
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class YamlWorkflowDefinitionParser implements WorkflowDefinitionParser {

    private final Yaml yaml;
    private final WorkflowDefinitionMapper mapper = new WorkflowDefinitionMapper();

    public YamlWorkflowDefinitionParser() {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
    }

    @Override
    public WorkflowDefinition parse(Path yamlFile) throws WorkflowParseException {
        try {
            String content = Files.readString(yamlFile);
            return parseFromString(content);
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read YAML file: " + yamlFile, e);
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public WorkflowDefinition parseFromString(String yamlContent) throws WorkflowParseException {
        Object data;
        try {
            data = yaml.load(yamlContent);
        } catch (YAMLException e) {
            throw new WorkflowParseException("YAML parsing failed", e);
        }
        if (!(data instanceof Map)) {
            throw new WorkflowParseException("Empty or invalid YAML content");
        }
        return mapper.toDefinition((Map<String, Object>) data);
    }
}

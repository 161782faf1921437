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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads workflow definitions written as JSON, using the same field names as the YAML format.
 */
public class JsonWorkflowDefinitionParser implements WorkflowDefinitionParser {

    private static final TypeReference<Map<String, Object>> DOCUMENT = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final WorkflowDefinitionMapper mapper = new WorkflowDefinitionMapper();

    public JsonWorkflowDefinitionParser() {
        this(new ObjectMapper());
    }

    public JsonWorkflowDefinitionParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public WorkflowDefinition parse(Path jsonFile) throws WorkflowParseException {
        try {
            return parseFromString(Files.readString(jsonFile));
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read JSON file: " + jsonFile, e);
        }
    }

    @Override
    public WorkflowDefinition parseFromString(String jsonContent) throws WorkflowParseException {
        Map<String, Object> data;
        try {
            data = objectMapper.readValue(jsonContent, DOCUMENT);
        } catch (JsonProcessingException e) {
            throw new WorkflowParseException("JSON parsing failed: " + e.getOriginalMessage(), e);
        }
        if (data == null) {
            throw new WorkflowParseException("Empty JSON content");
        }
        return mapper.toDefinition(data);
    }
}

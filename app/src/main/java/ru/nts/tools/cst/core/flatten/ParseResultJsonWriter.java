/*
 * Copyright 2025 Aristo
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
package ru.nts.tools.cst.core.flatten;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.cst.core.extract.ParameterInfo;
import ru.nts.tools.cst.core.policy.RecordField;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;
import java.util.Set;

/**
 * JSON-представление результата.
 * Набор полей каждого узла определяется политикой: незапрошенные поля не выводятся.
 */
public final class ParseResultJsonWriter {

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final ObjectMapper prettyMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private ParseResultJsonWriter() {}

    public static ObjectNode toJson(ParseResult result) {
        ObjectNode root = mapper.createObjectNode();
        root.put("language", result.language());
        root.put("file_path", result.filePath());
        root.put("node_count", result.nodeCount());
        root.put("max_depth", result.maxDepth());
        root.put("parse_time", result.parseTime() != null ? result.parseTime().toString() : null);

        ArrayNode columns = root.putArray("columns");
        result.columns().forEach(columns::add);

        Set<RecordField> fields = result.policy().fields();
        ArrayNode nodes = root.putArray("nodes");
        for (NodeRecord node : result.nodes()) {
            nodes.add(nodeToJson(node, fields));
        }
        return root;
    }

    /**
     * Один узел: только перечисленные поля.
     */
    public static ObjectNode nodeToJson(NodeRecord node, Set<RecordField> fields) {
        ObjectNode json = mapper.createObjectNode();
        for (RecordField field : fields) {
            Object value = node.value(field);
            String column = field.column();
            if (value == null) {
                json.putNull(column);
            } else if (value instanceof Integer number) {
                json.put(column, number);
            } else if (value instanceof Boolean flag) {
                json.put(column, flag);
            } else if (field == RecordField.PARAMETERS) {
                json.set(column, parametersToJson(castParameters(value)));
            } else if (value instanceof List<?> list) {
                ArrayNode array = json.putArray(column);
                list.forEach(item -> array.add(String.valueOf(item)));
            } else {
                json.put(column, value.toString());
            }
        }
        return json;
    }

    public static ArrayNode parametersToJson(List<ParameterInfo> parameters) {
        ArrayNode array = mapper.createArrayNode();
        for (ParameterInfo param : parameters) {
            ObjectNode item = array.addObject();
            item.put("name", param.name());
            item.put("type", param.type());
            item.put("default_value", param.defaultValue());
            item.put("is_optional", param.isOptional());
            item.put("is_variadic", param.isVariadic());
            item.put("annotations", param.annotations());
        }
        return array;
    }

    @SuppressWarnings("unchecked")
    private static List<ParameterInfo> castParameters(Object value) {
        return (List<ParameterInfo>) value;
    }

    public static String toJsonString(ParseResult result, boolean pretty) {
        try {
            return (pretty ? prettyMapper : mapper).writeValueAsString(toJson(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize parse result", e);
        }
    }

    /**
     * Пишет компактный JSON, writer не закрывается.
     */
    public static void write(ParseResult result, Writer writer) {
        try {
            writer.write(toJsonString(result, false));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

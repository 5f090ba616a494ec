package com.iptvcheck.validator.application.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.iptvcheck.validator.core.exception.InvalidFixPayloadException;
import com.iptvcheck.validator.core.model.ExtinfAttributes;
import com.iptvcheck.validator.core.model.FixOperation;
import com.iptvcheck.validator.core.model.RebuildAttributesFix;
import com.iptvcheck.validator.core.model.ReorderStreamUrlFix;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts fix lists to and from JSON so they can be handed to a client and replayed later
 * without running the analysis again.
 * <p>
 * Wire format: an array of objects tagged by {@code type}, e.g.
 * {@code {"type":"reorder_stream_url","line_num":3,"original_stream_line_num":5,"stream_url":"http://...","channel_name":"News"}}.
 */
@Component
public class FixOperationCodec {

    static final String TYPE_REBUILD = "rebuild_extinf_attributes";
    static final String TYPE_REORDER = "reorder_stream_url";

    private final ObjectMapper objectMapper;

    public FixOperationCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(List<? extends FixOperation> fixes) {
        ArrayNode array = objectMapper.createArrayNode();
        for (FixOperation fix : fixes) {
            array.add(toNode(fix));
        }
        try {
            return objectMapper.writeValueAsString(array);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize fix operations", e);
        }
    }

    /**
     * Reads a fix list produced by {@link #toJson}.
     *
     * @throws InvalidFixPayloadException when the text is not a valid fix list
     */
    public List<FixOperation> fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidFixPayloadException("Fix list must not be empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidFixPayloadException("Fix list is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (!root.isArray()) {
            throw new InvalidFixPayloadException("Fix list must be a JSON array");
        }

        List<FixOperation> fixes = new ArrayList<>();
        for (JsonNode node : root) {
            fixes.add(fromNode(node));
        }
        return fixes;
    }

    private ObjectNode toNode(FixOperation fix) {
        ObjectNode node = objectMapper.createObjectNode();
        if (fix instanceof RebuildAttributesFix rebuild) {
            node.put("type", TYPE_REBUILD);
            node.put("line_num", rebuild.getLineNum());
            node.put("duration", rebuild.getDuration());
            node.put("channel_name", rebuild.getChannelName());
            ObjectNode attributes = node.putObject("final_attributes");
            rebuild.getFinalAttributes().asMap().forEach(attributes::put);
        } else if (fix instanceof ReorderStreamUrlFix reorder) {
            node.put("type", TYPE_REORDER);
            node.put("line_num", reorder.getLineNum());
            node.put("original_stream_line_num", reorder.getOriginalStreamLineNum());
            node.put("stream_url", reorder.getStreamUrl());
            node.put("channel_name", reorder.getChannelName());
        } else {
            throw new IllegalArgumentException("Unsupported fix type: " + fix.getClass().getName());
        }
        return node;
    }

    private FixOperation fromNode(JsonNode node) {
        String type = requireText(node, "type");
        int lineNum = requireInt(node, "line_num");
        String channelName = node.path("channel_name").asText("");

        switch (type) {
            case TYPE_REBUILD:
                JsonNode attributesNode = node.get("final_attributes");
                if (attributesNode == null || !attributesNode.isObject()) {
                    throw new InvalidFixPayloadException("Fix at line " + lineNum + " has no 'final_attributes' object");
                }
                Map<String, String> attributes = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> fields = attributesNode.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    attributes.put(field.getKey(), field.getValue().isNull() ? "" : field.getValue().asText());
                }
                return new RebuildAttributesFix(lineNum, requireText(node, "duration"), channelName,
                        ExtinfAttributes.of(attributes));
            case TYPE_REORDER:
                return new ReorderStreamUrlFix(lineNum, requireInt(node, "original_stream_line_num"),
                        requireText(node, "stream_url"), channelName);
            default:
                throw new InvalidFixPayloadException("Unknown fix type '" + type + "'");
        }
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            throw new InvalidFixPayloadException("Fix is missing '" + field + "'");
        }
        return value.asText();
    }

    private static int requireInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new InvalidFixPayloadException("Fix is missing integer '" + field + "'");
        }
        return value.intValue();
    }
}

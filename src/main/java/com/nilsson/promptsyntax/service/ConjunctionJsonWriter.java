package com.nilsson.promptsyntax.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nilsson.promptsyntax.model.Attention;
import com.nilsson.promptsyntax.model.Blend;
import com.nilsson.promptsyntax.model.BlendablePrompt;
import com.nilsson.promptsyntax.model.Conjunction;
import com.nilsson.promptsyntax.model.ConjunctionPart;
import com.nilsson.promptsyntax.model.CrossAttentionControlSubstitute;
import com.nilsson.promptsyntax.model.FlatElement;
import com.nilsson.promptsyntax.model.FlattenedPrompt;
import com.nilsson.promptsyntax.model.Fragment;
import com.nilsson.promptsyntax.model.OptionValue;
import com.nilsson.promptsyntax.model.Prompt;
import com.nilsson.promptsyntax.model.PromptElement;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/**
 Exports a {@link Conjunction}, flattened or not, as a Jackson tree for downstream consumers.
 Every node becomes an object with a {@code "type"} field.
 */
public class ConjunctionJsonWriter {

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public ObjectNode toJson(Conjunction conjunction) {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode parts = root.putArray("parts");
        for (ConjunctionPart part : conjunction.parts()) {
            parts.add(part(part));
        }
        ArrayNode weights = root.putArray("weights");
        conjunction.weights().forEach(weights::add);
        return root;
    }

    public String write(Conjunction conjunction) {
        try {
            return mapper.writeValueAsString(toJson(conjunction));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize conjunction", e);
        }
    }

    // --- Parts ---

    private ObjectNode part(ConjunctionPart part) {
        if (part instanceof Blend blend) {
            ObjectNode node = mapper.createObjectNode();
            node.put("type", "blend");
            ArrayNode weights = node.putArray("weights");
            blend.weights().forEach(weights::add);
            node.put("normalize_weights", blend.normalizeWeights());
            ArrayNode children = node.putArray("children");
            for (BlendablePrompt child : blend.children()) {
                children.add(part(child));
            }
            return node;
        }
        if (part instanceof FlattenedPrompt flattened) {
            ObjectNode node = mapper.createObjectNode();
            node.put("type", "flattened_prompt");
            ArrayNode children = node.putArray("children");
            for (FlatElement child : flattened.children()) {
                children.add(element(child));
            }
            return node;
        }
        ObjectNode node = mapper.createObjectNode();
        node.put("type", "prompt");
        node.set("children", elements(((Prompt) part).children()));
        return node;
    }

    // --- Elements ---

    private ArrayNode elements(List<PromptElement> elements) {
        ArrayNode array = mapper.createArrayNode();
        for (PromptElement element : elements) {
            array.add(element(element));
        }
        return array;
    }

    private ObjectNode element(Object element) {
        ObjectNode node = mapper.createObjectNode();
        if (element instanceof Fragment fragment) {
            node.put("type", "fragment");
            node.put("text", fragment.text());
            node.put("weight", fragment.weight());
        } else if (element instanceof Attention attention) {
            node.put("type", "attention");
            node.put("weight", attention.weight());
            node.set("children", elements(attention.children()));
        } else if (element instanceof CrossAttentionControlSubstitute substitute) {
            node.put("type", "swap");
            node.set("original", elements(substitute.original()));
            node.set("edited", elements(substitute.edited()));
            ObjectNode options = node.putObject("options");
            for (Map.Entry<String, OptionValue> entry : substitute.options().asMap().entrySet()) {
                OptionValue value = entry.getValue();
                if (value instanceof OptionValue.NumberValue number) {
                    options.put(entry.getKey(), number.value());
                } else if (value instanceof OptionValue.TextValue text) {
                    options.put(entry.getKey(), text.value());
                } else if (value instanceof OptionValue.FlagValue flag) {
                    options.put(entry.getKey(), flag.value());
                }
            }
        } else {
            throw new IllegalArgumentException("Unknown prompt element: " + element);
        }
        return node;
    }
}

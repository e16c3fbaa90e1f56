/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.modelweave.expr.api.exceptions.ExpressionCodecException;
import com.modelweave.expr.api.model.Compound;
import com.modelweave.expr.api.model.ElementReference;
import com.modelweave.expr.api.model.Expression;
import com.modelweave.expr.api.model.ExpressionType;
import com.modelweave.expr.api.model.Literal;
import com.modelweave.expr.api.model.Operation;
import com.modelweave.expr.api.model.Operator;
import com.modelweave.expr.api.model.Reference;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the persisted expression JSON:
 * <pre>
 * {"type": "OPERATION", "value": null, "operator": "SUBTRACT",
 *  "leftOperand": {...}, "rightOperand": {...},
 *  "references": [{"elementName": "Place", "attributeName": "tokens"}],
 *  "isNested": false}
 * </pre>
 *
 * <p>Expressions are stored inside pattern element attribute maps and in a
 * rule's global expression field, so the codec works on Jackson trees as well
 * as on strings. An operator name this version does not know decodes to a
 * null operator; the evaluator reports it when the node is evaluated.
 */
public class ExpressionJsonCodec {

    private final ObjectMapper objectMapper;

    public ExpressionJsonCodec() {
        this(new ObjectMapper());
    }

    public ExpressionJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(Expression expression) {
        try {
            return objectMapper.writeValueAsString(toTree(expression));
        } catch (JsonProcessingException e) {
            throw new ExpressionCodecException("Failed to write expression JSON: " + e.getOriginalMessage(), e);
        }
    }

    public Expression fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new ExpressionCodecException("Expression JSON is empty");
        }
        try {
            return fromTree(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new ExpressionCodecException("Malformed expression JSON: " + e.getOriginalMessage(), e);
        }
    }

    public ObjectNode toTree(Expression expression) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", expression.type().getValue());

        if (expression instanceof Literal literal) {
            node.set("value", objectMapper.valueToTree(literal.value()));
        } else {
            node.putNull("value");
        }

        if (expression instanceof Operation operation) {
            writeOperator(node, operation.operator());
            writeOperand(node, "leftOperand", operation.leftOperand());
            writeOperand(node, "rightOperand", operation.rightOperand());
        } else if (expression instanceof Compound compound) {
            writeOperator(node, compound.operator());
            writeOperand(node, "leftOperand", compound.leftOperand());
            writeOperand(node, "rightOperand", compound.rightOperand());
        }

        if (!(expression instanceof Literal) && !(expression instanceof Compound)) {
            ArrayNode references = node.putArray("references");
            for (ElementReference ref : expression.references()) {
                references.addObject()
                        .put("elementName", ref.elementName())
                        .put("attributeName", ref.attributeName());
            }
        }

        if (expression.isNested()) {
            node.put("isNested", true);
        }
        return node;
    }

    public Expression fromTree(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ExpressionCodecException("Expression must be a JSON object");
        }
        ExpressionType type = ExpressionType.fromString(node.path("type").asText(null));
        if (type == null) {
            throw new ExpressionCodecException("Unknown expression type: " + node.path("type").asText());
        }
        boolean nested = node.path("isNested").asBoolean(false);

        switch (type) {
            case LITERAL:
                return new Literal(readScalar(node.get("value")), nested);
            case REFERENCE:
                return new Reference(readReferences(node.get("references")), nested);
            case OPERATION: {
                Expression left = readOperand(node.get("leftOperand"));
                Expression right = readOperand(node.get("rightOperand"));
                List<ElementReference> references = node.hasNonNull("references")
                        ? readReferences(node.get("references"))
                        : Expression.mergeReferences(left, right);
                return new Operation(readOperator(node), left, right, references, nested);
            }
            case COMPOUND:
                return new Compound(readOperator(node),
                        readOperand(node.get("leftOperand")),
                        readOperand(node.get("rightOperand")),
                        nested);
            default:
                throw new ExpressionCodecException("Unsupported expression type: " + type);
        }
    }

    /**
     * Interprets a stored pattern element attribute value. Expression JSON
     * (as a tree, or as the map Jackson produces for it) becomes an
     * {@link Expression}; any other value becomes a literal.
     *
     * @return the expression, or null for a null value
     */
    public Expression readAttributeValue(Object stored) {
        if (stored == null) {
            return null;
        }
        if (stored instanceof Expression expression) {
            return expression;
        }
        if (stored instanceof JsonNode tree) {
            return looksLikeExpression(tree) ? fromTree(tree) : Expression.literal(readScalar(tree));
        }
        if (stored instanceof Map<?, ?> map && map.containsKey("type")) {
            JsonNode tree = objectMapper.valueToTree(map);
            if (looksLikeExpression(tree)) {
                return fromTree(tree);
            }
        }
        return Expression.literal(stored);
    }

    private static boolean looksLikeExpression(JsonNode tree) {
        return tree.isObject() && ExpressionType.fromString(tree.path("type").asText(null)) != null;
    }

    private void writeOperator(ObjectNode node, Operator operator) {
        if (operator != null) {
            node.put("operator", operator.getValue());
        }
    }

    private void writeOperand(ObjectNode node, String field, Expression operand) {
        if (operand != null) {
            node.set(field, toTree(operand));
        }
    }

    private Expression readOperand(JsonNode node) {
        return node == null || node.isNull() ? null : fromTree(node);
    }

    private static Operator readOperator(JsonNode node) {
        return Operator.fromString(node.path("operator").asText(null));
    }

    private static List<ElementReference> readReferences(JsonNode node) {
        List<ElementReference> references = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return references;
        }
        for (JsonNode ref : node) {
            String elementName = ref.path("elementName").asText(null);
            String attributeName = ref.path("attributeName").asText(null);
            if (elementName == null || attributeName == null) {
                throw new ExpressionCodecException("Reference requires elementName and attributeName: " + ref);
            }
            references.add(new ElementReference(elementName, attributeName));
        }
        return references;
    }

    private static Object readScalar(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        if (node.isBoolean()) return node.booleanValue();
        if (node.isIntegralNumber()) return node.canConvertToLong() ? node.longValue() : node.bigIntegerValue();
        if (node.isNumber()) return node.doubleValue();
        if (node.isTextual()) return node.textValue();
        return node.toString();
    }
}

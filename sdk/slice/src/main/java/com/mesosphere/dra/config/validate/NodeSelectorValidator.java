package com.mesosphere.dra.config.validate;

import com.mesosphere.dra.specification.NodeSelector;
import com.mesosphere.dra.specification.NodeSelectorRequirement;
import com.mesosphere.dra.specification.NodeSelectorTerm;
import com.mesosphere.dra.specification.SpecCollections;
import com.mesosphere.dra.specification.validation.IdentifierValidation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks the node selector of a slice. Slices only support a single selector term.
 */
final class NodeSelectorValidator {

  private static final String NODE_NAME_FIELD = "metadata.name";

  private static final List<String> SUPPORTED_OPERATORS = Arrays.asList(
      NodeSelectorRequirement.OP_DOES_NOT_EXIST,
      NodeSelectorRequirement.OP_EXISTS,
      NodeSelectorRequirement.OP_GT,
      NodeSelectorRequirement.OP_IN,
      NodeSelectorRequirement.OP_LT,
      NodeSelectorRequirement.OP_NOT_IN);

  private static final List<String> SUPPORTED_FIELD_OPERATORS = Arrays.asList(
      NodeSelectorRequirement.OP_IN,
      NodeSelectorRequirement.OP_NOT_IN);

  private static final Pattern INTEGER_PATTERN = Pattern.compile("[+-]?[0-9]+");

  private NodeSelectorValidator() {
    // do not instantiate
  }

  static List<ConfigValidationError> validate(FieldPath path, NodeSelector nodeSelector) {
    List<ConfigValidationError> errors = new ArrayList<>();
    FieldPath termsPath = path.child("nodeSelectorTerms");
    List<NodeSelectorTerm> terms = nodeSelector.getNodeSelectorTerms();
    if (SpecCollections.size(terms) == 0) {
      errors.add(ConfigValidationError.required(termsPath, "must have at least one node selector term"));
    }
    for (int i = 0; i < SpecCollections.size(terms); ++i) {
      if (terms.get(i) == null) {
        errors.add(ConfigValidationError.required(termsPath.index(i), ""));
      } else {
        errors.addAll(validateTerm(termsPath.index(i), terms.get(i)));
      }
    }
    if (SpecCollections.size(terms) != 1) {
      errors.add(ConfigValidationError.invalid(termsPath, terms, "must have exactly one node selector term"));
    }
    return errors;
  }

  private static List<ConfigValidationError> validateTerm(FieldPath path, NodeSelectorTerm term) {
    List<ConfigValidationError> errors = new ArrayList<>();
    List<NodeSelectorRequirement> expressions = SpecCollections.orEmpty(term.getMatchExpressions());
    for (int i = 0; i < expressions.size(); ++i) {
      FieldPath expressionPath = path.child("matchExpressions").index(i);
      if (expressions.get(i) == null) {
        errors.add(ConfigValidationError.required(expressionPath, ""));
      } else {
        errors.addAll(validateExpression(expressionPath, expressions.get(i)));
      }
    }
    List<NodeSelectorRequirement> fields = SpecCollections.orEmpty(term.getMatchFields());
    for (int i = 0; i < fields.size(); ++i) {
      FieldPath fieldPath = path.child("matchFields").index(i);
      if (fields.get(i) == null) {
        errors.add(ConfigValidationError.required(fieldPath, ""));
      } else {
        errors.addAll(validateField(fieldPath, fields.get(i)));
      }
    }
    return errors;
  }

  private static List<ConfigValidationError> validateExpression(FieldPath path, NodeSelectorRequirement requirement) {
    List<ConfigValidationError> errors = new ArrayList<>();
    List<String> values = SpecCollections.orEmpty(requirement.getValues());
    FieldPath valuesPath = path.child("values");
    String operator = requirement.getOperator() == null ? "" : requirement.getOperator();
    switch (operator) {
      case NodeSelectorRequirement.OP_IN:
      case NodeSelectorRequirement.OP_NOT_IN:
        if (values.isEmpty()) {
          errors.add(ConfigValidationError.required(
              valuesPath, "must be specified when `operator` is 'In' or 'NotIn'"));
        }
        break;
      case NodeSelectorRequirement.OP_EXISTS:
      case NodeSelectorRequirement.OP_DOES_NOT_EXIST:
        if (!values.isEmpty()) {
          errors.add(ConfigValidationError.forbidden(
              valuesPath, "may not be specified when `operator` is 'Exists' or 'DoesNotExist'"));
        }
        break;
      case NodeSelectorRequirement.OP_GT:
      case NodeSelectorRequirement.OP_LT:
        if (values.size() != 1) {
          errors.add(ConfigValidationError.required(
              valuesPath, "must be specified single value when `operator` is 'Lt' or 'Gt'"));
        } else if (values.get(0) == null || !INTEGER_PATTERN.matcher(values.get(0)).matches()) {
          errors.add(ConfigValidationError.invalid(valuesPath.index(0), values.get(0), "must be an integer"));
          return errors;
        }
        break;
      default:
        errors.add(ConfigValidationError.notSupported(path.child("operator"), operator, SUPPORTED_OPERATORS));
    }

    errors.addAll(IdentifierValidation.validateLabelKey(path.child("key"), requirement.getKey()));
    for (int i = 0; i < values.size(); ++i) {
      errors.addAll(IdentifierValidation.validateLabelValue(valuesPath.index(i), values.get(i)));
    }
    return errors;
  }

  private static List<ConfigValidationError> validateField(FieldPath path, NodeSelectorRequirement requirement) {
    List<ConfigValidationError> errors = new ArrayList<>();
    String operator = requirement.getOperator() == null ? "" : requirement.getOperator();
    List<String> values = SpecCollections.orEmpty(requirement.getValues());
    FieldPath valuesPath = path.child("values");
    if (SUPPORTED_FIELD_OPERATORS.contains(operator)) {
      if (values.size() != 1) {
        errors.add(ConfigValidationError.required(
            valuesPath, "must be only one value when `operator` is 'In' or 'NotIn' for node field selector"));
      }
    } else {
      errors.add(ConfigValidationError.notSupported(path.child("operator"), operator, SUPPORTED_FIELD_OPERATORS));
    }

    if (!NODE_NAME_FIELD.equals(requirement.getKey())) {
      errors.add(ConfigValidationError.notSupported(
          path.child("key"), requirement.getKey(), Collections.singletonList(NODE_NAME_FIELD)));
    } else {
      for (int i = 0; i < values.size(); ++i) {
        errors.addAll(IdentifierValidation.validateSubdomain(valuesPath.index(i), values.get(i)));
      }
    }
    return errors;
  }
}

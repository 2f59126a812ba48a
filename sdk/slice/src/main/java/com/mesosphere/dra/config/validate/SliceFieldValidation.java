package com.mesosphere.dra.config.validate;

import com.mesosphere.dra.specification.Counter;
import com.mesosphere.dra.specification.DeviceAttribute;
import com.mesosphere.dra.specification.DeviceCapacity;
import com.mesosphere.dra.specification.Quantity;
import com.mesosphere.dra.specification.SpecCollections;
import com.mesosphere.dra.specification.validation.IdentifierValidation;
import com.mesosphere.dra.specification.validation.SemanticVersion;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks for the maps and reference lists which devices, counter sets and mixins have in common.
 */
final class SliceFieldValidation {

  static final int MAX_ATTRIBUTES_AND_CAPACITIES = 32;
  static final int MAX_INCLUDES = 8;
  static final int MAX_COUNTERS = 32;
  static final int MAX_ATTRIBUTE_VALUE_LENGTH = 64;

  static final String UNKNOWN_MIXIN_MESSAGE = "must be the name of a mixin in the resource slice";

  private SliceFieldValidation() {
    // do not instantiate
  }

  static List<ConfigValidationError> validateAttributes(FieldPath path, Map<String, DeviceAttribute> attributes) {
    List<ConfigValidationError> errors = new ArrayList<>();
    for (Map.Entry<String, DeviceAttribute> entry : SpecCollections.orEmpty(attributes).entrySet()) {
      FieldPath keyPath = path.key(entry.getKey());
      errors.addAll(IdentifierValidation.validateQualifiedName(keyPath, entry.getKey()));
      errors.addAll(validateAttributeValue(keyPath, entry.getValue()));
    }
    return errors;
  }

  private static List<ConfigValidationError> validateAttributeValue(FieldPath path, DeviceAttribute attribute) {
    List<ConfigValidationError> errors = new ArrayList<>();
    int valueCount = attribute == null ? 0 : attribute.getValueCount();
    if (valueCount == 0) {
      errors.add(ConfigValidationError.required(path, "exactly one value must be specified"));
      return errors;
    }
    if (valueCount > 1) {
      errors.add(ConfigValidationError.invalid(path, attribute, "exactly one value must be specified"));
      return errors;
    }

    if (attribute.getStringValue() != null && attribute.getStringValue().length() > MAX_ATTRIBUTE_VALUE_LENGTH) {
      errors.add(ConfigValidationError.tooLong(
          path.child("string"), attribute.getStringValue(), MAX_ATTRIBUTE_VALUE_LENGTH));
    }
    String version = attribute.getVersionValue();
    if (version != null) {
      FieldPath versionPath = path.child("version");
      if (!SemanticVersion.isValid(version)) {
        errors.add(ConfigValidationError.invalid(
            versionPath, version, "must be a string compatible with semver.org spec 2.0.0"));
      }
      if (version.length() > MAX_ATTRIBUTE_VALUE_LENGTH) {
        errors.add(ConfigValidationError.tooLong(versionPath, version, MAX_ATTRIBUTE_VALUE_LENGTH));
      }
    }
    return errors;
  }

  static List<ConfigValidationError> validateCapacity(FieldPath path, Map<String, DeviceCapacity> capacity) {
    List<ConfigValidationError> errors = new ArrayList<>();
    for (Map.Entry<String, DeviceCapacity> entry : SpecCollections.orEmpty(capacity).entrySet()) {
      FieldPath keyPath = path.key(entry.getKey());
      errors.addAll(IdentifierValidation.validateQualifiedName(keyPath, entry.getKey()));
      Quantity value = entry.getValue() == null ? null : entry.getValue().getValue();
      errors.addAll(validateNonNegative(keyPath.child("value"), value));
    }
    return errors;
  }

  /**
   * Checks the combined number of attributes and capacities of a device or device mixin.
   */
  static List<ConfigValidationError> validateAttributeAndCapacityCount(
      FieldPath path, Map<String, DeviceAttribute> attributes, Map<String, DeviceCapacity> capacity)
  {
    List<ConfigValidationError> errors = new ArrayList<>();
    int total = SpecCollections.size(attributes) + SpecCollections.size(capacity);
    if (total > MAX_ATTRIBUTES_AND_CAPACITIES) {
      errors.add(ConfigValidationError.invalid(path, total, String.format(
          "the total number of attributes and capacities must not exceed %d", MAX_ATTRIBUTES_AND_CAPACITIES)));
    }
    return errors;
  }

  /**
   * Checks a counter map: at most {@value #MAX_COUNTERS} entries, C identifier names and non-negative values.
   */
  static List<ConfigValidationError> validateCounters(FieldPath path, Map<String, Counter> counters) {
    List<ConfigValidationError> errors = new ArrayList<>();
    if (SpecCollections.size(counters) > MAX_COUNTERS) {
      errors.add(ConfigValidationError.tooMany(path, counters.size(), MAX_COUNTERS));
    }
    for (Map.Entry<String, Counter> entry : SpecCollections.orEmpty(counters).entrySet()) {
      FieldPath keyPath = path.key(entry.getKey());
      errors.addAll(IdentifierValidation.validateCIdentifier(keyPath, entry.getKey()));
      Quantity value = entry.getValue() == null ? null : entry.getValue().getValue();
      errors.addAll(validateNonNegative(keyPath.child("value"), value));
    }
    return errors;
  }

  /**
   * Checks a list of mixin includes against the names of the mixins which the entity may include.
   */
  static List<ConfigValidationError> validateIncludes(
      FieldPath path, List<String> includes, Set<String> knownMixins)
  {
    return validateReferences(path, includes, MAX_INCLUDES, knownMixins, UNKNOWN_MIXIN_MESSAGE);
  }

  /**
   * Checks a list of references by name: its length, the syntax of each name and that each name is known.
   */
  static List<ConfigValidationError> validateReferences(
      FieldPath path, List<String> names, int maxNames, Collection<String> known, String unknownMessage)
  {
    List<ConfigValidationError> errors = new ArrayList<>();
    if (SpecCollections.size(names) > maxNames) {
      errors.add(ConfigValidationError.tooMany(path, names.size(), maxNames));
    }
    List<String> refs = SpecCollections.orEmpty(names);
    for (int i = 0; i < refs.size(); ++i) {
      FieldPath refPath = path.index(i);
      errors.addAll(IdentifierValidation.validateLabel(refPath, refs.get(i)));
      if (!known.contains(refs.get(i))) {
        errors.add(ConfigValidationError.invalid(refPath, refs.get(i), unknownMessage));
      }
    }
    return errors;
  }

  static List<ConfigValidationError> validateNonNegative(FieldPath path, Quantity value) {
    List<ConfigValidationError> errors = new ArrayList<>();
    if (value == null) {
      errors.add(ConfigValidationError.required(path, ""));
    } else if (value.isNegative()) {
      errors.add(ConfigValidationError.invalid(path, value.toString(), "must be greater than or equal to 0"));
    }
    return errors;
  }
}

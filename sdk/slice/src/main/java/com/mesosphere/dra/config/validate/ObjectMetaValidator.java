package com.mesosphere.dra.config.validate;

import com.mesosphere.dra.specification.ObjectMeta;
import com.mesosphere.dra.specification.ResourceSlice;
import com.mesosphere.dra.specification.validation.IdentifierValidation;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration validator which checks the metadata of a slice: its name, labels and annotations, and that the name
 * doesn't change between versions.
 */
public class ObjectMetaValidator implements ConfigValidator<ResourceSlice> {

  private static final FieldPath METADATA = FieldPath.of("metadata");

  @Override
  public Collection<ConfigValidationError> validate(Optional<ResourceSlice> oldConfig, ResourceSlice newConfig) {
    ObjectMeta metadata = newConfig.getMetadata();
    List<ConfigValidationError> errors = new ArrayList<>();

    FieldPath namePath = METADATA.child("name");
    if (StringUtils.isEmpty(metadata.getName())) {
      if (StringUtils.isEmpty(metadata.getGenerateName())) {
        errors.add(ConfigValidationError.required(namePath, "name or generateName is required"));
      }
    } else {
      errors.addAll(IdentifierValidation.validateSubdomain(namePath, metadata.getName()));
    }
    if (!StringUtils.isEmpty(metadata.getGenerateName())) {
      // A generated suffix gets appended, so a trailing dash is fine.
      errors.addAll(IdentifierValidation.validateSubdomain(
          METADATA.child("generateName"), StringUtils.removeEnd(metadata.getGenerateName(), "-")));
    }

    FieldPath labelsPath = METADATA.child("labels");
    if (metadata.getLabels() != null) {
      for (Map.Entry<String, String> label : metadata.getLabels().entrySet()) {
        errors.addAll(IdentifierValidation.validateLabelKey(labelsPath, label.getKey()));
        errors.addAll(IdentifierValidation.validateLabelValue(labelsPath, label.getValue()));
      }
    }
    FieldPath annotationsPath = METADATA.child("annotations");
    if (metadata.getAnnotations() != null) {
      for (String key : metadata.getAnnotations().keySet()) {
        errors.addAll(IdentifierValidation.validateLabelKey(annotationsPath, key));
      }
    }

    if (oldConfig.isPresent()) {
      String oldName = oldConfig.get().getMetadata().getName();
      if (!Objects.equals(oldName, metadata.getName())) {
        errors.add(ConfigValidationError.transitionError(namePath, oldName, metadata.getName(), "field is immutable"));
      }
    }
    return errors;
  }
}

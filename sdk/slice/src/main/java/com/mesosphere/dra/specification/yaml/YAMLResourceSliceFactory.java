package com.mesosphere.dra.specification.yaml;

import com.mesosphere.dra.common.LoggingUtils;
import com.mesosphere.dra.config.SerializationUtils;
import com.mesosphere.dra.config.validate.ConfigValidationError;
import com.mesosphere.dra.config.validate.ResourceSliceValidation;
import com.mesosphere.dra.specification.InvalidResourceSliceException;
import com.mesosphere.dra.specification.ResourceSlice;
import com.mesosphere.dra.specification.mixin.ResourceSliceResolver;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;

import java.io.File;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Generates {@link ResourceSlice}s from YAML documents. JSON documents are accepted as well, since JSON is valid
 * YAML.
 */
public final class YAMLResourceSliceFactory {

  private static final Logger LOGGER = LoggingUtils.getLogger(YAMLResourceSliceFactory.class);

  private static final Charset CHARSET = StandardCharsets.UTF_8;

  private YAMLResourceSliceFactory() {
    // do not instantiate
  }

  public static ResourceSlice generateSliceFromYAML(File pathToYaml) throws IOException {
    return generateSliceFromYAML(FileUtils.readFileToString(pathToYaml, CHARSET));
  }

  /**
   * Parses the provided document without validating or resolving it.
   *
   * @throws IOException if the document is malformed, e.g. if it has a duplicate key
   */
  public static ResourceSlice generateSliceFromYAML(String yaml) throws IOException {
    return SerializationUtils.fromYamlString(yaml, ResourceSlice.class);
  }

  public static ResourceSlice generateResolvedSlice(File pathToYaml)
      throws IOException, InvalidResourceSliceException
  {
    return generateResolvedSlice(generateSliceFromYAML(pathToYaml));
  }

  public static ResourceSlice generateResolvedSlice(String yaml) throws IOException, InvalidResourceSliceException {
    return generateResolvedSlice(generateSliceFromYAML(yaml));
  }

  /**
   * Validates the provided slice as a new slice and returns its resolved form.
   *
   * @throws InvalidResourceSliceException if the slice has any validation errors
   */
  public static ResourceSlice generateResolvedSlice(ResourceSlice slice) throws InvalidResourceSliceException {
    List<ConfigValidationError> errors = ResourceSliceValidation.validateCreate(slice);
    if (!errors.isEmpty()) {
      throw new InvalidResourceSliceException(slice.getMetadata().getName(), errors);
    }
    ResourceSlice resolved = ResourceSliceResolver.resolve(slice);
    LOGGER.info("Generated resolved slice '{}' with {} devices",
        resolved.getMetadata().getName(),
        resolved.getSpec().getDevices() == null ? 0 : resolved.getSpec().getDevices().size());
    return resolved;
  }
}

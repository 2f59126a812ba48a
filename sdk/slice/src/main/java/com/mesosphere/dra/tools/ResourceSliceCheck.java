package com.mesosphere.dra.tools;

import com.mesosphere.dra.config.SerializationUtils;
import com.mesosphere.dra.config.validate.ConfigValidationError;
import com.mesosphere.dra.framework.EnvStore;
import com.mesosphere.dra.framework.SliceFeatures;
import com.mesosphere.dra.registry.ResourceSliceStrategy;
import com.mesosphere.dra.specification.ResourceSlice;
import com.mesosphere.dra.specification.mixin.ResourceSliceResolver;
import com.mesosphere.dra.specification.yaml.YAMLResourceSliceFactory;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;

/**
 * Checks a resource slice document from the command line.
 * <p>
 * Usage: {@code ResourceSliceCheck <slice.yml> [<stored-slice.yml>]}. With one argument the slice is checked as a
 * new slice; with two it is checked as an update of the stored slice. Validation errors are printed and the exit
 * code is non-zero; otherwise the resolved slice is printed as YAML. Partitionable devices are enabled through the
 * {@value SliceFeatures#PARTITIONABLE_DEVICES_ENV} envvar.
 */
public final class ResourceSliceCheck {

  static final int EXIT_OK = 0;
  static final int EXIT_INVALID = 1;
  static final int EXIT_USAGE = 2;

  private ResourceSliceCheck() {
    // do not instantiate
  }

  public static void main(String[] args) {
    System.exit(run(args, SliceFeatures.fromEnvStore(EnvStore.fromEnv()), System.out, System.err));
  }

  static int run(String[] args, SliceFeatures features, PrintStream out, PrintStream err) {
    if (args.length < 1 || args.length > 2) {
      err.println("Usage: ResourceSliceCheck <slice.yml> [<stored-slice.yml>]");
      return EXIT_USAGE;
    }

    ResourceSliceStrategy strategy = new ResourceSliceStrategy(features);
    try {
      ResourceSlice slice = YAMLResourceSliceFactory.generateSliceFromYAML(new File(args[0]));
      List<ConfigValidationError> errors;
      if (args.length == 1) {
        slice = strategy.prepareForCreate(slice);
        errors = strategy.validate(slice);
      } else {
        ResourceSlice storedSlice = YAMLResourceSliceFactory.generateSliceFromYAML(new File(args[1]));
        slice = strategy.prepareForUpdate(slice, storedSlice);
        errors = strategy.validateUpdate(slice, storedSlice);
      }

      if (!errors.isEmpty()) {
        for (ConfigValidationError error : errors) {
          err.println(error);
        }
        return EXIT_INVALID;
      }
      out.print(SerializationUtils.toYamlString(ResourceSliceResolver.resolve(slice)));
      return EXIT_OK;
    } catch (IOException e) {
      err.println(String.format("Failed to read resource slice: %s", e.getMessage()));
      return EXIT_INVALID;
    }
  }
}

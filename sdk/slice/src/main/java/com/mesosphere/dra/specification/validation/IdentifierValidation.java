package com.mesosphere.dra.specification.validation;

import com.mesosphere.dra.config.validate.ConfigValidationError;
import com.mesosphere.dra.config.validate.FieldPath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Syntax checks for the names and keys used throughout resource slices. The error messages match the ones which
 * Kubernetes produces for the same rules.
 */
public final class IdentifierValidation {

  public static final int LABEL_MAX_LENGTH = 63;
  public static final int SUBDOMAIN_MAX_LENGTH = 253;
  public static final int POOL_NAME_MAX_LENGTH = 253;
  public static final int QUALIFIED_NAME_DOMAIN_MAX_LENGTH = 63;
  public static final int C_IDENTIFIER_MAX_LENGTH = 32;
  public static final int LABEL_VALUE_MAX_LENGTH = 63;

  private static final String LABEL_FMT = "[a-z0-9]([-a-z0-9]*[a-z0-9])?";
  private static final String SUBDOMAIN_FMT = LABEL_FMT + "(\\." + LABEL_FMT + ")*";
  private static final String C_IDENTIFIER_FMT = "[A-Za-z_][A-Za-z0-9_]*";
  private static final String QUALIFIED_NAME_PART_FMT = "([A-Za-z0-9][-A-Za-z0-9_.]*)?[A-Za-z0-9]";
  private static final String LABEL_VALUE_FMT = "(" + QUALIFIED_NAME_PART_FMT + ")?";

  private static final Pattern LABEL_PATTERN = Pattern.compile(LABEL_FMT);
  private static final Pattern SUBDOMAIN_PATTERN = Pattern.compile(SUBDOMAIN_FMT);
  private static final Pattern C_IDENTIFIER_PATTERN = Pattern.compile(C_IDENTIFIER_FMT);
  private static final Pattern QUALIFIED_NAME_PART_PATTERN = Pattern.compile(QUALIFIED_NAME_PART_FMT);
  private static final Pattern LABEL_VALUE_PATTERN = Pattern.compile(LABEL_VALUE_FMT);

  public static final String LABEL_ERROR_MESSAGE = "a lowercase RFC 1123 label must consist of lower case "
      + "alphanumeric characters or '-', and must start and end with an alphanumeric character "
      + "(e.g. 'my-name',  or '123-abc', regex used for validation is '" + LABEL_FMT + "')";

  public static final String SUBDOMAIN_ERROR_MESSAGE = "a lowercase RFC 1123 subdomain must consist of lower case "
      + "alphanumeric characters, '-' or '.', and must start and end with an alphanumeric character "
      + "(e.g. 'example.com', regex used for validation is '" + SUBDOMAIN_FMT + "')";

  public static final String C_IDENTIFIER_ERROR_MESSAGE = "a valid C identifier must start with alphabetic "
      + "character or '_', followed by a string of alphanumeric characters or '_' "
      + "(e.g. 'my_name',  or 'MY_NAME',  or 'MyName', regex used for validation is '" + C_IDENTIFIER_FMT + "')";

  public static final String LABEL_VALUE_ERROR_MESSAGE = "a valid label must be an empty string or consist of "
      + "alphanumeric characters, '-', '_' or '.', and must start and end with an alphanumeric character "
      + "(e.g. 'MyValue',  or 'my_value',  or '12345', regex used for validation is '" + LABEL_VALUE_FMT + "')";

  public static final String NAME_PART_ERROR_MESSAGE = "name part must consist of alphanumeric characters, '-', '_' "
      + "or '.', and must start and end with an alphanumeric character "
      + "(e.g. 'MyName',  or 'my.name',  or '123-abc', regex used for validation is '"
      + QUALIFIED_NAME_PART_FMT + "')";

  private static final String LABEL_KEY_ERROR_MESSAGE = "a qualified name must consist of alphanumeric "
      + "characters, '-', '_' or '.', and must start and end with an alphanumeric character "
      + "(e.g. 'MyName',  or 'my.name',  or '123-abc', regex used for validation is '"
      + QUALIFIED_NAME_PART_FMT + "') with an optional DNS subdomain prefix and '/' (e.g. 'example.com/MyName')";

  private IdentifierValidation() {
    // do not instantiate
  }

  /**
   * Checks that the value is a lowercase RFC 1123 label, as used for device, counter set and mixin names.
   */
  public static List<ConfigValidationError> validateLabel(FieldPath path, String value) {
    List<ConfigValidationError> errors = new ArrayList<>();
    for (String message : labelMessages(value)) {
      errors.add(ConfigValidationError.invalid(path, value, message));
    }
    return errors;
  }

  /**
   * Checks that the value is a lowercase RFC 1123 subdomain, as used for driver and node names.
   */
  public static List<ConfigValidationError> validateSubdomain(FieldPath path, String value) {
    List<ConfigValidationError> errors = new ArrayList<>();
    for (String message : subdomainMessages(value)) {
      errors.add(ConfigValidationError.invalid(path, value, message));
    }
    return errors;
  }

  /**
   * Checks a pool name: one or more RFC 1123 subdomains separated by {@code /}. Each invalid part is reported on
   * its own with the part as the value.
   */
  public static List<ConfigValidationError> validatePoolName(FieldPath path, String name) {
    if (name == null || name.isEmpty()) {
      return Collections.singletonList(ConfigValidationError.required(path, ""));
    }
    if (name.length() > POOL_NAME_MAX_LENGTH) {
      return Collections.singletonList(ConfigValidationError.tooLong(path, name, POOL_NAME_MAX_LENGTH));
    }
    List<ConfigValidationError> errors = new ArrayList<>();
    for (String part : name.split("/", -1)) {
      for (String message : subdomainMessages(part)) {
        errors.add(ConfigValidationError.invalid(path, part, message));
      }
    }
    return errors;
  }

  /**
   * Checks an attribute or capacity key: a C identifier, optionally prefixed by a domain and {@code /}. Domain and
   * identifier are checked independently, so {@code "/"} yields two errors.
   */
  public static List<ConfigValidationError> validateQualifiedName(FieldPath path, String name) {
    if (name == null || name.isEmpty()) {
      return Collections.singletonList(ConfigValidationError.required(path, "name required"));
    }
    int slash = name.indexOf('/');
    if (slash < 0) {
      return validateCIdentifier(path, name);
    }
    String domain = name.substring(0, slash);
    String identifier = name.substring(slash + 1);

    List<ConfigValidationError> errors = new ArrayList<>();
    if (domain.isEmpty()) {
      errors.add(ConfigValidationError.required(path, "the domain must not be empty"));
    } else {
      errors.addAll(validateDomain(path, domain));
    }
    if (identifier.isEmpty()) {
      errors.add(ConfigValidationError.required(path, "the name must not be empty"));
    } else {
      errors.addAll(validateCIdentifier(path, identifier));
    }
    return errors;
  }

  /**
   * Checks a C identifier of at most {@value #C_IDENTIFIER_MAX_LENGTH} characters.
   */
  public static List<ConfigValidationError> validateCIdentifier(FieldPath path, String identifier) {
    List<ConfigValidationError> errors = new ArrayList<>();
    if (identifier.length() > C_IDENTIFIER_MAX_LENGTH) {
      errors.add(ConfigValidationError.tooLong(path, identifier, C_IDENTIFIER_MAX_LENGTH));
    }
    if (!C_IDENTIFIER_PATTERN.matcher(identifier).matches()) {
      errors.add(ConfigValidationError.typeInvalid(path, identifier, C_IDENTIFIER_ERROR_MESSAGE));
    }
    return errors;
  }

  /**
   * Checks a label value, which may be empty.
   */
  public static List<ConfigValidationError> validateLabelValue(FieldPath path, String value) {
    List<ConfigValidationError> errors = new ArrayList<>();
    String nonNullValue = value == null ? "" : value;
    if (nonNullValue.length() > LABEL_VALUE_MAX_LENGTH) {
      errors.add(ConfigValidationError.invalid(path, nonNullValue, maxLengthMessage(LABEL_VALUE_MAX_LENGTH)));
    }
    if (!LABEL_VALUE_PATTERN.matcher(nonNullValue).matches()) {
      errors.add(ConfigValidationError.invalid(path, nonNullValue, LABEL_VALUE_ERROR_MESSAGE));
    }
    return errors;
  }

  /**
   * Checks a label or annotation key: a name part, optionally prefixed by a DNS subdomain and {@code /}.
   */
  public static List<ConfigValidationError> validateLabelKey(FieldPath path, String key) {
    List<ConfigValidationError> errors = new ArrayList<>();
    for (String message : labelKeyMessages(key)) {
      errors.add(ConfigValidationError.invalid(path, key, message));
    }
    return errors;
  }

  private static List<ConfigValidationError> validateDomain(FieldPath path, String domain) {
    List<ConfigValidationError> errors = new ArrayList<>();
    if (domain.length() > QUALIFIED_NAME_DOMAIN_MAX_LENGTH) {
      errors.add(ConfigValidationError.tooLong(path, domain, QUALIFIED_NAME_DOMAIN_MAX_LENGTH));
    }
    for (String message : subdomainMessages(domain)) {
      errors.add(ConfigValidationError.invalid(path, domain, message));
    }
    return errors;
  }

  private static List<String> labelMessages(String value) {
    String nonNullValue = value == null ? "" : value;
    List<String> messages = new ArrayList<>();
    if (nonNullValue.length() > LABEL_MAX_LENGTH) {
      messages.add(maxLengthMessage(LABEL_MAX_LENGTH));
    }
    if (!LABEL_PATTERN.matcher(nonNullValue).matches()) {
      messages.add(LABEL_ERROR_MESSAGE);
    }
    return messages;
  }

  private static List<String> subdomainMessages(String value) {
    String nonNullValue = value == null ? "" : value;
    List<String> messages = new ArrayList<>();
    if (nonNullValue.length() > SUBDOMAIN_MAX_LENGTH) {
      messages.add(maxLengthMessage(SUBDOMAIN_MAX_LENGTH));
    }
    if (!SUBDOMAIN_PATTERN.matcher(nonNullValue).matches()) {
      messages.add(SUBDOMAIN_ERROR_MESSAGE);
    }
    return messages;
  }

  private static List<String> labelKeyMessages(String key) {
    String nonNullKey = key == null ? "" : key;
    String[] parts = nonNullKey.split("/", -1);
    String name;
    List<String> messages = new ArrayList<>();
    switch (parts.length) {
      case 1:
        name = parts[0];
        break;
      case 2:
        String prefix = parts[0];
        name = parts[1];
        if (prefix.isEmpty()) {
          messages.add("prefix part must be non-empty");
        } else {
          for (String message : subdomainMessages(prefix)) {
            messages.add("prefix part " + message);
          }
        }
        break;
      default:
        messages.add(LABEL_KEY_ERROR_MESSAGE);
        return messages;
    }

    if (name.isEmpty()) {
      messages.add("name part must be non-empty");
    } else if (name.length() > LABEL_MAX_LENGTH) {
      messages.add("name part " + maxLengthMessage(LABEL_MAX_LENGTH));
    }
    if (!QUALIFIED_NAME_PART_PATTERN.matcher(name).matches()) {
      messages.add(NAME_PART_ERROR_MESSAGE);
    }
    return messages;
  }

  private static String maxLengthMessage(int maxLength) {
    return String.format("must be no more than %d characters", maxLength);
  }
}

package com.tempeh.plugin.aws;

import com.tempeh.plugin.manifest.ValidationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Validates AWS resource configurations ({@code validator:aws-resource-validator}).
 * Only {@code aws_instance} resources carry rules today; other resource types are valid.
 */
public final class AwsResourceValidator {

    public static final String NAME = "aws-resource-validator";

    public ValidationResult validate(Map<String, Object> resource) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (resource != null && "aws_instance".equals(resource.get("resourceType"))) {
            Object instanceType = resource.get("instanceType");
            if (!(instanceType instanceof String) || ((String) instanceType).isBlank()) {
                errors.add("MISSING_INSTANCE_TYPE: AWS instance type is required (e.g. t3.micro)");
            } else if (((String) instanceType).startsWith("t1.")) {
                warnings.add("DEPRECATED_INSTANCE_TYPE: T1 instance types are deprecated; consider T2 or T3");
            }
        }
        return ValidationResult.of(errors, warnings);
    }
}

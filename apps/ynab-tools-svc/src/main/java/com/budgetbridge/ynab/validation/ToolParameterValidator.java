package com.budgetbridge.ynab.validation;

import com.budgetbridge.ynab.error.ToolValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Runs Bean Validation over a bound tool request and reports violations using the wire parameter names.
 */
@Component
public class ToolParameterValidator {

    private final Validator validator;
    private final ObjectMapper objectMapper;

    public ToolParameterValidator(Validator validator, ObjectMapper objectMapper) {
        this.validator = validator;
        this.objectMapper = objectMapper;
    }

    public <T> T validate(T request) {
        Set<ConstraintViolation<T>> violations = validator.validate(request);
        if (violations.isEmpty()) {
            return request;
        }
        String message = violations.stream()
                .map(violation -> parameterName(request.getClass(), violation.getPropertyPath().toString())
                        + ": " + violation.getMessage())
                .sorted(Comparator.naturalOrder())
                .collect(Collectors.joining("; "));
        throw new ToolValidationException(message);
    }

    private String parameterName(Class<?> type, String property) {
        return objectMapper.getSerializationConfig()
                .introspect(objectMapper.constructType(type))
                .findProperties()
                .stream()
                .filter(definition -> definition.getInternalName().equals(property))
                .map(BeanPropertyDefinition::getName)
                .findFirst()
                .orElse(property);
    }
}

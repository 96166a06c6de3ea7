package io.malicki.retrycommander.kafka.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.malicki.retrycommander.exception.ValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Binds the payload to {@code type} with Jackson and checks its Jakarta Bean Validation constraints.
 */
@Slf4j
public class BeanValidationPayloadValidator<T> implements PayloadValidator {

    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final Class<T> type;

    public BeanValidationPayloadValidator(ObjectMapper objectMapper, Validator validator, Class<T> type) {
        this.objectMapper = objectMapper;
        this.validator = validator;
        this.type = type;
    }

    @Override
    public void validate(JsonNode payload) {
        if (payload == null || payload.isNull()) {
            throw new ValidationException("payload is empty, expected " + type.getSimpleName());
        }

        T bound;
        try {
            bound = objectMapper.treeToValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new ValidationException("payload does not match " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }

        Set<ConstraintViolation<T>> violations = validator.validate(bound);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .map(v -> v.getPropertyPath() + " " + v.getMessage())
                .collect(Collectors.joining(", "));
            log.debug("Validation of {} failed: {}", type.getSimpleName(), details);
            throw new ValidationException(details);
        }
    }
}

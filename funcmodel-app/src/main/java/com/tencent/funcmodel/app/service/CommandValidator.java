package com.tencent.funcmodel.app.service;

import com.tencent.funcmodel.domain.shared.Result;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * 用 Bean Validation 校验命令对象，违反约束时返回 VALIDATION_ERROR
 */
@Component
@RequiredArgsConstructor
public class CommandValidator {

    private final Validator validator;

    public <T> Result<T> validate(T command) {
        if (command == null) {
            return Result.fail("Command cannot be null");
        }
        Set<ConstraintViolation<T>> violations = validator.validate(command);
        if (violations.isEmpty()) {
            return Result.ok(command);
        }
        String message = violations.stream()
                .map(violation -> violation.getPropertyPath() + ": " + violation.getMessage())
                .sorted()
                .collect(Collectors.joining("; "));
        return Result.fail(message);
    }
}

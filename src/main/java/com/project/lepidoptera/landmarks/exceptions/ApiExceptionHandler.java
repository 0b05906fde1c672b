package com.project.lepidoptera.landmarks.exceptions;

import com.project.lepidoptera.landmarks.controller.LandmarkApiController;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

import java.io.IOException;

/**
 * Problem-detail responses for the JSON API. Ordered ahead of
 * {@link GlobalExceptionHandler}, which renders views.
 */
@RestControllerAdvice(assignableTypes = LandmarkApiController.class)
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(LandmarkException.class)
    public ProblemDetail handleLandmarkException(LandmarkException ex) {
        log.warn("Landmark extraction failed: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
        problem.setTitle(ex.getClass().getSimpleName());
        return problem;
    }

    @ExceptionHandler({IllegalArgumentException.class, ConstraintViolationException.class,
            HandlerMethodValidationException.class})
    public ProblemDetail handleBadRequest(Exception ex) {
        log.warn("Invalid API request: {}", ex.getMessage());
        return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler({StorageException.class, IOException.class})
    public ProblemDetail handleIo(Exception ex) {
        log.error("I/O failure while serving API request", ex);
        return ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, "Could not read the uploaded file");
    }
}

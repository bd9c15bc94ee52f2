package com.agrilink.community.api.exception;

import com.agrilink.community.api.dto.ErrorResponse;
import com.agrilink.community.api.validation.FieldNames;
import com.agrilink.community.exception.*;
import com.agrilink.community.infrastructure.metrics.CloudWatchMetricsService;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for the AgriLink API.
 * Catches all exceptions thrown by controllers and converts them to standardized error responses.
 *
 * <p>Validation failures answer 422 with {@code details.fieldErrors} keyed by the snake_case
 * field names clients send.
 *
 * @author AgriLink Team
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String VALIDATION_MESSAGE = "The given data was invalid.";

    private final CloudWatchMetricsService metricsService;

    public GlobalExceptionHandler(CloudWatchMetricsService metricsService) {
        this.metricsService = metricsService;
    }

    /**
     * Handle OutOfStockException.
     * Returns 409 CONFLICT when an order line asks for more than the product has.
     */
    @ExceptionHandler(OutOfStockException.class)
    public ResponseEntity<ErrorResponse> handleOutOfStockException(
            OutOfStockException ex,
            HttpServletRequest request
    ) {
        logger.warn("Out of stock: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.CONFLICT.value(),
                "Out of Stock",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.addDetail("productId", ex.getProductId());
        error.addDetail("requestedQuantity", ex.getRequestedQuantity());
        error.addDetail("availableQuantity", ex.getAvailableQuantity());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Handle DuplicateResourceException.
     * Returns 409 CONFLICT, e.g. for an e-mail that is already registered.
     */
    @ExceptionHandler(DuplicateResourceException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateResourceException(
            DuplicateResourceException ex,
            HttpServletRequest request
    ) {
        logger.warn("Duplicate resource: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.CONFLICT.value(),
                "Duplicate Resource",
                ex.getMessage(),
                request.getRequestURI()
        );
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        fieldErrors.put(ex.getField(), ex.getMessage());
        error.addDetail("fieldErrors", fieldErrors);

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Handle ResourceNotFoundException.
     * Returns 404 NOT FOUND when any resource doesn't exist.
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            HttpServletRequest request
    ) {
        logger.warn("Resource not found: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.NOT_FOUND.value(),
                "Resource Not Found",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.addDetail("resourceType", ex.getResourceType());
        error.addDetail("resourceId", ex.getResourceId());

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    /**
     * Handle InvalidStateTransitionException.
     * Returns 422 when an order, order item or consultation cannot move to the requested status.
     */
    @ExceptionHandler(InvalidStateTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidStateTransitionException(
            InvalidStateTransitionException ex,
            HttpServletRequest request
    ) {
        logger.warn("Invalid state transition: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.UNPROCESSABLE_ENTITY.value(),
                "Invalid State Transition",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.addDetail("currentStatus", ex.getCurrentStatus());
        error.addDetail("requestedStatus", ex.getRequestedStatus());

        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(error);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDeniedException(
            AccessDeniedException ex,
            HttpServletRequest request
    ) {
        logger.warn("Access denied on {}: {}", request.getRequestURI(), ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.FORBIDDEN.value(),
                "Forbidden",
                ex.getMessage(),
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(error);
    }

    @ExceptionHandler(AuthenticationFailedException.class)
    public ResponseEntity<ErrorResponse> handleAuthenticationFailedException(
            AuthenticationFailedException ex,
            HttpServletRequest request
    ) {
        logger.warn("Authentication failed on {}", request.getRequestURI());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.UNAUTHORIZED.value(),
                "Unauthorized",
                ex.getMessage(),
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(error);
    }

    /**
     * Handle FileStorageException.
     * Rejected uploads are the client's fault (422); write failures are ours (500).
     */
    @ExceptionHandler(FileStorageException.class)
    public ResponseEntity<ErrorResponse> handleFileStorageException(
            FileStorageException ex,
            HttpServletRequest request
    ) {
        if (!ex.isClientError()) {
            logger.error("File storage failure on {}", request.getRequestURI(), ex);
            metricsService.recordError("FileStorageException", request.getRequestURI());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ErrorResponse(
                    HttpStatus.INTERNAL_SERVER_ERROR.value(),
                    "Internal Server Error",
                    "The file could not be stored. Please try again later.",
                    request.getRequestURI()
            ));
        }

        logger.warn("Upload rejected: {}", ex.getMessage());
        return validationError(request, Map.of("file", ex.getMessage()), ex.getMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleMaxUploadSizeExceededException(
            MaxUploadSizeExceededException ex,
            HttpServletRequest request
    ) {
        logger.warn("Upload too large on {}", request.getRequestURI());
        return validationError(request, Map.of("file", "The uploaded file is too large"), VALIDATION_MESSAGE);
    }

    /**
     * Handle field errors raised by services and form validation.
     */
    @ExceptionHandler(FieldValidationException.class)
    public ResponseEntity<ErrorResponse> handleFieldValidationException(
            FieldValidationException ex,
            HttpServletRequest request
    ) {
        logger.warn("Validation failed: {}", ex.getFieldErrors().keySet());
        return validationError(request, ex.getFieldErrors(), VALIDATION_MESSAGE);
    }

    /**
     * Handle validation errors from @Valid / @Validated request bodies and model attributes.
     * MethodArgumentNotValidException is a BindException and lands here too.
     */
    @ExceptionHandler(BindException.class)
    public ResponseEntity<ErrorResponse> handleBindException(
            BindException ex,
            HttpServletRequest request
    ) {
        logger.warn("Validation failed: {} field errors", ex.getBindingResult().getFieldErrorCount());

        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.putIfAbsent(FieldNames.toSnakeCase(error.getField()), error.getDefaultMessage());
        }
        ex.getBindingResult().getGlobalErrors().forEach(error ->
                fieldErrors.putIfAbsent(error.getObjectName(), error.getDefaultMessage()));

        return validationError(request, fieldErrors, VALIDATION_MESSAGE);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatchException(
            MethodArgumentTypeMismatchException ex,
            HttpServletRequest request
    ) {
        logger.warn("Invalid value for parameter {}: {}", ex.getName(), ex.getValue());
        return validationError(request,
                Map.of(ex.getName(), "The " + ex.getName() + " field has an invalid value"), VALIDATION_MESSAGE);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameterException(
            MissingServletRequestParameterException ex,
            HttpServletRequest request
    ) {
        logger.warn("Missing parameter: {}", ex.getParameterName());
        return validationError(request,
                Map.of(ex.getParameterName(), "The " + ex.getParameterName() + " field is required"),
                VALIDATION_MESSAGE);
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ErrorResponse> handleMissingPartException(
            MissingServletRequestPartException ex,
            HttpServletRequest request
    ) {
        logger.warn("Missing part: {}", ex.getRequestPartName());
        return validationError(request,
                Map.of(ex.getRequestPartName(), "The " + ex.getRequestPartName() + " field is required"),
                VALIDATION_MESSAGE);
    }

    /**
     * Handle malformed JSON bodies.
     * Returns 400 BAD REQUEST.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleMessageNotReadableException(
            HttpMessageNotReadableException ex,
            HttpServletRequest request
    ) {
        logger.warn("Unreadable request body on {}", request.getRequestURI());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                "Malformed Request",
                "The request body could not be read",
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle unique constraint races the services could not see coming.
     * Returns 409 CONFLICT.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrityViolationException(
            DataIntegrityViolationException ex,
            HttpServletRequest request
    ) {
        logger.warn("Data integrity violation on {}: {}", request.getRequestURI(), ex.getMostSpecificCause().getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.CONFLICT.value(),
                "Conflict",
                "The request conflicts with the current state of the resource",
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Handle routing failures raised by Spring MVC itself: unknown path (404), unsupported method
     * (405, with Allow) and unsupported content type (415).
     */
    @ExceptionHandler({
            NoResourceFoundException.class,
            NoHandlerFoundException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class
    })
    public ResponseEntity<ErrorResponse> handleRoutingException(
            ServletException ex,
            HttpServletRequest request
    ) {
        org.springframework.web.ErrorResponse mvcError = (org.springframework.web.ErrorResponse) ex;
        HttpStatusCode status = mvcError.getStatusCode();
        HttpStatus resolved = HttpStatus.resolve(status.value());
        logger.debug("{} {} rejected with {}: {}", request.getMethod(), request.getRequestURI(),
                status.value(), ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                status.value(),
                resolved != null ? resolved.getReasonPhrase() : "Error",
                mvcError.getBody().getDetail(),
                request.getRequestURI()
        );

        return ResponseEntity.status(status).headers(mvcError.getHeaders()).body(error);
    }

    /**
     * Handle all other uncaught exceptions.
     * Returns 500 INTERNAL SERVER ERROR. The cause is logged, never echoed.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.error("Unexpected error: ", ex);
        metricsService.recordError(ex.getClass().getSimpleName(), request.getRequestURI());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                "Internal Server Error",
                "An unexpected error occurred. Please try again later.",
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private ResponseEntity<ErrorResponse> validationError(HttpServletRequest request,
                                                          Map<String, String> fieldErrors,
                                                          String message) {
        ErrorResponse error = new ErrorResponse(
                HttpStatus.UNPROCESSABLE_ENTITY.value(),
                "Validation Failed",
                message,
                request.getRequestURI()
        );
        error.addDetail("fieldErrors", fieldErrors);

        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(error);
    }
}

package com.example.studio.exception;

import com.example.studio.common.dto.ErrorResponse;
import com.example.studio.common.util.StringSanitizer;
import com.example.studio.observability.filter.CorrelationIdFilter;
import com.example.studio.security.exception.AuthenticationException;
import com.example.studio.security.exception.AuthorizationException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.web.WebProperties;
import org.springframework.boot.autoconfigure.web.reactive.error.AbstractErrorWebExceptionHandler;
import org.springframework.boot.web.reactive.error.ErrorAttributes;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.server.RequestPredicates;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.stream.Collectors;

/**
 * Maps exceptions to the shared {@link ErrorResponse} body. Authorization
 * failures get a generic message; the reason stays in the logs.
 */
@Slf4j
@Component
@Order(-2)  // Higher priority than DefaultErrorWebExceptionHandler
public class GlobalErrorWebExceptionHandler extends AbstractErrorWebExceptionHandler {

    public GlobalErrorWebExceptionHandler(
            ErrorAttributes errorAttributes,
            WebProperties webProperties,
            ApplicationContext applicationContext,
            ServerCodecConfigurer serverCodecConfigurer) {
        super(errorAttributes, webProperties.getResources(), applicationContext);
        this.setMessageWriters(serverCodecConfigurer.getWriters());
    }

    @Override
    protected RouterFunction<ServerResponse> getRoutingFunction(ErrorAttributes errorAttributes) {
        return RouterFunctions.route(RequestPredicates.all(), this::renderErrorResponse);
    }

    private Mono<ServerResponse> renderErrorResponse(ServerRequest request) {
        Throwable error = getError(request);
        String path = request.path();
        String correlationId = request.headers().firstHeader(CorrelationIdFilter.CORRELATION_ID_HEADER);

        if (error instanceof AuthenticationException) {
            log.warn("Authentication failed: path={}, error={}",
                    StringSanitizer.forLog(path, 200), error.getMessage());
            return createErrorResponse(HttpStatus.UNAUTHORIZED, ErrorResponse.Categories.AUTHENTICATION_ERROR,
                    ErrorResponse.Codes.UNAUTHORIZED, "Authentication required", correlationId, path);
        }

        if (error instanceof AuthorizationException) {
            log.warn("Authorization denied: path={}, error={}",
                    StringSanitizer.forLog(path, 200), error.getMessage());
            return createErrorResponse(HttpStatus.FORBIDDEN, ErrorResponse.Categories.ACCESS_DENIED,
                    ErrorResponse.Codes.FORBIDDEN, "Access denied", correlationId, path);
        }

        if (error instanceof WebExchangeBindException bindException) {
            String fieldErrors = bindException.getFieldErrors().stream()
                    .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                    .collect(Collectors.joining(", "));

            log.warn("Validation failed: path={}, errors={}", StringSanitizer.forLog(path, 200), fieldErrors);
            return createErrorResponse(HttpStatus.BAD_REQUEST, ErrorResponse.Categories.VALIDATION_ERROR,
                    ErrorResponse.Codes.INVALID_REQUEST, "Validation failed: " + fieldErrors, correlationId, path);
        }

        if (error instanceof ConstraintViolationException violation) {
            log.warn("Constraint violation: path={}, violations={}",
                    StringSanitizer.forLog(path, 200), violation.getConstraintViolations().size());
            return createErrorResponse(HttpStatus.BAD_REQUEST, ErrorResponse.Categories.VALIDATION_ERROR,
                    ErrorResponse.Codes.INVALID_REQUEST, "Invalid request parameter", correlationId, path);
        }

        if (error instanceof ServerWebInputException inputException) {
            log.warn("Invalid request input: path={}, reason={}",
                    StringSanitizer.forLog(path, 200), inputException.getReason());
            return createErrorResponse(HttpStatus.BAD_REQUEST, ErrorResponse.Categories.VALIDATION_ERROR,
                    ErrorResponse.Codes.INVALID_REQUEST, "Invalid request parameter", correlationId, path);
        }

        if (error instanceof ResponseStatusException statusException) {
            HttpStatus status = HttpStatus.resolve(statusException.getStatusCode().value());
            if (status == null) {
                status = HttpStatus.INTERNAL_SERVER_ERROR;
            }

            log.warn("Response status exception: path={}, status={}, reason={}",
                    StringSanitizer.forLog(path, 200), status, statusException.getReason());
            String code = status == HttpStatus.NOT_FOUND
                    ? ErrorResponse.Codes.RESOURCE_NOT_FOUND
                    : status.name();
            String category = status == HttpStatus.NOT_FOUND
                    ? ErrorResponse.Categories.NOT_FOUND
                    : "request_error";
            return createErrorResponse(status, category, code,
                    statusException.getReason() != null ? statusException.getReason() : status.getReasonPhrase(),
                    correlationId, path);
        }

        if (error instanceof IllegalArgumentException) {
            log.warn("Invalid argument: path={}, error={}", StringSanitizer.forLog(path, 200), error.getMessage());
            return createErrorResponse(HttpStatus.BAD_REQUEST, "invalid_argument",
                    ErrorResponse.Codes.INVALID_REQUEST, "Invalid request parameter", correlationId, path);
        }

        log.error("Unhandled error: path={}, error={}", StringSanitizer.forLog(path, 200), error.getMessage(), error);
        return createErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, ErrorResponse.Categories.INTERNAL_ERROR,
                ErrorResponse.Codes.INTERNAL_ERROR, "An unexpected error occurred", correlationId, path);
    }

    private Mono<ServerResponse> createErrorResponse(
            HttpStatus status, String error, String code, String message, String correlationId, String path) {
        ErrorResponse body = ErrorResponse.of(error, code, message, correlationId, path);

        return ServerResponse.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromValue(body));
    }
}

package com.example.textengine.interfaces.api.error;

import com.example.textengine.application.exception.ApplicationException;
import com.example.textengine.application.exception.ExtractionCancelledException;
import com.example.textengine.application.exception.PageExtractionException;
import com.example.textengine.application.exception.UseCaseValidationException;
import com.example.textengine.domain.exception.DocumentNotFoundException;
import com.example.textengine.domain.exception.DomainException;
import com.example.textengine.domain.exception.PageScoped;
import com.example.textengine.infrastructure.exception.InfrastructureException;
import com.example.textengine.infrastructure.exception.ResolutionException;
import com.example.textengine.infrastructure.exception.SourceUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Centralized API-layer exception handler that maps domain/application/infrastructure failures to HTTP responses.
 * Page-scoped failures carry the failing page under {@code details.page}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Maps {@link DocumentNotFoundException} to a 404 response.
     *
     * @param ex       thrown exception
     * @param request  incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(DocumentNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleDocumentNotFound(DocumentNotFoundException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.NOT_FOUND, "DOCUMENT_NOT_FOUND");
    }

    /**
     * Maps domain validation exceptions, such as a rejected upload or page number, to a 400 response.
     */
    @ExceptionHandler(DomainException.class)
    public ResponseEntity<ErrorResponse> handleDomain(DomainException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "DOMAIN_ERROR");
    }

    @ExceptionHandler(UseCaseValidationException.class)
    public ResponseEntity<ErrorResponse> handleUseCaseValidation(UseCaseValidationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "USE_CASE_VALIDATION_ERROR");
    }

    /**
     * Maps a cancelled extraction to a 409 response.
     */
    @ExceptionHandler(ExtractionCancelledException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(ExtractionCancelledException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.CONFLICT, "EXTRACTION_CANCELLED");
    }

    /**
     * Maps a page the source could not produce to a 422 response.
     */
    @ExceptionHandler(SourceUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleSourceUnavailable(SourceUnavailableException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "SOURCE_UNAVAILABLE");
    }

    @ExceptionHandler(PageExtractionException.class)
    public ResponseEntity<ErrorResponse> handlePageExtraction(PageExtractionException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "PAGE_EXTRACTION_ERROR");
    }

    /**
     * Maps a font or object the document references but cannot supply to a 422 response, like other
     * unreadable document content.
     */
    @ExceptionHandler(ResolutionException.class)
    public ResponseEntity<ErrorResponse> handleResolution(ResolutionException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "RESOLUTION_ERROR");
    }

    /**
     * Maps other application-layer exceptions to a 422 response.
     */
    @ExceptionHandler(ApplicationException.class)
    public ResponseEntity<ErrorResponse> handleApplication(ApplicationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "APPLICATION_ERROR");
    }

    /**
     * Maps infrastructure exceptions to a 500 response.
     */
    @ExceptionHandler(InfrastructureException.class)
    public ResponseEntity<ErrorResponse> handleInfrastructure(InfrastructureException ex, HttpServletRequest request) {
        log.error("Infrastructure failure on {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "INFRASTRUCTURE_ERROR");
    }

    /**
     * Fallback for unexpected exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected failure on {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR");
    }

    /**
     * Central helper that creates a consistent {@link ErrorResponse} envelope.
     *
     * @param error     exception that triggered the handler
     * @param request   incoming HTTP request
     * @param status    HTTP status code to return
     * @param errorCode application-specific error code
     * @return response entity containing the serialized error
     */
    private ResponseEntity<ErrorResponse> buildResponse(Throwable error,
                                                       HttpServletRequest request,
                                                       HttpStatus status,
                                                       String errorCode) {
        ErrorResponse response = ErrorResponse.of(status.value(), errorCode, error.getMessage(), request.getRequestURI());
        Map<String, Object> details = new LinkedHashMap<>();
        if (error instanceof PageScoped scoped && scoped.pageNumber() != PageScoped.NO_PAGE) {
            details.put("page", scoped.pageNumber());
        }
        if (error instanceof ResolutionException resolution && resolution.reference() != null) {
            details.put("reference", resolution.reference());
        }
        if (!details.isEmpty()) {
            response = response.withDetails(details);
        }
        return ResponseEntity.status(status).body(response);
    }
}

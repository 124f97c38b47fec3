/*
 * Where: catalog API layer
 * What: maps domain and integration failures to the standard error body
 * Why: the seller app branches on stable codes rather than messages
 */
package com.example.catalog.api;

import com.example.catalog.service.CatalogException;
import com.example.catalog.service.WhatsAppIntegrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

@RestControllerAdvice
public class CatalogApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(CatalogApiExceptionHandler.class);

  @ExceptionHandler(CatalogException.class)
  public ResponseEntity<ApiErrorResponse> handleCatalog(CatalogException ex) {
    final HttpStatus status =
        switch (ex.reason()) {
          case NOT_FOUND -> HttpStatus.NOT_FOUND;
          case CONFLICT -> HttpStatus.CONFLICT;
          case GONE -> HttpStatus.GONE;
          case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
          case UPSTREAM_FAILURE -> HttpStatus.BAD_GATEWAY;
        };
    return ResponseEntity.status(status)
        .body(new ApiErrorResponse("CATALOG_" + ex.reason().name(), ex.getMessage()));
  }

  @ExceptionHandler(WhatsAppIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleWhatsAppIntegration(
      WhatsAppIntegrationException ex) {
    final HttpStatus status =
        ex.reason() == WhatsAppIntegrationException.Reason.TIMEOUT
            ? HttpStatus.GATEWAY_TIMEOUT
            : HttpStatus.BAD_GATEWAY;
    return ResponseEntity.status(status)
        .body(new ApiErrorResponse("WHATSAPP_" + ex.reason().name(), ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("CATALOG_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiErrorResponse> handleUploadSize(MaxUploadSizeExceededException ex) {
    return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
        .body(new ApiErrorResponse("CATALOG_PAYLOAD_TOO_LARGE", "upload exceeds size limit"));
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class,
    MissingServletRequestParameterException.class,
    MissingServletRequestPartException.class,
    IllegalArgumentException.class
  })
  public ResponseEntity<ApiErrorResponse> handleBadRequest(Exception ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("CATALOG_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled api failure", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("CATALOG_INTERNAL_ERROR", "internal error"));
  }
}

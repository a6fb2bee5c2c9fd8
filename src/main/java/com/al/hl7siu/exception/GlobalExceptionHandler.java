package com.al.hl7siu.exception;

import com.al.hl7siu.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.LocalDateTime;

@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(Hl7ParseException.class)
    public ResponseEntity<ErrorResponse> handleParseError(Hl7ParseException e, HttpServletRequest request) {
        log.warn("HL7 Parse Error: {}", e.getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, e.getErrorKind(), e.getMessage(), request);
    }

    @ExceptionHandler(UnsupportedMessageTypeException.class)
    public ResponseEntity<ErrorResponse> handleUnsupportedType(UnsupportedMessageTypeException e,
            HttpServletRequest request) {
        log.warn("Unsupported Message Type: {}", e.getMessageType());
        return buildResponse(HttpStatus.UNPROCESSABLE_ENTITY, e.getErrorKind(), e.getMessage(), request);
    }

    @ExceptionHandler(MissingSegmentException.class)
    public ResponseEntity<ErrorResponse> handleMissingSegment(MissingSegmentException e,
            HttpServletRequest request) {
        log.warn("Missing Segment: {}", e.getSegment());
        return buildResponse(HttpStatus.UNPROCESSABLE_ENTITY, e.getErrorKind(), e.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralError(Exception e, HttpServletRequest request) {
        log.error("Internal Server Error: ", e);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred",
                request);
    }

    private ResponseEntity<ErrorResponse> buildResponse(HttpStatus status, String error, String message,
            HttpServletRequest request) {
        ErrorResponse response = new ErrorResponse(
                LocalDateTime.now(),
                status.value(),
                error,
                message,
                request.getRequestURI());
        return new ResponseEntity<>(response, status);
    }
}

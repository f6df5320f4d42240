package io.bms.backend.exception;

import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Renders {@link org.springframework.web.ErrorResponseException}s such as {@link
 * ResourceNotFoundException} and Spring MVC's own exceptions as RFC 7807 problem details.
 */
@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {}

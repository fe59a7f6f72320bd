package com.agentmanager.dispatch.api;

import com.agentmanager.core.errors.AgentManagerException;
import com.agentmanager.core.errors.ConflictException;
import com.agentmanager.core.errors.NotFoundException;
import com.agentmanager.core.errors.ProtocolException;
import com.agentmanager.core.errors.ProvisioningException;
import com.agentmanager.core.errors.ValidationException;
import com.agentmanager.core.state.IllegalTransitionException;
import com.agentmanager.core.state.StaleStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain exceptions to {@code {error, code}} JSON bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> validation(ValidationException e) {
        return body(HttpStatus.BAD_REQUEST, e.getMessage(), e.code());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> unreadable(Exception e) {
        return body(HttpStatus.BAD_REQUEST, "Malformed request", "VALIDATION_FAILED");
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(NotFoundException e) {
        return body(HttpStatus.NOT_FOUND, e.getMessage(), e.code());
    }

    /**
     * Gateway rejections of REST-initiated messages. An unknown session is a 404, anything else
     * (not waiting, no agent) a 400.
     */
    @ExceptionHandler(ProtocolException.class)
    public ResponseEntity<Map<String, Object>> protocol(ProtocolException e) {
        HttpStatus status = ProtocolException.UNKNOWN_SESSION.equals(e.code())
                ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        return body(status, e.getMessage(), e.code());
    }

    @ExceptionHandler({ConflictException.class, StaleStateException.class, IllegalTransitionException.class})
    public ResponseEntity<Map<String, Object>> conflict(AgentManagerException e) {
        return body(HttpStatus.CONFLICT, e.getMessage(), e.code());
    }

    @ExceptionHandler(ProvisioningException.class)
    public ResponseEntity<Map<String, Object>> provisioning(ProvisioningException e) {
        var response = body(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), e.code());
        response.getBody().put("step", e.getStep());
        response.getBody().put("session_id", e.getSessionId());
        return response;
    }

    @ExceptionHandler(AgentManagerException.class)
    public ResponseEntity<Map<String, Object>> other(AgentManagerException e) {
        log.error("Request failed: {}", e.getMessage(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), e.code());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String message, String code) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("code", code);
        return ResponseEntity.status(status).body(body);
    }
}

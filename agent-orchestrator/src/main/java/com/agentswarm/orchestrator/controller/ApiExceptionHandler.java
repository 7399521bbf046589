package com.agentswarm.orchestrator.controller;

import com.agentswarm.common.exception.AgentNotFoundException;
import com.agentswarm.orchestrator.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.util.List;

/**
 * Maps the exceptions that reach the REST layer to HTTP status codes.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(AgentNotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(AgentNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(new ErrorResponse("agent_not_found", e.getMessage(), e.getCandidates()));
    }

    @ExceptionHandler({IllegalArgumentException.class, ServerWebInputException.class})
    public ResponseEntity<ErrorResponse> badRequest(Exception e) {
        log.warn("Rejected request reason={}", e.getMessage());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("invalid_request", e.getMessage(), List.of()));
    }
}

package com.summaryplatform.engine.controller;

import com.summaryplatform.common.exception.ConfigException;
import com.summaryplatform.common.exception.InsufficientDataException;
import com.summaryplatform.common.exception.InvalidInputException;
import com.summaryplatform.common.exception.SummarizationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;

import java.net.URI;

/**
 * Maps the summarization error taxonomy onto RFC 7807 problem bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({ConfigException.class, InvalidInputException.class})
    public ResponseEntity<ProblemDetail> handleBadRequest(SummarizationException ex, ServerWebExchange exchange) {
        return buildProblem(HttpStatus.BAD_REQUEST, "invalid-config", ex, exchange);
    }

    @ExceptionHandler(InsufficientDataException.class)
    public ResponseEntity<ProblemDetail> handleInsufficientData(InsufficientDataException ex,
                                                                ServerWebExchange exchange) {
        return buildProblem(HttpStatus.UNPROCESSABLE_ENTITY, "insufficient-data", ex, exchange);
    }

    @ExceptionHandler(SummarizationException.class)
    public ResponseEntity<ProblemDetail> handleSummarization(SummarizationException ex, ServerWebExchange exchange) {
        return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, "internal-error", ex, exchange);
    }

    private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, String slug,
                                                       SummarizationException ex, ServerWebExchange exchange) {
        String path = exchange.getRequest().getPath().value();
        if (status.is5xxServerError()) {
            log.error("Request failed. status={} path={} component={}", status.value(), path, ex.getComponent(), ex);
        } else {
            log.warn("Request rejected. status={} path={} component={} message={}",
                status.value(), path, ex.getComponent(), ex.getMessage());
        }

        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problem.setType(URI.create("https://summaryplatform.com/problems/" + slug));
        problem.setTitle(status.getReasonPhrase());
        problem.setInstance(URI.create(path));
        problem.setProperty("component", ex.getComponent());
        return ResponseEntity.status(status).body(problem);
    }
}

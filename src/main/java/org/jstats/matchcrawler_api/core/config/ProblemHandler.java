package org.jstats.matchcrawler_api.core.config;

import jakarta.validation.ConstraintViolationException;
import org.jstats.matchcrawler_api.modules.crawl.remote.RemoteMatchClient;
import org.jstats.matchcrawler_api.modules.crawl.repository.StorageException;
import org.jstats.matchcrawler_api.modules.crawl.repository.StorageUnavailableException;
import org.jstats.matchcrawler_api.modules.crawl.service.CrawlAlreadyRunningException;
import org.jstats.matchcrawler_api.modules.feature_builder.service.FeatureBuildInProgressException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.net.URI;

@RestControllerAdvice
public class ProblemHandler {

    private static final Logger log = LoggerFactory.getLogger(ProblemHandler.class);

    private static final String PROBLEMS = "https://api.jstats.org/problems/";

    // Anything thrown as ResponseStatusException becomes a Problem
    @ExceptionHandler(ResponseStatusException.class)
    public ProblemDetail handle(ResponseStatusException ex) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(ex.getStatusCode(), ex.getReason());
        pd.setType(URI.create(PROBLEMS + ex.getStatusCode().value()));
        var status = HttpStatus.resolve(ex.getStatusCode().value());
        pd.setTitle(status == null ? "Request Failed" : switch (status) {
            case NOT_FOUND -> "Resource Not Found";
            case BAD_REQUEST -> "Bad Request";
            case CONFLICT -> "Conflict";
            default -> "Request Failed";
        });
        return pd;
    }

    @ExceptionHandler(CrawlAlreadyRunningException.class)
    public ProblemDetail crawlRunning(CrawlAlreadyRunningException ex) {
        var pd = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, ex.getMessage());
        pd.setType(URI.create(PROBLEMS + "crawl-running"));
        pd.setTitle("Crawl Already Running");
        pd.setProperty("runId", ex.runId());
        return pd;
    }

    @ExceptionHandler(FeatureBuildInProgressException.class)
    public ProblemDetail buildRunning(FeatureBuildInProgressException ex) {
        var pd = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, ex.getMessage());
        pd.setType(URI.create(PROBLEMS + "build-running"));
        pd.setTitle("Build Already Running");
        return pd;
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            ConstraintViolationException.class,
            MethodArgumentNotValidException.class,
            HandlerMethodValidationException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class
    })
    public ProblemDetail badRequest(Exception ex) {
        var pd = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        pd.setType(URI.create(PROBLEMS + "400"));
        pd.setTitle("Bad Request");
        return pd;
    }

    @ExceptionHandler(StorageException.class)
    public ProblemDetail storage(StorageException ex) {
        log.error("Storage failure in {}: {}", ex.operation(), ex.getMessage());
        var pd = ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE,
                ex instanceof StorageUnavailableException
                        ? "Match store is unreachable. Please retry later."
                        : "Match store operation '" + ex.operation() + "' failed.");
        pd.setType(URI.create(PROBLEMS + "storage"));
        pd.setTitle("Storage Unavailable");
        return pd;
    }

    @ExceptionHandler(RemoteMatchClient.NotFoundException.class)
    public ProblemDetail remoteNotFound(RemoteMatchClient.NotFoundException ex) {
        var pd = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
        pd.setType(URI.create(PROBLEMS + "404"));
        pd.setTitle("Resource Not Found");
        return pd;
    }

    @ExceptionHandler(RemoteMatchClient.RateLimitedException.class)
    public ResponseEntity<ProblemDetail> rateLimited(RemoteMatchClient.RateLimitedException ex) {
        var pd = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_GATEWAY,
                "Rate limit reached at the Riot API. Please retry later.");
        pd.setType(URI.create(PROBLEMS + "rate-limit"));
        pd.setTitle("Upstream Rate Limited");
        var headers = new HttpHeaders();
        headers.add(HttpHeaders.RETRY_AFTER, String.valueOf(Math.max(1, ex.retryAfter.toSeconds())));
        return new ResponseEntity<>(pd, headers, HttpStatus.BAD_GATEWAY);
    }

    @ExceptionHandler(RemoteMatchClient.RemoteClientException.class)
    public ProblemDetail upstream(RemoteMatchClient.RemoteClientException ex) {
        var pd = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
        pd.setType(URI.create(PROBLEMS + "upstream"));
        pd.setTitle(ex instanceof RemoteMatchClient.UpstreamPayloadException
                ? "Failed to parse upstream JSON"
                : "Upstream Error");
        pd.setDetail(ex.getMessage());
        return pd;
    }

    // Catch any other unexpected exception as a 500 Problem (avoid leaking internals)
    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Unhandled error", ex);
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR,
                "Unexpected error. If this persists, contact support.");
        pd.setType(URI.create(PROBLEMS + "internal-error"));
        pd.setTitle("Internal Server Error");
        return pd;
    }
}

package dev.llmrouter.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.net.URI;
import java.time.Instant;

/**
 * Maps router failures to RFC 7807 Problem Details.
 *
 * <p>Upstream and internal messages stay in the server logs. Clients only see the
 * category of failure and, for internal errors, the request id to quote.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleBadRequest(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "bad-request", "Invalid Request");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Request body is not a valid chat completion request.",
                "bad-request", "Invalid Request");
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class})
    public ProblemDetail handleBadParameter(Exception ex) {
        log.warn("Bad request parameter: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "A request parameter is missing or malformed.",
                "bad-request", "Invalid Request");
    }

    @ExceptionHandler(BudgetExceededException.class)
    public ProblemDetail handleBudgetExceeded(BudgetExceededException ex) {
        log.warn("Budget exhausted: {}", ex.getRejectedProviders());
        return problem(HttpStatus.TOO_MANY_REQUESTS, "Spending cap reached. Please retry later.",
                "budget-exhausted", "Budget Exhausted");
    }

    @ExceptionHandler(NoViableRouteException.class)
    public ProblemDetail handleNoRoute(NoViableRouteException ex) {
        log.warn("No viable route: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "No provider is available for this request.",
                "no-viable-route", "Service Unavailable");
    }

    @ExceptionHandler(RouterInternalException.class)
    public ProblemDetail handleRouterFailure(RouterInternalException ex) {
        ProblemDetail problem = problem(HttpStatus.INTERNAL_SERVER_ERROR,
                "The request could not be completed. Please try again later.", "internal", "Internal Server Error");
        problem.setProperty("requestId", ex.getRequestId());
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please try again later.", "internal", "Internal Server Error");
    }

    private static ProblemDetail problem(HttpStatus status, String detail, String type, String title) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create("https://llmrouter.dev/errors/" + type));
        problem.setTitle(title);
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }
}

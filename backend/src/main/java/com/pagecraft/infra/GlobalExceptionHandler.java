package com.pagecraft.infra;

import com.pagecraft.dto.ErrorResponse;
import com.pagecraft.service.DesignNotFoundException;
import com.pagecraft.service.DesignerException;
import com.pagecraft.service.lock.InvalidLockRequestException;
import com.pagecraft.service.lock.LockConflictException;
import com.pagecraft.service.lock.LockExpiredException;
import com.pagecraft.service.lock.LockNotFoundException;
import com.pagecraft.service.lock.LockTokenMismatchException;
import com.pagecraft.service.tree.ComponentNotFoundException;
import com.pagecraft.service.tree.CyclicMoveException;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.exceptions.HttpStatusException;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

@Singleton
@Produces
public class GlobalExceptionHandler
    implements ExceptionHandler<Exception, HttpResponse<ErrorResponse>> {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @Override
    public HttpResponse<ErrorResponse> handle(HttpRequest request, Exception e) {
        if (e instanceof DesignerException de) {
            HttpStatus status = statusFor(de);
            log.debug("{} {} -> {} {}", request.getMethod(), request.getPath(), status.getCode(), de.getCode());
            return HttpResponse
                .status(status)
                .body(new ErrorResponse(de.getMessage(), de.getCode(), detailsFor(de)));
        }

        if (e instanceof HttpStatusException hse) {
            return HttpResponse
                .status(hse.getStatus())
                .body(new ErrorResponse(hse.getMessage(), hse.getStatus().name(), null));
        }

        if (e instanceof ConstraintViolationException cve) {
            String msg = cve.getConstraintViolations().stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation error");
            return HttpResponse
                .status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(msg, "VALIDATION_ERROR", null));
        }

        if (e instanceof IllegalArgumentException iae) {
            return HttpResponse
                .status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(iae.getMessage(), "VALIDATION_ERROR", null));
        }

        log.error("Unhandled exception: {}", e.getMessage(), e);
        return HttpResponse
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("Internal server error", "INTERNAL_ERROR", null));
    }

    static HttpStatus statusFor(DesignerException e) {
        if (e instanceof LockConflictException
            || e instanceof LockExpiredException
            || e instanceof CyclicMoveException) {
            return HttpStatus.CONFLICT;
        }
        if (e instanceof LockNotFoundException
            || e instanceof ComponentNotFoundException
            || e instanceof DesignNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof LockTokenMismatchException) {
            return HttpStatus.FORBIDDEN;
        }
        if (e instanceof InvalidLockRequestException) {
            return HttpStatus.BAD_REQUEST;
        }
        return HttpStatus.UNPROCESSABLE_ENTITY;
    }

    private static Map<String, Object> detailsFor(DesignerException e) {
        if (e instanceof LockConflictException lce && lce.getHolderId() != null) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("resourceId", lce.getResourceId());
            details.put("holderId", lce.getHolderId());
            details.put("expiresAt", lce.getExpiresAt().toString());
            return details;
        }
        if (e instanceof LockExpiredException lee) {
            return Map.of("resourceId", lee.getResourceId(), "expiredAt", lee.getExpiredAt().toString());
        }
        return null;
    }
}

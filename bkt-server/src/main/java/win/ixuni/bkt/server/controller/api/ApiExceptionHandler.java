package win.ixuni.bkt.server.controller.api;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.exception.GatewayException;
import win.ixuni.bkt.server.controller.api.dto.ErrorResponse;

/**
 * JSON errors of the management API: {@code {"error": code, "message": text}}
 */
@Slf4j
@RestControllerAdvice(basePackages = "win.ixuni.bkt.server.controller.api")
public class ApiExceptionHandler {

    @ExceptionHandler(GatewayException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGatewayException(GatewayException ex) {
        if (ex.getHttpStatus() >= 500) {
            log.error("API Error: {} - {}", ex.getErrorCode(), ex.getMessage(), ex);
        } else {
            log.warn("API Error: {} - {}", ex.getErrorCode(), ex.getMessage());
        }
        return respond(ex.getHttpStatus(), ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInputException(ServerWebInputException ex) {
        log.warn("Invalid request: {}", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST.value(), "InvalidArgument", ex.getReason());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(Exception ex) {
        log.error("Internal error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR.value(), "InternalError", "An internal error occurred");
    }

    private static Mono<ResponseEntity<ErrorResponse>> respond(int status, String code, String message) {
        return Mono.just(ResponseEntity
                .status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse(code, message)));
    }
}

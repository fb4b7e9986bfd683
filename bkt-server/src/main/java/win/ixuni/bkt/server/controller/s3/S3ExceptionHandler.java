package win.ixuni.bkt.server.controller.s3;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.exception.GatewayException;
import win.ixuni.bkt.server.controller.s3.model.S3ErrorResponse;
import win.ixuni.bkt.server.filter.S3RequestIdFilter;

/**
 * S3 error responses
 * <p>
 * Gateway errors keep their code and status; anything else is an {@code InternalError} with
 * a generic message.
 */
@Slf4j
@RestControllerAdvice(basePackages = "win.ixuni.bkt.server.controller.s3")
public class S3ExceptionHandler {

    private static final MediaType APPLICATION_XML = MediaType.APPLICATION_XML;

    @ExceptionHandler(GatewayException.class)
    public Mono<ResponseEntity<S3ErrorResponse>> handleGatewayException(
            GatewayException ex, ServerWebExchange exchange) {
        if (ex.getHttpStatus() >= 500) {
            log.error("S3 Error: {} - {}", ex.getErrorCode(), ex.getMessage(), ex);
        } else {
            log.warn("S3 Error: {} - {}", ex.getErrorCode(), ex.getMessage());
        }
        return respond(ex.getHttpStatus(), ex.getErrorCode(), ex.getMessage(), exchange);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<S3ErrorResponse>> handleInputException(
            ServerWebInputException ex, ServerWebExchange exchange) {
        log.warn("Invalid request: {}", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST.value(), "InvalidArgument", ex.getReason(), exchange);
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<S3ErrorResponse>> handleGenericException(
            Exception ex, ServerWebExchange exchange) {
        log.error("Internal error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR.value(), "InternalError",
                "We encountered an internal error. Please try again.", exchange);
    }

    private static Mono<ResponseEntity<S3ErrorResponse>> respond(int status, String code, String message,
                                                                ServerWebExchange exchange) {
        S3ErrorResponse error = new S3ErrorResponse(code, message,
                exchange.getRequest().getPath().value(), S3RequestIdFilter.requestIdOf(exchange));
        return Mono.just(ResponseEntity
                .status(status)
                .contentType(APPLICATION_XML)
                .body(error));
    }
}

package lab.relay.common;

import jakarta.servlet.http.HttpServletRequest;
import lab.relay.adapter.DestinationChains;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

    // Private keys and signatures must never leak into error bodies.
    private static final Pattern SENSITIVE_HEX_PATTERN = Pattern.compile("0x[a-fA-F0-9]{64,}");

    private final DestinationChains destinationChains;

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        String message = sanitizeMessage(ex.getMessage());

        if (ex instanceof MethodArgumentTypeMismatchException mismatch) {
            message = "Invalid value '%s' for '%s'".formatted(mismatch.getValue(), mismatch.getName());
            Class<?> type = mismatch.getRequiredType();
            if (type != null && type.isEnum()) {
                message += ". Allowed values: " + String.join(", ", enumNames(type));
            }
        }

        return ResponseEntity.badRequest().body(new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                message,
                allowedDestinationChains()
        ));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        String detail = ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage();
        String message = "Invalid JSON body.";
        if (detail != null && !detail.isBlank()) {
            message += " Detail: " + sanitizeMessage(detail);
        }

        return ResponseEntity.badRequest()
                .header(HttpHeaders.CONTENT_TYPE, "application/json")
                .body(new ErrorResponse(HttpStatus.BAD_REQUEST.value(), message, allowedDestinationChains()));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
        return ResponseEntity.badRequest().body(new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                "Missing required parameter: " + ex.getParameterName(),
                allowedDestinationChains()
        ));
    }

    @ExceptionHandler({IllegalStateException.class, RuntimeException.class})
    public ResponseEntity<RuntimeErrorResponse> handleRuntimeException(Exception ex, HttpServletRequest request) {
        log.error("event=http.unhandled path={} error={}", request.getRequestURI(), sanitizeMessage(ex.getMessage()), ex);
        RuntimeErrorResponse body = new RuntimeErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                sanitizeMessage(ex.getMessage()),
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    static String sanitizeMessage(String message) {
        if (message == null || message.isBlank()) {
            return "Unexpected server error";
        }
        return SENSITIVE_HEX_PATTERN.matcher(message).replaceAll("0x[REDACTED]");
    }

    private List<String> allowedDestinationChains() {
        return List.copyOf(destinationChains.names());
    }

    private static List<String> enumNames(Class<?> enumType) {
        return Arrays.stream(enumType.getEnumConstants())
                .map(c -> ((Enum<?>) c).name())
                .toList();
    }

    public record ErrorResponse(
            int status,
            String message,
            List<String> allowedDestinationChains
    ) {}

    public record RuntimeErrorResponse(
            int status,
            String message,
            String path
    ) {
    }
}

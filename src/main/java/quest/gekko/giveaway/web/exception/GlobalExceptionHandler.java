package quest.gekko.giveaway.web.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import quest.gekko.giveaway.dto.CommandAck;
import quest.gekko.giveaway.exception.GiveawayConflictException;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(GiveawayConflictException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public CommandAck handleConflict(GiveawayConflictException ex, HttpServletRequest request) {
        log.warn("Rejected command: {} for URL: {}", ex.getMessage(), request.getRequestURL());
        return CommandAck.failed();
    }

    @ExceptionHandler({ IllegalArgumentException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public CommandAck handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("Bad request: {} for URL: {}", ex.getMessage(), request.getRequestURL());
        return CommandAck.failed();
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public CommandAck handleGeneralException(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error for URL: {}", request.getRequestURL(), ex);
        return CommandAck.failed();
    }
}

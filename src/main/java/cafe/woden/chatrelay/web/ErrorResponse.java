package cafe.woden.chatrelay.web;

/** JSON error body returned by {@link GlobalExceptionHandler}. */
public record ErrorResponse(int status, String error, String message) {}

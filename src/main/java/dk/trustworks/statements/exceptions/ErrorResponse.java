package dk.trustworks.statements.exceptions;

public record ErrorResponse(String error, String message) {
}

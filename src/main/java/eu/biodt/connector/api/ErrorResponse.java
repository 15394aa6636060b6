package eu.biodt.connector.api;

public record ErrorResponse(String error) {
}

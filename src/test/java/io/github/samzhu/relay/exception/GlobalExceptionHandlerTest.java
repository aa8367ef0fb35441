package io.github.samzhu.relay.exception;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.ConnectException;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;

import io.github.samzhu.relay.config.ErrorReportingProperties;
import io.github.samzhu.relay.model.GatewayError;
import io.github.samzhu.relay.util.ErrorDetailsSanitizer;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler devHandler =
        new GlobalExceptionHandler(new ErrorDetailsSanitizer(new ErrorReportingProperties(false)));
    private final GlobalExceptionHandler prodHandler =
        new GlobalExceptionHandler(new ErrorDetailsSanitizer(new ErrorReportingProperties(true)));

    private static UpstreamException connectionRefused() {
        ConnectException cause = new ConnectException("Connection refused: localhost/127.0.0.1:8443");
        return UpstreamException.forNetwork(new ResourceAccessException("I/O error on POST request", cause));
    }

    @Test
    void shouldMapNetworkFailureToCategoryStatus() {
        ResponseEntity<GatewayError> response = devHandler.handleUpstream(connectionRefused());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().error()).isEqualTo(ErrorCategory.CONNECTION.getMessage());
        assertThat(response.getBody().status()).isEqualTo(503);
        assertThat(response.getBody().details()).isEqualTo("I/O error on POST request");
    }

    @Test
    void shouldHideSensitiveDetailsWhenEnabled() {
        UpstreamException e = UpstreamException.forStatus(401,
            "{\"error\":{\"message\":\"API key not valid. Please pass a valid API key.\"}}", false);

        ResponseEntity<GatewayError> response = prodHandler.handleUpstream(e);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody().error()).isEqualTo("Gemini request failed");
        assertThat(response.getBody().details()).isEqualTo(ErrorDetailsSanitizer.HIDDEN_MESSAGE);
    }

    @Test
    void shouldKeepUpstreamDetailsWhenNotHiding() {
        UpstreamException e = UpstreamException.forStatus(400, "Invalid argument", false);

        ResponseEntity<GatewayError> response = devHandler.handleUpstream(e);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody().details()).isEqualTo("Gemini API error: 400 - Invalid argument");
    }

    @Test
    void shouldMapMissingApiKeyTo503WithoutDetails() {
        ResponseEntity<GatewayError> response = devHandler.handleMissingApiKey(new MissingApiKeyException());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().error()).isEqualTo("Service configuration error");
        assertThat(response.getBody().details()).isNull();
    }

    @Test
    void shouldMapUnexpectedErrorsTo500() {
        ResponseEntity<GatewayError> response = prodHandler.handleGenericException(
            new RuntimeException("failed reading /var/secrets/token"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().error()).isEqualTo("Internal server error");
        assertThat(response.getBody().details()).isEqualTo(ErrorDetailsSanitizer.HIDDEN_MESSAGE);
    }
}

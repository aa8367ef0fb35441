package io.github.samzhu.relay.exception;

import java.util.regex.Pattern;

import org.springframework.http.HttpStatus;

/**
 * 上游網路層錯誤分類
 *
 * <p>依宣告順序比對，第一個符合的分類勝出；全部不符合時為 {@link #UNKNOWN}。
 *
 * @see UpstreamErrorClassifier
 */
public enum ErrorCategory {

    TIMEOUT("timeout|timed out|aborted",
        "Request timeout - the target service took too long to respond", HttpStatus.GATEWAY_TIMEOUT),

    DNS("dns|name resolution|unknownhost|unresolvedaddress",
        "DNS resolution failed - unable to resolve target hostname", HttpStatus.BAD_GATEWAY),

    SSL("ssl|tls|certificate",
        "SSL/TLS error - certificate or encryption issue", HttpStatus.BAD_GATEWAY),

    CONNECTION("connection refused|connect",
        "Connection refused - target service is not accepting connections", HttpStatus.SERVICE_UNAVAILABLE),

    NETWORK("network|fetch|i/o error|reset|broken pipe|eof",
        "Network error - unable to reach the target service", HttpStatus.BAD_GATEWAY),

    UNKNOWN(null, "Unexpected upstream error", HttpStatus.INTERNAL_SERVER_ERROR);

    private final Pattern pattern;
    private final String message;
    private final HttpStatus httpStatus;

    ErrorCategory(String regex, String message, HttpStatus httpStatus) {
        this.pattern = regex != null ? Pattern.compile(regex) : null;
        this.message = message;
        this.httpStatus = httpStatus;
    }

    boolean matches(String normalizedDescription) {
        return pattern != null && pattern.matcher(normalizedDescription).find();
    }

    public String getMessage() {
        return message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}

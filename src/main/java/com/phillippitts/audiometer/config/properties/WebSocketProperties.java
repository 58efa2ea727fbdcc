package com.phillippitts.audiometer.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Typed properties for the audio WebSocket endpoint.
 */
@Validated
@ConfigurationProperties(prefix = "websocket")
public class WebSocketProperties {

    private final String path;

    /** Origins allowed to open the socket (the browser front end). */
    private final List<String> allowedOrigins;

    /** Longest a single outbound send may take before the connection is closed. */
    @Min(100)
    @Max(60_000)
    private final int sendTimeLimitMs;

    /** Outbound bytes buffered per connection while a send is in progress. */
    @Min(1024)
    private final int sendBufferSizeLimit;

    /** Largest binary (PCM) message accepted. */
    @Min(1024)
    @Max(16 * 1024 * 1024)
    private final int maxBinaryMessageBytes;

    /** Largest text (control) message accepted. */
    @Min(256)
    @Max(1024 * 1024)
    private final int maxTextMessageBytes;

    @ConstructorBinding
    public WebSocketProperties(String path,
                               List<String> allowedOrigins,
                               Integer sendTimeLimitMs,
                               Integer sendBufferSizeLimit,
                               Integer maxBinaryMessageBytes,
                               Integer maxTextMessageBytes) {
        this.path = (path == null || path.isBlank()) ? "/ws/audio" : path;
        this.allowedOrigins = (allowedOrigins == null || allowedOrigins.isEmpty())
                ? List.of("http://localhost:3000") : List.copyOf(allowedOrigins);
        this.sendTimeLimitMs = sendTimeLimitMs == null ? 1000 : sendTimeLimitMs;
        this.sendBufferSizeLimit = sendBufferSizeLimit == null ? 256 * 1024 : sendBufferSizeLimit;
        this.maxBinaryMessageBytes = maxBinaryMessageBytes == null ? 1024 * 1024 : maxBinaryMessageBytes;
        this.maxTextMessageBytes = maxTextMessageBytes == null ? 64 * 1024 : maxTextMessageBytes;
    }

    public String getPath() { return path; }
    public List<String> getAllowedOrigins() { return allowedOrigins; }
    public int getSendTimeLimitMs() { return sendTimeLimitMs; }
    public int getSendBufferSizeLimit() { return sendBufferSizeLimit; }
    public int getMaxBinaryMessageBytes() { return maxBinaryMessageBytes; }
    public int getMaxTextMessageBytes() { return maxTextMessageBytes; }
}

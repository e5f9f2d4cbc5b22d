package com.questrail.mdoc.presentment;

import com.questrail.mdoc.model.Role;
import com.questrail.mdoc.request.DeviceRequestParser.ParsedDeviceRequest;
import com.questrail.mdoc.response.DeviceResponse;
import com.questrail.mdoc.transport.TransportState;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one completed presentment.
 *
 * <p>A holder result carries the request it answered; a reader result carries
 * the parsed response. {@code transactionTime} runs from the start of
 * {@code open} until the session ended. {@code scanningTime} is present when
 * this side was the GATT central.</p>
 */
public record PresentmentResult(
    Role role,
    TerminationStyle terminationStyle,
    Duration transactionTime,
    Duration scanningTime,
    ParsedDeviceRequest request,
    DeviceResponse response,
    TransportState finalTransportState
) {
    public PresentmentResult {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(terminationStyle, "terminationStyle");
        Objects.requireNonNull(transactionTime, "transactionTime");
        Objects.requireNonNull(finalTransportState, "finalTransportState");
    }

    public Optional<Duration> scanningTimeOptional() {
        return Optional.ofNullable(scanningTime);
    }

    public Optional<ParsedDeviceRequest> requestOptional() {
        return Optional.ofNullable(request);
    }

    public Optional<DeviceResponse> responseOptional() {
        return Optional.ofNullable(response);
    }
}

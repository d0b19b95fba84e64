package com.sandy.fleet.view.model;

import lombok.Builder;
import lombok.Value;

/**
 * Status of one management-protocol channel to a device. Missing axes read as UNKNOWN.
 */
@Value
@Builder
public class ProtocolState {
    @Builder.Default
    Protocol protocol = Protocol.UNKNOWN;
    @Builder.Default
    ConnectivityState connectivityState = ConnectivityState.UNKNOWN;
    @Builder.Default
    ServiceState serviceState = ServiceState.UNKNOWN;
    @Builder.Default
    ChannelState channelState = ChannelState.UNKNOWN;

    public Protocol protocolOrUnknown() {
        return protocol == null ? Protocol.UNKNOWN : protocol;
    }

    public ConnectivityState connectivityOrUnknown() {
        return connectivityState == null ? ConnectivityState.UNKNOWN : connectivityState;
    }

    public ServiceState serviceOrUnknown() {
        return serviceState == null ? ServiceState.UNKNOWN : serviceState;
    }

    public ChannelState channelOrUnknown() {
        return channelState == null ? ChannelState.UNKNOWN : channelState;
    }
}

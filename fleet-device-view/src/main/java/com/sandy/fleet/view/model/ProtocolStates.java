package com.sandy.fleet.view.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Derives display status from the protocol channels a device reports.
 */
public final class ProtocolStates {

    private ProtocolStates() {
    }

    /**
     * Additive health score over all channels: connectivity weighs 8, service 4 (2 while connecting)
     * and channel 1, positive when up and negative when down. The score is only meant for ordering.
     */
    public static int deriveStatusCode(List<ProtocolState> protocolStates) {
        if (protocolStates == null) return 0;
        int stateAsNumber = 0;
        for (ProtocolState p : protocolStates) {
            if (p == null) continue;
            stateAsNumber += p.connectivityOrUnknown().weight();
            stateAsNumber += p.serviceOrUnknown().weight();
            stateAsNumber += p.channelOrUnknown().weight();
        }
        return stateAsNumber;
    }

    /**
     * Style tokens, two per channel in input order: {@code <protocol>_<channel>} then
     * {@code <protocol>_<connectivity>}, e.g. {@code gnmi_connected}, {@code gnmi_reachable}.
     */
    public static List<String> deriveStatusLabels(List<ProtocolState> protocolStates) {
        if (protocolStates == null || protocolStates.isEmpty()) return Collections.emptyList();
        List<String> stateStyles = new ArrayList<>(protocolStates.size() * 2);
        for (ProtocolState p : protocolStates) {
            if (p == null) continue;
            String protocol = p.protocolOrUnknown().label();
            stateStyles.add(protocol + "_" + p.channelOrUnknown().label());
            stateStyles.add(protocol + "_" + p.connectivityOrUnknown().label());
        }
        return stateStyles;
    }
}

package com.tradejournal.exception;

import java.util.List;
import java.util.Map;

/**
 * Thrown when a broker profile is requested by a name the catalog does not know. The details
 * list the names it does know.
 */
public class BrokerProfileNotFoundException extends BaseException {

    public BrokerProfileNotFoundException(String brokerName, List<String> knownBrokers) {
        super(
                ErrorCode.BROKER_NOT_FOUND,
                String.format("No broker profile named '%s'", brokerName),
                Map.of("broker", brokerName, "knownBrokers", knownBrokers));
    }
}

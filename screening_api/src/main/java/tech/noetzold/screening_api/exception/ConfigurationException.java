package tech.noetzold.screening_api.exception;

/**
 * Unknown check id, duplicate or cyclic probe registration. Fatal to the single request that hit it.
 */
public class ConfigurationException extends ScreeningException {

    private final String probeId;

    public ConfigurationException(String message, String probeId) {
        super("configuration_error", message);
        this.probeId = probeId;
    }

    public String getProbeId() {
        return probeId;
    }

    public static ConfigurationException unknownCheck(String probeId) {
        return new ConfigurationException("Unknown check id: " + probeId, probeId);
    }

    public static ConfigurationException duplicate(String probeId) {
        return new ConfigurationException("Probe already registered: " + probeId, probeId);
    }

    public static ConfigurationException cycle(String probeId) {
        return new ConfigurationException("Aggregate probe depends on itself: " + probeId, probeId);
    }

    public static ConfigurationException unknownProvider(String probeId, String providerId) {
        return new ConfigurationException(
                "Probe " + probeId + " depends on unregistered provider " + providerId, probeId);
    }
}

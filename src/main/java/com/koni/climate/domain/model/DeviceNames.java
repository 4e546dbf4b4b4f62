package com.koni.climate.domain.model;

/**
 * Naming rules shared by the normalizer and the registry.
 */
public final class DeviceNames {

    private static final int FALLBACK_FRAGMENT_LENGTH = 6;

    private DeviceNames() {
    }

    /**
     * Infers a display name as {@code "<location> <source display name>"},
     * e.g. "Hall Motion Sensor". Without a location only the source display name is used.
     */
    public static String infer(String location, SourceKind sourceKind) {
        if (location == null || location.isBlank()) {
            return sourceKind.getDisplayName();
        }
        return location.trim() + " " + sourceKind.getDisplayName();
    }

    /**
     * Deterministic location used when neither the registry nor the vendor knows one.
     * Embeds the tail of the vendor id so distinct devices stay distinguishable.
     */
    public static String fallbackLocation(String vendorUniqueId) {
        String fragment = vendorUniqueId.length() <= FALLBACK_FRAGMENT_LENGTH
                ? vendorUniqueId
                : vendorUniqueId.substring(vendorUniqueId.length() - FALLBACK_FRAGMENT_LENGTH);
        return "Unknown " + fragment;
    }
}

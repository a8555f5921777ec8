package com.platform.netconfig.validation;

import com.platform.netconfig.config.NetConfigProperties;
import com.platform.netconfig.error.ErrorCode;
import com.platform.netconfig.error.ValidationException;
import com.platform.netconfig.model.HardwareProfile;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Segment ceilings per gateway class, looked up by profile id. New gateway
 * classes are added in configuration, never in the validator.
 */
@Component
public class HardwareProfileCatalog {
    
    private final Map<String, HardwareProfile> profiles;
    
    public HardwareProfileCatalog(NetConfigProperties properties) {
        this.profiles = properties.getHardware().getProfiles().entrySet().stream()
            .collect(Collectors.toUnmodifiableMap(
                e -> e.getKey().toLowerCase(Locale.ROOT),
                e -> new HardwareProfile(
                    e.getKey().toLowerCase(Locale.ROOT),
                    e.getValue().getDisplayName(),
                    e.getValue().getMaxSegments())
            ));
    }
    
    /**
     * @throws ValidationException if no profile is registered under the id
     */
    public HardwareProfile resolve(String profileId) {
        String key = profileId == null ? "" : profileId.trim().toLowerCase(Locale.ROOT);
        HardwareProfile profile = profiles.get(key);
        if (profile == null) {
            String supported = profiles.keySet().stream().sorted().collect(Collectors.joining(", "));
            throw new ValidationException(ErrorCode.UNKNOWN_HARDWARE_PROFILE, List.of(new Violation(
                ViolationClass.HARDWARE,
                "hardware.profile",
                profileId,
                "known-hardware-profile",
                "Unknown hardware profile, supported: " + supported
            )));
        }
        return profile;
    }
    
    public Collection<HardwareProfile> all() {
        return profiles.values().stream()
            .sorted((a, b) -> a.id().compareTo(b.id()))
            .toList();
    }
}

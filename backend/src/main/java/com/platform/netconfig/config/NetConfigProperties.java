package com.platform.netconfig.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the reconciler.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "netconfig")
public class NetConfigProperties {
    
    /**
     * Location of the desired-state document (YAML or JSON).
     */
    private String desiredStatePath = "config/network.yaml";
    
    /**
     * VLAN tags the engine must never create, update or delete.
     * VLAN 1 is the externally managed management network.
     */
    private List<Integer> protectedSegmentIds = new ArrayList<>(List.of(1));
    
    private Hardware hardware = new Hardware();
    
    private Controller controller = new Controller();
    
    private Apply apply = new Apply();
    
    private Backup backup = new Backup();
    
    /**
     * Number of finished runs kept in memory for the runs endpoint.
     */
    private int runHistorySize = 100;
    
    /**
     * Command executed on startup when running from the command line
     * (validate, plan, apply, backup, status). Empty means server mode.
     */
    private String command = "";
    
    @Data
    public static class Hardware {
        /**
         * Active hardware profile id.
         */
        private String profile = "usg3p";
        
        /**
         * Known gateway classes keyed by profile id.
         */
        private Map<String, Profile> profiles = defaultProfiles();
        
        private static Map<String, Profile> defaultProfiles() {
            Map<String, Profile> profiles = new LinkedHashMap<>();
            // USG-3P: four hardware VLANs, one of which is the management VLAN 1
            profiles.put("usg3p", new Profile("UniFi Security Gateway 3P", 3));
            profiles.put("uxg-pro", new Profile("UniFi Next-Gen Gateway Pro", 31));
            profiles.put("udm-pro", new Profile("UniFi Dream Machine Pro", 31));
            profiles.put("udm-se", new Profile("UniFi Dream Machine SE", 31));
            return profiles;
        }
    }
    
    @Data
    public static class Profile {
        private String displayName;
        private int maxSegments;
        
        public Profile() {
        }
        
        public Profile(String displayName, int maxSegments) {
            this.displayName = displayName;
            this.maxSegments = maxSegments;
        }
    }
    
    @Data
    public static class Controller {
        /**
         * Controller base URL.
         */
        private String url = "https://localhost:8443";
        
        private String site = "default";
        
        private String username = "";
        
        private String password = "";
        
        /**
         * Whether to verify the controller's TLS certificate.
         */
        private boolean verifySsl = true;
        
        private Duration connectTimeout = Duration.ofSeconds(5);
        
        private Duration readTimeout = Duration.ofSeconds(30);
        
        private Retry retry = new Retry();
        
        private RateLimit rateLimit = new RateLimit();
    }
    
    @Data
    public static class Retry {
        /**
         * Total attempts per call, including the first.
         */
        private int maxAttempts = 5;
        
        private Duration initialDelay = Duration.ofMillis(500);
        
        private double multiplier = 2.0;
        
        private Duration maxDelay = Duration.ofSeconds(30);
    }
    
    @Data
    public static class RateLimit {
        private boolean enabled = true;
        
        private int requestsPerSecond = 5;
        
        private int burst = 10;
    }
    
    @Data
    public static class Apply {
        /**
         * Independent operations dispatched at once. 1 means strictly sequential.
         */
        private int maxConcurrency = 4;
    }
    
    @Data
    public static class Backup {
        private String directory = "backups";
    }
}

package com.platform.netconfig.controller.unifi;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.netconfig.config.NetConfigProperties;
import com.platform.netconfig.controller.ControllerClient;
import com.platform.netconfig.controller.ControllerStatus;
import com.platform.netconfig.controller.unifi.UniFiModels.ApiResponse;
import com.platform.netconfig.controller.unifi.UniFiModels.BackupLocation;
import com.platform.netconfig.controller.unifi.UniFiModels.BackupRequest;
import com.platform.netconfig.controller.unifi.UniFiModels.FirewallRuleConf;
import com.platform.netconfig.controller.unifi.UniFiModels.LoginRequest;
import com.platform.netconfig.controller.unifi.UniFiModels.NetworkConf;
import com.platform.netconfig.controller.unifi.UniFiModels.SysInfo;
import com.platform.netconfig.error.ControllerApiException;
import com.platform.netconfig.error.ControllerApiException.ApiErrorKind;
import com.platform.netconfig.error.FatalApiException;
import com.platform.netconfig.error.TransientApiException;
import com.platform.netconfig.model.FirewallRule;
import com.platform.netconfig.model.NetworkSegment;
import com.platform.netconfig.model.ObjectIdentity;
import com.platform.netconfig.observability.ReconciliationMetrics;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.net.CookieManager;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Client for the UniFi Network controller REST API.
 *
 * <p>Authenticates with a session cookie from {@code /api/login} and logs in
 * again once when a call comes back 401. Controller object ids are cached by
 * authoritative identity from every fetch and create; a miss refreshes the
 * cache from the controller before giving up with not-found.
 */
@Slf4j
public class UniFiControllerClient implements ControllerClient {
    
    private final NetConfigProperties.Controller config;
    private final ObjectMapper objectMapper;
    private final ControllerModelMapper mapper;
    private final ReconciliationMetrics metrics;
    private final HttpClient httpClient;
    
    private final Map<Integer, String> networkIdByVlan = new ConcurrentHashMap<>();
    private final Map<ObjectIdentity, String> ruleIdByIdentity = new ConcurrentHashMap<>();
    
    private volatile boolean loggedIn = false;
    
    public UniFiControllerClient(NetConfigProperties.Controller config, ObjectMapper objectMapper,
                                 ControllerModelMapper mapper, ReconciliationMetrics metrics) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.mapper = mapper;
        this.metrics = metrics;
        
        HttpClient.Builder builder = HttpClient.newBuilder()
            .connectTimeout(config.getConnectTimeout())
            .cookieHandler(new CookieManager());
        if (!config.isVerifySsl()) {
            log.warn("TLS certificate verification disabled for controller {}", config.getUrl());
            builder.sslContext(trustAllContext());
        }
        this.httpClient = builder.build();
    }
    
    // ==================== Segments ====================
    
    @Override
    public List<NetworkSegment> fetchSegments() {
        List<NetworkConf> networks = fetchNetworks("fetchSegments");
        return networks.stream()
            .filter(mapper::isSegment)
            .map(mapper::toSegment)
            .toList();
    }
    
    @Override
    public void createSegment(NetworkSegment segment) {
        NetworkConf payload = mapper.toNetworkConf(segment, null);
        List<NetworkConf> created = exchange("createSegment", "POST", networkPath(""), payload, NetworkConf.class);
        if (!created.isEmpty() && created.get(0).getId() != null) {
            networkIdByVlan.put(segment.vlanId(), created.get(0).getId());
        }
        log.info("Created segment {} ({})", segment.vlanId(), segment.name());
    }
    
    @Override
    public void updateSegment(NetworkSegment current, NetworkSegment desired) {
        String id = resolveNetworkId(current.vlanId());
        exchange("updateSegment", "PUT", networkPath("/" + id), mapper.toNetworkConf(desired, id), NetworkConf.class);
        log.info("Updated segment {} ({})", desired.vlanId(), desired.name());
    }
    
    @Override
    public void deleteSegment(NetworkSegment current) {
        String id = resolveNetworkId(current.vlanId());
        exchange("deleteSegment", "DELETE", networkPath("/" + id), null, NetworkConf.class);
        networkIdByVlan.remove(current.vlanId());
        log.info("Deleted segment {} ({})", current.vlanId(), current.name());
    }
    
    private List<NetworkConf> fetchNetworks(String call) {
        List<NetworkConf> networks = exchange(call, "GET", networkPath(""), null, NetworkConf.class);
        networkIdByVlan.clear();
        networks.stream()
            .filter(mapper::isSegment)
            .forEach(n -> networkIdByVlan.put(mapper.vlanOf(n), n.getId()));
        return networks;
    }
    
    private String resolveNetworkId(int vlanId) {
        String id = networkIdByVlan.get(vlanId);
        if (id == null) {
            fetchNetworks("resolveSegment");
            id = networkIdByVlan.get(vlanId);
        }
        if (id == null) {
            throw ControllerApiException.notFound("Segment " + vlanId + " does not exist on the controller");
        }
        return id;
    }
    
    // ==================== Firewall rules ====================
    
    @Override
    public List<FirewallRule> fetchFirewallRules() {
        if (networkIdByVlan.isEmpty()) {
            fetchNetworks("fetchFirewallRules");
        }
        Map<String, Integer> vlanByNetworkId = networkIdByVlan.entrySet().stream()
            .collect(Collectors.toMap(Map.Entry::getValue, Map.Entry::getKey, (a, b) -> a));
        
        List<FirewallRuleConf> rules = fetchRuleConfs("fetchFirewallRules");
        return rules.stream()
            .map(r -> mapper.toRule(r, vlanByNetworkId))
            .toList();
    }
    
    @Override
    public void createFirewallRule(FirewallRule rule) {
        FirewallRuleConf payload = toRuleConf(rule, null);
        List<FirewallRuleConf> created = exchange("createFirewallRule", "POST", rulePath(""), payload, FirewallRuleConf.class);
        if (!created.isEmpty() && created.get(0).getId() != null) {
            ruleIdByIdentity.put(rule.identity(), created.get(0).getId());
        }
        log.info("Created firewall rule {} ({})", rule.identity(), rule.name());
    }
    
    @Override
    public void updateFirewallRule(FirewallRule current, FirewallRule desired) {
        String id = resolveRuleId(current.identity());
        exchange("updateFirewallRule", "PUT", rulePath("/" + id), toRuleConf(desired, id), FirewallRuleConf.class);
        ruleIdByIdentity.remove(current.identity());
        ruleIdByIdentity.put(desired.identity(), id);
        log.info("Updated firewall rule {} ({})", desired.identity(), desired.name());
    }
    
    @Override
    public void deleteFirewallRule(FirewallRule current) {
        String id = resolveRuleId(current.identity());
        exchange("deleteFirewallRule", "DELETE", rulePath("/" + id), null, FirewallRuleConf.class);
        ruleIdByIdentity.remove(current.identity());
        log.info("Deleted firewall rule {} ({})", current.identity(), current.name());
    }
    
    private List<FirewallRuleConf> fetchRuleConfs(String call) {
        List<FirewallRuleConf> rules = exchange(call, "GET", rulePath(""), null, FirewallRuleConf.class);
        ruleIdByIdentity.clear();
        rules.stream()
            .filter(r -> r.getRuleset() != null && r.getRuleIndex() != null)
            .forEach(r -> ruleIdByIdentity.put(ObjectIdentity.rule(r.getRuleset(), r.getRuleIndex()), r.getId()));
        return rules;
    }
    
    private String resolveRuleId(ObjectIdentity identity) {
        String id = ruleIdByIdentity.get(identity);
        if (id == null) {
            fetchRuleConfs("resolveFirewallRule");
            id = ruleIdByIdentity.get(identity);
        }
        if (id == null) {
            throw ControllerApiException.notFound("Firewall rule " + identity.key() + " does not exist on the controller");
        }
        return id;
    }
    
    private FirewallRuleConf toRuleConf(FirewallRule rule, String id) {
        for (Integer vlan : rule.referencedSegments()) {
            if (vlan != null && !networkIdByVlan.containsKey(vlan)) {
                resolveNetworkId(vlan);
            }
        }
        try {
            return mapper.toRuleConf(rule, id, networkIdByVlan);
        } catch (IllegalArgumentException e) {
            throw ControllerApiException.notFound(e.getMessage());
        }
    }
    
    // ==================== Status and backup ====================
    
    @Override
    public ControllerStatus status() {
        List<SysInfo> info = exchange("status", "GET", sitePath("/stat/sysinfo"), null, SysInfo.class);
        SysInfo sysInfo = info.isEmpty() ? new SysInfo() : info.get(0);
        int segments = fetchSegments().size();
        int rules = fetchFirewallRules().size();
        return new ControllerStatus(config.getUrl(), config.getSite(),
            sysInfo.getVersion(), sysInfo.getHostname(), segments, rules);
    }
    
    @Override
    public byte[] exportBackup() {
        List<BackupLocation> location = exchange("exportBackup", "POST", sitePath("/cmd/backup"),
            new BackupRequest(), BackupLocation.class);
        if (location.isEmpty() || location.get(0).getUrl() == null) {
            throw FatalApiException.unexpected(200, "Controller did not return a backup download location");
        }
        
        String downloadPath = location.get(0).getUrl();
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(config.getUrl() + downloadPath))
            .timeout(config.getReadTimeout())
            .GET()
            .build();
        HttpResponse<byte[]> response = send("downloadBackup", request, HttpResponse.BodyHandlers.ofByteArray());
        if (response.statusCode() != 200) {
            throw classify("downloadBackup", response.statusCode(), null);
        }
        log.info("Downloaded controller backup {} ({} bytes)", downloadPath, response.body().length);
        return response.body();
    }
    
    // ==================== HTTP plumbing ====================
    
    private <T> List<T> exchange(String call, String method, String path, Object body, Class<T> type) {
        ensureLoggedIn();
        
        HttpResponse<String> response = send(call, buildRequest(method, path, body), HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() == 401) {
            log.info("Controller session expired during {}, logging in again", call);
            loggedIn = false;
            login();
            response = send(call, buildRequest(method, path, body), HttpResponse.BodyHandlers.ofString());
        }
        
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw classify(call, response.statusCode(), response.body());
        }
        
        ApiResponse<T> envelope = parse(call, response.body(), type);
        if (envelope.getMeta() != null && !envelope.getMeta().isOk()) {
            throw ControllerApiException.conflict(call + " rejected by controller: " + envelope.getMeta().getMsg());
        }
        return envelope.getData() != null ? envelope.getData() : List.of();
    }
    
    private void ensureLoggedIn() {
        if (!loggedIn) {
            login();
        }
    }
    
    private synchronized void login() {
        if (loggedIn) {
            return;
        }
        LoginRequest login = new LoginRequest();
        login.setUsername(config.getUsername());
        login.setPassword(config.getPassword());
        
        HttpResponse<String> response = send("login", buildRequest("POST", "/api/login", login),
            HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status == 400 || status == 401 || status == 403) {
            throw FatalApiException.authFailure(
                String.format("Controller rejected credentials for user '%s'", config.getUsername()));
        }
        if (status < 200 || status >= 300) {
            throw classify("login", status, response.body());
        }
        loggedIn = true;
        log.info("Logged in to controller {} as {}", config.getUrl(), config.getUsername());
    }
    
    private HttpRequest buildRequest(String method, String path, Object body) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(config.getUrl() + path))
            .timeout(config.getReadTimeout())
            .header("Accept", "application/json");
        
        if (body == null) {
            return builder.method(method, HttpRequest.BodyPublishers.noBody()).build();
        }
        try {
            String json = objectMapper.writeValueAsString(body);
            return builder
                .header("Content-Type", "application/json")
                .method(method, HttpRequest.BodyPublishers.ofString(json))
                .build();
        } catch (JsonProcessingException e) {
            throw new FatalApiException(ApiErrorKind.UNEXPECTED, -1, "Cannot serialize request for " + path, e);
        }
    }
    
    private <B> HttpResponse<B> send(String call, HttpRequest request, HttpResponse.BodyHandler<B> handler) {
        long start = System.currentTimeMillis();
        try {
            HttpResponse<B> response = httpClient.send(request, handler);
            metrics.recordControllerCall(call, response.statusCode() < 400, System.currentTimeMillis() - start);
            log.debug("{} {} -> {}", request.method(), request.uri().getPath(), response.statusCode());
            return response;
        } catch (IOException e) {
            metrics.recordControllerCall(call, false, System.currentTimeMillis() - start);
            throw TransientApiException.network(
                String.format("%s: controller unreachable at %s (%s)", call, config.getUrl(), e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FatalApiException(ApiErrorKind.UNEXPECTED, -1, call + " interrupted", e);
        }
    }
    
    private <T> ApiResponse<T> parse(String call, String body, Class<T> type) {
        if (body == null || body.isBlank()) {
            return new ApiResponse<>();
        }
        try {
            JavaType envelopeType = objectMapper.getTypeFactory().constructParametricType(ApiResponse.class, type);
            return objectMapper.readValue(body, envelopeType);
        } catch (JsonProcessingException e) {
            throw new FatalApiException(ApiErrorKind.UNEXPECTED, 200,
                call + " returned a malformed response: " + e.getOriginalMessage(), e);
        }
    }
    
    /**
     * Maps an error status to the exception kind the retry and apply layers act on.
     */
    ControllerApiException classify(String call, int status, String body) {
        String detail = String.format("%s failed with HTTP %d%s", call, status, describe(body));
        return switch (status) {
            case 401, 403 -> FatalApiException.authFailure(detail);
            case 404 -> ControllerApiException.notFound(detail);
            case 400, 409 -> ControllerApiException.conflict(detail);
            case 429 -> TransientApiException.rateLimited(detail);
            case 502, 503, 504 -> new TransientApiException(ApiErrorKind.TRANSIENT_NETWORK, status, detail);
            default -> FatalApiException.unexpected(status, detail);
        };
    }
    
    private String describe(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            ApiResponse<Object> envelope = objectMapper.readValue(body,
                objectMapper.getTypeFactory().constructParametricType(ApiResponse.class, Object.class));
            if (envelope.getMeta() != null && envelope.getMeta().getMsg() != null) {
                return ": " + envelope.getMeta().getMsg();
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not a controller envelope: {}", e.getOriginalMessage());
        }
        return "";
    }
    
    private String sitePath(String suffix) {
        return "/api/s/" + config.getSite() + suffix;
    }
    
    private String networkPath(String suffix) {
        return sitePath("/rest/networkconf" + suffix);
    }
    
    private String rulePath(String suffix) {
        return sitePath("/rest/firewallrule" + suffix);
    }
    
    private static SSLContext trustAllContext() {
        TrustManager[] trustAll = {new X509TrustManager() {
            @Override
            public void checkClientTrusted(X509Certificate[] chain, String authType) {
            }
            
            @Override
            public void checkServerTrusted(X509Certificate[] chain, String authType) {
            }
            
            @Override
            public X509Certificate[] getAcceptedIssuers() {
                return new X509Certificate[0];
            }
        }};
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trustAll, new SecureRandom());
            return context;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cannot initialise TLS context", e);
        }
    }
}

package com.platform.netconfig.controller.unifi;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.netconfig.config.NetConfigProperties;
import com.platform.netconfig.error.ControllerApiException;
import com.platform.netconfig.error.ControllerApiException.ApiErrorKind;
import com.platform.netconfig.error.FatalApiException;
import com.platform.netconfig.error.TransientApiException;
import com.platform.netconfig.model.FirewallRule;
import com.platform.netconfig.model.NetworkSegment;
import com.platform.netconfig.model.RuleSelector;
import com.platform.netconfig.observability.ReconciliationMetrics;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UniFiControllerClientTest {

    private static final String NETWORKS = """
        {"meta":{"rc":"ok"},"data":[
          {"_id":"n1","name":"Default","purpose":"corporate","vlan_enabled":false,
           "ip_subnet":"192.168.1.1/24","dhcpd_enabled":true,"dhcpd_start":"192.168.1.6",
           "dhcpd_stop":"192.168.1.254","dhcpd_leasetime":86400,"enabled":true},
          {"_id":"n10","name":"Trusted","purpose":"corporate","vlan_enabled":true,"vlan":10,
           "ip_subnet":"10.0.10.1/24","dhcpd_enabled":false,"domain_name":"","enabled":true},
          {"_id":"w1","name":"WAN","purpose":"wan","wan_type":"dhcp"}
        ]}""";

    private static final String RULES = """
        {"meta":{"rc":"ok"},"data":[
          {"_id":"r1","name":"block-trusted-to-mgmt","ruleset":"LAN_IN","rule_index":2000,
           "action":"drop","protocol":"all","enabled":true,
           "src_networkconf_id":"n10","src_networkconf_type":"NETv4","src_address":"","src_port":"",
           "dst_networkconf_id":"n1","dst_networkconf_type":"NETv4","dst_address":"","dst_port":""}
        ]}""";

    private static final String OK_EMPTY = "{\"meta\":{\"rc\":\"ok\"},\"data\":[]}";

    private HttpServer server;
    private UniFiControllerClient client;

    private final AtomicInteger logins = new AtomicInteger();
    private final AtomicInteger expireNextDelete = new AtomicInteger();
    private final List<String> requests = new CopyOnWriteArrayList<>();
    private volatile int loginStatus = 200;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/api/login", exchange -> {
            logins.incrementAndGet();
            respond(exchange, loginStatus, loginStatus == 200 ? OK_EMPTY
                : "{\"meta\":{\"rc\":\"error\",\"msg\":\"api.err.Invalid\"},\"data\":[]}");
        });
        server.createContext("/api/s/default/rest/networkconf", exchange -> respond(exchange, 200, NETWORKS));
        server.createContext("/api/s/default/rest/firewallrule", exchange -> {
            if (exchange.getRequestMethod().equals("DELETE") && expireNextDelete.getAndSet(0) > 0) {
                respond(exchange, 401, "{\"meta\":{\"rc\":\"error\",\"msg\":\"api.err.LoginRequired\"},\"data\":[]}");
                return;
            }
            respond(exchange, 200, exchange.getRequestMethod().equals("GET") ? RULES : OK_EMPTY);
        });
        server.start();

        NetConfigProperties.Controller config = new NetConfigProperties.Controller();
        config.setUrl("http://localhost:" + server.getAddress().getPort());
        config.setUsername("admin");
        config.setPassword("secret");
        config.setReadTimeout(Duration.ofSeconds(5));

        ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        client = new UniFiControllerClient(config, objectMapper, new ControllerModelMapper(),
            new ReconciliationMetrics(new SimpleMeterRegistry()));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void fetchSegmentsKeepsLanNetworksOnly() {
        List<NetworkSegment> segments = client.fetchSegments();

        assertThat(segments).extracting(NetworkSegment::vlanId).containsExactly(1, 10);
        NetworkSegment trusted = segments.get(1);
        assertThat(trusted.subnet()).isEqualTo("10.0.10.0/24");
        assertThat(trusted.gateway()).isEqualTo("10.0.10.1");
        assertThat(trusted.dhcp().isEnabled()).isFalse();
        assertThat(trusted.domainName()).isNull();
        assertThat(logins.get()).isEqualTo(1);
    }

    @Test
    void fetchFirewallRulesResolvesNetworkReferences() {
        List<FirewallRule> rules = client.fetchFirewallRules();

        assertThat(rules).singleElement().satisfies(rule -> {
            assertThat(rule.chain()).isEqualTo("LAN_IN");
            assertThat(rule.priority()).isEqualTo(2000);
            assertThat(rule.action()).isEqualTo("deny");
            assertThat(rule.source()).isEqualTo(RuleSelector.segment(10));
            assertThat(rule.destination()).isEqualTo(RuleSelector.segment(1));
        });
    }

    @Test
    void expiredSessionLogsInOnceMoreAndRepeatsTheCall() {
        FirewallRule rule = client.fetchFirewallRules().get(0);
        expireNextDelete.set(1);

        client.deleteFirewallRule(rule);

        assertThat(logins.get()).isEqualTo(2);
        assertThat(requests).filteredOn(r -> r.startsWith("DELETE")).hasSize(2)
            .allMatch(r -> r.endsWith("/rest/firewallrule/r1"));
    }

    @Test
    void unknownRuleIsNotFoundAfterRefreshingIds() {
        FirewallRule missing = new FirewallRule("LAN_IN", 9, "gone", "deny", null, null, null, null);

        assertThatThrownBy(() -> client.deleteFirewallRule(missing))
            .isInstanceOf(ControllerApiException.class)
            .satisfies(e -> assertThat(((ControllerApiException) e).getKind()).isEqualTo(ApiErrorKind.NOT_FOUND));
        assertThat(requests).anyMatch(r -> r.equals("GET /api/s/default/rest/firewallrule"));
    }

    @Test
    void rejectedCredentialsAreFatal() {
        loginStatus = 400;

        assertThatThrownBy(() -> client.fetchSegments())
            .isInstanceOf(FatalApiException.class)
            .satisfies(e -> assertThat(((FatalApiException) e).getKind()).isEqualTo(ApiErrorKind.AUTH_FAILURE));
    }

    @Test
    void unreachableControllerIsTransient() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        NetConfigProperties.Controller config = new NetConfigProperties.Controller();
        config.setUrl("http://localhost:" + closedPort);
        config.setConnectTimeout(Duration.ofSeconds(2));
        UniFiControllerClient offline = new UniFiControllerClient(config, new ObjectMapper(),
            new ControllerModelMapper(), new ReconciliationMetrics(new SimpleMeterRegistry()));

        assertThatThrownBy(() -> offline.fetchSegments())
            .isInstanceOf(TransientApiException.class)
            .satisfies(e -> assertThat(((TransientApiException) e).getKind()).isEqualTo(ApiErrorKind.TRANSIENT_NETWORK));
    }

    @Test
    void statusCodesMapToErrorKinds() {
        assertThat(client.classify("call", 401, null)).isInstanceOf(FatalApiException.class);
        assertThat(client.classify("call", 404, null).getKind()).isEqualTo(ApiErrorKind.NOT_FOUND);
        assertThat(client.classify("call", 409, null).getKind()).isEqualTo(ApiErrorKind.CONFLICT);
        assertThat(client.classify("call", 400, null).getKind()).isEqualTo(ApiErrorKind.CONFLICT);
        assertThat(client.classify("call", 429, null)).isInstanceOf(TransientApiException.class);
        assertThat(client.classify("call", 503, null)).isInstanceOf(TransientApiException.class);
        assertThat(client.classify("call", 500, null)).isInstanceOf(FatalApiException.class);
    }

    @Test
    void errorMessageCarriesControllerReason() {
        ControllerApiException e = client.classify("createSegment", 400,
            "{\"meta\":{\"rc\":\"error\",\"msg\":\"api.err.VlanUsed\"},\"data\":[]}");

        assertThat(e.getMessage()).isEqualTo("createSegment failed with HTTP 400: api.err.VlanUsed");
    }

    private void respond(HttpExchange exchange, int status, String body) throws IOException {
        requests.add(exchange.getRequestMethod() + " " + exchange.getRequestURI().getPath());
        try (InputStream in = exchange.getRequestBody()) {
            in.readAllBytes();
        }
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}

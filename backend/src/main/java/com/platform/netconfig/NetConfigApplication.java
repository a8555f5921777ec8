package com.platform.netconfig;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;

/**
 * Declarative Network Configuration Reconciler
 * 
 * Converges a UniFi-style network controller toward a declared set of
 * VLAN segments and firewall rules:
 * - Validation against hardware limits and addressing rules
 * - Identity-based diffing and dependency-ordered planning
 * - Retried, rate-limited apply with per-operation outcomes
 * 
 * Runs as a REST service, or as a one-shot command when
 * {@code --netconfig.command} is given (validate, plan, apply, backup, status).
 */
@SpringBootApplication
public class NetConfigApplication {

    public static void main(String[] args) {
        boolean command = isCommand(args);
        ConfigurableApplicationContext context = new SpringApplicationBuilder(NetConfigApplication.class)
            .web(command ? WebApplicationType.NONE : WebApplicationType.SERVLET)
            .run(args);
        if (command) {
            System.exit(SpringApplication.exit(context));
        }
    }
    
    static boolean isCommand(String[] args) {
        return Arrays.stream(args)
            .anyMatch(arg -> arg.startsWith("--netconfig.command=") && arg.length() > "--netconfig.command=".length());
    }
}

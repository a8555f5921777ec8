package com.platform.netconfig;

import com.platform.netconfig.cli.ReconciliationCommandRunner;
import com.platform.netconfig.controller.ControllerClient;
import com.platform.netconfig.controller.RetryingControllerClient;
import com.platform.netconfig.reconciliation.ReconciliationService;
import com.platform.netconfig.validation.HardwareProfileCatalog;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
    "netconfig.controller.url=https://127.0.0.1:1",
    "netconfig.hardware.profile=udm-pro"
})
class NetConfigApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private HardwareProfileCatalog hardwareProfiles;

    @Test
    void contextLoadsInServerMode() {
        assertThat(context.getBean(ReconciliationService.class)).isNotNull();
        assertThat(context.getBean(ControllerClient.class)).isInstanceOf(RetryingControllerClient.class);
        assertThat(context.getBeansOfType(ReconciliationCommandRunner.class)).isEmpty();
        assertThat(hardwareProfiles.resolve("UDM-PRO").maxSegments()).isEqualTo(31);
    }

    @Test
    void commandModeNeedsANonEmptyCommand() {
        assertThat(NetConfigApplication.isCommand(new String[] {"--netconfig.command=apply", "--dry-run"})).isTrue();
        assertThat(NetConfigApplication.isCommand(new String[] {"--netconfig.command="})).isFalse();
        assertThat(NetConfigApplication.isCommand(new String[0])).isFalse();
    }
}

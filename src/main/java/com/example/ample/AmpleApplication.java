package com.example.ample;

import com.example.ample.application.service.SecretProvisioningRunner;
import com.example.ample.common.config.AppLastFmProperties;
import com.example.ample.common.config.AppScrobblerProperties;
import com.example.ample.common.config.AppSecretProperties;
import java.util.Arrays;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({
        AppLastFmProperties.class,
        AppScrobblerProperties.class,
        AppSecretProperties.class
})
public class AmpleApplication {

    static final String PROVISION_PROFILE = "provision";

    public static void main(String[] args) {
        if ("true".equalsIgnoreCase(System.getenv("AMPLE_DEBUG"))) {
            System.setProperty("logging.level.com.example.ample", "DEBUG");
        }

        SpringApplication application = new SpringApplication(AmpleApplication.class);
        if (isProvisioning(args)) {
            application.setAdditionalProfiles(PROVISION_PROFILE);
            ConfigurableApplicationContext context = application.run(args);
            System.exit(SpringApplication.exit(context));
        }
        application.run(args);
    }

    static boolean isProvisioning(String[] args) {
        return Arrays.stream(args).anyMatch(SecretProvisioningRunner::isProvisioningArgument);
    }
}

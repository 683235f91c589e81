package com.example.ample.common.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import javax.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "app.scrobbler")
public class AppScrobblerProperties {

    @Min(100)
    private long tickMs = 5000;

    /**
     * Only samples from this player are considered. Blank accepts every player.
     */
    private String primaryPlayer = "";

    private List<String> playerctlCommand = new ArrayList<>(Arrays.asList("playerctl"));

    private long pollTimeoutMs = 2000;
}

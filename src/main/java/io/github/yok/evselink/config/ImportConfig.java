package io.github.yok.evselink.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code import} section in {@code application.yml}.
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "import")
@Data
public class ImportConfig {

    /**
     * Feed file used when {@code --feed} is not given on the command line.
     */
    private String feedPath;

    /**
     * Worker threads used to derive translation and join rows concurrently.
     */
    private int derivationThreads = 4;
}

package com.skyfare.fareservice.config;

import com.skyfare.fareservice.auth.AmadeusEnvironment;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "amadeus")
public class AmadeusProperties {

    /**
     * Client id, bound from AMADEUS_API_KEY.
     */
    private String apiKey;

    /**
     * Client secret, bound from AMADEUS_API_SECRET.
     */
    private String apiSecret;

    /**
     * "test" or "production", bound from AMADEUS_ENV. Anything else means test.
     */
    private String env = "test";

    /**
     * Overrides the host picked from {@link #env}. Meant for tests and stubs.
     */
    private String baseUrl;

    @Valid
    private TokenCache tokenCache = new TokenCache();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Timeouts timeouts = new Timeouts();

    public AmadeusEnvironment resolveEnvironment() {
        return AmadeusEnvironment.from(env);
    }

    public String resolveBaseUrl() {
        if (StringUtils.isNotBlank(baseUrl)) {
            return StringUtils.removeEnd(baseUrl.trim(), "/");
        }
        return resolveEnvironment().getBaseUrl();
    }

    @Getter
    @Setter
    public static class TokenCache {

        public enum StoreType { FILE, MEMORY }

        @NotNull
        private StoreType store = StoreType.FILE;

        /**
         * Directory holding token-{env}.json.
         */
        @NotBlank
        private String directory = Path.of(System.getProperty("user.home"), ".skyfare", "state").toString();

        /**
         * How long concurrent callers wait for an in-flight token refresh.
         */
        @NotNull
        private Duration refreshWait = Duration.ofSeconds(35);
    }

    @Getter
    @Setter
    public static class Retry {

        /**
         * Total attempts per call, first one included.
         */
        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration initialBackoff = Duration.ofSeconds(1);

        @DecimalMin("1.0")
        private double multiplier = 2.0;
    }

    @Getter
    @Setter
    public static class Timeouts {

        @NotNull
        private Duration connect = Duration.ofSeconds(10);

        /**
         * Token exchange and reference-data calls.
         */
        @NotNull
        private Duration metadata = Duration.ofSeconds(30);

        /**
         * Search and pricing calls.
         */
        @NotNull
        private Duration search = Duration.ofSeconds(60);
    }
}

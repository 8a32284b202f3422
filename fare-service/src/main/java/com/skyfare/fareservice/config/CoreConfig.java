package com.skyfare.fareservice.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyfare.fareservice.auth.FileTokenStore;
import com.skyfare.fareservice.auth.InMemorySingleFlightExecutor;
import com.skyfare.fareservice.auth.InMemoryTokenStore;
import com.skyfare.fareservice.auth.SingleFlightExecutor;
import com.skyfare.fareservice.auth.TokenStore;
import com.skyfare.fareservice.client.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@Slf4j
public class CoreConfig {

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

	@Bean
	public TokenStore tokenStore(AmadeusProperties properties, ObjectMapper objectMapper) {
		AmadeusProperties.TokenCache cache = properties.getTokenCache();
		if (cache.getStore() == AmadeusProperties.TokenCache.StoreType.MEMORY) {
			log.info("Token cache: in-memory");
			return new InMemoryTokenStore();
		}
		Path file = Path.of(cache.getDirectory()).resolve("token-" + properties.resolveEnvironment().getKey() + ".json");
		log.info("Token cache: {}", file);
		return new FileTokenStore(file, objectMapper);
	}

	@Bean
	public SingleFlightExecutor singleFlightExecutor(AmadeusProperties properties) {
		return new InMemorySingleFlightExecutor(properties.getTokenCache().getRefreshWait());
	}

	@Bean
	public RetryPolicy retryPolicy(AmadeusProperties properties) {
		AmadeusProperties.Retry retry = properties.getRetry();
		return new RetryPolicy(retry.getMaxAttempts(), retry.getInitialBackoff(), retry.getMultiplier());
	}

	@Bean(destroyMethod = "shutdown")
	public ExecutorService comparisonExecutor(ComparisonProperties properties) {
		return Executors.newFixedThreadPool(properties.getMaxConcurrency());
	}
}

package com.skyfare.fareservice.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Optional;

/**
 * Token cache backed by one JSON file:
 * {@code {"access_token", "token_type", "expires_in", "expires_at"}} with {@code expires_at}
 * in epoch seconds.
 *
 * <p>Writes go to a sibling temp file first and are moved into place, so a reader in another
 * process sees either the old record or the new one. Two processes refreshing at once both
 * end up with a valid token; the last write wins.
 *
 * <p>Read problems are never errors: a missing, unreadable or malformed file is "no cache".
 * Write problems are logged and swallowed because the token in hand is still good.
 */
@Slf4j
public class FileTokenStore implements TokenStore {

	private final Path file;
	private final ObjectMapper objectMapper;

	public FileTokenStore(Path file, ObjectMapper objectMapper) {
		this.file = file;
		this.objectMapper = objectMapper;
	}

	@Override
	public Optional<CachedToken> load() {
		if (!Files.isRegularFile(file)) {
			return Optional.empty();
		}

		TokenFile stored;
		try {
			stored = objectMapper.readValue(file.toFile(), TokenFile.class);
		} catch (IOException e) {
			log.warn("Ignoring unreadable token cache {}: {}", file, e.getMessage());
			return Optional.empty();
		}

		if (stored == null || StringUtils.isBlank(stored.getAccessToken()) || stored.getExpiresAt() == null) {
			log.debug("Ignoring incomplete token cache {}", file);
			return Optional.empty();
		}

		long expiresAtMillis = Math.round(stored.getExpiresAt() * 1000d);
		long expiresIn = stored.getExpiresIn() != null ? stored.getExpiresIn() : CachedToken.DEFAULT_EXPIRES_IN_SECONDS;
		String tokenType = StringUtils.defaultIfBlank(stored.getTokenType(), CachedToken.DEFAULT_TOKEN_TYPE);

		return Optional.of(new CachedToken(stored.getAccessToken(), tokenType, expiresIn, Instant.ofEpochMilli(expiresAtMillis)));
	}

	@Override
	public void save(CachedToken token) {
		TokenFile record = new TokenFile();
		record.setAccessToken(token.accessToken());
		record.setTokenType(token.tokenType());
		record.setExpiresIn(token.expiresIn());
		record.setExpiresAt(token.expiresAt().toEpochMilli() / 1000d);

		Path temp = null;
		try {
			Path directory = file.toAbsolutePath().getParent();
			Files.createDirectories(directory);
			temp = Files.createTempFile(directory, "token-", ".tmp");
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), record);
			moveIntoPlace(temp);
			log.debug("Token cache written to {}", file);
		} catch (IOException e) {
			log.warn("Failed to write token cache {}: {}", file, e.getMessage());
			deleteQuietly(temp);
		}
	}

	@Override
	public void clear() {
		try {
			Files.deleteIfExists(file);
		} catch (IOException e) {
			log.warn("Failed to delete token cache {}: {}", file, e.getMessage());
		}
	}

	private void moveIntoPlace(Path temp) throws IOException {
		try {
			Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		} catch (AtomicMoveNotSupportedException e) {
			Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	private void deleteQuietly(Path temp) {
		if (temp == null) {
			return;
		}
		try {
			Files.deleteIfExists(temp);
		} catch (IOException e) {
			log.debug("Could not remove temp token file {}", temp, e);
		}
	}

	@Data
	@NoArgsConstructor
	@JsonIgnoreProperties(ignoreUnknown = true)
	static class TokenFile {

		@ToString.Exclude
		@JsonProperty("access_token")
		private String accessToken;

		@JsonProperty("token_type")
		private String tokenType;

		@JsonProperty("expires_in")
		private Long expiresIn;

		@JsonProperty("expires_at")
		private Double expiresAt;
	}
}
